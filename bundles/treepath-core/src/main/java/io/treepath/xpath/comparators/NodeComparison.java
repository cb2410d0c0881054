/**
 * Copyright (c) 2011, University of Konstanz, Distributed Systems Group All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without modification, are permitted
 * provided that the following conditions are met: * Redistributions of source code must retain the
 * above copyright notice, this list of conditions and the following disclaimer. * Redistributions
 * in binary form must reproduce the above copyright notice, this list of conditions and the
 * following disclaimer in the documentation and/or other materials provided with the distribution.
 * * Neither the name of the University of Konstanz nor the names of its contributors may be used to
 * endorse or promote products derived from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND
 * FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING,
 * BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS;
 * OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT,
 * STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.treepath.xpath.comparators;

import java.util.Collections;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.node.XPathNode;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;
import io.treepath.xpath.types.AtomicValue;

/**
 * The node comparisons {@code is} (identity), {@code <<} (precedes) and {@code >>} (follows).
 */
public final class NodeComparison extends XPathToken {

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  public NodeComparison(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  @Override
  public XPathToken led(final XPathToken left) {
    if (left instanceof AbstractComparison || left instanceof NodeComparison) {
      throw wrongSyntax();
    }
    children.add(left);
    children.add(parser.expression(getRbp()));
    return this;
  }

  @Override
  public List<Item> evaluate(final @Nullable XPathContext context) {
    final XPathNode first = getNode(context, 0);
    final XPathNode second = getNode(context, 1);
    if (first == null || second == null) {
      return Collections.emptyList();
    }
    final boolean result = switch (getSymbol()) {
      case "is" -> first == second;
      case "<<" -> XPathNode.DOCUMENT_ORDER.compare(first, second) < 0;
      default -> XPathNode.DOCUMENT_ORDER.compare(first, second) > 0;
    };
    return Collections.singletonList(AtomicValue.of(result));
  }

  private @Nullable XPathNode getNode(final @Nullable XPathContext context, final int index) {
    final List<Item> items = children.get(index).evaluate(context == null ? null : context.copy());
    if (items.isEmpty()) {
      return null;
    } else if (items.size() > 1 || !(items.get(0) instanceof XPathNode)) {
      throw EXPathError.XPTY0004.newException(
          "the operands of '" + getSymbol() + "' must be single nodes");
    }
    return (XPathNode) items.get(0);
  }
}
