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

package io.treepath.xpath.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.google.common.collect.Sets;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.node.XPathNode;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;

/**
 * The node set operators {@code union} (or {@code |}), {@code intersect} and {@code except}.
 * Nodes are compared by identity and the result is in document order without duplicates.
 */
public final class SetOperator extends XPathToken {

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  public SetOperator(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  @Override
  public XPathToken led(final XPathToken left) {
    children.add(left);
    children.add(parser.expression(getRbp()));
    return this;
  }

  @Override
  public List<Item> evaluate(final @Nullable XPathContext context) {
    final Set<XPathNode> left = nodes(context, 0);
    final Set<XPathNode> right = nodes(context, 1);
    final Set<XPathNode> result = switch (getSymbol()) {
      case "intersect" -> Sets.intersection(left, right);
      case "except" -> Sets.difference(left, right);
      default -> Sets.union(left, right);
    };
    final List<XPathNode> sorted = new ArrayList<>(result);
    sorted.sort(XPathNode.DOCUMENT_ORDER);
    return new ArrayList<>(sorted);
  }

  private Set<XPathNode> nodes(final @Nullable XPathContext context, final int index) {
    final Set<XPathNode> nodes = Sets.newIdentityHashSet();
    for (final Item item : children.get(index).evaluate(context == null ? null : context.copy())) {
      if (!(item instanceof XPathNode node)) {
        throw EXPathError.XPTY0004.newException(
            "the operands of '" + getSymbol() + "' must be node sequences");
      }
      nodes.add(node);
    }
    return nodes;
  }
}
