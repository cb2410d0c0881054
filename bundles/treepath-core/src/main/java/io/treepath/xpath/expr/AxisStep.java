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

import static java.util.Objects.requireNonNull;

import java.util.Comparator;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.CloseableIterator;
import io.treepath.api.Item;
import io.treepath.axis.Axis;
import io.treepath.node.XPathNode;
import io.treepath.utils.Sequences;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.filter.KindTest;
import io.treepath.xpath.filter.NameTest;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;

/**
 * <h1>AxisStep</h1>
 * <p>
 * An axis step such as {@code ancestor::a} or its abbreviation {@code @a}. The node test is
 * applied to every node of the axis while the axis holds the focus, so the test knows the
 * principal node kind of the axis.
 * </p>
 * <p>
 * The results of reverse axes are returned in document order; predicates applied to the step
 * count positions from the end.
 * </p>
 */
public final class AxisStep extends XPathToken {

  /** Orders the nodes of an axis. */
  private static final Comparator<Item> NODE_ORDER =
      Comparator.comparing(item -> (XPathNode) item, XPathNode.DOCUMENT_ORDER);

  /** The axis. */
  private @Nullable Axis axis;

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  public AxisStep(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  @Override
  public XPathToken nud() {
    if ("@".equals(getSymbol())) {
      axis = Axis.ATTRIBUTE;
    } else {
      axis = requireNonNull(Axis.fromName(getSymbol().substring(0, getSymbol().length() - 2)));
      parser.advance("::");
    }
    final XPathToken test = parser.expression(getRbp());
    if (!(test instanceof NameTest) && !(test instanceof KindTest)) {
      throw test.wrongSyntax();
    }
    children.add(test);
    return this;
  }

  /**
   * Get the axis.
   *
   * @return the axis
   */
  public Axis getAxis() {
    return requireNonNull(axis);
  }

  @Override
  public CloseableIterator<Item> select(final @Nullable XPathContext context) {
    if (context == null || context.getItem() == null) {
      throw missingContext();
    } else if (!(context.getItem() instanceof XPathNode)) {
      throw EXPathError.XPTY0020.newException(getSource());
    }
    final XPathToken test = children.get(0);
    final CloseableIterator<Item> results =
        Sequences.flatMap(context.iterAxis(getAxis()), item -> test.select(context));
    if (getAxis().isReverse()) {
      final List<Item> nodes = Sequences.toList(results);
      nodes.sort(NODE_ORDER);
      return Sequences.of(nodes);
    }
    return results;
  }

  @Override
  public boolean isReverseAxis() {
    return getAxis().isReverse();
  }

  @Override
  public String getSource() {
    return getAxis().getName() + "::" + children.get(0).getSource();
  }
}
