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
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.CloseableIterator;
import io.treepath.api.Item;
import io.treepath.node.DocumentNode;
import io.treepath.node.XPathNode;
import io.treepath.utils.AbstractCloseableIterator;
import io.treepath.utils.Sequences;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.parser.Label;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;

/**
 * <h1>PathExpr</h1>
 * <p>
 * The path operators {@code /} and {@code //}. As prefix they start an absolute path at the
 * document node of the context, a lone {@code /} selects the document node itself. As infix
 * operators they evaluate the right step once for every node selected by the left operand.
 * </p>
 * <p>
 * Node results are returned in document order without duplicates. Results of a step from a single
 * node are streamed, others are collected and sorted.
 * </p>
 */
public final class PathExpr extends XPathToken {

  /** Symbols which may start a step. */
  private static final ImmutableSet<String> STEP_SYMBOLS =
      ImmutableSet.of("*", "@", ".", "..", "(", "$");

  /** Determines if the path is absolute. */
  private boolean absolute;

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  public PathExpr(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  @Override
  public XPathToken nud() {
    absolute = true;
    if (isDescendantPath() || startsStep(parser.getNextToken())) {
      children.add(parser.expression(getRbp()));
    }
    return this;
  }

  private static boolean startsStep(final XPathToken next) {
    final Label label = next.getLabel();
    return label == Label.NAME || label == Label.AXIS || label == Label.KIND_TEST
        || label == Label.FUNCTION || label == Label.CONSTRUCTOR || label == Label.LITERAL
        || next.isNameLike() || STEP_SYMBOLS.contains(next.getSymbol());
  }

  @Override
  public XPathToken led(final XPathToken left) {
    children.add(left);
    children.add(parser.expression(getRbp()));
    return this;
  }

  private boolean isDescendantPath() {
    return "//".equals(getSymbol());
  }

  @Override
  public CloseableIterator<Item> select(final @Nullable XPathContext context) {
    if (context == null) {
      throw missingContext();
    }
    final List<Item> startItems;
    final XPathToken step;
    if (absolute) {
      final DocumentNode document = context.getDocumentRoot();
      if (children.isEmpty()) {
        return Sequences.singleton(
            document.isDetached() ? document.getDocumentElement() : document);
      }
      startItems = Collections.singletonList(document);
      step = children.get(0);
    } else {
      final XPathToken left = children.get(0);
      startItems = Sequences.toList(left.select(context.copy()));
      step = children.get(1);
    }

    final XPathContext stepContext = absolute ? context.copy() : context;
    final CloseableIterator<Item> results = Sequences.flatMap(
        stepContext.iterItems(startItems, !absolute && children.get(0).isReverseAxis()),
        item -> {
          if (!(item instanceof XPathNode)) {
            throw EXPathError.XPTY0019.newException(getSource());
          }
          return isDescendantPath()
              ? Sequences.flatMap(stepContext.iterDescendants(null),
                  descendant -> step.select(stepContext))
              : step.select(stepContext);
        });
    if (startItems.size() <= 1 && !isDescendantPath()) {
      return checkHomogeneous(results);
    }
    return normalize(Sequences.toList(results));
  }

  /**
   * Sorts node results in document order and removes duplicates.
   */
  private CloseableIterator<Item> normalize(final List<Item> items) {
    boolean nodes = false;
    for (final Item item : items) {
      nodes = item instanceof XPathNode;
      if (nodes) {
        break;
      }
    }
    if (!nodes) {
      return Sequences.of(items);
    }
    final List<XPathNode> sorted = new ArrayList<>(items.size());
    for (final Item item : items) {
      if (!(item instanceof XPathNode node)) {
        throw EXPathError.XPTY0018.newException(getSource());
      }
      sorted.add(node);
    }
    sorted.sort(XPathNode.DOCUMENT_ORDER);
    final List<Item> result = new ArrayList<>(sorted.size());
    XPathNode previous = null;
    for (final XPathNode node : sorted) {
      if (node != previous) {
        result.add(node);
      }
      previous = node;
    }
    return Sequences.of(result);
  }

  private CloseableIterator<Item> checkHomogeneous(final CloseableIterator<Item> results) {
    return new AbstractCloseableIterator<>() {
      private boolean nodes;

      private boolean atomics;

      @Override
      protected Item advance() {
        if (!results.hasNext()) {
          return finish();
        }
        final Item item = results.next();
        if (item instanceof XPathNode) {
          nodes = true;
        } else {
          atomics = true;
        }
        if (nodes && atomics) {
          throw EXPathError.XPTY0018.newException(getSource());
        }
        return item;
      }

      @Override
      protected void release() {
        results.close();
      }
    };
  }

  @Override
  public String getSource() {
    if (absolute) {
      return children.isEmpty() ? getSymbol() : getSymbol() + children.get(0).getSource();
    }
    return children.get(0).getSource() + getSymbol() + children.get(1).getSource();
  }
}
