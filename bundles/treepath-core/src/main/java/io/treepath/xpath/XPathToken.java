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

package io.treepath.xpath;

import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.google.common.collect.AbstractIterator;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.CloseableIterator;
import io.treepath.api.Item;
import io.treepath.exception.XPathException;
import io.treepath.exception.XPathSyntaxException;
import io.treepath.node.XPathNode;
import io.treepath.utils.Sequences;
import io.treepath.xpath.parser.Label;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;
import io.treepath.xpath.types.AtomicValue;
import io.treepath.xpath.types.Type;

/**
 * <h1>XPathToken</h1>
 * <p>
 * A node of a compiled expression tree. A token takes part in parsing through its null
 * denotation {@link #nud()}, called when the token starts an expression, and its left
 * denotation {@link #led(XPathToken)}, called when the token follows an already parsed operand.
 * </p>
 * <p>
 * After parsing, a token is evaluated either eagerly with {@link #evaluate(XPathContext)},
 * returning the flat result sequence, or lazily with {@link #select(XPathContext)}. Each one is
 * by default implemented by the other, so a token class overrides at least one of them. A
 * {@code null} context denotes the static evaluation after parsing: tokens which need a dynamic
 * context raise a missing context error.
 * </p>
 */
public abstract class XPathToken {

  /** The parser the token belongs to. */
  protected final XPathParser parser;

  /** Definition of the symbol. */
  private final SymbolDefinition definition;

  /** The value of literals, the text of names. */
  protected @Nullable Object value;

  /** The operands. */
  protected final List<XPathToken> children = new ArrayList<>();

  /** Offset in the expression. */
  private final int offset;

  /**
   * Constructor.
   *
   * @param parser the parser the token belongs to
   * @param definition definition of the symbol
   * @param value the value of the token
   * @param offset offset of the token in the expression
   */
  protected XPathToken(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    this.parser = requireNonNull(parser);
    this.definition = requireNonNull(definition);
    this.value = value;
    this.offset = offset;
  }

  /**
   * Get the symbol.
   *
   * @return the symbol
   */
  public String getSymbol() {
    return definition.getSymbol();
  }

  /**
   * Get the label of the symbol.
   *
   * @return the label
   */
  public Label getLabel() {
    return definition.getLabel();
  }

  /**
   * Get the left binding power.
   *
   * @return the left binding power
   */
  public int getLbp() {
    return definition.getLbp();
  }

  /**
   * Get the right binding power.
   *
   * @return the right binding power
   */
  public int getRbp() {
    return definition.getRbp();
  }

  /**
   * Get the value.
   *
   * @return the value or {@code null}
   */
  public @Nullable Object getValue() {
    return value;
  }

  /**
   * Get the offset of the token in the expression.
   *
   * @return the offset
   */
  public int getOffset() {
    return offset;
  }

  /**
   * Get the operands.
   *
   * @return unmodifiable view of the operands
   */
  public List<XPathToken> getChildren() {
    return Collections.unmodifiableList(children);
  }

  /**
   * Get an operand.
   *
   * @param index the index of the operand
   * @return the operand
   */
  public XPathToken get(final int index) {
    return children.get(index);
  }

  /**
   * Determines if the token is a word which can also be read as a name.
   *
   * @return true, for keywords
   */
  public boolean isNameLike() {
    return (getLabel() == Label.OPERATOR || getLabel() == Label.KEYWORD)
        && Character.isLetter(getSymbol().charAt(0));
  }

  /**
   * Null denotation, called when the token starts an expression. Words are read as names by
   * default.
   *
   * @return the parsed expression
   * @throws XPathSyntaxException if the token can not start an expression
   */
  public XPathToken nud() {
    if (isNameLike()) {
      return asName();
    }
    throw wrongSyntax();
  }

  /**
   * Left denotation, called when the token follows an operand.
   *
   * @param left the parsed left operand
   * @return the parsed expression
   * @throws XPathSyntaxException if the token can not follow an operand
   */
  public XPathToken led(final XPathToken left) {
    throw wrongSyntax();
  }

  /**
   * Reads the token as a name test.
   *
   * @return the parsed name test
   */
  public XPathToken asName() {
    return parser.createNameToken(getSymbol(), offset).nud();
  }

  /**
   * Evaluates the token.
   *
   * @param context the dynamic context, {@code null} for the static evaluation
   * @return the flat result sequence, possibly empty
   */
  public List<Item> evaluate(final @Nullable XPathContext context) {
    return Sequences.toList(select(context));
  }

  /**
   * Selects the results of the token lazily. The returned sequence must be closed if it is not
   * exhausted.
   *
   * @param context the dynamic context, {@code null} for the static evaluation
   * @return the result sequence
   */
  public CloseableIterator<Item> select(final @Nullable XPathContext context) {
    return Sequences.of(evaluate(context));
  }

  /**
   * Determines if the token is a step of a reverse axis, whose results are positioned in
   * reverse document order.
   *
   * @return true, for reverse axis steps
   */
  public boolean isReverseAxis() {
    return false;
  }

  /**
   * Iterates over this token and all tokens below, in preorder.
   *
   * @return the tokens of the subtree
   */
  public Iterator<XPathToken> iterTokens() {
    final Deque<XPathToken> stack = new ArrayDeque<>();
    stack.push(this);
    return new AbstractIterator<>() {
      @Override
      protected XPathToken computeNext() {
        if (stack.isEmpty()) {
          return endOfData();
        }
        final XPathToken token = stack.pop();
        for (int i = token.children.size() - 1; i >= 0; i--) {
          stack.push(token.children.get(i));
        }
        return token;
      }
    };
  }

  /**
   * Computes the effective boolean value of a sequence.
   *
   * @param items the sequence
   * @return the effective boolean value
   * @throws io.treepath.exception.XPathTypeException FORG0006 if the value is not defined
   */
  public static boolean booleanValue(final List<? extends Item> items) {
    if (items.isEmpty()) {
      return false;
    }
    final Item first = items.get(0);
    if (first instanceof XPathNode) {
      return true;
    } else if (items.size() > 1) {
      throw EXPathError.FORG0006.newException("effective boolean value is not defined for a "
          + "sequence of two or more items starting with an atomic value");
    } else if (first instanceof AtomicValue atomic) {
      if (atomic.getType().derivesFrom(Type.BOOLEAN)) {
        return atomic.getBoolean();
      } else if (atomic.isString() || atomic.isUntyped()) {
        return !atomic.getStringValue().isEmpty();
      } else if (atomic.isNumeric()) {
        return !atomic.isNaN() && atomic.getDouble() != 0;
      }
      throw EXPathError.FORG0006.newException(
          "effective boolean value is not defined for " + atomic.getType().getStringRepr());
    }
    throw EXPathError.FORG0006.newException("effective boolean value is not defined for " + first);
  }

  /**
   * Evaluates the token and computes the effective boolean value of the result.
   *
   * @param context the dynamic context
   * @return the effective boolean value
   */
  public boolean booleanValue(final @Nullable XPathContext context) {
    return booleanValue(evaluate(context));
  }

  /**
   * Atomizes a sequence.
   *
   * @param items the sequence
   * @return the atomic values
   * @throws io.treepath.exception.XPathTypeException FOTY0013 for items without typed value
   */
  public static List<AtomicValue> atomize(final List<? extends Item> items) {
    final List<AtomicValue> values = new ArrayList<>(items.size());
    for (final Item item : items) {
      values.addAll(atomize(item));
    }
    return values;
  }

  /**
   * Atomizes an item.
   *
   * @param item the item
   * @return the typed value
   * @throws io.treepath.exception.XPathTypeException FOTY0013 for items without typed value
   */
  public static List<AtomicValue> atomize(final Item item) {
    if (item instanceof AtomicValue atomic) {
      return Collections.singletonList(atomic);
    } else if (item instanceof XPathNode node) {
      return node.getTypedValue();
    }
    throw EXPathError.FOTY0013.newException(item.toString());
  }

  /**
   * Evaluates an operand on a copy of the context and atomizes it to at most one value.
   *
   * @param context the dynamic context
   * @param index index of the operand
   * @return the atomic value or {@code null} for the empty sequence
   * @throws io.treepath.exception.XPathTypeException XPTY0004 if the operand has more than one
   *         value
   */
  protected @Nullable AtomicValue getAtomizedOperand(final @Nullable XPathContext context,
      final int index) {
    final List<AtomicValue> values =
        atomize(children.get(index).evaluate(context == null ? null : context.copy()));
    if (values.size() > 1) {
      throw EXPathError.XPTY0004.newException("the operand of '" + getSymbol()
          + "' must be a single atomic value, found a sequence of " + values.size());
    }
    return values.isEmpty() ? null : values.get(0);
  }

  /**
   * Creates the error of a missing context.
   *
   * @return the exception to throw
   */
  protected XPathException missingContext() {
    return EXPathError.XPDY0002.newException("'" + getSymbol() + "' needs a dynamic context");
  }

  /**
   * Creates a coded error raised by this token.
   *
   * @param error the error code
   * @param detail the error detail
   * @return the exception to throw
   */
  protected XPathException error(final EXPathError error, final String detail) {
    return error.newException(detail);
  }

  /**
   * Creates a syntax error at this token.
   *
   * @return the exception to throw
   */
  public XPathSyntaxException wrongSyntax() {
    return wrongSyntax(Collections.emptySet());
  }

  /**
   * Creates a syntax error at this token.
   *
   * @param expected the symbols which were expected instead
   * @return the exception to throw
   */
  public XPathSyntaxException wrongSyntax(final Set<String> expected) {
    final String text = getText();
    final String detail = "(end)".equals(getSymbol()) ? "unexpected end of expression"
        : "unexpected '" + text + "' at position " + offset;
    return new XPathSyntaxException(
        expected.isEmpty() ? detail : detail + ", expected one of " + expected, text, offset,
        expected);
  }

  /**
   * Get the source text of the token.
   *
   * @return the text
   */
  public String getText() {
    if (value instanceof AtomicValue atomic) {
      return atomic.isString() ? "'" + atomic.getStringValue().replace("'", "''") + "'"
          : atomic.getStringValue();
    }
    return value instanceof String text ? text : getSymbol();
  }

  /**
   * Renders the expression of the token, for diagnostics.
   *
   * @return the expression
   */
  public String getSource() {
    if (children.isEmpty()) {
      return getText();
    } else if (children.size() == 2 && getLbp() > 0) {
      return children.get(0).getSource() + ' ' + getSymbol() + ' ' + children.get(1).getSource();
    }
    final StringBuilder builder = new StringBuilder(getSymbol()).append('(');
    for (int i = 0; i < children.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      builder.append(children.get(i).getSource());
    }
    return builder.append(')').toString();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '[' + getSource() + ']';
  }
}
