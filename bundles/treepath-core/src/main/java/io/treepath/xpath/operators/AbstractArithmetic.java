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

package io.treepath.xpath.operators;

import java.util.Collections;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;
import io.treepath.xpath.types.AtomicValue;
import io.treepath.xpath.types.Numbers;
import io.treepath.xpath.types.Type;

/**
 * <p>
 * Base class of the arithmetic operators. Both operands are atomized to at most one value;
 * untyped values are converted to {@code xs:double}. An empty operand gives the empty sequence,
 * or NaN in XPath 1.0 compatibility mode, where every operand is converted to a double.
 * </p>
 * <p>
 * Only numeric operands are supported.
 * </p>
 */
public abstract class AbstractArithmetic extends XPathToken {

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  protected AbstractArithmetic(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  @Override
  public XPathToken led(final XPathToken left) {
    children.add(left);
    children.add(parser.expression(getLbp()));
    return this;
  }

  @Override
  public List<Item> evaluate(final @Nullable XPathContext context) {
    final AtomicValue first = getNumericOperand(context, 0);
    if (children.size() == 1) {
      return first == null ? emptyResult() : Collections.singletonList(operate(first));
    }
    final AtomicValue second = getNumericOperand(context, 1);
    if (first == null || second == null) {
      return emptyResult();
    }
    return Collections.singletonList(operate(first, second));
  }

  private List<Item> emptyResult() {
    return parser.isCompatibilityMode()
        ? Collections.singletonList(AtomicValue.of(Double.NaN))
        : Collections.emptyList();
  }

  private @Nullable AtomicValue getNumericOperand(final @Nullable XPathContext context,
      final int index) {
    if (parser.isCompatibilityMode()) {
      final List<AtomicValue> values =
          atomize(children.get(index).evaluate(context == null ? null : context.copy()));
      return values.isEmpty() ? null : AtomicValue.of(Numbers.toDouble(values.get(0)));
    }
    final AtomicValue operand = getAtomizedOperand(context, index);
    if (operand == null) {
      return null;
    } else if (operand.isUntyped()) {
      return operand.castAs(Type.DOUBLE, null);
    } else if (!operand.isNumeric()) {
      throw EXPathError.XPTY0004.newException("unsupported operand type "
          + operand.getType().getStringRepr() + " of '" + getSymbol() + "'");
    }
    return operand;
  }

  /**
   * Applies the operator to two numbers.
   *
   * @param first the left operand
   * @param second the right operand
   * @return the result
   */
  protected abstract AtomicValue operate(AtomicValue first, AtomicValue second);

  /**
   * Applies the operator as a unary operator.
   *
   * @param operand the operand
   * @return the result
   */
  protected AtomicValue operate(final AtomicValue operand) {
    throw new IllegalStateException("'" + getSymbol() + "' is not a unary operator");
  }
}
