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

import java.time.ZoneOffset;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;
import io.treepath.xpath.types.AtomicValue;
import io.treepath.xpath.types.Numbers;
import io.treepath.xpath.types.Type;

/**
 * The general comparisons {@code =}, {@code !=}, {@code <}, {@code <=}, {@code >} and
 * {@code >=}. They are existentially quantified: the result is {@code true} if any pair of
 * values of the two operands satisfies the comparison.
 *
 * <p>
 * In XPath 1.0 compatibility mode a boolean operand turns the other into its effective boolean
 * value, and numbers and ordering comparisons convert both sides to doubles.
 * </p>
 */
public final class GeneralComparison extends AbstractComparison {

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  public GeneralComparison(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  @Override
  public List<Item> evaluate(final @Nullable XPathContext context) {
    final List<Item> left = children.get(0).evaluate(context == null ? null : context.copy());
    final List<Item> right = children.get(1).evaluate(context == null ? null : context.copy());
    final ComparisonOperator operator = getOperator();
    final ZoneOffset timezone = getTimezone(context);

    if (parser.isCompatibilityMode() && operator.isEquality()
        && (isBoolean(left) || isBoolean(right))) {
      return List.of(AtomicValue.of(operator.test(
          Boolean.compare(booleanValue(left), booleanValue(right)))));
    }
    final List<AtomicValue> values1 = atomize(left);
    final List<AtomicValue> values2 = atomize(right);
    for (final AtomicValue value1 : values1) {
      for (final AtomicValue value2 : values2) {
        if (compare(operator, value1, value2, timezone)) {
          return List.of(AtomicValue.TRUE);
        }
      }
    }
    return List.of(AtomicValue.FALSE);
  }

  private static boolean isBoolean(final List<Item> items) {
    return items.size() == 1 && items.get(0) instanceof AtomicValue value
        && value.getType() == Type.BOOLEAN;
  }

  private boolean compare(final ComparisonOperator operator, final AtomicValue first,
      final AtomicValue second, final ZoneOffset timezone) {
    if (parser.isCompatibilityMode()) {
      if (!operator.isEquality() || first.isNumeric() || second.isNumeric()) {
        return Comparisons.compare(operator, AtomicValue.of(Numbers.toDouble(first)),
            AtomicValue.of(Numbers.toDouble(second)), timezone);
      }
      return Comparisons.compare(operator, AtomicValue.of(first.getStringValue()),
          AtomicValue.of(second.getStringValue()), timezone);
    }
    return Comparisons.compare(operator, promoteUntyped(first, second),
        promoteUntyped(second, first), timezone);
  }

  /**
   * Converts an untyped value to the type of the other operand: {@code xs:double} if that one
   * is numeric, left as a string if it is a string or untyped.
   */
  private AtomicValue promoteUntyped(final AtomicValue value, final AtomicValue other) {
    if (!value.isUntyped() || other.isUntyped() || other.isString()) {
      return value;
    }
    return value.castAs(other.isNumeric() ? Type.DOUBLE : other.getType(),
        parser.getNamespaces());
  }
}
