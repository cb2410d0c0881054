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

import io.treepath.exception.XPathException;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.types.AtomicValue;
import io.treepath.xpath.types.Numbers;
import io.treepath.xpath.types.Temporals;
import io.treepath.xpath.types.Type;

/**
 * Comparison of two atomic values by a {@link ComparisonOperator}.
 */
public final class Comparisons {

  private Comparisons() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Compares two atomic values. Numbers are compared numerically, NaN being unequal to every
   * number including itself. Strings, untyped values and URIs compare by code points.
   *
   * @param operator the operator
   * @param first the first value
   * @param second the second value
   * @param implicitTimezone timezone of date and time values without an explicit one
   * @return the outcome of the comparison
   * @throws io.treepath.exception.XPathException XPTY0004 if the values are not comparable
   */
  public static boolean compare(final ComparisonOperator operator, final AtomicValue first,
      final AtomicValue second, final ZoneOffset implicitTimezone) {
    if (first.isNumeric() && second.isNumeric()) {
      if (first.isNaN() || second.isNaN()) {
        return operator == ComparisonOperator.NE;
      }
      return operator.test(Numbers.compare(first, second));
    }
    if (isStringLike(first) && isStringLike(second)) {
      return operator.test(first.getStringValue().compareTo(second.getStringValue()));
    }

    final Type type1 = first.getType().getPrimitiveBaseType();
    final Type type2 = second.getType().getPrimitiveBaseType();
    if (type1 == type2) {
      if (type1 == Type.BOOLEAN) {
        return operator.test(Boolean.compare(first.getBoolean(), second.getBoolean()));
      } else if (Temporals.isTemporal(type1)) {
        if (!operator.isEquality() && !(Temporals.isOrdered(first.getType())
            && Temporals.isOrdered(second.getType())
            && (type1 != Type.DURATION || first.getType() == second.getType()))) {
          throw incomparable(operator, first, second);
        }
        return operator.test(Temporals.compare(first, second, implicitTimezone));
      } else if (operator.isEquality() && (type1 == Type.QNAME || type1 == Type.HEX_BINARY
          || type1 == Type.BASE64_BINARY || type1 == Type.NOTATION)) {
        final boolean equal = type1 == Type.HEX_BINARY
            ? first.getStringValue().equalsIgnoreCase(second.getStringValue())
            : first.getValue().equals(second.getValue());
        return equal == (operator == ComparisonOperator.EQ);
      }
    }
    throw incomparable(operator, first, second);
  }

  private static boolean isStringLike(final AtomicValue value) {
    return value.isString() || value.isUntyped();
  }

  private static XPathException incomparable(final ComparisonOperator operator,
      final AtomicValue first, final AtomicValue second) {
    return EXPathError.XPTY0004.newException("cannot apply '" + operator.getValueSymbol()
        + "' to " + first.getType().getStringRepr() + " and " + second.getType().getStringRepr());
  }
}
