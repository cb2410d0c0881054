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

package io.treepath.xpath.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

import com.google.common.base.CharMatcher;

import io.treepath.xpath.EXPathError;

/**
 * Numeric operations of XPath on atomic values. Operands are promoted to their least common
 * numeric type in the order {@code xs:integer}, {@code xs:decimal}, {@code xs:float},
 * {@code xs:double}.
 */
public final class Numbers {

  /** Relative tolerance of floating point equality. */
  public static final double EQUALITY_TOLERANCE = 1e-7;

  /** The numeric representations, in promotion order. */
  private enum Kind {
    INTEGER, DECIMAL, FLOAT, DOUBLE
  }

  private Numbers() {
    throw new AssertionError("May never be instantiated!");
  }

  private static Kind kindOf(final AtomicValue value) {
    final Object number = value.getValue();
    if (number instanceof Double) {
      return Kind.DOUBLE;
    } else if (number instanceof Float) {
      return Kind.FLOAT;
    } else if (number instanceof BigDecimal) {
      return Kind.DECIMAL;
    } else if (number instanceof BigInteger) {
      return Kind.INTEGER;
    }
    throw EXPathError.XPTY0004.newException(
        "numeric operand expected, found " + value.getType().getStringRepr());
  }

  private static Kind promote(final AtomicValue first, final AtomicValue second) {
    final Kind kind1 = kindOf(first);
    final Kind kind2 = kindOf(second);
    return kind1.compareTo(kind2) >= 0 ? kind1 : kind2;
  }

  private static BigInteger integer(final AtomicValue value) {
    return (BigInteger) value.getValue();
  }

  private static BigDecimal decimal(final AtomicValue value) {
    final Object number = value.getValue();
    return number instanceof BigInteger integer ? new BigDecimal(integer) : (BigDecimal) number;
  }

  private static float floatValue(final AtomicValue value) {
    return value.getNumber().floatValue();
  }

  /**
   * Converts a value to a double as function {@code fn:number} does.
   *
   * @param value the value
   * @return the double, NaN if the value has no numeric interpretation
   */
  public static double toDouble(final AtomicValue value) {
    if (value.isNumeric()) {
      return value.getDouble();
    } else if (value.getValue() instanceof Boolean bool) {
      return bool ? 1 : 0;
    } else if (value.isString() || value.isUntyped()) {
      final String text = CharMatcher.whitespace().trimFrom(value.getStringValue());
      if (Type.DOUBLE.facetIsSatisfiedBy(text)) {
        return ((Number) AtomicValue.parse(text, Type.DOUBLE, null).getValue()).doubleValue();
      }
    }
    return Double.NaN;
  }

  /**
   * Compares two numbers. Floating point numbers are equal if they differ by at most the
   * relative tolerance {@value #EQUALITY_TOLERANCE}.
   *
   * @param first the first number, not NaN
   * @param second the second number, not NaN
   * @return negative, zero or positive as the first number is less than, equal to or greater
   *         than the second
   */
  public static int compare(final AtomicValue first, final AtomicValue second) {
    final Kind kind = promote(first, second);
    if (kind == Kind.DOUBLE || kind == Kind.FLOAT) {
      final double x = first.getDouble();
      final double y = second.getDouble();
      if (x == y || (!Double.isInfinite(x) && !Double.isInfinite(y)
          && Math.abs(x - y) <= EQUALITY_TOLERANCE * Math.max(Math.abs(x), Math.abs(y)))) {
        return 0;
      }
      return x < y ? -1 : 1;
    }
    return decimal(first).compareTo(decimal(second));
  }

  /**
   * Adds two numbers.
   *
   * @param first the first number
   * @param second the second number
   * @return the sum
   */
  public static AtomicValue add(final AtomicValue first, final AtomicValue second) {
    return switch (promote(first, second)) {
      case INTEGER -> AtomicValue.of(integer(first).add(integer(second)));
      case DECIMAL -> AtomicValue.of(decimal(first).add(decimal(second)));
      case FLOAT -> AtomicValue.of(floatValue(first) + floatValue(second));
      case DOUBLE -> AtomicValue.of(first.getDouble() + second.getDouble());
    };
  }

  /**
   * Subtracts two numbers.
   *
   * @param first the minuend
   * @param second the subtrahend
   * @return the difference
   */
  public static AtomicValue subtract(final AtomicValue first, final AtomicValue second) {
    return switch (promote(first, second)) {
      case INTEGER -> AtomicValue.of(integer(first).subtract(integer(second)));
      case DECIMAL -> AtomicValue.of(decimal(first).subtract(decimal(second)));
      case FLOAT -> AtomicValue.of(floatValue(first) - floatValue(second));
      case DOUBLE -> AtomicValue.of(first.getDouble() - second.getDouble());
    };
  }

  /**
   * Multiplies two numbers.
   *
   * @param first the first factor
   * @param second the second factor
   * @return the product
   */
  public static AtomicValue multiply(final AtomicValue first, final AtomicValue second) {
    return switch (promote(first, second)) {
      case INTEGER -> AtomicValue.of(integer(first).multiply(integer(second)));
      case DECIMAL -> AtomicValue.of(decimal(first).multiply(decimal(second)));
      case FLOAT -> AtomicValue.of(floatValue(first) * floatValue(second));
      case DOUBLE -> AtomicValue.of(first.getDouble() * second.getDouble());
    };
  }

  /**
   * Divides two numbers. The quotient of integers is a decimal.
   *
   * @param first the dividend
   * @param second the divisor
   * @return the quotient
   * @throws io.treepath.exception.XPathException FOAR0001 for a decimal division by zero
   */
  public static AtomicValue divide(final AtomicValue first, final AtomicValue second) {
    final Kind kind = promote(first, second);
    if (kind == Kind.DOUBLE) {
      return AtomicValue.of(first.getDouble() / second.getDouble());
    } else if (kind == Kind.FLOAT) {
      return AtomicValue.of(floatValue(first) / floatValue(second));
    }
    final BigDecimal divisor = decimal(second);
    if (divisor.signum() == 0) {
      throw EXPathError.FOAR0001.newException(first.getStringValue() + " div 0");
    }
    return AtomicValue.of(decimal(first).divide(divisor, MathContext.DECIMAL128));
  }

  /**
   * Computes the remainder of a truncating division, with the sign of the dividend.
   *
   * @param first the dividend
   * @param second the divisor
   * @return the remainder
   * @throws io.treepath.exception.XPathException FOAR0001 for a decimal division by zero
   */
  public static AtomicValue mod(final AtomicValue first, final AtomicValue second) {
    final Kind kind = promote(first, second);
    if (kind == Kind.DOUBLE) {
      return AtomicValue.of(first.getDouble() % second.getDouble());
    } else if (kind == Kind.FLOAT) {
      return AtomicValue.of(floatValue(first) % floatValue(second));
    } else if (decimal(second).signum() == 0) {
      throw EXPathError.FOAR0001.newException(first.getStringValue() + " mod 0");
    } else if (kind == Kind.INTEGER) {
      return AtomicValue.of(integer(first).remainder(integer(second)));
    }
    return AtomicValue.of(decimal(first).remainder(decimal(second)));
  }

  /**
   * Integer division, truncating the quotient toward zero.
   *
   * @param first the dividend
   * @param second the divisor
   * @return the integer quotient
   * @throws io.treepath.exception.XPathException FOAR0001 if the divisor is zero, FOAR0002 if an
   *         operand is NaN or the dividend is infinite
   */
  public static AtomicValue integerDivide(final AtomicValue first, final AtomicValue second) {
    final Kind kind = promote(first, second);
    if (kind == Kind.INTEGER) {
      if (integer(second).signum() == 0) {
        throw EXPathError.FOAR0001.newException(first.getStringValue() + " idiv 0");
      }
      return AtomicValue.of(integer(first).divide(integer(second)));
    } else if (kind == Kind.DECIMAL) {
      final BigDecimal divisor = decimal(second);
      if (divisor.signum() == 0) {
        throw EXPathError.FOAR0001.newException(first.getStringValue() + " idiv 0");
      }
      return AtomicValue.of(decimal(first).divide(divisor, 0, RoundingMode.DOWN).toBigInteger());
    }
    final double dividend = first.getDouble();
    final double divisor = second.getDouble();
    if (Double.isNaN(dividend) || Double.isNaN(divisor)) {
      throw EXPathError.FOAR0002.newException("NaN operand of idiv");
    } else if (divisor == 0) {
      throw EXPathError.FOAR0001.newException(first.getStringValue() + " idiv 0");
    } else if (Double.isInfinite(dividend)) {
      throw EXPathError.FOAR0002.newException("infinite dividend of idiv");
    } else if (Double.isInfinite(divisor)) {
      return AtomicValue.of(BigInteger.ZERO);
    }
    return AtomicValue.of(new BigDecimal(dividend)
        .divide(new BigDecimal(divisor), 0, RoundingMode.DOWN).toBigInteger());
  }

  /**
   * Negates a number.
   *
   * @param value the number
   * @return the negated number
   */
  public static AtomicValue negate(final AtomicValue value) {
    return switch (kindOf(value)) {
      case INTEGER -> AtomicValue.of(integer(value).negate());
      case DECIMAL -> AtomicValue.of(decimal(value).negate());
      case FLOAT -> AtomicValue.of(-floatValue(value));
      case DOUBLE -> AtomicValue.of(-value.getDouble());
    };
  }

  /**
   * Promotes a numeric value of a derived type to its primitive type, for unary plus.
   *
   * @param value the number
   * @return the number as {@code xs:integer}, {@code xs:decimal}, {@code xs:float} or
   *         {@code xs:double}
   */
  public static AtomicValue plus(final AtomicValue value) {
    return switch (kindOf(value)) {
      case INTEGER -> AtomicValue.of(integer(value));
      case DECIMAL -> AtomicValue.of(decimal(value));
      case FLOAT -> AtomicValue.of(floatValue(value));
      case DOUBLE -> AtomicValue.of(value.getDouble());
    };
  }
}
