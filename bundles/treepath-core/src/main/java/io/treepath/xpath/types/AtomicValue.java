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

import static java.util.Objects.requireNonNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.xpath.EXPathError;

/**
 * <h1>AtomicValue</h1>
 * <p>
 * An atomic value of one of the built-in XML Schema types. The value is held in its Java
 * representation: {@link BigInteger} for integer types, {@link BigDecimal} for decimals,
 * {@link Double}, {@link Float}, {@link Boolean}, {@link QName}, and the lexical {@link String}
 * for all other types.
 * </p>
 */
public final class AtomicValue implements Item {

  /** Boolean true. */
  public static final AtomicValue TRUE = new AtomicValue(Boolean.TRUE, Type.BOOLEAN);

  /** Boolean false. */
  public static final AtomicValue FALSE = new AtomicValue(Boolean.FALSE, Type.BOOLEAN);

  /** Positive range of plain decimal notation for doubles. */
  private static final double DECIMAL_NOTATION_MIN = 1e-6;

  /** Upper bound of plain decimal notation for doubles. */
  private static final double DECIMAL_NOTATION_MAX = 1e6;

  /** Trailing timezone of date and time values. */
  private static final Pattern TIMEZONE = Pattern.compile("(Z|[+-]\\d\\d:\\d\\d)$");

  /** The Java representation of the value. */
  private final Object value;

  /** The type of the value. */
  private final Type type;

  /**
   * Constructor. Initializes the internal state.
   *
   * @param value Java representation of the value, matching the type
   * @param type the atomic type
   */
  public AtomicValue(final Object value, final Type type) {
    this.value = requireNonNull(value);
    this.type = requireNonNull(type);
  }

  /**
   * Creates an {@code xs:string}.
   *
   * @param value the string
   * @return the atomic value
   */
  public static AtomicValue of(final String value) {
    return new AtomicValue(value, Type.STRING);
  }

  /**
   * Creates an {@code xs:boolean}.
   *
   * @param value the boolean
   * @return the atomic value
   */
  public static AtomicValue of(final boolean value) {
    return value ? TRUE : FALSE;
  }

  /**
   * Creates an {@code xs:integer}.
   *
   * @param value the integer
   * @return the atomic value
   */
  public static AtomicValue of(final long value) {
    return new AtomicValue(BigInteger.valueOf(value), Type.INTEGER);
  }

  /**
   * Creates an {@code xs:integer}.
   *
   * @param value the integer
   * @return the atomic value
   */
  public static AtomicValue of(final BigInteger value) {
    return new AtomicValue(value, Type.INTEGER);
  }

  /**
   * Creates an {@code xs:decimal}.
   *
   * @param value the decimal
   * @return the atomic value
   */
  public static AtomicValue of(final BigDecimal value) {
    return new AtomicValue(value, Type.DECIMAL);
  }

  /**
   * Creates an {@code xs:double}.
   *
   * @param value the double
   * @return the atomic value
   */
  public static AtomicValue of(final double value) {
    return new AtomicValue(value, Type.DOUBLE);
  }

  /**
   * Creates an {@code xs:float}.
   *
   * @param value the float
   * @return the atomic value
   */
  public static AtomicValue of(final float value) {
    return new AtomicValue(value, Type.FLOAT);
  }

  /**
   * Creates an {@code xs:untypedAtomic}.
   *
   * @param value the lexical value
   * @return the atomic value
   */
  public static AtomicValue untyped(final String value) {
    return new AtomicValue(value, Type.UNTYPED_ATOMIC);
  }

  /**
   * Get the type.
   *
   * @return the type
   */
  public Type getType() {
    return type;
  }

  /**
   * Get the Java representation of the value.
   *
   * @return the value
   */
  public Object getValue() {
    return value;
  }

  /**
   * Determines if the value is numeric.
   *
   * @return true, if the value is numeric
   */
  public boolean isNumeric() {
    return type.isNumericType();
  }

  /**
   * Determines if the value is an {@code xs:untypedAtomic}.
   *
   * @return true, if the value is untyped
   */
  public boolean isUntyped() {
    return type == Type.UNTYPED_ATOMIC;
  }

  /**
   * Determines if the value is a string, including types derived from {@code xs:string} and
   * {@code xs:anyURI} which is promoted to string.
   *
   * @return true, if the value is a string
   */
  public boolean isString() {
    return type.derivesFrom(Type.STRING) || type == Type.ANY_URI;
  }

  /**
   * Get the numeric value.
   *
   * @return the number
   * @throws IllegalStateException if the value is not numeric
   */
  public Number getNumber() {
    if (value instanceof Number number) {
      return number;
    }
    throw new IllegalStateException("Not a numeric value: " + this);
  }

  /**
   * Get the value as double.
   *
   * @return the double value
   */
  public double getDouble() {
    return getNumber().doubleValue();
  }

  /**
   * Get the boolean value.
   *
   * @return the boolean
   */
  public boolean getBoolean() {
    return (Boolean) value;
  }

  /**
   * Determines if the value is a double or float NaN.
   *
   * @return true, if NaN
   */
  public boolean isNaN() {
    return (value instanceof Double d && d.isNaN()) || (value instanceof Float f && f.isNaN());
  }

  /**
   * Returns the canonical lexical representation of the value.
   *
   * @return the string value
   */
  public String getStringValue() {
    if (value instanceof Double d) {
      return formatDouble(d);
    } else if (value instanceof Float f) {
      return formatDouble(f.doubleValue());
    } else if (value instanceof BigDecimal decimal) {
      final BigDecimal stripped = decimal.stripTrailingZeros();
      return stripped.signum() == 0 ? "0" : stripped.toPlainString();
    } else if (value instanceof QName qname) {
      return qname.getPrefix().isEmpty() ? qname.getLocalPart()
          : qname.getPrefix() + ':' + qname.getLocalPart();
    }
    return value.toString();
  }

  private static String formatDouble(final double number) {
    if (Double.isNaN(number)) {
      return "NaN";
    } else if (Double.isInfinite(number)) {
      return number > 0 ? "INF" : "-INF";
    } else if (number == 0) {
      return 1 / number < 0 ? "-0" : "0";
    }
    final double abs = Math.abs(number);
    if (abs >= DECIMAL_NOTATION_MIN && abs < DECIMAL_NOTATION_MAX) {
      final BigDecimal decimal = new BigDecimal(Double.toString(number)).stripTrailingZeros();
      return decimal.scale() <= 0 ? decimal.toBigInteger().toString() : decimal.toPlainString();
    }
    final BigDecimal decimal = new BigDecimal(Double.toString(number)).stripTrailingZeros();
    final String digits = decimal.unscaledValue().abs().toString();
    final int exponent = digits.length() - 1 - decimal.scale();
    final String fraction = digits.length() > 1 ? digits.substring(1) : "0";
    return (number < 0 ? "-" : "") + digits.charAt(0) + '.' + fraction + 'E' + exponent;
  }

  /**
   * Casts the value to the target type, as defined by the XPath casting rules.
   *
   * @param target the target type
   * @param namespaces statically known namespaces, used when casting to {@code xs:QName}
   * @return the cast value
   * @throws io.treepath.exception.XPathException XPST0080 for abstract target types,
   *         XPTY0004 for a forbidden cast, FORG0001 or FOCA0002 for invalid values
   */
  public AtomicValue castAs(final Type target, final @Nullable Map<String, String> namespaces) {
    if (target == Type.NOTATION || target == Type.ANY_ATOMIC_TYPE || !target.isAtomicType()) {
      throw EXPathError.XPST0080.newException(target.getStringRepr());
    }
    if (type == target) {
      return this;
    }
    if (target == Type.STRING || target == Type.UNTYPED_ATOMIC) {
      return new AtomicValue(getStringValue(), target);
    }
    if (type == Type.UNTYPED_ATOMIC || type.derivesFrom(Type.STRING)) {
      return parse(getStringValue(), target, namespaces);
    }

    final Type source = type.getPrimitiveBaseType();
    final Type primitiveTarget = target.getPrimitiveBaseType();
    if (value instanceof Number || value instanceof Boolean) {
      if (primitiveTarget == Type.BOOLEAN) {
        return of(!(isNaN() || isZero()));
      } else if (target.isNumericType()) {
        return castNumber(target);
      }
    }
    if (target.derivesFrom(Type.STRING)) {
      return parse(getStringValue(), target, namespaces);
    }
    if (source == primitiveTarget) {
      return parse(getStringValue(), target, namespaces);
    }
    final String lexical = getStringValue();
    if (source == Type.DATE_TIME) {
      final int timeStart = lexical.indexOf('T');
      final String timezone = timezoneOf(lexical);
      final String date = lexical.substring(0, timeStart);
      switch (primitiveTarget) {
        case DATE:
          return parse(date + timezone, target, namespaces);
        case TIME:
          return parse(lexical.substring(timeStart + 1), target, namespaces);
        case G_YEAR_MONTH:
          return parse(date.substring(0, date.lastIndexOf('-')) + timezone, target, namespaces);
        case G_YEAR:
          return parse(date.substring(0, date.indexOf('-', 1)) + timezone, target, namespaces);
        case G_MONTH_DAY:
          return parse("-" + date.substring(date.indexOf('-', 1)) + timezone, target, namespaces);
        case G_MONTH:
          return parse("-" + date.substring(date.indexOf('-', 1), date.lastIndexOf('-'))
              + timezone, target, namespaces);
        case G_DAY:
          return parse("--" + date.substring(date.lastIndexOf('-')) + timezone, target,
              namespaces);
        default:
          break;
      }
    } else if (source == Type.DATE && primitiveTarget == Type.DATE_TIME) {
      final String timezone = timezoneOf(lexical);
      final String date = lexical.substring(0, lexical.length() - timezone.length());
      return parse(date + "T00:00:00" + timezone, target, namespaces);
    } else if (source == Type.ANY_URI && primitiveTarget == Type.ANY_URI) {
      return new AtomicValue(lexical, target);
    }
    throw EXPathError.XPTY0004.newException(
        "cannot cast " + type.getStringRepr() + " to " + target.getStringRepr());
  }

  private boolean isZero() {
    if (value instanceof Boolean bool) {
      return !bool;
    } else if (value instanceof BigInteger integer) {
      return integer.signum() == 0;
    } else if (value instanceof BigDecimal decimal) {
      return decimal.signum() == 0;
    }
    return getDouble() == 0;
  }

  private static String timezoneOf(final String lexical) {
    final Matcher matcher = TIMEZONE.matcher(lexical);
    return matcher.find() ? matcher.group() : "";
  }

  private AtomicValue castNumber(final Type target) {
    final Type primitiveTarget = target.getPrimitiveBaseType();
    final Object number = value instanceof Boolean bool ? BigInteger.valueOf(bool ? 1 : 0) : value;
    if (primitiveTarget == Type.DOUBLE) {
      return of(((Number) number).doubleValue());
    } else if (primitiveTarget == Type.FLOAT) {
      return of(((Number) number).floatValue());
    }
    final BigDecimal decimal;
    if (number instanceof BigDecimal big) {
      decimal = big;
    } else if (number instanceof BigInteger big) {
      decimal = new BigDecimal(big);
    } else {
      final double doubleValue = ((Number) number).doubleValue();
      if (Double.isNaN(doubleValue) || Double.isInfinite(doubleValue)) {
        throw EXPathError.FOCA0002.newException(
            "cannot cast " + getStringValue() + " to " + target.getStringRepr());
      }
      decimal = new BigDecimal(Double.toString(doubleValue));
    }
    if (target.derivesFrom(Type.INTEGER)) {
      final BigInteger integer = decimal.toBigInteger();
      if (!target.isInRange(integer)) {
        throw EXPathError.FORG0001.newException(
            integer + " is out of the range of " + target.getStringRepr());
      }
      return new AtomicValue(integer, target);
    }
    return new AtomicValue(decimal, target);
  }

  /**
   * Creates a value from its lexical representation.
   *
   * @param lexical the lexical representation
   * @param target the target type
   * @param namespaces statically known namespaces, used for {@code xs:QName}
   * @return the atomic value
   * @throws io.treepath.exception.XPathException FORG0001 if the lexical value is invalid
   */
  public static AtomicValue parse(final String lexical, final Type target,
      final @Nullable Map<String, String> namespaces) {
    final String text = target.collapsesWhitespace()
        ? CharMatcher.whitespace().trimAndCollapseFrom(lexical, ' ')
        : lexical;
    if (!target.facetIsSatisfiedBy(text)) {
      throw EXPathError.FORG0001.newException(
          "invalid value '" + lexical + "' for " + target.getStringRepr());
    }
    switch (target.getPrimitiveBaseType()) {
      case BOOLEAN:
        return of("true".equals(text) || "1".equals(text));
      case DECIMAL:
        if (target.derivesFrom(Type.INTEGER)) {
          return new AtomicValue(new BigInteger(text.startsWith("+") ? text.substring(1) : text),
              target);
        }
        return new AtomicValue(new BigDecimal(text), target);
      case DOUBLE:
        return new AtomicValue(parseDouble(text), target);
      case FLOAT:
        return new AtomicValue((float) parseDouble(text), target);
      case QNAME:
        return new AtomicValue(resolveQName(text, namespaces), target);
      default:
        return new AtomicValue(text, target);
    }
  }

  private static double parseDouble(final String text) {
    return switch (text) {
      case "INF", "+INF" -> Double.POSITIVE_INFINITY;
      case "-INF" -> Double.NEGATIVE_INFINITY;
      case "NaN" -> Double.NaN;
      default -> Double.parseDouble(text);
    };
  }

  private static QName resolveQName(final String text,
      final @Nullable Map<String, String> namespaces) {
    final int colon = text.indexOf(':');
    final String prefix = colon < 0 ? "" : text.substring(0, colon);
    final String localName = text.substring(colon + 1);
    String uri = namespaces == null ? null : namespaces.get(prefix);
    if (uri == null && XMLConstants.XML_NS_PREFIX.equals(prefix)) {
      uri = XMLConstants.XML_NS_URI;
    }
    if (uri == null) {
      if (!prefix.isEmpty()) {
        throw EXPathError.FORG0001.newException("unknown prefix '" + prefix + "' in " + text);
      }
      uri = XMLConstants.NULL_NS_URI;
    }
    return new QName(uri, localName, prefix);
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof AtomicValue other)) {
      return false;
    }
    return type == other.type && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("type", type.getStringRepr())
                      .add("value", getStringValue())
                      .toString();
  }
}
