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

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Enum that represents the built-in types of XPath 2.0, with their derivation hierarchy and the
 * lexical facets used to validate casts.
 */
public enum Type {

  /* --------- UR Types ------------ */
  /** XML Schema type 'anyType'. */
  ANY_TYPE(null, "anyType", false, null),

  /** XML Schema type 'anySimpleType'. */
  ANY_SIMPLE_TYPE(ANY_TYPE, "anySimpleType", false, null),

  /** XML Schema type 'anyAtomicType'. */
  ANY_ATOMIC_TYPE(ANY_SIMPLE_TYPE, "anyAtomicType", false, null),

  /**
   * Denotes untyped atomic data, such as text that has not been assigned a more specific type.
   */
  UNTYPED_ATOMIC(ANY_ATOMIC_TYPE, "untypedAtomic", true, null),

  /** Denotes the dynamic type of an element node that has not been validated. */
  UNTYPED(ANY_TYPE, "untyped", false, null),

  /* --------- primitive types -------- */
  /** XML Schema type 'string'. */
  STRING(ANY_ATOMIC_TYPE, "string", true, null),

  /** XML Schema type 'boolean'. */
  BOOLEAN(ANY_ATOMIC_TYPE, "boolean", true, "true|false|1|0"),

  /** XML Schema type 'decimal'. */
  DECIMAL(ANY_ATOMIC_TYPE, "decimal", true, "[+-]?(\\d+(\\.\\d*)?|\\.\\d+)"),

  /** XML Schema type 'float'. */
  FLOAT(ANY_ATOMIC_TYPE, "float", true,
      "[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?|[+-]?INF|NaN"),

  /** XML Schema type 'double'. */
  DOUBLE(ANY_ATOMIC_TYPE, "double", true,
      "[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?|[+-]?INF|NaN"),

  /** XML Schema type 'duration'. */
  DURATION(ANY_ATOMIC_TYPE, "duration", true,
      "-?P((\\d+Y)?(\\d+M)?(\\d+D)?(T(\\d+H)?(\\d+M)?(\\d+(\\.\\d+)?S)?)?)"),

  /** XML Schema type 'dateTime'. */
  DATE_TIME(ANY_ATOMIC_TYPE, "dateTime", true,
      "-?\\d{4,}-(0[1-9]|1[0-2])-(0[1-9]|[12]\\d|3[01])T(([01]\\d|2[0-3]):[0-5]\\d:[0-5]\\d"
          + "(\\.\\d+)?|24:00:00(\\.0+)?)(Z|[+-](0\\d|1[0-4]):[0-5]\\d)?"),

  /** XML Schema type 'time'. */
  TIME(ANY_ATOMIC_TYPE, "time", true, "(([01]\\d|2[0-3]):[0-5]\\d:[0-5]\\d(\\.\\d+)?"
      + "|24:00:00(\\.0+)?)(Z|[+-](0\\d|1[0-4]):[0-5]\\d)?"),

  /** XML Schema type 'date'. */
  DATE(ANY_ATOMIC_TYPE, "date", true, "-?\\d{4,}-(0[1-9]|1[0-2])-(0[1-9]|[12]\\d|3[01])"
      + "(Z|[+-](0\\d|1[0-4]):[0-5]\\d)?"),

  /** XML Schema type 'gYearMonth'. */
  G_YEAR_MONTH(ANY_ATOMIC_TYPE, "gYearMonth", true,
      "-?\\d{4,}-(0[1-9]|1[0-2])(Z|[+-](0\\d|1[0-4]):[0-5]\\d)?"),

  /** XML Schema type 'gYear'. */
  G_YEAR(ANY_ATOMIC_TYPE, "gYear", true, "-?\\d{4,}(Z|[+-](0\\d|1[0-4]):[0-5]\\d)?"),

  /** XML Schema type 'gMonthDay'. */
  G_MONTH_DAY(ANY_ATOMIC_TYPE, "gMonthDay", true,
      "--(0[1-9]|1[0-2])-(0[1-9]|[12]\\d|3[01])(Z|[+-](0\\d|1[0-4]):[0-5]\\d)?"),

  /** XML Schema type 'gDay'. */
  G_DAY(ANY_ATOMIC_TYPE, "gDay", true, "---(0[1-9]|[12]\\d|3[01])(Z|[+-](0\\d|1[0-4]):[0-5]\\d)?"),

  /** XML Schema type 'gMonth'. */
  G_MONTH(ANY_ATOMIC_TYPE, "gMonth", true, "--(0[1-9]|1[0-2])(Z|[+-](0\\d|1[0-4]):[0-5]\\d)?"),

  /** XML Schema type 'hexBinary'. */
  HEX_BINARY(ANY_ATOMIC_TYPE, "hexBinary", true, "([0-9a-fA-F]{2})*"),

  /** XML Schema type 'base64Binary'. */
  BASE64_BINARY(ANY_ATOMIC_TYPE, "base64Binary", true, "[A-Za-z0-9+/= ]*"),

  /** XML Schema type 'anyURI'. */
  ANY_URI(ANY_ATOMIC_TYPE, "anyURI", true, null),

  /** XML Schema type 'QName'. */
  QNAME(ANY_ATOMIC_TYPE, "QName", true, "([\\p{L}_][\\w.\\-]*:)?[\\p{L}_][\\w.\\-]*"),

  /** XML Schema type 'NOTATION'. */
  NOTATION(ANY_ATOMIC_TYPE, "NOTATION", true, null),

  /* --------- derived types -------- */
  /** Duration restricted to days, hours, minutes and seconds. */
  DAY_TIME_DURATION(DURATION, "dayTimeDuration", false,
      "-?P((\\d+D)?(T(\\d+H)?(\\d+M)?(\\d+(\\.\\d+)?S)?)?)"),

  /** Duration restricted to years and months. */
  YEAR_MONTH_DURATION(DURATION, "yearMonthDuration", false, "-?P((\\d+Y)?(\\d+M)?)"),

  /** XML Schema type 'integer'. */
  INTEGER(DECIMAL, "integer", false, "[+-]?\\d+"),

  /** XML Schema type 'nonPositiveInteger'. */
  NON_POSITIVE_INTEGER(INTEGER, "nonPositiveInteger", false, "[+-]?\\d+", null, "0"),

  /** XML Schema type 'negativeInteger'. */
  NEGATIVE_INTEGER(NON_POSITIVE_INTEGER, "negativeInteger", false, "[+-]?\\d+", null, "-1"),

  /** XML Schema type 'long'. */
  LONG(INTEGER, "long", false, "[+-]?\\d+", "-9223372036854775808", "9223372036854775807"),

  /** XML Schema type 'int'. */
  INT(LONG, "int", false, "[+-]?\\d+", "-2147483648", "2147483647"),

  /** XML Schema type 'short'. */
  SHORT(INT, "short", false, "[+-]?\\d+", "-32768", "32767"),

  /** XML Schema type 'byte'. */
  BYTE(SHORT, "byte", false, "[+-]?\\d+", "-128", "127"),

  /** XML Schema type 'nonNegativeInteger'. */
  NON_NEGATIVE_INTEGER(INTEGER, "nonNegativeInteger", false, "[+-]?\\d+", "0", null),

  /** XML Schema type 'unsignedLong'. */
  UNSIGNED_LONG(NON_NEGATIVE_INTEGER, "unsignedLong", false, "[+-]?\\d+", "0",
      "18446744073709551615"),

  /** XML Schema type 'unsignedInt'. */
  UNSIGNED_INT(UNSIGNED_LONG, "unsignedInt", false, "[+-]?\\d+", "0", "4294967295"),

  /** XML Schema type 'unsignedShort'. */
  UNSIGNED_SHORT(UNSIGNED_INT, "unsignedShort", false, "[+-]?\\d+", "0", "65535"),

  /** XML Schema type 'unsignedByte'. */
  UNSIGNED_BYTE(UNSIGNED_SHORT, "unsignedByte", false, "[+-]?\\d+", "0", "255"),

  /** XML Schema type 'positiveInteger'. */
  POSITIVE_INTEGER(NON_NEGATIVE_INTEGER, "positiveInteger", false, "[+-]?\\d+", "1", null),

  /** Strings without carriage return, line feed and tab characters. */
  NORMALIZED_STRING(STRING, "normalizedString", false, "[^\\r\\n\\t]*"),

  /** Normalized strings without leading, trailing and double spaces. */
  TOKEN(NORMALIZED_STRING, "token", false, "([^\\s](\\s?[^\\s])*)?"),

  /** XML Schema type 'language'. */
  LANGUAGE(TOKEN, "language", false, "[a-zA-Z]{1,8}(-[a-zA-Z0-9]{1,8})*"),

  /** XML Schema type 'NMTOKEN'. */
  NMTOKEN(TOKEN, "NMTOKEN", false, "[\\w.:\\-]+"),

  /** XML Schema type 'Name'. */
  NAME(TOKEN, "Name", false, "[\\p{L}_:][\\w.:\\-]*"),

  /** XML Schema type 'NCName'. */
  NCNAME(NAME, "NCName", false, "[\\p{L}_][\\w.\\-]*"),

  /** XML Schema type 'ID'. */
  ID(NCNAME, "ID", false, "[\\p{L}_][\\w.\\-]*"),

  /** XML Schema type 'IDREF'. */
  IDREF(NCNAME, "IDREF", false, "[\\p{L}_][\\w.\\-]*"),

  /** XML Schema type 'ENTITY'. */
  ENTITY(NCNAME, "ENTITY", false, "[\\p{L}_][\\w.\\-]*");

  /** XML Schema namespace URI. */
  public static final String XSD_NAMESPACE = "http://www.w3.org/2001/XMLSchema";

  /** Mapping of local names to types. */
  private static final Map<String, Type> NAME_TO_TYPE = new HashMap<>();

  static {
    for (final Type type : Type.values()) {
      NAME_TO_TYPE.put(type.localName, type);
    }
  }

  /** Base type of the type. */
  private final @Nullable Type baseType;

  /** Local name of the type in the XML Schema namespace. */
  private final String localName;

  /** Defines whether the type is a primitive type. */
  private final boolean primitive;

  /** Lexical facet, {@code null} if any string is valid. */
  private final @Nullable Pattern facet;

  /** Inclusive lower bound of integer types. */
  private final @Nullable BigInteger minInclusive;

  /** Inclusive upper bound of integer types. */
  private final @Nullable BigInteger maxInclusive;

  Type(final @Nullable Type baseType, final String localName, final boolean primitive,
      final @Nullable String facet) {
    this(baseType, localName, primitive, facet, null, null);
  }

  Type(final @Nullable Type baseType, final String localName, final boolean primitive,
      final @Nullable String facet, final @Nullable String minInclusive,
      final @Nullable String maxInclusive) {
    this.baseType = baseType;
    this.localName = localName;
    this.primitive = primitive;
    this.facet = facet == null ? null : Pattern.compile(facet);
    this.minInclusive = minInclusive == null ? null : new BigInteger(minInclusive);
    this.maxInclusive = maxInclusive == null ? null : new BigInteger(maxInclusive);
  }

  /**
   * Getting the type for its prefixed name ({@code xs:integer}), its Clark name
   * ({@code {http://www.w3.org/2001/XMLSchema}integer}) or its local name.
   *
   * @param name the name of the type
   * @return the type or {@code null} if there is no built-in type with this name
   */
  public static @Nullable Type getType(final String name) {
    String localName = name;
    if (name.startsWith("xs:")) {
      localName = name.substring(3);
    } else if (name.startsWith("{" + XSD_NAMESPACE + "}")) {
      localName = name.substring(XSD_NAMESPACE.length() + 2);
    }
    return NAME_TO_TYPE.get(localName);
  }

  /**
   * Returns the prefixed name of the type, for instance {@code xs:integer}.
   *
   * @return prefixed name of the type
   */
  public String getStringRepr() {
    return "xs:" + localName;
  }

  /**
   * Returns the local name of the type.
   *
   * @return local name
   */
  public String getLocalName() {
    return localName;
  }

  /**
   * Declare, whether the type is one of the primitive value types.
   *
   * @return true, if type is a primitive type
   */
  public boolean isPrimitive() {
    return primitive;
  }

  /**
   * Get the base type.
   *
   * @return the base type or {@code null} for {@code xs:anyType}
   */
  public @Nullable Type getBaseType() {
    return baseType;
  }

  /**
   * Tests whether a type is derived by restriction from a certain type, or is that type.
   *
   * @param expectedType the type to check, if this type is derived from
   * @return true, if this type is derived from the input type.
   */
  public boolean derivesFrom(final Type expectedType) {
    for (Type type = this; type != null; type = type.baseType) {
      if (type == expectedType) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the least common base type of the given types.
   *
   * @param type1 first type
   * @param type2 second type
   * @return the common type of the parameter types
   */
  public static Type getLeastCommonType(final Type type1, final Type type2) {
    for (Type type = type1; type != null; type = type.baseType) {
      if (type2.derivesFrom(type)) {
        return type;
      }
    }
    return ANY_TYPE;
  }

  /**
   * Specifies if the current type is a numeric type or derived from a numeric type.
   *
   * @return true, if the type is a numeric type.
   */
  public boolean isNumericType() {
    return this == DOUBLE || this == FLOAT || derivesFrom(DECIMAL);
  }

  /**
   * Determines if the type is an atomic type, including {@code xs:anyAtomicType} itself.
   *
   * @return true, if the type is atomic
   */
  public boolean isAtomicType() {
    return derivesFrom(ANY_ATOMIC_TYPE);
  }

  /**
   * Return the next base type of the current type that is a primitive one. If the current type
   * is a primitive type the current type is returned.
   *
   * @return primitive base type of the current type
   * @throws IllegalStateException if the type has no primitive base type
   */
  public Type getPrimitiveBaseType() {
    for (Type type = this; type != null; type = type.baseType) {
      if (type.primitive) {
        return type;
      }
    }
    throw new IllegalStateException("Type " + getStringRepr() + " has no primitive base type.");
  }

  /**
   * Defines, whether the input string satisfies the lexical facet and the value range of the
   * type.
   *
   * @param value the value as string, whitespace already collapsed where the type requires it
   * @return true, if the value matches
   */
  public boolean facetIsSatisfiedBy(final String value) {
    for (Type type = this; type != null; type = type.baseType) {
      if (type.facet != null && !type.facet.matcher(value).matches()) {
        return false;
      }
    }
    if (minInclusive != null || maxInclusive != null) {
      final BigInteger number = new BigInteger(value.startsWith("+") ? value.substring(1) : value);
      return isInRange(number);
    }
    return true;
  }

  /**
   * Determines if an integer value is inside the value range of this type and all its base
   * types.
   *
   * @param value the value
   * @return true, if in range
   */
  public boolean isInRange(final BigInteger value) {
    for (Type type = this; type != null; type = type.baseType) {
      if ((type.minInclusive != null && value.compareTo(type.minInclusive) < 0)
          || (type.maxInclusive != null && value.compareTo(type.maxInclusive) > 0)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Determines if the whitespace of lexical values of this type is collapsed before validation.
   *
   * @return false for {@code xs:string}, {@code xs:untypedAtomic} and {@code xs:normalizedString}
   */
  public boolean collapsesWhitespace() {
    return this != STRING && this != UNTYPED_ATOMIC && this != NORMALIZED_STRING;
  }
}
