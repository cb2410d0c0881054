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
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.treepath.xpath.EXPathError;

/**
 * Comparison and formatting of date, time and duration values. Values without a timezone are
 * compared in the implicit timezone. Values of the partial types ({@code xs:time},
 * {@code xs:gDay} and others) are anchored on the reference date 1972-12-31.
 */
public final class Temporals {

  /** Trailing timezone of a lexical value. */
  private static final Pattern TIMEZONE = Pattern.compile("(Z|[+-]\\d\\d:\\d\\d)$");

  /** Lexical form of a duration. */
  private static final Pattern DURATION = Pattern.compile(
      "(-)?P(?:(\\d+)Y)?(?:(\\d+)M)?(?:(\\d+)D)?"
          + "(?:T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+(?:\\.\\d+)?)S)?)?");

  private static final BigDecimal SECONDS_PER_DAY = BigDecimal.valueOf(86400);

  private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

  private static final BigDecimal SECONDS_PER_MINUTE = BigDecimal.valueOf(60);

  private Temporals() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Determines if a primitive type is a date, time or duration type.
   *
   * @param type the type
   * @return {@code true} for temporal types
   */
  public static boolean isTemporal(final Type type) {
    return switch (type.getPrimitiveBaseType()) {
      case DATE_TIME, DATE, TIME, G_YEAR_MONTH, G_YEAR, G_MONTH_DAY, G_MONTH, G_DAY, DURATION ->
          true;
      default -> false;
    };
  }

  /**
   * Determines if values of the type have a total order. The partial date types and
   * {@code xs:duration} only support equality.
   *
   * @param type the type
   * @return {@code true} if values of the type can be ordered
   */
  public static boolean isOrdered(final Type type) {
    return switch (type) {
      case DATE_TIME, DATE, TIME, DAY_TIME_DURATION, YEAR_MONTH_DURATION -> true;
      default -> type.derivesFrom(Type.DATE_TIME);
    };
  }

  /**
   * Compares two temporal values of the same primitive type.
   *
   * @param first the first value
   * @param second the second value
   * @param implicitTimezone timezone of values without an explicit one
   * @return negative, zero or positive as the first value is before, equal to or after the second
   * @throws io.treepath.exception.XPathException XPTY0004 if the values are not comparable
   */
  public static int compare(final AtomicValue first, final AtomicValue second,
      final ZoneOffset implicitTimezone) {
    final Type primitive = first.getType().getPrimitiveBaseType();
    if (primitive != second.getType().getPrimitiveBaseType() || !isTemporal(primitive)) {
      throw EXPathError.XPTY0004.newException("cannot compare " + first.getType().getStringRepr()
          + " with " + second.getType().getStringRepr());
    }
    if (primitive == Type.DURATION) {
      final BigDecimal[] duration1 = parseDuration(first.getStringValue());
      final BigDecimal[] duration2 = parseDuration(second.getStringValue());
      final int months = duration1[0].compareTo(duration2[0]);
      return months != 0 ? months : duration1[1].compareTo(duration2[1]);
    }
    return OffsetDateTime.timeLineOrder().compare(
        toDateTime(first.getStringValue(), primitive, implicitTimezone),
        toDateTime(second.getStringValue(), primitive, implicitTimezone));
  }

  private static OffsetDateTime toDateTime(final String lexical, final Type primitive,
      final ZoneOffset implicitTimezone) {
    final Matcher matcher = TIMEZONE.matcher(lexical);
    final boolean hasTimezone = matcher.find();
    final String value = hasTimezone ? lexical.substring(0, matcher.start()) : lexical;
    final ZoneOffset offset = hasTimezone ? ZoneOffset.of(matcher.group()) : implicitTimezone;
    final String dateTime = switch (primitive) {
      case DATE_TIME -> value;
      case DATE -> value + "T00:00:00";
      case TIME -> "1972-12-31T" + value;
      case G_YEAR_MONTH -> value + "-01T00:00:00";
      case G_YEAR -> value + "-01-01T00:00:00";
      case G_MONTH_DAY -> "1972" + value.substring(1) + "T00:00:00";
      case G_MONTH -> "1972" + value.substring(1) + "-01T00:00:00";
      case G_DAY -> "1972-12" + value.substring(2) + "T00:00:00";
      default -> throw EXPathError.XPTY0004.newException(
          "not a date or time type: " + primitive.getStringRepr());
    };
    try {
      final int time = dateTime.indexOf('T');
      if (dateTime.startsWith("24:00:00", time + 1)) {
        return LocalDateTime.parse(dateTime.substring(0, time + 1) + "00:00:00")
            .plusDays(1).atOffset(offset);
      }
      return LocalDateTime.parse(dateTime).atOffset(offset);
    } catch (final DateTimeParseException e) {
      throw EXPathError.FORG0001.newException("invalid date or time '" + lexical + "'");
    }
  }

  /**
   * Splits a duration into its months and seconds components.
   *
   * @param lexical the lexical duration
   * @return an array of the total months and the total seconds
   */
  private static BigDecimal[] parseDuration(final String lexical) {
    final Matcher matcher = DURATION.matcher(lexical);
    if (!matcher.matches()) {
      throw EXPathError.FORG0001.newException("invalid duration '" + lexical + "'");
    }
    BigDecimal months = component(matcher, 2).multiply(BigDecimal.valueOf(12))
        .add(component(matcher, 3));
    BigDecimal seconds = component(matcher, 4).multiply(SECONDS_PER_DAY)
        .add(component(matcher, 5).multiply(SECONDS_PER_HOUR))
        .add(component(matcher, 6).multiply(SECONDS_PER_MINUTE))
        .add(component(matcher, 7));
    if (matcher.group(1) != null) {
      months = months.negate();
      seconds = seconds.negate();
    }
    return new BigDecimal[] {months, seconds};
  }

  private static BigDecimal component(final Matcher matcher, final int group) {
    final String text = matcher.group(group);
    return text == null ? BigDecimal.ZERO : new BigDecimal(text);
  }

  /**
   * Formats a date and time as {@code xs:dateTime}.
   *
   * @param dateTime the date and time
   * @return the value
   */
  public static AtomicValue toDateTime(final OffsetDateTime dateTime) {
    return new AtomicValue(dateTime.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
        Type.DATE_TIME);
  }

  /**
   * Formats a timezone offset as {@code xs:dayTimeDuration}.
   *
   * @param offset the offset
   * @return the duration, {@code PT0S} for UTC
   */
  public static AtomicValue toDayTimeDuration(final ZoneOffset offset) {
    final Duration duration = Duration.ofSeconds(offset.getTotalSeconds());
    if (duration.isZero()) {
      return new AtomicValue("PT0S", Type.DAY_TIME_DURATION);
    }
    final Duration abs = duration.abs();
    final StringBuilder builder = new StringBuilder(duration.isNegative() ? "-PT" : "PT");
    if (abs.toHours() > 0) {
      builder.append(abs.toHours()).append('H');
    }
    if (abs.toMinutesPart() > 0) {
      builder.append(abs.toMinutesPart()).append('M');
    }
    return new AtomicValue(builder.toString(), Type.DAY_TIME_DURATION);
  }
}
