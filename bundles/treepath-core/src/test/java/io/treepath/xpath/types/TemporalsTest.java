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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import io.treepath.exception.XPathException;

public class TemporalsTest {

  private static int compare(final String first, final String second, final Type type,
      final ZoneOffset implicitTimezone) {
    return Integer.signum(Temporals.compare(AtomicValue.parse(first, type, null),
        AtomicValue.parse(second, type, null), implicitTimezone));
  }

  @Test
  public void testClassification() {
    assertTrue(Temporals.isTemporal(Type.DATE));
    assertTrue(Temporals.isTemporal(Type.DAY_TIME_DURATION));
    assertFalse(Temporals.isTemporal(Type.STRING));
    assertTrue(Temporals.isOrdered(Type.DATE_TIME));
    assertTrue(Temporals.isOrdered(Type.YEAR_MONTH_DURATION));
    assertFalse(Temporals.isOrdered(Type.G_YEAR));
    assertFalse(Temporals.isOrdered(Type.DURATION));
  }

  @Test
  public void testTimezones() {
    assertEquals(1, compare("2020-01-01Z", "2020-01-01+01:00", Type.DATE, ZoneOffset.UTC));
    assertEquals(0, compare("2020-01-01T10:00:00", "2020-01-01T10:00:00Z", Type.DATE_TIME,
        ZoneOffset.UTC));
    assertEquals(-1, compare("2020-01-01T10:00:00", "2020-01-01T10:00:00Z", Type.DATE_TIME,
        ZoneOffset.ofHours(1)));
    assertEquals(0, compare("12:00:00+02:00", "10:00:00Z", Type.TIME, ZoneOffset.UTC));
  }

  @Test
  public void testEndOfDay() {
    assertEquals(0, compare("2020-01-01T24:00:00Z", "2020-01-02T00:00:00Z", Type.DATE_TIME,
        ZoneOffset.UTC));
  }

  @Test
  public void testDurations() {
    assertEquals(0, compare("P1D", "PT24H", Type.DAY_TIME_DURATION, ZoneOffset.UTC));
    assertEquals(1, compare("PT1M1S", "PT60S", Type.DAY_TIME_DURATION, ZoneOffset.UTC));
    assertEquals(-1, compare("-P1D", "PT0S", Type.DAY_TIME_DURATION, ZoneOffset.UTC));
    assertEquals(0, compare("P1Y", "P12M", Type.YEAR_MONTH_DURATION, ZoneOffset.UTC));
    assertEquals(1, compare("P1M", "P30D", Type.DURATION, ZoneOffset.UTC));
  }

  @Test
  public void testIncomparable() {
    final XPathException e = assertThrows(XPathException.class, () -> Temporals.compare(
        AtomicValue.parse("2020-01-01", Type.DATE, null),
        AtomicValue.parse("2020-01-01T00:00:00", Type.DATE_TIME, null), ZoneOffset.UTC));
    assertEquals("XPTY0004", e.getCode());
  }

  @Test
  public void testFormatting() {
    final AtomicValue dateTime =
        Temporals.toDateTime(OffsetDateTime.of(2020, 1, 2, 3, 4, 5, 0, ZoneOffset.ofHours(2)));
    assertEquals(Type.DATE_TIME, dateTime.getType());
    assertEquals("2020-01-02T03:04:05+02:00", dateTime.getStringValue());
    assertEquals("PT0S", Temporals.toDayTimeDuration(ZoneOffset.UTC).getStringValue());
    assertEquals("PT2H", Temporals.toDayTimeDuration(ZoneOffset.ofHours(2)).getStringValue());
    assertEquals("PT45M",
        Temporals.toDayTimeDuration(ZoneOffset.ofHoursMinutes(0, 45)).getStringValue());
    assertEquals("-PT5H30M",
        Temporals.toDayTimeDuration(ZoneOffset.ofHoursMinutes(-5, -30)).getStringValue());
  }
}
