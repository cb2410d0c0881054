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
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;

import javax.xml.namespace.QName;

import org.junit.jupiter.api.Test;

import io.treepath.exception.XPathException;

public class AtomicValueTest {

  private static String codeOf(final Runnable cast) {
    return assertThrows(XPathException.class, cast::run).getCode();
  }

  @Test
  public void testDoubleStringValue() {
    assertEquals("1.5", AtomicValue.of(1.5).getStringValue());
    assertEquals("100", AtomicValue.of(100.0).getStringValue());
    assertEquals("1.0E7", AtomicValue.of(1e7).getStringValue());
    assertEquals("1.234567E6", AtomicValue.of(1234567.0).getStringValue());
    assertEquals("1.0E-7", AtomicValue.of(1e-7).getStringValue());
    assertEquals("-2.5E10", AtomicValue.of(-2.5e10).getStringValue());
    assertEquals("INF", AtomicValue.of(Double.POSITIVE_INFINITY).getStringValue());
    assertEquals("-INF", AtomicValue.of(Double.NEGATIVE_INFINITY).getStringValue());
    assertEquals("NaN", AtomicValue.of(Double.NaN).getStringValue());
    assertEquals("0", AtomicValue.of(0.0).getStringValue());
    assertEquals("-0", AtomicValue.of(-0.0).getStringValue());
    assertEquals("1.5", AtomicValue.of(1.5f).getStringValue());
  }

  @Test
  public void testDecimalStringValue() {
    assertEquals("1.5", AtomicValue.of(new BigDecimal("1.50")).getStringValue());
    assertEquals("0", AtomicValue.of(new BigDecimal("0.00")).getStringValue());
    assertEquals("100", AtomicValue.of(new BigDecimal("100")).getStringValue());
    assertEquals("-7", AtomicValue.of(-7).getStringValue());
  }

  @Test
  public void testParse() {
    assertEquals(AtomicValue.of(12), AtomicValue.parse(" 12 ", Type.INTEGER, null));
    assertEquals(BigInteger.valueOf(5), AtomicValue.parse("+5", Type.INTEGER, null).getValue());
    assertEquals("a b", AtomicValue.parse("  a \n b ", Type.TOKEN, null).getValue());
    assertEquals(" a ", AtomicValue.parse(" a ", Type.STRING, null).getValue());
    assertTrue(AtomicValue.parse("1", Type.BOOLEAN, null).getBoolean());
    assertTrue(AtomicValue.parse("NaN", Type.DOUBLE, null).isNaN());
    assertEquals(Double.NEGATIVE_INFINITY, AtomicValue.parse("-INF", Type.DOUBLE, null)
        .getDouble());
    assertEquals("FORG0001", codeOf(() -> AtomicValue.parse("abc", Type.INTEGER, null)));
    assertEquals("FORG0001", codeOf(() -> AtomicValue.parse("128", Type.BYTE, null)));
    assertEquals("FORG0001", codeOf(() -> AtomicValue.parse("2020-13-01", Type.DATE, null)));
  }

  @Test
  public void testParseQName() {
    final QName name = (QName) AtomicValue.parse("p:x", Type.QNAME,
        Collections.singletonMap("p", "ns")).getValue();
    assertEquals(new QName("ns", "x"), name);
    assertEquals("p", name.getPrefix());
    assertEquals("p:x", AtomicValue.parse("p:x", Type.QNAME,
        Collections.singletonMap("p", "ns")).getStringValue());
    assertEquals("FORG0001", codeOf(() -> AtomicValue.parse("q:x", Type.QNAME, null)));
  }

  @Test
  public void testNumericCasts() {
    assertEquals(AtomicValue.of(3), AtomicValue.of(3.7).castAs(Type.INTEGER, null));
    assertEquals(AtomicValue.of(-3), AtomicValue.of(-3.7).castAs(Type.INTEGER, null));
    assertEquals(AtomicValue.of(1.0), AtomicValue.of(1).castAs(Type.DOUBLE, null));
    assertEquals(AtomicValue.of(1), AtomicValue.TRUE.castAs(Type.INTEGER, null));
    assertEquals(AtomicValue.FALSE, AtomicValue.of(0).castAs(Type.BOOLEAN, null));
    assertEquals(AtomicValue.FALSE, AtomicValue.of(Double.NaN).castAs(Type.BOOLEAN, null));
    assertEquals(Type.BYTE, AtomicValue.of(100).castAs(Type.BYTE, null).getType());
    assertEquals("FORG0001", codeOf(() -> AtomicValue.of(300).castAs(Type.BYTE, null)));
    assertEquals("FOCA0002",
        codeOf(() -> AtomicValue.of(Double.NaN).castAs(Type.INTEGER, null)));
    assertEquals("FOCA0002", codeOf(() -> AtomicValue.of(Double.POSITIVE_INFINITY)
        .castAs(Type.DECIMAL, null)));
  }

  @Test
  public void testStringCasts() {
    assertEquals(AtomicValue.of("1.5"), AtomicValue.of(1.5).castAs(Type.STRING, null));
    assertEquals(Type.UNTYPED_ATOMIC,
        AtomicValue.of("x").castAs(Type.UNTYPED_ATOMIC, null).getType());
    assertEquals(AtomicValue.of(12), AtomicValue.untyped("12").castAs(Type.INTEGER, null));
    assertEquals("FORG0001", codeOf(() -> AtomicValue.of("x").castAs(Type.DOUBLE, null)));
  }

  @Test
  public void testTemporalCasts() {
    final AtomicValue dateTime = AtomicValue.parse("2020-01-02T03:04:05Z", Type.DATE_TIME, null);
    assertEquals("2020-01-02Z", dateTime.castAs(Type.DATE, null).getStringValue());
    assertEquals("03:04:05Z", dateTime.castAs(Type.TIME, null).getStringValue());
    assertEquals("2020-01Z", dateTime.castAs(Type.G_YEAR_MONTH, null).getStringValue());
    assertEquals("2020Z", dateTime.castAs(Type.G_YEAR, null).getStringValue());
    assertEquals("--01-02Z", dateTime.castAs(Type.G_MONTH_DAY, null).getStringValue());
    assertEquals("--01Z", dateTime.castAs(Type.G_MONTH, null).getStringValue());
    assertEquals("---02Z", dateTime.castAs(Type.G_DAY, null).getStringValue());
    assertEquals("2020-01-02T00:00:00", AtomicValue.parse("2020-01-02", Type.DATE, null)
        .castAs(Type.DATE_TIME, null).getStringValue());
  }

  @Test
  public void testForbiddenCasts() {
    assertEquals("XPTY0004", codeOf(() -> AtomicValue.TRUE.castAs(Type.DATE, null)));
    assertEquals("XPTY0004", codeOf(() -> AtomicValue.parse("2020-01-02", Type.DATE, null)
        .castAs(Type.INTEGER, null)));
    assertEquals("XPST0080", codeOf(() -> AtomicValue.of(1).castAs(Type.ANY_ATOMIC_TYPE, null)));
    assertEquals("XPST0080", codeOf(() -> AtomicValue.of("x").castAs(Type.NOTATION, null)));
  }

  @Test
  public void testEquality() {
    assertEquals(AtomicValue.of(1), AtomicValue.of(1));
    assertEquals(AtomicValue.of(1).hashCode(), AtomicValue.of(1).hashCode());
    assertNotEquals(AtomicValue.of(1), AtomicValue.of(1.0));
    assertNotEquals(AtomicValue.of("1"), AtomicValue.untyped("1"));
    assertFalse(AtomicValue.of("1").isNumeric());
    assertTrue(AtomicValue.untyped("1").isUntyped());
  }
}
