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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import io.treepath.exception.XPathException;

public class NumbersTest {

  private static String codeOf(final Runnable operation) {
    return assertThrows(XPathException.class, operation::run).getCode();
  }

  private static AtomicValue decimal(final String value) {
    return AtomicValue.of(new BigDecimal(value));
  }

  @Test
  public void testIntegerDivide() {
    assertEquals(AtomicValue.of(2), Numbers.integerDivide(AtomicValue.of(5), AtomicValue.of(2)));
    assertEquals(AtomicValue.of(-2),
        Numbers.integerDivide(AtomicValue.of(-5), AtomicValue.of(2)));
    assertEquals(AtomicValue.of(-2),
        Numbers.integerDivide(AtomicValue.of(5), AtomicValue.of(-2)));
    assertEquals(AtomicValue.of(3), Numbers.integerDivide(AtomicValue.of(7.5), AtomicValue.of(2)));
    assertEquals(AtomicValue.of(-3), Numbers.integerDivide(decimal("-7.5"), AtomicValue.of(2)));
    assertEquals(AtomicValue.of(0),
        Numbers.integerDivide(AtomicValue.of(5.0), AtomicValue.of(Double.POSITIVE_INFINITY)));
  }

  @Test
  public void testIntegerDivideErrors() {
    assertEquals("FOAR0001",
        codeOf(() -> Numbers.integerDivide(AtomicValue.of(5), AtomicValue.of(0))));
    assertEquals("FOAR0001", codeOf(() -> Numbers.integerDivide(decimal("5.5"), decimal("0.0"))));
    assertEquals("FOAR0001",
        codeOf(() -> Numbers.integerDivide(AtomicValue.of(5.0), AtomicValue.of(0.0))));
    assertEquals("FOAR0002",
        codeOf(() -> Numbers.integerDivide(AtomicValue.of(Double.NaN), AtomicValue.of(1))));
    assertEquals("FOAR0002",
        codeOf(() -> Numbers.integerDivide(AtomicValue.of(1), AtomicValue.of(Double.NaN))));
    assertEquals("FOAR0002", codeOf(() -> Numbers.integerDivide(
        AtomicValue.of(Double.NEGATIVE_INFINITY), AtomicValue.of(2))));
  }

  @Test
  public void testDivide() {
    assertEquals("0.25",
        Numbers.divide(AtomicValue.of(1), AtomicValue.of(4)).getStringValue());
    assertEquals(AtomicValue.of(Double.POSITIVE_INFINITY),
        Numbers.divide(AtomicValue.of(1.0), AtomicValue.of(0)));
    assertTrue(Numbers.divide(AtomicValue.of(0.0), AtomicValue.of(0.0)).isNaN());
    assertEquals("FOAR0001", codeOf(() -> Numbers.divide(AtomicValue.of(1), AtomicValue.of(0))));
  }

  @Test
  public void testMod() {
    assertEquals(AtomicValue.of(-1), Numbers.mod(AtomicValue.of(-5), AtomicValue.of(2)));
    assertEquals(AtomicValue.of(1), Numbers.mod(AtomicValue.of(5), AtomicValue.of(-2)));
    assertEquals(AtomicValue.of(1.5), Numbers.mod(AtomicValue.of(5.5), AtomicValue.of(2)));
    assertEquals("0.5", Numbers.mod(decimal("2.5"), AtomicValue.of(1)).getStringValue());
    assertTrue(Numbers.mod(AtomicValue.of(1.0), AtomicValue.of(0)).isNaN());
    assertEquals("FOAR0001", codeOf(() -> Numbers.mod(AtomicValue.of(1), AtomicValue.of(0))));
  }

  @Test
  public void testPromotion() {
    assertEquals(Type.INTEGER, Numbers.add(AtomicValue.of(1), AtomicValue.of(2)).getType());
    assertEquals(Type.DECIMAL, Numbers.add(AtomicValue.of(1), decimal("0.5")).getType());
    assertEquals(Type.FLOAT, Numbers.add(AtomicValue.of(1), AtomicValue.of(0.5f)).getType());
    assertEquals(Type.DOUBLE, Numbers.multiply(AtomicValue.of(0.5f), AtomicValue.of(2.0))
        .getType());
    assertEquals(Type.INTEGER, Numbers.subtract(
        new AtomicValue(BigInteger.TEN, Type.BYTE), AtomicValue.of(1)).getType());
    assertEquals(Type.INTEGER, Numbers.plus(new AtomicValue(BigInteger.ONE, Type.BYTE))
        .getType());
    assertEquals("-1.5", Numbers.negate(decimal("1.5")).getStringValue());
    assertEquals("XPTY0004", codeOf(() -> Numbers.add(AtomicValue.of(1), AtomicValue.of("a"))));
  }

  @Test
  public void testCompare() {
    assertEquals(0, Numbers.compare(AtomicValue.of(1.0), AtomicValue.of(1.00000001)));
    assertEquals(0, Numbers.compare(AtomicValue.of(1), AtomicValue.of(1.00000001)));
    assertEquals(-1, Numbers.compare(AtomicValue.of(1.0), AtomicValue.of(1.001)));
    assertEquals(1, Numbers.compare(decimal("1.00000001"), AtomicValue.of(1)));
    assertEquals(1, Numbers.compare(AtomicValue.of(Double.POSITIVE_INFINITY),
        AtomicValue.of(Double.MAX_VALUE)));
    assertEquals(0, Numbers.compare(AtomicValue.of(Double.NEGATIVE_INFINITY),
        AtomicValue.of(Double.NEGATIVE_INFINITY)));
  }

  @Test
  public void testToDouble() {
    assertEquals(12, Numbers.toDouble(AtomicValue.of(" 12 ")));
    assertEquals(1, Numbers.toDouble(AtomicValue.TRUE));
    assertEquals(2.5, Numbers.toDouble(AtomicValue.untyped("2.5")));
    assertTrue(Double.isNaN(Numbers.toDouble(AtomicValue.of("x"))));
    assertTrue(Double.isNaN(Numbers.toDouble(AtomicValue.parse("2020-01-01", Type.DATE, null))));
  }
}
