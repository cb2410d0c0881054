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

import static io.treepath.XPathTestHelper.evaluate;
import static io.treepath.XPathTestHelper.strings;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.treepath.XPathTestHelper;
import io.treepath.exception.XPathException;
import io.treepath.node.builder.XmlDocuments;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathSelector;
import io.treepath.xpath.parser.ParserConfiguration;
import io.treepath.xpath.parser.XPath1Parser;

public class ArithmeticTest {

  private static String errorOf(final String path) {
    return assertThrows(XPathException.class, () -> evaluate(path)).getCode();
  }

  private static List<String> onNumbers(final String path) {
    final XPathContext context = new XPathContext.Builder()
        .root(XmlDocuments.parse("<r><n>10</n><n>x</n></r>")).build();
    return strings(XPathTestHelper.select(path, context));
  }

  private static List<String> xpath1(final String path) {
    final XPath1Parser parser = new XPath1Parser(
        new ParserConfiguration.Builder().namespaces(XPathTestHelper.NAMESPACES).build());
    return strings(new XPathSelector(path, parser).select(XPathTestHelper.createContext()));
  }

  @Test
  public void testIntegerDivisionTruncates() {
    assertThat(evaluate("5 idiv 2"), contains("2"));
    assertThat(evaluate("-5 idiv 2"), contains("-2"));
    assertThat(evaluate("5 idiv -2"), contains("-2"));
    assertThat(evaluate("5.5 idiv 2"), contains("2"));
    assertThat(evaluate("-5e0 idiv 2"), contains("-2"));
    assertThat(evaluate("(5 idiv 2) instance of xs:integer"), contains("true"));
    assertThat(evaluate("5e0 idiv xs:double('INF')"), contains("0"));
  }

  @Test
  public void testIntegerDivisionErrors() {
    assertEquals("FOAR0001", errorOf("5 idiv 0"));
    assertEquals("FOAR0001", errorOf("5.0 idiv 0.0"));
    assertEquals("FOAR0001", errorOf("5e0 idiv 0"));
    assertEquals("FOAR0002", errorOf("xs:double('NaN') idiv 2"));
    assertEquals("FOAR0002", errorOf("xs:double('INF') idiv 2"));
  }

  @Test
  public void testDivision() {
    assertThat(evaluate("10 div 4"), contains("2.5"));
    assertThat(evaluate("6 div 2"), contains("3"));
    assertThat(evaluate("(10 div 4) instance of xs:decimal"), contains("true"));
    assertThat(evaluate("1 div 0e0"), contains("INF"));
    assertThat(evaluate("-1e0 div 0"), contains("-INF"));
    assertThat(evaluate("0e0 div 0e0"), contains("NaN"));
    assertEquals("FOAR0001", errorOf("1 div 0"));
  }

  @Test
  public void testModulus() {
    assertThat(evaluate("5 mod 3"), contains("2"));
    assertThat(evaluate("-5 mod 3"), contains("-2"));
    assertThat(evaluate("5 mod -3"), contains("2"));
    assertThat(evaluate("5.5 mod 2"), contains("1.5"));
    assertThat(evaluate("5e0 mod 0"), contains("NaN"));
    assertEquals("FOAR0001", errorOf("5 mod 0"));
  }

  @Test
  public void testPromotion() {
    assertThat(evaluate("1 + 2.5"), contains("3.5"));
    assertThat(evaluate("1 + 1e0"), contains("2"));
    assertThat(evaluate("(1 + 1e0) instance of xs:double"), contains("true"));
    assertThat(evaluate("(1 + xs:float('1.5')) instance of xs:float"), contains("true"));
    assertThat(evaluate("2 * 3 - 10"), contains("-4"));
  }

  @Test
  public void testUnaryOperators() {
    assertThat(evaluate("- -2"), contains("2"));
    assertThat(evaluate("-(1 + 2)"), contains("-3"));
    assertThat(evaluate("+1.5"), contains("1.5"));
  }

  @Test
  public void testEmptyOperands() {
    assertThat(evaluate("() + 1"), empty());
    assertThat(evaluate("1 * ()"), empty());
    assertThat(evaluate("-()"), empty());
  }

  @Test
  public void testUntypedOperands() {
    assertThat(onNumbers("/r/n[1] + 1"), contains("11"));
    assertThrows(XPathException.class, () -> onNumbers("/r/n[2] + 1"));
  }

  @Test
  public void testOperandTypes() {
    assertEquals("XPTY0004", errorOf("'3' + 1"));
    assertEquals("XPTY0004", errorOf("(1, 2) + 1"));
  }

  @Test
  public void testCompatibilityMode() {
    assertThat(xpath1("'3' + 1"), contains("4"));
    assertThat(xpath1("1 + /p:a/missing"), contains("NaN"));
    assertThat(xpath1("'x' * 2"), contains("NaN"));
    assertThat(xpath1("7 mod 2"), contains("1"));
  }
}
