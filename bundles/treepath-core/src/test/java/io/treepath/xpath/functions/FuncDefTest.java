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

package io.treepath.xpath.functions;

import static io.treepath.XPathTestHelper.evaluate;
import static io.treepath.XPathTestHelper.select;
import static io.treepath.XPathTestHelper.strings;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.treepath.exception.XPathException;
import io.treepath.node.builder.XmlDocuments;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.parser.XPath1Parser;
import io.treepath.xpath.types.SequenceType.Occurrence;

public class FuncDefTest {

  private static String errorOf(final String path) {
    return assertThrows(XPathException.class, () -> select(path)).getCode();
  }

  private static List<String> on(final XPathContext context, final String path) {
    return strings(select(path, context));
  }

  @Test
  public void testRegistry() {
    assertEquals(FuncDef.COUNT, FuncDef.fromName("count"));
    assertEquals("XPST0017",
        assertThrows(XPathException.class, () -> FuncDef.fromName("nope")).getCode());
    assertThat(FuncDef.getFunctions("1.0"), hasItem(FuncDef.CONCAT));
    assertThat(FuncDef.getFunctions("1.0"), not(hasItem(FuncDef.EXISTS)));
    assertThat(FuncDef.getFunctions("2.0"), hasItem(FuncDef.EXISTS));
    assertEquals(Occurrence.ZERO_OR_ONE, FuncDef.CONCAT.getParameter(7));
    assertEquals(Integer.MAX_VALUE, FuncDef.CONCAT.getMaxArgs());
    assertThrows(XPathException.class, () -> new XPath1Parser().parse("exists(1)"));
  }

  @Test
  public void testFocusFunctions() {
    assertThat(evaluate("(5, 6, 7)[last()]"), contains("7"));
    assertThat(evaluate("(5, 6, 7)[position() > 1]"), contains("6", "7"));
    assertThat(strings(select("/p:a/node()[position() = last()]")), contains("oops3"));
    assertThat(strings(select("position()")), contains("1"));
  }

  @Test
  public void testSequenceFunctions() {
    assertThat(evaluate("count((1, 2, 3))"), contains("3"));
    assertThat(evaluate("count(())"), contains("0"));
    assertThat(evaluate("empty(())"), contains("true"));
    assertThat(evaluate("exists(())"), contains("false"));
    assertThat(strings(select("data(/p:a/@i)")), contains("j"));
    assertThat(strings(select("data(/p:a/@i) instance of xs:untypedAtomic")), contains("true"));
  }

  @Test
  public void testSum() {
    assertThat(evaluate("sum((1, 2.5))"), contains("3.5"));
    assertThat(evaluate("sum(())"), contains("0"));
    assertThat(evaluate("sum((), 'none')"), contains("none"));
    assertThat(evaluate("sum(1 to 4)"), contains("10"));
    final XPathContext numbers = new XPathContext.Builder()
        .root(XmlDocuments.parse("<r><n>1</n><n>2.5</n></r>")).build();
    assertThat(on(numbers, "sum(/r/n)"), contains("3.5"));
    assertEquals("FORG0006", errorOf("sum(('a', 1))"));
  }

  @Test
  public void testBooleanFunctions() {
    assertThat(evaluate("true()"), contains("true"));
    assertThat(evaluate("not(false())"), contains("true"));
    assertThat(evaluate("boolean('')"), contains("false"));
    assertThat(evaluate("boolean(0)"), contains("false"));
    assertThat(evaluate("boolean(xs:double('NaN'))"), contains("false"));
    assertThat(strings(select("boolean(/p:a/b)")), contains("true"));
    assertThat(evaluate("not(())"), contains("true"));
    assertEquals("FORG0006", errorOf("boolean((1, 2))"));
  }

  @Test
  public void testStringFunctions() {
    assertThat(strings(select("string()")), contains("oops1foooops2baroops3"));
    assertThat(strings(select("string(/p:a/b[1])")), contains("foo"));
    assertThat(evaluate("string(1.5e0)"), contains("1.5"));
    assertThat(evaluate("string(())"), contains(""));
    assertThat(evaluate("string-length('abc')"), contains("3"));
    assertThat(evaluate("string-length(())"), contains("0"));
    assertThat(evaluate("string-length('𝐀b')"), contains("2"));
    assertThat(evaluate("concat('a', 1, (), true())"), contains("a1true"));
    assertThat(evaluate("contains('abc', 'b')"), contains("true"));
    assertThat(evaluate("contains('abc', ())"), contains("true"));
    assertThat(evaluate("starts-with('abc', 'ab')"), contains("true"));
    assertThat(evaluate("starts-with('abc', 'b')"), contains("false"));
  }

  @Test
  public void testNumber() {
    assertThat(evaluate("number('12')"), contains("12"));
    assertThat(evaluate("number(' 1.5 ')"), contains("1.5"));
    assertThat(evaluate("number('x')"), contains("NaN"));
    assertThat(evaluate("number(true())"), contains("1"));
    assertThat(evaluate("number(())"), contains("NaN"));
    assertThat(strings(select("number(/p:a/@i)")), contains("NaN"));
  }

  @Test
  public void testNodeNames() {
    assertThat(strings(select("name(/p:a)")), contains("p:a"));
    assertThat(strings(select("local-name(/p:a)")), contains("a"));
    assertThat(strings(select("namespace-uri(/p:a)")), contains("ns"));
    assertThat(strings(select("namespace-uri(/p:a/b[1])")), contains(""));
    assertThat(strings(select("name(/p:a/b/@p:x)")), contains("p:x"));
    assertThat(evaluate("name(())"), contains(""));
    assertEquals("XPTY0004", errorOf("name(1)"));
  }

  @Test
  public void testRoot() {
    assertThat(strings(select("root(/p:a/b[1]) instance of document-node()")),
        contains("true"));
    assertThat(evaluate("root(())"), empty());
  }

  @Test
  public void testArgumentCardinality() {
    assertEquals("XPTY0004", errorOf("string-length(('a', 'b'))"));
  }

  @Test
  public void testDocumentsAndCollections() {
    final XPathContext context = new XPathContext.Builder()
        .document("x.xml", XmlDocuments.parse("<x><y/></x>"))
        .collection("c", Arrays.asList(XmlDocuments.parse("<c1/>"), XmlDocuments.parse("<c2/>")))
        .defaultCollection(Arrays.asList(XmlDocuments.parse("<d/>")))
        .build();
    assertThat(on(context, "count(doc('x.xml')/x/y)"), contains("1"));
    assertThat(on(context, "doc(())"), empty());
    assertThat(on(context, "count(collection('c'))"), contains("2"));
    assertThat(on(context, "name(collection()/*)"), contains("d"));
    assertThrows(XPathException.class, () -> on(context, "doc('missing.xml')"));
    final XPathException e =
        assertThrows(XPathException.class, () -> on(context, "collection('missing')"));
    assertEquals("FODC0002", e.getCode());
  }

  @Test
  public void testDatesAndTimes() {
    final XPathContext context = new XPathContext.Builder()
        .currentDateTime(OffsetDateTime.of(2020, 1, 2, 3, 4, 5, 0, ZoneOffset.UTC))
        .timezone(ZoneOffset.ofHoursMinutes(-5, -30))
        .build();
    assertThat(on(context, "current-dateTime()"), contains("2020-01-02T03:04:05Z"));
    assertThat(on(context, "current-dateTime() eq current-dateTime()"), contains("true"));
    assertThat(on(context, "implicit-timezone()"), contains("-PT5H30M"));
    assertThat(evaluate("implicit-timezone()"), contains("PT0S"));
  }

  @Test
  public void testConstructorFunctions() {
    assertThat(evaluate("xs:integer('5') + 1"), contains("6"));
    assertThat(evaluate("xs:date('2020-01-01')"), contains("2020-01-01"));
    assertThat(evaluate("xs:integer(())"), empty());
    assertThat(evaluate("xs:double('INF') gt 1"), contains("true"));
    assertEquals("FORG0001", errorOf("xs:boolean('maybe')"));
    assertThrows(XPathException.class, () -> select("xs:integer('1', '2')"));
  }
}
