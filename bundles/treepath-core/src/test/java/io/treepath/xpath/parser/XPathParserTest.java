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

package io.treepath.xpath.parser;

import static io.treepath.XPathTestHelper.evaluate;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Test;

import io.treepath.XPathTestHelper;
import io.treepath.exception.XPathException;
import io.treepath.exception.XPathSyntaxException;
import io.treepath.node.builder.XmlDocuments;
import io.treepath.schema.TestSchema;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathSelector;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.comparators.ValueComparison;
import io.treepath.xpath.operators.AddOperator;
import io.treepath.xpath.types.SequenceType;
import io.treepath.xpath.types.Type;

public class XPathParserTest {

  private static String code(final String expression) {
    return assertThrows(XPathException.class, () -> new XPath2Parser().parse(expression))
        .getCode();
  }

  @Test
  public void testPrecedence() {
    assertThat(evaluate("1 + 2 * 3"), contains("7"));
    assertThat(evaluate("(1 + 2) * 3"), contains("9"));
    assertThat(evaluate("10 - 4 - 3"), contains("3"));
    assertThat(evaluate("-2 * 3"), contains("-6"));
    assertThat(evaluate("1 = 1 and 2 = 3 or 4 = 4"), contains("true"));
  }

  @Test
  public void testTokenTree() {
    final XPathToken root = new XPath2Parser().parse("1 + 2 eq 3");
    assertThat(root, instanceOf(ValueComparison.class));
    assertThat(root.get(0), instanceOf(AddOperator.class));
    assertEquals("1 + 2 eq 3", root.getSource());
  }

  @Test
  public void testKeywordsAsNames() {
    final XPathContext context = new XPathContext.Builder()
        .root(XmlDocuments.parse("<div><for/><if><then/></if><mod/></div>")).build();
    assertEquals(1, XPathTestHelper.select("/div/for", context).size());
    assertEquals(1, XPathTestHelper.select("/div/if/then", context).size());
    assertEquals(1, XPathTestHelper.select("div/mod", context).size());
    assertThat(XPathTestHelper.strings(XPathTestHelper.select("count(/div/*)", context)),
        contains("3"));
  }

  @Test
  public void testUnexpectedEnd() {
    final XPathSyntaxException e =
        assertThrows(XPathSyntaxException.class, () -> new XPath2Parser().parse("1 +"));
    assertEquals("(end)", e.getToken());
    assertEquals(3, e.getOffset());
  }

  @Test
  public void testExpectedSymbols() {
    final XPathSyntaxException e =
        assertThrows(XPathSyntaxException.class, () -> new XPath2Parser().parse("(1, 2"));
    assertThat(e.getExpected(), hasItem(")"));
    final XPathSyntaxException trailing =
        assertThrows(XPathSyntaxException.class, () -> new XPath2Parser().parse("1 2"));
    assertThat(trailing.getExpected(), contains("(end)"));
    assertEquals(2, trailing.getOffset());
  }

  @Test
  public void testStaticErrors() {
    assertEquals("XPST0017", code("foo(1)"));
    assertEquals("XPST0017", code("count()"));
    assertEquals("XPST0017", code("concat('a')"));
    assertEquals("XPST0010", code("sideways::a"));
    assertEquals("XPST0081", code("q:a"));
    assertEquals("XPST0081", code("q:f(1)"));
    assertEquals("XPST0051", code("1 cast as xs:foo"));
    assertEquals("XPST0008", code("for $x in $x return 1"));
  }

  @Test
  public void testChainedComparisons() {
    assertThrows(XPathSyntaxException.class, () -> new XPath2Parser().parse("1 eq 1 eq 1"));
    assertThrows(XPathSyntaxException.class, () -> new XPath2Parser().parse("1 = 1 = 1"));
    assertThrows(XPathSyntaxException.class, () -> new XPath2Parser().parse("(/) is (/) is (/)"));
    assertThat(XPathTestHelper.strings(
        new XPathSelector("1 = 1 = 1", new XPath1Parser()).select(XPathTestHelper.createContext())),
        contains("true"));
  }

  @Test
  public void testXPath1Grammar() {
    final XPath1Parser parser = new XPath1Parser();
    assertEquals("1.0", parser.getVersion());
    assertTrue(parser.isCompatibilityMode());
    assertThrows(XPathSyntaxException.class, () -> parser.parse("1 eq 1"));
    assertThrows(XPathException.class, () -> parser.parse("1 to 3"));
    assertThrows(XPathException.class, () -> parser.parse("xs:integer('1')"));
  }

  @Test
  public void testXPath1ParserIgnoresSchema() {
    final XPath1Parser parser =
        new XPath1Parser(new ParserConfiguration.Builder().schema(new TestSchema()).build());
    assertNull(parser.getSchema());
  }

  @Test
  public void testUndeclaredVariables() {
    final ParserConfiguration strict = new ParserConfiguration.Builder()
        .variableTypes(ImmutableMap.of("y", "xs:string")).strict(true).build();
    final XPathException e =
        assertThrows(XPathException.class, () -> new XPath2Parser(strict).parse("$x"));
    assertEquals("XPST0008", e.getCode());
    new XPath2Parser(strict).parse("$y");
    new XPath2Parser(strict).parse("for $x in 1 return $x");

    final ParserConfiguration lenient = new ParserConfiguration.Builder()
        .variableTypes(ImmutableMap.of("y", "xs:string")).build();
    assertFalse(lenient.isStrict());
    new XPath2Parser(lenient).parse("$x");
  }

  @Test
  public void testPredeclaredNamespaces() {
    final XPath2Parser parser = new XPath2Parser();
    assertEquals(Type.XSD_NAMESPACE, parser.getNamespaces().get("xs"));
    assertEquals(XPathParser.FN_NAMESPACE, parser.getNamespaces().get("fn"));
    assertThat(evaluate("fn:count((1, 2))"), contains("2"));
  }

  @Test
  public void testSequenceTypes() {
    final XPath2Parser parser = new XPath2Parser();
    final SequenceType strings = parser.parseSequenceType("xs:string*");
    assertEquals(Type.STRING, strings.getAtomicType());
    assertEquals(SequenceType.Occurrence.ZERO_OR_MORE, strings.getOccurrence());
    assertTrue(parser.parseSequenceType("empty-sequence()").isEmptySequence());
    assertEquals(SequenceType.Occurrence.ONE_OR_MORE,
        parser.parseSequenceType("element(*)+").getOccurrence());
    assertEquals(SequenceType.Occurrence.ZERO_OR_ONE,
        parser.parseSequenceType("item()?").getOccurrence());
  }

  @Test
  public void testCommentsAreIgnored() {
    assertThat(evaluate("1 (: one :) + (: two (: nested :) :) 2"), contains("3"));
  }

  @Test
  public void testEmptyParentheses() {
    final List<String> result = evaluate("()");
    assertTrue(result.isEmpty());
  }
}
