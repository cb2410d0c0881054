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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.treepath.exception.XPathSyntaxException;

public class XPathScannerTest {

  private static List<String> texts(final String expression) {
    final List<String> texts = new ArrayList<>();
    for (final Lexeme lexeme : new XPathScanner(expression).tokenize()) {
      texts.add(lexeme.text());
    }
    return texts;
  }

  private static List<TokenType> types(final String expression) {
    final List<TokenType> types = new ArrayList<>();
    for (final Lexeme lexeme : new XPathScanner(expression).tokenize()) {
      types.add(lexeme.type());
    }
    return types;
  }

  @Test
  public void testPath() {
    assertThat(texts("/p:a//b[@i != 'j']"),
        contains("/", "p:a", "//", "b", "[", "@", "i", "!=", "j", "]", ""));
  }

  @Test
  public void testQualifiedNamesAndWildcards() {
    assertThat(texts("p:a *:b p:* *"), contains("p:a", "*:b", "p:*", "*", ""));
    assertThat(types("p:a *:b p:* *"), contains(TokenType.NAME, TokenType.NAME,
        TokenType.NAME, TokenType.SYMBOL, TokenType.END));
  }

  @Test
  public void testAxis() {
    assertThat(texts("child::a"), contains("child", "::", "a", ""));
  }

  @Test
  public void testNamesWithHyphens() {
    assertThat(texts("a-b - c"), contains("a-b", "-", "c", ""));
  }

  @Test
  public void testNumbers() {
    assertThat(types("1 .5 2.0 1e3 1.5E-2"), contains(TokenType.INTEGER, TokenType.DECIMAL,
        TokenType.DECIMAL, TokenType.DOUBLE, TokenType.DOUBLE, TokenType.END));
    assertThat(texts("1..2"), contains("1", "..", "2", ""));
  }

  @Test
  public void testStringLiterals() {
    final List<Lexeme> lexemes = new XPathScanner("'it''s' \"say \"\"hi\"\"\"").tokenize();
    assertEquals(new Lexeme(TokenType.STRING, "it's", 0), lexemes.get(0));
    assertEquals(new Lexeme(TokenType.STRING, "say \"hi\"", 8), lexemes.get(1));
  }

  @Test
  public void testNestedComments() {
    assertThat(texts("(: a (: nested :) comment :) 1 (::)"), contains("1", ""));
  }

  @Test
  public void testOffsets() {
    final List<Lexeme> lexemes = new XPathScanner("a  eq  b").tokenize();
    assertEquals(0, lexemes.get(0).offset());
    assertEquals(3, lexemes.get(1).offset());
    assertEquals(7, lexemes.get(2).offset());
    assertEquals(8, lexemes.get(3).offset());
  }

  @Test
  public void testInvalidCharacter() {
    final XPathSyntaxException e =
        assertThrows(XPathSyntaxException.class, () -> new XPathScanner("a # b").tokenize());
    assertEquals("#", e.getToken());
    assertEquals(2, e.getOffset());
    assertEquals("XPST0003", e.getCode());
  }

  @Test
  public void testLexicalErrors() {
    assertThrows(XPathSyntaxException.class, () -> new XPathScanner("'abc").tokenize());
    assertThrows(XPathSyntaxException.class, () -> new XPathScanner("(: abc").tokenize());
    assertThrows(XPathSyntaxException.class, () -> new XPathScanner("1a").tokenize());
    assertThrows(XPathSyntaxException.class, () -> new XPathScanner("1e+").tokenize());
    assertThrows(XPathSyntaxException.class, () -> new XPathScanner("a ! b").tokenize());
  }
}
