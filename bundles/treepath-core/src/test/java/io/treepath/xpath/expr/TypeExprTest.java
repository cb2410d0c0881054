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

package io.treepath.xpath.expr;

import static io.treepath.XPathTestHelper.evaluate;
import static io.treepath.XPathTestHelper.select;
import static io.treepath.XPathTestHelper.strings;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import io.treepath.exception.XPathException;

public class TypeExprTest {

  private static String errorOf(final String path) {
    return assertThrows(XPathException.class, () -> select(path)).getCode();
  }

  @Test
  public void testCast() {
    assertThat(evaluate("'12' cast as xs:integer"), contains("12"));
    assertThat(evaluate("('12' cast as xs:integer) instance of xs:integer"), contains("true"));
    assertThat(evaluate("1 cast as xs:boolean"), contains("true"));
    assertThat(evaluate("0 cast as xs:boolean"), contains("false"));
    assertThat(evaluate("'1.50' cast as xs:decimal"), contains("1.5"));
    assertThat(evaluate("() cast as xs:integer?"), empty());
    assertThat(strings(select("/p:a/@i cast as xs:string")), contains("j"));
  }

  @Test
  public void testCastErrors() {
    assertEquals("FORG0001", errorOf("'abc' cast as xs:integer"));
    assertEquals("XPTY0004", errorOf("() cast as xs:integer"));
    assertEquals("XPTY0004", errorOf("(1, 2) cast as xs:integer"));
    assertEquals("XPST0080", errorOf("1 cast as xs:anyAtomicType"));
    assertEquals("XPST0051", errorOf("1 cast as xs:element"));
  }

  @Test
  public void testCastable() {
    assertThat(evaluate("'12' castable as xs:integer"), contains("true"));
    assertThat(evaluate("'abc' castable as xs:integer"), contains("false"));
    assertThat(evaluate("() castable as xs:integer"), contains("false"));
    assertThat(evaluate("() castable as xs:integer?"), contains("true"));
    assertThat(evaluate("(1, 2) castable as xs:integer"), contains("false"));
  }

  @Test
  public void testInstanceOfAtomicTypes() {
    assertThat(evaluate("1 instance of xs:integer"), contains("true"));
    assertThat(evaluate("1 instance of xs:decimal"), contains("true"));
    assertThat(evaluate("1 instance of xs:string"), contains("false"));
    assertThat(evaluate("1 instance of xs:anyAtomicType"), contains("true"));
    assertThat(evaluate("(1, 2) instance of xs:integer"), contains("false"));
    assertThat(evaluate("(1, 2) instance of xs:integer+"), contains("true"));
    assertThat(evaluate("() instance of xs:integer?"), contains("true"));
    assertThat(evaluate("() instance of empty-sequence()"), contains("true"));
    assertThat(evaluate("'a' instance of item()"), contains("true"));
    assertThat(evaluate("('a', 1) instance of item()*"), contains("true"));
  }

  @Test
  public void testInstanceOfNodeTypes() {
    assertThat(strings(select("/p:a instance of element()")), contains("true"));
    assertThat(strings(select("/p:a instance of element(p:a)")), contains("true"));
    assertThat(strings(select("/p:a instance of element(b)")), contains("false"));
    assertThat(strings(select("/p:a/b instance of element(*)+")), contains("true"));
    assertThat(strings(select("/p:a/@i instance of attribute()")), contains("true"));
    assertThat(strings(select("/p:a/@i instance of element()")), contains("false"));
    assertThat(strings(select("(/) instance of document-node()")), contains("true"));
    assertThat(strings(select("(/) instance of document-node(element(p:a))")),
        contains("true"));
    assertThat(strings(select("/p:a/text() instance of text()+")), contains("true"));
    assertThat(strings(select("/p:a instance of xs:string")), contains("false"));
  }

  @Test
  public void testTreat() {
    assertThat(evaluate("1 treat as xs:integer"), contains("1"));
    assertThat(evaluate("(1, 2) treat as xs:decimal+"), contains("1", "2"));
    assertEquals("XPDY0050", errorOf("'a' treat as xs:integer"));
    assertEquals("XPDY0050", errorOf("() treat as xs:integer"));
  }
}
