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

public class SequenceExprTest {

  @Test
  public void testSequences() {
    assertThat(evaluate("(1, (2, 3), ())"), contains("1", "2", "3"));
    assertThat(evaluate("()"), empty());
    assertThat(evaluate("('a', 1, true())"), contains("a", "1", "true"));
  }

  @Test
  public void testRange() {
    assertThat(evaluate("1 to 3"), contains("1", "2", "3"));
    assertThat(evaluate("3 to 1"), empty());
    assertThat(evaluate("2 to 2"), contains("2"));
    assertThat(evaluate("() to 3"), empty());
    assertThat(evaluate("count(1 to 100)"), contains("100"));
    assertThat(evaluate("-1 to 1"), contains("-1", "0", "1"));
    assertThat(evaluate("1 + 1 to 2 + 1"), contains("2", "3"));
  }

  @Test
  public void testRangeErrors() {
    assertEquals("XPTY0004",
        assertThrows(XPathException.class, () -> evaluate("1.5 to 3")).getCode());
    assertEquals("XPTY0004",
        assertThrows(XPathException.class, () -> evaluate("(1, 2) to 3")).getCode());
  }

  @Test
  public void testUnion() {
    assertThat(strings(select("/p:a/b union /p:a/b[1]")), contains("foo", "bar"));
    assertThat(strings(select("/p:a/b[2] | /p:a/@i | /p:a/b[1]")), contains("j", "foo", "bar"));
    assertThat(select("() | ()"), empty());
  }

  @Test
  public void testIntersectExcept() {
    assertThat(strings(select("/p:a/b intersect /p:a/b[2]")), contains("bar"));
    assertThat(strings(select("/p:a/b except /p:a/b[2]")), contains("foo"));
    assertThat(strings(select("/p:a/node() except /p:a/text()")), contains("foo", "bar"));
    assertThat(select("/p:a/b intersect ()"), empty());
  }

  @Test
  public void testSetOperatorPrecedence() {
    assertThat(strings(select("/p:a/b union /p:a/b intersect /p:a/b[1]")),
        contains("foo", "bar"));
  }

  @Test
  public void testSetOperatorsNeedNodes() {
    assertEquals("XPTY0004",
        assertThrows(XPathException.class, () -> select("1 union /p:a")).getCode());
  }

  @Test
  public void testLogical() {
    assertThat(evaluate("1 and 0"), contains("false"));
    assertThat(evaluate("'' or 'x'"), contains("true"));
    assertThat(evaluate("() or (1)"), contains("true"));
  }
}
