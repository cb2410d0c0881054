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
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.types.AtomicValue;

public class BindingExprTest {

  @Test
  public void testForProduct() {
    assertThat(evaluate("for $x in (1, 2), $y in (1, 2) return $x * $y"),
        contains("1", "2", "2", "4"));
  }

  @Test
  public void testFor() {
    assertThat(evaluate("for $x in (1, 2, 3) return $x + 1"), contains("2", "3", "4"));
    assertThat(evaluate("for $x in () return $x"), empty());
    assertThat(evaluate("for $x in (1, 2), $y in ($x to 2) return $y"),
        contains("1", "2", "2"));
    assertThat(evaluate("for $x in (1, 2) return for $y in ($x * 10) return $y"),
        contains("10", "20"));
  }

  @Test
  public void testForOverNodes() {
    assertThat(strings(select("for $b in /p:a/b return name($b)")), contains("b", "b"));
    assertThat(strings(select("for $b in /p:a/b return $b/c")), contains("", ""));
  }

  @Test
  public void testQuantified() {
    assertThat(evaluate("some $x in (1, 2, 3) satisfies $x gt 2"), contains("true"));
    assertThat(evaluate("every $x in (1, 2, 3) satisfies $x gt 2"), contains("false"));
    assertThat(evaluate("every $x in (1, 2, 3) satisfies $x gt 0"), contains("true"));
    assertThat(evaluate("some $x in () satisfies true()"), contains("false"));
    assertThat(evaluate("every $x in () satisfies false()"), contains("true"));
    assertThat(evaluate("some $x in (1, 2), $y in (2, 3) satisfies $x + $y = 5"),
        contains("true"));
  }

  @Test
  public void testLoopVariableInOwnBinding() {
    assertEquals("XPST0008",
        assertThrows(XPathException.class, () -> evaluate("for $x in $x return 1")).getCode());
    assertEquals("XPST0008", assertThrows(XPathException.class,
        () -> evaluate("some $x in (1, $x) satisfies true()")).getCode());
  }

  @Test
  public void testLoopVariableScope() {
    final XPathException e = assertThrows(XPathException.class,
        () -> evaluate("(for $x in 1 return $x), $x"));
    assertEquals("XPST0008", e.getCode());
  }

  @Test
  public void testExternalVariables() {
    final XPathContext context =
        new XPathContext.Builder().variable("v", AtomicValue.of(3)).build();
    assertThat(strings(select("$v * 2", context)), contains("6"));
    assertThat(strings(select("for $x in (1, 2) return $x + $v", context)), contains("4", "5"));
    assertThat(strings(select("$v", context)), contains("3"));
  }

  @Test
  public void testIf() {
    assertThat(evaluate("if (1 = 1) then 'a' else 'b'"), contains("a"));
    assertThat(evaluate("if (()) then 1 else 2"), contains("2"));
    assertThat(evaluate("if ('') then 1 else (2, 3)"), contains("2", "3"));
  }
}
