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

import static io.treepath.XPathTestHelper.createContext;
import static io.treepath.XPathTestHelper.paths;
import static io.treepath.XPathTestHelper.select;
import static io.treepath.XPathTestHelper.strings;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.treepath.api.Item;
import io.treepath.exception.XPathException;
import io.treepath.node.DocumentNode;
import io.treepath.node.XPathNode;
import io.treepath.xpath.XPathContext;

public class PathExprTest {

  private static int count(final String path) {
    return select(path).size();
  }

  @Test
  public void testRoot() {
    final XPathContext context = createContext();
    final List<Item> result = select("/", context);
    assertEquals(1, result.size());
    assertThat(result.get(0), instanceOf(DocumentNode.class));
    assertThat(paths(select("/*")), contains("/p:a"));
    assertThat(select(".", context), contains(result.get(0)));
  }

  @Test
  public void testChildSteps() {
    assertThat(paths(select("/p:a/b")), contains("/p:a/b", "/p:a/b"));
    assertEquals(2, count("/p:a/b/c"));
    assertEquals(2, count("p:a/b"));
    assertThat(strings(select("/p:a/text()")), contains("oops1", "oops2", "oops3"));
    assertEquals(2, count("/p:a/*:b"));
    assertEquals(0, count("/p:a/p:*"));
    assertEquals(1, count("/p:*"));
  }

  @Test
  public void testDescendants() {
    assertEquals(2, count("//c"));
    assertEquals(10, count("//node()"));
    assertEquals(6, count("/p:a/b/descendant-or-self::node()"));
    assertThat(strings(select("//b[c]/text()")), contains("foo", "bar"));
  }

  @Test
  public void testAttributes() {
    assertThat(strings(select("/p:a/@i")), contains("j"));
    assertThat(strings(select("/p:a/attribute::i")), contains("j"));
    assertThat(strings(select("/p:a/@*")), contains("j"));
    assertThat(strings(select("/p:a/b/@p:x")), contains("y"));
    assertThat(strings(select("//b[@p:x]")), contains("bar"));
    assertEquals(2, count("/p:a/namespace::*"));
  }

  @Test
  public void testPredicates() {
    assertThat(strings(select("/p:a/b[2]")), contains("bar"));
    assertThat(strings(select("/p:a/b[last()]")), contains("bar"));
    assertThat(strings(select("/p:a/b[position() = 1]")), contains("foo"));
    assertThat(strings(select("(/p:a/b)[2]")), contains("bar"));
    assertThat(strings(select("/p:a/b[. = 'bar']")), contains("bar"));
    assertThat(strings(select("/p:a/node()[3]")), contains("oops2"));
    assertThat(strings(select("/p:a/b[c][2]")), contains("bar"));
    assertThat(select("/p:a/b[3]"), empty());
    assertThat(strings(select("(1 to 10)[. mod 3 = 0]")), contains("3", "6", "9"));
  }

  @Test
  public void testReverseAxes() {
    assertThat(strings(select("/p:a/b[2]/preceding-sibling::*[1]")), contains("foo"));
    assertThat(strings(select("/p:a/b[2]/preceding-sibling::node()[1]")), contains("oops2"));
    assertThat(strings(select("/p:a/b[2]/preceding-sibling::node()")),
        contains("oops1", "foo", "oops2"));
    assertEquals(3, count("//c/ancestor::*"));
    assertThat(strings(select("//c/ancestor::*[1]")), contains("foo", "bar"));
    assertThat(paths(select("/p:a/b[1]/c/ancestor-or-self::*[last()]")), contains("/p:a"));
  }

  @Test
  public void testForwardAxes() {
    assertThat(strings(select("/p:a/b[1]/following-sibling::b")), contains("bar"));
    assertEquals(5, count("/p:a/b[1]/c/following::node()"));
    assertEquals(1, count("/p:a/b[1]/self::b"));
    assertEquals(0, count("/p:a/b[1]/self::c"));
    assertThat(paths(select("//c/..")), contains("/p:a/b", "/p:a/b"));
    assertThat(paths(select("/p:a/b/parent::node()")), contains("/p:a"));
  }

  @Test
  public void testDuplicatesAreRemoved() {
    assertEquals(2, count("/p:a/b/c/../c"));
    assertEquals(1, count("/p:a/b/.."));
  }

  @Test
  public void testRelativeToContextNode() {
    final XPathContext context = createContext();
    final XPathNode a = context.getDocumentRoot().getChildren().get(0);
    context.setItem(a.getChildren().get(3));
    assertThat(strings(select("c | text()", context)), contains("", "bar"));
    assertThat(strings(select("../@i", context)), contains("j"));
    assertThat(paths(select("/p:a", context)), contains("/p:a"));
  }

  @Test
  public void testStepOnAtomicValue() {
    assertEquals("XPTY0019",
        assertThrows(XPathException.class, () -> select("(1, 2)/b")).getCode());
    assertEquals("XPTY0020",
        assertThrows(XPathException.class, () -> select("(1 to 2)[child::b]")).getCode());
  }
}
