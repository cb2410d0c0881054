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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import io.treepath.exception.XPathException;
import io.treepath.xpath.operators.IDivOperator;

public class SymbolTableTest {

  @Test
  public void testExtendLeavesOriginalUnchanged() {
    final SymbolTable base = XPath1Grammar.TABLE;
    final int size = base.getSymbols().size();
    final SymbolTable extended =
        base.extend().infix("idiv", 45, IDivOperator::new).unregister("|").build();

    assertTrue(extended.contains("idiv"));
    assertFalse(extended.contains("|"));
    assertFalse(base.contains("idiv"));
    assertTrue(base.contains("|"));
    assertEquals(size, base.getSymbols().size());
  }

  @Test
  public void testRedefinitionInExtension() {
    final SymbolTable extended =
        XPath1Grammar.TABLE.extend().infix("div", 99, IDivOperator::new).build();
    assertEquals(99, extended.getRequired("div").getLbp());
    assertEquals(45, XPath1Grammar.TABLE.getRequired("div").getLbp());
  }

  @Test
  public void testXPath2ExtendsXPath1() {
    for (final String symbol : XPath1Grammar.TABLE.getSymbols()) {
      assertTrue(XPath2Grammar.TABLE.contains(symbol), symbol);
    }
    assertTrue(XPath2Grammar.TABLE.contains("idiv"));
    assertTrue(XPath2Grammar.TABLE.contains("xs:integer"));
    assertFalse(XPath1Grammar.TABLE.contains("eq"));
  }

  @Test
  public void testLabels() {
    final SymbolTable table = XPath2Grammar.TABLE;
    assertEquals(Label.AXIS, table.getRequired("attribute::").getLabel());
    assertEquals(Label.KIND_TEST, table.getRequired("attribute").getLabel());
    assertEquals(Label.AXIS, table.getRequired("@").getLabel());
    assertEquals(Label.KEYWORD, table.getRequired("div").getLabel());
    assertEquals(Label.OPERATOR, table.getRequired("+").getLabel());
    assertEquals(Label.FUNCTION, table.getRequired("count").getLabel());
    assertEquals(Label.CONSTRUCTOR, table.getRequired("xs:double").getLabel());
  }

  @Test
  public void testBindingPowers() {
    final SymbolTable table = XPath2Grammar.TABLE;
    assertEquals(20, table.getRequired("or").getLbp());
    assertEquals(30, table.getRequired("eq").getLbp());
    assertEquals(40, table.getRequired("-").getLbp());
    assertEquals(70, table.getRequired("-").getRbp());
    assertEquals(45, table.getRequired("idiv").getLbp());
  }

  @Test
  public void testUnknownSymbol() {
    assertNull(XPath2Grammar.TABLE.get("foo"));
    final XPathException e =
        assertThrows(XPathException.class, () -> XPath2Grammar.TABLE.getRequired("foo"));
    assertEquals("XPST0010", e.getCode());
  }
}
