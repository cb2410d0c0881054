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

package io.treepath.xpath.filter;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.node.DocumentNode;
import io.treepath.node.ElementNode;
import io.treepath.node.XPathNode;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.parser.Label;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;

/**
 * The kind test {@code document-node()}, optionally testing the document element with an
 * {@code element()} or {@code schema-element()} test.
 */
public final class DocumentTest extends KindTest {

  /** The test of the document element or {@code null}. */
  private @Nullable KindTest elementTest;

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  public DocumentTest(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  @Override
  protected void parseArguments() {
    final XPathToken next = parser.getNextToken();
    if (next.getLabel() != Label.KIND_TEST
        || !("element".equals(next.getSymbol()) || "schema-element".equals(next.getSymbol()))) {
      throw next.wrongSyntax();
    }
    elementTest = (KindTest) parser.advance().nud();
  }

  @Override
  public boolean matches(final XPathNode node) {
    if (!(node instanceof DocumentNode document)) {
      return false;
    } else if (elementTest == null) {
      return true;
    }
    final ElementNode documentElement = document.getDocumentElement();
    return documentElement != null && elementTest.matches(documentElement);
  }

  @Override
  protected String getArgumentsSource() {
    return elementTest == null ? "" : elementTest.getSource();
  }
}
