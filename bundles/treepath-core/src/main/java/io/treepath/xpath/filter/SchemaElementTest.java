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

import javax.xml.namespace.QName;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.node.NodeKind;
import io.treepath.node.XPathNode;
import io.treepath.schema.SchemaProxy;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;

/**
 * The kind tests {@code schema-element(name)} and {@code schema-attribute(name)}. The name must
 * be declared globally by the schema bound to the parser.
 */
public final class SchemaElementTest extends KindTest {

  /** The declared name. */
  private @Nullable QName name;

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  public SchemaElementTest(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  private boolean isAttributeTest() {
    return "schema-attribute".equals(getSymbol());
  }

  @Override
  protected void parseArguments() {
    final String lexicalName = parser.advanceName();
    name = NameTest.resolveName(parser.getNamespaces(), lexicalName,
        isAttributeTest() ? null : parser.getDefaultNamespace());
    final SchemaProxy schema = parser.getSchema();
    final boolean declared = schema != null && (isAttributeTest()
        ? schema.getAttribute(name) != null
        : schema.getElement(name) != null);
    if (!declared) {
      throw EXPathError.XPST0008.newException("'" + lexicalName + "' is not declared by the "
          + "in-scope schema definitions");
    }
  }

  @Override
  public boolean matches(final XPathNode node) {
    final NodeKind kind = isAttributeTest() ? NodeKind.ATTRIBUTE : NodeKind.ELEMENT;
    final QName nodeName = node.getName();
    return node.getKind() == kind && nodeName != null && name != null
        && name.getNamespaceURI().equals(nodeName.getNamespaceURI())
        && name.getLocalPart().equals(nodeName.getLocalPart());
  }

  @Override
  protected String getArgumentsSource() {
    if (name == null) {
      return "";
    }
    return name.getPrefix().isEmpty() ? name.getLocalPart()
        : name.getPrefix() + ':' + name.getLocalPart();
  }
}
