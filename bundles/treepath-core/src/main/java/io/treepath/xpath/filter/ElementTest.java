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

import io.treepath.node.AttributeNode;
import io.treepath.node.ElementNode;
import io.treepath.node.NodeKind;
import io.treepath.node.XPathNode;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;
import io.treepath.xpath.types.Type;

/**
 * The kind tests {@code element(name?, type?)} and {@code attribute(name?, type?)}. The name may
 * be the wildcard {@code *}. Untyped nodes match the types {@code xs:anyType} and
 * {@code xs:untyped}, untyped attributes also {@code xs:anySimpleType} and
 * {@code xs:untypedAtomic}.
 */
public final class ElementTest extends KindTest {

  /** The name as written, {@code null} for any name. */
  private @Nullable String name;

  /** The expanded name. */
  private @Nullable String expandedName;

  /** The type name as written. */
  private @Nullable String typeSource;

  /** The resolved type name. */
  private @Nullable QName typeName;

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  public ElementTest(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  private boolean isAttributeTest() {
    return "attribute".equals(getSymbol());
  }

  @Override
  protected void parseArguments() {
    if ("*".equals(parser.getNextToken().getSymbol())) {
      parser.advance();
      name = "*";
    } else {
      name = parser.advanceName();
    }
    expandedName = NameTest.expandName(parser.getNamespaces(), name);
    if (",".equals(parser.getNextToken().getSymbol())) {
      parser.advance();
      typeSource = parser.advanceName();
      typeName = NameTest.resolveName(parser.getNamespaces(), typeSource, null);
      if (!isAttributeTest() && "?".equals(parser.getNextToken().getSymbol())) {
        parser.advance();
        typeSource += "?";
      }
    }
  }

  @Override
  public boolean matches(final XPathNode node) {
    final QName actualType;
    if (isAttributeTest() && node.getKind() == NodeKind.ATTRIBUTE) {
      actualType = ((AttributeNode) node).getTypeName();
    } else if (!isAttributeTest() && node.getKind() == NodeKind.ELEMENT) {
      actualType = ((ElementNode) node).getTypeName();
    } else {
      return false;
    }
    if (expandedName != null && !node.matchName(expandedName, parser.getDefaultNamespace())) {
      return false;
    }
    return typeMatches(actualType);
  }

  private boolean typeMatches(final @Nullable QName actualType) {
    if (typeName == null) {
      return true;
    }
    final Type expected = builtInType(typeName);
    if (actualType == null) {
      return expected == Type.ANY_TYPE || expected == Type.UNTYPED
          || (isAttributeTest()
              && (expected == Type.ANY_SIMPLE_TYPE || expected == Type.UNTYPED_ATOMIC));
    } else if (actualType.equals(typeName)) {
      return true;
    }
    final Type actual = builtInType(actualType);
    return expected != null && actual != null && actual.derivesFrom(expected);
  }

  private static @Nullable Type builtInType(final QName name) {
    return Type.XSD_NAMESPACE.equals(name.getNamespaceURI())
        ? Type.getType('{' + Type.XSD_NAMESPACE + '}' + name.getLocalPart())
        : null;
  }

  @Override
  protected String getArgumentsSource() {
    if (name == null) {
      return "";
    }
    return typeSource == null ? name : name + ", " + typeSource;
  }
}
