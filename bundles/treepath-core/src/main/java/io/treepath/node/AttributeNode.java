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

package io.treepath.node;

import static java.util.Objects.requireNonNull;

import java.util.Collections;
import java.util.List;

import javax.xml.namespace.QName;

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.xpath.types.AtomicValue;
import io.treepath.xpath.types.Type;

/**
 * An attribute node. Attributes are not children of their element, but the element is their
 * parent.
 */
public final class AttributeNode extends XPathNode {

  /** Name of the attribute. */
  private final QName name;

  /** Value of the attribute. */
  private final String value;

  /** Name of the type annotation, {@code null} if untyped. */
  private final @Nullable QName typeName;

  AttributeNode(final NodeTree tree, final ElementNode parent, final @NonNegative int position,
      final QName name, final String value, final @Nullable QName typeName) {
    super(tree, parent, position);
    this.name = requireNonNull(name);
    this.value = requireNonNull(value);
    this.typeName = typeName;
  }

  @Override
  public QName getName() {
    return name;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ATTRIBUTE;
  }

  @Override
  public String getStringValue() {
    return value;
  }

  /**
   * Get the name of the type annotation.
   *
   * @return the type name or {@code null} if untyped
   */
  public @Nullable QName getTypeName() {
    return typeName;
  }

  @Override
  public List<AtomicValue> getTypedValue() {
    if (typeName != null && Type.XSD_NAMESPACE.equals(typeName.getNamespaceURI())) {
      final Type type = Type.getType(typeName.getLocalPart());
      if (type != null && type.isAtomicType()) {
        return Collections.singletonList(
            AtomicValue.parse(value, type, getTree().getNamespaces()));
      }
    }
    return super.getTypedValue();
  }

  @Override
  public boolean matchName(final String nameTest, final @Nullable String defaultNamespace) {
    // unprefixed attribute names are never in the default namespace
    return matchName(name, nameTest, null);
  }

  @Override
  protected String getPathStep() {
    return "@" + prefixed(name);
  }
}
