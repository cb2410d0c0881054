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
import java.util.Map;
import java.util.function.Supplier;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.xpath.types.AtomicValue;
import io.treepath.xpath.types.Type;

/**
 * <h1>ElementNode</h1>
 * <p>
 * An element with its in-scope namespaces and attributes. The element reserves the positions
 * following its own for the block of its namespace nodes (the in-scope namespaces plus the
 * implicit {@code xml} namespace) and its attribute nodes, in this order.
 * </p>
 */
public class ElementNode extends ParentNode {

  /** Name of the element. */
  private final QName name;

  /** In-scope namespaces. */
  private final ImmutableMap<String, String> namespaces;

  /** Attribute nodes in order of declaration. */
  private final ImmutableList<AttributeNode> attributes;

  /** Name of the type annotation, {@code null} if untyped. */
  private final @Nullable QName typeName;

  /** Namespace nodes, created on first access. */
  private final Supplier<List<NamespaceNode>> namespaceNodes =
      Suppliers.memoize(this::createNamespaceNodes);

  /**
   * Constructor.
   *
   * @param tree the tree of the node
   * @param parent the parent node or {@code null}
   * @param position the position in document order
   * @param name the element name
   * @param namespaces the in-scope namespaces
   * @param attributes the attributes
   * @param typeName name of the type annotation or {@code null}
   */
  public ElementNode(final NodeTree tree, final @Nullable ParentNode parent,
      final @NonNegative int position, final QName name, final Map<String, String> namespaces,
      final List<AttributeData> attributes, final @Nullable QName typeName) {
    super(tree, parent, position);
    this.name = requireNonNull(name);
    this.namespaces = ImmutableMap.copyOf(namespaces);
    this.typeName = typeName;

    int attributePosition = position + getNamespaceCount(namespaces) + 1;
    final ImmutableList.Builder<AttributeNode> builder = ImmutableList.builder();
    for (final AttributeData attribute : attributes) {
      builder.add(new AttributeNode(tree, this, attributePosition++, attribute.name(),
          attribute.value(), attribute.typeName()));
    }
    this.attributes = builder.build();

    if (parent != null) {
      parent.appendChild(this);
    }
  }

  /**
   * Number of namespace nodes of an element with the given in-scope namespaces.
   *
   * @param namespaces the in-scope namespaces
   * @return number of namespace nodes
   */
  public static int getNamespaceCount(final Map<String, String> namespaces) {
    return namespaces.size() + (namespaces.containsKey(XMLConstants.XML_NS_PREFIX) ? 0 : 1);
  }

  /**
   * Number of positions an element takes: one for itself, one for each namespace node and one
   * for each attribute node.
   *
   * @param namespaces the in-scope namespaces
   * @param attributeCount the number of attributes
   * @return number of reserved positions
   */
  public static int getReservedPositions(final Map<String, String> namespaces,
      final int attributeCount) {
    return getNamespaceCount(namespaces) + 1 + attributeCount;
  }

  private List<NamespaceNode> createNamespaceNodes() {
    final ImmutableList.Builder<NamespaceNode> builder = ImmutableList.builder();
    int namespacePosition = getPosition() + 1;
    if (!namespaces.containsKey(XMLConstants.XML_NS_PREFIX)) {
      builder.add(new NamespaceNode(getTree(), this, namespacePosition++,
          XMLConstants.XML_NS_PREFIX, XMLConstants.XML_NS_URI));
    }
    for (final Map.Entry<String, String> namespace : namespaces.entrySet()) {
      builder.add(new NamespaceNode(getTree(), this, namespacePosition++, namespace.getKey(),
          namespace.getValue()));
    }
    return builder.build();
  }

  @Override
  public QName getName() {
    return name;
  }

  /**
   * Get the in-scope namespaces.
   *
   * @return prefix to URI map
   */
  public Map<String, String> getNamespaces() {
    return namespaces;
  }

  /**
   * Get the attribute nodes.
   *
   * @return the attributes in order of declaration
   */
  public List<AttributeNode> getAttributes() {
    return attributes;
  }

  /**
   * Get the namespace nodes, the implicit {@code xml} namespace first.
   *
   * @return the namespace nodes
   */
  public List<NamespaceNode> getNamespaceNodes() {
    return namespaceNodes.get();
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
        return Collections.singletonList(AtomicValue.parse(getStringValue(), type, namespaces));
      }
    }
    return super.getTypedValue();
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ELEMENT;
  }

  @Override
  public boolean matchName(final String nameTest, final @Nullable String defaultNamespace) {
    return matchName(name, nameTest, defaultNamespace);
  }

  @Override
  protected String getPathStep() {
    return prefixed(name);
  }
}
