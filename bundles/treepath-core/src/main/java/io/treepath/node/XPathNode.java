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
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;

import com.google.common.base.MoreObjects;
import com.google.common.collect.Iterators;

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.xpath.types.AtomicValue;

/**
 * <h1>XPathNode</h1>
 * <p>
 * A node of the XPath data model. Every node knows its tree, its parent (a back-reference, never
 * an ownership edge) and its position, which is unique in the tree and strictly increasing in
 * document order. Node identity, not value, determines equality.
 * </p>
 */
public abstract class XPathNode implements Item {

  /** Orders nodes by document order, nodes of different trees by creation order of the trees. */
  public static final Comparator<XPathNode> DOCUMENT_ORDER =
      Comparator.comparingLong((XPathNode node) -> node.getTree().getTreeId())
                .thenComparingInt(XPathNode::getPosition);

  /** The tree of the node. */
  private final NodeTree tree;

  /** The parent node, {@code null} for tree roots. */
  private final @Nullable ParentNode parent;

  /** Position in document order. */
  private final int position;

  /**
   * Constructor.
   *
   * @param tree the tree of the node
   * @param parent the parent node or {@code null}
   * @param position the position in document order
   */
  protected XPathNode(final NodeTree tree, final @Nullable ParentNode parent,
      final @NonNegative int position) {
    this.tree = requireNonNull(tree);
    this.parent = parent;
    this.position = position;
  }

  /**
   * Get the kind of node.
   *
   * @return the node kind
   */
  public abstract NodeKind getKind();

  /**
   * Get the string value of the node.
   *
   * @return the string value
   */
  public abstract String getStringValue();

  /**
   * Get the typed value of the node, used for atomization.
   *
   * @return the typed value, an {@code xs:untypedAtomic} of the string value for untyped nodes
   */
  public List<AtomicValue> getTypedValue() {
    return Collections.singletonList(AtomicValue.untyped(getStringValue()));
  }

  /**
   * Get the name of the node.
   *
   * @return the name or {@code null} for unnamed nodes
   */
  public @Nullable QName getName() {
    return null;
  }

  /**
   * Get the tree of the node.
   *
   * @return the tree
   */
  public NodeTree getTree() {
    return tree;
  }

  /**
   * Get the parent.
   *
   * @return the parent or {@code null}
   */
  public @Nullable ParentNode getParent() {
    return parent;
  }

  /**
   * Get the position in document order.
   *
   * @return the position
   */
  public int getPosition() {
    return position;
  }

  /**
   * Get the children of the node.
   *
   * @return the children, empty for leaf nodes
   */
  public List<XPathNode> getChildren() {
    return Collections.emptyList();
  }

  /**
   * Get the base URI of the node.
   *
   * @return the base URI or {@code null}
   */
  public @Nullable String getBaseUri() {
    return parent == null ? tree.getUri() : parent.getBaseUri();
  }

  /**
   * Get the topmost ancestor of the node.
   *
   * @return the root of the tree, which is the node itself for a root
   */
  public XPathNode getRoot() {
    XPathNode node = this;
    while (node.getParent() != null) {
      node = node.getParent();
    }
    return node;
  }

  /**
   * Get the document node of the tree.
   *
   * @return the document node or {@code null} if the tree is rooted by an element
   */
  public @Nullable DocumentNode getDocument() {
    return getRoot() instanceof DocumentNode document ? document : null;
  }

  /**
   * Iterates the node and its descendants in document order, without attribute and namespace
   * nodes.
   *
   * @param withSelf if the node itself is included
   * @return iterator over the nodes
   */
  public Iterator<XPathNode> iterDescendants(final boolean withSelf) {
    return withSelf ? Iterators.singletonIterator(this) : Collections.emptyIterator();
  }

  /**
   * Iterates the node and its descendants in document order, including the namespace and
   * attribute nodes of elements right after their owner.
   *
   * @return iterator over the nodes
   */
  public Iterator<XPathNode> iterDocument() {
    return Iterators.concat(Iterators.<XPathNode, Iterator<XPathNode>>transform(
        iterDescendants(true), node -> node instanceof ElementNode element
            ? Iterators.<XPathNode>concat(Iterators.singletonIterator(node),
                element.getNamespaceNodes().iterator(), element.getAttributes().iterator())
            : Iterators.singletonIterator(node)));
  }

  /**
   * Tests the name of the node. Names have the forms {@code *}, {@code local},
   * {@code {uri}local}, {@code {*}local}, {@code {uri}*} and {@code *:local}.
   *
   * @param name the name to test
   * @param defaultNamespace namespace of unprefixed names, or {@code null}
   * @return true, if the node has a matching name
   */
  public boolean matchName(final String name, final @Nullable String defaultNamespace) {
    return false;
  }

  /**
   * Tests a qualified name against a name test.
   *
   * @param qname the name of a node
   * @param name the name test
   * @param defaultNamespace namespace of unprefixed name tests, or {@code null}
   * @return true, if the name matches
   */
  protected static boolean matchName(final QName qname, final String name,
      final @Nullable String defaultNamespace) {
    if ("*".equals(name)) {
      return true;
    } else if (name.startsWith("*:")) {
      return name.substring(2).equals(qname.getLocalPart());
    } else if (name.startsWith("{")) {
      final int end = name.indexOf('}');
      final String namespace = name.substring(1, end);
      final String localName = name.substring(end + 1);
      return ("*".equals(namespace) || namespace.equals(qname.getNamespaceURI()))
          && ("*".equals(localName) || localName.equals(qname.getLocalPart()));
    }
    final String namespace = defaultNamespace == null ? XMLConstants.NULL_NS_URI : defaultNamespace;
    return name.equals(qname.getLocalPart()) && namespace.equals(qname.getNamespaceURI());
  }

  /**
   * Returns a path from the root to the node, for diagnostics.
   *
   * @return the path
   */
  public String getPath() {
    final String step = getPathStep();
    if (parent == null) {
      return step.isEmpty() ? "/" : "/" + step;
    }
    final String parentPath = parent.getPath();
    return parentPath.endsWith("/") ? parentPath + step : parentPath + '/' + step;
  }

  /**
   * Get the step which selects the node from its parent.
   *
   * @return path step
   */
  protected abstract String getPathStep();

  /**
   * Formats a qualified name with its prefix.
   *
   * @param qname the name
   * @return prefixed name
   */
  protected static String prefixed(final QName qname) {
    return qname.getPrefix().isEmpty() ? qname.getLocalPart()
        : qname.getPrefix() + ':' + qname.getLocalPart();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("kind", getKind())
                      .add("position", position)
                      .add("path", getPath())
                      .toString();
  }
}
