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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.xml.namespace.QName;

import com.google.common.collect.Sets;

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.schema.SchemaElementDeclaration;
import io.treepath.xpath.types.AtomicValue;

/**
 * <h1>SchemaElementNode</h1>
 * <p>
 * Wraps a schema element declaration, or the schema itself for the root of a schema graph.
 * Schema nodes build a graph rather than a tree: a node may share the children of an identical
 * declaration wrapped before, and a reference to a global declaration is linked to the node of
 * that declaration once the traversal is complete. Both are set while the graph is built and
 * never change afterwards.
 * </p>
 */
public final class SchemaElementNode extends ElementNode {

  /** The wrapped declaration, {@code null} for the schema root. */
  private final @Nullable SchemaElementDeclaration declaration;

  /** Node whose children are shared. */
  private @Nullable SchemaElementNode childrenSource;

  /** Node of the referenced global declaration. */
  private @Nullable SchemaElementNode ref;

  /**
   * Constructor.
   *
   * @param tree the tree of the node
   * @param parent the parent node or {@code null}
   * @param position the position in document order
   * @param declaration the wrapped declaration or {@code null} for the schema root
   * @param name the element name
   * @param namespaces the in-scope namespaces
   * @param attributes the declared attributes
   */
  public SchemaElementNode(final NodeTree tree, final @Nullable SchemaElementNode parent,
      final @NonNegative int position, final @Nullable SchemaElementDeclaration declaration,
      final QName name, final Map<String, String> namespaces,
      final List<AttributeData> attributes) {
    super(tree, parent, position, name, namespaces, attributes,
        declaration == null ? null : declaration.getTypeName());
    this.declaration = declaration;
    if (declaration != null) {
      tree.getElements().putIfAbsent(declaration, this);
    }
  }

  /**
   * Get the wrapped declaration.
   *
   * @return the declaration or {@code null} for the schema root
   */
  public @Nullable SchemaElementDeclaration getDeclaration() {
    return declaration;
  }

  /**
   * Get the node of the referenced global declaration.
   *
   * @return the linked node or {@code null}
   */
  public @Nullable SchemaElementNode getRef() {
    return ref;
  }

  /**
   * Shares the children of the node of an identical declaration.
   *
   * @param source node whose children are shared
   */
  public void shareChildren(final SchemaElementNode source) {
    checkState(childrenSource == null && super.getChildren().isEmpty(),
        "Children of %s are already set.", getPath());
    childrenSource = requireNonNull(source);
  }

  /**
   * Links a reference to the node of the referenced global declaration.
   *
   * @param target node of the referenced declaration
   */
  public void linkReference(final SchemaElementNode target) {
    checkState(ref == null, "Reference of %s is already linked.", getPath());
    ref = requireNonNull(target);
  }

  @Override
  public List<XPathNode> getChildren() {
    if (ref != null) {
      return ref.getChildren();
    } else if (childrenSource != null) {
      return childrenSource.getChildren();
    }
    return super.getChildren();
  }

  @Override
  protected Set<XPathNode> newVisitedSet() {
    return Sets.newIdentityHashSet();
  }

  @Override
  public List<AtomicValue> getTypedValue() {
    // schema nodes carry no instance data, a sample value is enough for static checks
    return Collections.singletonList(AtomicValue.untyped("1"));
  }
}
