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

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.schema.SchemaElementDeclaration;

/**
 * State shared by all nodes of one tree: the identity of the position space, the namespace map
 * given when the tree has been built, the URI of the source and, for schema graphs, the map of
 * already wrapped element declarations.
 */
public final class NodeTree {

  /** Generates tree identifiers, in order of creation. */
  private static final AtomicLong TREE_IDS = new AtomicLong();

  /** Unique identifier of the position space of the tree. */
  private final long treeId;

  /** Namespace map of the tree. */
  private final ImmutableMap<String, String> namespaces;

  /** Maps schema element declarations to the nodes wrapping them. */
  private final Map<SchemaElementDeclaration, SchemaElementNode> elements;

  /** URI of the source, set once. */
  private volatile @Nullable String uri;

  /**
   * Constructor.
   *
   * @param namespaces namespace map of the tree
   * @param uri URI of the source or {@code null}
   */
  public NodeTree(final Map<String, String> namespaces, final @Nullable String uri) {
    this(namespaces, uri, Maps.newIdentityHashMap());
  }

  /**
   * Constructor.
   *
   * @param namespaces namespace map of the tree
   * @param uri URI of the source or {@code null}
   * @param elements map of schema element declarations to nodes, possibly shared between trees
   */
  public NodeTree(final Map<String, String> namespaces, final @Nullable String uri,
      final Map<SchemaElementDeclaration, SchemaElementNode> elements) {
    this.treeId = TREE_IDS.incrementAndGet();
    this.namespaces = ImmutableMap.copyOf(namespaces);
    this.uri = uri;
    this.elements = requireNonNull(elements);
  }

  /**
   * Get the identifier of the position space. Trees created later get greater identifiers.
   *
   * @return tree identifier
   */
  public long getTreeId() {
    return treeId;
  }

  /**
   * Get the namespace map of the tree.
   *
   * @return prefix to URI map
   */
  public Map<String, String> getNamespaces() {
    return namespaces;
  }

  /**
   * Get the URI of the source.
   *
   * @return the URI or {@code null}
   */
  public @Nullable String getUri() {
    return uri;
  }

  /**
   * Associates a URI with the tree, unless it already has one.
   *
   * @param uri the URI
   */
  public void setUriIfAbsent(final String uri) {
    if (this.uri == null) {
      this.uri = requireNonNull(uri);
    }
  }

  /**
   * Get the map of wrapped schema element declarations.
   *
   * @return the elements map
   */
  public Map<SchemaElementDeclaration, SchemaElementNode> getElements() {
    return elements;
  }
}
