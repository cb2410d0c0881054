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

package io.treepath.node.builder;

import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;

import com.google.common.collect.Maps;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.node.AttributeData;
import io.treepath.node.ElementNode;
import io.treepath.node.NodeTree;
import io.treepath.node.SchemaElementNode;
import io.treepath.schema.Schema;
import io.treepath.schema.SchemaAttributeDeclaration;
import io.treepath.schema.SchemaElementDeclaration;
import io.treepath.utils.LogWrapper;

/**
 * <h1>SchemaNodeTreeBuilder</h1>
 * <p>
 * Builds the node graph of a schema or of a single element declaration. The graph is built in
 * two phases. The construction phase walks the declarations iteratively and wraps each of them;
 * a declaration met a second time shares the children of its first node instead of being walked
 * again, and a reference to a global declaration is only recorded. The linking phase then
 * connects every recorded reference to the node of its global declaration, building the
 * declarations not yet wrapped as new trees. Forward references and cyclic content models are
 * resolved without recursion.
 * </p>
 * <p>
 * Builders sharing the elements map and the list of global elements link their schema
 * fragments into one graph.
 * </p>
 */
public final class SchemaNodeTreeBuilder {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER =
      LogWrapper.forClass(SchemaNodeTreeBuilder.class);

  /** Name of the root node of a schema graph. */
  public static final QName SCHEMA_ROOT_NAME =
      new QName(XMLConstants.W3C_XML_SCHEMA_NS_URI, "schema", "xs");

  /** Placeholder value of attribute nodes, schema nodes carry no instance data. */
  private static final String ATTRIBUTE_VALUE = "1";

  /** URI of the schema source. */
  private final @Nullable String uri;

  /** Maps declarations to the first node wrapping them, shared by all built trees. */
  private final Map<SchemaElementDeclaration, SchemaElementNode> elements;

  /** Nodes of global declarations, the targets of references. */
  private final List<SchemaElementNode> globalElements;

  /** Index of the global element nodes by declaration. */
  private final Map<SchemaElementDeclaration, SchemaElementNode> globalIndex =
      Maps.newIdentityHashMap();

  /**
   * Constructor.
   *
   * @param uri URI of the schema source or {@code null}
   */
  public SchemaNodeTreeBuilder(final @Nullable String uri) {
    this(uri, Maps.newIdentityHashMap(), new ArrayList<>());
  }

  /**
   * Constructor.
   *
   * @param uri URI of the schema source or {@code null}
   * @param elements map of declarations to nodes, shared between builders
   * @param globalElements nodes of global declarations, shared between builders
   */
  public SchemaNodeTreeBuilder(final @Nullable String uri,
      final Map<SchemaElementDeclaration, SchemaElementNode> elements,
      final List<SchemaElementNode> globalElements) {
    this.uri = uri;
    this.elements = requireNonNull(elements);
    this.globalElements = requireNonNull(globalElements);
    for (final SchemaElementNode node : globalElements) {
      globalIndex.putIfAbsent(requireNonNull(node.getDeclaration()), node);
    }
  }

  /**
   * Builds the graph of a schema, rooted by a node named {@code xs:schema} whose children are
   * the global element declarations.
   *
   * @param schema the schema
   * @return the root node
   */
  public SchemaElementNode build(final Schema schema) {
    final String schemaUri = uri != null ? uri : schema.getUri();
    final Deque<SchemaElementNode> references = new ArrayDeque<>();
    final SchemaElementNode root = construct(null, schema.getGlobalElements(),
        schema.getNamespaces(), schemaUri, true, references);
    link(references, schemaUri);
    return root;
  }

  /**
   * Builds the graph of an element declaration.
   *
   * @param declaration the declaration
   * @return the root node
   */
  public SchemaElementNode build(final SchemaElementDeclaration declaration) {
    final Deque<SchemaElementNode> references = new ArrayDeque<>();
    final SchemaElementNode root = construct(declaration, declaration.getChildren(),
        Collections.emptyMap(), uri, false, references);
    if (declaration.getRef() != null) {
      references.addFirst(root);
    }
    link(references, uri);
    return root;
  }

  /**
   * Get the nodes of the global declarations.
   *
   * @return the global element nodes
   */
  public List<SchemaElementNode> getGlobalElements() {
    return Collections.unmodifiableList(globalElements);
  }

  private SchemaElementNode construct(final @Nullable SchemaElementDeclaration rootDeclaration,
      final List<SchemaElementDeclaration> rootChildren, final Map<String, String> namespaces,
      final @Nullable String treeUri, final boolean schemaRoot,
      final Deque<SchemaElementNode> references) {
    final NodeTree tree = new NodeTree(namespaces, treeUri, elements);
    final Map<SchemaElementDeclaration, SchemaElementNode> localNodes = Maps.newIdentityHashMap();
    int position = 1;

    final List<AttributeData> rootAttributes = attributesOf(rootDeclaration);
    final SchemaElementNode root = new SchemaElementNode(tree, null, position, rootDeclaration,
        rootDeclaration == null ? SCHEMA_ROOT_NAME : rootDeclaration.getName(), namespaces,
        rootAttributes);
    position += ElementNode.getReservedPositions(namespaces, rootAttributes.size());
    if (rootDeclaration != null) {
      localNodes.put(rootDeclaration, root);
      if (rootDeclaration.getRef() != null) {
        return root;
      }
    }

    final Deque<Map.Entry<SchemaElementNode, Iterator<SchemaElementDeclaration>>> stack =
        new ArrayDeque<>();
    stack.push(Map.entry(root, rootChildren.iterator()));
    while (!stack.isEmpty()) {
      final Map.Entry<SchemaElementNode, Iterator<SchemaElementDeclaration>> frame = stack.peek();
      if (!frame.getValue().hasNext()) {
        stack.pop();
        continue;
      }
      final SchemaElementDeclaration declaration = frame.getValue().next();
      SchemaElementNode known = localNodes.get(declaration);
      if (known == null) {
        known = elements.get(declaration);
      }

      final List<AttributeData> attributes = attributesOf(declaration);
      final SchemaElementNode node = new SchemaElementNode(tree, frame.getKey(), position,
          declaration, declaration.getName(), namespaces, attributes);
      position += ElementNode.getReservedPositions(namespaces, attributes.size());
      if (schemaRoot && frame.getKey() == root) {
        addGlobal(declaration, node);
      }

      if (declaration.getRef() != null) {
        references.add(node);
      } else if (known != null) {
        node.shareChildren(known);
      } else {
        localNodes.put(declaration, node);
        stack.push(Map.entry(node, declaration.getChildren().iterator()));
      }
    }

    LOGWRAPPER.debug("Built schema node tree {}, last position {}.", tree.getTreeId(),
        position - 1);
    return root;
  }

  private void link(final Deque<SchemaElementNode> references, final @Nullable String treeUri) {
    while (!references.isEmpty()) {
      final SchemaElementNode node = references.poll();
      final SchemaElementDeclaration target =
          requireNonNull(requireNonNull(node.getDeclaration()).getRef());
      SchemaElementNode global = globalIndex.get(target);
      if (global == null) {
        global = construct(target, target.getChildren(), Collections.emptyMap(), treeUri, false,
            references);
        addGlobal(target, global);
        if (target.getRef() != null) {
          references.add(global);
        }
      }
      node.linkReference(global);
    }
  }

  private void addGlobal(final SchemaElementDeclaration declaration,
      final SchemaElementNode node) {
    if (globalIndex.putIfAbsent(declaration, node) == null) {
      globalElements.add(node);
    }
  }

  private static List<AttributeData> attributesOf(
      final @Nullable SchemaElementDeclaration declaration) {
    if (declaration == null) {
      return Collections.emptyList();
    }
    final List<AttributeData> attributes = new ArrayList<>();
    for (final SchemaAttributeDeclaration attribute : declaration.getAttributes()) {
      attributes.add(new AttributeData(attribute.getName(), ATTRIBUTE_VALUE, null));
    }
    return attributes;
  }
}
