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

import com.google.common.base.MoreObjects;

import io.treepath.node.DocumentNode;
import io.treepath.node.ElementNode;
import io.treepath.node.ParentNode;
import io.treepath.node.XPathNode;
import io.treepath.schema.Schema;
import io.treepath.schema.SchemaElementDeclaration;
import io.treepath.xpath.EXPathError;

/**
 * <h1>TreeSource</h1>
 * <p>
 * The closed set of sources a node tree can be built from: a DOM document or element, a schema,
 * a schema element declaration, or an already built node tree. The {@link Kind} tag lets
 * consumers switch over the variants exhaustively.
 * </p>
 */
public final class TreeSource {

  /** Variants of tree sources. */
  public enum Kind {
    /** A DOM {@link org.w3c.dom.Document} or {@link org.w3c.dom.Element}. */
    DOM,

    /** A whole {@link Schema}. */
    SCHEMA,

    /** A single {@link SchemaElementDeclaration}. */
    SCHEMA_ELEMENT,

    /** A node tree built before, rooted by a document or an element. */
    NODE
  }

  /** The variant. */
  private final Kind kind;

  /** The wrapped source. */
  private final Object source;

  private TreeSource(final Kind kind, final Object source) {
    this.kind = kind;
    this.source = requireNonNull(source);
  }

  /**
   * Wraps a DOM document or element.
   *
   * @param node the DOM node
   * @return the tree source
   * @throws io.treepath.exception.XPathTypeException if the node is neither a document nor an
   *         element
   */
  public static TreeSource of(final org.w3c.dom.Node node) {
    final short nodeType = node.getNodeType();
    if (nodeType != org.w3c.dom.Node.DOCUMENT_NODE && nodeType != org.w3c.dom.Node.ELEMENT_NODE) {
      throw EXPathError.XPTY0004.newException(
          "invalid root " + node.getNodeName() + ", a document or an element is required");
    }
    return new TreeSource(Kind.DOM, node);
  }

  /**
   * Wraps a schema.
   *
   * @param schema the schema
   * @return the tree source
   */
  public static TreeSource of(final Schema schema) {
    return new TreeSource(Kind.SCHEMA, schema);
  }

  /**
   * Wraps a schema element declaration.
   *
   * @param declaration the declaration
   * @return the tree source
   */
  public static TreeSource of(final SchemaElementDeclaration declaration) {
    return new TreeSource(Kind.SCHEMA_ELEMENT, declaration);
  }

  /**
   * Wraps an already built tree.
   *
   * @param node a document or element node
   * @return the tree source
   * @throws io.treepath.exception.XPathTypeException if the node is not a document or element
   */
  public static TreeSource of(final XPathNode node) {
    if (!(node instanceof DocumentNode) && !(node instanceof ElementNode)) {
      throw EXPathError.XPTY0004.newException(
          "invalid root " + node.getPath() + ", a document or an element node is required");
    }
    return new TreeSource(Kind.NODE, node);
  }

  /**
   * Wraps an object of any of the supported source types.
   *
   * @param root the root object
   * @return the tree source
   * @throws io.treepath.exception.XPathTypeException if the object is not a supported source
   */
  public static TreeSource fromObject(final Object root) {
    if (root instanceof TreeSource treeSource) {
      return treeSource;
    } else if (root instanceof org.w3c.dom.Node node) {
      return of(node);
    } else if (root instanceof Schema schema) {
      return of(schema);
    } else if (root instanceof SchemaElementDeclaration declaration) {
      return of(declaration);
    } else if (root instanceof XPathNode node) {
      return of(node);
    }
    throw EXPathError.XPTY0004.newException("invalid root " + root
        + ", a document, an element, a schema or a schema element is required");
  }

  /**
   * Get the variant.
   *
   * @return the kind of source
   */
  public Kind getKind() {
    return kind;
  }

  /**
   * Get the DOM node of a {@link Kind#DOM} source.
   *
   * @return the DOM node
   */
  public org.w3c.dom.Node asDomNode() {
    return (org.w3c.dom.Node) source;
  }

  /**
   * Get the schema of a {@link Kind#SCHEMA} source.
   *
   * @return the schema
   */
  public Schema asSchema() {
    return (Schema) source;
  }

  /**
   * Get the declaration of a {@link Kind#SCHEMA_ELEMENT} source.
   *
   * @return the declaration
   */
  public SchemaElementDeclaration asSchemaElement() {
    return (SchemaElementDeclaration) source;
  }

  /**
   * Get the root node of a {@link Kind#NODE} source.
   *
   * @return the root node
   */
  public ParentNode asNode() {
    return (ParentNode) source;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("kind", kind).add("source", source).toString();
  }
}
