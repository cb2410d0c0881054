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

import java.util.Collections;
import java.util.Map;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.node.DocumentNode;
import io.treepath.node.ElementNode;
import io.treepath.node.ParentNode;
import io.treepath.xpath.EXPathError;

/**
 * Entry point to build node trees from any {@link TreeSource}.
 */
public final class NodeTrees {

  private NodeTrees() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Builds the node tree of a source.
   *
   * @param source the source
   * @param namespaces namespace map of the tree, ignored for schema sources, may be {@code null}
   * @param uri URI associated with the source, may be {@code null}
   * @param fragment {@code true} to never create a document node, {@code false} to always wrap
   *        the root in a document node, {@code null} to keep the structure of the source
   * @return the root of the built tree, a document or an element
   */
  public static ParentNode build(final TreeSource source,
      final @Nullable Map<String, String> namespaces, final @Nullable String uri,
      final @Nullable Boolean fragment) {
    final Map<String, String> namespaceMap =
        namespaces == null ? Collections.emptyMap() : namespaces;
    return switch (source.getKind()) {
      case DOM -> new DomNodeTreeBuilder(source.asDomNode(), namespaceMap, uri, fragment).build();
      case SCHEMA -> new SchemaNodeTreeBuilder(uri).build(source.asSchema());
      case SCHEMA_ELEMENT -> new SchemaNodeTreeBuilder(uri).build(source.asSchemaElement());
      case NODE -> adapt(source.asNode(), uri, fragment);
    };
  }

  /**
   * Builds the node tree of a source keeping its natural structure.
   *
   * @param source the source
   * @return the root of the built tree
   */
  public static ParentNode build(final TreeSource source) {
    return build(source, null, null, null);
  }

  private static ParentNode adapt(final ParentNode root, final @Nullable String uri,
      final @Nullable Boolean fragment) {
    if (uri != null) {
      root.getTree().setUriIfAbsent(uri);
    }
    if (Boolean.TRUE.equals(fragment) && root instanceof DocumentNode document) {
      final ElementNode documentElement = document.getDocumentElement();
      if (documentElement == null) {
        throw EXPathError.XPTY0004.newException("requested a fragment of an empty document");
      }
      return documentElement;
    } else if (Boolean.FALSE.equals(fragment) && root instanceof ElementNode element
        && element.getParent() == null) {
      return DocumentNode.detached(element);
    }
    return root;
  }
}
