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

package io.treepath.schema;

import javax.xml.namespace.QName;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.node.SchemaElementNode;
import io.treepath.node.builder.NodeTrees;
import io.treepath.node.builder.TreeSource;
import io.treepath.xpath.XPathSchemaContext;

/**
 * Binds a schema to the parser and the dynamic context. Used by the static check of a compiled
 * expression, which evaluates the expression once against the schema graph, and by the
 * {@code schema-element()} and {@code schema-attribute()} tests.
 */
public interface SchemaProxy {

  /**
   * Get the bound schema.
   *
   * @return the schema
   */
  Schema getSchema();

  /**
   * Looks up a global element declaration.
   *
   * @param name the element name
   * @return the declaration or {@code null}
   */
  @Nullable
  SchemaElementDeclaration getElement(QName name);

  /**
   * Looks up a global attribute declaration.
   *
   * @param name the attribute name
   * @return the declaration or {@code null}
   */
  @Nullable
  SchemaAttributeDeclaration getAttribute(QName name);

  /**
   * Creates a dynamic context over the node graph of the schema, for schema-aware static
   * checks.
   *
   * @return the schema context
   */
  default XPathSchemaContext getContext() {
    final SchemaElementNode root =
        (SchemaElementNode) NodeTrees.build(TreeSource.of(getSchema()), null, null, null);
    return new XPathSchemaContext(root, this);
  }
}
