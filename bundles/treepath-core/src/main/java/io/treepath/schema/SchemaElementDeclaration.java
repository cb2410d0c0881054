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

import java.util.List;

import javax.xml.namespace.QName;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An element declaration of a schema, as seen by the node tree builder. Declarations are
 * compared by identity.
 */
public interface SchemaElementDeclaration {

  /**
   * Get the name of the declared element.
   *
   * @return the element name
   */
  QName getName();

  /**
   * Get the name of the declared type.
   *
   * @return the type name or {@code null} for an anonymous type
   */
  @Nullable
  QName getTypeName();

  /**
   * Get the attribute declarations.
   *
   * @return the attributes of the declared type
   */
  List<SchemaAttributeDeclaration> getAttributes();

  /**
   * Get the element declarations of the content model, in order.
   *
   * @return child element declarations, empty for simple content or for references
   */
  List<SchemaElementDeclaration> getChildren();

  /**
   * Get the global declaration this declaration refers to.
   *
   * @return the referenced global declaration or {@code null} if this is not a reference
   */
  @Nullable
  SchemaElementDeclaration getRef();
}
