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

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A namespace node: a prefix bound to a namespace URI in the scope of its parent element. The
 * name of the node is the prefix, its value the URI.
 */
public final class NamespaceNode extends XPathNode {

  /** Bound prefix, empty for the default namespace. */
  private final String prefix;

  /** Namespace URI. */
  private final String uri;

  NamespaceNode(final NodeTree tree, final ElementNode parent, final @NonNegative int position,
      final String prefix, final String uri) {
    super(tree, parent, position);
    this.prefix = requireNonNull(prefix);
    this.uri = requireNonNull(uri);
  }

  /**
   * Get the prefix.
   *
   * @return the prefix, empty for the default namespace
   */
  public String getPrefix() {
    return prefix;
  }

  /**
   * Get the namespace URI.
   *
   * @return the URI
   */
  public String getUri() {
    return uri;
  }

  @Override
  public @Nullable QName getName() {
    return prefix.isEmpty() ? null : new QName(XMLConstants.NULL_NS_URI, prefix);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.NAMESPACE;
  }

  @Override
  public String getStringValue() {
    return uri;
  }

  @Override
  public boolean matchName(final String nameTest, final @Nullable String defaultNamespace) {
    return "*".equals(nameTest) || prefix.equals(nameTest);
  }

  @Override
  protected String getPathStep() {
    return "namespace::" + (prefix.isEmpty() ? "*[not(name())]" : prefix);
  }
}
