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

package io.treepath.xpath;

import java.util.List;
import java.util.Map;

import io.treepath.api.CloseableIterator;
import io.treepath.api.Item;
import io.treepath.xpath.parser.ParserConfiguration;

/**
 * Static entry points to select with an XPath 2.0 expression in a single call.
 */
public final class XPath {

  private XPath() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Selects from a root.
   *
   * @param root a DOM document or element, a node tree or a schema
   * @param path the expression
   * @return the result sequence
   */
  public static List<Item> select(final Object root, final String path) {
    return new XPathSelector(path).select(root);
  }

  /**
   * Selects from a root.
   *
   * @param root a DOM document or element, a node tree or a schema
   * @param path the expression
   * @param namespaces namespace prefixes of the expression
   * @return the result sequence
   */
  public static List<Item> select(final Object root, final String path,
      final Map<String, String> namespaces) {
    return selector(path, namespaces).select(root);
  }

  /**
   * Lazily selects from a root. The iterator must be closed.
   *
   * @param root a DOM document or element, a node tree or a schema
   * @param path the expression
   * @param namespaces namespace prefixes of the expression
   * @return the result sequence
   */
  public static CloseableIterator<Item> iterSelect(final Object root, final String path,
      final Map<String, String> namespaces) {
    return selector(path, namespaces).iterSelect(root);
  }

  private static XPathSelector selector(final String path, final Map<String, String> namespaces) {
    return new XPathSelector(path,
        new ParserConfiguration.Builder().namespaces(namespaces).build());
  }
}
