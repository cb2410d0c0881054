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

import java.util.Collections;
import java.util.List;

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * <h1>DocumentNode</h1>
 * <p>
 * Root of a document tree. A detached document is a placeholder wrapping an element-rooted tree:
 * it lists the root element as its only child, but the element does not list the document as
 * its parent, so the placeholder is never reached by upward navigation and never appears in
 * results of reverse axes.
 * </p>
 */
public final class DocumentNode extends ParentNode {

  /** The wrapped root element of a detached document. */
  private final @Nullable ElementNode detachedRoot;

  /**
   * Constructor.
   *
   * @param tree the tree of the node
   * @param position the position in document order
   */
  public DocumentNode(final NodeTree tree, final @NonNegative int position) {
    super(tree, null, position);
    this.detachedRoot = null;
  }

  private DocumentNode(final ElementNode root) {
    super(root.getTree(), null, 0);
    this.detachedRoot = root;
  }

  /**
   * Creates a detached document for an element-rooted tree.
   *
   * @param root the root element of the tree
   * @return the detached document
   * @throws IllegalArgumentException if the element has a parent
   */
  public static DocumentNode detached(final ElementNode root) {
    if (root.getParent() != null) {
      throw new IllegalArgumentException("Element " + root.getPath() + " is not a tree root.");
    }
    return new DocumentNode(root);
  }

  /**
   * Determines if this is a detached placeholder document.
   *
   * @return true, if detached
   */
  public boolean isDetached() {
    return detachedRoot != null;
  }

  @Override
  public List<XPathNode> getChildren() {
    return detachedRoot == null ? super.getChildren() : Collections.singletonList(detachedRoot);
  }

  /**
   * Get the document element.
   *
   * @return the first element child or {@code null}
   */
  public @Nullable ElementNode getDocumentElement() {
    for (final XPathNode child : getChildren()) {
      if (child instanceof ElementNode element) {
        return element;
      }
    }
    return null;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.DOCUMENT;
  }

  @Override
  protected String getPathStep() {
    return "";
  }
}
