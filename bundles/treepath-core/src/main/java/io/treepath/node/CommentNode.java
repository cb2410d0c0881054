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

import java.util.Collections;
import java.util.List;

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.xpath.types.AtomicValue;

/**
 * A comment node.
 */
public final class CommentNode extends XPathNode {

  /** Content of the comment. */
  private final String value;

  /**
   * Constructor.
   *
   * @param tree the tree of the node
   * @param parent the parent node or {@code null} for a comment outside of any document
   * @param position the position in document order
   * @param value content of the comment
   */
  public CommentNode(final NodeTree tree, final @Nullable ParentNode parent,
      final @NonNegative int position, final String value) {
    super(tree, parent, position);
    this.value = requireNonNull(value);
    if (parent != null) {
      parent.appendChild(this);
    }
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.COMMENT;
  }

  @Override
  public String getStringValue() {
    return value;
  }

  @Override
  public List<AtomicValue> getTypedValue() {
    return Collections.singletonList(AtomicValue.of(value));
  }

  @Override
  protected String getPathStep() {
    return "comment()";
  }
}
