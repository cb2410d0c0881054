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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.google.common.collect.AbstractIterator;

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node which owns an ordered list of children: a document or an element. These are the nodes
 * a tree can be rooted by.
 */
public abstract class ParentNode extends XPathNode {

  /** The children, in document order. */
  private final List<XPathNode> children = new ArrayList<>();

  /**
   * Constructor.
   *
   * @param tree the tree of the node
   * @param parent the parent node or {@code null}
   * @param position the position in document order
   */
  protected ParentNode(final NodeTree tree, final @Nullable ParentNode parent,
      final @NonNegative int position) {
    super(tree, parent, position);
  }

  /**
   * Appends a child, called by the constructors of child nodes.
   *
   * @param child the child to append
   */
  void appendChild(final XPathNode child) {
    children.add(child);
  }

  @Override
  public List<XPathNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  @Override
  public String getStringValue() {
    final StringBuilder builder = new StringBuilder();
    final Iterator<XPathNode> descendants = iterDescendants(false);
    while (descendants.hasNext()) {
      final XPathNode node = descendants.next();
      if (node instanceof TextNode) {
        builder.append(node.getStringValue());
      }
    }
    return builder.toString();
  }

  /**
   * Creates the set used to skip nodes which have already been visited while iterating
   * descendants.
   *
   * @return the set or {@code null} if the node structure is a tree
   */
  protected @Nullable Set<XPathNode> newVisitedSet() {
    return null;
  }

  @Override
  public Iterator<XPathNode> iterDescendants(final boolean withSelf) {
    final Set<XPathNode> visited = newVisitedSet();
    final Deque<Iterator<XPathNode>> stack = new ArrayDeque<>();
    stack.push(getChildren().iterator());
    if (visited != null) {
      visited.add(this);
    }

    return new AbstractIterator<>() {
      private boolean selfPending = withSelf;

      @Override
      protected XPathNode computeNext() {
        if (selfPending) {
          selfPending = false;
          return ParentNode.this;
        }
        while (!stack.isEmpty()) {
          final Iterator<XPathNode> current = stack.peek();
          if (!current.hasNext()) {
            stack.pop();
            continue;
          }
          final XPathNode node = current.next();
          if (visited != null && !visited.add(node)) {
            continue;
          }
          final List<XPathNode> nodeChildren = node.getChildren();
          if (!nodeChildren.isEmpty()) {
            stack.push(nodeChildren.iterator());
          }
          return node;
        }
        return endOfData();
      }
    };
  }
}
