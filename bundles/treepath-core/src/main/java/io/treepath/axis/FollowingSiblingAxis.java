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

package io.treepath.axis;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.node.AttributeNode;
import io.treepath.node.NamespaceNode;
import io.treepath.node.XPathNode;
import io.treepath.xpath.XPathContext;

/**
 * <h1>FollowingSiblingAxis</h1>
 *
 * <p>
 * Iterates over all following siblings of a node. Attribute and namespace nodes have no
 * siblings.
 * </p>
 */
public final class FollowingSiblingAxis extends AbstractAxis {

  /** The following siblings. */
  private final Iterator<XPathNode> siblings;

  /**
   * Constructor.
   *
   * @param context the context
   */
  public FollowingSiblingAxis(final XPathContext context) {
    super(context, Axis.FOLLOWING_SIBLING);
    siblings = followingSiblings(context, getStartItem()).iterator();
  }

  /**
   * Get the siblings following an item.
   *
   * @param context the context
   * @param item the item
   * @return the following siblings in document order
   */
  static List<XPathNode> followingSiblings(final XPathContext context,
      final @Nullable Item item) {
    if (!(item instanceof XPathNode node) || item instanceof AttributeNode
        || item instanceof NamespaceNode) {
      return Collections.emptyList();
    }
    final XPathNode parent = context.getParentOf(node);
    if (parent == null) {
      return Collections.emptyList();
    }
    final List<XPathNode> children = parent.getChildren();
    final int index = children.indexOf(node);
    return index < 0 ? Collections.emptyList() : children.subList(index + 1, children.size());
  }

  @Override
  protected @Nullable Item nextItem() {
    return siblings.hasNext() ? siblings.next() : null;
  }
}
