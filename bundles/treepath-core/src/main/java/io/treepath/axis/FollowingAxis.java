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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.Iterators;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.node.AttributeNode;
import io.treepath.node.NamespaceNode;
import io.treepath.node.XPathNode;
import io.treepath.xpath.XPathContext;

/**
 * <h1>FollowingAxis</h1>
 *
 * <p>
 * Iterates over all nodes following a node in document order. Descendants, attributes and
 * namespace nodes are not following nodes. The following nodes of an attribute or a namespace
 * node start with the descendants of its element.
 * </p>
 */
public final class FollowingAxis extends AbstractAxis {

  /** The following nodes. */
  private final Iterator<XPathNode> followings;

  /**
   * Constructor.
   *
   * @param context the context
   */
  public FollowingAxis(final XPathContext context) {
    super(context, Axis.FOLLOWING);
    final Item item = getStartItem();
    if (!(item instanceof XPathNode node)) {
      followings = Collections.emptyIterator();
      return;
    }

    final List<Iterator<XPathNode>> levels = new ArrayList<>();
    XPathNode current = node;
    if (node instanceof AttributeNode || node instanceof NamespaceNode) {
      current = node.getParent();
      levels.add(current.iterDescendants(false));
    }
    // The first following is either a right sibling, or the right sibling of an ancestor.
    while (current != null) {
      final List<XPathNode> siblings = FollowingSiblingAxis.followingSiblings(context, current);
      if (!siblings.isEmpty()) {
        levels.add(Iterators.concat(
            Iterators.transform(siblings.iterator(), sibling -> sibling.iterDescendants(true))));
      }
      current = context.getParentOf(current);
    }
    followings = Iterators.concat(levels.iterator());
  }

  @Override
  protected @Nullable Item nextItem() {
    return followings.hasNext() ? followings.next() : null;
  }
}
