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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.node.AttributeNode;
import io.treepath.node.NamespaceNode;
import io.treepath.node.XPathNode;
import io.treepath.xpath.XPathContext;

/**
 * <h1>PrecedingAxis</h1>
 *
 * <p>
 * Iterates over all nodes preceding a node, nearest first. Ancestors, attributes and namespace
 * nodes are not preceding nodes.
 * </p>
 */
public final class PrecedingAxis extends AbstractAxis {

  /** Preceding siblings of the current level, nearest first. */
  private Iterator<XPathNode> siblings = Collections.emptyIterator();

  /** Nodes of the subtree currently iterated, in reverse document order. */
  private Iterator<XPathNode> subtree = Collections.emptyIterator();

  /** Node whose preceding siblings are iterated next. */
  private @Nullable XPathNode level;

  /**
   * Constructor.
   *
   * @param context the context
   */
  public PrecedingAxis(final XPathContext context) {
    super(context, Axis.PRECEDING);
    final Item item = getStartItem();
    if (item instanceof AttributeNode || item instanceof NamespaceNode) {
      level = ((XPathNode) item).getParent();
    } else if (item instanceof XPathNode node) {
      level = node;
    }
  }

  @Override
  protected @Nullable Item nextItem() {
    while (!subtree.hasNext()) {
      while (!siblings.hasNext()) {
        if (level == null) {
          return null;
        }
        final List<XPathNode> preceding =
            PrecedingSiblingAxis.precedingSiblings(getContext(), level);
        siblings = Lists.reverse(preceding).iterator();
        level = getContext().getParentOf(level);
      }
      final XPathNode sibling = siblings.next();
      subtree = Lists.reverse(ImmutableList.copyOf(sibling.iterDescendants(true))).iterator();
    }
    return subtree.next();
  }
}
