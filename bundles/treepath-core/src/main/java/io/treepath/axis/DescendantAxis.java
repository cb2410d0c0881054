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

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.node.DocumentNode;
import io.treepath.node.XPathNode;
import io.treepath.xpath.XPathContext;

/**
 * <h1>DescendantAxis</h1>
 *
 * <p>
 * Iterates over all descendants of a node in document order, optionally starting with the node
 * itself. Attribute and namespace nodes are not descendants.
 * </p>
 *
 * <p>
 * With a {@code null} axis tag the axis is the first half of an abbreviated {@code //} step: the
 * items are focus only, so a detached document is returned to let the following child step find
 * the root element. With an explicit tag a detached document is skipped.
 * </p>
 */
public final class DescendantAxis extends AbstractAxis {

  /** The descendants. */
  private final Iterator<XPathNode> descendants;

  /** Determines if detached documents are skipped. */
  private final boolean skipDetached;

  /**
   * Constructor.
   *
   * @param context the context
   * @param includeSelf determines if the context node is included
   * @param axis the axis tag, {@code null} for the focus of an abbreviated step
   */
  public DescendantAxis(final XPathContext context, final IncludeSelf includeSelf,
      final @Nullable Axis axis) {
    super(context, axis);
    descendants = getStartItem() instanceof XPathNode node
        ? node.iterDescendants(includeSelf == IncludeSelf.YES)
        : Collections.emptyIterator();
    skipDetached = axis != null;
  }

  @Override
  protected @Nullable Item nextItem() {
    while (descendants.hasNext()) {
      final XPathNode node = descendants.next();
      if (skipDetached && node instanceof DocumentNode document && document.isDetached()) {
        continue;
      }
      return node;
    }
    return null;
  }
}
