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

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.node.DocumentNode;
import io.treepath.node.XPathNode;
import io.treepath.xpath.XPathContext;

/**
 * <h1>AncestorAxis</h1>
 *
 * <p>
 * Iterates over all ancestors of a node, nearest first, optionally starting with the node
 * itself. The iteration stops at the root of the context.
 * </p>
 */
public final class AncestorAxis extends AbstractAxis {

  /** The next candidate. */
  private @Nullable XPathNode current;

  /**
   * Constructor.
   *
   * @param context the context
   * @param includeSelf determines if the context node is included
   */
  public AncestorAxis(final XPathContext context, final IncludeSelf includeSelf) {
    super(context, includeSelf == IncludeSelf.YES ? Axis.ANCESTOR_OR_SELF : Axis.ANCESTOR);
    if (getStartItem() instanceof XPathNode node) {
      current = includeSelf == IncludeSelf.YES ? node : context.getParentOf(node);
    }
  }

  @Override
  protected @Nullable Item nextItem() {
    final XPathNode node = current;
    if (node == null || node instanceof DocumentNode document && document.isDetached()) {
      return null;
    }
    current = getContext().getParentOf(node);
    return node;
  }
}
