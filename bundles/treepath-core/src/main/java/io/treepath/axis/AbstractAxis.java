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

import static java.util.Objects.requireNonNull;

import java.util.NoSuchElementException;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.CloseableIterator;
import io.treepath.api.Item;
import io.treepath.xpath.Focus;
import io.treepath.xpath.XPathContext;

/**
 * <p>
 * Lazy axis over the items reachable from the focus of a context. While the axis is iterated
 * the context item is the item returned last and the active axis is the axis of this iterator.
 * The focus the axis started with is restored when the axis is exhausted or closed, whichever
 * happens first.
 * </p>
 *
 * <p>
 * Override the "template method" {@code nextItem()} to implement an axis.
 * </p>
 */
public abstract class AbstractAxis implements CloseableIterator<Item> {

  /** The context whose focus is moved. */
  private final XPathContext context;

  /** The focus the axis started with. */
  private final Focus startFocus;

  /** The axis tag set while iterating, {@code null} for the default axis. */
  private final @Nullable Axis axis;

  /** Item computed by {@code hasNext()} and not yet returned. */
  private @Nullable Item nextItem;

  /** Determines if the axis tag has been set. */
  private boolean started;

  /** Determines if the axis is exhausted or closed. */
  private boolean done;

  /**
   * Bind axis to a context.
   *
   * @param context the context to operate on
   * @param axis the axis tag to set while iterating, {@code null} for the default axis
   */
  protected AbstractAxis(final XPathContext context, final @Nullable Axis axis) {
    this.context = requireNonNull(context);
    this.startFocus = context.getFocus();
    this.axis = axis;
  }

  /**
   * Get the context the axis operates on.
   *
   * @return the context
   */
  protected final XPathContext getContext() {
    return context;
  }

  /**
   * Get the context item the axis started with.
   *
   * @return the start item or {@code null}
   */
  protected final @Nullable Item getStartItem() {
    return startFocus.item();
  }

  /**
   * Get the focus the axis started with.
   *
   * @return the start focus
   */
  protected final Focus getStartFocus() {
    return startFocus;
  }

  /**
   * {@inheritDoc}
   *
   * <p>
   * When {@code hasNext()} returns false the focus the axis started with is restored.
   * </p>
   */
  @Override
  public final boolean hasNext() {
    if (done) {
      return false;
    }
    if (nextItem != null) {
      return true;
    }
    if (!started) {
      started = true;
      context.setAxis(axis);
    }
    // Template method.
    nextItem = nextItem();
    if (nextItem == null) {
      close();
      return false;
    }
    return true;
  }

  /**
   * Determines the next item of the axis. Do not override {@code hasNext()}, override this
   * template method instead.
   *
   * @return the next item or {@code null} if the axis is exhausted
   */
  protected abstract @Nullable Item nextItem();

  @Override
  public final Item next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more items in the axis!");
    }
    final Item item = nextItem;
    nextItem = null;
    moveTo(item);
    return item;
  }

  /**
   * Moves the focus of the context to a returned item.
   *
   * @param item the item returned by {@code next()}
   */
  protected void moveTo(final Item item) {
    context.setItem(item);
  }

  @Override
  public final void close() {
    if (!done) {
      done = true;
      nextItem = null;
      context.restoreFocus(startFocus);
    }
  }
}
