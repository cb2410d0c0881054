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

package io.treepath.utils;

import com.google.common.collect.AbstractIterator;
import io.treepath.api.CloseableIterator;

/**
 * Guava {@link AbstractIterator} which additionally releases its sources when closed or
 * exhausted. Subclasses implement {@link #advance()} and override {@link #release()} if they
 * hold closeable sources. A closed iterator has no further values.
 *
 * @param <T> type of the iterated values
 */
public abstract class AbstractCloseableIterator<T> extends AbstractIterator<T>
    implements CloseableIterator<T> {

  /** Determines if the sources have been released. */
  private boolean released;

  @Override
  protected final T computeNext() {
    return released ? endOfData() : advance();
  }

  /**
   * Computes the next value, or calls {@link #finish()} at the end of the sequence.
   *
   * @return the next value
   */
  protected abstract T advance();

  /**
   * Releases the sources and signals the end of the sequence.
   *
   * @return always {@code null}
   */
  protected final T finish() {
    close();
    return endOfData();
  }

  @Override
  public final void close() {
    if (!released) {
      released = true;
      release();
    }
  }

  /**
   * Hook to release the sources of this iterator, called at most once.
   */
  protected void release() {
  }
}
