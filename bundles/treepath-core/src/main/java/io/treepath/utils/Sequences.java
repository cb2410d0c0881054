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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.CloseableIterator;

/**
 * Static helpers to create and compose lazy sequences. Every composed sequence forwards
 * {@link CloseableIterator#close()} to the sequences it reads from.
 */
public final class Sequences {

  private Sequences() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Returns an empty sequence.
   *
   * @param <T> value type
   * @return empty sequence
   */
  public static <T> CloseableIterator<T> empty() {
    return of(Collections.emptyList());
  }

  /**
   * Returns a sequence with a single value.
   *
   * @param <T> value type
   * @param value the value
   * @return singleton sequence
   */
  public static <T> CloseableIterator<T> singleton(final T value) {
    return of(Collections.singletonList(checkNotNull(value)));
  }

  /**
   * Returns a sequence over the values of the given iterable.
   *
   * @param <T> value type
   * @param values the values
   * @return the sequence
   */
  public static <T> CloseableIterator<T> of(final Iterable<? extends T> values) {
    return wrap(values.iterator());
  }

  /**
   * Adapts a plain iterator. If it is already closeable it is returned unchanged.
   *
   * @param <T> value type
   * @param iterator the iterator
   * @return closeable view of the iterator
   */
  @SuppressWarnings("unchecked")
  public static <T> CloseableIterator<T> wrap(final Iterator<? extends T> iterator) {
    checkNotNull(iterator);
    if (iterator instanceof CloseableIterator) {
      return (CloseableIterator<T>) iterator;
    }
    return new AbstractCloseableIterator<>() {
      @Override
      protected T advance() {
        return iterator.hasNext() ? iterator.next() : finish();
      }
    };
  }

  /**
   * Lazily filters a sequence.
   *
   * @param <T> value type
   * @param source the sequence to filter
   * @param predicate the predicate to apply
   * @return the filtered sequence
   */
  public static <T> CloseableIterator<T> filter(final Iterator<T> source,
      final Predicate<? super T> predicate) {
    checkNotNull(predicate);
    final CloseableIterator<T> input = wrap(source);
    return new AbstractCloseableIterator<>() {
      @Override
      protected T advance() {
        while (input.hasNext()) {
          final T value = input.next();
          if (predicate.test(value)) {
            return value;
          }
        }
        return finish();
      }

      @Override
      protected void release() {
        input.close();
      }
    };
  }

  /**
   * Lazily maps every value of a sequence to a sequence and concatenates the results.
   *
   * @param <F> source value type
   * @param <T> result value type
   * @param source the source sequence
   * @param function the mapping function
   * @return the concatenated sequence
   */
  public static <F, T> CloseableIterator<T> flatMap(final Iterator<F> source,
      final Function<? super F, ? extends Iterator<? extends T>> function) {
    checkNotNull(function);
    final CloseableIterator<F> input = wrap(source);
    return new AbstractCloseableIterator<>() {
      private @Nullable CloseableIterator<? extends T> current;

      @Override
      protected T advance() {
        while (current == null || !current.hasNext()) {
          if (current != null) {
            current.close();
            current = null;
          }
          if (!input.hasNext()) {
            return finish();
          }
          current = wrap(function.apply(input.next()));
        }
        return current.next();
      }

      @Override
      protected void release() {
        if (current != null) {
          current.close();
        }
        input.close();
      }
    };
  }

  /**
   * Concatenates sequences which are created on demand.
   *
   * @param <T> value type
   * @param suppliers creates the sequences in order
   * @return the concatenated sequence
   */
  public static <T> CloseableIterator<T> concat(
      final List<? extends Supplier<? extends Iterator<? extends T>>> suppliers) {
    return flatMap(suppliers.iterator(), Supplier::get);
  }

  /**
   * Drains a sequence into a list and closes it.
   *
   * @param <T> value type
   * @param iterator the sequence
   * @return list of all values
   */
  public static <T> List<T> toList(final Iterator<? extends T> iterator) {
    final List<T> result = new ArrayList<>();
    try (CloseableIterator<? extends T> it = wrap(iterator)) {
      while (it.hasNext()) {
        result.add(it.next());
      }
    }
    return result;
  }

  /**
   * Closes the sequence if it is closeable.
   *
   * @param iterator the sequence to close
   */
  public static void close(final @Nullable Iterator<?> iterator) {
    if (iterator instanceof CloseableIterator) {
      ((CloseableIterator<?>) iterator).close();
    }
  }
}
