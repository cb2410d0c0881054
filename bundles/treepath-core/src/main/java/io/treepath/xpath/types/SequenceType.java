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

package io.treepath.xpath.types;

import static java.util.Objects.requireNonNull;

import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.node.XPathNode;

/**
 * <h1>SequenceType</h1>
 * <p>
 * Describes the expected shape of a sequence: an item type and an occurrence indicator. The item
 * type is either {@code item()}, an atomic type or a node test; {@code empty-sequence()} matches
 * only the empty sequence.
 * </p>
 */
public final class SequenceType {

  /** The occurrence indicators. */
  public enum Occurrence {
    /** Exactly one item. */
    EXACTLY_ONE("", 1, 1),

    /** Zero or one item. */
    ZERO_OR_ONE("?", 0, 1),

    /** Any number of items. */
    ZERO_OR_MORE("*", 0, Integer.MAX_VALUE),

    /** At least one item. */
    ONE_OR_MORE("+", 1, Integer.MAX_VALUE);

    /** The indicator. */
    private final String symbol;

    /** Minimal number of items. */
    private final int min;

    /** Maximal number of items. */
    private final int max;

    Occurrence(final String symbol, final int min, final int max) {
      this.symbol = symbol;
      this.min = min;
      this.max = max;
    }

    /**
     * Get the indicator.
     *
     * @return the indicator, empty for exactly one
     */
    public String getSymbol() {
      return symbol;
    }

    /**
     * Determines if a number of items is allowed.
     *
     * @param count the number of items
     * @return true, if allowed
     */
    public boolean allows(final int count) {
      return count >= min && count <= max;
    }

    /**
     * Get the occurrence of an indicator.
     *
     * @param symbol the indicator
     * @return the occurrence or {@code null} if the symbol is not an indicator
     */
    public static @Nullable Occurrence fromSymbol(final String symbol) {
      for (final Occurrence occurrence : values()) {
        if (!occurrence.symbol.isEmpty() && occurrence.symbol.equals(symbol)) {
          return occurrence;
        }
      }
      return null;
    }
  }

  /** Matches only the empty sequence. */
  public static final SequenceType EMPTY =
      new SequenceType(null, null, Occurrence.ZERO_OR_ONE, true);

  /** Any sequence. */
  public static final SequenceType ANY = item(Occurrence.ZERO_OR_MORE);

  /** The atomic type, {@code null} if not an atomic type. */
  private final @Nullable Type atomicType;

  /** The node test, {@code null} if not a node type. */
  private final @Nullable NodeTest nodeTest;

  /** The occurrence indicator. */
  private final Occurrence occurrence;

  /** Determines if the type is {@code empty-sequence()}. */
  private final boolean empty;

  private SequenceType(final @Nullable Type atomicType, final @Nullable NodeTest nodeTest,
      final Occurrence occurrence, final boolean empty) {
    this.atomicType = atomicType;
    this.nodeTest = nodeTest;
    this.occurrence = requireNonNull(occurrence);
    this.empty = empty;
  }

  /**
   * Creates the type {@code item()} with an occurrence.
   *
   * @param occurrence the occurrence
   * @return the sequence type
   */
  public static SequenceType item(final Occurrence occurrence) {
    return new SequenceType(null, null, occurrence, false);
  }

  /**
   * Creates an atomic sequence type.
   *
   * @param type the atomic type
   * @param occurrence the occurrence
   * @return the sequence type
   */
  public static SequenceType atomic(final Type type, final Occurrence occurrence) {
    return new SequenceType(requireNonNull(type), null, occurrence, false);
  }

  /**
   * Creates a node sequence type.
   *
   * @param nodeTest the node test
   * @param occurrence the occurrence
   * @return the sequence type
   */
  public static SequenceType node(final NodeTest nodeTest, final Occurrence occurrence) {
    return new SequenceType(null, requireNonNull(nodeTest), occurrence, false);
  }

  /**
   * Get the atomic type.
   *
   * @return the atomic type or {@code null}
   */
  public @Nullable Type getAtomicType() {
    return atomicType;
  }

  /**
   * Get the occurrence.
   *
   * @return the occurrence
   */
  public Occurrence getOccurrence() {
    return occurrence;
  }

  /**
   * Determines if the type is {@code empty-sequence()}.
   *
   * @return true for the empty sequence type
   */
  public boolean isEmptySequence() {
    return empty;
  }

  /**
   * Tests a sequence against the type.
   *
   * @param items the sequence
   * @return true, if the number of items is allowed and every item matches the item type
   */
  public boolean matches(final List<? extends Item> items) {
    if (empty) {
      return items.isEmpty();
    } else if (!occurrence.allows(items.size())) {
      return false;
    }
    for (final Item item : items) {
      if (!matchesItem(item)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Tests an item against the item type.
   *
   * @param item the item
   * @return true, if the item matches
   */
  public boolean matchesItem(final Item item) {
    if (empty) {
      return false;
    } else if (atomicType != null) {
      return item instanceof AtomicValue value && value.getType().derivesFrom(atomicType);
    } else if (nodeTest != null) {
      return item instanceof XPathNode node && nodeTest.matches(node);
    }
    return true;
  }

  @Override
  public String toString() {
    if (empty) {
      return "empty-sequence()";
    }
    final String itemType;
    if (atomicType != null) {
      itemType = atomicType.getStringRepr();
    } else if (nodeTest != null) {
      itemType = nodeTest.getSource();
    } else {
      itemType = "item()";
    }
    return itemType + occurrence.getSymbol();
  }
}
