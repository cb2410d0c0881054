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

package io.treepath.xpath.comparators;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The six comparison operators, with the symbols of their value and general comparison forms.
 */
public enum ComparisonOperator {

  /** Equality. */
  EQ("eq", "=") {
    @Override
    public boolean test(final int comparison) {
      return comparison == 0;
    }
  },

  /** Inequality. */
  NE("ne", "!=") {
    @Override
    public boolean test(final int comparison) {
      return comparison != 0;
    }
  },

  /** Less than. */
  LT("lt", "<") {
    @Override
    public boolean test(final int comparison) {
      return comparison < 0;
    }
  },

  /** Less than or equal. */
  LE("le", "<=") {
    @Override
    public boolean test(final int comparison) {
      return comparison <= 0;
    }
  },

  /** Greater than. */
  GT("gt", ">") {
    @Override
    public boolean test(final int comparison) {
      return comparison > 0;
    }
  },

  /** Greater than or equal. */
  GE("ge", ">=") {
    @Override
    public boolean test(final int comparison) {
      return comparison >= 0;
    }
  };

  private final String valueSymbol;

  private final String generalSymbol;

  ComparisonOperator(final String valueSymbol, final String generalSymbol) {
    this.valueSymbol = valueSymbol;
    this.generalSymbol = generalSymbol;
  }

  /**
   * Applies the operator to the result of a three-way comparison.
   *
   * @param comparison negative, zero or positive
   * @return the outcome of the comparison
   */
  public abstract boolean test(int comparison);

  /**
   * Determines if the operator only tests for (in)equality.
   *
   * @return {@code true} for {@link #EQ} and {@link #NE}
   */
  public boolean isEquality() {
    return this == EQ || this == NE;
  }

  public String getValueSymbol() {
    return valueSymbol;
  }

  public String getGeneralSymbol() {
    return generalSymbol;
  }

  /**
   * Looks up an operator by either of its symbols.
   *
   * @param symbol the symbol
   * @return the operator or {@code null} if there is none
   */
  public static @Nullable ComparisonOperator fromSymbol(final String symbol) {
    for (final ComparisonOperator operator : values()) {
      if (operator.valueSymbol.equals(symbol) || operator.generalSymbol.equals(symbol)) {
        return operator;
      }
    }
    return null;
  }
}
