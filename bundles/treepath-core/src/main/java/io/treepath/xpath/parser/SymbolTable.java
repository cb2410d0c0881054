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

package io.treepath.xpath.parser;

import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.xpath.EXPathError;

/**
 * <h1>SymbolTable</h1>
 * <p>
 * Immutable table of the symbols of a grammar version. A later grammar version is built by
 * {@link #extend() extending} a copy of an earlier table, the earlier table never changes.
 * </p>
 */
public final class SymbolTable {

  /** Symbol definitions by symbol. */
  private final ImmutableMap<String, SymbolDefinition> symbols;

  private SymbolTable(final Map<String, SymbolDefinition> symbols) {
    this.symbols = ImmutableMap.copyOf(symbols);
  }

  /**
   * Get the definition of a symbol.
   *
   * @param symbol the symbol
   * @return the definition or {@code null} if the symbol is not part of the grammar
   */
  public @Nullable SymbolDefinition get(final String symbol) {
    return symbols.get(symbol);
  }

  /**
   * Get the definition of a symbol which must be part of the grammar.
   *
   * @param symbol the symbol
   * @return the definition
   * @throws io.treepath.exception.XPathKeyException if the symbol is unknown
   */
  public SymbolDefinition getRequired(final String symbol) {
    final SymbolDefinition definition = symbols.get(symbol);
    if (definition == null) {
      throw EXPathError.XPST0010.newException("unknown symbol " + symbol);
    }
    return definition;
  }

  /**
   * Determines if a symbol is part of the grammar.
   *
   * @param symbol the symbol
   * @return true, if the symbol is defined
   */
  public boolean contains(final String symbol) {
    return symbols.containsKey(symbol);
  }

  /**
   * Get all symbols.
   *
   * @return the symbols
   */
  public Set<String> getSymbols() {
    return symbols.keySet();
  }

  /**
   * Creates a builder initialized with a copy of this table.
   *
   * @return the builder
   */
  public Builder extend() {
    return new Builder(symbols);
  }

  /**
   * Creates a builder of an empty table.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder(ImmutableMap.of());
  }

  /**
   * Builder of symbol tables.
   */
  public static final class Builder {

    /** Symbol definitions by symbol. */
    private final Map<String, SymbolDefinition> symbols;

    private Builder(final Map<String, SymbolDefinition> symbols) {
      this.symbols = new LinkedHashMap<>(symbols);
    }

    /**
     * Registers or redefines a symbol.
     *
     * @param symbol the symbol
     * @param label the label
     * @param lbp left binding power
     * @param rbp right binding power
     * @param factory factory of the tokens
     * @return this builder
     */
    public Builder register(final String symbol, final Label label, final int lbp,
        final int rbp, final TokenFactory factory) {
      symbols.put(symbol, new SymbolDefinition(symbol, label, lbp, rbp, factory));
      return this;
    }

    /**
     * Registers a literal.
     *
     * @param symbol the literal symbol, for instance {@code (string)}
     * @param factory factory of the tokens
     * @return this builder
     */
    public Builder literal(final String symbol, final TokenFactory factory) {
      return register(symbol, Label.LITERAL, 0, 0, factory);
    }

    /**
     * Registers punctuation which ends expressions.
     *
     * @param symbols the symbols
     * @return this builder
     */
    public Builder punctuation(final String... symbols) {
      for (final String symbol : symbols) {
        register(symbol, Label.SYMBOL, 0, 0, Punctuation::new);
      }
      return this;
    }

    /**
     * Registers a left associative infix operator.
     *
     * @param symbol the symbol
     * @param bp the binding power
     * @param factory factory of the tokens
     * @return this builder
     */
    public Builder infix(final String symbol, final int bp, final TokenFactory factory) {
      return register(symbol, labelOf(symbol), bp, bp, factory);
    }

    /**
     * Registers an operator which is both infix and prefix.
     *
     * @param symbol the symbol
     * @param lbp the binding power as infix operator
     * @param rbp the binding power as prefix operator
     * @param factory factory of the tokens
     * @return this builder
     */
    public Builder infixAndPrefix(final String symbol, final int lbp, final int rbp,
        final TokenFactory factory) {
      return register(symbol, labelOf(symbol), lbp, rbp, factory);
    }

    /**
     * Registers a prefix symbol.
     *
     * @param symbol the symbol
     * @param bp the binding power of the operand
     * @param factory factory of the tokens
     * @return this builder
     */
    public Builder prefix(final String symbol, final int bp, final TokenFactory factory) {
      return register(symbol, labelOf(symbol), 0, bp, factory);
    }

    /**
     * Registers a keyword which structures expressions, such as {@code then}.
     *
     * @param symbols the keywords
     * @return this builder
     */
    public Builder keyword(final String... symbols) {
      for (final String symbol : symbols) {
        register(symbol, Label.KEYWORD, 0, 0, Punctuation::new);
      }
      return this;
    }

    /**
     * Registers an axis.
     *
     * @param symbol the axis name with the {@code ::} suffix, or {@code @}
     * @param factory factory of the tokens
     * @return this builder
     */
    public Builder axis(final String symbol, final TokenFactory factory) {
      return register(symbol, Label.AXIS, 0, 80, factory);
    }

    /**
     * Registers a function.
     *
     * @param symbol the function name
     * @param factory factory of the tokens
     * @return this builder
     */
    public Builder function(final String symbol, final TokenFactory factory) {
      return register(symbol, Label.FUNCTION, 0, 90, factory);
    }

    /**
     * Registers a constructor function.
     *
     * @param symbol the prefixed type name
     * @param factory factory of the tokens
     * @return this builder
     */
    public Builder constructor(final String symbol, final TokenFactory factory) {
      return register(symbol, Label.CONSTRUCTOR, 0, 90, factory);
    }

    /**
     * Registers a kind test.
     *
     * @param symbol the name of the kind test
     * @param factory factory of the tokens
     * @return this builder
     */
    public Builder kindTest(final String symbol, final TokenFactory factory) {
      return register(symbol, Label.KIND_TEST, 0, 90, factory);
    }

    /**
     * Registers an item type only valid in sequence types.
     *
     * @param symbol the name of the item type
     * @param factory factory of the tokens
     * @return this builder
     */
    public Builder sequenceType(final String symbol, final TokenFactory factory) {
      return register(symbol, Label.SEQUENCE_TYPE, 0, 90, factory);
    }

    /**
     * Removes a symbol.
     *
     * @param symbol the symbol
     * @return this builder
     */
    public Builder unregister(final String symbol) {
      symbols.remove(requireNonNull(symbol));
      return this;
    }

    /**
     * Builds the table.
     *
     * @return the immutable table
     */
    public SymbolTable build() {
      return new SymbolTable(symbols);
    }

    private static Label labelOf(final String symbol) {
      return Character.isLetter(symbol.charAt(0)) ? Label.KEYWORD : Label.OPERATOR;
    }
  }
}
