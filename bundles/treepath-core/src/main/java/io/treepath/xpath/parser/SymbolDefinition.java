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

import com.google.common.base.MoreObjects;

/**
 * Definition of a grammar symbol: its label, its binding powers and the factory of its tokens.
 * The left binding power is used when the symbol follows an operand, the right binding power
 * when the symbol starts an expression.
 */
public final class SymbolDefinition {

  /** The symbol. */
  private final String symbol;

  /** The label. */
  private final Label label;

  /** Left binding power. */
  private final int lbp;

  /** Right binding power. */
  private final int rbp;

  /** Factory of the tokens. */
  private final TokenFactory factory;

  /**
   * Constructor.
   *
   * @param symbol the symbol
   * @param label the label
   * @param lbp the left binding power
   * @param rbp the right binding power
   * @param factory factory of the tokens
   */
  public SymbolDefinition(final String symbol, final Label label, final int lbp, final int rbp,
      final TokenFactory factory) {
    this.symbol = requireNonNull(symbol);
    this.label = requireNonNull(label);
    this.lbp = lbp;
    this.rbp = rbp;
    this.factory = requireNonNull(factory);
  }

  /**
   * Get the symbol.
   *
   * @return the symbol
   */
  public String getSymbol() {
    return symbol;
  }

  /**
   * Get the label.
   *
   * @return the label
   */
  public Label getLabel() {
    return label;
  }

  /**
   * Get the left binding power.
   *
   * @return the left binding power
   */
  public int getLbp() {
    return lbp;
  }

  /**
   * Get the right binding power.
   *
   * @return the right binding power
   */
  public int getRbp() {
    return rbp;
  }

  /**
   * Get the token factory.
   *
   * @return the factory
   */
  public TokenFactory getFactory() {
    return factory;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("symbol", symbol)
                      .add("label", label)
                      .add("lbp", lbp)
                      .add("rbp", rbp)
                      .toString();
  }
}
