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

import java.time.ZoneOffset;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;

/**
 * Base class of the comparison operators. Comparisons are not associative since XPath 2.0, so
 * {@code a = b = c} is a syntax error there.
 */
public abstract class AbstractComparison extends XPathToken {

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  protected AbstractComparison(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  @Override
  public XPathToken led(final XPathToken left) {
    if (left instanceof AbstractComparison && !"1.0".equals(parser.getVersion())) {
      throw wrongSyntax();
    }
    children.add(left);
    children.add(parser.expression(getRbp()));
    return this;
  }

  /**
   * Get the operator of the token.
   *
   * @return the operator
   */
  protected ComparisonOperator getOperator() {
    final ComparisonOperator operator = ComparisonOperator.fromSymbol(getSymbol());
    if (operator == null) {
      throw new IllegalStateException("not a comparison operator: " + getSymbol());
    }
    return operator;
  }

  /**
   * Get the timezone of dates and times without an explicit one.
   *
   * @param context the dynamic context
   * @return the implicit timezone of the context, UTC without a context
   */
  protected static ZoneOffset getTimezone(final @Nullable XPathContext context) {
    return context == null ? ZoneOffset.UTC : context.getTimezone();
  }
}
