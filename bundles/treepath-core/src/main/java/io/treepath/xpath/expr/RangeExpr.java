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

package io.treepath.xpath.expr;

import java.math.BigInteger;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.CloseableIterator;
import io.treepath.api.Item;
import io.treepath.exception.XPathException;
import io.treepath.utils.AbstractCloseableIterator;
import io.treepath.utils.Sequences;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;
import io.treepath.xpath.types.AtomicValue;
import io.treepath.xpath.types.Type;

/**
 * The range expression {@code a to b}, a lazy sequence of consecutive integers. It is empty if
 * either operand is empty or the start is greater than the end.
 */
public final class RangeExpr extends XPathToken {

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  public RangeExpr(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  @Override
  public XPathToken led(final XPathToken left) {
    children.add(left);
    children.add(parser.expression(getRbp()));
    return this;
  }

  @Override
  public CloseableIterator<Item> select(final @Nullable XPathContext context) {
    final BigInteger start;
    final BigInteger end;
    try {
      start = integerOperand(context, 0);
      end = integerOperand(context, 1);
    } catch (final XPathException e) {
      if (context != null && context.isSchemaContext() && e.getError() != EXPathError.XPDY0002) {
        // schema nodes carry sample values only
        return Sequences.empty();
      }
      throw e;
    }
    if (start == null || end == null) {
      return Sequences.empty();
    }
    return new AbstractCloseableIterator<>() {
      private BigInteger next = start;

      @Override
      protected Item advance() {
        if (next.compareTo(end) > 0) {
          return finish();
        }
        final AtomicValue current = AtomicValue.of(next);
        next = next.add(BigInteger.ONE);
        return current;
      }
    };
  }

  private @Nullable BigInteger integerOperand(final @Nullable XPathContext context,
      final int index) {
    AtomicValue operand = getAtomizedOperand(context, index);
    if (operand == null) {
      return null;
    } else if (operand.isUntyped()) {
      operand = operand.castAs(Type.INTEGER, null);
    }
    if (!operand.getType().derivesFrom(Type.INTEGER)) {
      throw EXPathError.XPTY0004.newException("the operands of 'to' must be integers, found "
          + operand.getType().getStringRepr());
    }
    return (BigInteger) operand.getValue();
  }
}
