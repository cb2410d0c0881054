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

import java.util.Collections;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.exception.MissingContextException;
import io.treepath.exception.XPathException;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;
import io.treepath.xpath.types.AtomicValue;
import io.treepath.xpath.types.SequenceType;
import io.treepath.xpath.types.SequenceType.Occurrence;
import io.treepath.xpath.types.Type;

/**
 * The expressions {@code cast as} and {@code castable as}. A cast propagates the errors of the
 * conversion, {@code castable as} reports them as {@code false}.
 */
public final class CastExpr extends XPathToken {

  /** The target type. */
  private @Nullable SequenceType singleType;

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  public CastExpr(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  @Override
  public XPathToken led(final XPathToken left) {
    children.add(left);
    parser.advance("as");
    singleType = parser.parseSingleType();
    final Type type = singleType.getAtomicType();
    if (type == Type.NOTATION || type == Type.ANY_ATOMIC_TYPE) {
      throw EXPathError.XPST0080.newException(type.getStringRepr());
    }
    return this;
  }

  private boolean isCastable() {
    return "castable".equals(getSymbol());
  }

  @Override
  public List<Item> evaluate(final @Nullable XPathContext context) {
    final List<AtomicValue> values =
        atomize(children.get(0).evaluate(context == null ? null : context.copy()));
    if (!isCastable()) {
      return cast(values);
    }
    try {
      cast(values);
      return Collections.singletonList(AtomicValue.TRUE);
    } catch (final MissingContextException e) {
      throw e;
    } catch (final XPathException e) {
      return Collections.singletonList(AtomicValue.FALSE);
    }
  }

  private List<Item> cast(final List<AtomicValue> values) {
    if (values.isEmpty()) {
      if (singleType.getOccurrence() == Occurrence.ZERO_OR_ONE) {
        return Collections.emptyList();
      }
      throw EXPathError.XPTY0004.newException("cast of an empty sequence to " + singleType);
    } else if (values.size() > 1) {
      throw EXPathError.XPTY0004.newException("cast of a sequence of " + values.size()
          + " items to " + singleType);
    }
    return Collections.singletonList(
        values.get(0).castAs(singleType.getAtomicType(), parser.getNamespaces()));
  }

  @Override
  public String getSource() {
    return children.get(0).getSource() + ' ' + getSymbol() + " as " + singleType;
  }
}
