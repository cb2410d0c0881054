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

package io.treepath.xpath.functions;

import java.util.Collections;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;
import io.treepath.xpath.types.AtomicValue;
import io.treepath.xpath.types.Type;

/**
 * Constructor function of a built-in atomic type, such as {@code xs:double('NaN')}. It casts its
 * single argument to the type; the empty sequence constructs the empty sequence.
 */
public final class ConstructorFunction extends XPathToken {

  /** The constructed type. */
  private final Type type;

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition, the symbol being the prefixed type name
   * @param value not used
   * @param offset offset in the expression
   */
  public ConstructorFunction(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
    final Type constructed = Type.getType(definition.getSymbol());
    if (constructed == null) {
      throw EXPathError.XPST0017.newException("unknown constructor " + definition.getSymbol());
    }
    type = constructed;
  }

  @Override
  public XPathToken nud() {
    parser.advance("(");
    if (")".equals(parser.getNextToken().getSymbol())) {
      throw EXPathError.XPST0017.newException(getSymbol() + "() needs one argument");
    }
    children.add(parser.expression(5));
    parser.advance(")");
    return this;
  }

  @Override
  public List<Item> evaluate(final @Nullable XPathContext context) {
    final AtomicValue argument = getAtomizedOperand(context, 0);
    if (argument == null) {
      return Collections.emptyList();
    }
    return Collections.singletonList(argument.castAs(type, parser.getNamespaces()));
  }
}
