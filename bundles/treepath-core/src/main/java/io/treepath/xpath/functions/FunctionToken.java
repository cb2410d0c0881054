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

import java.util.ArrayList;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;
import io.treepath.xpath.types.SequenceType.Occurrence;

/**
 * A call of a built-in function. The number of arguments is checked while parsing, their
 * cardinality when the call is evaluated.
 */
public final class FunctionToken extends XPathToken {

  /** Binding power of the arguments, above the sequence operator. */
  private static final int ARGUMENT_BP = 5;

  /** The called function. */
  private final FuncDef function;

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition, the symbol being the function name
   * @param value not used
   * @param offset offset in the expression
   */
  public FunctionToken(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
    function = FuncDef.fromName(definition.getSymbol());
  }

  @Override
  public XPathToken nud() {
    parser.advance("(");
    if (!")".equals(parser.getNextToken().getSymbol())) {
      children.add(parser.expression(ARGUMENT_BP));
      while (",".equals(parser.getNextToken().getSymbol())) {
        parser.advance(",");
        children.add(parser.expression(ARGUMENT_BP));
      }
    }
    parser.advance(")");
    if (children.size() < function.getMinArgs() || children.size() > function.getMaxArgs()) {
      throw EXPathError.XPST0017.newException("fn:" + function.getName() + "() called with "
          + children.size() + " argument(s)");
    }
    return this;
  }

  public FuncDef getFunction() {
    return function;
  }

  @Override
  public List<Item> evaluate(final @Nullable XPathContext context) {
    final List<List<Item>> arguments = new ArrayList<>(children.size());
    for (int i = 0; i < children.size(); i++) {
      final List<Item> argument = children.get(i).evaluate(context == null ? null : context.copy());
      final Occurrence occurrence = function.getParameter(i);
      if (!occurrence.allows(argument.size())) {
        throw EXPathError.XPTY0004.newException("argument " + (i + 1) + " of fn:"
            + function.getName() + "() must have cardinality '" + occurrence.getSymbol()
            + "', found " + argument.size() + " items");
      }
      arguments.add(argument);
    }
    return function.invoke(context, arguments);
  }
}
