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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.CloseableIterator;
import io.treepath.api.Item;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;

/**
 * <h1>BindingExpr</h1>
 * <p>
 * Base of the expressions which bind variables to the items of their binding sequences:
 * {@code for}, {@code some} and {@code every}. The operands are the binding sequences, in the
 * order of the variables, followed by the body.
 * </p>
 * <p>
 * The variable tuples are enumerated in nested loop order: a binding sequence is selected again
 * for every combination of the preceding variables, so it may refer to them.
 * </p>
 */
public abstract class BindingExpr extends XPathToken {

  /** The names of the bound variables. */
  private final List<String> varNames = new ArrayList<>();

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  protected BindingExpr(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  /**
   * Get the keyword which introduces the body.
   *
   * @return {@code return} or {@code satisfies}
   */
  protected abstract String getBodyKeyword();

  @Override
  public XPathToken nud() {
    if (!"$".equals(parser.getNextToken().getSymbol())) {
      return asName();
    }
    try {
      do {
        if (!varNames.isEmpty()) {
          parser.advance(",");
        }
        parser.advance("$");
        final String name = parser.advanceName();
        parser.advance("in");
        final XPathToken bindingSequence = parser.expression(getRbp());
        checkLoopVariable(name, bindingSequence);
        children.add(bindingSequence);
        varNames.add(name);
        parser.pushVariable(name);
      } while (",".equals(parser.getNextToken().getSymbol()));
      parser.advance(getBodyKeyword());
      children.add(parser.expression(getRbp()));
    } finally {
      varNames.forEach(name -> parser.popVariable());
    }
    return this;
  }

  private static void checkLoopVariable(final String name, final XPathToken bindingSequence) {
    final Iterator<XPathToken> tokens = bindingSequence.iterTokens();
    while (tokens.hasNext()) {
      if (tokens.next() instanceof VariableReference reference
          && name.equals(reference.getName())) {
        throw EXPathError.XPST0008.newException(
            "loop variable $" + name + " is referenced in its own binding sequence");
      }
    }
  }

  /**
   * Get the names of the bound variables.
   *
   * @return the names
   */
  public List<String> getVarNames() {
    return Collections.unmodifiableList(varNames);
  }

  /**
   * Get the body.
   *
   * @return the body expression
   */
  protected XPathToken getBody() {
    return children.get(children.size() - 1);
  }

  /**
   * Enumerates the variable tuples. The variables are bound in the given context while a tuple
   * is current.
   *
   * @param context the context to bind the variables in
   * @return the tuples
   */
  protected CloseableIterator<List<Item>> iterTuples(final XPathContext context) {
    final List<Function<XPathContext, ? extends Iterator<? extends Item>>> selectors =
        new ArrayList<>(varNames.size());
    for (final XPathToken bindingSequence : children.subList(0, varNames.size())) {
      selectors.add(bound -> bindingSequence.select(bound.copy()));
    }
    return context.iterProduct(selectors, varNames);
  }

  @Override
  public String getSource() {
    final StringBuilder builder = new StringBuilder(getSymbol()).append(' ');
    for (int i = 0; i < varNames.size(); i++) {
      if (i > 0) {
        builder.append(", ");
      }
      builder.append('$').append(varNames.get(i)).append(" in ")
             .append(children.get(i).getSource());
    }
    return builder.append(' ').append(getBodyKeyword()).append(' ')
                  .append(getBody().getSource()).toString();
  }
}
