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

import io.treepath.axis.Axis;
import io.treepath.xpath.comparators.GeneralComparison;
import io.treepath.xpath.expr.AxisStep;
import io.treepath.xpath.expr.ContextItem;
import io.treepath.xpath.expr.Literal;
import io.treepath.xpath.expr.LogicalExpr;
import io.treepath.xpath.expr.ParentShortcut;
import io.treepath.xpath.expr.Parenthesized;
import io.treepath.xpath.expr.PathExpr;
import io.treepath.xpath.expr.PredicateFilter;
import io.treepath.xpath.expr.SetOperator;
import io.treepath.xpath.expr.VariableReference;
import io.treepath.xpath.filter.NameTest;
import io.treepath.xpath.filter.NodeKindTest;
import io.treepath.xpath.filter.ProcessingInstructionTest;
import io.treepath.xpath.functions.FuncDef;
import io.treepath.xpath.functions.FunctionToken;
import io.treepath.xpath.operators.AddOperator;
import io.treepath.xpath.operators.DivOperator;
import io.treepath.xpath.operators.ModOperator;
import io.treepath.xpath.operators.MulOperator;
import io.treepath.xpath.operators.SubOperator;

/**
 * <h1>XPath1Grammar</h1>
 * <p>
 * Symbol table of XPath 1.0. Binding powers, from loose to tight: {@code or} 20, {@code and}
 * 25, comparisons 30, additive operators 40, multiplicative operators 45, {@code |} 50, unary
 * minus 70, path operators 75, predicates 80.
 * </p>
 */
public final class XPath1Grammar {

  /** The grammar. */
  public static final SymbolTable TABLE = createTable();

  private XPath1Grammar() {
    throw new AssertionError("May never be instantiated!");
  }

  private static SymbolTable createTable() {
    final SymbolTable.Builder builder = SymbolTable.builder()
        .literal("(string)", Literal::new)
        .literal("(integer)", Literal::new)
        .literal("(decimal)", Literal::new)
        .literal("(double)", Literal::new)
        .register("(name)", Label.NAME, 0, 0, NameTest::new)
        .punctuation("(end)", ")", "]", ",", "::")
        .prefix("$", 90, VariableReference::new)
        .prefix("(", 0, Parenthesized::new)
        .prefix(".", 0, ContextItem::new)
        .prefix("..", 0, ParentShortcut::new)
        .infix("[", 80, PredicateFilter::new)
        .axis("@", AxisStep::new)
        .infix("or", 20, LogicalExpr::new)
        .infix("and", 25, LogicalExpr::new)
        .infixAndPrefix("+", 40, 70, AddOperator::new)
        .infixAndPrefix("-", 40, 70, SubOperator::new)
        .infix("*", 45, MulOperator::new)
        .infix("div", 45, DivOperator::new)
        .infix("mod", 45, ModOperator::new)
        .infix("|", 50, SetOperator::new)
        .infixAndPrefix("/", 75, 75, PathExpr::new)
        .infixAndPrefix("//", 75, 75, PathExpr::new)
        .kindTest("node", NodeKindTest::new)
        .kindTest("text", NodeKindTest::new)
        .kindTest("comment", NodeKindTest::new)
        .kindTest("processing-instruction", ProcessingInstructionTest::new);
    for (final String comparison : new String[] {"=", "!=", "<", "<=", ">", ">="}) {
      builder.infix(comparison, 30, GeneralComparison::new);
    }
    for (final Axis axis : Axis.values()) {
      builder.axis(axis.getName() + "::", AxisStep::new);
    }
    for (final FuncDef function : FuncDef.getFunctions("1.0")) {
      builder.function(function.getName(), FunctionToken::new);
    }
    return builder.build();
  }
}
