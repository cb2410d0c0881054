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

import io.treepath.xpath.comparators.NodeComparison;
import io.treepath.xpath.comparators.ValueComparison;
import io.treepath.xpath.expr.CastExpr;
import io.treepath.xpath.expr.ForExpr;
import io.treepath.xpath.expr.IfExpr;
import io.treepath.xpath.expr.InstanceOfExpr;
import io.treepath.xpath.expr.ItemType;
import io.treepath.xpath.expr.QuantifiedExpr;
import io.treepath.xpath.expr.RangeExpr;
import io.treepath.xpath.expr.SequenceExpr;
import io.treepath.xpath.expr.SetOperator;
import io.treepath.xpath.expr.TreatExpr;
import io.treepath.xpath.filter.DocumentTest;
import io.treepath.xpath.filter.ElementTest;
import io.treepath.xpath.filter.SchemaElementTest;
import io.treepath.xpath.functions.ConstructorFunction;
import io.treepath.xpath.functions.FuncDef;
import io.treepath.xpath.functions.FunctionToken;
import io.treepath.xpath.operators.IDivOperator;
import io.treepath.xpath.types.Type;

/**
 * <h1>XPath2Grammar</h1>
 * <p>
 * Symbol table of XPath 2.0, extending a copy of the {@link XPath1Grammar} table. Additional
 * binding powers: {@code ,} 5, value and node comparisons 30, {@code to} 35, {@code idiv} 45,
 * {@code union} 50, {@code intersect} and {@code except} 55, {@code instance of} 60,
 * {@code treat as} 61, {@code castable as} 62, {@code cast as} 63.
 * </p>
 */
public final class XPath2Grammar {

  /** The grammar. */
  public static final SymbolTable TABLE = createTable();

  private XPath2Grammar() {
    throw new AssertionError("May never be instantiated!");
  }

  private static SymbolTable createTable() {
    final SymbolTable.Builder builder = XPath1Grammar.TABLE.extend()
        .infix(",", 5, SequenceExpr::new)
        .prefix("if", 5, IfExpr::new)
        .prefix("for", 5, ForExpr::new)
        .prefix("some", 5, QuantifiedExpr::new)
        .prefix("every", 5, QuantifiedExpr::new)
        .keyword("then", "else", "return", "in", "satisfies", "as", "of")
        .punctuation("?")
        .infix("is", 30, NodeComparison::new)
        .infix("<<", 30, NodeComparison::new)
        .infix(">>", 30, NodeComparison::new)
        .infix("to", 35, RangeExpr::new)
        .infix("idiv", 45, IDivOperator::new)
        .infix("union", 50, SetOperator::new)
        .infix("intersect", 55, SetOperator::new)
        .infix("except", 55, SetOperator::new)
        .infix("instance", 60, InstanceOfExpr::new)
        .infix("treat", 61, TreatExpr::new)
        .infix("castable", 62, CastExpr::new)
        .infix("cast", 63, CastExpr::new)
        .kindTest("element", ElementTest::new)
        .kindTest("attribute", ElementTest::new)
        .kindTest("document-node", DocumentTest::new)
        .kindTest("schema-element", SchemaElementTest::new)
        .kindTest("schema-attribute", SchemaElementTest::new)
        .sequenceType("item", ItemType::new)
        .sequenceType("empty-sequence", ItemType::new);
    for (final String comparison : new String[] {"eq", "ne", "lt", "le", "gt", "ge"}) {
      builder.infix(comparison, 30, ValueComparison::new);
    }
    for (final Type type : Type.values()) {
      if (type.isAtomicType() && type != Type.NOTATION && type != Type.ANY_ATOMIC_TYPE) {
        builder.constructor("xs:" + type.getLocalName(), ConstructorFunction::new);
      }
    }
    for (final FuncDef function : FuncDef.getFunctions("2.0")) {
      builder.function(function.getName(), FunctionToken::new);
    }
    return builder.build();
  }
}
