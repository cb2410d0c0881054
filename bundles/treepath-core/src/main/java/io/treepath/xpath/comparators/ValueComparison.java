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

import java.util.Collections;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.parser.SymbolDefinition;
import io.treepath.xpath.parser.XPathParser;
import io.treepath.xpath.types.AtomicValue;

/**
 * The value comparisons {@code eq}, {@code ne}, {@code lt}, {@code le}, {@code gt} and
 * {@code ge} of two single atomic values. An empty operand gives the empty sequence and untyped
 * operands compare as strings.
 */
public final class ValueComparison extends AbstractComparison {

  /**
   * Constructor.
   *
   * @param parser the parser
   * @param definition the symbol definition
   * @param value not used
   * @param offset offset in the expression
   */
  public ValueComparison(final XPathParser parser, final SymbolDefinition definition,
      final @Nullable Object value, final int offset) {
    super(parser, definition, value, offset);
  }

  @Override
  public List<Item> evaluate(final @Nullable XPathContext context) {
    final AtomicValue first = getAtomizedOperand(context, 0);
    final AtomicValue second = getAtomizedOperand(context, 1);
    if (first == null || second == null) {
      return Collections.emptyList();
    }
    return Collections.singletonList(AtomicValue.of(Comparisons.compare(getOperator(),
        asString(first), asString(second), getTimezone(context))));
  }

  private static AtomicValue asString(final AtomicValue value) {
    return value.isUntyped() ? AtomicValue.of(value.getStringValue()) : value;
  }
}
