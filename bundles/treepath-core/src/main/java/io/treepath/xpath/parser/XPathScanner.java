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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import io.treepath.exception.XPathSyntaxException;

/**
 * <h1>XPathScanner</h1>
 * <p>
 * Lexical scanner for XPath expressions. It reads the expression char by char and creates a
 * lexeme for every logical text unit. Whitespace and nested comments {@code (: ... :)} separate
 * lexemes and are dropped. Qualified names and name tests with wildcards, such as {@code p:a},
 * {@code *:a} and {@code p:*}, are returned as one name lexeme.
 * </p>
 */
public final class XPathScanner {

  /** Symbols of two characters. */
  private static final Set<String> TWO_CHAR_SYMBOLS =
      ImmutableSet.of("!=", "<=", ">=", "<<", ">>", "//", "..", "::");

  /** Symbols of one character. */
  private static final String ONE_CHAR_SYMBOLS = "()[],/@|+-*=<>$.?:";

  /** Scanner states. */
  private enum State {
    /** Start state. */
    START,
    /** Number state. */
    NUMBER,
    /** Name state. */
    NAME,
    /** String literal state. */
    STRING,
    /** Comment state. */
    COMMENT,
    /** Symbol state. */
    SYMBOL
  }

  /** The expression to scan. */
  private final String expression;

  /** The current position of the cursor. */
  private int pos;

  /**
   * Constructor.
   *
   * @param expression the expression to scan
   */
  public XPathScanner(final String expression) {
    this.expression = requireNonNull(expression);
  }

  /**
   * Scans the whole expression.
   *
   * @return the lexemes, terminated by an {@link TokenType#END} lexeme
   * @throws XPathSyntaxException if the expression contains an invalid character, an unterminated
   *         string literal or an unterminated comment
   */
  public List<Lexeme> tokenize() {
    final List<Lexeme> lexemes = new ArrayList<>();
    pos = 0;
    while (true) {
      final State state = skipSeparators();
      final int start = pos;
      switch (state) {
        case START:
          lexemes.add(new Lexeme(TokenType.END, "", start));
          return ImmutableList.copyOf(lexemes);
        case NUMBER:
          lexemes.add(scanNumber(start));
          break;
        case NAME:
          lexemes.add(scanName(start));
          break;
        case STRING:
          lexemes.add(scanString(start));
          break;
        case SYMBOL:
          lexemes.add(scanSymbol(start));
          break;
        default:
          throw new IllegalStateException("Unexpected scanner state: " + state);
      }
    }
  }

  /**
   * Skips whitespace and comments and determines the state the next lexeme starts with.
   *
   * @return the state, {@link State#START} at the end of the expression
   */
  private State skipSeparators() {
    while (pos < expression.length()) {
      final char input = expression.charAt(pos);
      if (Character.isWhitespace(input)) {
        pos++;
      } else if (input == '(' && peek(1) == ':') {
        skipComment();
      } else if (isDigit(input) || input == '.' && isDigit(peek(1))) {
        return State.NUMBER;
      } else if (isNameStart(input)
          || input == '*' && peek(1) == ':' && isNameStart(peek(2))) {
        return State.NAME;
      } else if (input == '"' || input == '\'') {
        return State.STRING;
      } else if (ONE_CHAR_SYMBOLS.indexOf(input) >= 0 || input == '!') {
        return State.SYMBOL;
      } else {
        throw syntaxError("invalid character '" + input + "'", String.valueOf(input), pos);
      }
    }
    return State.START;
  }

  private void skipComment() {
    final int start = pos;
    int commentCount = 0;
    State state = State.COMMENT;
    while (state == State.COMMENT) {
      if (pos >= expression.length()) {
        throw syntaxError("unterminated comment", "(:", start);
      }
      if (expression.startsWith("(:", pos)) {
        commentCount++;
        pos += 2;
      } else if (expression.startsWith(":)", pos)) {
        commentCount--;
        pos += 2;
        if (commentCount == 0) {
          state = State.START;
        }
      } else {
        pos++;
      }
    }
  }

  private Lexeme scanNumber(final int start) {
    TokenType type = TokenType.INTEGER;
    while (isDigit(current())) {
      pos++;
    }
    if (current() == '.' && peek(1) != '.') {
      type = TokenType.DECIMAL;
      pos++;
      while (isDigit(current())) {
        pos++;
      }
    }
    if (current() == 'e' || current() == 'E') {
      final int exponentStart = pos;
      pos++;
      if (current() == '+' || current() == '-') {
        pos++;
      }
      if (!isDigit(current())) {
        throw syntaxError("invalid numeric literal", expression.substring(start, pos),
            exponentStart);
      }
      while (isDigit(current())) {
        pos++;
      }
      type = TokenType.DOUBLE;
    }
    if (isNameStart(current())) {
      throw syntaxError("invalid numeric literal", expression.substring(start, pos + 1), start);
    }
    return new Lexeme(type, expression.substring(start, pos), start);
  }

  private Lexeme scanName(final int start) {
    if (current() == '*') {
      // *:local
      pos += 2;
      scanNCName();
      return new Lexeme(TokenType.NAME, expression.substring(start, pos), start);
    }
    scanNCName();
    if (current() == ':' && peek(1) != ':') {
      if (isNameStart(peek(1))) {
        pos++;
        scanNCName();
      } else if (peek(1) == '*') {
        pos += 2;
      }
    }
    return new Lexeme(TokenType.NAME, expression.substring(start, pos), start);
  }

  private void scanNCName() {
    pos++;
    while (isNameChar(current())) {
      pos++;
    }
  }

  private Lexeme scanString(final int start) {
    final char quote = current();
    final StringBuilder output = new StringBuilder();
    pos++;
    while (true) {
      if (pos >= expression.length()) {
        throw syntaxError("unterminated string literal", expression.substring(start), start);
      }
      final char input = current();
      pos++;
      if (input == quote) {
        if (current() != quote) {
          break;
        }
        // doubled quote
        pos++;
      }
      output.append(input);
    }
    return new Lexeme(TokenType.STRING, output.toString(), start);
  }

  private Lexeme scanSymbol(final int start) {
    if (pos + 1 < expression.length()
        && TWO_CHAR_SYMBOLS.contains(expression.substring(pos, pos + 2))) {
      pos += 2;
    } else if (current() == '!') {
      throw syntaxError("invalid character '!'", "!", pos);
    } else {
      pos++;
    }
    return new Lexeme(TokenType.SYMBOL, expression.substring(start, pos), start);
  }

  private char current() {
    return peek(0);
  }

  private char peek(final int offset) {
    final int index = pos + offset;
    return index < expression.length() ? expression.charAt(index) : '\0';
  }

  private static boolean isDigit(final char input) {
    return input >= '0' && input <= '9';
  }

  private static boolean isNameStart(final char input) {
    return input == '_' || Character.isLetter(input);
  }

  private static boolean isNameChar(final char input) {
    return isNameStart(input) || isDigit(input) || input == '-' || input == '.'
        || input == '\u00B7' || Character.getType(input) == Character.NON_SPACING_MARK;
  }

  private static XPathSyntaxException syntaxError(final String detail, final String token,
      final int offset) {
    return new XPathSyntaxException(detail + " at position " + offset, token, offset,
        Collections.emptySet());
  }
}
