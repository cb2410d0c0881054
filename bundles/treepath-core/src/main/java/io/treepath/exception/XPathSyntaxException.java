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

package io.treepath.exception;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.xpath.EXPathError;

/**
 * Expression is not a valid instance of the grammar. Carries the offending token, its offset in
 * the expression and the symbols the parser expected instead.
 */
public final class XPathSyntaxException extends XPathException {

  private static final long serialVersionUID = 1L;

  /** Text of the offending token. */
  private final String token;

  /** Offset of the offending token in the source text. */
  private final int offset;

  /** Expected symbols, empty if unknown. */
  private final ImmutableSet<String> expected;

  /**
   * Constructor.
   *
   * @param detail the error detail
   * @param token the offending token
   * @param offset offset of the token in the source text
   * @param expected the expected symbols
   */
  public XPathSyntaxException(final @Nullable String detail, final String token, final int offset,
      final Set<String> expected) {
    super(EXPathError.XPST0003, detail);
    this.token = token;
    this.offset = offset;
    this.expected = ImmutableSet.copyOf(expected);
  }

  /**
   * Get the offending token.
   *
   * @return the token text
   */
  public String getToken() {
    return token;
  }

  /**
   * Get the offset of the offending token.
   *
   * @return the offset
   */
  public int getOffset() {
    return offset;
  }

  /**
   * Get the expected symbols.
   *
   * @return set of symbols, empty if not known
   */
  public Set<String> getExpected() {
    return expected;
  }
}
