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

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.xpath.EXPathError;

/**
 * <h1>XPathException</h1>
 * <p>
 * Base of all errors raised while building node trees, parsing or evaluating XPath expressions.
 * The error is identified by its standard {@link EXPathError} code, the message starts with the
 * code's standard message and ends with an optional detail.
 * </p>
 * <p>
 * The exception is unchecked, as evaluation errors surface lazily while iterating result
 * sequences.
 * </p>
 */
public class XPathException extends RuntimeException {

  /** General ID. */
  private static final long serialVersionUID = 1L;

  /** The standard error code. */
  private final EXPathError error;

  /** Additional error detail, if any. */
  private final @Nullable String detail;

  /**
   * Constructor.
   *
   * @param error the error code
   * @param detail additional error detail
   */
  public XPathException(final EXPathError error, final @Nullable String detail) {
    super(buildMessage(error, detail));
    this.error = requireNonNull(error);
    this.detail = detail;
  }

  /**
   * Constructor.
   *
   * @param error the error code
   * @param detail additional error detail
   * @param cause the cause
   */
  public XPathException(final EXPathError error, final @Nullable String detail,
      final Throwable cause) {
    super(buildMessage(error, detail), cause);
    this.error = requireNonNull(error);
    this.detail = detail;
  }

  private static String buildMessage(final EXPathError error, final @Nullable String detail) {
    return detail == null ? error.getMsg() : error.getMsg() + ": " + detail;
  }

  /**
   * Get the error code.
   *
   * @return the error code
   */
  public EXPathError getError() {
    return error;
  }

  /**
   * Get the error code as string, for instance {@code XPTY0004}.
   *
   * @return the error code
   */
  public String getCode() {
    return error.name();
  }

  /**
   * Get the additional error detail.
   *
   * @return the detail or {@code null}
   */
  public @Nullable String getDetail() {
    return detail;
  }
}
