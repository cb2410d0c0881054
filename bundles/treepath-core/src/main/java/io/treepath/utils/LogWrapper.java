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

package io.treepath.utils;

import static java.util.Objects.requireNonNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guards the logging calls of the tree builders and parsers with the level check of the wrapped
 * logger, so that message arguments such as expression sources are only formatted when the
 * level is on.
 */
public final class LogWrapper {

  private final Logger logger;

  /**
   * Constructor.
   *
   * @param logger logger
   */
  public LogWrapper(final Logger logger) {
    this.logger = requireNonNull(logger);
  }

  /**
   * Creates a wrapper around the logger of a class.
   *
   * @param clazz the logging class
   * @return the wrapper
   */
  public static LogWrapper forClass(final Class<?> clazz) {
    return new LogWrapper(LoggerFactory.getLogger(clazz));
  }

  /**
   * Log debugging information.
   *
   * @param message message pattern with {@code {}} placeholders
   * @param arguments the placeholder values
   */
  public void debug(final String message, final Object... arguments) {
    if (logger.isDebugEnabled()) {
      logger.debug(message, arguments);
    }
  }

  /**
   * Log a warning.
   *
   * @param message message pattern with {@code {}} placeholders
   * @param arguments the placeholder values
   */
  public void warn(final String message, final Object... arguments) {
    if (logger.isWarnEnabled()) {
      logger.warn(message, arguments);
    }
  }
}
