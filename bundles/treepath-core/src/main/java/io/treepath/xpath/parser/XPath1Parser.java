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

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.schema.SchemaProxy;
import io.treepath.utils.LogWrapper;

/**
 * Parser of XPath 1.0 expressions. It always runs in XPath 1.0 compatibility mode and ignores a
 * schema binding.
 */
public class XPath1Parser extends XPathParser {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER =
      LogWrapper.forClass(XPath1Parser.class);

  /**
   * Constructor with default settings.
   */
  public XPath1Parser() {
    this(ParserConfiguration.defaults());
  }

  /**
   * Constructor.
   *
   * @param config the settings
   */
  public XPath1Parser(final ParserConfiguration config) {
    super(XPath1Grammar.TABLE, config);
    if (config.getSchema() != null) {
      LOGWRAPPER.warn("Schema {} is ignored by the XPath 1.0 parser", config.getSchema());
    }
  }

  @Override
  public String getVersion() {
    return "1.0";
  }

  @Override
  public boolean isCompatibilityMode() {
    return true;
  }

  @Override
  public @Nullable SchemaProxy getSchema() {
    return null;
  }
}
