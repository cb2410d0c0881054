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

package io.treepath.node;

/**
 * Kinds of nodes of the XPath data model, with the name of the kind test matching them.
 */
public enum NodeKind {

  /** Document node. */
  DOCUMENT("document-node"),

  /** Element node. */
  ELEMENT("element"),

  /** Attribute node. */
  ATTRIBUTE("attribute"),

  /** Text node. */
  TEXT("text"),

  /** Comment node. */
  COMMENT("comment"),

  /** Processing instruction node. */
  PROCESSING_INSTRUCTION("processing-instruction"),

  /** Namespace node. */
  NAMESPACE("namespace-node");

  /** Name of the kind test. */
  private final String kindTestName;

  NodeKind(final String kindTestName) {
    this.kindTestName = kindTestName;
  }

  /**
   * Get the name of the kind test matching nodes of this kind.
   *
   * @return kind test name, for instance {@code processing-instruction}
   */
  public String getKindTestName() {
    return kindTestName;
  }
}
