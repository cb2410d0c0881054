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

package io.treepath.axis;

import java.util.HashMap;
import java.util.Map;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The navigation directions of XPath. The active axis is kept in the focus of a context, a
 * {@code null} axis denotes the default child axis.
 */
public enum Axis {

  /** The context item itself. */
  SELF("self", false),

  /** The attributes of an element. */
  ATTRIBUTE("attribute", false),

  /** The children of a document or an element. */
  CHILD("child", false),

  /** The parent of a node. */
  PARENT("parent", true),

  /** The ancestors of a node. */
  ANCESTOR("ancestor", true),

  /** A node and its ancestors. */
  ANCESTOR_OR_SELF("ancestor-or-self", true),

  /** The descendants of a node. */
  DESCENDANT("descendant", false),

  /** A node and its descendants. */
  DESCENDANT_OR_SELF("descendant-or-self", false),

  /** Nodes following a node in document order, without its descendants. */
  FOLLOWING("following", false),

  /** Siblings following a node. */
  FOLLOWING_SIBLING("following-sibling", false),

  /** Nodes preceding a node in document order, without its ancestors. */
  PRECEDING("preceding", true),

  /** Siblings preceding a node. */
  PRECEDING_SIBLING("preceding-sibling", true),

  /** The namespace nodes of an element. */
  NAMESPACE("namespace", false);

  /** Mapping of names to axes. */
  private static final Map<String, Axis> NAME_TO_AXIS = new HashMap<>();

  static {
    for (final Axis axis : values()) {
      NAME_TO_AXIS.put(axis.name, axis);
    }
  }

  /** Name of the axis in expressions. */
  private final String name;

  /** Determines if the axis is a reverse axis. */
  private final boolean reverse;

  Axis(final String name, final boolean reverse) {
    this.name = name;
    this.reverse = reverse;
  }

  /**
   * Get the name used in expressions.
   *
   * @return the axis name
   */
  public String getName() {
    return name;
  }

  /**
   * Determines if the axis navigates in reverse document order.
   *
   * @return true, if this is a reverse axis
   */
  public boolean isReverse() {
    return reverse;
  }

  /**
   * Get the axis with the given name.
   *
   * @param name the axis name
   * @return the axis or {@code null} if there is no such axis
   */
  public static @Nullable Axis fromName(final String name) {
    return NAME_TO_AXIS.get(name);
  }
}
