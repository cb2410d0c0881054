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

package io.treepath.xpath;

import java.util.Collections;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.exception.MissingContextException;
import io.treepath.exception.XPathException;
import io.treepath.exception.XPathKeyException;
import io.treepath.exception.XPathNameException;
import io.treepath.exception.XPathSyntaxException;
import io.treepath.exception.XPathTypeException;

/**
 * <h1>EXPathError</h1>
 * <p>
 * Standard error codes of <a href="http://www.w3.org/TR/xpath20/#id-errors">XPath 2.0</a> and
 * <a href="http://www.w3.org/TR/xpath-functions/#error-summary">XQuery 1.0 and XPath 2.0
 * Functions and Operators</a>, each bound to the class of exception that reports it.
 * </p>
 */
public enum EXPathError {

  /** XPath static error 0001. */
  XPST0001(Category.VALUE,
      "err:XPST0001 Some component of the static context has not been assigned a value."),

  /** XPath dynamic error 0002. */
  XPDY0002(Category.MISSING_CONTEXT,
      "err:XPDY0002 Some part of the dynamic context has not been assigned a value."),

  /** XPath static error 0003. */
  XPST0003(Category.SYNTAX,
      "err:XPST0003 Expression is not a valid instance of the grammar defined in A.1 EBNF."),

  /** XPath type error 0004. */
  XPTY0004(Category.TYPE, "err:XPTY0004 The type is not appropriate the expression or the "
      + "type does not match a required type as specified by the matching rules."),

  /** XPath static error 0005. */
  XPST0005(Category.TYPE, "err:XPST0005 The static type assigned to an expression other than the "
      + "expression () or data(()) is empty-sequence()."),

  /** XPath static error 0008. */
  XPST0008(Category.NAME,
      "err:XPST0008 Expression refers to a name that is not defined in the static context."),

  /** XPath static error 0010. */
  XPST0010(Category.KEY, "err:XPST0010 Axis is not supported."),

  /** XPath static error 0017. */
  XPST0017(Category.NAME, "err:XPST0017 The expanded QName and number of arguments in a "
      + "function call do not match the name and arity of a function signature."),

  /** XPath type error 0018. */
  XPTY0018(Category.TYPE, "err:XPTY0018 Result of the last step in a path expression contains "
      + "both nodes and atomic values."),

  /** XPath type error 0019. */
  XPTY0019(Category.TYPE, "err:XPTY0019 Result of a step (other than the last step) in a path "
      + "expression contains an atomic value."),

  /** XPath type error 0020. */
  XPTY0020(Category.TYPE, "err:XPTY0020 Context item in an axis step is not a node."),

  /** XPath dynamic error 0050. */
  XPDY0050(Category.TYPE, "err:XPDY0050 Dynamic type of the operand of a treat expression does "
      + "not match the sequence type specified by the treat expression."),

  /** XPath static error 0051. */
  XPST0051(Category.NAME,
      "err:XPST0051 Type is not defined in the in-scope schema types as an atomic type."),

  /** XPath static error 0080. */
  XPST0080(Category.NAME, "err:XPST0080 Target type of a cast or castable expression must not be "
      + "xs:NOTATION or xs:anyAtomicType."),

  /** XPath static error 0081. */
  XPST0081(Category.NAME, "err:XPST0081 Namespace prefix cannot be expanded into a namespace URI "
      + "by using the statically known namespaces."),

  /** Division by zero. */
  FOAR0001(Category.VALUE, "err:FOAR0001 Division by zero."),

  /** Numeric operation overflow/underflow. */
  FOAR0002(Category.VALUE, "err:FOAR0002 Numeric operation overflow/underflow."),

  /** Input value too large for decimal. */
  FOCA0001(Category.VALUE, "err:FOCA0001 Input value too large for decimal."),

  /** Invalid lexical value. */
  FOCA0002(Category.VALUE, "err:FOCA0002 Invalid lexical value."),

  /** Input value too large for integer. */
  FOCA0003(Category.VALUE, "err:FOCA0003 Input value too large for integer."),

  /** No context document. */
  FODC0001(Category.VALUE, "err:FODC0001 No context document."),

  /** Error retrieving resource. */
  FODC0002(Category.VALUE, "err:FODC0002 Error retrieving resource."),

  /** Invalid argument to fn:collection. */
  FODC0004(Category.VALUE, "err:FODC0004 Invalid argument to fn:collection."),

  /** Unidentified error. */
  FOER0000(Category.VALUE, "err:FOER0000 Unidentified error."),

  /** Invalid value for cast/constructor. */
  FORG0001(Category.VALUE, "err:FORG0001 Invalid value for cast/constructor."),

  /** fn:zero-or-one called with a sequence containing more than one item. */
  FORG0003(Category.VALUE,
      "err:FORG0003 fn:zero-or-one called with a sequence containing more than one item."),

  /** fn:one-or-more called with a sequence containing no items. */
  FORG0004(Category.VALUE,
      "err:FORG0004 fn:one-or-more called with a sequence containing no items."),

  /** fn:exactly-one called with a sequence containing zero or more than one item. */
  FORG0005(Category.VALUE, "err:FORG0005 fn:exactly-one called with a sequence containing zero "
      + "or more than one item."),

  /** Invalid argument type. */
  FORG0006(Category.TYPE, "err:FORG0006 Invalid argument type."),

  /** Argument node does not have a typed value. */
  FOTY0012(Category.TYPE, "err:FOTY0012 Argument node does not have a typed value."),

  /** Argument to fn:data() contains a function item. */
  FOTY0013(Category.TYPE, "err:FOTY0013 An argument to fn:data() contains a function item.");

  /** Class of exception reporting an error. */
  private enum Category {
    SYNTAX, MISSING_CONTEXT, TYPE, NAME, KEY, VALUE
  }

  /** Class of exception reporting this error. */
  private final Category category;

  /** Error message. */
  private final String msg;

  /**
   * Constructor. Initializes the internal state.
   *
   * @param category class of exception reporting the error
   * @param msg the error message
   */
  EXPathError(final Category category, final String msg) {
    this.category = category;
    this.msg = msg;
  }

  /**
   * Get the standard error message.
   *
   * @return the error message
   */
  public String getMsg() {
    return msg;
  }

  /**
   * Creates a new exception reporting this error.
   *
   * @return the exception
   */
  public XPathException newException() {
    return newException(null);
  }

  /**
   * Creates a new exception reporting this error with an additional detail.
   *
   * @param detail the error detail, may be {@code null}
   * @return the exception
   */
  public XPathException newException(final @Nullable String detail) {
    final Set<String> noExpectation = Collections.emptySet();
    return switch (category) {
      case SYNTAX -> new XPathSyntaxException(detail, "", -1, noExpectation);
      case MISSING_CONTEXT -> new MissingContextException(this, detail);
      case TYPE -> new XPathTypeException(this, detail);
      case NAME -> new XPathNameException(this, detail);
      case KEY -> new XPathKeyException(this, detail);
      case VALUE -> new XPathException(this, detail);
    };
  }
}
