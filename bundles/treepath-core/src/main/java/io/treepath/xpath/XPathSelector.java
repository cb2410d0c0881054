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

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.CloseableIterator;
import io.treepath.api.Item;
import io.treepath.xpath.parser.ParserConfiguration;
import io.treepath.xpath.parser.XPath2Parser;
import io.treepath.xpath.parser.XPathParser;
import io.treepath.xpath.types.SequenceType;

/**
 * <h1>XPathSelector</h1>
 * <p>
 * A compiled expression, reusable for any number of evaluations. Declared variable types are
 * checked against the variables of each context.
 * </p>
 *
 * <pre>
 * XPathSelector selector = new XPathSelector("//b[@p:x]", config);
 * List&lt;Item&gt; result = selector.select(document);
 * </pre>
 */
public final class XPathSelector {

  /** The expression. */
  private final String path;

  /** The parser which compiled the expression. */
  private final XPathParser parser;

  /** The compiled expression. */
  private final XPathToken root;

  /** Declared types of external variables. */
  private final ImmutableMap<String, SequenceType> variableTypes;

  /**
   * Compiles an XPath 2.0 expression with default settings.
   *
   * @param path the expression
   * @throws io.treepath.exception.XPathException if the expression is not valid
   */
  public XPathSelector(final String path) {
    this(path, ParserConfiguration.defaults());
  }

  /**
   * Compiles an XPath 2.0 expression.
   *
   * @param path the expression
   * @param config parser settings
   * @throws io.treepath.exception.XPathException if the expression is not valid
   */
  public XPathSelector(final String path, final ParserConfiguration config) {
    this(path, new XPath2Parser(config));
  }

  /**
   * Compiles an expression.
   *
   * @param path the expression
   * @param parser the parser
   * @throws io.treepath.exception.XPathException if the expression or a declared variable type
   *         is not valid
   */
  public XPathSelector(final String path, final XPathParser parser) {
    this.path = requireNonNull(path);
    this.parser = requireNonNull(parser);
    final ImmutableMap.Builder<String, SequenceType> types = ImmutableMap.builder();
    final Map<String, String> declared = parser.getConfiguration().getVariableTypes();
    if (declared != null) {
      declared.forEach((name, type) -> types.put(name, parser.parseSequenceType(type)));
    }
    variableTypes = types.build();
    root = parser.parse(path);
  }

  /**
   * Get the compiled expression.
   *
   * @return the root token
   */
  public XPathToken getRoot() {
    return root;
  }

  public XPathParser getParser() {
    return parser;
  }

  /**
   * Selects from a root: a DOM document or element, a node tree or a schema.
   *
   * @param rootSource the root
   * @return the result sequence
   */
  public List<Item> select(final Object rootSource) {
    return select(newContext(rootSource));
  }

  /**
   * Selects with a dynamic context.
   *
   * @param context the dynamic context
   * @return the result sequence
   * @throws io.treepath.exception.XPathException XPTY0004 if a variable does not match its
   *         declared type, or any evaluation error
   */
  public List<Item> select(final XPathContext context) {
    checkVariables(context);
    return root.evaluate(context);
  }

  /**
   * Lazily selects from a root. The iterator must be closed.
   *
   * @param rootSource the root
   * @return the result sequence
   */
  public CloseableIterator<Item> iterSelect(final Object rootSource) {
    return iterSelect(newContext(rootSource));
  }

  /**
   * Lazily selects with a dynamic context. The iterator must be closed.
   *
   * @param context the dynamic context
   * @return the result sequence
   */
  public CloseableIterator<Item> iterSelect(final XPathContext context) {
    checkVariables(context);
    return root.select(context);
  }

  /**
   * Evaluates the expression, possibly without dynamic context.
   *
   * @param context the dynamic context or {@code null}
   * @return the result sequence
   * @throws io.treepath.exception.MissingContextException if the expression needs a context
   */
  public List<Item> evaluate(final @Nullable XPathContext context) {
    if (context != null) {
      checkVariables(context);
    }
    return root.evaluate(context);
  }

  private XPathContext newContext(final Object rootSource) {
    return new XPathContext.Builder().root(rootSource).namespaces(parser.getNamespaces()).build();
  }

  private void checkVariables(final XPathContext context) {
    final Map<String, List<Item>> variables = context.getVariables();
    variableTypes.forEach((name, type) -> {
      final List<Item> value = variables.get(name);
      if (value != null && !type.matches(value)) {
        throw EXPathError.XPTY0004.newException(
            "variable $" + name + " does not match its declared type " + type);
      }
    });
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("path", path).add("parser", parser).toString();
  }
}
