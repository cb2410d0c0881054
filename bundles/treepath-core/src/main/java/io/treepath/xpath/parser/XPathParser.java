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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.XMLConstants;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import io.treepath.api.CloseableIterator;
import io.treepath.api.Item;
import io.treepath.exception.MissingContextException;
import io.treepath.exception.XPathSyntaxException;
import io.treepath.schema.SchemaProxy;
import io.treepath.utils.LogWrapper;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.types.AtomicValue;
import io.treepath.xpath.types.NodeTest;
import io.treepath.xpath.types.SequenceType;
import io.treepath.xpath.types.SequenceType.Occurrence;
import io.treepath.xpath.types.Type;

/**
 * <h1>XPathParser</h1>
 * <p>
 * Top down operator precedence parser which compiles an expression into a tree of
 * {@link XPathToken}s. The grammar is given by an immutable {@link SymbolTable}; each token
 * parses itself with its null and left denotation, calling back into
 * {@link #expression(int)} and {@link #advance(String...)}.
 * </p>
 * <p>
 * After parsing, the compiled expression is evaluated once without dynamic context and, if a
 * schema is bound, once against the schema graph, to report static errors early. Missing context
 * conditions are expected during these checks and ignored.
 * </p>
 * <p>
 * A parser instance is not thread safe, but the compiled expressions may be evaluated
 * concurrently with different contexts.
 * </p>
 */
public abstract class XPathParser {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER =
      new LogWrapper(LoggerFactory.getLogger(XPathParser.class));

  /** Namespace of the standard functions. */
  public static final String FN_NAMESPACE = "http://www.w3.org/2005/xpath-functions";

  /** Symbols of the occurrence indicators. */
  private static final ImmutableSet<String> OCCURRENCE_INDICATORS = ImmutableSet.of("?", "*", "+");

  /** The grammar. */
  private final SymbolTable table;

  /** The settings. */
  private final ParserConfiguration config;

  /** Statically known namespaces, including the predeclared ones. */
  private final ImmutableMap<String, String> namespaces;

  /** Variables bound by enclosing {@code for}, {@code some} and {@code every} expressions. */
  private final Deque<String> scopedVariables = new ArrayDeque<>();

  /** Lexemes of the expression. */
  private List<Lexeme> lexemes = ImmutableList.of();

  /** Index of the next lexeme to convert. */
  private int lexemeIndex;

  /** The last consumed token. */
  private @Nullable XPathToken token;

  /** The next token. */
  private @Nullable XPathToken nextToken;

  /** Determines if a sequence type is parsed. */
  private boolean inSequenceType;

  /**
   * Constructor.
   *
   * @param table the grammar
   * @param config the settings
   */
  protected XPathParser(final SymbolTable table, final ParserConfiguration config) {
    this.table = requireNonNull(table);
    this.config = requireNonNull(config);
    final Map<String, String> known = new LinkedHashMap<>();
    known.put(XMLConstants.XML_NS_PREFIX, XMLConstants.XML_NS_URI);
    known.put("xs", Type.XSD_NAMESPACE);
    known.put("fn", FN_NAMESPACE);
    config.getNamespaces().forEach((prefix, uri) -> {
      if (!XMLConstants.XML_NS_PREFIX.equals(prefix)) {
        known.put(prefix, uri);
      }
    });
    namespaces = ImmutableMap.copyOf(known);
  }

  /**
   * Get the XPath version of the grammar.
   *
   * @return the version, for instance {@code 2.0}
   */
  public abstract String getVersion();

  /**
   * Get the grammar.
   *
   * @return the symbol table
   */
  public SymbolTable getTable() {
    return table;
  }

  /**
   * Get the settings.
   *
   * @return the settings
   */
  public ParserConfiguration getConfiguration() {
    return config;
  }

  /**
   * Get the statically known namespaces, including the predeclared prefixes {@code xml},
   * {@code xs} and {@code fn}.
   *
   * @return map from prefix to URI
   */
  public Map<String, String> getNamespaces() {
    return namespaces;
  }

  /**
   * Get the default namespace of element names.
   *
   * @return the namespace URI or {@code null}
   */
  public @Nullable String getDefaultNamespace() {
    return config.getDefaultNamespace();
  }

  /**
   * Get the schema binding.
   *
   * @return the schema or {@code null}
   */
  public @Nullable SchemaProxy getSchema() {
    return config.getSchema();
  }

  /**
   * Determines if XPath 1.0 compatibility mode is on.
   *
   * @return true in compatibility mode
   */
  public boolean isCompatibilityMode() {
    return config.isCompatibilityMode();
  }

  /**
   * Compiles an expression.
   *
   * @param source the expression
   * @return the root token of the compiled expression
   * @throws io.treepath.exception.XPathException if the expression is not valid
   */
  public XPathToken parse(final String source) {
    LOGWRAPPER.debug("Parsing '{}' with the XPath {} parser", source, getVersion());
    reset(source);
    final XPathToken root = expression(0);
    if (!"(end)".equals(getNextToken().getSymbol())) {
      throw getNextToken().wrongSyntax(ImmutableSet.of("(end)"));
    }
    staticCheck(root);
    return root;
  }

  /**
   * Parses a standalone sequence type, such as {@code xs:string*}.
   *
   * @param source the sequence type
   * @return the parsed sequence type
   */
  public SequenceType parseSequenceType(final String source) {
    reset(source);
    final SequenceType sequenceType = parseSequenceType();
    advance("(end)");
    return sequenceType;
  }

  private void reset(final String source) {
    lexemes = new XPathScanner(source).tokenize();
    lexemeIndex = 0;
    scopedVariables.clear();
    inSequenceType = false;
    token = null;
    nextToken = null;
    shift();
  }

  /**
   * Evaluates the compiled expression without dynamic context and against the schema graph.
   *
   * @param root the compiled expression
   */
  protected void staticCheck(final XPathToken root) {
    evaluateStatically(root, null);
    final SchemaProxy schema = getSchema();
    if (schema != null) {
      evaluateStatically(root, schema.getContext());
    }
  }

  private static void evaluateStatically(final XPathToken root,
      final @Nullable XPathContext context) {
    try (CloseableIterator<Item> results = root.select(context)) {
      if (results.hasNext()) {
        results.next();
      }
    } catch (final MissingContextException e) {
      LOGWRAPPER.debug("Static check of {} needs a dynamic context: {}", root.getSource(),
          e.getMessage());
    }
  }

  /**
   * Parses an expression. Consumes tokens while their left binding power is greater than the
   * given right binding power.
   *
   * @param rbp the right binding power
   * @return the parsed expression
   */
  public XPathToken expression(final int rbp) {
    XPathToken current = advance();
    XPathToken left = current.nud();
    while (rbp < getNextToken().getLbp()) {
      current = advance();
      left = current.led(left);
    }
    return left;
  }

  /**
   * Parses an expression with the lowest binding power.
   *
   * @return the parsed expression
   */
  public XPathToken expression() {
    return expression(0);
  }

  /**
   * Consumes the next token.
   *
   * @param expected the allowed symbols of the next token, any symbol if empty
   * @return the consumed token
   * @throws XPathSyntaxException if the next token is not one of the expected symbols
   */
  public XPathToken advance(final String... expected) {
    final XPathToken current = getNextToken();
    if (expected.length > 0 && !ImmutableSet.copyOf(expected).contains(current.getSymbol())) {
      throw current.wrongSyntax(ImmutableSet.copyOf(expected));
    }
    token = current;
    shift();
    return current;
  }

  /**
   * Consumes a name, which may be a word also used as keyword.
   *
   * @return the name
   * @throws XPathSyntaxException if the next token is not a name
   */
  public String advanceName() {
    final XPathToken current = getNextToken();
    if ("(name)".equals(current.getSymbol()) && current.getValue() instanceof String name) {
      advance();
      return name;
    } else if (current.isNameLike() || current.getLabel() == Label.FUNCTION
        || current.getLabel() == Label.KIND_TEST) {
      advance();
      return current.getSymbol();
    }
    throw current.wrongSyntax(ImmutableSet.of("(name)"));
  }

  private void shift() {
    if (nextToken != null && "(end)".equals(nextToken.getSymbol())) {
      return;
    }
    final Lexeme lexeme = lexemes.get(lexemeIndex++);
    final Lexeme following = lexemeIndex < lexemes.size() ? lexemes.get(lexemeIndex) : null;
    nextToken = createToken(lexeme, following);
  }

  /**
   * Get the last consumed token.
   *
   * @return the token
   */
  public XPathToken getToken() {
    return requireNonNull(token, "no token consumed");
  }

  /**
   * Get the next token.
   *
   * @return the token
   */
  public XPathToken getNextToken() {
    return requireNonNull(nextToken, "no expression");
  }

  private XPathToken createToken(final Lexeme lexeme, final @Nullable Lexeme following) {
    final int offset = lexeme.offset();
    final String text = lexeme.text();
    switch (lexeme.type()) {
      case END:
        return newToken("(end)", null, offset);
      case STRING:
        return newToken("(string)", AtomicValue.of(text), offset);
      case INTEGER:
        return newToken("(integer)", AtomicValue.of(new BigInteger(text)), offset);
      case DECIMAL:
        return newToken("(decimal)", AtomicValue.of(new BigDecimal(text)), offset);
      case DOUBLE:
        return newToken("(double)", AtomicValue.of(Double.parseDouble(text)), offset);
      case SYMBOL: {
        final SymbolDefinition definition = table.get(text);
        if (definition == null) {
          throw new XPathSyntaxException("unknown symbol '" + text + "' at position " + offset,
              text, offset, ImmutableSet.of());
        }
        return definition.getFactory().create(this, definition, null, offset);
      }
      case NAME:
        return createNameLikeToken(text, offset, following);
      default:
        throw new IllegalStateException("Unknown lexeme type " + lexeme.type());
    }
  }

  /**
   * Reads a name depending on the following lexeme: as axis before {@code ::}, as function,
   * kind test or constructor before {@code (}, otherwise as keyword if it is one or else as
   * name test. Axes are registered with their {@code ::} suffix, so {@code attribute} can be
   * both an axis and a kind test.
   */
  private XPathToken createNameLikeToken(final String name, final int offset,
      final @Nullable Lexeme following) {
    if (following != null && following.isSymbol("::")) {
      final SymbolDefinition definition = table.get(name + "::");
      if (definition == null || definition.getLabel() != Label.AXIS) {
        throw EXPathError.XPST0010.newException("unknown axis '" + name + "'");
      }
      return definition.getFactory().create(this, definition, null, offset);
    }
    final SymbolDefinition keyword = table.get(name);
    if (following != null && following.isSymbol("(")) {
      final SymbolDefinition definition = table.get(functionSymbol(name));
      if (definition != null && isCallable(definition.getLabel())) {
        return definition.getFactory().create(this, definition, null, offset);
      } else if (keyword != null && isKeyword(keyword.getLabel())) {
        return keyword.getFactory().create(this, keyword, null, offset);
      }
      throw EXPathError.XPST0017.newException("unknown function '" + name + "'");
    } else if (keyword != null && isKeyword(keyword.getLabel())) {
      return keyword.getFactory().create(this, keyword, null, offset);
    }
    return createNameToken(name, offset);
  }

  private static boolean isCallable(final Label label) {
    return label == Label.FUNCTION || label == Label.CONSTRUCTOR || label == Label.KIND_TEST
        || label == Label.SEQUENCE_TYPE;
  }

  private static boolean isKeyword(final Label label) {
    return label == Label.KEYWORD || label == Label.OPERATOR;
  }

  /**
   * Maps a function name to its symbol: standard functions are registered without prefix,
   * constructor functions with the {@code xs} prefix.
   */
  private String functionSymbol(final String name) {
    final int colon = name.indexOf(':');
    if (colon < 0) {
      return name;
    }
    final String prefix = name.substring(0, colon);
    final String localName = name.substring(colon + 1);
    final String uri = namespaces.get(prefix);
    if (uri == null) {
      throw EXPathError.XPST0081.newException("unknown prefix '" + prefix + "'");
    } else if (FN_NAMESPACE.equals(uri)) {
      return localName;
    } else if (Type.XSD_NAMESPACE.equals(uri)) {
      return "xs:" + localName;
    }
    return '{' + uri + '}' + localName;
  }

  /**
   * Creates a name test token.
   *
   * @param name the name
   * @param offset offset in the expression
   * @return the token
   */
  public XPathToken createNameToken(final String name, final int offset) {
    return newToken("(name)", name, offset);
  }

  private XPathToken newToken(final String symbol, final @Nullable Object value,
      final int offset) {
    final SymbolDefinition definition = table.getRequired(symbol);
    return definition.getFactory().create(this, definition, value, offset);
  }

  /**
   * Parses a sequence type at the current position.
   *
   * @return the sequence type
   */
  public SequenceType parseSequenceType() {
    inSequenceType = true;
    try {
      final XPathToken current = getNextToken();
      if ("empty-sequence".equals(current.getSymbol())
          && current.getLabel() == Label.SEQUENCE_TYPE) {
        advance().nud();
        return SequenceType.EMPTY;
      } else if ("item".equals(current.getSymbol())
          && current.getLabel() == Label.SEQUENCE_TYPE) {
        advance().nud();
        return SequenceType.item(parseOccurrence());
      } else if (current.getLabel() == Label.KIND_TEST) {
        final XPathToken test = advance().nud();
        if (!(test instanceof NodeTest nodeTest)) {
          throw current.wrongSyntax();
        }
        return SequenceType.node(nodeTest, parseOccurrence());
      }
      final Type type = resolveTypeName(current, advanceName());
      return SequenceType.atomic(type, parseOccurrence());
    } finally {
      inSequenceType = false;
    }
  }

  /**
   * Parses the single type of a cast expression: an atomic type and an optional {@code ?}.
   *
   * @return the single type, with occurrence exactly one or zero or one
   */
  public SequenceType parseSingleType() {
    final XPathToken current = getNextToken();
    final Type type = resolveTypeName(current, advanceName());
    if ("?".equals(getNextToken().getSymbol())) {
      advance();
      return SequenceType.atomic(type, Occurrence.ZERO_OR_ONE);
    }
    return SequenceType.atomic(type, Occurrence.EXACTLY_ONE);
  }

  private Occurrence parseOccurrence() {
    final String symbol = getNextToken().getSymbol();
    if (OCCURRENCE_INDICATORS.contains(symbol)) {
      advance();
      return requireNonNull(Occurrence.fromSymbol(symbol));
    }
    return Occurrence.EXACTLY_ONE;
  }

  private Type resolveTypeName(final XPathToken at, final String name) {
    final int colon = name.indexOf(':');
    final String uri;
    if (colon < 0) {
      uri = getDefaultNamespace();
    } else {
      final String prefix = name.substring(0, colon);
      uri = namespaces.get(prefix);
      if (uri == null) {
        throw EXPathError.XPST0081.newException("unknown prefix '" + prefix + "'");
      }
    }
    final Type type = Type.XSD_NAMESPACE.equals(uri)
        ? Type.getType('{' + uri + '}' + name.substring(colon + 1))
        : null;
    if (type == null || !type.isAtomicType()) {
      throw EXPathError.XPST0051.newException(
          "unknown atomic type '" + name + "' at position " + at.getOffset());
    }
    return type;
  }

  /**
   * Determines if a sequence type is being parsed.
   *
   * @return true inside a sequence type
   */
  public boolean isInSequenceType() {
    return inSequenceType;
  }

  /**
   * Enters the scope of a variable bound by a {@code for}, {@code some} or {@code every}
   * expression.
   *
   * @param name the variable name
   */
  public void pushVariable(final String name) {
    scopedVariables.push(name);
  }

  /**
   * Leaves the scope of the most recently bound variable.
   */
  public void popVariable() {
    scopedVariables.pop();
  }

  /**
   * Determines if a variable may be referenced. Undeclared variables are only rejected in strict
   * mode, when variables are declared.
   *
   * @param name the variable name
   * @return true, if the variable is bound or declared
   */
  public boolean isVariableDeclared(final String name) {
    final Map<String, String> variableTypes = config.getVariableTypes();
    return !config.isStrict() || variableTypes == null || variableTypes.containsKey(name)
        || scopedVariables.contains(name);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '[' + getVersion() + ']';
  }
}
