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

package io.treepath.xpath.functions;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.xml.namespace.QName;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.Item;
import io.treepath.node.NodeKind;
import io.treepath.node.XPathNode;
import io.treepath.xpath.EXPathError;
import io.treepath.xpath.XPathContext;
import io.treepath.xpath.XPathToken;
import io.treepath.xpath.types.AtomicValue;
import io.treepath.xpath.types.Numbers;
import io.treepath.xpath.types.SequenceType.Occurrence;
import io.treepath.xpath.types.Temporals;
import io.treepath.xpath.types.Type;

/**
 * <h1>FuncDef</h1>
 * <p>
 * The built-in functions with their arity, the cardinality of their parameters and the XPath
 * version that introduced them, according to <a href="http://www.w3.org/TR/xpath-functions/">
 * XQuery 1.0 and XPath 2.0 Functions and Operators</a>.
 * </p>
 * <p>
 * Functions reading the focus raise XPDY0002 without a dynamic context.
 * </p>
 */
public enum FuncDef {

  // ////////////////////////
  // CONTEXT FUNCTIONS
  // ////////////////////////

  /** fn:position() as xs:integer. */
  POSITION("position", "1.0", 0, 0) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(AtomicValue.of(requireContext(this, context).getPosition()));
    }
  },

  /** fn:last() as xs:integer. */
  LAST("last", "1.0", 0, 0) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(AtomicValue.of(requireContext(this, context).getSize()));
    }
  },

  // ////////////////////////
  // SEQUENCE FUNCTIONS
  // ////////////////////////

  /** fn:count($arg as item()*) as xs:integer. */
  COUNT("count", "1.0", 1, 1, Occurrence.ZERO_OR_MORE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(AtomicValue.of(arguments.get(0).size()));
    }
  },

  /**
   * fn:sum($arg as xs:anyAtomicType*, $zero as xs:anyAtomicType?) as xs:anyAtomicType?
   * <p>
   * Untyped values are added as doubles, the sum of the empty sequence is $zero or 0.
   * </p>
   */
  SUM("sum", "1.0", 1, 2, Occurrence.ZERO_OR_MORE, Occurrence.ZERO_OR_ONE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      final List<AtomicValue> values = XPathToken.atomize(arguments.get(0));
      if (values.isEmpty()) {
        return arguments.size() > 1 ? arguments.get(1)
            : single(AtomicValue.of(BigInteger.ZERO));
      }
      AtomicValue sum = null;
      for (final AtomicValue value : values) {
        final AtomicValue number = value.isUntyped() ? value.castAs(Type.DOUBLE, null) : value;
        if (!number.isNumeric()) {
          throw EXPathError.FORG0006.newException(
              "fn:sum of " + value.getType().getStringRepr());
        }
        sum = sum == null ? number : Numbers.add(sum, number);
      }
      return single(sum);
    }
  },

  /** fn:empty($arg as item()*) as xs:boolean. */
  EMPTY("empty", "2.0", 1, 1, Occurrence.ZERO_OR_MORE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(AtomicValue.of(arguments.get(0).isEmpty()));
    }
  },

  /** fn:exists($arg as item()*) as xs:boolean. */
  EXISTS("exists", "2.0", 1, 1, Occurrence.ZERO_OR_MORE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(AtomicValue.of(!arguments.get(0).isEmpty()));
    }
  },

  /** fn:data($arg as item()*) as xs:anyAtomicType*. */
  DATA("data", "2.0", 1, 1, Occurrence.ZERO_OR_MORE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return new ArrayList<>(XPathToken.atomize(arguments.get(0)));
    }
  },

  // ////////////////////////
  // BOOLEAN FUNCTIONS
  // ////////////////////////

  /** fn:true() as xs:boolean. */
  TRUE("true", "1.0", 0, 0) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(AtomicValue.TRUE);
    }
  },

  /** fn:false() as xs:boolean. */
  FALSE("false", "1.0", 0, 0) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(AtomicValue.FALSE);
    }
  },

  /**
   * fn:boolean($arg as item()*) as xs:boolean
   * <p>
   * Computes the effective boolean value of the sequence $arg.
   * </p>
   */
  BOOLEAN("boolean", "1.0", 1, 1, Occurrence.ZERO_OR_MORE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(AtomicValue.of(XPathToken.booleanValue(arguments.get(0))));
    }
  },

  /** fn:not($arg as item()*) as xs:boolean. */
  NOT("not", "1.0", 1, 1, Occurrence.ZERO_OR_MORE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(AtomicValue.of(!XPathToken.booleanValue(arguments.get(0))));
    }
  },

  // ////////////////////////
  // STRING AND NUMERIC FUNCTIONS
  // ////////////////////////

  /** fn:string($arg as item()?) as xs:string. */
  STRING("string", "1.0", 0, 1, Occurrence.ZERO_OR_ONE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(AtomicValue.of(stringValue(argumentOrItem(this, context, arguments))));
    }
  },

  /** fn:number($arg as xs:anyAtomicType?) as xs:double. */
  NUMBER("number", "1.0", 0, 1, Occurrence.ZERO_OR_ONE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      final Item item = argumentOrItem(this, context, arguments);
      if (item == null) {
        return single(AtomicValue.of(Double.NaN));
      }
      final List<AtomicValue> values = XPathToken.atomize(item);
      return single(AtomicValue.of(values.size() == 1 ? Numbers.toDouble(values.get(0))
          : Double.NaN));
    }
  },

  /** fn:string-length($arg as xs:string?) as xs:integer. */
  STRING_LENGTH("string-length", "1.0", 0, 1, Occurrence.ZERO_OR_ONE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      final String text = stringValue(argumentOrItem(this, context, arguments));
      return single(AtomicValue.of(text.codePointCount(0, text.length())));
    }
  },

  /** fn:concat($arg1 as xs:anyAtomicType?, $arg2 as xs:anyAtomicType?, ...) as xs:string. */
  CONCAT("concat", "1.0", 2, Integer.MAX_VALUE, Occurrence.ZERO_OR_ONE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      final StringBuilder builder = new StringBuilder();
      for (final List<Item> argument : arguments) {
        builder.append(stringValue(argument.isEmpty() ? null : argument.get(0)));
      }
      return single(AtomicValue.of(builder.toString()));
    }
  },

  /** fn:contains($arg1 as xs:string?, $arg2 as xs:string?) as xs:boolean. */
  CONTAINS("contains", "1.0", 2, 2, Occurrence.ZERO_OR_ONE, Occurrence.ZERO_OR_ONE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(AtomicValue.of(stringArgument(arguments, 0)
          .contains(stringArgument(arguments, 1))));
    }
  },

  /** fn:starts-with($arg1 as xs:string?, $arg2 as xs:string?) as xs:boolean. */
  STARTS_WITH("starts-with", "1.0", 2, 2, Occurrence.ZERO_OR_ONE, Occurrence.ZERO_OR_ONE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(AtomicValue.of(stringArgument(arguments, 0)
          .startsWith(stringArgument(arguments, 1))));
    }
  },

  // ////////////////////////
  // NODE FUNCTIONS
  // ////////////////////////

  /** fn:name($arg as node()?) as xs:string. */
  NAME("name", "1.0", 0, 1, Occurrence.ZERO_OR_ONE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      final QName name = nodeName(this, argumentOrItem(this, context, arguments));
      if (name == null) {
        return single(AtomicValue.of(""));
      }
      return single(AtomicValue.of(name.getPrefix().isEmpty() ? name.getLocalPart()
          : name.getPrefix() + ':' + name.getLocalPart()));
    }
  },

  /** fn:local-name($arg as node()?) as xs:string. */
  LOCAL_NAME("local-name", "1.0", 0, 1, Occurrence.ZERO_OR_ONE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      final QName name = nodeName(this, argumentOrItem(this, context, arguments));
      return single(AtomicValue.of(name == null ? "" : name.getLocalPart()));
    }
  },

  /** fn:namespace-uri($arg as node()?) as xs:anyURI. */
  NAMESPACE_URI("namespace-uri", "1.0", 0, 1, Occurrence.ZERO_OR_ONE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      final Item item = argumentOrItem(this, context, arguments);
      final QName name = nodeName(this, item);
      final String uri = name == null || ((XPathNode) item).getKind() == NodeKind.NAMESPACE
          ? "" : name.getNamespaceURI();
      return single(new AtomicValue(uri, Type.ANY_URI));
    }
  },

  /** fn:root($arg as node()?) as node()?. */
  ROOT("root", "2.0", 0, 1, Occurrence.ZERO_OR_ONE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      final Item item = argumentOrItem(this, context, arguments);
      if (item == null) {
        return Collections.emptyList();
      }
      if (!(item instanceof XPathNode node)) {
        throw EXPathError.XPTY0004.newException("fn:root needs a node argument");
      }
      return single(node.getRoot());
    }
  },

  // ////////////////////////
  // DOCUMENTS AND COLLECTIONS
  // ////////////////////////

  /** fn:doc($uri as xs:string?) as document-node()?. */
  DOC("doc", "2.0", 1, 1, Occurrence.ZERO_OR_ONE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      if (arguments.get(0).isEmpty()) {
        return Collections.emptyList();
      }
      return single(requireContext(this, context)
          .getAvailableDocument(stringArgument(arguments, 0)));
    }
  },

  /** fn:collection($arg as xs:string?) as node()*. */
  COLLECTION("collection", "2.0", 0, 1, Occurrence.ZERO_OR_ONE) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      final String uri = arguments.isEmpty() || arguments.get(0).isEmpty() ? null
          : stringArgument(arguments, 0);
      return new ArrayList<>(requireContext(this, context).getAvailableCollection(uri));
    }
  },

  // ////////////////////////
  // DATES AND TIMES
  // ////////////////////////

  /** fn:current-dateTime() as xs:dateTime. */
  CURRENT_DATE_TIME("current-dateTime", "2.0", 0, 0) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(Temporals.toDateTime(requireContext(this, context).getCurrentDateTime()));
    }
  },

  /** fn:implicit-timezone() as xs:dayTimeDuration. */
  IMPLICIT_TIMEZONE("implicit-timezone", "2.0", 0, 0) {
    @Override
    List<Item> invoke(final @Nullable XPathContext context, final List<List<Item>> arguments) {
      return single(Temporals.toDayTimeDuration(requireContext(this, context).getTimezone()));
    }
  };

  /** Local name of the function in the function namespace. */
  private final String name;

  /** The XPath version which introduced the function. */
  private final String version;

  private final int minArgs;

  private final int maxArgs;

  /** Cardinality of the parameters, the last one repeating. */
  private final List<Occurrence> parameters;

  FuncDef(final String name, final String version, final int minArgs, final int maxArgs,
      final Occurrence... parameters) {
    this.name = name;
    this.version = version;
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
    this.parameters = ImmutableList.copyOf(parameters);
  }

  /**
   * Applies the function.
   *
   * @param context the dynamic context, {@code null} for the static evaluation
   * @param arguments the evaluated arguments
   * @return the result sequence
   */
  abstract List<Item> invoke(@Nullable XPathContext context, List<List<Item>> arguments);

  public String getName() {
    return name;
  }

  public String getVersion() {
    return version;
  }

  public int getMinArgs() {
    return minArgs;
  }

  public int getMaxArgs() {
    return maxArgs;
  }

  /**
   * Get the cardinality of a parameter.
   *
   * @param index index of the parameter
   * @return the allowed number of items
   */
  public Occurrence getParameter(final int index) {
    return parameters.get(Math.min(index, parameters.size() - 1));
  }

  /**
   * Get the functions available in an XPath version.
   *
   * @param version the XPath version, {@code "1.0"} or {@code "2.0"}
   * @return the functions introduced by that version or an earlier one
   */
  public static List<FuncDef> getFunctions(final String version) {
    final List<FuncDef> functions = new ArrayList<>();
    for (final FuncDef function : values()) {
      if (function.version.compareTo(version) <= 0) {
        functions.add(function);
      }
    }
    return functions;
  }

  /**
   * Looks up a function by its local name.
   *
   * @param name the name
   * @return the function
   * @throws io.treepath.exception.XPathNameException XPST0017 if there is no such function
   */
  public static FuncDef fromName(final String name) {
    for (final FuncDef function : values()) {
      if (function.name.equals(name)) {
        return function;
      }
    }
    throw EXPathError.XPST0017.newException("unknown function " + name + "()");
  }

  private static List<Item> single(final Item item) {
    return Collections.singletonList(item);
  }

  private static XPathContext requireContext(final FuncDef function,
      final @Nullable XPathContext context) {
    if (context == null) {
      throw EXPathError.XPDY0002.newException("fn:" + function.name + "() needs a dynamic context");
    }
    return context;
  }

  private static @Nullable Item argumentOrItem(final FuncDef function,
      final @Nullable XPathContext context, final List<List<Item>> arguments) {
    if (!arguments.isEmpty()) {
      return arguments.get(0).isEmpty() ? null : arguments.get(0).get(0);
    }
    final Item item = requireContext(function, context).getItem();
    if (item == null) {
      throw EXPathError.XPDY0002.newException("fn:" + function.name + "() needs a context item");
    }
    return item;
  }

  private static String stringValue(final @Nullable Item item) {
    if (item == null) {
      return "";
    }
    return item instanceof XPathNode node ? node.getStringValue()
        : ((AtomicValue) item).getStringValue();
  }

  private static String stringArgument(final List<List<Item>> arguments, final int index) {
    final List<Item> argument = arguments.get(index);
    return stringValue(argument.isEmpty() ? null : argument.get(0));
  }

  private static @Nullable QName nodeName(final FuncDef function, final @Nullable Item item) {
    if (item == null) {
      return null;
    }
    if (!(item instanceof XPathNode node)) {
      throw EXPathError.XPTY0004.newException("fn:" + function.name + "() needs a node argument");
    }
    return node.getName();
  }
}
