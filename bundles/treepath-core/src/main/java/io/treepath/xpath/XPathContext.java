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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.api.CloseableIterator;
import io.treepath.api.Item;
import io.treepath.axis.AbstractAxis;
import io.treepath.axis.AncestorAxis;
import io.treepath.axis.AttributeAxis;
import io.treepath.axis.Axis;
import io.treepath.axis.ChildAxis;
import io.treepath.axis.DescendantAxis;
import io.treepath.axis.FollowingAxis;
import io.treepath.axis.FollowingSiblingAxis;
import io.treepath.axis.IncludeSelf;
import io.treepath.axis.NamespaceAxis;
import io.treepath.axis.ParentAxis;
import io.treepath.axis.PrecedingAxis;
import io.treepath.axis.PrecedingSiblingAxis;
import io.treepath.axis.SelfAxis;
import io.treepath.node.DocumentNode;
import io.treepath.node.ElementNode;
import io.treepath.node.ParentNode;
import io.treepath.node.XPathNode;
import io.treepath.node.builder.NodeTrees;
import io.treepath.node.builder.TreeSource;
import io.treepath.schema.SchemaProxy;
import io.treepath.utils.AbstractCloseableIterator;
import io.treepath.utils.Sequences;

/**
 * <h1>XPathContext</h1>
 * <p>
 * The dynamic context of an evaluation: the focus (context item, position, size and active
 * axis), the variable bindings and the static references to the root of the tree, the
 * registries of available documents and collections, the implicit timezone and the current
 * date and time.
 * </p>
 * <p>
 * The focus is moved in place by the axis iterators and restored when they are exhausted or
 * closed. Sibling sub-expressions that must not see each other's focus or variables evaluate on
 * {@link #copy() copies}, which share the node trees. A context must not be used by more than
 * one evaluation at a time.
 * </p>
 */
public class XPathContext {

  /** The root of the tree, {@code null} for contexts without a tree. */
  private final @Nullable ParentNode root;

  /** The document of the tree, a detached document for element rooted trees. */
  private final @Nullable DocumentNode document;

  /** Statically known namespaces. */
  private final ImmutableMap<String, String> namespaces;

  /** Bound schema, if any. */
  private final @Nullable SchemaProxy schema;

  /** Available documents by URI. */
  private final ImmutableMap<String, ParentNode> documents;

  /** Available collections by URI. */
  private final ImmutableMap<String, List<XPathNode>> collections;

  /** The default collection, {@code null} if undefined. */
  private final @Nullable List<XPathNode> defaultCollection;

  /** The implicit timezone. */
  private final ZoneOffset timezone;

  /** The current date and time, stable during an evaluation. */
  private final OffsetDateTime currentDateTime;

  /** Variable bindings. */
  private final Map<String, List<Item>> variables;

  /** The context item. */
  private @Nullable Item item;

  /** The context position. */
  private int position;

  /** The context size. */
  private int size;

  /** The active axis, {@code null} for the default child axis. */
  private @Nullable Axis axis;

  /**
   * Constructor.
   *
   * @param builder the builder with the settings
   */
  protected XPathContext(final Builder builder) {
    ParentNode rootNode = null;
    if (builder.root != null) {
      rootNode = NodeTrees.build(TreeSource.fromObject(builder.root), builder.namespaces,
          builder.uri, builder.fragment);
    } else if (builder.item instanceof XPathNode node && node.getRoot() instanceof ParentNode) {
      rootNode = (ParentNode) node.getRoot();
    }

    if (rootNode instanceof DocumentNode documentNode && documentNode.isDetached()) {
      root = documentNode.getDocumentElement();
      document = documentNode;
    } else if (rootNode instanceof DocumentNode documentNode) {
      root = documentNode;
      document = documentNode;
    } else if (rootNode instanceof ElementNode element) {
      root = element;
      if (Boolean.TRUE.equals(builder.fragment)) {
        document = null;
      } else if (element.getParent() == null) {
        document = DocumentNode.detached(element);
      } else {
        document = element.getDocument();
      }
    } else {
      root = null;
      document = null;
    }

    namespaces = ImmutableMap.copyOf(builder.namespaces);
    schema = builder.schema;
    timezone = builder.timezone;
    currentDateTime = builder.currentDateTime != null ? builder.currentDateTime
        : OffsetDateTime.now(timezone);

    final ImmutableMap.Builder<String, ParentNode> documentsBuilder = ImmutableMap.builder();
    for (final Map.Entry<String, Object> entry : builder.documents.entrySet()) {
      documentsBuilder.put(entry.getKey(), NodeTrees.build(TreeSource.fromObject(entry.getValue()),
          builder.namespaces, entry.getKey(), null));
    }
    documents = documentsBuilder.build();

    final ImmutableMap.Builder<String, List<XPathNode>> collectionsBuilder = ImmutableMap.builder();
    for (final Map.Entry<String, List<Object>> entry : builder.collections.entrySet()) {
      collectionsBuilder.put(entry.getKey(), buildCollection(entry.getValue(), builder));
    }
    collections = collectionsBuilder.build();
    defaultCollection = builder.defaultCollection == null ? null
        : buildCollection(builder.defaultCollection, builder);

    variables = new HashMap<>(builder.variables);
    if (builder.item != null) {
      item = builder.item;
    } else if (root != null) {
      item = root == document ? document : root;
    }
    position = builder.position;
    size = builder.size;
    axis = builder.axis;
  }

  private static List<XPathNode> buildCollection(final List<Object> sources,
      final Builder builder) {
    final List<XPathNode> nodes = new ArrayList<>(sources.size());
    for (final Object source : sources) {
      nodes.add(NodeTrees.build(TreeSource.fromObject(source), builder.namespaces, null, null));
    }
    return ImmutableList.copyOf(nodes);
  }

  /**
   * Copy constructor. The copy shares the trees and registries but has its own focus and its own
   * copy of the variable bindings.
   *
   * @param other the context to copy
   */
  protected XPathContext(final XPathContext other) {
    root = other.root;
    document = other.document;
    namespaces = other.namespaces;
    schema = other.schema;
    documents = other.documents;
    collections = other.collections;
    defaultCollection = other.defaultCollection;
    timezone = other.timezone;
    currentDateTime = other.currentDateTime;
    variables = new HashMap<>(other.variables);
    item = other.item;
    position = other.position;
    size = other.size;
    axis = other.axis;
  }

  /**
   * Creates a copy with an independent focus and independent variable bindings.
   *
   * @return the copy
   */
  public XPathContext copy() {
    return new XPathContext(this);
  }

  /**
   * Determines if this context evaluates expressions against a schema instead of instance data.
   *
   * @return true, for schema contexts
   */
  public boolean isSchemaContext() {
    return false;
  }

  /**
   * Get the root of the tree.
   *
   * @return the root or {@code null}
   */
  public @Nullable ParentNode getRoot() {
    return root;
  }

  /**
   * Get the document of the tree.
   *
   * @return the document, a detached document for element rooted trees, {@code null} for
   *         fragments
   */
  public @Nullable DocumentNode getDocument() {
    return document;
  }

  /**
   * Get the root an absolute path starts from.
   *
   * @return the document of the tree
   * @throws io.treepath.exception.MissingContextException if the context has no tree
   * @throws io.treepath.exception.XPathTypeException XPDY0050 if the tree is a fragment
   */
  public DocumentNode getDocumentRoot() {
    if (document == null) {
      if (root == null) {
        throw EXPathError.XPDY0002.newException("no tree bound to the context");
      }
      throw EXPathError.XPDY0050.newException("the root of the tree is not a document node");
    }
    return document;
  }

  /**
   * Get the parent of a node, as seen from this context. The root of an element rooted tree has
   * no parent.
   *
   * @param node the node
   * @return the parent or {@code null}
   */
  public @Nullable ParentNode getParentOf(final XPathNode node) {
    if (node == root && (document == null || document.isDetached())) {
      return null;
    }
    return node.getParent();
  }

  /**
   * Get the statically known namespaces.
   *
   * @return prefix to URI map
   */
  public Map<String, String> getNamespaces() {
    return namespaces;
  }

  /**
   * Get the bound schema.
   *
   * @return the schema or {@code null}
   */
  public @Nullable SchemaProxy getSchema() {
    return schema;
  }

  /**
   * Get the implicit timezone.
   *
   * @return the timezone offset
   */
  public ZoneOffset getTimezone() {
    return timezone;
  }

  /**
   * Get the current date and time.
   *
   * @return the current date and time
   */
  public OffsetDateTime getCurrentDateTime() {
    return currentDateTime;
  }

  /**
   * Get an available document.
   *
   * @param uri the URI of the document
   * @return the root of the document
   * @throws io.treepath.exception.XPathException FODC0002 if no document is available for the URI
   */
  public ParentNode getAvailableDocument(final String uri) {
    final ParentNode availableDocument = documents.get(uri);
    if (availableDocument == null) {
      throw EXPathError.FODC0002.newException("document " + uri + " is not available");
    }
    return availableDocument;
  }

  /**
   * Get an available collection.
   *
   * @param uri the URI of the collection, {@code null} for the default collection
   * @return the nodes of the collection
   * @throws io.treepath.exception.XPathException FODC0002 if the collection is not available
   */
  public List<XPathNode> getAvailableCollection(final @Nullable String uri) {
    final List<XPathNode> collection = uri == null ? defaultCollection : collections.get(uri);
    if (collection == null) {
      throw EXPathError.FODC0002.newException(
          uri == null ? "the default collection is undefined" : "collection " + uri
              + " is not available");
    }
    return collection;
  }

  /**
   * Get the value of a variable.
   *
   * @param name the variable name
   * @return the bound sequence
   * @throws io.treepath.exception.XPathNameException XPST0008 if the variable is not bound
   */
  public List<Item> getVariable(final String name) {
    final List<Item> value = variables.get(name);
    if (value == null) {
      throw EXPathError.XPST0008.newException("unknown variable $" + name);
    }
    return value;
  }

  /**
   * Binds a variable.
   *
   * @param name the variable name
   * @param value the bound sequence
   */
  public void setVariable(final String name, final List<? extends Item> value) {
    variables.put(requireNonNull(name), ImmutableList.copyOf(value));
  }

  /**
   * Get the variable bindings.
   *
   * @return unmodifiable view of the bindings
   */
  public Map<String, List<Item>> getVariables() {
    return Collections.unmodifiableMap(variables);
  }

  /**
   * Get the context item.
   *
   * @return the item or {@code null}
   */
  public @Nullable Item getItem() {
    return item;
  }

  /**
   * Sets the context item.
   *
   * @param item the item
   */
  public void setItem(final @Nullable Item item) {
    this.item = item;
  }

  /**
   * Get the context position.
   *
   * @return the 1-based position
   */
  public int getPosition() {
    return position;
  }

  /**
   * Sets the context position.
   *
   * @param position the 1-based position
   */
  public void setPosition(final int position) {
    this.position = position;
  }

  /**
   * Get the context size.
   *
   * @return the size
   */
  public int getSize() {
    return size;
  }

  /**
   * Sets the context size.
   *
   * @param size the size
   */
  public void setSize(final int size) {
    this.size = size;
  }

  /**
   * Get the active axis.
   *
   * @return the axis or {@code null} for the default child axis
   */
  public @Nullable Axis getAxis() {
    return axis;
  }

  /**
   * Sets the active axis.
   *
   * @param axis the axis or {@code null}
   */
  public void setAxis(final @Nullable Axis axis) {
    this.axis = axis;
  }

  /**
   * Takes a snapshot of the focus.
   *
   * @return the focus
   */
  public Focus getFocus() {
    return new Focus(item, position, size, axis);
  }

  /**
   * Restores a focus taken before.
   *
   * @param focus the focus
   */
  public void restoreFocus(final Focus focus) {
    item = focus.item();
    position = focus.position();
    size = focus.size();
    axis = focus.axis();
  }

  private void checkItem() {
    if (item == null) {
      throw EXPathError.XPDY0002.newException("the context item is undefined");
    }
  }

  /**
   * The self axis.
   *
   * @return the context item
   */
  public CloseableIterator<Item> iterSelf() {
    checkItem();
    return new SelfAxis(this, Axis.SELF);
  }

  /**
   * The attribute axis.
   *
   * @return the attributes of the context element
   */
  public CloseableIterator<Item> iterAttributes() {
    checkItem();
    return new AttributeAxis(this);
  }

  /**
   * The namespace axis.
   *
   * @return the namespace nodes of the context element
   */
  public CloseableIterator<Item> iterNamespaces() {
    checkItem();
    return new NamespaceAxis(this);
  }

  /**
   * Yields the context item while an axis is active, the children of the context item
   * otherwise. This is how node tests select the nodes of their step.
   *
   * @return the items to test
   */
  public CloseableIterator<Item> iterChildrenOrSelf() {
    checkItem();
    if (axis != null) {
      return new SelfAxis(this, axis);
    }
    return new ChildAxis(this, null);
  }

  /**
   * The explicit child axis.
   *
   * @return the children of the context item
   */
  public CloseableIterator<Item> iterChildren() {
    checkItem();
    return new ChildAxis(this, Axis.CHILD);
  }

  /**
   * The parent axis.
   *
   * @return the parent of the context node
   */
  public CloseableIterator<Item> iterParent() {
    checkItem();
    return new ParentAxis(this);
  }

  /**
   * The sibling axes.
   *
   * @param siblingAxis {@link Axis#FOLLOWING_SIBLING} or {@link Axis#PRECEDING_SIBLING}
   * @return the siblings, nearest first
   */
  public CloseableIterator<Item> iterSiblings(final Axis siblingAxis) {
    checkArgument(siblingAxis == Axis.FOLLOWING_SIBLING || siblingAxis == Axis.PRECEDING_SIBLING,
        "Not a sibling axis: %s", siblingAxis);
    checkItem();
    return siblingAxis == Axis.FOLLOWING_SIBLING ? new FollowingSiblingAxis(this)
        : new PrecedingSiblingAxis(this);
  }

  /**
   * The descendant axes.
   *
   * @param descendantAxis {@link Axis#DESCENDANT}, {@link Axis#DESCENDANT_OR_SELF} or
   *        {@code null} for the focus of an abbreviated {@code //} step, which includes self
   * @return the descendants in document order
   */
  public CloseableIterator<Item> iterDescendants(final @Nullable Axis descendantAxis) {
    checkItem();
    return new DescendantAxis(this,
        descendantAxis == Axis.DESCENDANT ? IncludeSelf.NO : IncludeSelf.YES, descendantAxis);
  }

  /**
   * The ancestor axes.
   *
   * @param ancestorAxis {@link Axis#ANCESTOR} or {@link Axis#ANCESTOR_OR_SELF}
   * @return the ancestors, nearest first
   */
  public CloseableIterator<Item> iterAncestors(final Axis ancestorAxis) {
    checkItem();
    return new AncestorAxis(this,
        ancestorAxis == Axis.ANCESTOR_OR_SELF ? IncludeSelf.YES : IncludeSelf.NO);
  }

  /**
   * The preceding axis.
   *
   * @return the preceding nodes, nearest first
   */
  public CloseableIterator<Item> iterPreceding() {
    checkItem();
    return new PrecedingAxis(this);
  }

  /**
   * The following axis.
   *
   * @return the following nodes in document order
   */
  public CloseableIterator<Item> iterFollowings() {
    checkItem();
    return new FollowingAxis(this);
  }

  /**
   * Iterates an axis by its name.
   *
   * @param navigationAxis the axis
   * @return the items of the axis
   */
  public CloseableIterator<Item> iterAxis(final Axis navigationAxis) {
    return switch (navigationAxis) {
      case SELF -> iterSelf();
      case ATTRIBUTE -> iterAttributes();
      case CHILD -> iterChildren();
      case PARENT -> iterParent();
      case ANCESTOR, ANCESTOR_OR_SELF -> iterAncestors(navigationAxis);
      case DESCENDANT, DESCENDANT_OR_SELF -> iterDescendants(navigationAxis);
      case FOLLOWING -> iterFollowings();
      case FOLLOWING_SIBLING, PRECEDING_SIBLING -> iterSiblings(navigationAxis);
      case PRECEDING -> iterPreceding();
      case NAMESPACE -> iterNamespaces();
    };
  }

  /**
   * Selects the results of an expression on a copy of this context, then iterates them as the
   * focus of this context, setting the context position and size. Positions count down for the
   * results of a reverse axis step, which are in document order.
   *
   * @param token the expression
   * @return the results
   */
  public CloseableIterator<Item> innerFocusSelect(final XPathToken token) {
    final List<Item> results = Sequences.toList(token.select(copy()));
    return iterItems(results, token.isReverseAxis());
  }

  /**
   * Iterates a materialized sequence as the focus of this context.
   *
   * @param items the items
   * @param reverse determines if positions count down
   * @return the items
   */
  public CloseableIterator<Item> iterItems(final List<? extends Item> items,
      final boolean reverse) {
    return new FocusAxis(this, items, reverse);
  }

  /**
   * Iterates the cartesian product of sequences in nested-loop order, binding the members of
   * each tuple to the given variables. Every selector is invoked again for each combination of
   * the preceding variables, so a selector may depend on them.
   *
   * @param selectors creates the sequences, called with this context
   * @param varNames the names of the bound variables, one per selector
   * @return the tuples
   */
  public CloseableIterator<List<Item>> iterProduct(
      final List<Function<XPathContext, ? extends Iterator<? extends Item>>> selectors,
      final List<String> varNames) {
    checkArgument(selectors.size() == varNames.size(),
        "%s selectors for %s variables", selectors.size(), varNames.size());
    final int dimension = selectors.size();
    @SuppressWarnings("unchecked")
    final CloseableIterator<? extends Item>[] iterators = new CloseableIterator[dimension];
    final Item[] product = new Item[dimension];

    return new AbstractCloseableIterator<>() {
      private int k;

      private boolean started;

      @Override
      protected List<Item> advance() {
        if (dimension == 0) {
          return finish();
        }
        if (!started) {
          started = true;
          iterators[0] = Sequences.wrap(selectors.get(0).apply(XPathContext.this));
        }
        while (true) {
          if (iterators[k].hasNext()) {
            final Item value = iterators[k].next();
            product[k] = value;
            setVariable(varNames.get(k), Collections.singletonList(value));
            if (k == dimension - 1) {
              return ImmutableList.copyOf(product);
            }
            k++;
            iterators[k] = Sequences.wrap(selectors.get(k).apply(XPathContext.this));
          } else {
            iterators[k].close();
            iterators[k] = null;
            if (k == 0) {
              return finish();
            }
            k--;
          }
        }
      }

      @Override
      protected void release() {
        for (int i = 0; i < dimension; i++) {
          if (iterators[i] != null) {
            iterators[i].close();
            iterators[i] = null;
          }
        }
      }
    };
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("root", root)
                      .add("item", item)
                      .add("position", position)
                      .add("size", size)
                      .add("axis", axis)
                      .add("variables", variables.keySet())
                      .toString();
  }

  /** Iterates a materialized sequence, moving the whole focus. */
  private static final class FocusAxis extends AbstractAxis {

    /** The items. */
    private final List<? extends Item> items;

    /** Determines if positions count down. */
    private final boolean reverse;

    /** Index of the next item. */
    private int index;

    FocusAxis(final XPathContext context, final List<? extends Item> items,
        final boolean reverse) {
      super(context, null);
      this.items = items;
      this.reverse = reverse;
    }

    @Override
    protected @Nullable Item nextItem() {
      return index < items.size() ? items.get(index++) : null;
    }

    @Override
    protected void moveTo(final Item item) {
      super.moveTo(item);
      getContext().setSize(items.size());
      getContext().setPosition(reverse ? items.size() - index + 1 : index);
    }
  }

  /**
   * Builder of contexts.
   */
  public static class Builder {

    /** The root source. */
    private @Nullable Object root;

    /** The context item. */
    private @Nullable Item item;

    /** URI of the root source. */
    private @Nullable String uri;

    /** Fragment mode of the root source. */
    private @Nullable Boolean fragment;

    /** Statically known namespaces. */
    private final Map<String, String> namespaces = new LinkedHashMap<>();

    /** Variable bindings. */
    private final Map<String, List<Item>> variables = new HashMap<>();

    /** Bound schema. */
    private @Nullable SchemaProxy schema;

    /** Document sources by URI. */
    private final Map<String, Object> documents = new LinkedHashMap<>();

    /** Collection sources by URI. */
    private final Map<String, List<Object>> collections = new LinkedHashMap<>();

    /** Default collection sources. */
    private @Nullable List<Object> defaultCollection;

    /** Implicit timezone. */
    private ZoneOffset timezone = ZoneOffset.UTC;

    /** Current date and time. */
    private @Nullable OffsetDateTime currentDateTime;

    /** Context position. */
    private int position = 1;

    /** Context size. */
    private int size = 1;

    /** Active axis. */
    private @Nullable Axis axis;

    /**
     * Sets the root: a DOM document or element, a node tree, a schema, a schema element
     * declaration or a {@link TreeSource}.
     *
     * @param root the root source
     * @return this builder
     */
    public Builder root(final Object root) {
      this.root = requireNonNull(root);
      return this;
    }

    /**
     * Sets the context item, by default the root.
     *
     * @param item the context item
     * @return this builder
     */
    public Builder item(final Item item) {
      this.item = requireNonNull(item);
      return this;
    }

    /**
     * Sets the URI of the root source.
     *
     * @param uri the URI
     * @return this builder
     */
    public Builder uri(final String uri) {
      this.uri = requireNonNull(uri);
      return this;
    }

    /**
     * Sets the fragment mode of the root source.
     *
     * @param fragment {@code true} to never create a document node, {@code false} to always
     *        create one
     * @return this builder
     */
    public Builder fragment(final boolean fragment) {
      this.fragment = fragment;
      return this;
    }

    /**
     * Adds statically known namespaces.
     *
     * @param namespaces prefix to URI map
     * @return this builder
     */
    public Builder namespaces(final Map<String, String> namespaces) {
      this.namespaces.putAll(namespaces);
      return this;
    }

    /**
     * Binds a variable.
     *
     * @param name the variable name
     * @param value the bound sequence
     * @return this builder
     */
    public Builder variable(final String name, final List<? extends Item> value) {
      variables.put(requireNonNull(name), ImmutableList.copyOf(value));
      return this;
    }

    /**
     * Binds a variable to a single item.
     *
     * @param name the variable name
     * @param value the bound item
     * @return this builder
     */
    public Builder variable(final String name, final Item value) {
      return variable(name, Collections.singletonList(value));
    }

    /**
     * Binds a schema.
     *
     * @param schema the schema proxy
     * @return this builder
     */
    public Builder schema(final SchemaProxy schema) {
      this.schema = requireNonNull(schema);
      return this;
    }

    /**
     * Makes a document available to {@code fn:doc}.
     *
     * @param uri the URI of the document
     * @param source the document source
     * @return this builder
     */
    public Builder document(final String uri, final Object source) {
      documents.put(requireNonNull(uri), requireNonNull(source));
      return this;
    }

    /**
     * Makes a collection available to {@code fn:collection}.
     *
     * @param uri the URI of the collection
     * @param sources the sources of the collection members
     * @return this builder
     */
    public Builder collection(final String uri, final List<?> sources) {
      collections.put(requireNonNull(uri), new ArrayList<>(sources));
      return this;
    }

    /**
     * Sets the default collection.
     *
     * @param sources the sources of the collection members
     * @return this builder
     */
    public Builder defaultCollection(final List<?> sources) {
      defaultCollection = new ArrayList<>(sources);
      return this;
    }

    /**
     * Sets the implicit timezone, UTC by default.
     *
     * @param timezone the timezone offset
     * @return this builder
     */
    public Builder timezone(final ZoneOffset timezone) {
      this.timezone = requireNonNull(timezone);
      return this;
    }

    /**
     * Sets the current date and time, the time of building by default.
     *
     * @param currentDateTime the current date and time
     * @return this builder
     */
    public Builder currentDateTime(final OffsetDateTime currentDateTime) {
      this.currentDateTime = requireNonNull(currentDateTime);
      return this;
    }

    /**
     * Sets the context position.
     *
     * @param position the 1-based position
     * @return this builder
     */
    public Builder position(final int position) {
      checkArgument(position > 0, "position must be positive: %s", position);
      this.position = position;
      return this;
    }

    /**
     * Sets the context size.
     *
     * @param size the size
     * @return this builder
     */
    public Builder size(final int size) {
      checkArgument(size >= 0, "size must not be negative: %s", size);
      this.size = size;
      return this;
    }

    /**
     * Sets the active axis.
     *
     * @param axis the axis
     * @return this builder
     */
    public Builder axis(final Axis axis) {
      this.axis = requireNonNull(axis);
      return this;
    }

    /**
     * Builds the context, building the node trees of all sources.
     *
     * @return the context
     */
    public XPathContext build() {
      return new XPathContext(this);
    }
  }
}
