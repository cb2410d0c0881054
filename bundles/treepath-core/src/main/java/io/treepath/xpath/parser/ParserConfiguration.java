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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.treepath.schema.SchemaProxy;

/**
 * Immutable settings of a parser: the statically known namespaces, the default element
 * namespace, the declared variables, the schema binding and the parsing modes.
 */
public final class ParserConfiguration {

  /** Statically known namespaces. */
  private final ImmutableMap<String, String> namespaces;

  /** Default namespace of element names and types. */
  private final @Nullable String defaultNamespace;

  /** Declared variables with their sequence types, {@code null} if not declared. */
  private final @Nullable ImmutableMap<String, String> variableTypes;

  /** The schema binding. */
  private final @Nullable SchemaProxy schema;

  /** Determines if undeclared variables are rejected. */
  private final boolean strict;

  /** XPath 1.0 compatibility mode. */
  private final boolean compatibilityMode;

  private ParserConfiguration(final Builder builder) {
    namespaces = ImmutableMap.copyOf(builder.namespaces);
    defaultNamespace = builder.defaultNamespace;
    variableTypes =
        builder.variableTypes == null ? null : ImmutableMap.copyOf(builder.variableTypes);
    schema = builder.schema;
    strict = builder.strict;
    compatibilityMode = builder.compatibilityMode;
  }

  /**
   * Returns the default settings.
   *
   * @return settings without namespaces and schema
   */
  public static ParserConfiguration defaults() {
    return new Builder().build();
  }

  /**
   * Get the statically known namespaces.
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
    return defaultNamespace;
  }

  /**
   * Get the declared variables.
   *
   * @return map from variable name to sequence type, {@code null} if variables are not declared
   */
  public @Nullable Map<String, String> getVariableTypes() {
    return variableTypes;
  }

  /**
   * Get the schema binding.
   *
   * @return the schema proxy or {@code null}
   */
  public @Nullable SchemaProxy getSchema() {
    return schema;
  }

  /**
   * Determines if references to undeclared variables are static errors.
   *
   * @return true in strict mode
   */
  public boolean isStrict() {
    return strict;
  }

  /**
   * Determines if XPath 1.0 compatibility mode is on.
   *
   * @return true in compatibility mode
   */
  public boolean isCompatibilityMode() {
    return compatibilityMode;
  }

  /**
   * Creates a builder initialized with these settings.
   *
   * @return the builder
   */
  public Builder toBuilder() {
    final Builder builder = new Builder().namespaces(namespaces)
                                         .strict(strict)
                                         .compatibilityMode(compatibilityMode);
    if (defaultNamespace != null) {
      builder.defaultNamespace(defaultNamespace);
    }
    if (variableTypes != null) {
      builder.variableTypes(variableTypes);
    }
    if (schema != null) {
      builder.schema(schema);
    }
    return builder;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("namespaces", namespaces)
                      .add("defaultNamespace", defaultNamespace)
                      .add("variableTypes", variableTypes)
                      .add("schema", schema)
                      .add("strict", strict)
                      .add("compatibilityMode", compatibilityMode)
                      .toString();
  }

  /**
   * Builder of parser settings.
   */
  public static final class Builder {

    private Map<String, String> namespaces = ImmutableMap.of();

    private @Nullable String defaultNamespace;

    private @Nullable Map<String, String> variableTypes;

    private @Nullable SchemaProxy schema;

    private boolean strict;

    private boolean compatibilityMode;

    /**
     * Sets the statically known namespaces.
     *
     * @param namespaces map from prefix to URI
     * @return this builder
     */
    public Builder namespaces(final Map<String, String> namespaces) {
      this.namespaces = checkNotNull(namespaces);
      return this;
    }

    /**
     * Sets the default namespace of element names.
     *
     * @param defaultNamespace the namespace URI
     * @return this builder
     */
    public Builder defaultNamespace(final String defaultNamespace) {
      this.defaultNamespace = checkNotNull(defaultNamespace);
      return this;
    }

    /**
     * Declares the in-scope variables.
     *
     * @param variableTypes map from variable name to sequence type, such as {@code xs:string*}
     * @return this builder
     */
    public Builder variableTypes(final Map<String, String> variableTypes) {
      this.variableTypes = checkNotNull(variableTypes);
      return this;
    }

    /**
     * Binds a schema.
     *
     * @param schema the schema proxy
     * @return this builder
     */
    public Builder schema(final SchemaProxy schema) {
      this.schema = checkNotNull(schema);
      return this;
    }

    /**
     * Sets the strict mode, off by default.
     *
     * @param strict if undeclared variables are rejected when variables are declared
     * @return this builder
     */
    public Builder strict(final boolean strict) {
      this.strict = strict;
      return this;
    }

    /**
     * Sets the XPath 1.0 compatibility mode.
     *
     * @param compatibilityMode the mode
     * @return this builder
     */
    public Builder compatibilityMode(final boolean compatibilityMode) {
      this.compatibilityMode = compatibilityMode;
      return this;
    }

    /**
     * Builds the settings.
     *
     * @return the settings
     */
    public ParserConfiguration build() {
      return new ParserConfiguration(this);
    }
  }
}
