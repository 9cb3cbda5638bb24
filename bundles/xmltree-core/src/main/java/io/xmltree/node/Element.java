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

package io.xmltree.node;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.xmltree.service.xml.serialize.XmlTreeSerializer;
import io.xmltree.utils.XMLToken;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * <p>
 * An immutable element. Besides its name, attributes and children an element references the
 * {@link NamespaceBinding} chain of every namespace binding visible at the element, inherited ones
 * included. Children built below an element usually share that chain as the tail of their own.
 * </p>
 *
 * <p>
 * Attributes keep their insertion order, which is the order they are serialized in.
 * </p>
 *
 */
public final class Element implements Node {

  /** The prefix of the element name or {@code null}. */
  private final @Nullable String prefix;

  /** The local name. */
  private final String name;

  /** Attributes in insertion order. */
  private final ImmutableMap<QNm, String> attributes;

  /** Namespace bindings visible at this element. */
  private final NamespaceBinding scope;

  /** The child nodes. */
  private final ImmutableList<Node> children;

  private Element(final @Nullable String prefix, final String name, final ImmutableMap<QNm, String> attributes,
      final NamespaceBinding scope, final ImmutableList<Node> children) {
    this.prefix = prefix;
    this.name = name;
    this.attributes = attributes;
    this.scope = scope;
    this.children = children;
  }

  /**
   * Get a new builder for an element.
   *
   * @param name the local name
   * @return a new {@link Builder} instance
   */
  public static Builder newBuilder(final String name) {
    return new Builder(name);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ELEMENT;
  }

  public @Nullable String getPrefix() {
    return prefix;
  }

  public String getName() {
    return name;
  }

  public ImmutableMap<QNm, String> getAttributes() {
    return attributes;
  }

  public NamespaceBinding getScope() {
    return scope;
  }

  public ImmutableList<Node> getChildren() {
    return children;
  }

  /**
   * Get a builder initialized with the state of this element.
   *
   * @return a new {@link Builder} instance
   */
  public Builder toBuilder() {
    return new Builder(name).prefix(prefix).attributes(attributes).scope(scope).children(children);
  }

  /**
   * Copy of this element with other children.
   *
   * @param newChildren the children of the copy
   * @return the copy
   */
  public Element withChildren(final Iterable<? extends Node> newChildren) {
    return new Element(prefix, name, attributes, scope, ImmutableList.copyOf(newChildren));
  }

  /**
   * Copy of this element with another scope.
   *
   * @param newScope the namespace bindings of the copy
   * @return the copy
   */
  public Element withScope(final NamespaceBinding newScope) {
    return new Element(prefix, name, attributes, requireNonNull(newScope), children);
  }

  /**
   * Copy of this element with an attribute added, or replaced in place if the name already exists.
   *
   * @param attributeName the attribute name
   * @param value the attribute value
   * @return the copy
   */
  public Element withAttribute(final QNm attributeName, final String value) {
    requireNonNull(attributeName);
    requireNonNull(value);
    final ImmutableMap.Builder<QNm, String> builder = ImmutableMap.builderWithExpectedSize(attributes.size() + 1);
    boolean replaced = false;
    for (final Map.Entry<QNm, String> attribute : attributes.entrySet()) {
      if (attribute.getKey().equals(attributeName)) {
        builder.put(attributeName, value);
        replaced = true;
      } else {
        builder.put(attribute);
      }
    }
    if (!replaced) {
      builder.put(attributeName, value);
    }
    return new Element(prefix, name, builder.buildOrThrow(), scope, children);
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof final Element other)) {
      return false;
    }
    return Objects.equals(prefix, other.prefix) && name.equals(other.name)
        && attributes.entrySet().asList().equals(other.attributes.entrySet().asList()) && scope.equals(other.scope)
        && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(prefix, name, attributes, scope, children);
  }

  /**
   * The serialized form of this element and its descendants, without XML declaration.
   */
  @Override
  public String toString() {
    return new XmlTreeSerializer().serializeToString(this);
  }

  /**
   * Builder to set up an {@link Element}.
   */
  public static final class Builder {

    /** The local name. */
    private final String name;

    /** The prefix. */
    private @Nullable String prefix;

    /** Attributes in insertion order. */
    private final ImmutableMap.Builder<QNm, String> attributes = ImmutableMap.builder();

    /** The scope, empty if not set. */
    private NamespaceBinding scope = NamespaceBinding.empty();

    /** The children. */
    private final ImmutableList.Builder<Node> children = ImmutableList.builder();

    private Builder(final String name) {
      this.name = requireNonNull(name);
      checkArgument(XMLToken.isNCName(name), "Invalid element name: %s", name);
    }

    /**
     * Set the prefix of the element name.
     *
     * @param prefix the prefix, {@code null} or empty for none
     * @return this {@link Builder} instance
     */
    public Builder prefix(final @Nullable String prefix) {
      checkArgument(prefix == null || prefix.isEmpty() || XMLToken.isNCName(prefix), "Invalid prefix: %s", prefix);
      this.prefix = prefix == null || prefix.isEmpty()
          ? null
          : prefix;
      return this;
    }

    /**
     * Add an unprefixed attribute.
     *
     * @param attributeName the local name
     * @param value the value
     * @return this {@link Builder} instance
     */
    public Builder attribute(final String attributeName, final String value) {
      return attribute(QNm.of(attributeName), value);
    }

    /**
     * Add an attribute.
     *
     * @param attributeName the name
     * @param value the value
     * @return this {@link Builder} instance
     */
    public Builder attribute(final QNm attributeName, final String value) {
      attributes.put(requireNonNull(attributeName), requireNonNull(value));
      return this;
    }

    /**
     * Add attributes in iteration order.
     *
     * @param newAttributes the attributes
     * @return this {@link Builder} instance
     */
    public Builder attributes(final Map<QNm, String> newAttributes) {
      attributes.putAll(newAttributes);
      return this;
    }

    /**
     * Set the namespace bindings visible at the element.
     *
     * @param scope the innermost link of the chain
     * @return this {@link Builder} instance
     */
    public Builder scope(final NamespaceBinding scope) {
      this.scope = requireNonNull(scope);
      return this;
    }

    /**
     * Append a child.
     *
     * @param child the child
     * @return this {@link Builder} instance
     */
    public Builder child(final Node child) {
      children.add(requireNonNull(child));
      return this;
    }

    /**
     * Append children in iteration order.
     *
     * @param newChildren the children
     * @return this {@link Builder} instance
     */
    public Builder children(final Iterable<? extends Node> newChildren) {
      children.addAll(newChildren);
      return this;
    }

    /**
     * Append a text child.
     *
     * @param text the character data
     * @return this {@link Builder} instance
     */
    public Builder text(final String text) {
      return child(new Text(text));
    }

    /**
     * Build the element.
     *
     * @return the new {@link Element} instance
     * @throws IllegalArgumentException if an attribute name was added twice
     */
    public Element build() {
      return new Element(prefix, name, attributes.buildOrThrow(), scope, children.build());
    }
  }
}
