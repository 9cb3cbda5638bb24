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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * <p>
 * One link of an immutable namespace scope chain. Each element references the link describing every
 * binding visible at that element; the links of its ancestors are shared through {@link #getParent()}.
 * </p>
 *
 * <p>
 * There are three kinds of links:
 * </p>
 *
 * <ul>
 * <li>{@link EmptyNamespaceBinding}, terminating every chain,</li>
 * <li>{@link UnprefixedNamespaceBinding}, declaring the default namespace,</li>
 * <li>{@link PrefixedNamespaceBinding}, binding a prefix to a URI.</li>
 * </ul>
 *
 */
public interface NamespaceBinding {

  /**
   * Get the chain terminator.
   *
   * @return the empty binding
   */
  static NamespaceBinding empty() {
    return EmptyNamespaceBinding.INSTANCE;
  }

  /**
   * The bound prefix.
   *
   * @return the prefix, {@code null} for the empty and the unprefixed binding
   */
  @Nullable
  String getPrefix();

  /**
   * The bound namespace URI.
   *
   * @return the URI, {@code null} for the empty binding
   */
  @Nullable
  String getUri();

  /**
   * The next outer link.
   *
   * @return the parent link, {@code null} only for the empty binding
   */
  @Nullable
  NamespaceBinding getParent();

  /**
   * Determines if this link is the chain terminator.
   *
   * @return {@code true} for the empty binding, {@code false} otherwise
   */
  default boolean isEmpty() {
    return false;
  }

  /**
   * Extends the chain by binding {@code prefix} to {@code uri}.
   *
   * @param prefix the prefix
   * @param uri the namespace URI
   * @return the new innermost link, whose parent is this link
   */
  default NamespaceBinding prefixed(final String prefix, final String uri) {
    return new PrefixedNamespaceBinding(prefix, uri, this);
  }

  /**
   * Extends the chain by declaring the default namespace. An empty {@code uri} resets the default
   * namespace to no namespace.
   *
   * @param uri the namespace URI
   * @return the new innermost link, whose parent is this link
   */
  default NamespaceBinding unprefixed(final String uri) {
    return new UnprefixedNamespaceBinding(uri, this);
  }

  /**
   * Finds the nearest binding of {@code prefix}. The empty prefix matches the nearest unprefixed
   * binding, or the empty binding if no default namespace is declared.
   *
   * @param prefix the prefix to look up, empty for the default namespace
   * @return the binding, or an empty optional if a non-empty prefix is not bound
   */
  default Optional<NamespaceBinding> findByPrefix(final String prefix) {
    requireNonNull(prefix);
    NamespaceBinding current = this;
    for (; !current.isEmpty(); current = current.getParent()) {
      if (prefix.isEmpty()
          ? current.getPrefix() == null
          : prefix.equals(current.getPrefix())) {
        return Optional.of(current);
      }
    }
    return prefix.isEmpty()
        ? Optional.of(current)
        : Optional.empty();
  }

  /**
   * Finds the nearest binding of {@code uri}, prefixed or not.
   *
   * @param uri the namespace URI to look up
   * @return the binding, or an empty optional if {@code uri} is not bound
   */
  default Optional<NamespaceBinding> findByUri(final String uri) {
    requireNonNull(uri);
    for (NamespaceBinding current = this; !current.isEmpty(); current = current.getParent()) {
      if (uri.equals(current.getUri())) {
        return Optional.of(current);
      }
    }
    return Optional.empty();
  }

  /**
   * Lists the bindings visible at this link, outermost first. Bindings shadowed by a nearer binding
   * of the same prefix (or a nearer default namespace declaration) are left out, as is the empty
   * binding.
   *
   * @return the visible bindings
   */
  default ImmutableList<NamespaceBinding> toList() {
    final List<NamespaceBinding> innermostFirst = new ArrayList<>();
    final Set<String> seenPrefixes = new HashSet<>();
    for (NamespaceBinding current = this; !current.isEmpty(); current = current.getParent()) {
      final String prefix = current.getPrefix();
      if (seenPrefixes.add(prefix == null
          ? ""
          : prefix)) {
        innermostFirst.add(current);
      }
    }
    return ImmutableList.copyOf(innermostFirst).reverse();
  }
}
