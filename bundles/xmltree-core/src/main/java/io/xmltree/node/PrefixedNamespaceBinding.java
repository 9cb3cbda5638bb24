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

import com.google.common.base.MoreObjects;
import io.xmltree.settings.Constants;
import io.xmltree.utils.XMLToken;
import java.util.Objects;

/**
 * Binds a prefix to a namespace URI.
 *
 */
public final class PrefixedNamespaceBinding implements NamespaceBinding {

  /** The prefix. */
  private final String prefix;

  /** The namespace URI, never empty. */
  private final String uri;

  /** The next outer link. */
  private final NamespaceBinding parent;

  /**
   * Constructor.
   *
   * @param prefix the prefix, an NCName other than {@code xmlns}
   * @param uri the namespace URI, which must not be empty
   * @param parent the next outer link
   * @throws IllegalArgumentException if the prefix or the URI can't be declared
   */
  public PrefixedNamespaceBinding(final String prefix, final String uri, final NamespaceBinding parent) {
    this.prefix = requireNonNull(prefix);
    this.uri = requireNonNull(uri);
    this.parent = requireNonNull(parent);
    checkArgument(XMLToken.isNCName(prefix), "Invalid prefix: %s", prefix);
    checkArgument(!Constants.XMLNS_PREFIX.equals(prefix), "The prefix xmlns must not be declared!");
    checkArgument(!uri.isEmpty(), "The prefix %s can't be bound to the empty URI!", prefix);
    checkArgument(!"xml".equals(prefix) || Constants.XML_NAMESPACE_URI.equals(uri),
        "The prefix xml can only be bound to %s!", Constants.XML_NAMESPACE_URI);
  }

  @Override
  public String getPrefix() {
    return prefix;
  }

  @Override
  public String getUri() {
    return uri;
  }

  @Override
  public NamespaceBinding getParent() {
    return parent;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof final PrefixedNamespaceBinding other)) {
      return false;
    }
    return prefix.equals(other.prefix) && uri.equals(other.uri) && parent.equals(other.parent);
  }

  @Override
  public int hashCode() {
    return Objects.hash(prefix, uri, parent);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("prefix", prefix).add("uri", uri).add("parent", parent).toString();
  }
}
