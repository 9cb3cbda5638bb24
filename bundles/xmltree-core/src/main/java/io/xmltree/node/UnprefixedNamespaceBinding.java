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

import com.google.common.base.MoreObjects;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Declares the default namespace. An empty URI resets the default namespace to no namespace.
 *
 */
public final class UnprefixedNamespaceBinding implements NamespaceBinding {

  /** The namespace URI. */
  private final String uri;

  /** The next outer link. */
  private final NamespaceBinding parent;

  /**
   * Constructor.
   *
   * @param uri the namespace URI, possibly empty
   * @param parent the next outer link
   */
  public UnprefixedNamespaceBinding(final String uri, final NamespaceBinding parent) {
    this.uri = requireNonNull(uri);
    this.parent = requireNonNull(parent);
  }

  @Override
  public @Nullable String getPrefix() {
    return null;
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
    if (!(obj instanceof final UnprefixedNamespaceBinding other)) {
      return false;
    }
    return uri.equals(other.uri) && parent.equals(other.parent);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uri, parent);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("uri", uri).add("parent", parent).toString();
  }
}
