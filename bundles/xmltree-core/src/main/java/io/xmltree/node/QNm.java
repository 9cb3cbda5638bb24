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

import io.xmltree.settings.Constants;
import io.xmltree.utils.XMLToken;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The name of an attribute: a local name and an optional prefix. The namespace URI of a prefixed
 * name is resolved through the scope of the owning element.
 *
 */
public final class QNm {

  /** The prefix or {@code null}. */
  private final @Nullable String prefix;

  /** The local name. */
  private final String localName;

  private QNm(final @Nullable String prefix, final String localName) {
    requireNonNull(localName);
    checkArgument(XMLToken.isNCName(localName), "Invalid local name: %s", localName);
    checkArgument(prefix == null || XMLToken.isNCName(prefix), "Invalid prefix: %s", prefix);
    checkArgument(!Constants.XMLNS_PREFIX.equals(prefix), "Namespace declarations are no attributes: %s:%s", prefix,
        localName);
    checkArgument(prefix != null || !Constants.XMLNS_PREFIX.equals(localName),
        "Namespace declarations are no attributes: %s", localName);
    this.prefix = prefix;
    this.localName = localName;
  }

  /**
   * Creates an unprefixed name.
   *
   * @param localName the local name
   * @return the name
   * @throws IllegalArgumentException if {@code localName} is not an NCName or is {@code xmlns}
   */
  public static QNm of(final String localName) {
    return new QNm(null, localName);
  }

  /**
   * Creates a name.
   *
   * @param prefix the prefix, or {@code null} / empty for none
   * @param localName the local name
   * @return the name
   * @throws IllegalArgumentException if {@code prefix} or {@code localName} is not an NCName, or the
   *         name would declare a namespace
   */
  public static QNm of(final @Nullable String prefix, final String localName) {
    return new QNm(prefix == null || prefix.isEmpty()
        ? null
        : prefix, localName);
  }

  public @Nullable String getPrefix() {
    return prefix;
  }

  public String getLocalName() {
    return localName;
  }

  public boolean hasPrefix() {
    return prefix != null;
  }

  /**
   * The name as it is written in a start tag, {@code prefix:localName} or {@code localName}.
   *
   * @return the lexical form of the name
   */
  public String nameForAttribute() {
    return prefix == null
        ? localName
        : prefix + ':' + localName;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof final QNm other)) {
      return false;
    }
    return Objects.equals(prefix, other.prefix) && localName.equals(other.localName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(prefix, localName);
  }

  @Override
  public String toString() {
    return nameForAttribute();
  }
}
