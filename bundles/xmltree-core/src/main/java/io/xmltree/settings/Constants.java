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

package io.xmltree.settings;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Interface to hold all constants of the serializer.
 *
 */
public final class Constants {

  /** Default encoding. */
  public static final Charset DEFAULT_ENCODING = StandardCharsets.UTF_8;

  /** Start of the XML declaration, followed by the encoding name. */
  public static final String XML_DECLARATION_START = "<?xml version=\"1.0\" encoding=\"";

  /** End of the XML declaration. */
  public static final String XML_DECLARATION_END = "\" standalone=\"yes\"?>";

  /** Namespace URI of the {@code xml} prefix. */
  public static final String XML_NAMESPACE_URI = "http://www.w3.org/XML/1998/namespace";

  /** The {@code xmlns} prefix, which may never be bound. */
  public static final String XMLNS_PREFIX = "xmlns";

  /** Hidden constructor. */
  private Constants() {
    throw new AssertionError("May never be instantiated!");
  }

}
