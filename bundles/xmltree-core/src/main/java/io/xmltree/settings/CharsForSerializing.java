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

/**
 * Holding all character sequences used for building up XML text.
 *
 */
public enum CharsForSerializing {

  /** " ". */
  SPACE(" "),

  /** "&lt;". */
  OPEN("<"),

  /** "&gt;". */
  CLOSE(">"),

  /** "/". */
  SLASH("/"),

  /** ":". */
  COLON(":"),

  /** "=\"". */
  EQUAL_QUOTE("=", "\""),

  /** "\"". */
  QUOTE("\""),

  /** "&lt;/". */
  OPEN_SLASH(OPEN.getValue(), SLASH.getValue()),

  /** "/&gt;". */
  SLASH_CLOSE(SLASH.getValue(), CLOSE.getValue()),

  /** " xmlns=\"". */
  XMLNS(SPACE.getValue(), "xmlns", EQUAL_QUOTE.getValue()),

  /** " xmlns:". */
  XMLNS_COLON(SPACE.getValue(), "xmlns", COLON.getValue()),

  /** "&lt;!--". */
  OPENCOMMENT(OPEN.getValue(), "!--"),

  /** "--&gt;". */
  CLOSECOMMENT("--", CLOSE.getValue()),

  /** "&lt;?". */
  OPENPI(OPEN.getValue(), "?"),

  /** "?&gt;". */
  CLOSEPI("?", CLOSE.getValue()),

  /** "&lt;![CDATA[". */
  OPENCDATA(OPEN.getValue(), "![CDATA["),

  /** "]]&gt;". */
  CLOSECDATA("]]", CLOSE.getValue()),

  /** "&amp;". */
  AMPERSAND("&"),

  /** ";". */
  SEMICOLON(";");

  /** The characters. */
  private final String value;

  /**
   * Private constructor.
   *
   * @param parts the parts, concatenated in order
   */
  CharsForSerializing(final String... parts) {
    value = String.join("", parts);
  }

  /**
   * Getting the characters.
   *
   * @return the characters
   */
  public String getValue() {
    return value;
  }

}
