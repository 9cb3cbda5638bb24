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

package io.xmltree.utils;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Utility methods for XML names and character escaping.
 * </p>
 */
public final class XMLToken {

  /**
   * Hidden constructor.
   */
  private XMLToken() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Checks if the specified character is a name start character, as required e.g. by QName and
   * NCName.
   *
   * @param ch character
   * @return result of check
   */
  public static boolean isNCStartChar(final int ch) {
    return ch < 0x80
        ? ch >= 'A' && ch <= 'Z' || ch >= 'a' && ch <= 'z' || ch == '_'
        : ch < 0x300
            ? ch >= 0xC0 && ch != 0xD7 && ch != 0xF7
            : ch >= 0x370 && ch <= 0x37D || ch >= 0x37F && ch <= 0x1FFF || ch >= 0x200C && ch <= 0x200D
                || ch >= 0x2070 && ch <= 0x218F || ch >= 0x2C00 && ch <= 0x2EFF || ch >= 0x3001 && ch <= 0xD7FF
                || ch >= 0xF900 && ch <= 0xFDCF || ch >= 0xFDF0 && ch <= 0xFFFD || ch >= 0x10000 && ch <= 0xEFFFF;
  }

  /**
   * Checks if the specified character is an XML letter.
   *
   * @param ch character
   * @return result of check
   */
  public static boolean isNCChar(final int ch) {
    return isNCStartChar(ch) || (ch < 0x100
        ? digit(ch) || ch == '-' || ch == '.' || ch == 0xB7
        : ch >= 0x300 && ch <= 0x36F || ch == 0x203F || ch == 0x2040);
  }

  /**
   * Checks if the specified string is a valid NCName, that is a name without a colon.
   *
   * @param value value to be checked
   * @return result of check
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public static boolean isNCName(final String value) {
    requireNonNull(value);
    if (value.isEmpty()) {
      return false;
    }
    for (int i = 0; i < value.length(); ) {
      final int cp = value.codePointAt(i);
      if (i == 0
          ? !isNCStartChar(cp)
          : !isNCChar(cp)) {
        return false;
      }
      i += Character.charCount(cp);
    }
    return true;
  }

  /**
   * Checks if the specified character is a digit (0 - 9).
   *
   * @param ch the letter to be checked
   * @return result of comparison
   */
  public static boolean digit(final int ch) {
    return ch >= '0' && ch <= '9';
  }

  /**
   * Escape characters not allowed in an attribute value delimited by {@code quote}. The other quote
   * character is kept as is. Tab, line feed and carriage return become character references, so
   * attribute value normalization keeps them.
   *
   * @param value the string value to escape
   * @param quote the delimiting quote character, either {@code '"'} or {@code '\''}
   * @return escaped value
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public static String escapeAttribute(final String value, final char quote) {
    requireNonNull(value);
    final StringBuilder escape = new StringBuilder(value.length());
    for (final char i : value.toCharArray()) {
      switch (i) {
        case '&' -> escape.append("&amp;");
        case '<' -> escape.append("&lt;");
        case '>' -> escape.append("&gt;");
        case '\t' -> escape.append("&#9;");
        case '\n' -> escape.append("&#10;");
        case '\r' -> escape.append("&#13;");
        case '"' -> escape.append(quote == '"'
            ? "&quot;"
            : "\"");
        case '\'' -> escape.append(quote == '\''
            ? "&apos;"
            : "'");
        default -> escape.append(i);
      }
    }
    return escape.toString();
  }

  /**
   * Escape characters not allowed in text content.
   *
   * @param value the string value to escape
   * @return escaped value
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public static String escapeContent(final String value) {
    requireNonNull(value);
    final StringBuilder escape = new StringBuilder(value.length());
    for (final char i : value.toCharArray()) {
      switch (i) {
        case '&' -> escape.append("&amp;");
        case '<' -> escape.append("&lt;");
        case '>' -> escape.append("&gt;");
        default -> escape.append(i);
      }
    }
    return escape.toString();
  }
}
