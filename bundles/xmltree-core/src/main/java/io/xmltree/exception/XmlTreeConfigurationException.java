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

package io.xmltree.exception;

/**
 * Thrown if serializer settings can't be read or hold invalid values.
 *
 */
public class XmlTreeConfigurationException extends RuntimeException {

  /** General ID. */
  private static final long serialVersionUID = 1L;

  /**
   * Constructor.
   *
   * @param message message, formatted with {@link String#format(String, Object...)}
   * @param args arguments referenced by the format specifiers in {@code message}
   */
  public XmlTreeConfigurationException(final String message, final Object... args) {
    super(String.format(message, args));
  }

  /**
   * Constructor.
   *
   * @param cause the cause
   * @param message message, formatted with {@link String#format(String, Object...)}
   * @param args arguments referenced by the format specifiers in {@code message}
   */
  public XmlTreeConfigurationException(final Throwable cause, final String message, final Object... args) {
    super(String.format(message, args), cause);
  }
}
