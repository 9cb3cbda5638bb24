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

package io.xmltree.service.xml.serialize;

import static java.util.Objects.requireNonNull;

import io.xmltree.exception.XmlTreeConfigurationException;
import java.io.BufferedReader;
import java.io.IOException;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 *
 * <p>
 * XmlSerializer properties.
 * </p>
 *
 * <p>
 * Each public {@code S_*} constant holds a key and its default value. The defaults are overridden by
 * {@link #readProps(Path)}.
 * </p>
 *
 */
public final class XmlSerializerProperties {

  private static final Logger LOGGER = LoggerFactory.getLogger(XmlSerializerProperties.class);

  // ============== Class constants. =================

  /** NO maps to false. */
  private static final boolean NO = false;

  // ============ Serialization constants. ===============

  /** Name of the output encoding, also written into the XML declaration. */
  public static final Object[] S_ENCODING = {"encoding", "UTF-8"};

  /** Serialize XML declaration: yes/no. */
  public static final Object[] S_XMLDECL = {"xmldecl", NO};

  /** Properties. */
  private final ConcurrentMap<String, Object> props = new ConcurrentHashMap<>();

  /**
   * Constructor, seeding the properties with the default values.
   */
  public XmlSerializerProperties() {
    for (final Field f : getClass().getFields()) {
      final Object obj;
      try {
        obj = f.get(null);
      } catch (final IllegalAccessException e) {
        throw new IllegalStateException(e);
      }
      if (!(obj instanceof final Object[] arr)) {
        continue;
      }
      props.put(arr[0].toString(), arr[1]);
    }
  }

  /**
   * <p>
   * Read a properties file, overriding the defaults. Format of properties file:
   * </p>
   *
   * <ul>
   * <li>xmldecl=yes (possible values: yes/no/true/false)</li>
   * <li>encoding=UTF-8 (possible values: any charset name)</li>
   * </ul>
   *
   * <p>
   * Blank lines and lines starting with {@code #} are ignored. Keys are case-insensitive. If a key is
   * specified more than once the last value is preserved.
   * </p>
   *
   * @param filePath path to properties file
   * @return ConcurrentMap which holds property key/values
   * @throws XmlTreeConfigurationException if the file can't be read or holds an invalid line
   */
  public ConcurrentMap<String, Object> readProps(final Path filePath) {
    requireNonNull(filePath);
    if (!Files.exists(filePath)) {
      throw new XmlTreeConfigurationException("Properties file %s doesn't exist!", filePath);
    }

    try (final BufferedReader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
      int lineNumber = 0;
      for (String line = reader.readLine(); line != null; line = reader.readLine()) {
        lineNumber++;
        line = line.trim();
        if (line.isEmpty() || line.startsWith("#")) {
          continue;
        }

        final int equals = line.indexOf('=');
        if (equals < 0) {
          throw new XmlTreeConfigurationException("Properties file %s has no '=' sign in line %d!", filePath,
              lineNumber);
        }

        final String key = line.substring(0, equals).trim().toLowerCase(Locale.ROOT);
        final String value = line.substring(equals + 1).trim();
        final Object defaultValue = props.get(key);
        if (defaultValue == null) {
          LOGGER.warn("Ignoring unknown serializer property '{}' in {}.", key, filePath);
        } else if (defaultValue instanceof Boolean) {
          props.put(key, parseBoolean(key, value));
        } else {
          props.put(key, value);
        }
      }
    } catch (final IOException e) {
      throw new XmlTreeConfigurationException(e, "Properties file %s can't be read!", filePath);
    }

    LOGGER.info("Read serializer properties from {}.", filePath);
    return props;
  }

  private static boolean parseBoolean(final String key, final String value) {
    return switch (value.toLowerCase(Locale.ROOT)) {
      case "yes", "true" -> true;
      case "no", "false" -> false;
      default -> throw new XmlTreeConfigurationException("Invalid value '%s' for property '%s' (yes/no expected)!",
          value, key);
    };
  }

  /**
   * Get properties map.
   *
   * @return ConcurrentMap with key/value property pairs.
   */
  public ConcurrentMap<String, Object> getProps() {
    return props;
  }

}
