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

import static com.google.common.base.Preconditions.checkArgument;
import static io.xmltree.service.xml.serialize.XmlSerializerProperties.S_ENCODING;
import static io.xmltree.service.xml.serialize.XmlSerializerProperties.S_XMLDECL;
import static java.util.Objects.requireNonNull;

import io.xmltree.node.Element;
import io.xmltree.settings.Constants;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 *
 * <p>
 * Serializes an element tree as a document, optionally preceded by an XML declaration, into a
 * {@link Writer}, an {@link OutputStream} or a file. The element tree itself is written by a
 * {@link XmlTreeSerializer}.
 * </p>
 *
 * <p>
 * When writing to a {@link Writer} it is up to the caller to make sure the writer's character
 * encoding matches the encoding of this serializer.
 * </p>
 */
public final class XmlSerializer {

  private static final Logger LOGGER = LoggerFactory.getLogger(XmlSerializer.class);

  /** Name of the encoding. */
  private final String encoding;

  /** The encoding. */
  private final Charset charset;

  /** Serialize XML declaration. */
  private final boolean serializeXMLDeclaration;

  /** Writes the element tree. */
  private final XmlTreeSerializer treeSerializer;

  private XmlSerializer(final XmlSerializerBuilder builder) {
    encoding = builder.encoding;
    charset = Charset.forName(builder.encoding);
    serializeXMLDeclaration = builder.declaration;
    treeSerializer = new XmlTreeSerializer(builder.attributeEncoder, builder.nodeRenderer);
  }

  /**
   * Serialize a document whose root is given, with the XML declaration if this serializer was built
   * with {@link XmlSerializerBuilder#emitXMLDeclaration()}.
   *
   * @param root the root element
   * @param out {@link Writer} to write to
   * @throws IOException if writing fails
   */
  public void serializeDocument(final Element root, final Writer out) throws IOException {
    requireNonNull(root);
    requireNonNull(out);
    if (serializeXMLDeclaration) {
      out.write(Constants.XML_DECLARATION_START);
      out.write(encoding);
      out.write(Constants.XML_DECLARATION_END);
    }
    treeSerializer.serialize(root, out);
  }

  /**
   * Serialize a document whose root is given, using the encoding of this serializer. Characters the
   * encoding can't represent are replaced by its replacement byte sequence. The stream is flushed but
   * not closed, also if serialization fails.
   *
   * @param root the root element
   * @param out {@link OutputStream} to write to
   * @throws IOException if writing fails
   */
  public void serializeDocument(final Element root, final OutputStream out) throws IOException {
    requireNonNull(out);
    final Writer writer = new BufferedWriter(new OutputStreamWriter(out, charset), 4096);
    try {
      serializeDocument(root, writer);
    } catch (final IOException | RuntimeException e) {
      // Hand what was written so far to the stream before failing.
      try {
        writer.flush();
      } catch (final IOException flushFailure) {
        e.addSuppressed(flushFailure);
      }
      throw e;
    }
    writer.flush();
  }

  /**
   * Serialize a document whose root is given into a file, like
   * {@link #serializeDocument(Element, OutputStream)}. The file is created or truncated, and closed on
   * return, also if serialization fails.
   *
   * @param root the root element
   * @param target the file to write
   * @throws IOException if the file can't be opened or writing fails
   */
  public void serializeDocument(final Element root, final Path target) throws IOException {
    requireNonNull(target);
    LOGGER.debug("Serializing '{}' to '{}' ... ", root.getName(), target);
    final long time = System.nanoTime();
    try (final OutputStream out = Files.newOutputStream(target)) {
      serializeDocument(root, out);
    }
    LOGGER.debug(" done [{}ms].", (System.nanoTime() - time) / 1_000_000);
  }

  /**
   * Serialize a document whose root is given into a file.
   *
   * @param root the root element
   * @param target the file to write
   * @throws IOException if the file can't be opened or writing fails
   * @see #serializeDocument(Element, Path)
   */
  public void serializeDocument(final Element root, final File target) throws IOException {
    serializeDocument(root, requireNonNull(target).toPath());
  }

  /**
   * Serialize the element tree only, never with an XML declaration.
   *
   * @param root the root element
   * @param out {@link Writer} to write to
   * @throws IOException if writing fails
   */
  public void serialize(final Element root, final Writer out) throws IOException {
    treeSerializer.serialize(root, out);
  }

  /**
   * Serialize a document whose root is given into a string.
   *
   * @param root the root element
   * @return the document
   */
  public String serializeToString(final Element root) {
    final StringWriter out = new StringWriter();
    try {
      serializeDocument(root, out);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  public String getEncoding() {
    return encoding;
  }

  public boolean isSerializingXMLDeclaration() {
    return serializeXMLDeclaration;
  }

  /**
   * Get a builder with the defaults: UTF-8 and no XML declaration.
   *
   * @return a new {@link XmlSerializerBuilder} instance
   */
  public static XmlSerializerBuilder newBuilder() {
    return new XmlSerializerBuilder();
  }

  /**
   * Get a builder initialized from properties.
   *
   * @param properties {@link XmlSerializerProperties} to use
   * @return a new {@link XmlSerializerBuilder} instance
   */
  public static XmlSerializerBuilder newBuilder(final XmlSerializerProperties properties) {
    return new XmlSerializerBuilder(properties);
  }

  /**
   * XmlSerializerBuilder to set up the XmlSerializer.
   */
  public static final class XmlSerializerBuilder {

    /** Name of the encoding. */
    private String encoding = Constants.DEFAULT_ENCODING.name();

    /** XML declaration. */
    private boolean declaration;

    /** Attribute encoder. */
    private AttributeEncoder attributeEncoder = new QuotingAttributeEncoder();

    /** Renderer of nodes other than elements. */
    private NodeRenderer nodeRenderer = new DefaultNodeRenderer();

    /**
     * Constructor using the defaults.
     */
    public XmlSerializerBuilder() {
    }

    /**
     * Constructor.
     *
     * @param properties {@link XmlSerializerProperties} to use
     */
    public XmlSerializerBuilder(final XmlSerializerProperties properties) {
      final ConcurrentMap<String, Object> map = requireNonNull(properties.getProps());
      encoding((String) requireNonNull(map.get(S_ENCODING[0])));
      declaration = requireNonNull((Boolean) map.get(S_XMLDECL[0]));
    }

    /**
     * Set the encoding.
     *
     * @param encoding the name of a charset supported by this JVM
     * @return this {@link XmlSerializerBuilder} instance
     * @throws IllegalArgumentException if the encoding is not supported
     */
    public XmlSerializerBuilder encoding(final String encoding) {
      requireNonNull(encoding);
      checkArgument(isSupported(encoding), "Unsupported encoding: %s", encoding);
      this.encoding = encoding;
      return this;
    }

    /**
     * Emit an XML declaration.
     *
     * @return this {@link XmlSerializerBuilder} instance
     */
    public XmlSerializerBuilder emitXMLDeclaration() {
      declaration = true;
      return this;
    }

    /**
     * Use another {@link AttributeEncoder}.
     *
     * @param attributeEncoder the encoder
     * @return this {@link XmlSerializerBuilder} instance
     */
    public XmlSerializerBuilder attributeEncoder(final AttributeEncoder attributeEncoder) {
      this.attributeEncoder = requireNonNull(attributeEncoder);
      return this;
    }

    /**
     * Use another {@link NodeRenderer}.
     *
     * @param nodeRenderer the renderer
     * @return this {@link XmlSerializerBuilder} instance
     */
    public XmlSerializerBuilder nodeRenderer(final NodeRenderer nodeRenderer) {
      this.nodeRenderer = requireNonNull(nodeRenderer);
      return this;
    }

    /**
     * Building new {@link XmlSerializer} instance.
     *
     * @return a new {@link XmlSerializer} instance
     */
    public XmlSerializer build() {
      return new XmlSerializer(this);
    }

    private static boolean isSupported(final String encoding) {
      try {
        return Charset.isSupported(encoding);
      } catch (final IllegalArgumentException e) {
        return false;
      }
    }
  }
}
