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

import com.google.common.base.Joiner;
import com.google.common.collect.Iterables;
import io.xmltree.node.Element;
import io.xmltree.node.NamespaceBinding;
import io.xmltree.node.Node;
import io.xmltree.node.NodeKind;
import io.xmltree.node.PrefixedNamespaceBinding;
import io.xmltree.node.UnprefixedNamespaceBinding;
import io.xmltree.settings.CharsForSerializing;
import io.xmltree.utils.XMLToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Serializes an element tree into its textual form, depth-first.
 * </p>
 *
 * <p>
 * Namespace declarations are written only where a binding is new relative to the declarations
 * already written by an ancestor: a prefixed binding is declared unless the nearest ancestor declaring
 * its prefix declared the same URI, and the default namespace is declared whenever it differs from
 * the one in effect at the parent (including {@code xmlns=""} to reset it). Sibling subtrees never
 * see each other's declarations.
 * </p>
 *
 * <p>
 * Instances are immutable and may be shared; the declaration state lives in a {@link TreeWalk}
 * owned by a single call.
 * </p>
 */
public final class XmlTreeSerializer {

  private static final Logger LOGGER = LoggerFactory.getLogger(XmlTreeSerializer.class);

  private static final Joiner ATTRIBUTE_JOINER = Joiner.on(CharsForSerializing.SPACE.getValue());

  /** Renders ordinary attributes. */
  private final AttributeEncoder attributeEncoder;

  /** Renders all nodes but elements. */
  private final NodeRenderer nodeRenderer;

  /**
   * Constructor using the {@link QuotingAttributeEncoder} and the {@link DefaultNodeRenderer}.
   */
  public XmlTreeSerializer() {
    this(new QuotingAttributeEncoder(), new DefaultNodeRenderer());
  }

  /**
   * Constructor.
   *
   * @param attributeEncoder renders ordinary attributes
   * @param nodeRenderer renders all nodes but elements
   */
  public XmlTreeSerializer(final AttributeEncoder attributeEncoder, final NodeRenderer nodeRenderer) {
    this.attributeEncoder = requireNonNull(attributeEncoder);
    this.nodeRenderer = requireNonNull(nodeRenderer);
  }

  /**
   * Serialize {@code root} and its descendants. Nothing but the element tree is written, so the
   * output may be embedded into a larger stream.
   *
   * @param root the root of the tree
   * @param out the sink to append to
   * @throws IOException if writing to {@code out} fails; output written so far is left as is
   */
  public void serialize(final Element root, final Writer out) throws IOException {
    requireNonNull(root);
    requireNonNull(out);
    new TreeWalk(out).emitElement(root);
  }

  /**
   * Serialize {@code root} and its descendants into a string.
   *
   * @param root the root of the tree
   * @return the serialized tree
   */
  public String serializeToString(final Element root) {
    final StringWriter out = new StringWriter();
    try {
      serialize(root, out);
    } catch (final IOException e) {
      // Only a custom NodeRenderer can fail here.
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  /**
   * State of one serialization: two stacks with one entry per open element.
   */
  private final class TreeWalk {

    /** Writer to append to. */
    private final Writer out;

    /** Prefix to URI declarations written on each open element, innermost first. */
    private final Deque<Map<String, String>> declaredBindings = new ArrayDeque<>();

    /**
     * Default namespace changes of each open element, innermost first. Present if the element
     * changed the default namespace, empty if it inherited it.
     */
    private final Deque<Optional<String>> defaultOverrides = new ArrayDeque<>();

    TreeWalk(final Writer out) {
      this.out = out;
    }

    private void emitNode(final Node node) throws IOException {
      if (node.getKind() == NodeKind.ELEMENT) {
        emitElement((Element) node);
      } else {
        nodeRenderer.render(node, out);
      }
    }

    void emitElement(final Element element) throws IOException {
      final String prefix = element.getPrefix();
      final NamespaceBinding ownBinding = element.getScope()
                                                 .findByPrefix(prefix == null
                                                     ? ""
                                                     : prefix)
                                                 .orElseGet(() -> unboundPrefix(element));

      // Decide the qualified name and the default namespace declaration, if any.
      final String qName;
      final @Nullable String defaultNamespace;
      if (ownBinding instanceof final PrefixedNamespaceBinding prefixed) {
        qName = prefixed.getPrefix() + CharsForSerializing.COLON.getValue() + element.getName();
        defaultNamespace = null;
      } else {
        qName = element.getName();
        final String uri = ownBinding instanceof final UnprefixedNamespaceBinding unprefixed
            ? unprefixed.getUri()
            : "";
        defaultNamespace = uri.equals(currentDefaultUri())
            ? null
            : uri;
      }

      final Map<String, String> newDeclarations = new LinkedHashMap<>();
      for (final NamespaceBinding binding : element.getScope().toList()) {
        if (binding instanceof final PrefixedNamespaceBinding prefixed
            && !isDeclared(prefixed.getPrefix(), prefixed.getUri())) {
          newDeclarations.put(prefixed.getPrefix(), prefixed.getUri());
        }
      }

      defaultOverrides.push(Optional.ofNullable(defaultNamespace));
      declaredBindings.push(newDeclarations);
      try {
        out.write(CharsForSerializing.OPEN.getValue());
        out.write(qName);
        if (defaultNamespace != null) {
          out.write(CharsForSerializing.XMLNS.getValue());
          out.write(XMLToken.escapeAttribute(defaultNamespace, '"'));
          out.write(CharsForSerializing.QUOTE.getValue());
        }
        for (final Map.Entry<String, String> declaration : newDeclarations.entrySet()) {
          out.write(CharsForSerializing.XMLNS_COLON.getValue());
          out.write(declaration.getKey());
          out.write(CharsForSerializing.EQUAL_QUOTE.getValue());
          out.write(XMLToken.escapeAttribute(declaration.getValue(), '"'));
          out.write(CharsForSerializing.QUOTE.getValue());
        }
        if (!element.getAttributes().isEmpty()) {
          out.write(CharsForSerializing.SPACE.getValue());
          out.write(ATTRIBUTE_JOINER.join(Iterables.transform(element.getAttributes().entrySet(),
              attribute -> attributeEncoder.encode(attribute.getKey(), attribute.getValue()))));
        }

        if (element.getChildren().isEmpty()) {
          out.write(CharsForSerializing.SLASH_CLOSE.getValue());
        } else {
          out.write(CharsForSerializing.CLOSE.getValue());
          for (final Node child : element.getChildren()) {
            emitNode(child);
          }
          out.write(CharsForSerializing.OPEN_SLASH.getValue());
          out.write(qName);
          out.write(CharsForSerializing.CLOSE.getValue());
        }
      } finally {
        declaredBindings.pop();
        defaultOverrides.pop();
      }
    }

    private NamespaceBinding unboundPrefix(final Element element) {
      LOGGER.debug("Prefix '{}' of element '{}' is not bound, writing the element without prefix.",
          element.getPrefix(), element.getName());
      return NamespaceBinding.empty();
    }

    private String currentDefaultUri() {
      for (final Optional<String> override : defaultOverrides) {
        if (override.isPresent()) {
          return override.get();
        }
      }
      return "";
    }

    // The nearest ancestor declaring the prefix decides, however far up it is.
    private boolean isDeclared(final String prefix, final String uri) {
      for (final Map<String, String> level : declaredBindings) {
        final String declaredUri = level.get(prefix);
        if (declaredUri != null) {
          return declaredUri.equals(uri);
        }
      }
      return false;
    }
  }
}
