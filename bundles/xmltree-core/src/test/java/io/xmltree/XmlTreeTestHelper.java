package io.xmltree;

import io.xmltree.node.Element;
import io.xmltree.node.NamespaceBinding;
import io.xmltree.node.Node;
import io.xmltree.node.NodeKind;
import io.xmltree.node.QNm;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Attr;
import org.w3c.dom.NamedNodeMap;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Helper to compare the effective namespaces of an element tree with the ones a namespace-aware
 * parser reads back from its serialized form.
 */
public final class XmlTreeTestHelper {

  private XmlTreeTestHelper() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Expanded names of all elements in document order, each followed by the sorted expanded names of
   * its attributes, as resolved through the scope chains of the tree.
   *
   * @param root the root of the tree
   * @return the expanded names
   */
  public static List<String> expandedNames(final Element root) {
    final List<String> names = new ArrayList<>();
    collect(root, names);
    return names;
  }

  private static void collect(final Element element, final List<String> names) {
    final String prefix = element.getPrefix();
    final NamespaceBinding binding = element.getScope()
                                            .findByPrefix(prefix == null
                                                ? ""
                                                : prefix)
                                            .orElseThrow();
    names.add(expand(binding.getUri(), element.getName()));
    final TreeSet<String> attributes = new TreeSet<>();
    for (final QNm name : element.getAttributes().keySet()) {
      final String uri = name.hasPrefix()
          ? element.getScope().findByPrefix(name.getPrefix()).orElseThrow().getUri()
          : null;
      attributes.add(expand(uri, name.getLocalName()));
    }
    names.add(attributes.toString());
    for (final Node child : element.getChildren()) {
      if (child.getKind() == NodeKind.ELEMENT) {
        collect((Element) child, names);
      }
    }
  }

  /**
   * Parses {@code xml} namespace-aware and lists expanded names like {@link #expandedNames(Element)}.
   *
   * @param xml the serialized document or element
   * @return the expanded names
   * @throws ParserConfigurationException if no namespace-aware parser is available
   * @throws SAXException if {@code xml} is not well-formed
   * @throws IOException if reading {@code xml} fails
   */
  public static List<String> parseExpandedNames(final String xml)
      throws ParserConfigurationException, SAXException, IOException {
    final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    final org.w3c.dom.Element root =
        factory.newDocumentBuilder().parse(new InputSource(new StringReader(xml))).getDocumentElement();
    final List<String> names = new ArrayList<>();
    collect(root, names);
    return names;
  }

  private static void collect(final org.w3c.dom.Element element, final List<String> names) {
    names.add(expand(element.getNamespaceURI(), element.getLocalName()));
    final TreeSet<String> attributes = new TreeSet<>();
    final NamedNodeMap map = element.getAttributes();
    for (int i = 0; i < map.getLength(); i++) {
      final Attr attribute = (Attr) map.item(i);
      if (!XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attribute.getNamespaceURI())) {
        attributes.add(expand(attribute.getNamespaceURI(), attribute.getLocalName()));
      }
    }
    names.add(attributes.toString());
    for (org.w3c.dom.Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
      if (child.getNodeType() == org.w3c.dom.Node.ELEMENT_NODE) {
        collect((org.w3c.dom.Element) child, names);
      }
    }
  }

  private static String expand(final String uri, final String localName) {
    return uri == null || uri.isEmpty()
        ? localName
        : '{' + uri + '}' + localName;
  }
}
