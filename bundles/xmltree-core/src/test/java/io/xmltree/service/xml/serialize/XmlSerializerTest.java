package io.xmltree.service.xml.serialize;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.xmltree.node.Element;
import io.xmltree.node.NamespaceBinding;
import io.xmltree.node.NodeKind;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class XmlSerializerTest {

  private static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>";

  private static final Element DOCUMENT = Element.newBuilder("a")
                                                 .scope(NamespaceBinding.empty().unprefixed("urn:x"))
                                                 .child(Element.newBuilder("b").text("café").build())
                                                 .build();

  @TempDir
  Path tempDir;

  @Test
  public void testDefaults() {
    final XmlSerializer serializer = XmlSerializer.newBuilder().build();

    assertEquals("UTF-8", serializer.getEncoding());
    assertFalse(serializer.isSerializingXMLDeclaration());
    assertEquals("<a xmlns=\"urn:x\"><b xmlns=\"\">café</b></a>", serializer.serializeToString(DOCUMENT));
  }

  @Test
  public void testXMLDeclaration() throws IOException {
    final XmlSerializer serializer = XmlSerializer.newBuilder().emitXMLDeclaration().build();
    final StringWriter out = new StringWriter();

    serializer.serializeDocument(DOCUMENT, out);

    assertEquals(DECLARATION + "<a xmlns=\"urn:x\"><b xmlns=\"\">café</b></a>", out.toString());
  }

  @Test
  public void testSerializeNeverWritesDeclaration() throws IOException {
    final XmlSerializer serializer = XmlSerializer.newBuilder().emitXMLDeclaration().build();
    final StringWriter out = new StringWriter();
    out.write("<wrapper>");

    serializer.serialize(Element.newBuilder("fragment").build(), out);
    out.write("</wrapper>");

    assertEquals("<wrapper><fragment/></wrapper>", out.toString());
  }

  @Test
  public void testOutputStreamUsesEncoding() throws IOException {
    final XmlSerializer serializer = XmlSerializer.newBuilder().encoding("ISO-8859-1").emitXMLDeclaration().build();
    final ByteArrayOutputStream out = new ByteArrayOutputStream();

    serializer.serializeDocument(DOCUMENT, out);

    final byte[] bytes = out.toByteArray();
    assertEquals("<?xml version=\"1.0\" encoding=\"ISO-8859-1\" standalone=\"yes\"?>"
        + "<a xmlns=\"urn:x\"><b xmlns=\"\">café</b></a>", new String(bytes, StandardCharsets.ISO_8859_1));
    // One byte for the e acute.
    assertEquals(bytes.length, new String(bytes, StandardCharsets.ISO_8859_1).length());
  }

  @Test
  public void testFile() throws IOException {
    final XmlSerializer serializer = XmlSerializer.newBuilder().emitXMLDeclaration().build();
    final Path target = tempDir.resolve("out.xml");

    serializer.serializeDocument(DOCUMENT, target.toFile());

    assertEquals(DECLARATION + "<a xmlns=\"urn:x\"><b xmlns=\"\">café</b></a>",
        Files.readString(target, StandardCharsets.UTF_8));
  }

  @Test
  public void testFileIsClosedWhenSerializationFails() throws IOException {
    final NodeRenderer failing = (node, out) -> {
      throw new IOException("Can't render " + node.getKind());
    };
    final XmlSerializer serializer = XmlSerializer.newBuilder().nodeRenderer(failing).build();
    final Path target = tempDir.resolve("partial.xml");
    final Element root = Element.newBuilder("a").child(Element.newBuilder("b").build()).text("boom").build();

    final IOException thrown = assertThrows(IOException.class, () -> serializer.serializeDocument(root, target));

    assertEquals("Can't render " + NodeKind.TEXT, thrown.getMessage());
    // Output written before the failure is kept.
    assertEquals("<a><b/>", Files.readString(target, StandardCharsets.UTF_8));
    Files.delete(target);
    assertFalse(Files.exists(target));
  }

  @Test
  public void testUnencodableCharactersAreReplacedForEveryDestination() throws IOException {
    final XmlSerializer serializer = XmlSerializer.newBuilder().encoding("US-ASCII").build();
    final Element root = Element.newBuilder("a").text("café").build();
    final ByteArrayOutputStream stream = new ByteArrayOutputStream();
    final Path target = tempDir.resolve("ascii.xml");

    serializer.serializeDocument(root, stream);
    serializer.serializeDocument(root, target);

    assertEquals("<a>caf?</a>", new String(stream.toByteArray(), StandardCharsets.US_ASCII));
    assertArrayEquals(stream.toByteArray(), Files.readAllBytes(target));
  }

  @Test
  public void testStreamIsFlushedWhenSerializationFails() {
    final NodeRenderer failing = (node, out) -> {
      throw new IOException("Can't render " + node.getKind());
    };
    final XmlSerializer serializer = XmlSerializer.newBuilder().nodeRenderer(failing).build();
    final ByteArrayOutputStream out = new ByteArrayOutputStream();

    assertThrows(IOException.class,
        () -> serializer.serializeDocument(Element.newBuilder("a").text("boom").build(), out));

    assertEquals("<a>", out.toString(StandardCharsets.UTF_8));
  }

  @Test
  public void testUnsupportedEncoding() {
    assertThrows(IllegalArgumentException.class, () -> XmlSerializer.newBuilder().encoding("no-such-charset"));
    assertThrows(IllegalArgumentException.class, () -> XmlSerializer.newBuilder().encoding("in valid"));
  }

  @Test
  public void testBuilderFromProperties() throws IOException {
    final Path file = tempDir.resolve("serializer.properties");
    Files.writeString(file, "xmldecl=yes\nencoding=UTF-16\n");
    final XmlSerializerProperties properties = new XmlSerializerProperties();
    properties.readProps(file);

    final XmlSerializer serializer = XmlSerializer.newBuilder(properties).build();

    assertEquals("UTF-16", serializer.getEncoding());
    assertTrue(serializer.isSerializingXMLDeclaration());
    assertTrue(serializer.serializeToString(Element.newBuilder("r").build())
                         .startsWith("<?xml version=\"1.0\" encoding=\"UTF-16\""));
  }
}
