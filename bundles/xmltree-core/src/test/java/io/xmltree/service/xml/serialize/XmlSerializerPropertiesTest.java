package io.xmltree.service.xml.serialize;

import static io.xmltree.service.xml.serialize.XmlSerializerProperties.S_ENCODING;
import static io.xmltree.service.xml.serialize.XmlSerializerProperties.S_XMLDECL;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.xmltree.exception.XmlTreeConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class XmlSerializerPropertiesTest {

  @TempDir
  Path tempDir;

  @Test
  public void testDefaults() {
    final Map<String, Object> map = new XmlSerializerProperties().getProps();

    assertEquals(2, map.size());
    assertEquals("UTF-8", map.get(S_ENCODING[0]));
    assertEquals(false, map.get(S_XMLDECL[0]));
  }

  @Test
  public void testReadProps() throws IOException {
    final Path file = tempDir.resolve("serializer.properties");
    Files.writeString(file, "# serializer settings\n\n XMLDECL = Yes \nencoding=ISO-8859-1\nxmldecl=true\nunknown=1\n");

    final Map<String, Object> map = new XmlSerializerProperties().readProps(file);

    assertEquals(true, map.get(S_XMLDECL[0]));
    assertEquals("ISO-8859-1", map.get(S_ENCODING[0]));
    assertFalse(map.containsKey("unknown"));
  }

  @Test
  public void testMissingFile() {
    final XmlSerializerProperties properties = new XmlSerializerProperties();

    assertThrows(XmlTreeConfigurationException.class, () -> properties.readProps(tempDir.resolve("missing")));
  }

  @Test
  public void testLineWithoutEqualsSign() throws IOException {
    final Path file = tempDir.resolve("broken.properties");
    Files.writeString(file, "xmldecl=no\nencoding\n");

    final XmlTreeConfigurationException e =
        assertThrows(XmlTreeConfigurationException.class, () -> new XmlSerializerProperties().readProps(file));
    assertEquals("Properties file " + file + " has no '=' sign in line 2!", e.getMessage());
  }

  @Test
  public void testInvalidBoolean() throws IOException {
    final Path file = tempDir.resolve("broken.properties");
    Files.writeString(file, "xmldecl=maybe\n");

    assertThrows(XmlTreeConfigurationException.class, () -> new XmlSerializerProperties().readProps(file));
  }
}
