package io.xmltree.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public final class XMLTokenTest {

  @Test
  public void testIsNCName() {
    assertTrue(XMLToken.isNCName("a"));
    assertTrue(XMLToken.isNCName("_a-b.c1"));
    assertTrue(XMLToken.isNCName("élément"));
    assertFalse(XMLToken.isNCName(""));
    assertFalse(XMLToken.isNCName("1a"));
    assertFalse(XMLToken.isNCName("-a"));
    assertFalse(XMLToken.isNCName("a:b"));
    assertFalse(XMLToken.isNCName("a b"));
  }

  @Test
  public void testEscapeAttribute() {
    assertEquals("&lt;a&gt; &amp; &quot;b&quot; 'c'", XMLToken.escapeAttribute("<a> & \"b\" 'c'", '"'));
    assertEquals("\"b\" &apos;c&apos;", XMLToken.escapeAttribute("\"b\" 'c'", '\''));
  }

  @Test
  public void testEscapeAttributeWhitespace() {
    assertEquals("a&#9;b&#10;c&#13;&#10;d e", XMLToken.escapeAttribute("a\tb\nc\r\nd e", '"'));
  }

  @Test
  public void testEscapeContentKeepsWhitespace() {
    assertEquals("a\tb\nc", XMLToken.escapeContent("a\tb\nc"));
  }

  @Test
  public void testEscapeContent() {
    assertEquals("a &lt; b &amp;&amp; c &gt; \"d\"", XMLToken.escapeContent("a < b && c > \"d\""));
  }
}
