package io.xmltree.service.xml.serialize;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.xmltree.node.QNm;
import org.junit.jupiter.api.Test;

public final class QuotingAttributeEncoderTest {

  private final AttributeEncoder encoder = new QuotingAttributeEncoder();

  @Test
  public void testDoubleQuotesByDefault() {
    assertEquals("id=\"a &lt; b\"", encoder.encode(QNm.of("id"), "a < b"));
    assertEquals("p:id=\"it's\"", encoder.encode(QNm.of("p", "id"), "it's"));
  }

  @Test
  public void testSingleQuotesForDoubleQuotedValue() {
    assertEquals("title='say \"hi\"'", encoder.encode(QNm.of("title"), "say \"hi\""));
  }

  @Test
  public void testBothQuotes() {
    assertEquals("title=\"&quot;it's&quot;\"", encoder.encode(QNm.of("title"), "\"it's\""));
  }
}
