package io.xmltree.node;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.jupiter.api.Test;

public final class ElementTest {

  @Test
  public void testBuilder() {
    final NamespaceBinding scope = NamespaceBinding.empty().prefixed("p", "urn:p");
    final Element child = Element.newBuilder("child").build();
    final Element element = Element.newBuilder("name")
                                   .prefix("p")
                                   .scope(scope)
                                   .attribute("b", "2")
                                   .attribute(QNm.of("p", "a"), "1")
                                   .child(child)
                                   .text("text")
                                   .build();

    assertEquals(NodeKind.ELEMENT, element.getKind());
    assertEquals("p", element.getPrefix());
    assertEquals("name", element.getName());
    assertSame(scope, element.getScope());
    assertEquals(List.of(QNm.of("b"), QNm.of("p", "a")), element.getAttributes().keySet().asList());
    assertEquals(ImmutableList.of(child, new Text("text")), element.getChildren());
  }

  @Test
  public void testEmptyPrefixMeansNone() {
    assertNull(Element.newBuilder("e").prefix("").build().getPrefix());
    assertSame(NamespaceBinding.empty(), Element.newBuilder("e").build().getScope());
  }

  @Test
  public void testInvalidNames() {
    assertThrows(IllegalArgumentException.class, () -> Element.newBuilder("1abc"));
    assertThrows(IllegalArgumentException.class, () -> Element.newBuilder("a:b"));
    assertThrows(IllegalArgumentException.class, () -> Element.newBuilder("e").prefix("p q"));
    assertThrows(IllegalArgumentException.class,
        () -> Element.newBuilder("e").attribute("a", "1").attribute("a", "2").build());
  }

  @Test
  public void testNamespaceDeclarationsAreNoAttributes() {
    final Element.Builder builder = Element.newBuilder("a").scope(NamespaceBinding.empty().unprefixed("urn:x"));

    assertThrows(IllegalArgumentException.class, () -> builder.attribute("xmlns", "urn:q"));
    assertThrows(IllegalArgumentException.class, () -> builder.attribute(QNm.of("xmlns", "p"), "urn:p"));
    assertThrows(IllegalArgumentException.class, () -> QNm.of("", "xmlns"));
    assertEquals("<a xmlns=\"urn:x\" p:xmlns=\"v\"/>",
        builder.attribute(QNm.of("p", "xmlns"), "v").build().toString());
  }

  @Test
  public void testWithAttributeKeepsPosition() {
    final Element element = Element.newBuilder("e").attribute("a", "1").attribute("b", "2").build();

    final Element replaced = element.withAttribute(QNm.of("a"), "3");
    final Element added = element.withAttribute(QNm.of("c"), "4");

    assertEquals("<e a=\"3\" b=\"2\"/>", replaced.toString());
    assertEquals("<e a=\"1\" b=\"2\" c=\"4\"/>", added.toString());
    assertEquals("<e a=\"1\" b=\"2\"/>", element.toString());
  }

  @Test
  public void testCopies() {
    final Element element = Element.newBuilder("e").text("x").build();

    assertEquals("<e/>", element.withChildren(List.of()).toString());
    assertEquals("<e xmlns=\"urn:d\">x</e>", element.withScope(NamespaceBinding.empty().unprefixed("urn:d")).toString());
    assertEquals(element, element.toBuilder().build());
  }

  @Test
  public void testEqualityRespectsAttributeOrder() {
    final Element ab = Element.newBuilder("e").attribute("a", "1").attribute("b", "2").build();
    final Element ba = Element.newBuilder("e").attribute("b", "2").attribute("a", "1").build();

    assertEquals(ab, Element.newBuilder("e").attribute("a", "1").attribute("b", "2").build());
    assertNotEquals(ab, ba);
  }

  @Test
  public void testOtherNodeValidation() {
    assertThrows(IllegalArgumentException.class, () -> new CData("a]]>b"));
    assertThrows(IllegalArgumentException.class, () -> new Comment("a--b"));
    assertThrows(IllegalArgumentException.class, () -> new Comment("a-"));
    assertThrows(IllegalArgumentException.class, () -> new ProcessingInstruction("XML", "x"));
    assertThrows(IllegalArgumentException.class, () -> new ProcessingInstruction("pi", "a?>"));
    assertThrows(IllegalArgumentException.class, () -> new EntityReference("a b"));
    assertThrows(NullPointerException.class, () -> new Text(null));
  }
}
