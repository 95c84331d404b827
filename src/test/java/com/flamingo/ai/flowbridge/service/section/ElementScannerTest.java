package com.flamingo.ai.flowbridge.service.section;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ElementScanner Tests")
class ElementScannerTest {

  @Test
  @DisplayName("Should balance nested same-tag elements")
  void shouldBalanceNestedTags() {
    String html = "<div class=\"a\"><div><div></div></div><br/></div><div>next</div>";

    ElementScanner.Element element = ElementScanner.elementAt(html, 0).orElseThrow();

    assertThat(element.html(html)).isEqualTo("<div class=\"a\"><div><div></div></div><br/></div>");
    assertThat(element.firstClass()).isEqualTo("a");
  }

  @Test
  @DisplayName("Should not treat a longer tag name as the same tag")
  void shouldIgnoreTagsWithSamePrefix() {
    String html = "<section><section-card></section-card></section>";

    assertThat(ElementScanner.elementAt(html, 0).orElseThrow().end()).isEqualTo(html.length());
  }

  @Test
  @DisplayName("Should return empty when the close is missing or no tag starts there")
  void shouldReturnEmpty_whenUnbalanced() {
    assertThat(ElementScanner.elementAt("<section><p>x</p>", 0)).isEmpty();
    assertThat(ElementScanner.elementAt("text <div></div>", 0)).isEmpty();
  }

  @Test
  @DisplayName("Should read classes and id without matching data-class")
  void shouldReadAttributes() {
    String html = "<section data-class=\"nope\" class='hero  dark' id=\"top\"></section>";

    ElementScanner.Element element = ElementScanner.elementAt(html, 0).orElseThrow();

    assertThat(element.classes()).containsExactly("hero", "dark");
    assertThat(element.id()).isEqualTo("top");
    assertThat(ElementScanner.allClassNames("<a class=\"x y\"><b class=\"y z\"></b></a>"))
        .containsExactly("x", "y", "z");
  }

  @Test
  @DisplayName("Should read unquoted class and id values")
  void shouldReadUnquotedAttributes() {
    String html = "<div class=hero-section id=intro><p class=lead>x</p></div>";

    ElementScanner.Element element = ElementScanner.elementAt(html, 0).orElseThrow();

    assertThat(element.firstClass()).isEqualTo("hero-section");
    assertThat(element.id()).isEqualTo("intro");
    assertThat(ElementScanner.allClassNames(element.html(html)))
        .containsExactly("hero-section", "lead");
  }
}
