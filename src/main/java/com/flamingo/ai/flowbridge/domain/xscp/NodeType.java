package com.flamingo.ai.flowbridge.domain.xscp;

/** Node type labels as written to the {@code type} field. */
public enum NodeType {
  BLOCK("Block"),
  SECTION("Section"),
  HEADING("Heading"),
  PARAGRAPH("Paragraph"),
  LINK("Link"),
  IMAGE("Image"),
  VIDEO("Video"),
  LIST("List"),
  LIST_ITEM("ListItem"),
  HTML_EMBED("HtmlEmbed");

  private final String label;

  NodeType(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /** Maps a normalized source tag to its node type. */
  public static NodeType fromTag(String tag) {
    return switch (tag) {
      case "section" -> SECTION;
      case "h1", "h2", "h3", "h4", "h5", "h6" -> HEADING;
      case "p" -> PARAGRAPH;
      case "a" -> LINK;
      case "img" -> IMAGE;
      case "video" -> VIDEO;
      case "ul", "ol" -> LIST;
      case "li" -> LIST_ITEM;
      default -> BLOCK;
    };
  }
}
