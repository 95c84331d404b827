package com.flamingo.ai.flowbridge.service.safety;

/** Raw embed strings that travel with a document. Any of them may be null. */
public record EmbedContent(String html, String css, String js) {

  public static EmbedContent none() {
    return new EmbedContent(null, null, null);
  }

  public String get(EmbedType type) {
    return switch (type) {
      case HTML -> html;
      case CSS -> css;
      case JS -> js;
    };
  }
}
