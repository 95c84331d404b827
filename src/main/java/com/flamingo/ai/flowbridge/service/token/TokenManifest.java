package com.flamingo.ai.flowbridge.service.token;

import java.util.List;
import java.util.Optional;

/**
 * Design tokens extracted from one page. Scoped to a single conversion and passed explicitly to
 * the stages that need it.
 *
 * @param schemaVersion manifest format version
 * @param name human title the namespace derives from
 * @param slug slugified title
 * @param namespace short prefix derived from the slug
 * @param modes mode names in value order
 * @param variables extracted variables
 * @param fonts font summary
 */
public record TokenManifest(
    String schemaVersion,
    String name,
    String slug,
    String namespace,
    List<String> modes,
    List<TokenVariable> variables,
    TokenFonts fonts) {

  public static final String SCHEMA_VERSION = "1.0";

  public TokenManifest {
    modes = List.copyOf(modes);
    variables = List.copyOf(variables);
  }

  public static TokenManifest empty() {
    return new TokenManifest(
        SCHEMA_VERSION,
        "Untitled",
        "untitled",
        "unt",
        List.of("light"),
        List.of(),
        TokenFonts.none());
  }

  /**
   * Looks up a variable by custom property name.
   *
   * @param cssVar name with or without the leading {@code --}
   */
  public Optional<TokenVariable> find(String cssVar) {
    String key = cssVar.startsWith("--") ? cssVar : "--" + cssVar;
    return variables.stream().filter(v -> v.cssVar().equals(key)).findFirst();
  }
}
