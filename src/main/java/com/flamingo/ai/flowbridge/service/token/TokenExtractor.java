package com.flamingo.ai.flowbridge.service.token;

import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import com.flamingo.ai.flowbridge.service.css.CssBlock;
import com.flamingo.ai.flowbridge.service.css.CssDeclaration;
import com.flamingo.ai.flowbridge.service.css.CssRuleScanner;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts color and font-family tokens from root-scope custom property blocks.
 *
 * <p>The first root block to declare a property supplies its first-mode value; a later root block
 * redeclaring it supplies the second mode.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenExtractor {

  static final String LIGHT_MODE = "light";
  static final String DARK_MODE = "dark";

  private static final Pattern COLOR_VALUE =
      Pattern.compile(
          "^(#[0-9a-fA-F]{3,8}|(rgba?|hsla?|oklch|oklab|lab|lch|color)\\(.*|var\\(--.*"
              + "|transparent|currentcolor|inherit|white|black)$",
          Pattern.CASE_INSENSITIVE);
  private static final Set<String> COLOR_NAME_HINTS =
      Set.of(
          "bg", "background", "text", "border", "accent", "primary", "secondary", "brand",
          "surface", "muted", "dark", "light", "card", "color", "coral");
  private static final Set<String> NON_FAMILY_FONT_HINTS =
      Set.of("size", "weight", "line", "height", "spacing", "tracking", "leading");

  private final FlowbridgeConfig config;
  private final CssRuleScanner cssRuleScanner;
  private final FontDetector fontDetector;

  /**
   * Extracts the token manifest for one page.
   *
   * @param source page markup or stylesheet
   * @param title human title used for slug and namespace, may be blank
   * @return a manifest scoped to this call
   */
  public TokenManifest extract(String source, String title) {
    String name = title == null || title.isBlank() ? "Untitled" : title.trim();
    String slug = slugify(name);

    Map<String, Map<String, String>> declared = new LinkedHashMap<>();
    for (CssBlock block : rootBlocks(cssRuleScanner.scan(CssRuleScanner.stylesheetOf(source)))) {
      for (CssDeclaration declaration : CssRuleScanner.parseDeclarations(block.body())) {
        if (!declaration.property().startsWith("--")) {
          continue;
        }
        Map<String, String> values =
            declared.computeIfAbsent(declaration.property(), k -> new LinkedHashMap<>());
        String mode = values.isEmpty() ? LIGHT_MODE : DARK_MODE;
        values.put(mode, declaration.value());
      }
    }

    List<TokenVariable> variables = new ArrayList<>();
    for (Map.Entry<String, Map<String, String>> entry : declared.entrySet()) {
      categorize(entry.getKey(), entry.getValue()).ifPresent(variables::add);
    }

    boolean multiMode = variables.stream().anyMatch(TokenVariable::isMultiMode);
    List<String> modes = multiMode ? List.of(LIGHT_MODE, DARK_MODE) : List.of(LIGHT_MODE);

    FontReport fonts = fontDetector.detect(source);
    log.debug(
        "Extracted {} tokens ({} modes) for namespace {}",
        variables.size(),
        modes.size(),
        namespaceOf(slug));
    return new TokenManifest(
        TokenManifest.SCHEMA_VERSION,
        name,
        slug,
        namespaceOf(slug),
        modes,
        variables,
        fontDetector.toTokenFonts(fonts));
  }

  /** Lower-case, hyphen-separated form of a title. */
  public static String slugify(String text) {
    String slug =
        text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("^-+|-+$", "");
    return slug.isEmpty() ? "untitled" : slug;
  }

  /** Initials of the slug words, or the first three letters of a single-word slug. */
  public static String namespaceOf(String slug) {
    String[] words = slug.split("-");
    if (words.length > 1) {
      return Arrays.stream(words)
          .filter(w -> !w.isEmpty())
          .map(w -> w.substring(0, 1))
          .collect(Collectors.joining());
    }
    return slug.length() <= 3 ? slug : slug.substring(0, 3);
  }

  // ---- private helpers ----

  private List<CssBlock> rootBlocks(List<CssBlock> blocks) {
    List<CssBlock> roots = new ArrayList<>();
    for (CssBlock block : blocks) {
      if (block.kind() == CssBlock.Kind.STYLE_RULE) {
        boolean root =
            CssRuleScanner.splitSelectors(block.prelude()).stream().anyMatch(this::isRootSelector);
        if (root) {
          roots.add(block);
        }
      } else if (!block.children().isEmpty()) {
        roots.addAll(rootBlocks(block.children()));
      }
    }
    return roots;
  }

  private boolean isRootSelector(String selector) {
    String alternate = config.getTokens().getAlternateRootSelector();
    return selector.startsWith(":root")
        || (alternate != null && !alternate.isBlank() && selector.startsWith(alternate));
  }

  private Optional<TokenVariable> categorize(String cssVar, Map<String, String> values) {
    String name = cssVar.substring(2).toLowerCase(Locale.ROOT);
    String value = values.values().iterator().next().trim();

    if (name.startsWith("radius")) {
      log.debug("Skipping radius token {}", cssVar);
      return Optional.empty();
    }

    List<String> words = List.of(name.split("-"));
    if (name.startsWith("font") && words.stream().noneMatch(NON_FAMILY_FONT_HINTS::contains)) {
      String label = titleCase(words.subList(1, words.size()));
      String path = "Typography / " + (label.isEmpty() ? "Base" : label);
      return Optional.of(new TokenVariable(path, cssVar, TokenType.FONT_FAMILY, values));
    }

    if (COLOR_VALUE.matcher(value).matches()
        || words.stream().anyMatch(COLOR_NAME_HINTS::contains)) {
      return Optional.of(new TokenVariable(colorPath(words), cssVar, TokenType.COLOR, values));
    }

    log.debug("Skipping non color/font token {}: {}", cssVar, value);
    return Optional.empty();
  }

  private static String colorPath(List<String> words) {
    String group = null;
    String groupWord = null;
    List<String> rest = new ArrayList<>();
    for (String word : words) {
      String wordGroup =
          switch (word) {
            case "bg", "background", "surface" -> "Background";
            case "text", "foreground", "fg" -> "Text";
            case "border" -> "Border";
            case "accent", "primary", "secondary", "brand" -> "Accent";
            default -> null;
          };
      if (group == null && wordGroup != null) {
        group = wordGroup;
        groupWord = word;
        continue;
      }
      if (!word.equals("color")) {
        rest.add(word);
      }
    }
    String label = titleCase(rest);
    if (group == null) {
      return "Colors / " + (label.isEmpty() ? "Base" : label);
    }
    if (label.isEmpty()) {
      label = group.equals("Accent") ? titleCase(List.of(groupWord)) : "Base";
    }
    return "Colors / " + group + " / " + label;
  }

  private static String titleCase(List<String> words) {
    return words.stream()
        .filter(w -> !w.isEmpty())
        .map(w -> Character.toUpperCase(w.charAt(0)) + w.substring(1))
        .collect(Collectors.joining(" "));
  }
}
