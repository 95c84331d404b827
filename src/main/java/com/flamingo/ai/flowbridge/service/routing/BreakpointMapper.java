package com.flamingo.ai.flowbridge.service.routing;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Maps width media queries onto the supported breakpoints.
 *
 * <p>Max-width queries round up to the nearest of tiny (479), small (767) and medium (991).
 * Min-width queries round down to the nearest of large (1280), xl (1440) and xxl (1920). Anything
 * else, including queries on other media features, has no mapping.
 */
@Component
public class BreakpointMapper {

  static final int ROOT_FONT_SIZE_PX = 16;

  private static final Pattern WIDTH_FEATURE =
      Pattern.compile(
          "\\(\\s*(max|min)-width\\s*:\\s*([0-9]*\\.?[0-9]+)\\s*(px|rem|em)\\s*\\)",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern MEDIA_TYPE_WORDS =
      Pattern.compile("\\b(only|screen|all|and)\\b", Pattern.CASE_INSENSITIVE);

  private static final List<String> NON_STANDARD_FEATURES =
      List.of(
          "orientation",
          "prefers-",
          "print",
          "hover",
          "pointer",
          "aspect-ratio",
          "resolution",
          "height");

  private record Step(String name, int width) {}

  private static final List<Step> MAX_WIDTH_STEPS =
      List.of(new Step("tiny", 479), new Step("small", 767), new Step("medium", 991));
  private static final List<Step> MIN_WIDTH_STEPS =
      List.of(new Step("xxl", 1920), new Step("xl", 1440), new Step("large", 1280));

  /**
   * Maps one media condition.
   *
   * @param condition the media prelude without {@code @media}
   * @return the mapping, or empty when the query needs an embed
   */
  public Optional<BreakpointMapping> map(String condition) {
    if (condition == null || condition.isBlank()) {
      return Optional.empty();
    }
    String query = condition.trim().toLowerCase(Locale.ROOT);
    if (NON_STANDARD_FEATURES.stream().anyMatch(query::contains) || query.contains(",")) {
      return Optional.empty();
    }

    Matcher width = WIDTH_FEATURE.matcher(query);
    if (!width.find()) {
      return Optional.empty();
    }
    String direction = width.group(1);
    int pixels = toPixels(Double.parseDouble(width.group(2)), width.group(3));
    if (width.find()) {
      return Optional.empty();
    }
    String withoutWidth = WIDTH_FEATURE.matcher(query).replaceAll("");
    String rest = MEDIA_TYPE_WORDS.matcher(withoutWidth).replaceAll("");
    if (!rest.isBlank()) {
      return Optional.empty();
    }

    Optional<Step> step = direction.equals("max") ? roundUp(pixels) : roundDown(pixels);
    return step.map(
        s ->
            new BreakpointMapping(
                condition.trim(), s.name(), s.width() != pixels, pixels, s.width()));
  }

  // ---- private helpers ----

  private static int toPixels(double value, String unit) {
    double px = unit.equalsIgnoreCase("px") ? value : value * ROOT_FONT_SIZE_PX;
    return (int) Math.round(px);
  }

  private static Optional<Step> roundUp(int pixels) {
    return MAX_WIDTH_STEPS.stream().filter(step -> pixels <= step.width()).findFirst();
  }

  private static Optional<Step> roundDown(int pixels) {
    return MIN_WIDTH_STEPS.stream().filter(step -> pixels >= step.width()).findFirst();
  }
}
