package com.flamingo.ai.flowbridge.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the conversion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "flowbridge")
@Getter
@Setter
public class FlowbridgeConfig {

  private Style style = new Style();
  private Section section = new Section();
  private Extraction extraction = new Extraction();
  private Tokens tokens = new Tokens();
  private Safety safety = new Safety();
  private Generation generation = new Generation();

  @Getter
  @Setter
  public static class Style {
    /** Marker written to the comb field of modifier (combo) styles. */
    private String combinatorMarker = "&";

    private List<String> breakpoints =
        new ArrayList<>(List.of("main", "medium", "small", "tiny", "large", "xl", "xxl"));

    private List<String> pseudoStates =
        new ArrayList<>(
            List.of(
                "hover",
                "pressed",
                "focus",
                "visited",
                "focus-visible",
                "focus-within",
                "checked",
                "disabled",
                "placeholder",
                "selection"));

    /** CSS pseudo-class to variant key. Pseudo-classes missing here are not expressible. */
    private Map<String, String> pseudoClassVariants = defaultPseudoClassVariants();

    private static Map<String, String> defaultPseudoClassVariants() {
      Map<String, String> variants = new LinkedHashMap<>();
      variants.put("hover", "hover");
      variants.put("active", "pressed");
      variants.put("focus", "focus");
      variants.put("visited", "visited");
      variants.put("focus-visible", "focus-visible");
      variants.put("focus-within", "focus-within");
      return variants;
    }
  }

  @Getter
  @Setter
  public static class Section {
    private boolean implicitDetectionEnabled = true;

    /** Leading-class pattern for container divs treated as implicit sections. */
    private String implicitClassPattern = ".+-section";

    private List<String> implicitClassNames = new ArrayList<>(List.of("hero", "cta", "banner"));
  }

  @Getter
  @Setter
  public static class Extraction {
    private boolean includeRoot = true;
    private boolean includeReset = true;
    private boolean includeBody = true;
    private boolean includeHtml = false;
    private boolean includeImg = false;
    private boolean includeKeyframes = true;
    private boolean dedupe = true;
  }

  @Getter
  @Setter
  public static class Tokens {
    private String alternateRootSelector = ".fp-root";
  }

  @Getter
  @Setter
  public static class Safety {
    private Embed embed = new Embed();
    private Depth depth = new Depth();
    private String reservedPrefix = "w-";
    private String reservedRenamePrefix = "custom-";
    private MissingStylePolicy missingStylePolicy = MissingStylePolicy.SYNTHESIZE;

    @Getter
    @Setter
    public static class Embed {
      private int softLimitBytes = 40_960;
      private int hardLimitBytes = 51_200;
      private boolean chunkingEnabled = false;
      private int chunkSizeBytes = 40_000;
    }

    @Getter
    @Setter
    public static class Depth {
      /** Nesting beyond this is logged only. */
      private int safeLimit = 30;

      /** Nesting beyond this is reported as a warning. */
      private int maxLimit = 50;
    }
  }

  /** What to do with a node class reference that matches no declared style. */
  public enum MissingStylePolicy {
    SYNTHESIZE,
    DROP
  }

  @Getter
  @Setter
  public static class Generation {
    /** Generation strategy: "none", "http" or "llm". */
    private String strategy = "none";

    private String baseUrl = "http://localhost:8090";
    private String path = "/generate";
    private int readTimeoutMs = 30_000;
    private String defaultIdPrefix = "wf";
  }
}
