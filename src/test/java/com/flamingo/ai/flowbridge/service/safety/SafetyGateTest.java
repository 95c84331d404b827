package com.flamingo.ai.flowbridge.service.safety;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.flowbridge.config.FlowbridgeConfig;
import com.flamingo.ai.flowbridge.config.FlowbridgeConfig.MissingStylePolicy;
import com.flamingo.ai.flowbridge.domain.xscp.Node;
import com.flamingo.ai.flowbridge.domain.xscp.NodeData;
import com.flamingo.ai.flowbridge.domain.xscp.NodeType;
import com.flamingo.ai.flowbridge.domain.xscp.Style;
import com.flamingo.ai.flowbridge.domain.xscp.XscpDocument;
import com.flamingo.ai.flowbridge.domain.xscp.XscpPayload;
import com.flamingo.ai.flowbridge.service.graph.PayloadShapeValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SafetyGate Tests")
class SafetyGateTest {

  private static final int KB = 1024;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private FlowbridgeConfig config;
  private MeterRegistry meterRegistry;
  private SafetyGate gate;

  @BeforeEach
  void setUp() {
    config = new FlowbridgeConfig();
    meterRegistry = new SimpleMeterRegistry();
    gate = newGate();
  }

  private SafetyGate newGate() {
    return new SafetyGate(
        config,
        objectMapper,
        new PayloadShapeValidator(objectMapper),
        new EmbedChunker(),
        meterRegistry);
  }

  // ---- fixtures ----

  private static Node element(String id, List<String> classes, String... children) {
    return Node.builder()
        .id(id)
        .type(NodeType.BLOCK.label())
        .tag("div")
        .classes(new ArrayList<>(classes))
        .children(new ArrayList<>(List.of(children)))
        .build();
  }

  private static Style style(String id, String name, String styleLess) {
    return Style.builder().id(id).name(name).styleLess(styleLess).build();
  }

  private static XscpDocument document(List<Node> nodes, List<Style> styles) {
    return XscpDocument.builder()
        .payload(
            XscpPayload.builder()
                .nodes(new ArrayList<>(nodes))
                .styles(new ArrayList<>(styles))
                .build())
        .build();
  }

  private static XscpDocument clean() {
    return document(
        List.of(element("root", List.of("hero"), "t1"), Node.textRun("t1", "Hello")),
        List.of(style("hero", "hero", "color: red;")));
  }

  private static String cssOfSize(int bytes) {
    String rule = ".r{color:red}\n";
    StringBuilder css = new StringBuilder();
    while (css.length() + rule.length() <= bytes) {
      css.append(rule);
    }
    while (css.length() < bytes) {
      css.append('\n');
    }
    return css.toString();
  }

  private SafetyReport run(XscpDocument document) {
    return gate.evaluate(document, EmbedContent.none()).report();
  }

  // ---- status ----

  @Test
  @DisplayName("Should pass a clean document unchanged with status ok")
  void shouldPassCleanDocument() {
    XscpDocument input = clean();

    SafetyGateResult result = gate.evaluate(input, EmbedContent.none());

    assertThat(result.report().status()).isEqualTo(SafetyStatus.OK);
    assertThat(result.report().autoFixes()).isEmpty();
    assertThat(result.report().warnings()).isEmpty();
    assertThat(result.sanitizationApplied()).isFalse();
    assertThat(result.document()).isEqualTo(input);
    assertThat(result.document()).isNotSameAs(input);
  }

  @Test
  @DisplayName("Should treat a null document as an empty one")
  void shouldTreatNullDocumentAsEmpty() {
    SafetyGateResult result = gate.evaluate((XscpDocument) null, null);

    assertThat(result.report().status()).isEqualTo(SafetyStatus.OK);
    assertThat(result.document().getPayload().getNodes()).isEmpty();
  }

  @Test
  @DisplayName("Should never modify the caller's document")
  void shouldNotModifyInput() {
    XscpDocument input =
        document(
            List.of(element("root", List.of("ghost"), "t1"), Node.textRun("t1", "a<br>b")),
            List.of());

    gate.evaluate(input, EmbedContent.none());

    assertThat(input.getPayload().getNodes().get(1).getV()).isEqualTo("a<br>b");
    assertThat(input.getPayload().getStyles()).isEmpty();
  }

  @Test
  @DisplayName("Should record the status and fix count as metrics")
  void shouldRecordMetrics() {
    gate.evaluate(
        document(List.of(element("root", List.of("ghost"))), List.of()), EmbedContent.none());
    gate.evaluate("not json", EmbedContent.none());

    assertThat(meterRegistry.counter("flowbridge.safety.status", "status", "warn").count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("flowbridge.safety.status", "status", "block").count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("flowbridge.safety.fixes").count()).isEqualTo(1.0);
  }

  @Nested
  @DisplayName("Raw JSON input")
  class RawJsonInput {

    @Test
    @DisplayName("Should block unparseable text with an empty document")
    void shouldBlockInvalidJson() {
      SafetyGateResult result = gate.evaluate("{not json", EmbedContent.none());

      assertThat(result.report().status()).isEqualTo(SafetyStatus.BLOCK);
      assertThat(result.report().fatalIssues()).containsExactly(SafetyGate.INVALID_JSON);
      assertThat(result.document().getPayload().getNodes()).isEmpty();
      assertThat(result.document().getType()).isEqualTo(XscpDocument.TYPE);
    }

    @Test
    @DisplayName("Should block blank text")
    void shouldBlockBlankText() {
      assertThat(gate.evaluate("  ", EmbedContent.none()).report().fatalIssues())
          .containsExactly(SafetyGate.INVALID_JSON);
      assertThat(gate.evaluate((String) null, EmbedContent.none()).report().isBlocked()).isTrue();
    }

    @Test
    @DisplayName("Should block JSON that lacks the document slots")
    void shouldBlockWrongShape() {
      SafetyReport report = gate.evaluate("{\"type\": \"other\"}", EmbedContent.none()).report();

      assertThat(report.status()).isEqualTo(SafetyStatus.BLOCK);
      assertThat(report.fatalIssues())
          .contains("Missing or wrong type, expected @webflow/XscpData", "Missing payload object");
    }

    @Test
    @DisplayName("Should drop null entries from the node and style lists")
    void shouldDropNullEntries() {
      String json =
          "{\"type\": \"@webflow/XscpData\", \"payload\": {"
              + "\"nodes\": [null, {\"_id\": \"n1\", \"type\": \"Block\", \"tag\": \"div\"}],"
              + " \"styles\": [null]}}";

      SafetyGateResult result = gate.evaluate(json, EmbedContent.none());

      assertThat(result.report().autoFixes())
          .contains("Removed null node entries", "Removed null style entries");
      assertThat(result.document().getPayload().getNodes()).hasSize(1);
      assertThat(result.report().status()).isEqualTo(SafetyStatus.WARN);
    }
  }

  @Nested
  @DisplayName("Structural sanitation")
  class StructuralSanitation {

    @Test
    @DisplayName("Should replace <br> tags in text runs with newlines")
    void shouldStripLineBreaks() {
      XscpDocument input =
          document(
              List.of(element("root", List.of(), "t1"), Node.textRun("t1", "One<br/>Two<BR>")),
              List.of());

      SafetyGateResult result = gate.evaluate(input, EmbedContent.none());

      assertThat(result.document().getPayload().getNodes().get(1).getV()).isEqualTo("One\nTwo\n");
      assertThat(result.report().autoFixes())
          .containsExactly("Removed <br> tags from 1 text node(s)");
      assertThat(result.report().status()).isEqualTo(SafetyStatus.WARN);
      assertThat(result.sanitizationApplied()).isTrue();
    }

    @Test
    @DisplayName("Should remove variant keys outside the breakpoint and state vocabulary")
    void shouldRemoveInvalidVariants() {
      Style hero = style("hero", "hero", "color: red;");
      hero.getVariants().put("huge", new Style.Variant("color: blue;"));
      hero.getVariants().put("medium", new Style.Variant("color: green;"));
      hero.getVariants().put("small_hover", new Style.Variant("color: pink;"));
      hero.getVariants().put("hover_small", new Style.Variant("color: gray;"));

      SafetyGateResult result =
          gate.evaluate(
              document(List.of(element("root", List.of("hero"))), List.of(hero)),
              EmbedContent.none());

      Style sanitized = result.document().getPayload().getStyles().get(0);
      assertThat(sanitized.getVariants()).containsOnlyKeys("medium", "small_hover");
      assertThat(result.report().autoFixes())
          .containsExactly(
              "Removed invalid variant \"huge\" from style hero",
              "Removed invalid variant \"hover_small\" from style hero");
    }

    @Test
    @DisplayName("Should rename reserved-prefix identifiers and every reference to them")
    void shouldRenameReservedIdentifiers() {
      XscpDocument input =
          document(
              List.of(
                  element("root", List.of(), "w-node"),
                  element("w-node", List.of("w-button"))),
              List.of(style("w-button", "w-button", "color: red;")));

      SafetyGateResult result = gate.evaluate(input, EmbedContent.none());

      List<Node> nodes = result.document().getPayload().getNodes();
      assertThat(nodes.get(0).getChildren()).containsExactly("custom-node");
      assertThat(nodes.get(1).getId()).isEqualTo("custom-node");
      assertThat(nodes.get(1).getClasses()).containsExactly("custom-button");
      Style renamed = result.document().getPayload().getStyles().get(0);
      assertThat(renamed.getId()).isEqualTo("custom-button");
      assertThat(renamed.getName()).isEqualTo("custom-button");
      assertThat(result.report().autoFixes())
          .contains("Renamed reserved style w-button to custom-button");
    }

    @Test
    @DisplayName("Should remove child references to nodes that do not exist")
    void shouldRemoveDanglingChildren() {
      SafetyGateResult result =
          gate.evaluate(
              document(List.of(element("root", List.of(), "gone")), List.of()),
              EmbedContent.none());

      assertThat(result.document().getPayload().getNodes().get(0).getChildren()).isEmpty();
      assertThat(result.report().autoFixes())
          .containsExactly("Removed dangling child reference(s) from node root");
    }

    @Test
    @DisplayName("Should cut cycles in the children graph")
    void shouldCutNodeCycles() {
      SafetyGateResult result =
          gate.evaluate(
              document(
                  List.of(element("a", List.of(), "b"), element("b", List.of(), "a")), List.of()),
              EmbedContent.none());

      List<Node> nodes = result.document().getPayload().getNodes();
      assertThat(nodes.get(0).getChildren()).containsExactly("b");
      assertThat(nodes.get(1).getChildren()).isEmpty();
      assertThat(result.report().warnings()).containsExactly("Cut node cycle edge b -> a");
      assertThat(result.report().status()).isEqualTo(SafetyStatus.WARN);
    }

    @Test
    @DisplayName("Should cut cycles in style combo chains")
    void shouldCutStyleCycles() {
      Style a = style("a", "a", "");
      a.setChildren(new ArrayList<>(List.of("b")));
      Style b = style("b", "b", "");
      b.setChildren(new ArrayList<>(List.of("a")));

      SafetyGateResult result =
          gate.evaluate(document(List.of(), List.of(a, b)), EmbedContent.none());

      List<Style> styles = result.document().getPayload().getStyles();
      assertThat(styles.get(0).getChildren()).containsExactly("b");
      assertThat(styles.get(1).getChildren()).isEmpty();
      assertThat(result.report().warnings()).contains("Cut style cycle edge b -> a");
      assertThat(gate.evaluate(result.document(), EmbedContent.none()).report().warnings())
          .noneMatch(warning -> warning.startsWith("Cut style cycle"));
    }

    @Test
    @DisplayName("Should cut a cycle closing a very long chain without exhausting the stack")
    void shouldCutCycle_whenChainIsVeryLong() {
      int length = 50_000;
      List<Node> nodes = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        String next = "n" + ((i + 1) % length);
        nodes.add(element("n" + i, List.of(), next));
      }

      SafetyGateResult result =
          gate.evaluate(document(nodes, List.of()), EmbedContent.none());

      List<Node> gated = result.document().getPayload().getNodes();
      assertThat(gated.get(length - 1).getChildren()).isEmpty();
      assertThat(gated.get(0).getChildren()).containsExactly("n1");
      assertThat(result.report().warnings())
          .contains("Cut node cycle edge n" + (length - 1) + " -> n0");
    }

    @Test
    @DisplayName("Should strip document-level tags and event handlers from embed nodes")
    void shouldSanitizeEmbedNodes() {
      Node embed =
          Node.builder()
              .id("e1")
              .type(NodeType.HTML_EMBED.label())
              .tag("div")
              .classes(new ArrayList<>())
              .children(new ArrayList<>())
              .data(
                  NodeData.builder()
                      .embed(
                          NodeData.Embed.html(
                              "<!DOCTYPE html><html><head><style>.x{}</style></head>"
                                  + "<body><button onclick=\"go()\" class=\"cta\">Go</button>"
                                  + "</body></html>"))
                      .build())
              .build();

      SafetyGateResult result =
          gate.evaluate(document(List.of(embed), List.of()), EmbedContent.none());

      String html =
          result.document().getPayload().getNodes().get(0).getData().getEmbed().getMeta().getHtml();
      assertThat(html)
          .contains("<style>.x{}</style>")
          .contains("<button class=\"cta\">Go</button>")
          .doesNotContainIgnoringCase("doctype")
          .doesNotContain("onclick", "<html", "<head", "<body");
      assertThat(result.report().autoFixes())
          .contains(
              "HtmlEmbed e1: Removed 1 inline event handler(s)",
              "HtmlEmbed e1: Removed document-level tags: doctype, html, head, body");
      assertThat(result.report().warnings())
          .contains(
              "HtmlEmbed e1: Inline event handlers were removed; "
                  + "recreate them as script listeners");
      assertThat(result.report().status()).isEqualTo(SafetyStatus.WARN);
      assertThat(gate.evaluate(result.document(), EmbedContent.none()).report().autoFixes())
          .isEmpty();
    }

    @Test
    @DisplayName("Should clean the raw HTML embed and return it with the result")
    void shouldSanitizeRawHtmlEmbed() {
      SafetyGateResult result =
          gate.evaluate(
              clean(),
              new EmbedContent(
                  "<body><img src=\"x.png\" onerror=\"alert(1)\"></body>", ".a{}", null));

      assertThat(result.embeds().html()).isEqualTo("<img src=\"x.png\">");
      assertThat(result.embeds().css()).isEqualTo(".a{}");
      assertThat(result.report().autoFixes())
          .containsExactly(
              "HTML embed: Removed 1 inline event handler(s)",
              "HTML embed: Removed document-level tags: body");
      assertThat(result.sanitizationApplied()).isTrue();
    }

    @Test
    @DisplayName("Should leave tag text inside scripts alone and warn about it")
    void shouldWarn_whenTagTextRemainsInScript() {
      String html = "<script>document.write('<body>');</script>";

      SafetyGateResult result =
          gate.evaluate(clean(), new EmbedContent(html, null, null));

      assertThat(result.embeds().html()).isEqualTo(html);
      assertThat(result.report().autoFixes()).isEmpty();
      assertThat(result.report().warnings())
          .containsExactly(
              "HTML embed: Embed HTML still contains <body> tag text; remove it manually");
    }

    @Test
    @DisplayName("Should remap class references that use a style name instead of its id")
    void shouldRemapStyleNames() {
      SafetyGateResult result =
          gate.evaluate(
              document(
                  List.of(element("root", List.of("hero"))),
                  List.of(style("s-1", "hero", "color: red;"))),
              EmbedContent.none());

      assertThat(result.document().getPayload().getNodes().get(0).getClasses())
          .containsExactly("s-1");
      assertThat(result.report().autoFixes())
          .containsExactly("Remapped 1 class reference(s) from style names to IDs");
    }
  }

  @Nested
  @DisplayName("Identity integrity")
  class IdentityIntegrity {

    @Test
    @DisplayName("Should keep two nodes pointing at their own copy of a duplicated style")
    void shouldRegenerateDuplicateStyleIds() {
      XscpDocument input =
          document(
              List.of(
                  element("root", List.of(), "n1", "n2"),
                  element("n1", List.of("card")),
                  element("n2", List.of("card"))),
              List.of(style("card", "card", "color: red;"), style("card", "card", "color: blue;")));

      SafetyGateResult result = gate.evaluate(input, EmbedContent.none());

      List<Style> styles = result.document().getPayload().getStyles();
      assertThat(styles).extracting(Style::getId).containsExactly("card", "card-1");
      assertThat(styles.get(1).getName()).isEqualTo("card-1");
      List<Node> nodes = result.document().getPayload().getNodes();
      assertThat(nodes.get(1).getClasses()).containsExactly("card");
      assertThat(nodes.get(2).getClasses()).containsExactly("card-1");
      assertThat(result.report().autoFixes())
          .containsExactly("Regenerated duplicate style id card as card-1");
    }

    @Test
    @DisplayName("Should regenerate duplicate node ids and repoint the k-th child reference")
    void shouldRegenerateDuplicateNodeIds() {
      XscpDocument input =
          document(
              List.of(
                  element("root", List.of(), "x", "x"),
                  element("x", List.of()),
                  element("x", List.of()),
                  element("x-1", List.of())),
              List.of());

      SafetyGateResult result = gate.evaluate(input, EmbedContent.none());

      List<Node> nodes = result.document().getPayload().getNodes();
      assertThat(nodes).extracting(Node::getId).containsExactly("root", "x", "x-2", "x-1");
      assertThat(nodes.get(0).getChildren()).containsExactly("x", "x-2");
      assertThat(result.report().autoFixes())
          .containsExactly("Regenerated duplicate node id x as x-2");
    }

    @Test
    @DisplayName("Should cut a cycle closed by a regenerated duplicate node id")
    void shouldCutCycle_whenRegeneratedIdClosesLoop() {
      XscpDocument input =
          document(
              List.of(
                  element("z", List.of(), "x"),
                  element("y", List.of(), "x"),
                  element("x", List.of()),
                  element("x", List.of(), "y")),
              List.of());

      SafetyGateResult once = gate.evaluate(input, EmbedContent.none());

      List<Node> nodes = once.document().getPayload().getNodes();
      assertThat(nodes).extracting(Node::getId).containsExactly("z", "y", "x", "x-1");
      assertThat(nodes.get(0).getChildren()).containsExactly("x");
      assertThat(nodes.get(1).getChildren()).containsExactly("x-1");
      assertThat(nodes.get(3).getChildren()).isEmpty();
      assertThat(once.report().warnings()).contains("Cut node cycle edge x-1 -> y");

      SafetyGateResult twice = gate.evaluate(once.document(), EmbedContent.none());
      assertThat(twice.report().autoFixes()).isEmpty();
      assertThat(twice.report().warnings()).noneMatch(warning -> warning.startsWith("Cut"));
      assertThat(twice.document()).isEqualTo(once.document());
    }

    @Test
    @DisplayName("Should repoint combo references to the regenerated copy of a duplicated style")
    void shouldRewriteComboReferences_whenStyleIdDuplicated() {
      Style first = style("a", "a", "");
      first.setChildren(new ArrayList<>(List.of("combo")));
      Style second = style("b", "b", "");
      second.setChildren(new ArrayList<>(List.of("combo")));
      XscpDocument input =
          document(
              List.of(),
              List.of(
                  first,
                  second,
                  style("combo", "combo", "color: red;"),
                  style("combo", "combo", "color: blue;")));

      SafetyGateResult result = gate.evaluate(input, EmbedContent.none());

      List<Style> styles = result.document().getPayload().getStyles();
      assertThat(styles).extracting(Style::getId).containsExactly("a", "b", "combo", "combo-1");
      assertThat(styles.get(0).getChildren()).containsExactly("combo");
      assertThat(styles.get(1).getChildren()).containsExactly("combo-1");
    }

    @Test
    @DisplayName("Should report no further fixes after regenerating duplicate ids")
    void shouldBeIdempotent_whenIdsDuplicated() {
      XscpDocument input =
          document(
              List.of(
                  element("root", List.of("card"), "n", "n"),
                  element("n", List.of("card")),
                  element("n", List.of("card"))),
              List.of(
                  style("card", "card", "color: red;"),
                  style("card", "card", "color: blue;"),
                  style("card", "card", "color: green;")));

      SafetyGateResult once = gate.evaluate(input, EmbedContent.none());
      SafetyGateResult twice = gate.evaluate(once.document(), EmbedContent.none());

      assertThat(once.report().autoFixes())
          .contains(
              "Regenerated duplicate node id n as n-1",
              "Regenerated duplicate style id card as card-1",
              "Regenerated duplicate style id card as card-2");
      assertThat(twice.report().autoFixes()).isEmpty();
      assertThat(twice.document()).isEqualTo(once.document());
    }
  }

  @Nested
  @DisplayName("Nesting depth")
  class NestingDepth {

    private XscpDocument chain(int depth) {
      List<Node> nodes = new ArrayList<>();
      for (int i = 1; i <= depth; i++) {
        String[] children = i < depth ? new String[] {"n" + (i + 1)} : new String[0];
        nodes.add(element("n" + i, List.of(), children));
      }
      return document(nodes, List.of());
    }

    @Test
    @DisplayName("Should warn when nesting exceeds the maximum")
    void shouldWarn_whenTooDeep() {
      SafetyReport report = run(chain(52));

      assertThat(report.warnings())
          .containsExactly(
              "Nesting depth 52 exceeds the maximum of 50 at node n52; consider flattening");
      assertThat(report.status()).isEqualTo(SafetyStatus.WARN);
      assertThat(report.autoFixes()).isEmpty();
    }

    @Test
    @DisplayName("Should only log nesting between the safe and maximum limits")
    void shouldNotWarn_whenWithinMaximum() {
      SafetyReport report = run(chain(40));

      assertThat(report.warnings()).isEmpty();
      assertThat(report.status()).isEqualTo(SafetyStatus.OK);
    }
  }

  @Nested
  @DisplayName("Referential integrity")
  class ReferentialIntegrity {

    @Test
    @DisplayName("Should create placeholder styles for missing classes by default")
    void shouldSynthesizeMissingStyles() {
      SafetyGateResult result =
          gate.evaluate(
              document(List.of(element("root", List.of("ghost", "ghost", " "))), List.of()),
              EmbedContent.none());

      assertThat(result.document().getPayload().getStyles())
          .extracting(Style::getId)
          .containsExactly("ghost");
      assertThat(result.report().autoFixes())
          .containsExactly(
              "Removed blank class reference(s) from node root",
              "Created placeholder style for missing class ghost");
    }

    @Test
    @DisplayName("Should drop missing classes when configured to")
    void shouldDropMissingClasses() {
      config.getSafety().setMissingStylePolicy(MissingStylePolicy.DROP);
      gate = newGate();

      SafetyGateResult result =
          gate.evaluate(
              document(
                  List.of(element("root", List.of("hero", "ghost"))),
                  List.of(style("hero", "hero", ""))),
              EmbedContent.none());

      assertThat(result.document().getPayload().getNodes().get(0).getClasses())
          .containsExactly("hero");
      assertThat(result.document().getPayload().getStyles()).hasSize(1);
      assertThat(result.report().autoFixes())
          .containsExactly("Dropped missing class ghost from node root");
    }

    @Test
    @DisplayName("Should warn about combo styles that no base style lists")
    void shouldWarnAboutUnlistedCombos() {
      Style modifier = style("is-active", "is-active", "color: red;");
      modifier.setComb("&");

      SafetyReport report =
          run(document(List.of(element("root", List.of("is-active"))), List.of(modifier)));

      assertThat(report.warnings())
          .containsExactly("Combo style is-active is not listed by any base style");
    }
  }

  @Nested
  @DisplayName("Embed budget")
  class EmbedBudgetChecks {

    private SafetyReport withCss(int bytes) {
      return gate.evaluate(clean(), new EmbedContent(null, cssOfSize(bytes), null)).report();
    }

    @Test
    @DisplayName("Should accept embeds below the soft limit")
    void shouldAcceptSmallEmbed() {
      SafetyReport report = withCss(30 * KB);

      assertThat(report.status()).isEqualTo(SafetyStatus.OK);
      assertThat(report.embedSize().css()).isEqualTo(30 * KB);
      assertThat(report.embedSize().limitBytes()).isEqualTo(50 * KB);
    }

    @Test
    @DisplayName("Should warn for embeds between the soft and hard limits")
    void shouldWarnNearLimit() {
      SafetyReport report = withCss(45 * KB);

      assertThat(report.status()).isEqualTo(SafetyStatus.WARN);
      assertThat(report.embedSize().warnings())
          .containsExactly("CSS embed is 45.0KB, approaching the 50.0KB limit");
      assertThat(report.fatalIssues()).isEmpty();
    }

    @Test
    @DisplayName("Should block embeds at or over the hard limit without chunking")
    void shouldBlockOverLimit() {
      SafetyReport report = withCss(55 * KB);

      assertThat(report.status()).isEqualTo(SafetyStatus.BLOCK);
      assertThat(report.embedSize().errors())
          .containsExactly("CSS embed is 55.0KB, over the 50.0KB limit");
      assertThat(report.fatalIssues())
          .containsExactly("CSS embed is 55.0KB, over the 50.0KB limit");
      assertThat(withCss(50 * KB).status()).isEqualTo(SafetyStatus.BLOCK);
    }

    @Test
    @DisplayName("Should chunk over-limit embeds when chunking is enabled")
    void shouldChunkOverLimit() {
      config.getSafety().getEmbed().setChunkingEnabled(true);
      gate = newGate();

      SafetyGateResult result =
          gate.evaluate(clean(), new EmbedContent(null, cssOfSize(55 * KB), null));

      assertThat(result.report().status()).isEqualTo(SafetyStatus.WARN);
      assertThat(result.report().embedSize().warnings())
          .containsExactly(
              "CSS embed is 55.0KB, over the 50.0KB limit; needs chunking into 2 parts");
      assertThat(result.chunkedEmbeds()).hasSize(1);
      assertThat(result.chunkedEmbeds().get(0).chunks())
          .allSatisfy(chunk -> assertThat(chunk.sizeBytes()).isLessThanOrEqualTo(40_000));
    }

    @Test
    @DisplayName("Should budget each embed type on its own")
    void shouldNotSumEmbedTypes() {
      String css = cssOfSize(30 * KB);

      SafetyReport report = gate.evaluate(clean(), new EmbedContent(css, css, css)).report();

      assertThat(report.status()).isEqualTo(SafetyStatus.OK);
      assertThat(report.embedSize().html()).isEqualTo(30 * KB);
      assertThat(report.embedSize().js()).isEqualTo(30 * KB);
    }

    @Test
    @DisplayName("Should measure every embed node as a separate HTML embed")
    void shouldMeasureEmbedNodes() {
      Node embed =
          Node.builder()
              .id("e1")
              .type(NodeType.HTML_EMBED.label())
              .tag("div")
              .classes(new ArrayList<>())
              .children(new ArrayList<>())
              .data(
                  NodeData.builder()
                      .embed(NodeData.Embed.html("<style>" + cssOfSize(55 * KB) + "</style>"))
                      .build())
              .build();

      SafetyReport report = run(document(List.of(embed), List.of()));

      assertThat(report.status()).isEqualTo(SafetyStatus.BLOCK);
      assertThat(report.embedSize().errors().get(0)).startsWith("HTML embed node e1 is 55.0KB");
    }
  }

  @Test
  @DisplayName("Should report no further fixes when run over its own output")
  void shouldBeIdempotent() {
    Style first = style("card", "card", "color: red;");
    first.getVariants().put("bogus", new Style.Variant("color: red;"));
    XscpDocument messy =
        document(
            List.of(
                element("root", List.of("w-grid"), "n1", "n1", "lost"),
                element("n1", List.of("card", "ghost"), "t1"),
                element("n1", List.of("card")),
                Node.textRun("t1", "a<br>b")),
            List.of(first, style("card", "card", ""), style("w-grid", "w-grid", "")));

    SafetyGateResult once = gate.evaluate(messy, EmbedContent.none());
    SafetyGateResult twice = gate.evaluate(once.document(), EmbedContent.none());

    assertThat(once.report().autoFixes()).isNotEmpty();
    assertThat(twice.report().autoFixes()).isEmpty();
    assertThat(twice.sanitizationApplied()).isFalse();
    assertThat(twice.document()).isEqualTo(once.document());
  }
}
