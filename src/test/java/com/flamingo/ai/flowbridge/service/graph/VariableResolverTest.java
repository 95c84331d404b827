package com.flamingo.ai.flowbridge.service.graph;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.flowbridge.service.token.TokenFonts;
import com.flamingo.ai.flowbridge.service.token.TokenManifest;
import com.flamingo.ai.flowbridge.service.token.TokenType;
import com.flamingo.ai.flowbridge.service.token.TokenVariable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VariableResolver Tests")
class VariableResolverTest {

  private final VariableResolver resolver = new VariableResolver();

  private static TokenManifest manifest(TokenVariable... variables) {
    return new TokenManifest(
        TokenManifest.SCHEMA_VERSION,
        "Demo",
        "demo",
        "dem",
        List.of("light", "dark"),
        List.of(variables),
        TokenFonts.none());
  }

  private static TokenVariable color(String name, String light, String dark) {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("light", light);
    values.put("dark", dark);
    return new TokenVariable("Colors / " + name, "--" + name, TokenType.COLOR, values);
  }

  @Test
  @DisplayName("Should substitute the first mode value of a known variable")
  void shouldSubstituteKnownVariable() {
    TokenManifest manifest = manifest(color("brand", "#111111", "#eeeeee"));

    assertThat(resolver.resolve("1px solid var(--brand)", manifest))
        .isEqualTo("1px solid #111111");
  }

  @Test
  @DisplayName("Should use the fallback when the variable is unknown")
  void shouldUseFallback_whenUnknown() {
    assertThat(resolver.resolve("var(--gap, 4px)", manifest())).isEqualTo("4px");
    assertThat(resolver.resolve("var(--gap, 4px)", null)).isEqualTo("4px");
  }

  @Test
  @DisplayName("Should resolve nested references inside fallbacks")
  void shouldResolveNestedFallbacks() {
    TokenManifest manifest = manifest(color("brand", "#111111", "#eeeeee"));

    assertThat(resolver.resolve("var(--missing, var(--brand))", manifest)).isEqualTo("#111111");
    assertThat(resolver.resolve("var(--missing, rgba(0, 0, 0, 0.5))", manifest))
        .isEqualTo("rgba(0, 0, 0, 0.5)");
  }

  @Test
  @DisplayName("Should leave references with neither a value nor a fallback in place")
  void shouldLeaveUnresolvedReference() {
    assertThat(resolver.resolve("var(--missing)", manifest())).isEqualTo("var(--missing)");
  }

  @Test
  @DisplayName("Should stop expanding self-referencing variables")
  void shouldStopOnSelfReference() {
    TokenManifest manifest =
        manifest(
            new TokenVariable(
                "Colors / Loop", "--loop", TokenType.COLOR, Map.of("light", "var(--loop)")));

    assertThat(resolver.resolve("var(--loop)", manifest)).isEqualTo("var(--loop)");
  }

  @Test
  @DisplayName("Should return values without references unchanged")
  void shouldReturnPlainValuesUnchanged() {
    assertThat(resolver.resolve("color: red;", manifest())).isEqualTo("color: red;");
    assertThat(resolver.resolve(null, manifest())).isNull();
    assertThat(resolver.resolve("var(--open", manifest())).isEqualTo("var(--open");
  }
}
