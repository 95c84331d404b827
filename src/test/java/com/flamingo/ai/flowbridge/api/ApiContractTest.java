package com.flamingo.ai.flowbridge.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.flowbridge.api.rest.CollisionController;
import com.flamingo.ai.flowbridge.api.rest.ConversionController;
import com.flamingo.ai.flowbridge.api.rest.SafetyGateController;
import com.flamingo.ai.flowbridge.api.rest.TokenController;
import java.lang.reflect.Method;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the public endpoint paths.
 *
 * <ul>
 *   <li>POST /api/conversions - Convert a page
 *   <li>POST /api/sections/detect - Detect sections
 *   <li>POST /api/tokens - Extract tokens and fonts
 *   <li>POST /api/safety-gate - Validate a document
 *   <li>POST /api/routing/trace - Trace CSS routing
 *   <li>POST /api/collisions - Check destination collisions
 *   <li>POST /api/variables/remap - Remap variable references
 * </ul>
 */
class ApiContractTest {

  private static String[] postPaths(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map(method -> method.getAnnotation(PostMapping.class))
        .filter(mapping -> mapping != null)
        .flatMap(mapping -> Arrays.stream(mapping.value()))
        .toArray(String[]::new);
  }

  @Nested
  @DisplayName("ConversionController API contract")
  class ConversionControllerContract {

    @Test
    @DisplayName("should be mapped under /api prefix")
    void shouldBeMappedUnderApiPrefix() {
      RequestMapping mapping = ConversionController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
    }

    @Test
    @DisplayName("should expose conversion and section detection")
    void shouldExposeConversionEndpoints() {
      assertThat(postPaths(ConversionController.class))
          .containsExactlyInAnyOrder("/conversions", "/sections/detect");
    }
  }

  @Nested
  @DisplayName("TokenController API contract")
  class TokenControllerContract {

    @Test
    @DisplayName("should be mapped to /api/tokens")
    void shouldBeMappedToApiTokens() {
      RequestMapping mapping = TokenController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/tokens");
    }

    @Test
    @DisplayName("should accept POST on the base path")
    void shouldAcceptPostOnBasePath() {
      Method[] posts =
          Arrays.stream(TokenController.class.getDeclaredMethods())
              .filter(method -> method.isAnnotationPresent(PostMapping.class))
              .toArray(Method[]::new);
      assertThat(posts).hasSize(1);
      assertThat(posts[0].getAnnotation(PostMapping.class).value()).isEmpty();
    }
  }

  @Nested
  @DisplayName("SafetyGateController API contract")
  class SafetyGateControllerContract {

    @Test
    @DisplayName("should be mapped under /api prefix")
    void shouldBeMappedUnderApiPrefix() {
      RequestMapping mapping = SafetyGateController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
    }

    @Test
    @DisplayName("should expose the gate and the routing trace")
    void shouldExposeGateEndpoints() {
      assertThat(postPaths(SafetyGateController.class))
          .containsExactlyInAnyOrder("/safety-gate", "/routing/trace");
    }
  }

  @Nested
  @DisplayName("CollisionController API contract")
  class CollisionControllerContract {

    @Test
    @DisplayName("should be mapped under /api prefix")
    void shouldBeMappedUnderApiPrefix() {
      RequestMapping mapping = CollisionController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
    }

    @Test
    @DisplayName("should expose collision checks and variable remapping")
    void shouldExposeCollisionEndpoints() {
      assertThat(postPaths(CollisionController.class))
          .containsExactlyInAnyOrder("/collisions", "/variables/remap");
    }
  }
}
