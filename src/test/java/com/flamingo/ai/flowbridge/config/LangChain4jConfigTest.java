package com.flamingo.ai.flowbridge.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.flowbridge.agent.SectionGenerationAgent;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

@DisplayName("LangChain4jConfig Tests")
class LangChain4jConfigTest {

  private static LangChain4jConfig config(String apiKey) {
    LangChain4jConfig config = new LangChain4jConfig();
    ReflectionTestUtils.setField(config, "openAiApiKey", apiKey);
    ReflectionTestUtils.setField(config, "chatModelName", "gpt-5-mini");
    ReflectionTestUtils.setField(config, "maxCompletionTokens", 1024);
    ReflectionTestUtils.setField(config, "timeoutSeconds", 10);
    return config;
  }

  @Test
  @DisplayName("Should refuse to build a chat model without an API key")
  void shouldFail_whenApiKeyBlank() {
    assertThatThrownBy(() -> config(" ").chatModel())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("OPENAI_API_KEY");
  }

  @Test
  @DisplayName("Should build the chat model and the generation agent when a key is set")
  void shouldBuildAgent_whenApiKeyPresent() {
    ChatModel chatModel = config("sk-test").chatModel();

    SectionGenerationAgent agent = new AiAgentConfig().sectionGenerationAgent(chatModel);

    assertThat(chatModel).isNotNull();
    assertThat(agent).isNotNull();
  }
}
