package com.flamingo.ai.flowbridge;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.flowbridge.service.graph.LlmSectionGenerator;
import com.flamingo.ai.flowbridge.service.graph.SectionGenerator;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Context test for the LLM generation strategy. The key is a placeholder; building the chat model
 * makes no network call, so the context loads without an OpenAI account.
 */
@SpringBootTest(
    properties = {
      "flowbridge.generation.strategy=llm",
      "langchain4j.openai.api-key=sk-test-placeholder"
    })
class FlowbridgeApplicationTests {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load with the LLM generation strategy")
  void contextLoads() {
    assertThat(applicationContext.getBean(ChatModel.class)).isNotNull();
    assertThat(applicationContext.getBean(SectionGenerator.class))
        .isInstanceOf(LlmSectionGenerator.class);
  }
}
