package com.flamingo.ai.contextengine.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

@DisplayName("LangChain4jConfig Tests")
class LangChain4jConfigTest {

  @Nested
  @DisplayName("requestedDimensions")
  class RequestedDimensionsTests {

    @Test
    @DisplayName("should request the configured size when it fits the model and the index")
    void shouldRequestConfiguredSize() {
      assertThat(LangChain4jConfig.requestedDimensions("text-embedding-3-small", 1536, 1536))
          .isEqualTo(1536);
      assertThat(LangChain4jConfig.requestedDimensions("text-embedding-3-large", 1024, 1024))
          .isEqualTo(1024);
    }

    @Test
    @DisplayName("should fail when the embedding size differs from the index mapping")
    void shouldFailOnIndexMismatch() {
      assertThatThrownBy(
              () -> LangChain4jConfig.requestedDimensions("text-embedding-3-large", 3072, 1536))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("1536");
    }

    @Test
    @DisplayName("should fail when the model cannot produce the configured size")
    void shouldFailAboveModelMaximum() {
      assertThatThrownBy(
              () -> LangChain4jConfig.requestedDimensions("text-embedding-3-small", 3072, 3072))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("max 1536");
    }

    @Test
    @DisplayName("should omit the size for fixed-size models")
    void shouldOmitSizeForFixedModels() {
      assertThat(LangChain4jConfig.requestedDimensions("text-embedding-ada-002", 1536, 1536))
          .isNull();
      assertThatThrownBy(
              () -> LangChain4jConfig.requestedDimensions("text-embedding-ada-002", 512, 512))
          .isInstanceOf(IllegalStateException.class);
    }
  }

  @Test
  @DisplayName("should refuse to build models without an API key")
  void shouldRequireApiKey() {
    LangChain4jConfig config = new LangChain4jConfig();
    ReflectionTestUtils.setField(config, "openAiApiKey", " ");

    assertThatThrownBy(config::chatModel)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("OPENAI_API_KEY");
  }
}
