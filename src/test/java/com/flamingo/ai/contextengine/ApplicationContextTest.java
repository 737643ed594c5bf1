package com.flamingo.ai.contextengine;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import com.flamingo.ai.contextengine.service.cache.VectorCache;
import com.flamingo.ai.contextengine.service.context.ContextAssemblyService;
import com.flamingo.ai.contextengine.service.mood.MoodEngine;
import com.flamingo.ai.contextengine.service.prompt.PromptVariantSelector;
import com.flamingo.ai.contextengine.service.response.ResponseOrchestrator;
import com.flamingo.ai.contextengine.service.search.HybridSearchService;
import com.flamingo.ai.contextengine.service.usage.UsageTracker;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. External dependencies (LLM, Elasticsearch) are
 * mocked; Redis connections are opened lazily and never used here.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private EmbeddingModel embeddingModel;
  @MockitoBean private ElasticsearchClient elasticsearchClient;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(VectorCache.class)).isNotNull();
    assertThat(applicationContext.getBean(HybridSearchService.class)).isNotNull();
    assertThat(applicationContext.getBean(ContextAssemblyService.class)).isNotNull();
    assertThat(applicationContext.getBean(MoodEngine.class)).isNotNull();
    assertThat(applicationContext.getBean(UsageTracker.class)).isNotNull();
    assertThat(applicationContext.getBean(PromptVariantSelector.class)).isNotNull();
    assertThat(applicationContext.getBean(ResponseOrchestrator.class)).isNotNull();
  }

  @Test
  @DisplayName("Configuration should bind with defaults")
  void configurationShouldBind() {
    ContextEngineConfig config = applicationContext.getBean(ContextEngineConfig.class);

    assertThat(config.getBackfill().isEnabled()).isFalse();
    assertThat(config.getContext().getMaxTokens()).isEqualTo(4000);
  }
}
