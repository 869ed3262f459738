package com.flamingo.ai.memoryvault.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j embedding model.
 *
 * <p>The model bean only exists when an API key is configured. Without it the vault still starts,
 * and embedding-dependent operations fail with {@code EmbedderNotConfiguredException}. No
 * dimension is configured here; the store learns it from the first vector it receives.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.timeout-seconds:30}")
  private long timeoutSeconds;

  @Bean
  @ConditionalOnExpression("!'${langchain4j.openai.api-key:}'.isBlank()")
  public EmbeddingModel embeddingModel() {
    log.info("Embedding model configured: {} at {}", embeddingModelName, baseUrl);
    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .baseUrl(baseUrl)
        .modelName(embeddingModelName)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .logRequests(false)
        .logResponses(false)
        .build();
  }
}
