package com.flamingo.ai.memoryvault.service.embedding;

import com.flamingo.ai.memoryvault.exception.EmbedderNotConfiguredException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/** Service for generating text embeddings through the configured LangChain4j model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; dense scripts approach one token per character
  public static final int MAX_CHARS_PER_EMBEDDING = 8000;

  private final ObjectProvider<EmbeddingModel> embeddingModelProvider;
  private final MeterRegistry meterRegistry;

  public boolean isAvailable() {
    return embeddingModelProvider.getIfAvailable() != null;
  }

  /**
   * Embeds a single text, truncating overly long input.
   *
   * @param text the text to embed
   * @return the embedding vector
   * @throws EmbedderNotConfiguredException if no embedding model is configured
   */
  @CircuitBreaker(name = "embedding")
  @Retry(name = "embedding")
  public float[] embedText(String text) {
    EmbeddingModel model = embeddingModelProvider.getIfAvailable();
    if (model == null) {
      throw new EmbedderNotConfiguredException();
    }

    String input = text;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = model.embed(input);
      float[] vector = response.content().vector();
      meterRegistry.counter("embedding.requests.success").increment();
      log.debug("Embedding generated, dimension {}", vector.length);
      return vector;
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw e;
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }
}
