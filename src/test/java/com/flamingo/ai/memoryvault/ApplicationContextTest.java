package com.flamingo.ai.memoryvault;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.memoryvault.service.capture.AutoCaptureService;
import com.flamingo.ai.memoryvault.service.consolidation.ConsolidationScheduler;
import com.flamingo.ai.memoryvault.service.embedding.Embedder;
import com.flamingo.ai.memoryvault.service.store.VectorStore;
import com.flamingo.ai.memoryvault.service.vault.VaultService;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. The embedding model is mocked so the test runs
 * without an API key.
 */
@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core vault beans should be available")
  void coreBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(VaultService.class)).isNotNull();
    assertThat(applicationContext.getBean(VectorStore.class)).isNotNull();
    assertThat(applicationContext.getBean(Embedder.class).isAvailable()).isTrue();
    assertThat(applicationContext.getBean(AutoCaptureService.class)).isNotNull();
    assertThat(applicationContext.getBean(ConsolidationScheduler.class)).isNotNull();
  }
}
