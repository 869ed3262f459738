package com.flamingo.ai.memoryvault.service.capture;

import com.flamingo.ai.memoryvault.config.VaultConfig;
import com.flamingo.ai.memoryvault.service.sanitize.MemoryTextValidator;
import com.flamingo.ai.memoryvault.service.vault.SaveOptions;
import com.flamingo.ai.memoryvault.service.vault.SaveResult;
import com.flamingo.ai.memoryvault.service.vault.VaultService;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Captures memory-worthy user messages from a finished conversation turn. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoCaptureService {

  static final double BASE_IMPORTANCE = 0.5;
  static final double SCORE_WEIGHT = 0.3;
  static final double MAX_IMPORTANCE = 0.9;

  private final CaptureHeuristicEvaluator evaluator;
  private final VaultService vaultService;
  private final VaultConfig vaultConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Evaluates each message and saves those scoring at or above the capture threshold, up to the
   * per-turn cap. Duplicates and rejected texts are skipped. A failure ends the turn's capture
   * without propagating.
   *
   * @param userMessages the user's messages from one turn, in order
   * @return the number of memories saved
   */
  public int captureFromTurn(List<String> userMessages) {
    if (!vaultConfig.isAutoCapture() || userMessages == null || userMessages.isEmpty()) {
      return 0;
    }
    VaultConfig.Capture settings = vaultConfig.getCapture();
    int captured = 0;

    try {
      for (String message : userMessages) {
        if (captured >= settings.getMaxPerTurn()) {
          break;
        }
        if (!MemoryTextValidator.isValid(message, vaultConfig.getCaptureMaxChars())) {
          continue;
        }
        CaptureResult result = evaluator.evaluate(message);
        if (result.score() < settings.getThreshold()) {
          continue;
        }

        SaveResult saved =
            vaultService.save(
                message,
                SaveOptions.builder()
                    .category(result.category())
                    .importance(importanceFor(result.score()))
                    .build());
        if (saved.isSaved()) {
          captured++;
        } else {
          log.debug("Auto-capture skipped message: {}", saved.status());
        }
      }
    } catch (RuntimeException e) {
      log.warn("Auto-capture stopped after {} memories: {}", captured, e.getMessage());
      meterRegistry.counter("vault.capture.errors").increment();
    }

    if (captured > 0) {
      meterRegistry.counter("vault.capture.count").increment(captured);
      log.info("Auto-captured {} memories", captured);
    }
    return captured;
  }

  static float importanceFor(double score) {
    return (float) Math.min(BASE_IMPORTANCE + score * SCORE_WEIGHT, MAX_IMPORTANCE);
  }
}
