package com.flamingo.ai.memoryvault.api.rest;

import com.flamingo.ai.memoryvault.api.dto.request.CaptureRequest;
import com.flamingo.ai.memoryvault.api.dto.request.SaveMemoryRequest;
import com.flamingo.ai.memoryvault.api.dto.response.CaptureResponse;
import com.flamingo.ai.memoryvault.api.dto.response.ConsolidationResponse;
import com.flamingo.ai.memoryvault.api.dto.response.MemoryContextResponse;
import com.flamingo.ai.memoryvault.api.dto.response.MemoryResponse;
import com.flamingo.ai.memoryvault.api.dto.response.SaveMemoryResponse;
import com.flamingo.ai.memoryvault.config.VaultConfig;
import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;
import com.flamingo.ai.memoryvault.exception.ConsolidationInProgressException;
import com.flamingo.ai.memoryvault.exception.MemoryNotFoundException;
import com.flamingo.ai.memoryvault.service.capture.AutoCaptureService;
import com.flamingo.ai.memoryvault.service.consolidation.ConsolidationScheduler;
import com.flamingo.ai.memoryvault.service.store.MemoryFilter;
import com.flamingo.ai.memoryvault.service.store.VaultStats;
import com.flamingo.ai.memoryvault.service.vault.ExportedMemory;
import com.flamingo.ai.memoryvault.service.vault.ImportResult;
import com.flamingo.ai.memoryvault.service.vault.RecalledMemory;
import com.flamingo.ai.memoryvault.service.vault.SaveOptions;
import com.flamingo.ai.memoryvault.service.vault.SaveResult;
import com.flamingo.ai.memoryvault.service.vault.VaultService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the memory vault. */
@RestController
@RequestMapping("/api/memories")
@RequiredArgsConstructor
@Slf4j
public class MemoryController {

  static final int MAX_RECALL_LIMIT = 20;
  static final int DEFAULT_LIST_LIMIT = 50;

  private final VaultService vaultService;
  private final AutoCaptureService autoCaptureService;
  private final ConsolidationScheduler consolidationScheduler;
  private final VaultConfig vaultConfig;

  /**
   * Saves a memory.
   *
   * @param request the memory to save
   * @return 201 when saved, 200 when an equivalent memory already exists, 422 when rejected
   */
  @PostMapping
  public ResponseEntity<SaveMemoryResponse> saveMemory(
      @Valid @RequestBody SaveMemoryRequest request) {

    log.info("Saving memory: category={}", request.getCategory());

    SaveResult result =
        vaultService.save(
            request.getText(),
            SaveOptions.builder()
                .category(parseCategory(request.getCategory()))
                .importance(request.getImportance())
                .namespace(request.getNamespace())
                .agentId(request.getAgentId())
                .metadata(request.getMetadata())
                .build());

    HttpStatus status =
        switch (result.status()) {
          case SAVED -> HttpStatus.CREATED;
          case DUPLICATE -> HttpStatus.OK;
          case REJECTED_INVALID, REJECTED_FLAGGED -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    return ResponseEntity.status(status).body(SaveMemoryResponse.fromResult(result));
  }

  /**
   * Recalls the memories most relevant to a query.
   *
   * @param limit number of results, clamped to 1..20
   * @return memories by descending score
   */
  @GetMapping("/search")
  public ResponseEntity<List<MemoryResponse>> search(
      @RequestParam String query,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) String category,
      @RequestParam(required = false) String namespace,
      @RequestParam(required = false) String agentId) {

    int k = clampLimit(limit != null ? limit : vaultConfig.getRecallLimit());
    MemoryFilter filter = new MemoryFilter(parseCategory(category), namespace, agentId);
    List<MemoryResponse> response =
        vaultService.recall(query, k, filter).stream().map(MemoryResponse::fromRecall).toList();
    return ResponseEntity.ok(response);
  }

  /** Lists active memories, most recently updated first. */
  @GetMapping
  public ResponseEntity<List<MemoryResponse>> listMemories(
      @RequestParam(defaultValue = "" + DEFAULT_LIST_LIMIT) int limit,
      @RequestParam(required = false) String category) {
    List<MemoryResponse> response =
        vaultService.list(limit, parseCategory(category)).stream()
            .map(MemoryResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(response);
  }

  @GetMapping("/{memoryId}")
  public ResponseEntity<MemoryResponse> getMemory(@PathVariable String memoryId) {
    return ResponseEntity.ok(MemoryResponse.fromEntity(vaultService.getMemory(memoryId)));
  }

  /**
   * Deletes a memory.
   *
   * @param memoryId the memory ID
   * @return 204 No Content on success
   */
  @DeleteMapping("/{memoryId}")
  public ResponseEntity<Void> deleteMemory(@PathVariable String memoryId) {
    if (!vaultService.forget(memoryId)) {
      throw new MemoryNotFoundException(memoryId);
    }
    return ResponseEntity.noContent().build();
  }

  /**
   * Deletes the memory nearest to a query.
   *
   * @return the deleted memory, or 404 when nothing matched
   */
  @DeleteMapping
  public ResponseEntity<MemoryResponse> deleteByQuery(@RequestParam String query) {
    return vaultService
        .forgetByQuery(query)
        .map(record -> ResponseEntity.ok(MemoryResponse.fromEntity(record)))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @GetMapping("/stats")
  public ResponseEntity<VaultStats> stats() {
    return ResponseEntity.ok(vaultService.stats());
  }

  /** Runs a consolidation pass now; 409 when one is already running. */
  @PostMapping("/consolidate")
  public ResponseEntity<ConsolidationResponse> consolidate() {
    int merged =
        consolidationScheduler.triggerNow().orElseThrow(ConsolidationInProgressException::new);
    return ResponseEntity.ok(new ConsolidationResponse(merged));
  }

  @GetMapping("/export")
  public ResponseEntity<List<ExportedMemory>> exportMemories() {
    return ResponseEntity.ok(vaultService.exportMemories());
  }

  @PostMapping("/import")
  public ResponseEntity<ImportResult> importMemories(
      @RequestBody List<ExportedMemory> memories) {
    log.info("Importing {} memories", memories.size());
    return ResponseEntity.ok(vaultService.importMemories(memories));
  }

  /** Auto-captures memory-worthy messages from one conversation turn. */
  @PostMapping("/capture")
  public ResponseEntity<CaptureResponse> capture(@Valid @RequestBody CaptureRequest request) {
    return ResponseEntity.ok(
        new CaptureResponse(autoCaptureService.captureFromTurn(request.getMessages())));
  }

  /**
   * Recalls memories for a query and renders them as a prompt context block. Returns an empty
   * block when auto-recall is disabled.
   */
  @PostMapping("/context")
  public ResponseEntity<MemoryContextResponse> context(
      @RequestParam String query, @RequestParam(required = false) Integer limit) {
    if (!vaultConfig.isAutoRecall()) {
      return ResponseEntity.ok(new MemoryContextResponse("", List.of()));
    }
    int k = clampLimit(limit != null ? limit : vaultConfig.getRecallLimit());
    List<RecalledMemory> recalled = vaultService.recall(query, k, MemoryFilter.none());
    return ResponseEntity.ok(
        new MemoryContextResponse(
            vaultService.buildMemoryContext(recalled),
            recalled.stream().map(MemoryResponse::fromRecall).toList()));
  }

  private static int clampLimit(int limit) {
    return Math.max(1, Math.min(MAX_RECALL_LIMIT, limit));
  }

  /** Null for a missing category, so filters stay open. */
  private static MemoryCategory parseCategory(String category) {
    return category == null || category.isBlank() ? null : MemoryCategory.fromValue(category);
  }
}
