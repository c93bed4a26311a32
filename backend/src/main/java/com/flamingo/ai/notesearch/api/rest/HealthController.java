package com.flamingo.ai.notesearch.api.rest;

import com.flamingo.ai.notesearch.api.dto.response.CorpusResponse;
import com.flamingo.ai.notesearch.api.dto.response.SystemStats;
import com.flamingo.ai.notesearch.service.corpus.CorpusManager;
import com.flamingo.ai.notesearch.service.corpus.RetrievalClientCache;
import com.flamingo.ai.notesearch.service.embedding.EmbeddingService;
import com.flamingo.ai.notesearch.service.profile.ProfileRegistry;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and system info. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final RetrievalClientCache clientCache;
  private final CorpusManager corpusManager;
  private final ProfileRegistry profileRegistry;
  private final EmbeddingService embeddingService;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", Instant.now());
    health.put("service", "notesearch");
    health.put("cachedCorpora", clientCache.stats().cachedCorpora());
    return ResponseEntity.ok(health);
  }

  /** Returns client cache and corpus statistics. */
  @GetMapping("/stats")
  public ResponseEntity<SystemStats> stats() {
    List<CorpusResponse> corpora =
        corpusManager.listCorpora().stream()
            .map(
                corpus ->
                    CorpusResponse.fromCorpus(
                        corpus,
                        corpusManager.getIndexMetadata(corpus.storagePath()),
                        clientCache.contains(corpus)))
            .toList();
    return ResponseEntity.ok(
        SystemStats.builder()
            .clientCache(clientCache.stats())
            .corpora(corpora)
            .profileCount(profileRegistry.list().size())
            .embeddingModel(embeddingService.modelId())
            .timestamp(Instant.now())
            .build());
  }
}
