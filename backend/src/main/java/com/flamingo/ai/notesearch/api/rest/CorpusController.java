package com.flamingo.ai.notesearch.api.rest;

import com.flamingo.ai.notesearch.api.dto.response.CorpusResponse;
import com.flamingo.ai.notesearch.api.dto.response.ReindexResponse;
import com.flamingo.ai.notesearch.domain.model.Corpus;
import com.flamingo.ai.notesearch.domain.model.CorpusIndexMetadata;
import com.flamingo.ai.notesearch.service.corpus.CorpusManager;
import com.flamingo.ai.notesearch.service.corpus.RetrievalClientCache;
import com.flamingo.ai.notesearch.service.indexing.IndexingService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for corpora and their indexes. */
@RestController
@RequestMapping("/api/corpora")
@RequiredArgsConstructor
@Slf4j
public class CorpusController {

  private final CorpusManager corpusManager;
  private final RetrievalClientCache clientCache;
  private final IndexingService indexingService;

  /** Lists configured corpora. */
  @GetMapping
  public ResponseEntity<List<CorpusResponse>> listCorpora() {
    return ResponseEntity.ok(corpusManager.listCorpora().stream().map(this::toResponse).toList());
  }

  /** Gets a corpus and its index metadata. */
  @GetMapping("/{name}")
  public ResponseEntity<CorpusResponse> getCorpus(@PathVariable String name) {
    return ResponseEntity.ok(toResponse(corpusManager.getCorpus(name)));
  }

  /** Rebuilds a corpus index and waits for it to finish. */
  @PostMapping("/{name}/reindex")
  public ResponseEntity<ReindexResponse> reindex(
      @PathVariable String name,
      @RequestParam(defaultValue = "false") boolean force,
      @RequestParam(defaultValue = "false") boolean full,
      @RequestParam(required = false) String profile) {
    return ResponseEntity.ok(
        ReindexResponse.fromResult(indexingService.reindex(name, force, full, profile)));
  }

  /** Queues a rebuild. Progress and failures are reported in the log. */
  @PostMapping("/{name}/reindex/async")
  public ResponseEntity<ReindexResponse> reindexAsync(
      @PathVariable String name,
      @RequestParam(defaultValue = "false") boolean force,
      @RequestParam(defaultValue = "false") boolean full,
      @RequestParam(required = false) String profile) {
    indexingService
        .reindexAsync(name, force, full, profile)
        .whenComplete(
            (result, error) -> {
              if (error != null) {
                log.error("Background reindex of {} failed", name, error);
              }
            });
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(ReindexResponse.accepted(name, profile));
  }

  private CorpusResponse toResponse(Corpus corpus) {
    CorpusIndexMetadata metadata = corpusManager.getIndexMetadata(corpus.storagePath());
    return CorpusResponse.fromCorpus(corpus, metadata, clientCache.contains(corpus));
  }
}
