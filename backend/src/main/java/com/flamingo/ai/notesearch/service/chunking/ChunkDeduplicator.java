package com.flamingo.ai.notesearch.service.chunking;

import com.flamingo.ai.notesearch.domain.model.RetrievalCandidate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Collapses candidates from the same parent item into the highest-scoring one. */
@Component
@Slf4j
public class ChunkDeduplicator {

  /**
   * Keeps one candidate per parent item. The survivor records how many sibling chunks also
   * matched; that count is informational and never affects scoring.
   */
  public List<RetrievalCandidate> dedupe(List<RetrievalCandidate> candidates) {
    Map<String, RetrievalCandidate> best = new LinkedHashMap<>();
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (RetrievalCandidate candidate : candidates) {
      String parentId = candidate.getParentId();
      counts.merge(parentId, 1, Integer::sum);
      RetrievalCandidate current = best.get(parentId);
      if (current == null || RetrievalCandidate.BY_SCORE.compare(candidate, current) < 0) {
        best.put(parentId, candidate);
      }
    }
    List<RetrievalCandidate> deduped = new ArrayList<>(best.size());
    for (Map.Entry<String, RetrievalCandidate> entry : best.entrySet()) {
      RetrievalCandidate survivor = entry.getValue();
      survivor.setSiblingCount(counts.get(entry.getKey()) - 1);
      deduped.add(survivor);
    }
    deduped.sort(RetrievalCandidate.BY_SCORE);
    if (deduped.size() < candidates.size()) {
      log.debug("Deduplicated {} candidates to {} items", candidates.size(), deduped.size());
    }
    return deduped;
  }
}
