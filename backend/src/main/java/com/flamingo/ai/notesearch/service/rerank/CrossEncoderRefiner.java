package com.flamingo.ai.notesearch.service.rerank;

import com.flamingo.ai.notesearch.config.SearchConfig;
import com.flamingo.ai.notesearch.domain.model.RetrievalCandidate;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Re-scores the top {@code topN} candidates with the cross-encoder and re-sorts them into precision
 * order. Tag-boosted candidates are not sent to the model; they stay pinned ahead in their fused
 * order.
 */
@Component
@Slf4j
public class CrossEncoderRefiner {

  private final ObjectProvider<Reranker> rerankerProvider;
  private final SearchConfig searchConfig;

  public CrossEncoderRefiner(ObjectProvider<Reranker> rerankerProvider, SearchConfig searchConfig) {
    this.rerankerProvider = rerankerProvider;
    this.searchConfig = searchConfig;
  }

  /**
   * Refines {@code candidates} (already sorted by current score).
   *
   * @return the top {@code topK} candidates and whether the model was actually applied
   */
  public RefineResult refine(String query, List<RetrievalCandidate> candidates, int topK) {
    Reranker reranker = rerankerProvider.getIfAvailable();
    int topN = searchConfig.getReranking().getTopN();
    List<RetrievalCandidate> window =
        candidates.size() > topN ? candidates.subList(0, topN) : candidates;

    List<RetrievalCandidate> pinned = new ArrayList<>();
    List<RetrievalCandidate> toScore = new ArrayList<>();
    for (RetrievalCandidate candidate : window) {
      (candidate.isTagBoosted() ? pinned : toScore).add(candidate);
    }

    if (reranker == null) {
      log.debug("No reranker configured, keeping fused order");
      return new RefineResult(truncate(window, topK), false);
    }
    if (toScore.isEmpty()) {
      return new RefineResult(truncate(window, topK), true);
    }

    Reranker.RerankResult result = reranker.rerank(query, toScore);
    if (result.degraded()) {
      return new RefineResult(truncate(window, topK), false);
    }

    List<RetrievalCandidate> refined = new ArrayList<>(pinned);
    for (Reranker.ScoredCandidate scored : result.scored()) {
      scored.candidate().setCrossEncoderScore(scored.score());
      refined.add(scored.candidate());
    }
    log.debug(
        "Refined {} candidates ({} pinned by tag match)", toScore.size(), pinned.size());
    return new RefineResult(truncate(refined, topK), true);
  }

  private static List<RetrievalCandidate> truncate(List<RetrievalCandidate> list, int topK) {
    return List.copyOf(list.size() > topK ? list.subList(0, topK) : list);
  }

  /** Refined candidates; {@code applied} is false when the model was skipped or unavailable. */
  public record RefineResult(List<RetrievalCandidate> candidates, boolean applied) {}
}
