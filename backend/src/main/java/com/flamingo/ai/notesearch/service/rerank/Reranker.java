package com.flamingo.ai.notesearch.service.rerank;

import com.flamingo.ai.notesearch.domain.model.RetrievalCandidate;
import java.util.List;

/**
 * Abstraction for scoring candidates with a joint query-document relevance model after fusion.
 */
public interface Reranker {

  /**
   * Scores every candidate against the query.
   *
   * @param query the search query
   * @param candidates candidates to score, in their current order
   * @return one score per candidate sorted by score descending, or a degraded result that keeps
   *     the input order when the model is unavailable
   */
  RerankResult rerank(String query, List<RetrievalCandidate> candidates);

  /** A candidate paired with its relevance score. */
  record ScoredCandidate(RetrievalCandidate candidate, double score) {}

  /** Scored candidates; {@code degraded} is set when the model could not be used. */
  record RerankResult(List<ScoredCandidate> scored, boolean degraded) {

    public static RerankResult degraded(List<RetrievalCandidate> candidates) {
      return new RerankResult(
          candidates.stream().map(c -> new ScoredCandidate(c, c.getScore())).toList(), true);
    }
  }
}
