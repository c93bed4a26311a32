package com.flamingo.ai.notesearch.service.rerank;

import com.flamingo.ai.notesearch.domain.model.RetrievalCandidate;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** Cross-encoder reranker backed by a Hugging Face TEI container. */
@Service
@ConditionalOnProperty(
    name = "search.reranking.strategy",
    havingValue = "tei",
    matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class TeiCrossEncoderReranker implements Reranker {

  private final TeiRerankerClient teiRerankerClient;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "search.reranker.tei", description = "Time for TEI cross-encoder reranking")
  @CircuitBreaker(name = "tei", fallbackMethod = "rerankFallback")
  @Retry(name = "tei")
  public RerankResult rerank(String query, List<RetrievalCandidate> candidates) {
    if (candidates.isEmpty()) {
      return new RerankResult(List.of(), false);
    }
    log.debug("TEI reranking {} candidates for query: {}", candidates.size(), query);

    List<String> texts =
        candidates.stream().map(candidate -> candidate.getEntry().embeddingText()).toList();
    List<TeiRerankerClient.RerankScore> scores = teiRerankerClient.rerank(query, texts);
    if (scores == null || scores.size() != candidates.size()) {
      throw new IllegalStateException(
          "TEI returned "
              + (scores == null ? 0 : scores.size())
              + " scores for "
              + candidates.size()
              + " texts");
    }

    List<ScoredCandidate> scored = new ArrayList<>(scores.size());
    for (TeiRerankerClient.RerankScore score : scores) {
      scored.add(new ScoredCandidate(candidates.get(score.index()), score.score()));
    }
    scored.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());
    meterRegistry.counter("search.reranker.tei.invocations").increment();

    log.debug(
        "TEI reranking complete, top score: {}", String.format("%.3f", scored.get(0).score()));
    return new RerankResult(scored, false);
  }

  /** Keeps the fused order when TEI is unavailable. */
  @SuppressWarnings("unused")
  RerankResult rerankFallback(String query, List<RetrievalCandidate> candidates, Throwable t) {
    log.warn("TEI reranker unavailable, keeping fused order: {}", t.getMessage());
    meterRegistry.counter("search.reranker.tei.fallback").increment();
    return RerankResult.degraded(candidates);
  }
}
