package com.flamingo.ai.notesearch.service.embedding;

import com.flamingo.ai.notesearch.config.SearchConfig;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for generating text embeddings through the configured LangChain4j embedding model.
 *
 * <p>Failures open the {@code embedding} circuit breaker and return empty results: an empty query
 * vector means the vector lookup is skipped, an empty batch means the reindex fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final SearchConfig searchConfig;
  private final MeterRegistry meterRegistry;

  /** Identifier of the model vectors are produced with. */
  public String modelId() {
    return searchConfig.getEmbedding().getModelId();
  }

  /**
   * Embeds a query.
   *
   * @param query the query text
   * @return embedding vector, or an empty array if the model is unavailable
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedQueryFallback")
  @Retry(name = "embedding")
  public float[] embedQuery(String query) {
    String text = truncate(query, "query");
    Response<Embedding> response = embeddingModel.embed(text);
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return response.content().vector();
  }

  /**
   * Embeds passages in batches, preserving order.
   *
   * @param texts the passages to embed
   * @return one vector per passage, or an empty list if the model is unavailable
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedPassagesFallback")
  @Retry(name = "embedding")
  public List<float[]> embedPassages(List<String> texts) {
    int batchSize = Math.max(1, searchConfig.getEmbedding().getBatchSize());
    List<float[]> results = new ArrayList<>(texts.size());
    for (int from = 0; from < texts.size(); from += batchSize) {
      List<TextSegment> segments = new ArrayList<>();
      for (int i = from; i < Math.min(from + batchSize, texts.size()); i++) {
        segments.add(TextSegment.from(truncate(texts.get(i), "passage " + i)));
      }
      Response<List<Embedding>> response = embeddingModel.embedAll(segments);
      for (Embedding embedding : response.content()) {
        results.add(embedding.vector());
      }
      log.debug("Embedded passages {}-{} of {}", from, from + segments.size(), texts.size());
    }
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment(texts.size());
    return results;
  }

  private String truncate(String text, String label) {
    int max = searchConfig.getEmbedding().getMaxInputChars();
    if (text.length() <= max) {
      return text;
    }
    log.warn(
        "Text for {} too long for embedding, truncating from {} to {} chars",
        label,
        text.length(),
        max);
    meterRegistry.counter("embedding.truncations").increment();
    return text.substring(0, max);
  }

  @SuppressWarnings("unused")
  private float[] embedQueryFallback(String query, Throwable t) {
    log.warn("Query embedding failed, vector search will be skipped: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
    return new float[0];
  }

  @SuppressWarnings("unused")
  private List<float[]> embedPassagesFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} passages failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "passage").increment();
    return List.of();
  }
}
