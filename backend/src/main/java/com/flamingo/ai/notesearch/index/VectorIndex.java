package com.flamingo.ai.notesearch.index;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Exact cosine similarity over precomputed embeddings, held in a LangChain4j {@link
 * InMemoryEmbeddingStore} keyed by entry id.
 *
 * <p>Vectors are L2-normalized when added. Zero-norm vectors are kept out of the index and never
 * match.
 */
@Slf4j
public final class VectorIndex {

  private final String embeddingModel;
  private final int dimension;
  private final InMemoryEmbeddingStore<TextSegment> store;
  private final Map<String, Embedding> embeddings;

  private VectorIndex(
      String embeddingModel,
      int dimension,
      InMemoryEmbeddingStore<TextSegment> store,
      Map<String, Embedding> embeddings) {
    this.embeddingModel = embeddingModel;
    this.dimension = dimension;
    this.store = store;
    this.embeddings = Collections.unmodifiableMap(embeddings);
  }

  public static Builder builder(String embeddingModel) {
    return new Builder(embeddingModel);
  }

  public static VectorIndex empty(String embeddingModel) {
    return new VectorIndex(embeddingModel, 0, new InMemoryEmbeddingStore<>(), Map.of());
  }

  /**
   * Restores an index serialized by {@link #toJson()}. The model and dimension come from the
   * corpus metadata; without a dimension the stored vectors cannot be queried.
   */
  public static VectorIndex fromJson(String json, String embeddingModel, Integer dimension) {
    InMemoryEmbeddingStore<TextSegment> store = InMemoryEmbeddingStore.fromJson(json);
    if (dimension == null || dimension <= 0) {
      log.warn("No embedding dimension recorded for model {}, vectors unavailable", embeddingModel);
      return new VectorIndex(embeddingModel, 0, store, Map.of());
    }
    // a match carries the stored embedding, so one unbounded search enumerates the store
    float[] axis = new float[dimension];
    axis[0] = 1f;
    Map<String, Embedding> embeddings = new LinkedHashMap<>();
    for (EmbeddingMatch<TextSegment> match :
        store.search(request(axis, Integer.MAX_VALUE)).matches()) {
      embeddings.put(match.embeddingId(), match.embedding());
    }
    return new VectorIndex(embeddingModel, dimension, store, embeddings);
  }

  public String toJson() {
    return store.serializeToJson();
  }

  public String getEmbeddingModel() {
    return embeddingModel;
  }

  public int getDimension() {
    return dimension;
  }

  public int size() {
    return embeddings.size();
  }

  /** Returns the stored (normalized) vector of an entry, or {@code null} if it has none. */
  public float[] vectorOf(String entryId) {
    Embedding embedding = embeddings.get(entryId);
    return embedding == null ? null : embedding.vector();
  }

  /**
   * Ranks entries by cosine similarity to {@code embedding}. A query of the wrong dimension (for
   * example after an embedding model change) returns an empty list.
   */
  public List<VectorHit> query(float[] embedding, int limit) {
    if (embedding == null || embedding.length == 0 || embeddings.isEmpty() || limit <= 0) {
      return List.of();
    }
    if (embedding.length != dimension) {
      log.warn(
          "Query embedding dimension {} does not match index dimension {} (model {}), skipping"
              + " vector search",
          embedding.length,
          dimension,
          embeddingModel);
      return List.of();
    }
    if (isZero(embedding)) {
      return List.of();
    }
    List<VectorHit> hits = new ArrayList<>(embeddings.size());
    for (EmbeddingMatch<TextSegment> match :
        store.search(request(embedding, embeddings.size())).matches()) {
      hits.add(
          new VectorHit(
              match.embeddingId(), CosineSimilarity.fromRelevanceScore(match.score())));
    }
    hits.sort(
        Comparator.comparingDouble(VectorHit::similarity)
            .reversed()
            .thenComparing(VectorHit::entryId));
    return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
  }

  private static EmbeddingSearchRequest request(float[] vector, int maxResults) {
    return EmbeddingSearchRequest.builder()
        .queryEmbedding(Embedding.from(vector))
        .maxResults(maxResults)
        .minScore(0.0)
        .build();
  }

  private static boolean isZero(float[] vector) {
    for (float v : vector) {
      if (v != 0f && !Float.isNaN(v)) {
        return false;
      }
    }
    return true;
  }

  public record VectorHit(String entryId, double similarity) {}

  /** Collects vectors; the first non-empty vector fixes the dimension. */
  public static final class Builder {

    private final String embeddingModel;
    private final Map<String, Embedding> embeddings = new LinkedHashMap<>();
    private int dimension;

    private Builder(String embeddingModel) {
      this.embeddingModel = embeddingModel;
    }

    /**
     * Adds a vector. Returns {@code false} (and skips it) for empty or zero vectors and for
     * vectors whose dimension differs from the ones already added.
     */
    public boolean add(String entryId, float[] vector) {
      if (vector == null || vector.length == 0 || isZero(vector)) {
        return false;
      }
      if (dimension == 0) {
        dimension = vector.length;
      } else if (vector.length != dimension) {
        log.warn(
            "Skipping vector for {}: dimension {} differs from {}",
            entryId,
            vector.length,
            dimension);
        return false;
      }
      Embedding embedding = Embedding.from(vector.clone());
      embedding.normalize();
      embeddings.put(entryId, embedding);
      return true;
    }

    public VectorIndex build() {
      InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
      embeddings.forEach((entryId, embedding) -> store.add(entryId, embedding));
      return new VectorIndex(
          embeddingModel, dimension, store, new LinkedHashMap<>(embeddings));
    }
  }
}
