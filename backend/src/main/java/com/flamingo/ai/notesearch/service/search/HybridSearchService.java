package com.flamingo.ai.notesearch.service.search;

import com.flamingo.ai.notesearch.api.dto.request.SearchRequest;
import com.flamingo.ai.notesearch.config.SearchConfig;
import com.flamingo.ai.notesearch.domain.enums.ItemStatus;
import com.flamingo.ai.notesearch.domain.enums.PipelineStage;
import com.flamingo.ai.notesearch.domain.model.Corpus;
import com.flamingo.ai.notesearch.domain.model.IndexEntry;
import com.flamingo.ai.notesearch.domain.model.RetrievalCandidate;
import com.flamingo.ai.notesearch.exception.SearchException;
import com.flamingo.ai.notesearch.index.IndexSnapshot;
import com.flamingo.ai.notesearch.index.LexicalIndex.LexicalHit;
import com.flamingo.ai.notesearch.index.VectorIndex.VectorHit;
import com.flamingo.ai.notesearch.service.chunking.ChunkDeduplicator;
import com.flamingo.ai.notesearch.service.corpus.CorpusManager;
import com.flamingo.ai.notesearch.service.corpus.RetrievalClientCache;
import com.flamingo.ai.notesearch.service.embedding.EmbeddingService;
import com.flamingo.ai.notesearch.service.fusion.FusionOptions;
import com.flamingo.ai.notesearch.service.fusion.HybridFusion;
import com.flamingo.ai.notesearch.service.profile.ProfileRegistry;
import com.flamingo.ai.notesearch.service.profile.SearchProfile;
import com.flamingo.ai.notesearch.service.profile.TimeDecaySettings;
import com.flamingo.ai.notesearch.service.query.QueryExpander;
import com.flamingo.ai.notesearch.service.rerank.CrossEncoderRefiner;
import com.flamingo.ai.notesearch.service.scoring.TimeDecayScorer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the query pipeline: optional expansion, parallel lexical and vector lookups, fusion,
 * filters, time decay, chunk deduplication, the score threshold, and cross-encoder refinement.
 *
 * <p>Stage failures degrade instead of failing the query: a failed lookup contributes an empty
 * list and a failed refinement keeps the current order. Such stages are reported as skipped.
 */
@Service
@Slf4j
public class HybridSearchService {

  private static final Set<ItemStatus> HIDDEN_BY_DEFAULT =
      EnumSet.of(ItemStatus.INACTIVE, ItemStatus.HIDDEN);

  private final ProfileRegistry profileRegistry;
  private final CorpusManager corpusManager;
  private final RetrievalClientCache clientCache;
  private final EmbeddingService embeddingService;
  private final QueryExpander queryExpander;
  private final HybridFusion hybridFusion;
  private final TimeDecayScorer timeDecayScorer;
  private final ChunkDeduplicator chunkDeduplicator;
  private final CrossEncoderRefiner crossEncoderRefiner;
  private final SearchConfig searchConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Executor searchExecutor;

  public HybridSearchService(
      ProfileRegistry profileRegistry,
      CorpusManager corpusManager,
      RetrievalClientCache clientCache,
      EmbeddingService embeddingService,
      QueryExpander queryExpander,
      HybridFusion hybridFusion,
      TimeDecayScorer timeDecayScorer,
      ChunkDeduplicator chunkDeduplicator,
      CrossEncoderRefiner crossEncoderRefiner,
      SearchConfig searchConfig,
      MeterRegistry meterRegistry,
      Clock clock,
      @Qualifier("searchExecutor") Executor searchExecutor) {
    this.profileRegistry = profileRegistry;
    this.corpusManager = corpusManager;
    this.clientCache = clientCache;
    this.embeddingService = embeddingService;
    this.queryExpander = queryExpander;
    this.hybridFusion = hybridFusion;
    this.timeDecayScorer = timeDecayScorer;
    this.chunkDeduplicator = chunkDeduplicator;
    this.crossEncoderRefiner = crossEncoderRefiner;
    this.searchConfig = searchConfig;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.searchExecutor = searchExecutor;
  }

  /** Runs a query against one corpus snapshot. */
  @Timed(value = "search.query", description = "Time to answer a search query")
  public SearchResult search(SearchRequest request) {
    long start = System.currentTimeMillis();
    SearchProfile profile = profileRegistry.get(request.getProfile());
    Corpus corpus = corpusManager.getCorpus(request.getCorpus());
    SearchConfig.Retrieval retrieval = searchConfig.getRetrieval();
    int limit =
        Math.min(
            request.getLimit() != null ? request.getLimit() : retrieval.getDefaultLimit(),
            retrieval.getMaxLimit());
    int candidateLimit =
        Math.max(retrieval.getMinCandidates(), limit * retrieval.getCandidatesMultiplier());

    IndexSnapshot snapshot = currentSnapshot(corpus);
    Set<PipelineStage> skipped = EnumSet.noneOf(PipelineStage.class);
    FusionOptions baseOptions = fusionOptions(request, profile, request.getQuery());

    String effectiveQuery = request.getQuery();
    boolean expansion =
        enabled(request.getExpansion(), profile.isQueryExpansionEnabled())
            && searchConfig.getQueryExpansion().isEnabled();
    if (expansion && queryExpander.shouldExpand(request.getQuery())) {
      effectiveQuery = expandQuery(snapshot, baseOptions, candidateLimit);
      if (!effectiveQuery.equals(request.getQuery())) {
        log.info("Expanded query '{}' -> '{}'", request.getQuery(), effectiveQuery);
        meterRegistry.counter("search.query.expanded").increment();
      }
    }

    FusionOptions options =
        effectiveQuery.equals(request.getQuery())
            ? baseOptions
            : fusionOptions(request, profile, effectiveQuery);
    List<RetrievalCandidate> candidates = retrieve(snapshot, options, candidateLimit, skipped);
    int fused = candidates.size();

    Instant now = clock.instant();
    candidates = filter(candidates, request, profile, now);

    TimeDecaySettings decay = timeDecaySettings(request, profile);
    if (decay != null) {
      candidates = timeDecayScorer.apply(candidates, now, decay);
    }

    candidates = chunkDeduplicator.dedupe(candidates);

    if (request.getMinScore() != null) {
      double minScore = request.getMinScore();
      candidates = candidates.stream().filter(c -> c.getScore() >= minScore).toList();
    }

    boolean rerank =
        enabled(request.getRerank(), profile.isCrossEncoderEnabled())
            && searchConfig.getReranking().isEnabled();
    if (rerank) {
      CrossEncoderRefiner.RefineResult refined =
          crossEncoderRefiner.refine(effectiveQuery, candidates, limit);
      if (!refined.applied()) {
        skipped.add(PipelineStage.RERANK);
      }
      candidates = refined.candidates();
    } else if (candidates.size() > limit) {
      candidates = List.copyOf(candidates.subList(0, limit));
    }

    long took = System.currentTimeMillis() - start;
    if (!skipped.isEmpty()) {
      meterRegistry.counter("search.query.degraded").increment();
    }
    log.debug(
        "Query '{}' on {} ({}): {} fused, {} returned, skipped={} in {} ms",
        effectiveQuery,
        corpus.name(),
        profile.getName(),
        fused,
        candidates.size(),
        skipped,
        took);
    return new SearchResult(
        request.getQuery(),
        effectiveQuery,
        corpus.name(),
        profile.getName(),
        candidates,
        List.copyOf(skipped),
        profile.isShowChunkContext(),
        took);
  }

  /**
   * Expands the query from the top results of a first pass. The first pass is not reported: its
   * degraded stages are retried by the main pass, and if it fails outright the original query is
   * kept.
   */
  private String expandQuery(IndexSnapshot snapshot, FusionOptions options, int candidateLimit) {
    int seedCount = searchConfig.getQueryExpansion().getSeedCount();
    List<String> seeds;
    try {
      seeds =
          retrieve(
                  snapshot,
                  options,
                  Math.max(seedCount, candidateLimit),
                  EnumSet.noneOf(PipelineStage.class))
              .stream()
              .limit(seedCount)
              .map(candidate -> candidate.getEntry().embeddingText())
              .toList();
    } catch (SearchException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("Seed retrieval for query expansion failed, using original query", e);
      meterRegistry.counter("search.stage.skipped", "stage", "EXPANSION").increment();
      return options.query();
    }
    return queryExpander.expand(options.query(), seeds);
  }

  /** Parallel lexical and vector lookups followed by fusion. */
  private List<RetrievalCandidate> retrieve(
      IndexSnapshot snapshot, FusionOptions options, int limit, Set<PipelineStage> skipped) {
    String query = options.query();
    CompletableFuture<List<LexicalHit>> lexicalFuture =
        CompletableFuture.supplyAsync(
            () -> snapshot.getLexicalIndex().query(query, limit), searchExecutor);

    CompletableFuture<List<VectorHit>> vectorFuture;
    String indexModel = snapshot.getVectorIndex().getEmbeddingModel();
    if (snapshot.getVectorIndex().size() == 0) {
      vectorFuture = CompletableFuture.completedFuture(List.of());
    } else if (!embeddingService.modelId().equals(indexModel)) {
      log.warn(
          "Index vectors were built with {} but the query model is {}, reindex the corpus;"
              + " using lexical results only",
          indexModel,
          embeddingService.modelId());
      skipped.add(PipelineStage.VECTOR);
      vectorFuture = CompletableFuture.completedFuture(List.of());
    } else {
      vectorFuture =
          CompletableFuture.supplyAsync(
              () -> {
                float[] embedding = embeddingService.embedQuery(query);
                if (embedding.length == 0) {
                  throw new IllegalStateException("query embedding unavailable");
                }
                return snapshot.getVectorIndex().query(embedding, limit);
              },
              searchExecutor);
    }

    List<LexicalHit> lexicalHits = await(lexicalFuture, PipelineStage.LEXICAL, skipped);
    List<VectorHit> vectorHits = await(vectorFuture, PipelineStage.VECTOR, skipped);
    return hybridFusion.fuse(lexicalHits, vectorHits, snapshot, options);
  }

  private <T> List<T> await(
      CompletableFuture<List<T>> future, PipelineStage stage, Set<PipelineStage> skipped) {
    long timeoutMs = searchConfig.getRetrieval().getLookupTimeoutMs();
    try {
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("{} lookup timed out after {} ms, continuing without it", stage, timeoutMs);
    } catch (ExecutionException e) {
      log.warn("{} lookup failed, continuing without it: {}", stage, e.getCause().getMessage());
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new SearchException("Search interrupted", e);
    }
    skipped.add(stage);
    meterRegistry.counter("search.stage.skipped", "stage", stage.name()).increment();
    return List.of();
  }

  private List<RetrievalCandidate> filter(
      List<RetrievalCandidate> candidates,
      SearchRequest request,
      SearchProfile profile,
      Instant now) {
    Set<ItemStatus> allowed = allowedStatuses(request);
    Set<String> includeTypes =
        lowerCase(
            isEmpty(request.getIncludeTypes())
                ? profile.getIncludeTypes()
                : request.getIncludeTypes());
    // explicit request types replace the profile's default exclusions
    Set<String> excludeTypes =
        lowerCase(
            isEmpty(request.getExcludeTypes()) && isEmpty(request.getIncludeTypes())
                ? profile.getExcludeTypes()
                : request.getExcludeTypes());
    Instant cutoff =
        profile.getMaxAgeDays() == null
            ? null
            : now.minus(Duration.ofDays(profile.getMaxAgeDays()));

    List<RetrievalCandidate> kept = new ArrayList<>(candidates.size());
    for (RetrievalCandidate candidate : candidates) {
      IndexEntry entry = candidate.getEntry();
      if (!allowed.contains(entry.status())) {
        continue;
      }
      String type = entry.metadata().type().map(t -> t.toLowerCase(Locale.ROOT)).orElse(null);
      if (!includeTypes.isEmpty() && (type == null || !includeTypes.contains(type))) {
        continue;
      }
      if (type != null && excludeTypes.contains(type)) {
        continue;
      }
      if (cutoff != null && (entry.modifiedAt() == null || entry.modifiedAt().isBefore(cutoff))) {
        continue;
      }
      kept.add(candidate);
    }
    if (kept.size() < candidates.size()) {
      log.debug(
          "Filters dropped {} of {} candidates",
          candidates.size() - kept.size(),
          candidates.size());
    }
    return kept;
  }

  static Set<ItemStatus> allowedStatuses(SearchRequest request) {
    Set<ItemStatus> allowed;
    if (request.getIncludeStatuses() != null && !request.getIncludeStatuses().isEmpty()) {
      allowed = EnumSet.copyOf(request.getIncludeStatuses());
    } else {
      allowed = EnumSet.allOf(ItemStatus.class);
      allowed.removeAll(HIDDEN_BY_DEFAULT);
    }
    if (request.getExcludeStatuses() != null) {
      allowed.removeAll(request.getExcludeStatuses());
    }
    return allowed;
  }

  private FusionOptions fusionOptions(SearchRequest request, SearchProfile profile, String query) {
    boolean tagBoost =
        enabled(request.getTagBoost(), profile.isTagBoostEnabled())
            && searchConfig.getTagBoost().isEnabled();
    boolean metadataBoost = enabled(request.getMetadataBoost(), true);
    return new FusionOptions(
        query,
        profile.getHybridWeight(),
        profile.getBm25Boost(),
        tagBoost,
        metadataBoost ? profile.getMetadataBoosts() : List.of());
  }

  /**
   * The profile's decay settings, or the configured defaults when the request turns decay on for
   * a profile without it. {@code null} when decay does not run.
   */
  private TimeDecaySettings timeDecaySettings(SearchRequest request, SearchProfile profile) {
    SearchConfig.TimeDecay config = searchConfig.getTimeDecay();
    if (!config.isEnabled() || !enabled(request.getTimeDecay(), profile.getTimeDecay() != null)) {
      return null;
    }
    return profile.getTimeDecay() != null
        ? profile.getTimeDecay()
        : new TimeDecaySettings(config.getHalfLifeDays(), config.getMaxBoost());
  }

  /**
   * The corpus snapshot a query reads from. A client evicted between the cache lookup and the
   * read is closed, so the lookup is repeated once.
   */
  private IndexSnapshot currentSnapshot(Corpus corpus) {
    IndexSnapshot snapshot = clientCache.get(corpus).snapshot();
    if (snapshot == null) {
      snapshot = clientCache.get(corpus).snapshot();
    }
    if (snapshot == null) {
      throw new SearchException(
          corpus.name(), "Index of corpus " + corpus.name() + " is not available");
    }
    return snapshot;
  }

  private static boolean enabled(Boolean override, boolean profileDefault) {
    return override != null ? override : profileDefault;
  }

  private static boolean isEmpty(Collection<?> values) {
    return values == null || values.isEmpty();
  }

  private static Set<String> lowerCase(Collection<String> values) {
    if (values == null) {
      return Set.of();
    }
    return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
  }
}
