package com.flamingo.ai.notesearch.service.indexing;

import com.flamingo.ai.notesearch.config.SearchConfig;
import com.flamingo.ai.notesearch.domain.model.Chunk;
import com.flamingo.ai.notesearch.domain.model.Corpus;
import com.flamingo.ai.notesearch.domain.model.CorpusIndexMetadata;
import com.flamingo.ai.notesearch.domain.model.IndexEntry;
import com.flamingo.ai.notesearch.domain.model.Item;
import com.flamingo.ai.notesearch.exception.IndexingException;
import com.flamingo.ai.notesearch.index.CorpusIndexStore;
import com.flamingo.ai.notesearch.index.IndexSnapshot;
import com.flamingo.ai.notesearch.index.LexicalIndex;
import com.flamingo.ai.notesearch.index.VectorIndex;
import com.flamingo.ai.notesearch.service.chunking.Chunker;
import com.flamingo.ai.notesearch.service.corpus.CorpusManager;
import com.flamingo.ai.notesearch.service.corpus.RetrievalClientCache;
import com.flamingo.ai.notesearch.service.embedding.EmbeddingService;
import com.flamingo.ai.notesearch.service.profile.ProfileRegistry;
import com.flamingo.ai.notesearch.service.profile.SearchProfile;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Rebuilds corpus indexes.
 *
 * <p>A rebuild validates the storage binding first, so a refused rebuild writes nothing. It then
 * chunks and embeds the items (reusing stored vectors of unchanged entries unless a full rebuild
 * is requested), writes the index files with the metadata last, and swaps the new snapshot into
 * the cached client. Queries keep reading the previous snapshot until the swap. One rebuild per
 * corpus runs at a time.
 */
@Service
@Slf4j
public class IndexingService {

  private final CorpusManager corpusManager;
  private final ItemSource itemSource;
  private final Chunker chunker;
  private final EmbeddingService embeddingService;
  private final CorpusIndexStore indexStore;
  private final RetrievalClientCache clientCache;
  private final ProfileRegistry profileRegistry;
  private final SearchConfig searchConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Executor indexingExecutor;
  private final Map<String, ReentrantLock> corpusLocks = new ConcurrentHashMap<>();

  public IndexingService(
      CorpusManager corpusManager,
      ItemSource itemSource,
      Chunker chunker,
      EmbeddingService embeddingService,
      CorpusIndexStore indexStore,
      RetrievalClientCache clientCache,
      ProfileRegistry profileRegistry,
      SearchConfig searchConfig,
      MeterRegistry meterRegistry,
      Clock clock,
      @Qualifier("indexingExecutor") Executor indexingExecutor) {
    this.corpusManager = corpusManager;
    this.itemSource = itemSource;
    this.chunker = chunker;
    this.embeddingService = embeddingService;
    this.indexStore = indexStore;
    this.clientCache = clientCache;
    this.profileRegistry = profileRegistry;
    this.searchConfig = searchConfig;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.indexingExecutor = indexingExecutor;
  }

  /** Runs {@link #reindex} on the indexing executor. */
  public CompletableFuture<IndexingResult> reindexAsync(
      String corpusName, boolean force, boolean full, String profileName) {
    // resolve names up front so bad requests fail synchronously
    corpusManager.getCorpus(corpusName);
    profileRegistry.get(profileName);
    return CompletableFuture.supplyAsync(
        () -> reindex(corpusName, force, full, profileName), indexingExecutor);
  }

  /**
   * Rebuilds the index of a corpus.
   *
   * @param corpusName corpus to rebuild, blank for the default corpus
   * @param force rebind a storage directory that belongs to another corpus root
   * @param full re-embed every entry instead of reusing unchanged vectors
   * @param profileName profile whose chunking settings apply, blank for the default profile
   */
  @Timed(value = "search.reindex", description = "Time to rebuild a corpus index")
  public IndexingResult reindex(
      String corpusName, boolean force, boolean full, String profileName) {
    Corpus corpus = corpusManager.getCorpus(corpusName);
    SearchProfile profile = profileRegistry.get(profileName);
    ReentrantLock lock = corpusLocks.computeIfAbsent(corpus.name(), name -> new ReentrantLock());
    lock.lock();
    try {
      return rebuild(corpus, profile, force, full);
    } finally {
      lock.unlock();
    }
  }

  private IndexingResult rebuild(
      Corpus corpus, SearchProfile profile, boolean force, boolean full) {
    long start = System.currentTimeMillis();
    log.info(
        "Reindexing corpus {} (root={}, storage={}, profile={}, force={}, full={})",
        corpus.name(),
        corpus.root(),
        corpus.storagePath(),
        profile.getName(),
        force,
        full);

    corpusManager.validateSafe(corpus.storagePath(), corpus.root(), "reindex", force);

    List<Item> items;
    try {
      items = itemSource.load(corpus);
    } catch (IOException e) {
      meterRegistry.counter("search.reindex.failure", "reason", "item_source").increment();
      throw new IndexingException(
          corpus.name(), "Failed to read items for corpus " + corpus.name(), e);
    }

    Chunker windowed = chunker.withWindow(profile.getChunkSize(), profile.getChunkOverlap());
    List<IndexEntry> entries = new ArrayList<>();
    List<Chunk> splitChunks = new ArrayList<>();
    int chunkedItems = 0;
    for (Item item : items) {
      List<Chunk> chunks =
          windowed.chunkForIndexing(
              item.getId(), item.getTitle(), item.getBody(), profile.isChunkingEnabled());
      if (chunks.size() <= 1) {
        entries.add(IndexEntry.ofItem(item));
        continue;
      }
      chunkedItems++;
      splitChunks.addAll(chunks);
      for (Chunk chunk : chunks) {
        entries.add(IndexEntry.ofChunk(item, chunk));
      }
    }

    IndexSnapshot previous = full ? null : reusableSnapshot(corpus);
    VectorIndex.Builder vectors = VectorIndex.builder(corpus.embeddingModel());
    List<IndexEntry> toEmbed = new ArrayList<>();
    int reused = 0;
    for (IndexEntry entry : entries) {
      float[] stored = previous == null ? null : reusableVector(previous, entry);
      if (stored != null) {
        vectors.add(entry.entryId(), stored);
        reused++;
      } else {
        toEmbed.add(entry);
      }
    }
    embed(corpus, toEmbed, vectors);

    SearchConfig.Lexical lexical = searchConfig.getLexical();
    LexicalIndex lexicalIndex =
        LexicalIndex.build(entries, lexical.getK1(), lexical.getB(), lexical.getTagRepeat());
    VectorIndex vectorIndex = vectors.build();
    Instant indexedAt = clock.instant();
    CorpusIndexMetadata metadata =
        CorpusIndexMetadata.builder()
            .corpusRoot(corpus.root().toString())
            .corpusName(corpus.name())
            .embeddingModel(corpus.embeddingModel())
            .indexedAt(indexedAt)
            .itemCount(items.size())
            .entryCount(entries.size())
            .embeddingDimension(vectorIndex.getDimension())
            .build();
    IndexSnapshot snapshot = new IndexSnapshot(entries, lexicalIndex, vectorIndex, metadata);

    try {
      indexStore.write(corpus.storagePath(), snapshot);
    } catch (IOException e) {
      meterRegistry.counter("search.reindex.failure", "reason", "write").increment();
      throw new IndexingException(
          corpus.name(), "Failed to write index to " + corpus.storagePath(), e);
    }
    clientCache.publish(corpus, snapshot);

    Chunker.ChunkStatistics stats = Chunker.statistics(splitChunks);
    long duration = System.currentTimeMillis() - start;
    log.info(
        "Reindexed corpus {}: {} items, {} entries, {} chunked items ({} chunks, size"
            + " min/avg/max {}/{}/{}, ~{} tokens avg), {} embedded, {} reused in {} ms",
        corpus.name(),
        items.size(),
        entries.size(),
        chunkedItems,
        stats.count(),
        stats.minSize(),
        String.format("%.0f", stats.avgSize()),
        stats.maxSize(),
        stats.avgEstimatedTokens(),
        toEmbed.size(),
        reused,
        duration);
    meterRegistry.counter("search.reindex.success").increment();

    return new IndexingResult(
        corpus.name(),
        profile.getName(),
        items.size(),
        entries.size(),
        chunkedItems,
        toEmbed.size(),
        reused,
        stats,
        indexedAt,
        duration);
  }

  private void embed(Corpus corpus, List<IndexEntry> toEmbed, VectorIndex.Builder vectors) {
    if (toEmbed.isEmpty()) {
      return;
    }
    List<String> texts = toEmbed.stream().map(IndexEntry::embeddingText).toList();
    List<float[]> embeddings = embeddingService.embedPassages(texts);
    if (embeddings.size() != texts.size()) {
      meterRegistry.counter("search.reindex.failure", "reason", "embedding").increment();
      throw new IndexingException(
          corpus.name(),
          "Embedding returned "
              + embeddings.size()
              + " vectors for "
              + texts.size()
              + " entries in corpus "
              + corpus.name(),
          null,
          true);
    }
    for (int i = 0; i < toEmbed.size(); i++) {
      if (!vectors.add(toEmbed.get(i).entryId(), embeddings.get(i))) {
        log.warn(
            "No usable vector for {}, it is searchable lexically only",
            toEmbed.get(i).entryId());
      }
    }
  }

  /**
   * The snapshot whose vectors may be reused: the cached one if present, otherwise the one on
   * disk. Vectors built with another model or for another corpus root are never reused.
   */
  private IndexSnapshot reusableSnapshot(Corpus corpus) {
    IndexSnapshot previous = null;
    if (clientCache.contains(corpus)) {
      previous = clientCache.get(corpus).snapshot();
    }
    if (previous == null || previous.size() == 0) {
      try {
        previous = indexStore.load(corpus.storagePath());
      } catch (IOException e) {
        log.warn(
            "Previous index of {} unreadable, embedding everything: {}",
            corpus.name(),
            e.getMessage());
        return null;
      }
    }
    if (previous == null) {
      return null;
    }
    if (!corpus.embeddingModel().equals(previous.getVectorIndex().getEmbeddingModel())) {
      log.info(
          "Embedding model changed ({} -> {}), re-embedding corpus {}",
          previous.getVectorIndex().getEmbeddingModel(),
          corpus.embeddingModel(),
          corpus.name());
      return null;
    }
    CorpusIndexMetadata metadata = previous.getMetadata();
    if (metadata != null
        && metadata.getCorpusRoot() != null
        && !corpus.root().toString().equals(metadata.getCorpusRoot())) {
      return null;
    }
    return previous;
  }

  private static float[] reusableVector(IndexSnapshot previous, IndexEntry entry) {
    IndexEntry old = previous.entry(entry.entryId());
    if (old == null
        || entry.modifiedAt() == null
        || !Objects.equals(old.modifiedAt(), entry.modifiedAt())
        || !old.embeddingText().equals(entry.embeddingText())) {
      return null;
    }
    return previous.getVectorIndex().vectorOf(entry.entryId());
  }
}
