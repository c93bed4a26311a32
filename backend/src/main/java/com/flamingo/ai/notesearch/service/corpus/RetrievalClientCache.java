package com.flamingo.ai.notesearch.service.corpus;

import com.flamingo.ai.notesearch.config.SearchConfig;
import com.flamingo.ai.notesearch.domain.model.Corpus;
import com.flamingo.ai.notesearch.index.IndexSnapshot;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Bounded LRU cache of {@link RetrievalClient}s keyed by corpus name and embedding model.
 *
 * <p>The lock covers only lookups, inserts and evictions. Clients are loaded outside it, so a slow
 * load never blocks queries against other corpora. Evicted clients are closed before the call that
 * evicted them returns.
 */
@Component
@Slf4j
public class RetrievalClientCache {

  private final int maxSize;
  private final RetrievalClientFactory factory;
  private final MeterRegistry meterRegistry;
  private final ReentrantLock lock = new ReentrantLock();
  private final LinkedHashMap<String, RetrievalClient> clients =
      new LinkedHashMap<>(16, 0.75f, true);

  @Autowired
  public RetrievalClientCache(
      SearchConfig searchConfig, RetrievalClientFactory factory, MeterRegistry meterRegistry) {
    this(searchConfig.getCorpus().getCacheMaxSize(), factory, meterRegistry);
  }

  RetrievalClientCache(int maxSize, RetrievalClientFactory factory, MeterRegistry meterRegistry) {
    if (maxSize < 1) {
      throw new IllegalArgumentException("Cache size must be at least 1, got " + maxSize);
    }
    this.maxSize = maxSize;
    this.factory = factory;
    this.meterRegistry = meterRegistry;
    meterRegistry.gauge("search.client_cache.size", clients, Map::size);
  }

  public static String key(Corpus corpus) {
    return corpus.name() + ":" + corpus.embeddingModel();
  }

  /** Returns the cached client for {@code corpus}, loading it on a miss. */
  public RetrievalClient get(Corpus corpus) {
    String key = key(corpus);
    lock.lock();
    try {
      RetrievalClient cached = clients.get(key);
      if (cached != null) {
        meterRegistry.counter("search.client_cache.hits").increment();
        return cached;
      }
    } finally {
      lock.unlock();
    }

    meterRegistry.counter("search.client_cache.misses").increment();
    log.info("Client cache miss for {}, loading", key);
    RetrievalClient loaded = factory.create(corpus);
    return insert(key, loaded);
  }

  /**
   * Installs a freshly built snapshot: swapped into the cached client if there is one, otherwise
   * cached as a new client.
   */
  public RetrievalClient publish(Corpus corpus, IndexSnapshot snapshot) {
    String key = key(corpus);
    lock.lock();
    try {
      RetrievalClient cached = clients.get(key);
      if (cached != null) {
        cached.swap(snapshot);
        return cached;
      }
    } finally {
      lock.unlock();
    }
    return insert(key, new RetrievalClient(corpus, snapshot));
  }

  private RetrievalClient insert(String key, RetrievalClient candidate) {
    List<RetrievalClient> toClose = new ArrayList<>();
    RetrievalClient result;
    lock.lock();
    try {
      RetrievalClient raced = clients.get(key);
      if (raced != null) {
        // another thread loaded the same corpus first
        toClose.add(candidate);
        result = raced;
      } else {
        clients.put(key, candidate);
        result = candidate;
        Iterator<Map.Entry<String, RetrievalClient>> eldest = clients.entrySet().iterator();
        while (clients.size() > maxSize && eldest.hasNext()) {
          Map.Entry<String, RetrievalClient> evicted = eldest.next();
          eldest.remove();
          toClose.add(evicted.getValue());
          log.info("Evicted client {} from cache (max size {})", evicted.getKey(), maxSize);
          meterRegistry.counter("search.client_cache.evictions").increment();
        }
      }
    } finally {
      lock.unlock();
    }
    toClose.forEach(RetrievalClient::close);
    return result;
  }

  /** Drops and closes every cached client of the named corpus. */
  public int invalidate(String corpusName) {
    List<RetrievalClient> removed = new ArrayList<>();
    lock.lock();
    try {
      Iterator<RetrievalClient> it = clients.values().iterator();
      while (it.hasNext()) {
        RetrievalClient client = it.next();
        if (client.getCorpus().name().equals(corpusName)) {
          it.remove();
          removed.add(client);
        }
      }
    } finally {
      lock.unlock();
    }
    removed.forEach(RetrievalClient::close);
    if (!removed.isEmpty()) {
      log.info("Invalidated {} cached client(s) for corpus {}", removed.size(), corpusName);
    }
    return removed.size();
  }

  public void clear() {
    List<RetrievalClient> removed;
    lock.lock();
    try {
      removed = new ArrayList<>(clients.values());
      clients.clear();
    } finally {
      lock.unlock();
    }
    removed.forEach(RetrievalClient::close);
    log.info("Cleared client cache ({} clients)", removed.size());
  }

  public boolean contains(Corpus corpus) {
    lock.lock();
    try {
      return clients.containsKey(key(corpus));
    } finally {
      lock.unlock();
    }
  }

  /** Current cache occupancy; keys are listed from least to most recently used. */
  public CacheStats stats() {
    lock.lock();
    try {
      int size = clients.size();
      return new CacheStats(size, maxSize, (double) size / maxSize, List.copyOf(clients.keySet()));
    } finally {
      lock.unlock();
    }
  }

  /** Cache occupancy snapshot. */
  public record CacheStats(int size, int maxSize, double utilization, List<String> cachedCorpora) {}
}
