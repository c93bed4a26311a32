package com.flamingo.ai.notesearch.service.corpus;

import com.flamingo.ai.notesearch.domain.model.Corpus;
import com.flamingo.ai.notesearch.index.IndexSnapshot;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Ready-to-query handle for one corpus. Holds the current {@link IndexSnapshot}; a rebuild swaps in
 * a new snapshot atomically, so readers see either the old or the new index, never a mix.
 *
 * <p>Owned by {@link RetrievalClientCache}. Closing drops the snapshot so its postings and vectors
 * can be reclaimed.
 */
@Slf4j
public class RetrievalClient implements AutoCloseable {

  private final Corpus corpus;
  private final AtomicReference<IndexSnapshot> snapshot;

  public RetrievalClient(Corpus corpus, IndexSnapshot initial) {
    this.corpus = corpus;
    this.snapshot = new AtomicReference<>(initial);
  }

  public Corpus getCorpus() {
    return corpus;
  }

  /** Returns the current snapshot, or {@code null} once the client is closed. */
  public IndexSnapshot snapshot() {
    return snapshot.get();
  }

  /** Replaces the snapshot. Ignored on a closed client. */
  public void swap(IndexSnapshot next) {
    IndexSnapshot previous = snapshot.get();
    if (previous == null || !snapshot.compareAndSet(previous, next)) {
      log.debug("Client for {} closed, snapshot swap ignored", corpus.name());
      return;
    }
    log.info(
        "Swapped index for corpus {}: {} -> {} entries",
        corpus.name(),
        previous.size(),
        next.size());
  }

  public boolean isClosed() {
    return snapshot.get() == null;
  }

  /** Entries currently held in memory; 0 after close. */
  public int loadedEntryCount() {
    IndexSnapshot current = snapshot.get();
    return current == null ? 0 : current.size();
  }

  @Override
  public void close() {
    IndexSnapshot released = snapshot.getAndSet(null);
    if (released != null) {
      log.info("Released client for corpus {} ({} entries)", corpus.name(), released.size());
    }
  }
}
