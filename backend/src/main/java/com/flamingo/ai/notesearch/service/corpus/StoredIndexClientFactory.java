package com.flamingo.ai.notesearch.service.corpus;

import com.flamingo.ai.notesearch.config.SearchConfig;
import com.flamingo.ai.notesearch.domain.model.Corpus;
import com.flamingo.ai.notesearch.index.CorpusIndexStore;
import com.flamingo.ai.notesearch.index.IndexSnapshot;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads a client from the corpus's storage directory after checking that the directory belongs to
 * the corpus. A corpus that was never indexed gets an empty snapshot.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoredIndexClientFactory implements RetrievalClientFactory {

  private final CorpusManager corpusManager;
  private final CorpusIndexStore indexStore;
  private final SearchConfig searchConfig;

  @Override
  public RetrievalClient create(Corpus corpus) {
    corpusManager.validateSafe(corpus.storagePath(), corpus.root(), "load index", false);
    IndexSnapshot snapshot;
    try {
      snapshot = indexStore.load(corpus.storagePath());
    } catch (IOException e) {
      log.error(
          "Failed to load index for corpus {} from {}, serving empty results until reindexed: {}",
          corpus.name(),
          corpus.storagePath(),
          e.getMessage());
      snapshot = null;
    }
    if (snapshot == null) {
      SearchConfig.Lexical lexical = searchConfig.getLexical();
      snapshot =
          IndexSnapshot.empty(
              corpus.embeddingModel(), lexical.getK1(), lexical.getB(), lexical.getTagRepeat());
    }
    log.info("Loaded client for corpus {} with {} entries", corpus.name(), snapshot.size());
    return new RetrievalClient(corpus, snapshot);
  }
}
