package com.flamingo.ai.notesearch.service.corpus;

import com.flamingo.ai.notesearch.domain.model.Corpus;

/** Creates initialized clients for {@link RetrievalClientCache} on a cache miss. */
public interface RetrievalClientFactory {

  RetrievalClient create(Corpus corpus);
}
