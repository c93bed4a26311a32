package com.flamingo.ai.notesearch.service.indexing;

import com.flamingo.ai.notesearch.domain.model.Corpus;
import com.flamingo.ai.notesearch.domain.model.Item;
import java.io.IOException;
import java.util.List;

/** Supplies the structured items of a corpus. Turning raw notes into items happens upstream. */
public interface ItemSource {

  List<Item> load(Corpus corpus) throws IOException;
}
