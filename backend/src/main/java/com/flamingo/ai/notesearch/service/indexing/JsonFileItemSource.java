package com.flamingo.ai.notesearch.service.indexing;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.notesearch.domain.model.Corpus;
import com.flamingo.ai.notesearch.domain.model.Item;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Reads {@code items.json}, a JSON array of items, from the corpus root. */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonFileItemSource implements ItemSource {

  public static final String ITEMS_FILE = "items.json";

  private static final TypeReference<List<Item>> ITEM_LIST = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  @Override
  public List<Item> load(Corpus corpus) throws IOException {
    Path file = corpus.root().resolve(ITEMS_FILE);
    if (!Files.isRegularFile(file)) {
      throw new NoSuchFileException(file.toString(), null, "corpus has no " + ITEMS_FILE);
    }
    List<Item> raw = objectMapper.readValue(file.toFile(), ITEM_LIST);
    List<Item> items = new ArrayList<>(raw.size());
    Set<String> seen = new HashSet<>();
    for (Item item : raw) {
      if (item == null || item.getId() == null || item.getId().isBlank()) {
        log.warn("Skipping item without id in {}", file);
        continue;
      }
      if (!seen.add(item.getId())) {
        log.warn("Skipping duplicate item id {} in {}", item.getId(), file);
        continue;
      }
      items.add(item);
    }
    log.debug("Read {} items from {}", items.size(), file);
    return items;
  }
}
