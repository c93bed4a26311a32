package com.flamingo.ai.notesearch.service.corpus;

import com.flamingo.ai.notesearch.config.SearchConfig;
import com.flamingo.ai.notesearch.domain.model.Corpus;
import com.flamingo.ai.notesearch.domain.model.CorpusIndexMetadata;
import com.flamingo.ai.notesearch.exception.CorpusMismatchException;
import com.flamingo.ai.notesearch.exception.CorpusNotFoundException;
import com.flamingo.ai.notesearch.index.CorpusIndexStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves corpora to their storage directories and guards the binding between a storage directory
 * and the corpus root it was built from.
 *
 * <p>A storage directory belongs to exactly one corpus root. Any operation that would bind it to
 * another root is refused unless forced, since overwriting an unrelated corpus's index cannot be
 * undone.
 */
@Service
@Slf4j
public class CorpusManager {

  /** Directory created inside a non-default corpus root to hold its index. */
  public static final String LOCAL_STORAGE_DIR = ".notesearch";

  private final CorpusIndexStore indexStore;
  private final Clock clock;
  private final String defaultCorpus;
  private final Map<String, Corpus> corpora;

  public CorpusManager(SearchConfig searchConfig, CorpusIndexStore indexStore, Clock clock) {
    this.indexStore = indexStore;
    this.clock = clock;
    SearchConfig.Corpus config = searchConfig.getCorpus();
    this.defaultCorpus = config.getDefaultCorpus();

    Path defaultRoot = normalize(Path.of(config.getDefaultRoot()));
    Path defaultStorage = normalize(Path.of(config.getDefaultStorage()));
    String modelId = searchConfig.getEmbedding().getModelId();

    Map<String, Corpus> all = new LinkedHashMap<>();
    all.put(
        defaultCorpus,
        new Corpus(defaultCorpus, defaultRoot, defaultStorage, modelId, null));
    config
        .getDefinitions()
        .forEach(
            (name, definition) -> {
              Path root = normalize(Path.of(definition.getRoot()));
              Path storage = deriveStoragePath(root, defaultRoot, defaultStorage);
              all.put(name, new Corpus(name, root, storage, modelId, null));
            });
    this.corpora = Collections.unmodifiableMap(all);
    all.values()
        .forEach(
            corpus ->
                log.info(
                    "Corpus '{}': root={}, storage={}",
                    corpus.name(),
                    corpus.root(),
                    corpus.storagePath()));
  }

  /**
   * Resolves a corpus by name; a blank name means the default corpus.
   *
   * @throws CorpusNotFoundException if no corpus has that name
   */
  public Corpus getCorpus(String name) {
    String key = name == null || name.isBlank() ? defaultCorpus : name;
    Corpus corpus = corpora.get(key);
    if (corpus == null) {
      throw new CorpusNotFoundException(key);
    }
    return corpus;
  }

  public Collection<Corpus> listCorpora() {
    return corpora.values();
  }

  /**
   * Returns {@code defaultStorage} when {@code corpusRoot} is the default root, otherwise a
   * directory inside {@code corpusRoot}.
   */
  public static Path deriveStoragePath(Path corpusRoot, Path defaultRoot, Path defaultStorage) {
    Path root = normalize(corpusRoot);
    if (defaultRoot != null && root.equals(normalize(defaultRoot))) {
      return normalize(defaultStorage);
    }
    return root.resolve(LOCAL_STORAGE_DIR);
  }

  /**
   * Checks that {@code storagePath} may be used for {@code corpusRoot}.
   *
   * <ul>
   *   <li>no metadata: nothing to check
   *   <li>unreadable metadata: logged, treated as absent
   *   <li>legacy metadata without a root: stamped with this root and persisted
   *   <li>another root: {@link CorpusMismatchException} without {@code force}; nothing is written
   * </ul>
   *
   * @param operation what the caller is about to do, used in the error message
   */
  public void validateSafe(Path storagePath, Path corpusRoot, String operation, boolean force) {
    Path root = normalize(corpusRoot);
    CorpusIndexMetadata metadata;
    try {
      metadata = indexStore.readMetadata(storagePath);
    } catch (IOException e) {
      log.warn(
          "Could not read index metadata at {}: {}. Proceeding without validation",
          storagePath,
          e.getMessage());
      return;
    }
    if (metadata == null) {
      return;
    }
    if (metadata.isLegacy()) {
      migrateLegacy(storagePath, root, metadata);
      return;
    }

    Path existingRoot = normalize(Path.of(metadata.getCorpusRoot()));
    if (existingRoot.equals(root)) {
      return;
    }
    if (force) {
      log.warn(
          "Forcing {} at {}: index belongs to {}, will be rebound to {}",
          operation,
          storagePath,
          existingRoot,
          root);
      return;
    }
    throw new CorpusMismatchException(operation, storagePath, metadata.getCorpusRoot(), root);
  }

  /**
   * Returns the metadata stored at {@code storagePath}, or {@code null} when there is none or it
   * cannot be read.
   */
  public CorpusIndexMetadata getIndexMetadata(Path storagePath) {
    try {
      return indexStore.readMetadata(storagePath);
    } catch (IOException e) {
      log.warn("Could not read index metadata at {}: {}", storagePath, e.getMessage());
      return null;
    }
  }

  private void migrateLegacy(Path storagePath, Path root, CorpusIndexMetadata metadata) {
    metadata.setCorpusRoot(root.toString());
    if (metadata.getCorpusName() == null) {
      Path name = root.getFileName();
      metadata.setCorpusName(name == null ? root.toString() : name.toString());
    }
    metadata.setMigratedAt(clock.instant());
    try {
      indexStore.writeMetadata(storagePath, metadata);
      log.info("Migrated legacy index at {} to corpus root {}", storagePath, root);
    } catch (IOException e) {
      log.warn("Failed to persist legacy migration at {}: {}", storagePath, e.getMessage());
    }
  }

  static Path normalize(Path path) {
    return path.toAbsolutePath().normalize();
  }
}
