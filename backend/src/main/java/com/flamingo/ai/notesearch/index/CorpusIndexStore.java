package com.flamingo.ai.notesearch.index;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.notesearch.domain.model.CorpusIndexMetadata;
import com.flamingo.ai.notesearch.domain.model.IndexEntry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * Reads and writes the per-corpus index files under a storage directory:
 *
 * <ul>
 *   <li>{@code index.json} binds the directory to one corpus root
 *   <li>{@code entries.json} holds the indexed items and chunks
 *   <li>{@code lexical/} holds the Lucene BM25 index
 *   <li>{@code vectors.json} holds the serialized embedding store
 * </ul>
 *
 * <p>Every file (and the Lucene directory) is written to a temporary sibling and moved into place,
 * and {@code index.json} is written last, so a crashed write never leaves metadata pointing at
 * partial index files.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CorpusIndexStore {

  public static final String METADATA_FILE = "index.json";
  public static final String ENTRIES_FILE = "entries.json";
  public static final String LEXICAL_DIR = "lexical";
  public static final String VECTORS_FILE = "vectors.json";

  private static final TypeReference<List<IndexEntry>> ENTRY_LIST = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public boolean hasMetadata(Path storagePath) {
    return Files.isRegularFile(storagePath.resolve(METADATA_FILE));
  }

  /**
   * Reads {@code index.json}.
   *
   * @return the metadata, or {@code null} if the file does not exist
   * @throws IOException if the file exists but cannot be read or parsed
   */
  public CorpusIndexMetadata readMetadata(Path storagePath) throws IOException {
    Path file = storagePath.resolve(METADATA_FILE);
    if (!Files.isRegularFile(file)) {
      return null;
    }
    return objectMapper.readValue(file.toFile(), CorpusIndexMetadata.class);
  }

  public void writeMetadata(Path storagePath, CorpusIndexMetadata metadata) throws IOException {
    writeAtomically(
        storagePath.resolve(METADATA_FILE),
        objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(metadata));
  }

  /**
   * Loads a complete snapshot.
   *
   * @return the snapshot, or {@code null} if no index files exist yet
   */
  public IndexSnapshot load(Path storagePath) throws IOException {
    Path entriesFile = storagePath.resolve(ENTRIES_FILE);
    if (!Files.isRegularFile(entriesFile)) {
      return null;
    }
    List<IndexEntry> entries = objectMapper.readValue(entriesFile.toFile(), ENTRY_LIST);
    CorpusIndexMetadata metadata = readMetadata(storagePath);
    LexicalIndex lexical = LexicalIndex.load(storagePath.resolve(LEXICAL_DIR));
    VectorIndex vectors =
        VectorIndex.fromJson(
            Files.readString(storagePath.resolve(VECTORS_FILE), StandardCharsets.UTF_8),
            metadata == null ? null : metadata.getEmbeddingModel(),
            metadata == null ? null : metadata.getEmbeddingDimension());
    log.debug("Loaded {} entries from {}", entries.size(), storagePath);
    return new IndexSnapshot(entries, lexical, vectors, metadata);
  }

  /** Writes all index files of {@code snapshot}, with its metadata last. */
  public void write(Path storagePath, IndexSnapshot snapshot) throws IOException {
    Files.createDirectories(storagePath);
    writeAtomically(
        storagePath.resolve(ENTRIES_FILE), objectMapper.writeValueAsBytes(snapshot.getEntries()));
    writeLexical(storagePath, snapshot.getLexicalIndex());
    writeAtomically(
        storagePath.resolve(VECTORS_FILE),
        snapshot.getVectorIndex().toJson().getBytes(StandardCharsets.UTF_8));
    writeMetadata(storagePath, snapshot.getMetadata());
    log.info("Wrote index with {} entries to {}", snapshot.size(), storagePath);
  }

  /** Stages the Lucene files in a temporary directory and renames it over {@code lexical/}. */
  private void writeLexical(Path storagePath, LexicalIndex index) throws IOException {
    Path target = storagePath.resolve(LEXICAL_DIR);
    Path retired = storagePath.resolve(LEXICAL_DIR + ".old");
    Path staged = Files.createTempDirectory(storagePath, LEXICAL_DIR + ".");
    try {
      index.writeTo(staged);
      FileSystemUtils.deleteRecursively(retired);
      if (Files.exists(target)) {
        moveIntoPlace(target, retired);
      }
      moveIntoPlace(staged, target);
    } finally {
      FileSystemUtils.deleteRecursively(staged);
      FileSystemUtils.deleteRecursively(retired);
    }
  }

  private void writeAtomically(Path target, byte[] content) throws IOException {
    Files.createDirectories(target.getParent());
    Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
    try {
      Files.write(temp, content);
      moveIntoPlace(temp, target);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private static void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, falling back to replace", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
