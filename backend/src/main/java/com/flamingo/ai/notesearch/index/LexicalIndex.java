package com.flamingo.ai.notesearch.index;

import com.flamingo.ai.notesearch.domain.model.IndexEntry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.store.IOContext;

/**
 * BM25 (Okapi) index over index entries, backed by an in-memory Lucene index.
 *
 * <p>Each entry is indexed as title + tags (each repeated {@code tagRepeat} times) + description
 * + body. Normalized tags are also indexed verbatim so exact tag matches are found across the
 * whole index, not only among the best BM25 hits; they are reported per hit but are not part of
 * the BM25 score. Instances are immutable once built; a rebuild produces a new index.
 */
public final class LexicalIndex {

  static final String ID_FIELD = "id";
  static final String CONTENT_FIELD = "content";
  static final String TAG_FIELD = "tag";

  private static final String K1_KEY = "bm25.k1";
  private static final String B_KEY = "bm25.b";
  private static final Set<String> HIT_FIELDS = Set.of(ID_FIELD, TAG_FIELD);

  private final Directory directory;
  private final IndexSearcher searcher;
  private final double k1;
  private final double b;

  private LexicalIndex(Directory directory) throws IOException {
    this.directory = directory;
    DirectoryReader reader = DirectoryReader.open(directory);
    Map<String, String> commitData = reader.getIndexCommit().getUserData();
    this.k1 = Double.parseDouble(commitData.getOrDefault(K1_KEY, "1.2"));
    this.b = Double.parseDouble(commitData.getOrDefault(B_KEY, "0.75"));
    this.searcher = new IndexSearcher(reader);
    this.searcher.setSimilarity(new BM25Similarity((float) k1, (float) b));
  }

  /** Builds an index over {@code entries}. */
  public static LexicalIndex build(List<IndexEntry> entries, double k1, double b, int tagRepeat) {
    ByteBuffersDirectory directory = new ByteBuffersDirectory();
    IndexWriterConfig config = new IndexWriterConfig(new NoteAnalyzer());
    config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
    config.setSimilarity(new BM25Similarity((float) k1, (float) b));
    try (IndexWriter writer = new IndexWriter(directory, config)) {
      for (IndexEntry entry : entries) {
        writer.addDocument(document(entry, tagRepeat));
      }
      writer.setLiveCommitData(
          Map.of(K1_KEY, Double.toString(k1), B_KEY, Double.toString(b)).entrySet());
      writer.commit();
      return new LexicalIndex(directory);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to build lexical index", e);
    }
  }

  public static LexicalIndex empty(double k1, double b, int tagRepeat) {
    return build(List.of(), k1, b, tagRepeat);
  }

  /** Reads an index written by {@link #writeTo(Path)} fully into memory. */
  public static LexicalIndex load(Path source) throws IOException {
    ByteBuffersDirectory memory = new ByteBuffersDirectory();
    try (FSDirectory stored = FSDirectory.open(source)) {
      for (String file : stored.listAll()) {
        if (!file.equals(IndexWriter.WRITE_LOCK_NAME)) {
          memory.copyFrom(stored, file, file, IOContext.DEFAULT);
        }
      }
    }
    return new LexicalIndex(memory);
  }

  /** Copies the index files into {@code target}, creating it if needed. */
  public void writeTo(Path target) throws IOException {
    Files.createDirectories(target);
    try (FSDirectory out = FSDirectory.open(target)) {
      for (String file : directory.listAll()) {
        out.copyFrom(directory, file, file, IOContext.DEFAULT);
      }
      out.sync(Arrays.asList(out.listAll()));
      out.syncMetaData();
    }
  }

  public int size() {
    return searcher.getIndexReader().numDocs();
  }

  public double getK1() {
    return k1;
  }

  public double getB() {
    return b;
  }

  /**
   * Ranks entries against {@code text}: the best {@code limit} BM25 hits plus every entry with a
   * tag the query names exactly, wherever that entry ranks. Entries that match no query term and
   * no tag are not returned, so a query matching nothing yields an empty list.
   */
  public List<LexicalHit> query(String text, int limit) {
    List<String> queryTokens = NoteAnalyzer.tokenize(text);
    if (queryTokens.isEmpty() || size() == 0 || limit <= 0) {
      return List.of();
    }
    Set<String> uniqueTokens = new LinkedHashSet<>(queryTokens);
    String wholeQuery = String.join(" ", queryTokens);

    BooleanQuery.Builder content = new BooleanQuery.Builder();
    BooleanQuery.Builder tags = new BooleanQuery.Builder();
    for (String token : uniqueTokens) {
      content.add(new TermQuery(new Term(CONTENT_FIELD, token)), BooleanClause.Occur.SHOULD);
      tags.add(new TermQuery(new Term(TAG_FIELD, token)), BooleanClause.Occur.SHOULD);
    }
    if (!uniqueTokens.contains(wholeQuery)) {
      tags.add(new TermQuery(new Term(TAG_FIELD, wholeQuery)), BooleanClause.Occur.SHOULD);
    }
    Query contentQuery = content.build();
    Query tagQuery = tags.build();

    try {
      StoredFields storedFields = searcher.storedFields();
      Map<String, LexicalHit> hits = new LinkedHashMap<>();

      int tagged = searcher.count(tagQuery);
      if (tagged > 0) {
        // content scores the tagged entries, the tag clause only selects them
        Query taggedQuery =
            new BooleanQuery.Builder()
                .add(contentQuery, BooleanClause.Occur.SHOULD)
                .add(tagQuery, BooleanClause.Occur.FILTER)
                .build();
        for (ScoreDoc scoreDoc : searcher.search(taggedQuery, tagged).scoreDocs) {
          Document doc = storedFields.document(scoreDoc.doc, HIT_FIELDS);
          String entryId = doc.get(ID_FIELD);
          hits.put(
              entryId,
              new LexicalHit(
                  entryId,
                  scoreDoc.score,
                  tagMatches(doc.getValues(TAG_FIELD), uniqueTokens, wholeQuery)));
        }
      }

      for (ScoreDoc scoreDoc : searcher.search(contentQuery, limit).scoreDocs) {
        String entryId = storedFields.document(scoreDoc.doc, HIT_FIELDS).get(ID_FIELD);
        hits.putIfAbsent(entryId, new LexicalHit(entryId, scoreDoc.score, Set.of()));
      }

      List<LexicalHit> ranked = new ArrayList<>(hits.values());
      ranked.sort(
          Comparator.comparingDouble(LexicalHit::score)
              .reversed()
              .thenComparing(LexicalHit::entryId));
      return List.copyOf(ranked);
    } catch (IOException e) {
      throw new UncheckedIOException("Lexical query failed", e);
    }
  }

  private static Document document(IndexEntry entry, int tagRepeat) {
    Document doc = new Document();
    doc.add(new StringField(ID_FIELD, entry.entryId(), Field.Store.YES));
    StringBuilder content = new StringBuilder(Objects.toString(entry.title(), ""));
    for (String tag : entry.tags()) {
      String normalized = NoteAnalyzer.normalizeTag(tag);
      if (normalized.isEmpty()) {
        continue;
      }
      doc.add(new StringField(TAG_FIELD, normalized, Field.Store.YES));
      for (int r = 0; r < tagRepeat; r++) {
        content.append(' ').append(normalized);
      }
    }
    content.append(' ').append(Objects.toString(entry.description(), ""));
    content.append(' ').append(Objects.toString(entry.text(), ""));
    doc.add(new TextField(CONTENT_FIELD, content.toString(), Field.Store.NO));
    return doc;
  }

  private static Set<String> tagMatches(
      String[] docTags, Set<String> queryTokens, String wholeQuery) {
    Set<String> out = new TreeSet<>();
    for (String tag : docTags) {
      if (queryTokens.contains(tag) || tag.equals(wholeQuery)) {
        out.add(tag);
      }
    }
    return out.isEmpty() ? Set.of() : Collections.unmodifiableSet(out);
  }

  /** One scored entry. {@code matchedTags} holds the entry tags the query named exactly. */
  public record LexicalHit(String entryId, double score, Set<String> matchedTags) {

    public boolean tagMatched() {
      return !matchedTags.isEmpty();
    }
  }
}
