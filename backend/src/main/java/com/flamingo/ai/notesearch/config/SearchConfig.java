package com.flamingo.ai.notesearch.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "search")
@Getter
@Setter
public class SearchConfig {

  private Chunking chunking = new Chunking();
  private Lexical lexical = new Lexical();
  private Retrieval retrieval = new Retrieval();
  private TagBoost tagBoost = new TagBoost();
  private TimeDecay timeDecay = new TimeDecay();
  private QueryExpansion queryExpansion = new QueryExpansion();
  private Reranking reranking = new Reranking();
  private Embedding embedding = new Embedding();
  private Corpus corpus = new Corpus();

  /** Custom search profiles keyed by name. Built-in names cannot be redefined. */
  private Map<String, ProfileDefinition> profiles = new LinkedHashMap<>();

  @Getter
  @Setter
  public static class Chunking {
    private boolean enabled = true;

    /** Bodies longer than this many characters are split. */
    private int threshold = 4000;

    private int size = 2000;
    private int overlap = 400;
  }

  @Getter
  @Setter
  public static class Lexical {
    private double k1 = 1.5;
    private double b = 0.75;

    /** How many times each tag is repeated in the indexed text. */
    private int tagRepeat = 2;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int rrfK = 60;
    private int candidatesMultiplier = 3;
    private int minCandidates = 50;
    private int defaultLimit = 10;
    private int maxLimit = 100;

    /** Upper bound for one index lookup, query embedding included. */
    private long lookupTimeoutMs = 15000;
  }

  /**
   * Exact tag matches override plain RRF ordering. The margin range is a tuned heuristic, not a
   * derived constant.
   */
  @Getter
  @Setter
  public static class TagBoost {
    private boolean enabled = true;
    private double lexicalMultiplier = 5.0;
    private double minMargin = 1.5;
    private double maxMargin = 2.0;
  }

  @Getter
  @Setter
  public static class TimeDecay {
    private boolean enabled = true;
    private double halfLifeDays = 90;
    private double maxBoost = 0.2;
  }

  @Getter
  @Setter
  public static class QueryExpansion {
    private boolean enabled = true;

    /** Seed results the TF-IDF fit needs; fewer seeds leave the query unchanged. */
    private int seedCount = 5;

    private int maxTerms = 3;

    /** Queries with at least this many whitespace tokens are never expanded. */
    private int minTokens = 3;

    private int maxFeatures = 100;
  }

  @Getter
  @Setter
  public static class Reranking {
    private boolean enabled = true;

    /** Reranking strategy. Only "tei" (cross-encoder via TEI) ships. */
    private String strategy = "tei";

    private int topN = 100;

    private Tei tei = new Tei();

    /** Configuration for TEI (Text Embeddings Inference) cross-encoder reranker. */
    @Getter
    @Setter
    public static class Tei {
      private String baseUrl = "http://localhost:8090";
      private String modelId = "cross-encoder/ms-marco-MiniLM-L6-v2";
      private boolean truncate = true;
      private boolean rawScores = false;
      private int connectTimeoutMs = 5000;
      private int readTimeoutMs = 10000;
    }
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Identifier recorded with stored vectors; a change invalidates them. */
    private String modelId = "text-embedding-3-small";

    /** Longest text the embedding model accepts without truncation. */
    private int maxInputChars = 5000;

    private int batchSize = 64;
  }

  @Getter
  @Setter
  public static class Corpus {
    private int cacheMaxSize = 3;

    /** Corpus used when a request names none. */
    private String defaultCorpus = "notes";

    /** Root of the default corpus; its index lives in {@link #defaultStorage}. */
    private String defaultRoot = "data/notes";

    private String defaultStorage = "data/index";

    private Map<String, CorpusDefinition> definitions = new LinkedHashMap<>();
  }

  @Getter
  @Setter
  public static class CorpusDefinition {
    private String root;
  }

  /** A custom profile. Unset fields fall back to the {@code default} profile. */
  @Getter
  @Setter
  public static class ProfileDefinition {
    private String displayName;
    private String description;
    private Double hybridWeight;
    private Double bm25Boost;
    private Boolean tagBoostEnabled;
    private List<MetadataBoostDefinition> metadataBoosts = new ArrayList<>();
    private Double timeDecayHalfLifeDays;
    private Double timeDecayMaxBoost;
    private Boolean timeDecayEnabled;
    private Integer maxAgeDays;
    private Boolean crossEncoderEnabled;
    private Boolean queryExpansionEnabled;
    private List<String> includeTypes;
    private List<String> excludeTypes;
    private Boolean chunkingEnabled;
    private Integer chunkSize;
    private Integer chunkOverlap;
    private Boolean showChunkContext;
  }

  /** A metadata boost rule of a custom profile. */
  @Getter
  @Setter
  public static class MetadataBoostDefinition {
    /** Metadata key, one of the well-known names such as {@code popularity} or {@code topics}. */
    private String key;

    /** {@code log} for unbounded counters, {@code match} for categorical values. */
    private String scale = "log";

    private double maxBoost = 0.5;
    private double saturation = 10000;
    private double matchBoost = 1.5;
  }
}
