package com.flamingo.ai.notesearch.service.query;

import com.flamingo.ai.notesearch.config.SearchConfig;
import com.flamingo.ai.notesearch.index.NoteAnalyzer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.pattern.PatternTokenizer;
import org.apache.lucene.analysis.shingle.ShingleFilter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Expands short queries with terms mined from the top results of a first retrieval pass
 * (pseudo-relevance feedback).
 *
 * <p>A TF-IDF model (unigrams and bigrams, English stop words removed, smoothed idf, L2-normalized
 * rows) is fitted over the seed texts. Terms are ranked by mean weight; the best {@code maxTerms}
 * that do not already occur in the query are appended.
 */
@Component
@Slf4j
public class QueryExpander {

  private static final Pattern TOKEN =
      Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

  private static final Analyzer UNIGRAMS =
      new Analyzer() {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
          Tokenizer source = new PatternTokenizer(TOKEN, 0);
          TokenStream stream = new LowerCaseFilter(source);
          stream = new StopFilter(stream, EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);
          return new TokenStreamComponents(source, stream);
        }
      };

  // runs over the unigrams left after stop-word removal
  private static final Analyzer SHINGLES =
      new Analyzer() {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
          Tokenizer source = new WhitespaceTokenizer();
          return new TokenStreamComponents(source, new ShingleFilter(source, 2, 2));
        }
      };

  private final SearchConfig.QueryExpansion config;

  @Autowired
  public QueryExpander(SearchConfig searchConfig) {
    this(searchConfig.getQueryExpansion());
  }

  QueryExpander(SearchConfig.QueryExpansion config) {
    this.config = config;
    log.info(
        "QueryExpander initialized: maxTerms={}, seedCount={}, stopWords={}",
        config.getMaxTerms(),
        config.getSeedCount(),
        EnglishAnalyzer.ENGLISH_STOP_WORDS_SET.size());
  }

  /** True for queries with fewer whitespace-separated tokens than the configured minimum. */
  public boolean shouldExpand(String query) {
    if (query == null || query.isBlank()) {
      return false;
    }
    return query.trim().split("\\s+").length < config.getMinTokens();
  }

  public String expand(String query, List<String> seedTexts) {
    return expand(query, seedTexts, config.getSeedCount(), config.getMaxTerms());
  }

  /**
   * Expands {@code query} from the first {@code topK} seed texts. Returns the query unchanged when
   * it is long enough already, when fewer than {@code topK} seeds are available, when nothing new
   * is found, or when anything goes wrong.
   */
  public String expand(String query, List<String> seedTexts, int topK, int maxTerms) {
    if (!shouldExpand(query)) {
      log.debug("Query '{}' doesn't need expansion", query);
      return query;
    }
    if (seedTexts == null || seedTexts.size() < topK) {
      log.debug(
          "Not enough results for expansion (need {}, got {})",
          topK,
          seedTexts == null ? 0 : seedTexts.size());
      return query;
    }
    try {
      List<String> docs = new ArrayList<>();
      for (String text : seedTexts.subList(0, topK)) {
        if (text != null && !text.isBlank()) {
          docs.add(text);
        }
      }
      if (docs.isEmpty()) {
        return query;
      }
      List<String> topTerms = topTerms(docs, maxTerms);
      String queryLower = query.toLowerCase(Locale.ROOT);
      List<String> additions = new ArrayList<>();
      for (String term : topTerms) {
        if (!queryLower.contains(term.toLowerCase(Locale.ROOT))) {
          additions.add(term);
        }
      }
      if (additions.isEmpty()) {
        log.debug("No new expansion terms found for '{}'", query);
        return query;
      }
      String expanded = query + " " + String.join(" ", additions);
      log.info("Expanded query: '{}' -> '{}'", query, expanded);
      return expanded;
    } catch (RuntimeException e) {
      log.warn("Query expansion failed, using original query: {}", e.getMessage());
      return query;
    }
  }

  /** Fits TF-IDF over {@code docs} and returns the {@code limit} terms with the highest mean. */
  List<String> topTerms(List<String> docs, int limit) {
    List<Map<String, Integer>> termCounts = new ArrayList<>(docs.size());
    Map<String, Integer> corpusCounts = new HashMap<>();
    for (String doc : docs) {
      Map<String, Integer> counts = new HashMap<>();
      for (String term : terms(doc)) {
        counts.merge(term, 1, Integer::sum);
        corpusCounts.merge(term, 1, Integer::sum);
      }
      termCounts.add(counts);
    }

    List<String> vocabulary = new ArrayList<>(corpusCounts.keySet());
    vocabulary.sort(
        Comparator.comparing((String term) -> corpusCounts.get(term))
            .reversed()
            .thenComparing(Comparator.naturalOrder()));
    if (vocabulary.size() > config.getMaxFeatures()) {
      vocabulary = vocabulary.subList(0, config.getMaxFeatures());
    }
    Set<String> kept = new HashSet<>(vocabulary);

    int n = docs.size();
    Map<String, Double> idf = new HashMap<>();
    for (String term : vocabulary) {
      int df = 0;
      for (Map<String, Integer> counts : termCounts) {
        if (counts.containsKey(term)) {
          df++;
        }
      }
      idf.put(term, Math.log((1.0 + n) / (1.0 + df)) + 1.0);
    }

    Map<String, Double> meanWeights = new HashMap<>();
    for (Map<String, Integer> counts : termCounts) {
      Map<String, Double> row = new HashMap<>();
      double sumSquares = 0.0;
      for (Map.Entry<String, Integer> count : counts.entrySet()) {
        if (kept.contains(count.getKey())) {
          double weight = count.getValue() * idf.get(count.getKey());
          row.put(count.getKey(), weight);
          sumSquares += weight * weight;
        }
      }
      double norm = Math.sqrt(sumSquares);
      for (Map.Entry<String, Double> cell : row.entrySet()) {
        double normalized = norm > 0 ? cell.getValue() / norm : 0.0;
        meanWeights.merge(cell.getKey(), normalized / n, Double::sum);
      }
    }

    List<String> ranked = new ArrayList<>(meanWeights.keySet());
    ranked.sort(
        Comparator.comparing((String term) -> meanWeights.get(term))
            .reversed()
            .thenComparing(Comparator.naturalOrder()));
    return ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : List.copyOf(ranked);
  }

  /** Unigrams and bigrams of the stop-word-filtered token stream. */
  private static List<String> terms(String text) {
    List<String> unigrams = NoteAnalyzer.analyze(UNIGRAMS, text);
    if (unigrams.isEmpty()) {
      return unigrams;
    }
    return NoteAnalyzer.analyze(SHINGLES, String.join(" ", unigrams));
  }
}
