package com.flamingo.ai.notesearch.index;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.pattern.PatternReplaceFilter;
import org.apache.lucene.analysis.pattern.PatternTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

/**
 * Analyzer for note text. Lower-cases and splits on anything that is not a letter or digit, except
 * that {@code + # . -} are kept inside a token so terms like {@code c++}, {@code c#} and {@code
 * node.js} survive. A token starts at its first letter or digit; trailing dots and dashes
 * (sentence punctuation) are stripped.
 */
public final class NoteAnalyzer extends Analyzer {

  private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}+#.\\-]*");
  private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.\\-]+$");

  private static final NoteAnalyzer SHARED = new NoteAnalyzer();

  @Override
  protected TokenStreamComponents createComponents(String fieldName) {
    Tokenizer source = new PatternTokenizer(TOKEN, 0);
    TokenStream stream = new LowerCaseFilter(source);
    stream = new PatternReplaceFilter(stream, TRAILING_PUNCTUATION, "", false);
    return new TokenStreamComponents(source, stream);
  }

  /** Tokens of {@code text} as they are indexed. */
  public static List<String> tokenize(String text) {
    return analyze(SHARED, text);
  }

  /** Normalizes a tag the way query tokens are compared to it, dropping a leading {@code #}. */
  public static String normalizeTag(String tag) {
    if (tag == null) {
      return "";
    }
    String normalized = tag.trim().toLowerCase(Locale.ROOT);
    while (normalized.startsWith("#")) {
      normalized = normalized.substring(1);
    }
    return normalized.trim();
  }

  /** Runs {@code analyzer} over {@code text} and collects the terms. */
  public static List<String> analyze(Analyzer analyzer, String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return tokens;
    }
    try (TokenStream stream = analyzer.tokenStream("text", text)) {
      CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
      stream.reset();
      while (stream.incrementToken()) {
        tokens.add(term.toString());
      }
      stream.end();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to analyze text", e);
    }
    return tokens;
  }
}
