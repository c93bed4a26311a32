package com.flamingo.ai.notesearch.exception;

/** Exception thrown when a request names a corpus that is not configured. */
public class CorpusNotFoundException extends RuntimeException {

  private final String corpusName;

  public CorpusNotFoundException(String corpusName) {
    super("Corpus not found: " + corpusName);
    this.corpusName = corpusName;
  }

  public String getCorpusName() {
    return corpusName;
  }
}
