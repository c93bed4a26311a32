package com.flamingo.ai.notesearch.exception;

/** Exception thrown when a query cannot be answered from a corpus index. */
public class SearchException extends RuntimeException {

  private final String corpusName;
  private final String userMessage;

  public SearchException(String message, Throwable cause) {
    super(message, cause);
    this.corpusName = null;
    this.userMessage = "The note search was interrupted. Please run the query again.";
  }

  /** The corpus has no loadable index, usually because it was never indexed. */
  public SearchException(String corpusName, String message) {
    super(message);
    this.corpusName = corpusName;
    this.userMessage =
        "The index of corpus '" + corpusName + "' is not available. Reindex the corpus first.";
  }

  public String getCorpusName() {
    return corpusName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
