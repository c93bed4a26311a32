package com.flamingo.ai.notesearch.exception;

/** Exception thrown when rebuilding a corpus index fails. */
public class IndexingException extends RuntimeException {

  private final String corpusName;
  private final boolean retryable;
  private final String userMessage;

  public IndexingException(String corpusName, String message, Throwable cause) {
    this(corpusName, message, cause, false);
  }

  public IndexingException(
      String corpusName, String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.corpusName = corpusName;
    this.retryable = retryable;
    this.userMessage =
        retryable
            ? "Embedding service is unavailable. Please retry the reindex later."
            : "Failed to index corpus";
  }

  public String getCorpusName() {
    return corpusName;
  }

  /** True when the failure came from an external service rather than the corpus data. */
  public boolean isRetryable() {
    return retryable;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
