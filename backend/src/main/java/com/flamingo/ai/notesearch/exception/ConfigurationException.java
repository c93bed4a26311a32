package com.flamingo.ai.notesearch.exception;

/**
 * Thrown for invalid configuration such as chunk parameters or profile definitions. Raised at
 * startup or at the offending operation and never corrected silently.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
