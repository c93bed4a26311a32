package com.flamingo.ai.notesearch.exception;

import java.nio.file.Path;

/** Exception thrown when a storage directory is already bound to a different corpus root. */
public class CorpusMismatchException extends ConfigurationException {

  private final String operation;
  private final Path storagePath;
  private final String existingRoot;
  private final Path requestedRoot;

  public CorpusMismatchException(
      String operation, Path storagePath, String existingRoot, Path requestedRoot) {
    super(buildMessage(operation, storagePath, existingRoot, requestedRoot));
    this.operation = operation;
    this.storagePath = storagePath;
    this.existingRoot = existingRoot;
    this.requestedRoot = requestedRoot;
  }

  private static String buildMessage(
      String operation, Path storagePath, String existingRoot, Path requestedRoot) {
    return String.format(
        "Refusing to %s: index at %s belongs to corpus root %s, not %s.%n%s",
        operation, storagePath, existingRoot, requestedRoot, remedies(storagePath, existingRoot));
  }

  /** The ways out, listed in the error message and in the API error details. */
  public static String remedies(Path storagePath, String existingRoot) {
    return String.format(
        "Options:%n"
            + "  1. Use the corpus root this index was built for: %s%n"
            + "  2. Delete the stale index at %s and rebuild%n"
            + "  3. Re-run with force=true to overwrite it",
        existingRoot, storagePath);
  }

  public String getOperation() {
    return operation;
  }

  public Path getStoragePath() {
    return storagePath;
  }

  public String getExistingRoot() {
    return existingRoot;
  }

  public Path getRequestedRoot() {
    return requestedRoot;
  }

  public String getUserMessage() {
    return "Index storage belongs to a different corpus";
  }
}
