package com.flamingo.ai.notesearch.exception;

import java.util.Collection;

/** Exception thrown when a request names a search profile that does not exist. */
public class UnknownProfileException extends RuntimeException {

  private final String profileName;

  public UnknownProfileException(String profileName, Collection<String> available) {
    super(
        "Unknown profile '"
            + profileName
            + "'. Available profiles: "
            + String.join(", ", available));
    this.profileName = profileName;
  }

  public String getProfileName() {
    return profileName;
  }
}
