package com.flamingo.ai.notesearch.domain.enums;

/**
 * Well-known metadata keys. Boost rules and filters only ever read these; anything else an item
 * source supplies lands in the open extras bag of {@code ItemMetadata}.
 */
public enum MetadataKey {
  DESCRIPTION("description"),
  TYPE("type"),
  POPULARITY("popularity"),
  TOPICS("topics"),
  LANGUAGE("language"),
  SOURCE_URL("source_url");

  private final String jsonName;

  MetadataKey(String jsonName) {
    this.jsonName = jsonName;
  }

  public String getJsonName() {
    return jsonName;
  }

  /** Resolves a key from its serialized name, or {@code null} when the name is not well-known. */
  public static MetadataKey fromJsonName(String name) {
    for (MetadataKey key : values()) {
      if (key.jsonName.equalsIgnoreCase(name)) {
        return key;
      }
    }
    return null;
  }
}
