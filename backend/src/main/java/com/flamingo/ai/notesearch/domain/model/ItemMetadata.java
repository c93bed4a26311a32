package com.flamingo.ai.notesearch.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flamingo.ai.notesearch.domain.enums.MetadataKey;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Free-form item metadata split into well-known keys ({@link MetadataKey}) with typed accessors
 * and an open bag for everything else.
 *
 * <p>Serializes as a flat JSON object so item sources can write {@code {"type": "note",
 * "popularity": 120, "anything": "else"}} without knowing about the split.
 */
public final class ItemMetadata {

  private static final ItemMetadata EMPTY = new ItemMetadata(Map.of(), Map.of());

  private final Map<MetadataKey, Object> known;
  private final Map<String, Object> extras;

  private ItemMetadata(Map<MetadataKey, Object> known, Map<String, Object> extras) {
    this.known = known.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(known));
    this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(extras));
  }

  public static ItemMetadata empty() {
    return EMPTY;
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static ItemMetadata fromMap(Map<String, Object> raw) {
    if (raw == null || raw.isEmpty()) {
      return EMPTY;
    }
    Map<MetadataKey, Object> known = new EnumMap<>(MetadataKey.class);
    Map<String, Object> extras = new LinkedHashMap<>();
    raw.forEach(
        (name, value) -> {
          if (value == null) {
            return;
          }
          MetadataKey key = MetadataKey.fromJsonName(name);
          if (key != null) {
            known.put(key, value);
          } else {
            extras.put(name, value);
          }
        });
    return new ItemMetadata(known, extras);
  }

  /** Returns a copy with {@code key} set to {@code value} (or removed when {@code null}). */
  public ItemMetadata with(MetadataKey key, Object value) {
    Map<MetadataKey, Object> copy = new EnumMap<>(MetadataKey.class);
    copy.putAll(known);
    if (value == null) {
      copy.remove(key);
    } else {
      copy.put(key, value);
    }
    return new ItemMetadata(copy, extras);
  }

  @JsonValue
  public Map<String, Object> toMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    known.forEach((key, value) -> out.put(key.getJsonName(), value));
    out.putAll(extras);
    return out;
  }

  public Optional<String> getString(MetadataKey key) {
    Object value = known.get(key);
    if (value == null) {
      return Optional.empty();
    }
    String text = value.toString().trim();
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  /** Reads a numeric value; numeric strings are accepted, anything else is treated as absent. */
  public OptionalLong getLong(MetadataKey key) {
    Object value = known.get(key);
    if (value instanceof Number number) {
      return OptionalLong.of(number.longValue());
    }
    if (value instanceof String text) {
      try {
        return OptionalLong.of(Long.parseLong(text.trim()));
      } catch (NumberFormatException e) {
        return OptionalLong.empty();
      }
    }
    return OptionalLong.empty();
  }

  /** Reads a list value; a comma-separated string is split into its parts. */
  public List<String> getStringList(MetadataKey key) {
    Object value = known.get(key);
    if (value == null) {
      return List.of();
    }
    List<String> out = new ArrayList<>();
    if (value instanceof Collection<?> values) {
      for (Object element : values) {
        if (element != null && !element.toString().isBlank()) {
          out.add(element.toString().trim());
        }
      }
    } else {
      for (String part : value.toString().split(",")) {
        if (!part.isBlank()) {
          out.add(part.trim());
        }
      }
    }
    return out;
  }

  public String description() {
    return getString(MetadataKey.DESCRIPTION).orElse("");
  }

  public Optional<String> type() {
    return getString(MetadataKey.TYPE);
  }

  public Map<String, Object> extras() {
    return extras;
  }

  public boolean isEmpty() {
    return known.isEmpty() && extras.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ItemMetadata other)) {
      return false;
    }
    return known.equals(other.known) && extras.equals(other.extras);
  }

  @Override
  public int hashCode() {
    return 31 * known.hashCode() + extras.hashCode();
  }

  @Override
  public String toString() {
    return "ItemMetadata" + toMap();
  }
}
