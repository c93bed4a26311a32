package com.flamingo.ai.notesearch.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contents of {@code index.json}, the file that binds a storage directory to one corpus root.
 *
 * <p>Unknown keys are preserved so a rewrite (for example a legacy migration) never drops data
 * written by a newer version.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CorpusIndexMetadata {

  private String corpusRoot;
  private String corpusName;
  private String embeddingModel;
  private Instant indexedAt;
  private Instant migratedAt;
  private Integer itemCount;
  private Integer entryCount;
  private Integer embeddingDimension;

  @Builder.Default private Map<String, Object> other = new LinkedHashMap<>();

  @JsonAnySetter
  public void putOther(String key, Object value) {
    if (other == null) {
      other = new LinkedHashMap<>();
    }
    other.put(key, value);
  }

  @JsonAnyGetter
  public Map<String, Object> getOther() {
    return other;
  }

  /** An index without a root binding predates corpus validation and must be migrated. */
  @JsonIgnore
  public boolean isLegacy() {
    return corpusRoot == null || corpusRoot.isBlank();
  }
}
