package com.flamingo.ai.notesearch.domain.model;

import com.flamingo.ai.notesearch.domain.enums.ItemStatus;
import java.time.Instant;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A unit of retrievable content as supplied by an item source. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Item {

  private String id;
  @Builder.Default private String title = "";
  @Builder.Default private String body = "";
  @Builder.Default private Set<String> tags = Set.of();
  @Builder.Default private ItemMetadata metadata = ItemMetadata.empty();
  private Instant modifiedAt;
  @Builder.Default private ItemStatus status = ItemStatus.ACTIVE;
}
