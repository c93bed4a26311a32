package com.flamingo.ai.notesearch.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.notesearch.domain.enums.MetadataKey;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ItemMetadata Tests")
class ItemMetadataTest {

  @Test
  @DisplayName("Should split well-known keys from free-form ones")
  void shouldSplitKnownKeys() {
    ItemMetadata metadata =
        ItemMetadata.fromMap(Map.of("type", "gleaning", "popularity", 1200, "mood", "calm"));

    assertThat(metadata.type()).contains("gleaning");
    assertThat(metadata.getLong(MetadataKey.POPULARITY)).hasValue(1200);
    assertThat(metadata.extras()).containsEntry("mood", "calm").doesNotContainKey("type");
  }

  @Test
  @DisplayName("Should read numeric strings and reject other text")
  void shouldParseNumericStrings() {
    assertThat(ItemMetadata.fromMap(Map.of("popularity", " 42 ")).getLong(MetadataKey.POPULARITY))
        .hasValue(42);
    assertThat(ItemMetadata.fromMap(Map.of("popularity", "many")).getLong(MetadataKey.POPULARITY))
        .isEmpty();
  }

  @Test
  @DisplayName("Should read lists and comma-separated strings alike")
  void shouldReadStringLists() {
    assertThat(
            ItemMetadata.fromMap(Map.of("topics", List.of("rust", " cli ", "")))
                .getStringList(MetadataKey.TOPICS))
        .containsExactly("rust", "cli");
    assertThat(
            ItemMetadata.fromMap(Map.of("topics", "rust, cli,"))
                .getStringList(MetadataKey.TOPICS))
        .containsExactly("rust", "cli");
  }

  @Test
  @DisplayName("Should serialize as one flat JSON object")
  void shouldSerializeFlat() throws Exception {
    ObjectMapper objectMapper = new ObjectMapper();
    ItemMetadata metadata =
        ItemMetadata.empty().with(MetadataKey.LANGUAGE, "Rust").with(MetadataKey.TYPE, "note");

    String json = objectMapper.writeValueAsString(metadata);
    ItemMetadata read =
        objectMapper.readValue(
            "{\"language\":\"Rust\",\"type\":\"note\"}", ItemMetadata.class);

    assertThat(json).contains("\"language\":\"Rust\"").doesNotContain("known");
    assertThat(read).isEqualTo(metadata);
  }

  @Test
  @DisplayName("Should treat blank values as absent")
  void shouldTreatBlankAsAbsent() {
    ItemMetadata metadata = ItemMetadata.fromMap(Map.of("description", "   "));

    assertThat(metadata.description()).isEmpty();
    assertThat(metadata.type()).isEmpty();
  }
}
