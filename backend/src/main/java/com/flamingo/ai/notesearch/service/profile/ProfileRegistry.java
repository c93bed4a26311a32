package com.flamingo.ai.notesearch.service.profile;

import com.flamingo.ai.notesearch.config.SearchConfig;
import com.flamingo.ai.notesearch.domain.enums.MetadataKey;
import com.flamingo.ai.notesearch.exception.ConfigurationException;
import com.flamingo.ai.notesearch.exception.UnknownProfileException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Holds the built-in search profiles plus custom ones from {@code search.profiles}. Custom
 * profiles cannot replace a built-in; a clash is logged and skipped.
 */
@Service
@Slf4j
public class ProfileRegistry {

  public static final String DEFAULT_PROFILE = "default";

  private static final double POPULARITY_SATURATION = 10000;

  private final Map<String, SearchProfile> profiles;
  private final Set<String> builtInNames;

  public ProfileRegistry(SearchConfig searchConfig) {
    Map<String, SearchProfile> all = new LinkedHashMap<>();
    for (SearchProfile profile : builtIns(searchConfig)) {
      all.put(profile.getName(), profile);
    }
    this.builtInNames = Set.copyOf(all.keySet());

    SearchProfile defaults = all.get(DEFAULT_PROFILE);
    searchConfig
        .getProfiles()
        .forEach(
            (name, definition) -> {
              if (builtInNames.contains(name)) {
                log.warn(
                    "Skipping custom profile '{}': name conflicts with a built-in profile", name);
                return;
              }
              all.put(name, fromDefinition(name, definition, defaults));
              log.info("Loaded custom profile: {}", name);
            });
    this.profiles = Collections.unmodifiableMap(all);
  }

  /**
   * Resolves a profile by name. A blank name means {@value #DEFAULT_PROFILE}.
   *
   * @throws UnknownProfileException if no profile has that name
   */
  public SearchProfile get(String name) {
    if (name == null || name.isBlank()) {
      return profiles.get(DEFAULT_PROFILE);
    }
    SearchProfile profile = profiles.get(name);
    if (profile == null) {
      throw new UnknownProfileException(name, profiles.keySet());
    }
    return profile;
  }

  public Collection<SearchProfile> list() {
    return profiles.values();
  }

  public boolean isBuiltIn(String name) {
    return builtInNames.contains(name);
  }

  private static List<SearchProfile> builtIns(SearchConfig config) {
    SearchConfig.TimeDecay decay = config.getTimeDecay();
    SearchConfig.Chunking chunking = config.getChunking();
    List<SearchProfile> builtIns = new ArrayList<>();

    builtIns.add(
        SearchProfile.builder()
            .name("repos")
            .displayName("Repos & Tech")
            .description("Find repositories, libraries and tools by keywords and popularity")
            .hybridWeight(0.3)
            .bm25Boost(2.0)
            .metadataBoosts(
                List.of(
                    MetadataBoostRule.logScale(MetadataKey.POPULARITY, 0.5, POPULARITY_SATURATION),
                    MetadataBoostRule.match(MetadataKey.TOPICS, 3.0),
                    MetadataBoostRule.match(MetadataKey.LANGUAGE, 1.5)))
            .crossEncoderEnabled(false)
            .includeTypes(List.of("gleaning"))
            .chunkingEnabled(false)
            .chunkSize(chunking.getSize())
            .chunkOverlap(chunking.getOverlap())
            .build());

    builtIns.add(
        SearchProfile.builder()
            .name("recent")
            .displayName("Recent Work")
            .description("Find what you wrote or saved recently (last 90 days)")
            .hybridWeight(0.5)
            .timeDecay(new TimeDecaySettings(7, 0.5))
            .maxAgeDays(90)
            .includeTypes(List.of("daily", "note", "writering"))
            .chunkSize(chunking.getSize())
            .chunkOverlap(chunking.getOverlap())
            .build());

    builtIns.add(
        SearchProfile.builder()
            .name("deep")
            .displayName("Deep Reading")
            .description("Search long-form content with full context (articles, books, essays)")
            .hybridWeight(0.8)
            .excludeTypes(List.of("daily", "gleaning"))
            .chunkSize(2000)
            .chunkOverlap(400)
            .showChunkContext(true)
            .build());

    builtIns.add(
        SearchProfile.builder()
            .name("keywords")
            .displayName("Keyword Search")
            .description("Exact keyword matching for technical terms, names, phrases")
            .hybridWeight(0.2)
            .bm25Boost(1.5)
            .crossEncoderEnabled(false)
            .chunkSize(chunking.getSize())
            .chunkOverlap(chunking.getOverlap())
            .build());

    builtIns.add(
        SearchProfile.builder()
            .name(DEFAULT_PROFILE)
            .displayName("Balanced")
            .description("General-purpose search")
            .hybridWeight(0.5)
            .timeDecay(
                decay.isEnabled()
                    ? new TimeDecaySettings(decay.getHalfLifeDays(), decay.getMaxBoost())
                    : null)
            .excludeTypes(List.of("daily"))
            .chunkingEnabled(chunking.isEnabled())
            .chunkSize(chunking.getSize())
            .chunkOverlap(chunking.getOverlap())
            .build());
    return builtIns;
  }

  private static SearchProfile fromDefinition(
      String name, SearchConfig.ProfileDefinition def, SearchProfile defaults) {
    SearchProfile.SearchProfileBuilder builder =
        defaults.toBuilder()
            .name(name)
            .displayName(def.getDisplayName() != null ? def.getDisplayName() : capitalize(name))
            .description(
                def.getDescription() != null ? def.getDescription() : "Custom search profile")
            .metadataBoosts(metadataRules(name, def.getMetadataBoosts()))
            .includeTypes(def.getIncludeTypes() != null ? def.getIncludeTypes() : List.of())
            .excludeTypes(def.getExcludeTypes() != null ? def.getExcludeTypes() : List.of());

    if (def.getHybridWeight() != null) {
      double weight = def.getHybridWeight();
      if (weight < 0.0 || weight > 1.0) {
        throw new ConfigurationException(
            "Profile '" + name + "': hybrid-weight must be within [0, 1], got " + weight);
      }
      builder.hybridWeight(weight);
    }
    if (def.getBm25Boost() != null) {
      builder.bm25Boost(def.getBm25Boost());
    }
    if (def.getTagBoostEnabled() != null) {
      builder.tagBoostEnabled(def.getTagBoostEnabled());
    }
    if (Boolean.FALSE.equals(def.getTimeDecayEnabled())) {
      builder.timeDecay(null);
    } else if (def.getTimeDecayHalfLifeDays() != null || def.getTimeDecayMaxBoost() != null) {
      TimeDecaySettings base =
          defaults.getTimeDecay() != null
              ? defaults.getTimeDecay()
              : new TimeDecaySettings(90, 0.2);
      builder.timeDecay(
          new TimeDecaySettings(
              def.getTimeDecayHalfLifeDays() != null
                  ? def.getTimeDecayHalfLifeDays()
                  : base.halfLifeDays(),
              def.getTimeDecayMaxBoost() != null ? def.getTimeDecayMaxBoost() : base.maxBoost()));
    }
    if (def.getMaxAgeDays() != null) {
      builder.maxAgeDays(def.getMaxAgeDays());
    }
    if (def.getCrossEncoderEnabled() != null) {
      builder.crossEncoderEnabled(def.getCrossEncoderEnabled());
    }
    if (def.getQueryExpansionEnabled() != null) {
      builder.queryExpansionEnabled(def.getQueryExpansionEnabled());
    }
    if (def.getChunkingEnabled() != null) {
      builder.chunkingEnabled(def.getChunkingEnabled());
    }
    if (def.getChunkSize() != null) {
      builder.chunkSize(def.getChunkSize());
    }
    if (def.getChunkOverlap() != null) {
      builder.chunkOverlap(def.getChunkOverlap());
    }
    if (def.getShowChunkContext() != null) {
      builder.showChunkContext(def.getShowChunkContext());
    }
    SearchProfile profile = builder.build();
    if (profile.getChunkOverlap() >= profile.getChunkSize() || profile.getChunkOverlap() < 0) {
      throw new ConfigurationException(
          "Profile '"
              + name
              + "': chunk overlap ("
              + profile.getChunkOverlap()
              + ") must be non-negative and smaller than chunk size ("
              + profile.getChunkSize()
              + ")");
    }
    return profile;
  }

  private static List<MetadataBoostRule> metadataRules(
      String profileName, List<SearchConfig.MetadataBoostDefinition> definitions) {
    if (definitions == null || definitions.isEmpty()) {
      return List.of();
    }
    List<MetadataBoostRule> rules = new ArrayList<>();
    for (SearchConfig.MetadataBoostDefinition def : definitions) {
      MetadataKey key = MetadataKey.fromJsonName(def.getKey());
      if (key == null) {
        throw new ConfigurationException(
            "Profile '" + profileName + "': unknown metadata boost key '" + def.getKey() + "'");
      }
      String scale = def.getScale() == null ? "log" : def.getScale().toLowerCase(Locale.ROOT);
      switch (scale) {
        case "log" ->
            rules.add(MetadataBoostRule.logScale(key, def.getMaxBoost(), def.getSaturation()));
        case "match" -> rules.add(MetadataBoostRule.match(key, def.getMatchBoost()));
        default ->
            throw new ConfigurationException(
                "Profile '"
                    + profileName
                    + "': unknown metadata boost scale '"
                    + def.getScale()
                    + "'");
      }
    }
    return List.copyOf(rules);
  }

  private static String capitalize(String name) {
    return name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);
  }
}
