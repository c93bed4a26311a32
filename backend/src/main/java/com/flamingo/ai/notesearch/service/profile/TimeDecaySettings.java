package com.flamingo.ai.notesearch.service.profile;

/** Half-life and maximum boost of the recency boost. */
public record TimeDecaySettings(double halfLifeDays, double maxBoost) {}
