package com.gt.tutor.profile.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Difficulty progress of one grammar item. Tiers are written by rank, 1 (recognition) to 4 (free production);
 * {@code difficulty_mastery} is keyed by the rank as a string.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredDifficultyProgress(@JsonProperty("current_max_difficulty") Integer currentMaxDifficulty,
                                       @JsonProperty("unlocked_difficulties") List<Integer> unlockedDifficulties,
                                       @JsonProperty("difficulty_mastery") Map<String, StoredTierProgress> difficultyMastery) { }
