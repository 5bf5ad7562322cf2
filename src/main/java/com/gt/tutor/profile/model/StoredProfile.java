package com.gt.tutor.profile.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The profile document. Properties without a field here are collected into {@link #otherProperties()} and written
 * back next to the known ones.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StoredProfile {

    private final String userId;
    private final String level;
    private final String legacyUserLevel;
    private final String targetLanguage;
    private final StoredPreferences learningPreferences;
    private final StoredSessionTracking sessionTracking;
    private final Map<String, StoredLearningItem> grammarSummary;
    private final Map<String, StoredLearningItem> vocabSummary;
    private final Map<String, StoredDifficultyProgress> grammarDifficultyProgress;
    private final Map<String, Object> otherProperties;

    @JsonCreator
    public StoredProfile(@JsonProperty("user_id") String userId,
                         @JsonProperty("level") String level,
                         @JsonProperty("user_level") String legacyUserLevel,
                         @JsonProperty("target_language") String targetLanguage,
                         @JsonProperty("learning_preferences") StoredPreferences learningPreferences,
                         @JsonProperty("session_tracking") StoredSessionTracking sessionTracking,
                         @JsonProperty("grammar_summary") Map<String, StoredLearningItem> grammarSummary,
                         @JsonProperty("vocab_summary") Map<String, StoredLearningItem> vocabSummary,
                         @JsonProperty("grammar_difficulty_progress") Map<String, StoredDifficultyProgress> grammarDifficultyProgress) {
        this(userId, level, legacyUserLevel, targetLanguage, learningPreferences, sessionTracking, grammarSummary,
                vocabSummary, grammarDifficultyProgress, Map.of());
    }

    public StoredProfile(String userId,
                         String level,
                         String legacyUserLevel,
                         String targetLanguage,
                         StoredPreferences learningPreferences,
                         StoredSessionTracking sessionTracking,
                         Map<String, StoredLearningItem> grammarSummary,
                         Map<String, StoredLearningItem> vocabSummary,
                         Map<String, StoredDifficultyProgress> grammarDifficultyProgress,
                         Map<String, Object> otherProperties) {
        this.userId = userId;
        this.level = level;
        this.legacyUserLevel = legacyUserLevel;
        this.targetLanguage = targetLanguage;
        this.learningPreferences = learningPreferences;
        this.sessionTracking = sessionTracking;
        this.grammarSummary = grammarSummary;
        this.vocabSummary = vocabSummary;
        this.grammarDifficultyProgress = grammarDifficultyProgress;
        this.otherProperties = new LinkedHashMap<>(otherProperties);
    }

    @JsonProperty("user_id")
    public String userId() {
        return userId;
    }

    @JsonProperty("level")
    public String level() {
        return level;
    }

    @JsonProperty("user_level")
    public String legacyUserLevel() {
        return legacyUserLevel;
    }

    @JsonProperty("target_language")
    public String targetLanguage() {
        return targetLanguage;
    }

    @JsonProperty("learning_preferences")
    public StoredPreferences learningPreferences() {
        return learningPreferences;
    }

    @JsonProperty("session_tracking")
    public StoredSessionTracking sessionTracking() {
        return sessionTracking;
    }

    @JsonProperty("grammar_summary")
    public Map<String, StoredLearningItem> grammarSummary() {
        return grammarSummary;
    }

    @JsonProperty("vocab_summary")
    public Map<String, StoredLearningItem> vocabSummary() {
        return vocabSummary;
    }

    @JsonProperty("grammar_difficulty_progress")
    public Map<String, StoredDifficultyProgress> grammarDifficultyProgress() {
        return grammarDifficultyProgress;
    }

    @JsonAnyGetter
    public Map<String, Object> otherProperties() {
        return otherProperties;
    }

    @JsonAnySetter
    void putOtherProperty(String name, Object value) {
        otherProperties.put(name, value);
    }
}
