package com.gt.tutor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Profile(String userId,
                      String level,
                      String targetLanguage,
                      LearningPreferences preferences,
                      SessionTracking tracking,
                      Map<String, LearningItem> grammarSummary,
                      Map<String, LearningItem> vocabSummary,
                      Map<String, DifficultyProgress> difficultyProgress,
                      RetainedProperties retainedProperties) {

    public Profile {
        preferences = preferences == null ? LearningPreferences.defaults() : preferences;
        tracking = tracking == null ? SessionTracking.empty() : tracking;
        grammarSummary = grammarSummary == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(grammarSummary));
        vocabSummary = vocabSummary == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(vocabSummary));
        difficultyProgress = difficultyProgress == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(difficultyProgress));
        retainedProperties = retainedProperties == null ? RetainedProperties.empty() : retainedProperties;
    }

    public Profile(String userId,
                   String level,
                   String targetLanguage,
                   LearningPreferences preferences,
                   SessionTracking tracking,
                   Map<String, LearningItem> grammarSummary,
                   Map<String, LearningItem> vocabSummary) {
        this(userId, level, targetLanguage, preferences, tracking, grammarSummary, vocabSummary, Map.of(),
                RetainedProperties.empty());
    }

    public static Profile newProfile(String userId, String level, String targetLanguage, LearningPreferences preferences) {
        return new Profile(userId, level, targetLanguage, preferences, SessionTracking.empty(), Map.of(), Map.of());
    }

    public Profile withGrammarSummary(Map<String, LearningItem> grammarSummary) {
        return new Profile(userId, level, targetLanguage, preferences, tracking, grammarSummary, vocabSummary,
                difficultyProgress, retainedProperties);
    }

    public Profile withVocabSummary(Map<String, LearningItem> vocabSummary) {
        return new Profile(userId, level, targetLanguage, preferences, tracking, grammarSummary, vocabSummary,
                difficultyProgress, retainedProperties);
    }

    public Profile withDifficultyProgress(Map<String, DifficultyProgress> difficultyProgress) {
        return new Profile(userId, level, targetLanguage, preferences, tracking, grammarSummary, vocabSummary,
                difficultyProgress, retainedProperties);
    }

    public Profile withTracking(SessionTracking tracking) {
        return new Profile(userId, level, targetLanguage, preferences, tracking, grammarSummary, vocabSummary,
                difficultyProgress, retainedProperties);
    }

    public Profile withPreferences(LearningPreferences preferences) {
        return new Profile(userId, level, targetLanguage, preferences, tracking, grammarSummary, vocabSummary,
                difficultyProgress, retainedProperties);
    }
}
