package com.gt.tutor.profile.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StoredPreferences {

    private final Integer reviewsPerSession;
    private final Integer vocabReviewsPerSession;
    private final Integer newGrammarPerSession;
    private final Integer newVocabPerSession;
    private final Integer maxNewItemsPerSession;
    private final Integer consolidationSessions;
    private final List<String> preferredExerciseTypes;
    private final Map<String, Object> otherProperties;

    @JsonCreator
    public StoredPreferences(@JsonProperty("reviews_per_session") Integer reviewsPerSession,
                             @JsonProperty("vocab_reviews_per_session") Integer vocabReviewsPerSession,
                             @JsonProperty("new_grammar_per_session") Integer newGrammarPerSession,
                             @JsonProperty("new_vocab_per_session") Integer newVocabPerSession,
                             @JsonProperty("max_new_items_per_session") Integer maxNewItemsPerSession,
                             @JsonProperty("consolidation_sessions") Integer consolidationSessions,
                             @JsonProperty("preferred_exercise_types") List<String> preferredExerciseTypes) {
        this(reviewsPerSession, vocabReviewsPerSession, newGrammarPerSession, newVocabPerSession, maxNewItemsPerSession,
                consolidationSessions, preferredExerciseTypes, Map.of());
    }

    public StoredPreferences(Integer reviewsPerSession,
                             Integer vocabReviewsPerSession,
                             Integer newGrammarPerSession,
                             Integer newVocabPerSession,
                             Integer maxNewItemsPerSession,
                             Integer consolidationSessions,
                             List<String> preferredExerciseTypes,
                             Map<String, Object> otherProperties) {
        this.reviewsPerSession = reviewsPerSession;
        this.vocabReviewsPerSession = vocabReviewsPerSession;
        this.newGrammarPerSession = newGrammarPerSession;
        this.newVocabPerSession = newVocabPerSession;
        this.maxNewItemsPerSession = maxNewItemsPerSession;
        this.consolidationSessions = consolidationSessions;
        this.preferredExerciseTypes = preferredExerciseTypes;
        this.otherProperties = new LinkedHashMap<>(otherProperties);
    }

    @JsonProperty("reviews_per_session")
    public Integer reviewsPerSession() {
        return reviewsPerSession;
    }

    @JsonProperty("vocab_reviews_per_session")
    public Integer vocabReviewsPerSession() {
        return vocabReviewsPerSession;
    }

    @JsonProperty("new_grammar_per_session")
    public Integer newGrammarPerSession() {
        return newGrammarPerSession;
    }

    @JsonProperty("new_vocab_per_session")
    public Integer newVocabPerSession() {
        return newVocabPerSession;
    }

    @JsonProperty("max_new_items_per_session")
    public Integer maxNewItemsPerSession() {
        return maxNewItemsPerSession;
    }

    @JsonProperty("consolidation_sessions")
    public Integer consolidationSessions() {
        return consolidationSessions;
    }

    @JsonProperty("preferred_exercise_types")
    public List<String> preferredExerciseTypes() {
        return preferredExerciseTypes;
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
