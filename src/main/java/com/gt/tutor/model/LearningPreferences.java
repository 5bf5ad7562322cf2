package com.gt.tutor.model;

import java.util.List;

public record LearningPreferences(int reviewsPerSession,
                                  int vocabReviewsPerSession,
                                  int newGrammarPerSession,
                                  int newVocabPerSession,
                                  int maxNewItemsPerSession,
                                  int consolidationSessions,
                                  List<ExerciseCategory> preferredExerciseTypes) {

    public static final int DEFAULT_REVIEWS_PER_SESSION = 10;
    public static final int DEFAULT_VOCAB_REVIEWS_PER_SESSION = 10;
    public static final int DEFAULT_NEW_GRAMMAR_PER_SESSION = 2;
    public static final int DEFAULT_NEW_VOCAB_PER_SESSION = 5;
    public static final int DEFAULT_MAX_NEW_ITEMS_PER_SESSION = 5;
    public static final int DEFAULT_CONSOLIDATION_SESSIONS = 1;

    public LearningPreferences {
        reviewsPerSession = Math.max(0, reviewsPerSession);
        vocabReviewsPerSession = Math.max(0, vocabReviewsPerSession);
        newGrammarPerSession = Math.max(0, newGrammarPerSession);
        newVocabPerSession = Math.max(0, newVocabPerSession);
        maxNewItemsPerSession = Math.max(0, maxNewItemsPerSession);
        consolidationSessions = Math.max(0, consolidationSessions);
        preferredExerciseTypes = preferredExerciseTypes == null ? List.of() : List.copyOf(preferredExerciseTypes);
    }

    public static LearningPreferences defaults() {
        return new LearningPreferences(DEFAULT_REVIEWS_PER_SESSION,
                DEFAULT_VOCAB_REVIEWS_PER_SESSION,
                DEFAULT_NEW_GRAMMAR_PER_SESSION,
                DEFAULT_NEW_VOCAB_PER_SESSION,
                DEFAULT_MAX_NEW_ITEMS_PER_SESSION,
                DEFAULT_CONSOLIDATION_SESSIONS,
                List.of());
    }
}
