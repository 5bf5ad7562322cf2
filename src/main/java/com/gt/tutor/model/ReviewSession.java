package com.gt.tutor.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;

public record ReviewSession(int sessionNumber,
                            LocalDate sessionDate,
                            SessionSelection selection,
                            Map<String, ExerciseCategory> recommendedCategories,
                            Map<String, MasteryLevel> startingGrammarLevels) {

    public ReviewSession {
        recommendedCategories = Collections.unmodifiableMap(recommendedCategories);
        startingGrammarLevels = Collections.unmodifiableMap(startingGrammarLevels);
    }
}
