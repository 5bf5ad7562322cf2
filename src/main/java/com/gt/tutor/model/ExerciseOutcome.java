package com.gt.tutor.model;

import java.util.List;

// Result of one evaluated exercise. Ids may be raw or canonical; category is optional.
public record ExerciseOutcome(List<String> grammarIds,
                              List<String> vocabIds,
                              boolean correct,
                              ExerciseCategory category) {

    public ExerciseOutcome {
        grammarIds = grammarIds == null ? List.of() : List.copyOf(grammarIds);
        vocabIds = vocabIds == null ? List.of() : List.copyOf(vocabIds);
    }
}
