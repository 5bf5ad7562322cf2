package com.gt.tutor.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public record MasteryReport(LocalDate reportDate,
                            List<ItemMasterySummary> grammar,
                            List<ItemMasterySummary> vocab,
                            Map<MasteryLevel, Integer> grammarCounts,
                            Map<MasteryLevel, Integer> vocabCounts,
                            List<DifficultySummary> grammarDifficulty,
                            boolean newContentAllowed) {

    public MasteryReport {
        grammar = Collections.unmodifiableList(grammar);
        vocab = Collections.unmodifiableList(vocab);
        grammarCounts = Collections.unmodifiableMap(grammarCounts);
        vocabCounts = Collections.unmodifiableMap(vocabCounts);
        grammarDifficulty = Collections.unmodifiableList(grammarDifficulty);
    }
}
