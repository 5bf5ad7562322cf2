package com.gt.tutor.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public record DifficultySummary(String grammarId,
                                DifficultyTier currentMaxTier,
                                List<DifficultyTier> unlockedTiers,
                                Map<DifficultyTier, TierMasterySummary> masteryByTier,
                                boolean canUnlockNext) {

    public DifficultySummary {
        unlockedTiers = List.copyOf(unlockedTiers);
        masteryByTier = Collections.unmodifiableMap(masteryByTier);
    }

    public record TierMasterySummary(boolean mastered, int repetitions, double accuracy, int consecutiveCorrect) { }
}
