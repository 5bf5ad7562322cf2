package com.gt.tutor.difficulty;

import com.gt.tutor.model.DifficultyProgress;
import com.gt.tutor.model.DifficultyTier;
import com.gt.tutor.model.ExerciseCategory;
import com.gt.tutor.model.LearningPreferences;
import com.gt.tutor.model.TierProgress;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Picks the exercise category a grammar item should be practiced with. The hardest unlocked tier that is not yet
 * mastered, or is due again, wins; within a tier the learner's preferred categories win.
 */
@Component
public class DifficultyAdvisor {

    private final DifficultyProgressTracker difficultyProgressTracker;

    @Autowired
    public DifficultyAdvisor(DifficultyProgressTracker difficultyProgressTracker) {
        this.difficultyProgressTracker = difficultyProgressTracker;
    }

    // A null progress has never been practiced
    public DifficultyTier selectTier(DifficultyProgress progress, LocalDate today) {
        DifficultyProgress current = difficultyProgressTracker.unlockPending(
                progress == null ? DifficultyProgress.initial() : progress, today);

        List<DifficultyTier> unlockedTiers = current.unlockedTiers();
        for (int i = unlockedTiers.size() - 1; i >= 0; i--) {
            DifficultyTier tier = unlockedTiers.get(i);
            TierProgress tierProgress = current.progressAt(tier);
            if (!difficultyProgressTracker.isMastered(tierProgress) || tierProgress.isDue(today)) {
                return tier;
            }
        }

        // everything mastered and nothing due, keep up the hardest tier
        return current.currentMaxTier();
    }

    public ExerciseCategory recommend(DifficultyProgress progress, LearningPreferences preferences, LocalDate today) {
        List<ExerciseCategory> tierCategories = ExerciseCategory.forTier(selectTier(progress, today));

        for (ExerciseCategory preferred : preferences.preferredExerciseTypes()) {
            if (tierCategories.contains(preferred)) {
                return preferred;
            }
        }

        return tierCategories.get(0);
    }
}
