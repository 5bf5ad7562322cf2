package com.gt.tutor.difficulty;

import com.gt.tutor.model.DifficultyProgress;
import com.gt.tutor.model.DifficultySummary;
import com.gt.tutor.model.DifficultySummary.TierMasterySummary;
import com.gt.tutor.model.DifficultyTier;
import com.gt.tutor.model.ExerciseCategory;
import com.gt.tutor.model.TierProgress;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Records practice per difficulty tier and unlocks tiers one at a time. A tier unlocks once the tier below it is
 * mastered and the unlock delay has passed since its mastery date.
 */
@Component
public class DifficultyProgressTracker {

    private final DifficultySettings settings;

    @Autowired
    public DifficultyProgressTracker(DifficultySettings settings) {
        this.settings = settings;
    }

    public boolean isMastered(TierProgress progress) {
        return progress != null
                && progress.repetitions() >= settings.minRepetitions()
                && progress.recentAccuracy() >= settings.minAccuracy()
                && progress.consecutiveCorrect() >= settings.minStreak()
                && progress.totalAttempts() >= settings.minAttempts();
    }

    // A null progress has never been practiced
    public DifficultyProgress recordOutcome(DifficultyProgress progress, ExerciseCategory category, boolean correct,
                                            LocalDate today) {
        DifficultyProgress current = unlockPending(progress == null ? DifficultyProgress.initial() : progress, today);

        DifficultyTier tier = category.getTier();
        TierProgress practiced = current.progressAt(tier);
        TierProgress updated = practice(practiced == null ? TierProgress.firstSeen(today) : practiced, correct, today);

        if (correct && updated.masteryDate() == null && isMastered(updated)) {
            updated = new TierProgress(updated.repetitions(), updated.lapses(), updated.consecutiveCorrect(),
                    updated.totalAttempts(), updated.recentAccuracy(), updated.intervalDays(), updated.firstSeenDate(),
                    updated.lastReviewedDate(), updated.nextReviewDate(), today);
        }

        return current.withTierProgress(tier, updated);
    }

    public boolean canUnlockNext(DifficultyProgress progress, LocalDate today) {
        if (progress.currentMaxTier().next().isEmpty()) {
            return false;
        }

        TierProgress current = progress.progressAt(progress.currentMaxTier());
        if (!isMastered(current)) {
            return false;
        }

        return current.masteryDate() == null
                || ChronoUnit.DAYS.between(current.masteryDate(), today) >= settings.unlockDelayDays();
    }

    public DifficultyProgress unlockPending(DifficultyProgress progress, LocalDate today) {
        if (!canUnlockNext(progress, today)) {
            return progress;
        }

        Optional<DifficultyTier> next = progress.currentMaxTier().next();
        return next.map(progress::withCurrentMaxTier).orElse(progress);
    }

    public DifficultySummary summarize(String grammarId, DifficultyProgress progress, LocalDate today) {
        DifficultyProgress current = progress == null ? DifficultyProgress.initial() : progress;

        Map<DifficultyTier, TierMasterySummary> masteryByTier = new EnumMap<>(DifficultyTier.class);
        for (DifficultyTier tier : DifficultyTier.values()) {
            TierProgress tierProgress = current.progressAt(tier);
            masteryByTier.put(tier, tierProgress == null
                    ? new TierMasterySummary(false, 0, 0.0, 0)
                    : new TierMasterySummary(isMastered(tierProgress), tierProgress.repetitions(),
                            tierProgress.recentAccuracy(), tierProgress.consecutiveCorrect()));
        }

        return new DifficultySummary(grammarId, current.currentMaxTier(), current.unlockedTiers(), masteryByTier,
                canUnlockNext(current, today));
    }

    private TierProgress practice(TierProgress progress, boolean correct, LocalDate today) {
        int totalAttempts = progress.totalAttempts() + 1;
        int repetitions = progress.repetitions();
        int consecutiveCorrect = progress.consecutiveCorrect();
        int lapses = progress.lapses();

        if (correct) {
            consecutiveCorrect++;
            repetitions++;
        } else {
            consecutiveCorrect = 0;
            lapses++;
        }

        double recentAccuracy = Math.min(1.0,
                (double) consecutiveCorrect / Math.min(totalAttempts, settings.accuracyWindow()));
        int intervalDays = Math.max(1, repetitions);

        return new TierProgress(repetitions, lapses, consecutiveCorrect, totalAttempts, recentAccuracy, intervalDays,
                progress.firstSeenDate() == null ? today : progress.firstSeenDate(), today,
                today.plusDays(intervalDays), progress.masteryDate());
    }
}
