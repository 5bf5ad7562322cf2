package com.gt.tutor.model;

import java.time.LocalDate;

/**
 * Practice record of one grammar item at one difficulty tier. Kept apart from the item's own review state: the tier
 * record only measures whether the learner handles this kind of exercise, it never moves the item's schedule.
 */
public record TierProgress(int repetitions,
                           int lapses,
                           int consecutiveCorrect,
                           int totalAttempts,
                           double recentAccuracy,
                           int intervalDays,
                           LocalDate firstSeenDate,
                           LocalDate lastReviewedDate,
                           LocalDate nextReviewDate,
                           LocalDate masteryDate) {

    public static TierProgress firstSeen(LocalDate today) {
        return new TierProgress(0, 0, 0, 0, 0.0, 1, today, today, null, null);
    }

    public boolean isDue(LocalDate today) {
        return nextReviewDate != null && !nextReviewDate.isAfter(today);
    }
}
