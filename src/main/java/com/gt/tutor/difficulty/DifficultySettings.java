package com.gt.tutor.difficulty;

/**
 * Bars a grammar item has to clear at a difficulty tier before the next tier unlocks.
 *
 * @param minRepetitions  correct answers at the tier
 * @param minAccuracy     recent accuracy at the tier
 * @param minStreak       consecutive correct answers at the tier
 * @param minAttempts     attempts at the tier
 * @param accuracyWindow  attempts the recent accuracy is measured over
 * @param unlockDelayDays days between mastering a tier and unlocking the next one
 */
public record DifficultySettings(int minRepetitions,
                                 double minAccuracy,
                                 int minStreak,
                                 int minAttempts,
                                 int accuracyWindow,
                                 int unlockDelayDays) {

    public static final int DEFAULT_MIN_REPETITIONS = 3;
    public static final double DEFAULT_MIN_ACCURACY = 0.8;
    public static final int DEFAULT_MIN_STREAK = 3;
    public static final int DEFAULT_MIN_ATTEMPTS = 5;
    public static final int DEFAULT_ACCURACY_WINDOW = 8;
    public static final int DEFAULT_UNLOCK_DELAY_DAYS = 1;

    public DifficultySettings {
        if (accuracyWindow < 1) {
            throw new IllegalArgumentException("Difficulty accuracy window must be positive, got " + accuracyWindow);
        }
    }

    public static DifficultySettings defaults() {
        return new DifficultySettings(DEFAULT_MIN_REPETITIONS, DEFAULT_MIN_ACCURACY, DEFAULT_MIN_STREAK,
                DEFAULT_MIN_ATTEMPTS, DEFAULT_ACCURACY_WINDOW, DEFAULT_UNLOCK_DELAY_DAYS);
    }
}
