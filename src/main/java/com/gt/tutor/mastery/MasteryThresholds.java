package com.gt.tutor.mastery;

/**
 * Thresholds of the mastery classification and of the "struggling" test.
 *
 * @param learningMinRepetitions  below this level an item is still Learning
 * @param learningMinStreak       below this streak an item is still Learning
 * @param learningMinAttempts     below this many attempts an item is still Learning
 * @param masteryMinAccuracy      below this recent accuracy an item is Reviewing
 * @param masteryMinStreak        below this streak an item is Reviewing
 * @param strugglingAccuracy      recent accuracy under this marks an attempted item as struggling
 * @param strugglingMinAttempts   attempts after which a zero streak marks an item as struggling
 */
public record MasteryThresholds(int learningMinRepetitions,
                                int learningMinStreak,
                                int learningMinAttempts,
                                double masteryMinAccuracy,
                                int masteryMinStreak,
                                double strugglingAccuracy,
                                int strugglingMinAttempts) {

    public static final int DEFAULT_LEARNING_MIN_REPETITIONS = 3;
    public static final int DEFAULT_LEARNING_MIN_STREAK = 1;
    public static final int DEFAULT_LEARNING_MIN_ATTEMPTS = 5;
    public static final double DEFAULT_MASTERY_MIN_ACCURACY = 0.8;
    public static final int DEFAULT_MASTERY_MIN_STREAK = 3;
    public static final double DEFAULT_STRUGGLING_ACCURACY = 0.6;
    public static final int DEFAULT_STRUGGLING_MIN_ATTEMPTS = 3;

    public static MasteryThresholds defaults() {
        return new MasteryThresholds(DEFAULT_LEARNING_MIN_REPETITIONS, DEFAULT_LEARNING_MIN_STREAK,
                DEFAULT_LEARNING_MIN_ATTEMPTS, DEFAULT_MASTERY_MIN_ACCURACY, DEFAULT_MASTERY_MIN_STREAK,
                DEFAULT_STRUGGLING_ACCURACY, DEFAULT_STRUGGLING_MIN_ATTEMPTS);
    }
}
