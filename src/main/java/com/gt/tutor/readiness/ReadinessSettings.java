package com.gt.tutor.readiness;

/**
 * Bars of the new-content gate.
 *
 * @param singleItemMinExposures   exposures the only known item needs before new content is allowed
 * @param singleItemMinStreak      consecutive correct answers the only known item needs
 * @param singleItemMinAccuracy    recent accuracy the only known item needs
 * @param singleItemMinAttempts    attempts the only known item needs
 * @param singleItemMinRepetitions srs level the only known item needs
 * @param smallSetMaxSize          largest item count judged by the strict small-set rule
 * @param smallSetMasteredShare    share of Mastered items a small set needs
 * @param largeSetStrugglingDivisor a large set may hold at most {@code total / divisor} struggling items
 * @param largeSetUnmasteredDivisor a large set may hold at most {@code total / divisor} items not yet Mastered
 */
public record ReadinessSettings(int singleItemMinExposures,
                                int singleItemMinStreak,
                                double singleItemMinAccuracy,
                                int singleItemMinAttempts,
                                int singleItemMinRepetitions,
                                int smallSetMaxSize,
                                double smallSetMasteredShare,
                                int largeSetStrugglingDivisor,
                                int largeSetUnmasteredDivisor) {

    public static final int DEFAULT_SINGLE_ITEM_MIN_EXPOSURES = 5;
    public static final int DEFAULT_SINGLE_ITEM_MIN_STREAK = 3;
    public static final double DEFAULT_SINGLE_ITEM_MIN_ACCURACY = 0.8;
    public static final int DEFAULT_SINGLE_ITEM_MIN_ATTEMPTS = 5;
    public static final int DEFAULT_SINGLE_ITEM_MIN_REPETITIONS = 3;
    public static final int DEFAULT_SMALL_SET_MAX_SIZE = 4;
    public static final double DEFAULT_SMALL_SET_MASTERED_SHARE = 0.75;
    public static final int DEFAULT_LARGE_SET_STRUGGLING_DIVISOR = 4;
    public static final int DEFAULT_LARGE_SET_UNMASTERED_DIVISOR = 3;

    public ReadinessSettings {
        if (largeSetStrugglingDivisor < 1 || largeSetUnmasteredDivisor < 1) {
            throw new IllegalArgumentException("Readiness divisors must be positive, got " + largeSetStrugglingDivisor
                    + " and " + largeSetUnmasteredDivisor);
        }
    }

    public static ReadinessSettings defaults() {
        return new ReadinessSettings(DEFAULT_SINGLE_ITEM_MIN_EXPOSURES, DEFAULT_SINGLE_ITEM_MIN_STREAK,
                DEFAULT_SINGLE_ITEM_MIN_ACCURACY, DEFAULT_SINGLE_ITEM_MIN_ATTEMPTS, DEFAULT_SINGLE_ITEM_MIN_REPETITIONS,
                DEFAULT_SMALL_SET_MAX_SIZE, DEFAULT_SMALL_SET_MASTERED_SHARE, DEFAULT_LARGE_SET_STRUGGLING_DIVISOR,
                DEFAULT_LARGE_SET_UNMASTERED_DIVISOR);
    }
}
