package com.gt.tutor.srs;

import java.util.Arrays;
import java.util.List;

/**
 * Tunables of the spaced repetition update.
 *
 * @param intervalTable          fixed intervals in days, indexed by repetitions
 * @param failureResetSteps      repetitions removed by an incorrect outcome
 * @param lapseEscalationAfter   lapse count after which {@code escalatedLapsePenalty} replaces {@code baseLapsePenalty}
 * @param lowLevelCeiling        levels below this need {@code lowLevelStreak} consecutive successes to advance
 * @param midLevelCeiling        levels below this need {@code midLevelStreak}; higher levels need {@code baselineStreak}
 * @param growthEaseCap          highest ease used for interval growth past the fixed table
 * @param maxGrowthMultiplier    highest factor an interval may grow by in one advancement
 * @param highQualityAccuracy    recent accuracy at or above which a success counts as top quality
 * @param repairHorizonDays      next review dates further out than this are treated as corrupt on load
 */
public record SrsSettings(double minEase,
                          double maxEase,
                          double initialEase,
                          int maxIntervalDays,
                          List<Integer> intervalTable,
                          int failureResetSteps,
                          double baseLapsePenalty,
                          double escalatedLapsePenalty,
                          int lapseEscalationAfter,
                          int accuracyWindow,
                          int lowLevelCeiling,
                          int lowLevelStreak,
                          int midLevelCeiling,
                          int midLevelStreak,
                          int baselineStreak,
                          double growthEaseCap,
                          double maxGrowthMultiplier,
                          double highQualityAccuracy,
                          int repairHorizonDays) {

    public static final double DEFAULT_MIN_EASE = 1.3;
    public static final double DEFAULT_MAX_EASE = 2.8;
    public static final double DEFAULT_INITIAL_EASE = 2.5;
    public static final int DEFAULT_MAX_INTERVAL_DAYS = 90;
    public static final String DEFAULT_INTERVAL_TABLE = "1,2,4,7,12";
    public static final int DEFAULT_FAILURE_RESET_STEPS = 2;
    public static final double DEFAULT_BASE_LAPSE_PENALTY = 0.2;
    public static final double DEFAULT_ESCALATED_LAPSE_PENALTY = 0.3;
    public static final int DEFAULT_LAPSE_ESCALATION_AFTER = 2;
    public static final int DEFAULT_ACCURACY_WINDOW = 8;
    public static final int DEFAULT_LOW_LEVEL_CEILING = 3;
    public static final int DEFAULT_LOW_LEVEL_STREAK = 4;
    public static final int DEFAULT_MID_LEVEL_CEILING = 5;
    public static final int DEFAULT_MID_LEVEL_STREAK = 3;
    public static final int DEFAULT_BASELINE_STREAK = 2;
    public static final double DEFAULT_GROWTH_EASE_CAP = 2.0;
    public static final double DEFAULT_MAX_GROWTH_MULTIPLIER = 1.5;
    public static final double DEFAULT_HIGH_QUALITY_ACCURACY = 0.9;
    public static final int DEFAULT_REPAIR_HORIZON_DAYS = 180;

    public SrsSettings {
        if (minEase <= 0 || minEase > initialEase || initialEase > maxEase) {
            throw new IllegalArgumentException("Ease bounds must satisfy 0 < min <= initial <= max, got min=" + minEase
                    + " initial=" + initialEase + " max=" + maxEase);
        }
        if (maxIntervalDays < 1) {
            throw new IllegalArgumentException("Max interval must be at least one day, got " + maxIntervalDays);
        }
        if (intervalTable == null || intervalTable.isEmpty()) {
            throw new IllegalArgumentException("Interval table must not be empty");
        }
        for (Integer interval : intervalTable) {
            if (interval == null || interval < 1 || interval > maxIntervalDays) {
                throw new IllegalArgumentException("Interval table entries must be between 1 and " + maxIntervalDays + ", got " + intervalTable);
            }
        }
        if (accuracyWindow < 1) {
            throw new IllegalArgumentException("Accuracy window must be positive, got " + accuracyWindow);
        }
        intervalTable = List.copyOf(intervalTable);
        failureResetSteps = Math.max(0, failureResetSteps);
        lowLevelStreak = Math.max(1, lowLevelStreak);
        midLevelStreak = Math.max(1, midLevelStreak);
        baselineStreak = Math.max(1, baselineStreak);
        maxGrowthMultiplier = Math.max(1.0, maxGrowthMultiplier);
        growthEaseCap = Math.max(1.0, growthEaseCap);
    }

    public static SrsSettings defaults() {
        return new SrsSettings(DEFAULT_MIN_EASE, DEFAULT_MAX_EASE, DEFAULT_INITIAL_EASE, DEFAULT_MAX_INTERVAL_DAYS,
                parseIntervalTable(DEFAULT_INTERVAL_TABLE), DEFAULT_FAILURE_RESET_STEPS, DEFAULT_BASE_LAPSE_PENALTY,
                DEFAULT_ESCALATED_LAPSE_PENALTY, DEFAULT_LAPSE_ESCALATION_AFTER, DEFAULT_ACCURACY_WINDOW,
                DEFAULT_LOW_LEVEL_CEILING, DEFAULT_LOW_LEVEL_STREAK, DEFAULT_MID_LEVEL_CEILING, DEFAULT_MID_LEVEL_STREAK,
                DEFAULT_BASELINE_STREAK, DEFAULT_GROWTH_EASE_CAP, DEFAULT_MAX_GROWTH_MULTIPLIER,
                DEFAULT_HIGH_QUALITY_ACCURACY, DEFAULT_REPAIR_HORIZON_DAYS);
    }

    public static List<Integer> parseIntervalTable(String intervalTable) {
        if (intervalTable == null || intervalTable.isBlank()) {
            return List.of();
        }

        return Arrays.stream(intervalTable.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(Integer::valueOf)
                .toList();
    }

    public int requiredStreak(int repetitions) {
        if (repetitions < lowLevelCeiling) {
            return lowLevelStreak;
        } else if (repetitions < midLevelCeiling) {
            return midLevelStreak;
        }
        return baselineStreak;
    }

    public double lapsePenalty(int lapses) {
        return lapses > lapseEscalationAfter ? escalatedLapsePenalty : baseLapsePenalty;
    }
}
