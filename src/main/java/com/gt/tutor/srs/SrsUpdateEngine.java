package com.gt.tutor.srs;

import com.gt.tutor.model.ItemKind;
import com.gt.tutor.model.LearningItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Component
public class SrsUpdateEngine {

    private static final Logger log = LoggerFactory.getLogger(SrsUpdateEngine.class);

    private static final int TOP_QUALITY = 5;
    private static final int GOOD_QUALITY = 4;

    private final SrsSettings settings;

    @Autowired
    public SrsUpdateEngine(SrsSettings settings) {
        this.settings = settings;
    }

    public SrsSettings getSettings() {
        return settings;
    }

    public LearningItem newItem(String id, ItemKind kind, LocalDate today) {
        int intervalDays = intervalForLevel(0);

        return LearningItem.builder()
                .id(id)
                .kind(kind)
                .easeFactor(settings.initialEase())
                .intervalDays(intervalDays)
                .firstSeenDate(today)
                .lastReviewedDate(today)
                .nextReviewDate(today.plusDays(intervalDays))
                .build();
    }

    public LearningItem applyOutcome(LearningItem item, boolean correct, LocalDate today) {
        int totalAttempts = item.totalAttempts() + 1;
        int consecutiveCorrect = correct ? item.consecutiveCorrect() + 1 : 0;
        int successStreak = correct ? item.successStreak() + 1 : 0;
        double recentAccuracy = calculateRecentAccuracy(consecutiveCorrect, totalAttempts);

        int repetitions = item.repetitions();
        int intervalDays = clampInterval(item.intervalDays());
        int lapses = item.lapses();
        double easeFactor = clampEase(item.easeFactor());

        if (!correct) {
            repetitions = Math.max(0, repetitions - settings.failureResetSteps());
            intervalDays = intervalForLevel(repetitions);
            lapses++;
            easeFactor = Math.max(settings.minEase(), easeFactor - settings.lapsePenalty(lapses));
        } else if (successStreak >= settings.requiredStreak(repetitions)) {
            int previousInterval = intervalDays;

            repetitions++;
            intervalDays = repetitions < settings.intervalTable().size()
                    ? settings.intervalTable().get(repetitions)
                    : growInterval(previousInterval, easeFactor);
            easeFactor = clampEase(easeFactor + calculateEaseDelta(calculateQuality(recentAccuracy)));
            successStreak = 0;
        }
        // a success without the required streak keeps the level and repeats the current interval

        LearningItem updated = item.toBuilder()
                .easeFactor(easeFactor)
                .intervalDays(intervalDays)
                .repetitions(repetitions)
                .lapses(lapses)
                .consecutiveCorrect(consecutiveCorrect)
                .successStreak(successStreak)
                .totalAttempts(totalAttempts)
                .recentAccuracy(recentAccuracy)
                .firstSeenDate(item.firstSeenDate() == null ? today : item.firstSeenDate())
                .lastReviewedDate(today)
                .nextReviewDate(today.plusDays(intervalDays))
                .build();

        log.debug("{} {} '{}': level {} -> {}, interval {} -> {} days, ease {} -> {}",
                correct ? "Correct" : "Incorrect", item.kind(), item.id(),
                item.repetitions(), updated.repetitions(),
                item.intervalDays(), updated.intervalDays(),
                item.easeFactor(), updated.easeFactor());

        return updated;
    }

    /**
     * Restores the numeric and date invariants of an item loaded from storage. Items with an interval or ease outside
     * the configured bounds, or a next review date beyond the repair horizon, get an interval recomputed from their
     * repetitions alone. Returns the same instance when nothing needed repair.
     */
    public LearningItem repair(LearningItem item, LocalDate today) {
        List<String> problems = new ArrayList<>();

        int repetitions = nonNegative(item.repetitions(), "repetitions", problems);
        int lapses = nonNegative(item.lapses(), "lapses", problems);
        int consecutiveCorrect = nonNegative(item.consecutiveCorrect(), "consecutive correct", problems);
        int successStreak = nonNegative(item.successStreak(), "success streak", problems);
        int totalAttempts = nonNegative(item.totalAttempts(), "total attempts", problems);
        int streakAttempts = Math.max(consecutiveCorrect, successStreak);
        if (totalAttempts < streakAttempts) {
            problems.add("total attempts " + totalAttempts + " below streak " + streakAttempts);
            totalAttempts = streakAttempts;
        }
        int exposureCount = nonNegative(item.exposureCount(), "exposure count", problems);

        double recentAccuracy = item.recentAccuracy();
        if (Double.isNaN(recentAccuracy) || recentAccuracy < 0 || recentAccuracy > 1) {
            problems.add("recent accuracy " + recentAccuracy);
            recentAccuracy = Double.isNaN(recentAccuracy) ? 0 : Math.min(1, Math.max(0, recentAccuracy));
        }

        boolean recomputeInterval = false;
        double easeFactor = item.easeFactor();
        if (Double.isNaN(easeFactor) || easeFactor < settings.minEase() || easeFactor > settings.maxEase()) {
            problems.add("ease " + easeFactor);
            easeFactor = Double.isNaN(easeFactor) ? settings.initialEase() : clampEase(easeFactor);
            recomputeInterval = true;
        }

        int intervalDays = item.intervalDays();
        if (intervalDays < 1 || intervalDays > settings.maxIntervalDays()) {
            problems.add("interval " + intervalDays);
            recomputeInterval = true;
        }

        LocalDate horizon = today.plusDays(settings.repairHorizonDays());
        LocalDate nextReviewDate = item.nextReviewDate();
        boolean beyondHorizon = nextReviewDate != null && nextReviewDate.isAfter(horizon);
        if (beyondHorizon) {
            problems.add("next review " + nextReviewDate);
            recomputeInterval = true;
        }

        if (recomputeInterval) {
            intervalDays = intervalForLevel(repetitions);
        }

        LocalDate lastReviewedDate = item.lastReviewedDate();
        if (lastReviewedDate == null || lastReviewedDate.isAfter(today)) {
            LocalDate inferred = nextReviewDate == null || recomputeInterval ? null : nextReviewDate.minusDays(intervalDays);
            LocalDate repairedLastReviewed = inferred != null && !inferred.isAfter(today) ? inferred : today;
            problems.add("last reviewed " + lastReviewedDate);
            lastReviewedDate = repairedLastReviewed;
        }

        LocalDate expectedNextReview = lastReviewedDate.plusDays(intervalDays);
        if (!expectedNextReview.equals(nextReviewDate)) {
            if (!beyondHorizon) {
                problems.add("next review " + nextReviewDate + " does not match interval");
            }
            nextReviewDate = expectedNextReview;
        }

        LocalDate firstSeenDate = item.firstSeenDate();
        if (firstSeenDate == null || firstSeenDate.isAfter(lastReviewedDate)) {
            problems.add("first seen " + firstSeenDate);
            firstSeenDate = lastReviewedDate;
        }

        if (problems.isEmpty()) {
            return item;
        }

        log.info("Repaired {} '{}': {}", item.kind(), item.id(), String.join(", ", problems));

        return item.toBuilder()
                .repetitions(repetitions)
                .lapses(lapses)
                .consecutiveCorrect(consecutiveCorrect)
                .successStreak(successStreak)
                .totalAttempts(totalAttempts)
                .exposureCount(exposureCount)
                .recentAccuracy(recentAccuracy)
                .easeFactor(easeFactor)
                .intervalDays(intervalDays)
                .firstSeenDate(firstSeenDate)
                .lastReviewedDate(lastReviewedDate)
                .nextReviewDate(nextReviewDate)
                .build();
    }

    // Deterministic interval for a level: the table value inside the table, dampened growth past it
    public int intervalForLevel(int repetitions) {
        List<Integer> intervalTable = settings.intervalTable();
        if (repetitions < intervalTable.size()) {
            return intervalTable.get(Math.max(0, repetitions));
        }

        int intervalDays = intervalTable.get(intervalTable.size() - 1);
        for (int level = intervalTable.size(); level <= repetitions && intervalDays < settings.maxIntervalDays(); level++) {
            int grown = growInterval(intervalDays, settings.growthEaseCap());
            if (grown == intervalDays) {
                break;
            }
            intervalDays = grown;
        }
        return intervalDays;
    }

    double calculateRecentAccuracy(int consecutiveCorrect, int totalAttempts) {
        int window = Math.min(totalAttempts, settings.accuracyWindow());
        if (window <= 0) {
            return 0;
        }
        return Math.min(1.0, (double) consecutiveCorrect / window);
    }

    private int growInterval(int previousInterval, double easeFactor) {
        double dampenedEase = Math.min(easeFactor, settings.growthEaseCap());
        double grown = Math.min(previousInterval * dampenedEase, previousInterval * settings.maxGrowthMultiplier());

        return clampInterval((int) Math.round(grown));
    }

    private int calculateQuality(double recentAccuracy) {
        return recentAccuracy >= settings.highQualityAccuracy() ? TOP_QUALITY : GOOD_QUALITY;
    }

    // SM-2 ease adjustment
    private double calculateEaseDelta(int quality) {
        int shortfall = TOP_QUALITY - quality;
        return 0.1 - shortfall * (0.08 + shortfall * 0.02);
    }

    private double clampEase(double easeFactor) {
        return Math.min(settings.maxEase(), Math.max(settings.minEase(), easeFactor));
    }

    private int clampInterval(int intervalDays) {
        return Math.min(settings.maxIntervalDays(), Math.max(1, intervalDays));
    }

    private int nonNegative(int value, String name, List<String> problems) {
        if (value < 0) {
            problems.add(name + " " + value);
            return 0;
        }
        return value;
    }
}
