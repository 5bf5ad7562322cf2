package com.gt.tutor.model;

import java.time.LocalDate;

/**
 * Scheduling state of a single grammar pattern or vocabulary entry.
 * <p>
 * Instances are immutable; every update produces a new instance through {@link #toBuilder()}.
 */
public record LearningItem(String id,
                           ItemKind kind,
                           double easeFactor,
                           int intervalDays,
                           int repetitions,
                           int lapses,
                           int consecutiveCorrect,
                           int successStreak,
                           int totalAttempts,
                           double recentAccuracy,
                           int exposureCount,
                           LocalDate firstSeenDate,
                           LocalDate lastReviewedDate,
                           LocalDate nextReviewDate,
                           LocalDate masteryDate) {

    public int srsLevel() {
        return repetitions;
    }

    public boolean isDue(LocalDate today) {
        return nextReviewDate == null || !nextReviewDate.isAfter(today);
    }

    public boolean isOverdue(LocalDate today) {
        return nextReviewDate == null || nextReviewDate.isBefore(today);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .kind(kind)
                .easeFactor(easeFactor)
                .intervalDays(intervalDays)
                .repetitions(repetitions)
                .lapses(lapses)
                .consecutiveCorrect(consecutiveCorrect)
                .successStreak(successStreak)
                .totalAttempts(totalAttempts)
                .recentAccuracy(recentAccuracy)
                .exposureCount(exposureCount)
                .firstSeenDate(firstSeenDate)
                .lastReviewedDate(lastReviewedDate)
                .nextReviewDate(nextReviewDate)
                .masteryDate(masteryDate);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private ItemKind kind;
        private double easeFactor;
        private int intervalDays;
        private int repetitions;
        private int lapses;
        private int consecutiveCorrect;
        private int successStreak;
        private int totalAttempts;
        private double recentAccuracy;
        private int exposureCount;
        private LocalDate firstSeenDate;
        private LocalDate lastReviewedDate;
        private LocalDate nextReviewDate;
        private LocalDate masteryDate;

        private Builder() { }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(ItemKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder easeFactor(double easeFactor) {
            this.easeFactor = easeFactor;
            return this;
        }

        public Builder intervalDays(int intervalDays) {
            this.intervalDays = intervalDays;
            return this;
        }

        public Builder repetitions(int repetitions) {
            this.repetitions = repetitions;
            return this;
        }

        public Builder lapses(int lapses) {
            this.lapses = lapses;
            return this;
        }

        public Builder consecutiveCorrect(int consecutiveCorrect) {
            this.consecutiveCorrect = consecutiveCorrect;
            return this;
        }

        public Builder successStreak(int successStreak) {
            this.successStreak = successStreak;
            return this;
        }

        public Builder totalAttempts(int totalAttempts) {
            this.totalAttempts = totalAttempts;
            return this;
        }

        public Builder recentAccuracy(double recentAccuracy) {
            this.recentAccuracy = recentAccuracy;
            return this;
        }

        public Builder exposureCount(int exposureCount) {
            this.exposureCount = exposureCount;
            return this;
        }

        public Builder firstSeenDate(LocalDate firstSeenDate) {
            this.firstSeenDate = firstSeenDate;
            return this;
        }

        public Builder lastReviewedDate(LocalDate lastReviewedDate) {
            this.lastReviewedDate = lastReviewedDate;
            return this;
        }

        public Builder nextReviewDate(LocalDate nextReviewDate) {
            this.nextReviewDate = nextReviewDate;
            return this;
        }

        public Builder masteryDate(LocalDate masteryDate) {
            this.masteryDate = masteryDate;
            return this;
        }

        public LearningItem build() {
            return new LearningItem(id, kind, easeFactor, intervalDays, repetitions, lapses, consecutiveCorrect,
                    successStreak, totalAttempts, recentAccuracy, exposureCount, firstSeenDate, lastReviewedDate,
                    nextReviewDate, masteryDate);
        }
    }
}
