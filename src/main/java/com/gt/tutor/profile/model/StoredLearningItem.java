package com.gt.tutor.profile.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One item as written to the profile document. Wrapper types mark values missing from older documents; the
 * {@code reps}, {@code interval}, {@code exposure}, {@code first_seen}, {@code last_reviewed} and {@code srs_level}
 * properties are only read, never written.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredLearningItem(@JsonProperty("ease_factor") Double easeFactor,
                                 @JsonProperty("interval_days") Integer intervalDays,
                                 @JsonProperty("interval") Integer legacyInterval,
                                 @JsonProperty("repetitions") Integer repetitions,
                                 @JsonProperty("reps") Integer legacyReps,
                                 @JsonProperty("srs_level") Integer legacySrsLevel,
                                 @JsonProperty("lapses") Integer lapses,
                                 @JsonProperty("consecutive_correct") Integer consecutiveCorrect,
                                 @JsonProperty("success_streak") Integer successStreak,
                                 @JsonProperty("total_attempts") Integer totalAttempts,
                                 @JsonProperty("recent_accuracy") Double recentAccuracy,
                                 @JsonProperty("exposure_count") Integer exposureCount,
                                 @JsonProperty("exposure") Integer legacyExposure,
                                 @JsonProperty("first_seen_date") String firstSeenDate,
                                 @JsonProperty("first_seen") String legacyFirstSeen,
                                 @JsonProperty("last_reviewed_date") String lastReviewedDate,
                                 @JsonProperty("last_reviewed") String legacyLastReviewed,
                                 @JsonProperty("next_review_date") String nextReviewDate,
                                 @JsonProperty("mastery_date") String masteryDate) { }
