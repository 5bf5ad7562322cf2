package com.gt.tutor.profile.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

// ease_factor written by older documents is not used by tier progress and is dropped
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredTierProgress(@JsonProperty("reps") Integer repetitions,
                                 @JsonProperty("lapses") Integer lapses,
                                 @JsonProperty("consecutive_correct") Integer consecutiveCorrect,
                                 @JsonProperty("total_attempts") Integer totalAttempts,
                                 @JsonProperty("recent_accuracy") Double recentAccuracy,
                                 @JsonProperty("interval") Integer intervalDays,
                                 @JsonProperty("first_seen") String firstSeenDate,
                                 @JsonProperty("last_reviewed") String lastReviewedDate,
                                 @JsonProperty("next_review_date") String nextReviewDate,
                                 @JsonProperty("mastery_date") String masteryDate) { }
