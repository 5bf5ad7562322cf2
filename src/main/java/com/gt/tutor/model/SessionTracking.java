package com.gt.tutor.model;

import java.time.LocalDate;

/**
 * Session counters kept with the profile.
 *
 * @param sessionsSinceNewContent review-only sessions started since new content was last introduced,
 *                                or {@code null} if new content has never been introduced
 */
public record SessionTracking(int sessionsStarted,
                              Integer sessionsSinceNewContent,
                              LocalDate lastSessionDate,
                              int exercisesCompleted,
                              int correctExercises) {

    public static SessionTracking empty() {
        return new SessionTracking(0, null, null, 0, 0);
    }

    public SessionTracking withSessionStarted(LocalDate sessionDate, boolean introducedNewContent) {
        Integer sinceNewContent;
        if (introducedNewContent) {
            sinceNewContent = 0;
        } else if (sessionsSinceNewContent != null) {
            sinceNewContent = sessionsSinceNewContent + 1;
        } else {
            sinceNewContent = null;
        }

        return new SessionTracking(sessionsStarted + 1, sinceNewContent, sessionDate, exercisesCompleted, correctExercises);
    }

    public SessionTracking withExercises(int completed, int correct) {
        return new SessionTracking(sessionsStarted, sessionsSinceNewContent, lastSessionDate,
                exercisesCompleted + completed, correctExercises + correct);
    }
}
