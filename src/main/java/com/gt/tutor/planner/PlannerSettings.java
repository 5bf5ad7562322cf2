package com.gt.tutor.planner;

/**
 * @param urgentMaxRepetitions overdue items below this srs level are urgent
 */
public record PlannerSettings(int urgentMaxRepetitions) {

    public static final int DEFAULT_URGENT_MAX_REPETITIONS = 2;

    public static PlannerSettings defaults() {
        return new PlannerSettings(DEFAULT_URGENT_MAX_REPETITIONS);
    }
}
