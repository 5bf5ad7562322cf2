package com.gt.tutor.conf;

import com.gt.tutor.difficulty.DifficultySettings;
import com.gt.tutor.mastery.MasteryThresholds;
import com.gt.tutor.model.ExerciseCategory;
import com.gt.tutor.model.LearningPreferences;
import com.gt.tutor.planner.PlannerSettings;
import com.gt.tutor.readiness.ReadinessSettings;
import com.gt.tutor.srs.SrsSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * Builds the scheduling tunables from {@code tutor.*} properties. Every property has a default, so an empty
 * configuration yields the stock behavior.
 */
@Configuration
public class LearningConfig {

    @Bean
    public SrsSettings getSrsSettings(@Value("${tutor.srs.minEase:" + SrsSettings.DEFAULT_MIN_EASE + "}") double minEase,
                                      @Value("${tutor.srs.maxEase:" + SrsSettings.DEFAULT_MAX_EASE + "}") double maxEase,
                                      @Value("${tutor.srs.initialEase:" + SrsSettings.DEFAULT_INITIAL_EASE + "}") double initialEase,
                                      @Value("${tutor.srs.maxIntervalDays:" + SrsSettings.DEFAULT_MAX_INTERVAL_DAYS + "}") int maxIntervalDays,
                                      @Value("${tutor.srs.intervalTable:" + SrsSettings.DEFAULT_INTERVAL_TABLE + "}") String intervalTable,
                                      @Value("${tutor.srs.failureResetSteps:" + SrsSettings.DEFAULT_FAILURE_RESET_STEPS + "}") int failureResetSteps,
                                      @Value("${tutor.srs.baseLapsePenalty:" + SrsSettings.DEFAULT_BASE_LAPSE_PENALTY + "}") double baseLapsePenalty,
                                      @Value("${tutor.srs.escalatedLapsePenalty:" + SrsSettings.DEFAULT_ESCALATED_LAPSE_PENALTY + "}") double escalatedLapsePenalty,
                                      @Value("${tutor.srs.lapseEscalationAfter:" + SrsSettings.DEFAULT_LAPSE_ESCALATION_AFTER + "}") int lapseEscalationAfter,
                                      @Value("${tutor.srs.accuracyWindow:" + SrsSettings.DEFAULT_ACCURACY_WINDOW + "}") int accuracyWindow,
                                      @Value("${tutor.srs.lowLevelCeiling:" + SrsSettings.DEFAULT_LOW_LEVEL_CEILING + "}") int lowLevelCeiling,
                                      @Value("${tutor.srs.lowLevelStreak:" + SrsSettings.DEFAULT_LOW_LEVEL_STREAK + "}") int lowLevelStreak,
                                      @Value("${tutor.srs.midLevelCeiling:" + SrsSettings.DEFAULT_MID_LEVEL_CEILING + "}") int midLevelCeiling,
                                      @Value("${tutor.srs.midLevelStreak:" + SrsSettings.DEFAULT_MID_LEVEL_STREAK + "}") int midLevelStreak,
                                      @Value("${tutor.srs.baselineStreak:" + SrsSettings.DEFAULT_BASELINE_STREAK + "}") int baselineStreak,
                                      @Value("${tutor.srs.growthEaseCap:" + SrsSettings.DEFAULT_GROWTH_EASE_CAP + "}") double growthEaseCap,
                                      @Value("${tutor.srs.maxGrowthMultiplier:" + SrsSettings.DEFAULT_MAX_GROWTH_MULTIPLIER + "}") double maxGrowthMultiplier,
                                      @Value("${tutor.srs.highQualityAccuracy:" + SrsSettings.DEFAULT_HIGH_QUALITY_ACCURACY + "}") double highQualityAccuracy,
                                      @Value("${tutor.srs.repairHorizonDays:" + SrsSettings.DEFAULT_REPAIR_HORIZON_DAYS + "}") int repairHorizonDays) {
        return new SrsSettings(minEase, maxEase, initialEase, maxIntervalDays, SrsSettings.parseIntervalTable(intervalTable),
                failureResetSteps, baseLapsePenalty, escalatedLapsePenalty, lapseEscalationAfter, accuracyWindow,
                lowLevelCeiling, lowLevelStreak, midLevelCeiling, midLevelStreak, baselineStreak, growthEaseCap,
                maxGrowthMultiplier, highQualityAccuracy, repairHorizonDays);
    }

    @Bean
    public MasteryThresholds getMasteryThresholds(
            @Value("${tutor.mastery.learningMinRepetitions:" + MasteryThresholds.DEFAULT_LEARNING_MIN_REPETITIONS + "}") int learningMinRepetitions,
            @Value("${tutor.mastery.learningMinStreak:" + MasteryThresholds.DEFAULT_LEARNING_MIN_STREAK + "}") int learningMinStreak,
            @Value("${tutor.mastery.learningMinAttempts:" + MasteryThresholds.DEFAULT_LEARNING_MIN_ATTEMPTS + "}") int learningMinAttempts,
            @Value("${tutor.mastery.masteryMinAccuracy:" + MasteryThresholds.DEFAULT_MASTERY_MIN_ACCURACY + "}") double masteryMinAccuracy,
            @Value("${tutor.mastery.masteryMinStreak:" + MasteryThresholds.DEFAULT_MASTERY_MIN_STREAK + "}") int masteryMinStreak,
            @Value("${tutor.mastery.strugglingAccuracy:" + MasteryThresholds.DEFAULT_STRUGGLING_ACCURACY + "}") double strugglingAccuracy,
            @Value("${tutor.mastery.strugglingMinAttempts:" + MasteryThresholds.DEFAULT_STRUGGLING_MIN_ATTEMPTS + "}") int strugglingMinAttempts) {
        return new MasteryThresholds(learningMinRepetitions, learningMinStreak, learningMinAttempts, masteryMinAccuracy,
                masteryMinStreak, strugglingAccuracy, strugglingMinAttempts);
    }

    @Bean
    public ReadinessSettings getReadinessSettings(
            @Value("${tutor.readiness.singleItemMinExposures:" + ReadinessSettings.DEFAULT_SINGLE_ITEM_MIN_EXPOSURES + "}") int singleItemMinExposures,
            @Value("${tutor.readiness.singleItemMinStreak:" + ReadinessSettings.DEFAULT_SINGLE_ITEM_MIN_STREAK + "}") int singleItemMinStreak,
            @Value("${tutor.readiness.singleItemMinAccuracy:" + ReadinessSettings.DEFAULT_SINGLE_ITEM_MIN_ACCURACY + "}") double singleItemMinAccuracy,
            @Value("${tutor.readiness.singleItemMinAttempts:" + ReadinessSettings.DEFAULT_SINGLE_ITEM_MIN_ATTEMPTS + "}") int singleItemMinAttempts,
            @Value("${tutor.readiness.singleItemMinRepetitions:" + ReadinessSettings.DEFAULT_SINGLE_ITEM_MIN_REPETITIONS + "}") int singleItemMinRepetitions,
            @Value("${tutor.readiness.smallSetMaxSize:" + ReadinessSettings.DEFAULT_SMALL_SET_MAX_SIZE + "}") int smallSetMaxSize,
            @Value("${tutor.readiness.smallSetMasteredShare:" + ReadinessSettings.DEFAULT_SMALL_SET_MASTERED_SHARE + "}") double smallSetMasteredShare,
            @Value("${tutor.readiness.largeSetStrugglingDivisor:" + ReadinessSettings.DEFAULT_LARGE_SET_STRUGGLING_DIVISOR + "}") int largeSetStrugglingDivisor,
            @Value("${tutor.readiness.largeSetUnmasteredDivisor:" + ReadinessSettings.DEFAULT_LARGE_SET_UNMASTERED_DIVISOR + "}") int largeSetUnmasteredDivisor) {
        return new ReadinessSettings(singleItemMinExposures, singleItemMinStreak, singleItemMinAccuracy, singleItemMinAttempts,
                singleItemMinRepetitions, smallSetMaxSize, smallSetMasteredShare, largeSetStrugglingDivisor,
                largeSetUnmasteredDivisor);
    }

    @Bean
    public DifficultySettings getDifficultySettings(
            @Value("${tutor.difficulty.minRepetitions:" + DifficultySettings.DEFAULT_MIN_REPETITIONS + "}") int minRepetitions,
            @Value("${tutor.difficulty.minAccuracy:" + DifficultySettings.DEFAULT_MIN_ACCURACY + "}") double minAccuracy,
            @Value("${tutor.difficulty.minStreak:" + DifficultySettings.DEFAULT_MIN_STREAK + "}") int minStreak,
            @Value("${tutor.difficulty.minAttempts:" + DifficultySettings.DEFAULT_MIN_ATTEMPTS + "}") int minAttempts,
            @Value("${tutor.difficulty.accuracyWindow:" + DifficultySettings.DEFAULT_ACCURACY_WINDOW + "}") int accuracyWindow,
            @Value("${tutor.difficulty.unlockDelayDays:" + DifficultySettings.DEFAULT_UNLOCK_DELAY_DAYS + "}") int unlockDelayDays) {
        return new DifficultySettings(minRepetitions, minAccuracy, minStreak, minAttempts, accuracyWindow, unlockDelayDays);
    }

    @Bean
    public PlannerSettings getPlannerSettings(
            @Value("${tutor.planner.urgentMaxRepetitions:" + PlannerSettings.DEFAULT_URGENT_MAX_REPETITIONS + "}") int urgentMaxRepetitions) {
        return new PlannerSettings(urgentMaxRepetitions);
    }

    @Bean
    public LearningPreferences getDefaultLearningPreferences(
            @Value("${tutor.session.reviewsPerSession:" + LearningPreferences.DEFAULT_REVIEWS_PER_SESSION + "}") int reviewsPerSession,
            @Value("${tutor.session.vocabReviewsPerSession:" + LearningPreferences.DEFAULT_VOCAB_REVIEWS_PER_SESSION + "}") int vocabReviewsPerSession,
            @Value("${tutor.session.newGrammarPerSession:" + LearningPreferences.DEFAULT_NEW_GRAMMAR_PER_SESSION + "}") int newGrammarPerSession,
            @Value("${tutor.session.newVocabPerSession:" + LearningPreferences.DEFAULT_NEW_VOCAB_PER_SESSION + "}") int newVocabPerSession,
            @Value("${tutor.session.maxNewItemsPerSession:" + LearningPreferences.DEFAULT_MAX_NEW_ITEMS_PER_SESSION + "}") int maxNewItemsPerSession,
            @Value("${tutor.session.consolidationSessions:" + LearningPreferences.DEFAULT_CONSOLIDATION_SESSIONS + "}") int consolidationSessions,
            @Value("${tutor.session.preferredExerciseTypes:}") String preferredExerciseTypes) {
        return new LearningPreferences(reviewsPerSession, vocabReviewsPerSession, newGrammarPerSession, newVocabPerSession,
                maxNewItemsPerSession, consolidationSessions, parseExerciseCategories(preferredExerciseTypes));
    }

    // Unknown ids fail startup
    static List<ExerciseCategory> parseExerciseCategories(String exerciseCategoryIds) {
        if (exerciseCategoryIds == null || exerciseCategoryIds.isBlank()) {
            return List.of();
        }

        return Arrays.stream(exerciseCategoryIds.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .map(ExerciseCategory::fromId)
                .toList();
    }
}
