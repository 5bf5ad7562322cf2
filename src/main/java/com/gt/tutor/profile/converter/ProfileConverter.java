package com.gt.tutor.profile.converter;

import com.gt.tutor.model.DifficultyProgress;
import com.gt.tutor.model.DifficultyTier;
import com.gt.tutor.model.ExerciseCategory;
import com.gt.tutor.model.ItemKind;
import com.gt.tutor.model.LearningItem;
import com.gt.tutor.model.LearningPreferences;
import com.gt.tutor.model.Profile;
import com.gt.tutor.model.RetainedProperties;
import com.gt.tutor.model.SessionTracking;
import com.gt.tutor.model.TierProgress;
import com.gt.tutor.profile.model.StoredDifficultyProgress;
import com.gt.tutor.profile.model.StoredLearningItem;
import com.gt.tutor.profile.model.StoredPreferences;
import com.gt.tutor.profile.model.StoredProfile;
import com.gt.tutor.profile.model.StoredSessionTracking;
import com.gt.tutor.profile.model.StoredTierProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the stored profile document to domain records and back. Reading is lenient: missing numbers take neutral
 * values (the repair pass fixes what is left out of range) and unparseable dates are dropped. Document properties
 * without a domain field travel through the profile as {@link RetainedProperties} and are written back unchanged.
 */
public class ProfileConverter {

    private static final Logger log = LoggerFactory.getLogger(ProfileConverter.class);

    public static final String DEFAULT_USER_ID = "user_001";
    public static final String DEFAULT_LEVEL = "beginner";
    public static final String DEFAULT_TARGET_LANGUAGE = "Korean";

    // ISO date, optionally followed by a time part
    private static final int ISO_DATE_LENGTH = 10;

    public static Profile convertStoredProfile(StoredProfile storedProfile, LearningPreferences defaultPreferences) {
        String level = firstNonBlank(storedProfile.level(), storedProfile.legacyUserLevel(), DEFAULT_LEVEL);

        return new Profile(
                firstNonBlank(storedProfile.userId(), DEFAULT_USER_ID),
                level,
                firstNonBlank(storedProfile.targetLanguage(), DEFAULT_TARGET_LANGUAGE),
                convertStoredPreferences(storedProfile.learningPreferences(), defaultPreferences),
                convertStoredSessionTracking(storedProfile.sessionTracking()),
                convertStoredSummary(storedProfile.grammarSummary(), ItemKind.Grammar),
                convertStoredSummary(storedProfile.vocabSummary(), ItemKind.Vocabulary),
                convertStoredDifficultySummary(storedProfile.grammarDifficultyProgress()),
                new RetainedProperties(
                        storedProfile.otherProperties(),
                        storedProfile.learningPreferences() == null ? null : storedProfile.learningPreferences().otherProperties(),
                        storedProfile.sessionTracking() == null ? null : storedProfile.sessionTracking().otherProperties()));
    }

    public static StoredProfile convertProfile(Profile profile) {
        RetainedProperties retainedProperties = profile.retainedProperties();

        return new StoredProfile(
                profile.userId(),
                profile.level(),
                null,
                profile.targetLanguage(),
                convertPreferences(profile.preferences(), retainedProperties.preferences()),
                convertSessionTracking(profile.tracking(), retainedProperties.tracking()),
                convertSummary(profile.grammarSummary()),
                convertSummary(profile.vocabSummary()),
                convertDifficultySummary(profile.difficultyProgress()),
                retainedProperties.profile());
    }

    public static LearningItem convertStoredLearningItem(String id, ItemKind kind, StoredLearningItem storedItem) {
        int exposureCount = firstNonNull(storedItem.exposureCount(), storedItem.legacyExposure(), 0);
        LocalDate lastReviewedDate = parseDate(firstNonBlank(storedItem.lastReviewedDate(), storedItem.legacyLastReviewed(), null), id);

        return LearningItem.builder()
                .id(id)
                .kind(kind)
                .easeFactor(storedItem.easeFactor() == null ? Double.NaN : storedItem.easeFactor())
                .intervalDays(firstNonNull(storedItem.intervalDays(), storedItem.legacyInterval(), 0))
                .repetitions(firstNonNull(storedItem.repetitions(), storedItem.legacyReps(),
                        firstNonNull(storedItem.legacySrsLevel(), null, 0)))
                .lapses(firstNonNull(storedItem.lapses(), null, 0))
                .consecutiveCorrect(firstNonNull(storedItem.consecutiveCorrect(), null, 0))
                .successStreak(firstNonNull(storedItem.successStreak(), null, 0))
                // documents written before attempts were tracked only counted exposures
                .totalAttempts(firstNonNull(storedItem.totalAttempts(), null, exposureCount))
                .recentAccuracy(storedItem.recentAccuracy() == null ? 0.0 : storedItem.recentAccuracy())
                .exposureCount(exposureCount)
                .firstSeenDate(parseDate(firstNonBlank(storedItem.firstSeenDate(), storedItem.legacyFirstSeen(), null), id))
                .lastReviewedDate(lastReviewedDate)
                .nextReviewDate(parseDate(storedItem.nextReviewDate(), id))
                .masteryDate(parseDate(storedItem.masteryDate(), id))
                .build();
    }

    public static StoredLearningItem convertLearningItem(LearningItem item) {
        return new StoredLearningItem(
                item.easeFactor(),
                item.intervalDays(),
                null,
                item.repetitions(),
                null,
                null,
                item.lapses(),
                item.consecutiveCorrect(),
                item.successStreak(),
                item.totalAttempts(),
                item.recentAccuracy(),
                item.kind() == ItemKind.Grammar ? item.exposureCount() : null,
                null,
                formatDate(item.firstSeenDate()),
                null,
                formatDate(item.lastReviewedDate()),
                null,
                formatDate(item.nextReviewDate()),
                formatDate(item.masteryDate()));
    }

    public static LearningPreferences convertStoredPreferences(StoredPreferences storedPreferences, LearningPreferences defaults) {
        if (storedPreferences == null) {
            return defaults;
        }

        List<ExerciseCategory> preferredExerciseTypes = new ArrayList<>();
        if (storedPreferences.preferredExerciseTypes() != null) {
            for (String exerciseTypeId : storedPreferences.preferredExerciseTypes()) {
                try {
                    preferredExerciseTypes.add(ExerciseCategory.fromId(exerciseTypeId));
                } catch (IllegalArgumentException ex) {
                    log.warn("Ignoring unknown preferred exercise type '{}'", exerciseTypeId);
                }
            }
        } else {
            preferredExerciseTypes.addAll(defaults.preferredExerciseTypes());
        }

        return new LearningPreferences(
                firstNonNull(storedPreferences.reviewsPerSession(), null, defaults.reviewsPerSession()),
                firstNonNull(storedPreferences.vocabReviewsPerSession(), null, defaults.vocabReviewsPerSession()),
                firstNonNull(storedPreferences.newGrammarPerSession(), null, defaults.newGrammarPerSession()),
                firstNonNull(storedPreferences.newVocabPerSession(), null, defaults.newVocabPerSession()),
                firstNonNull(storedPreferences.maxNewItemsPerSession(), null, defaults.maxNewItemsPerSession()),
                firstNonNull(storedPreferences.consolidationSessions(), null, defaults.consolidationSessions()),
                preferredExerciseTypes);
    }

    public static StoredPreferences convertPreferences(LearningPreferences preferences, Map<String, Object> otherProperties) {
        return new StoredPreferences(
                preferences.reviewsPerSession(),
                preferences.vocabReviewsPerSession(),
                preferences.newGrammarPerSession(),
                preferences.newVocabPerSession(),
                preferences.maxNewItemsPerSession(),
                preferences.consolidationSessions(),
                preferences.preferredExerciseTypes().stream().map(ExerciseCategory::getId).toList(),
                otherProperties);
    }

    public static SessionTracking convertStoredSessionTracking(StoredSessionTracking storedTracking) {
        if (storedTracking == null) {
            return SessionTracking.empty();
        }

        return new SessionTracking(
                Math.max(0, firstNonNull(storedTracking.sessionsStarted(), null, 0)),
                storedTracking.sessionsSinceNewContent() == null ? null : Math.max(0, storedTracking.sessionsSinceNewContent()),
                parseDate(storedTracking.lastSessionDate(), "session tracking"),
                Math.max(0, firstNonNull(storedTracking.exercisesCompleted(), null, 0)),
                Math.max(0, firstNonNull(storedTracking.correctExercises(), null, 0)));
    }

    public static StoredSessionTracking convertSessionTracking(SessionTracking tracking, Map<String, Object> otherProperties) {
        return new StoredSessionTracking(
                tracking.sessionsStarted(),
                tracking.sessionsSinceNewContent(),
                formatDate(tracking.lastSessionDate()),
                tracking.exercisesCompleted(),
                tracking.correctExercises(),
                otherProperties);
    }

    public static DifficultyProgress convertStoredDifficultyProgress(String grammarId, StoredDifficultyProgress storedProgress) {
        // tiers unlock in order, so the highest rank named anywhere is the current maximum
        int maxRank = firstNonNull(storedProgress.currentMaxDifficulty(), null, DifficultyTier.Recognition.getRank());
        if (storedProgress.unlockedDifficulties() != null) {
            for (Integer unlockedRank : storedProgress.unlockedDifficulties()) {
                if (unlockedRank != null) {
                    maxRank = Math.max(maxRank, unlockedRank);
                }
            }
        }
        DifficultyTier currentMaxTier = clampTier(maxRank);

        Map<DifficultyTier, TierProgress> tierProgress = new EnumMap<>(DifficultyTier.class);
        if (storedProgress.difficultyMastery() != null) {
            for (Map.Entry<String, StoredTierProgress> entry : storedProgress.difficultyMastery().entrySet()) {
                Optional<DifficultyTier> tier = parseTier(entry.getKey());
                if (tier.isEmpty() || entry.getValue() == null) {
                    log.warn("Ignoring difficulty entry '{}' on '{}'", entry.getKey(), grammarId);
                    continue;
                }
                tierProgress.put(tier.get(), convertStoredTierProgress(grammarId, entry.getValue()));
            }
        }

        return new DifficultyProgress(currentMaxTier, tierProgress);
    }

    public static StoredDifficultyProgress convertDifficultyProgress(DifficultyProgress progress) {
        Map<String, StoredTierProgress> difficultyMastery = new LinkedHashMap<>();
        for (Map.Entry<DifficultyTier, TierProgress> entry : progress.tierProgress().entrySet()) {
            difficultyMastery.put(String.valueOf(entry.getKey().getRank()), convertTierProgress(entry.getValue()));
        }

        return new StoredDifficultyProgress(
                progress.currentMaxTier().getRank(),
                progress.unlockedTiers().stream().map(DifficultyTier::getRank).toList(),
                difficultyMastery);
    }

    private static TierProgress convertStoredTierProgress(String grammarId, StoredTierProgress storedTierProgress) {
        int repetitions = Math.max(0, firstNonNull(storedTierProgress.repetitions(), null, 0));

        return new TierProgress(
                repetitions,
                Math.max(0, firstNonNull(storedTierProgress.lapses(), null, 0)),
                Math.max(0, firstNonNull(storedTierProgress.consecutiveCorrect(), null, 0)),
                Math.max(0, firstNonNull(storedTierProgress.totalAttempts(), null, 0)),
                storedTierProgress.recentAccuracy() == null
                        ? 0.0
                        : Math.min(1.0, Math.max(0.0, storedTierProgress.recentAccuracy())),
                Math.max(1, firstNonNull(storedTierProgress.intervalDays(), null, repetitions)),
                parseDate(storedTierProgress.firstSeenDate(), grammarId),
                parseDate(storedTierProgress.lastReviewedDate(), grammarId),
                parseDate(storedTierProgress.nextReviewDate(), grammarId),
                parseDate(storedTierProgress.masteryDate(), grammarId));
    }

    private static StoredTierProgress convertTierProgress(TierProgress tierProgress) {
        return new StoredTierProgress(
                tierProgress.repetitions(),
                tierProgress.lapses(),
                tierProgress.consecutiveCorrect(),
                tierProgress.totalAttempts(),
                tierProgress.recentAccuracy(),
                tierProgress.intervalDays(),
                formatDate(tierProgress.firstSeenDate()),
                formatDate(tierProgress.lastReviewedDate()),
                formatDate(tierProgress.nextReviewDate()),
                formatDate(tierProgress.masteryDate()));
    }

    private static Map<String, DifficultyProgress> convertStoredDifficultySummary(
            Map<String, StoredDifficultyProgress> storedDifficultyProgress) {
        Map<String, DifficultyProgress> difficultyProgress = new LinkedHashMap<>();
        if (storedDifficultyProgress == null) {
            return difficultyProgress;
        }

        for (Map.Entry<String, StoredDifficultyProgress> entry : storedDifficultyProgress.entrySet()) {
            if (entry.getValue() == null) {
                log.warn("Skipping empty difficulty progress '{}'", entry.getKey());
                continue;
            }
            difficultyProgress.put(entry.getKey(), convertStoredDifficultyProgress(entry.getKey(), entry.getValue()));
        }
        return difficultyProgress;
    }

    // Omitted from the document until some grammar item has been practiced at a tier
    private static Map<String, StoredDifficultyProgress> convertDifficultySummary(
            Map<String, DifficultyProgress> difficultyProgress) {
        if (difficultyProgress.isEmpty()) {
            return null;
        }

        Map<String, StoredDifficultyProgress> storedDifficultyProgress = new LinkedHashMap<>();
        for (Map.Entry<String, DifficultyProgress> entry : difficultyProgress.entrySet()) {
            storedDifficultyProgress.put(entry.getKey(), convertDifficultyProgress(entry.getValue()));
        }
        return storedDifficultyProgress;
    }

    private static DifficultyTier clampTier(int rank) {
        int clampedRank = Math.max(DifficultyTier.Recognition.getRank(), Math.min(DifficultyTier.FreeProduction.getRank(), rank));
        return DifficultyTier.fromRank(clampedRank).orElse(DifficultyTier.Recognition);
    }

    private static Optional<DifficultyTier> parseTier(String rank) {
        try {
            return DifficultyTier.fromRank(Integer.parseInt(rank.trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private static Map<String, LearningItem> convertStoredSummary(Map<String, StoredLearningItem> storedSummary, ItemKind kind) {
        Map<String, LearningItem> summary = new LinkedHashMap<>();
        if (storedSummary == null) {
            return summary;
        }

        for (Map.Entry<String, StoredLearningItem> entry : storedSummary.entrySet()) {
            if (entry.getValue() == null) {
                log.warn("Skipping empty {} entry '{}'", kind, entry.getKey());
                continue;
            }
            summary.put(entry.getKey(), convertStoredLearningItem(entry.getKey(), kind, entry.getValue()));
        }
        return summary;
    }

    private static Map<String, StoredLearningItem> convertSummary(Map<String, LearningItem> summary) {
        Map<String, StoredLearningItem> storedSummary = new LinkedHashMap<>();
        for (Map.Entry<String, LearningItem> entry : summary.entrySet()) {
            storedSummary.put(entry.getKey(), convertLearningItem(entry.getValue()));
        }
        return storedSummary;
    }

    static LocalDate parseDate(String value, String context) {
        if (value == null || value.isBlank()) {
            return null;
        }

        String trimmed = value.trim();
        String datePart = trimmed.length() > ISO_DATE_LENGTH ? trimmed.substring(0, ISO_DATE_LENGTH) : trimmed;
        try {
            return LocalDate.parse(datePart);
        } catch (DateTimeParseException ex) {
            log.warn("Ignoring unparseable date '{}' on {}", value, context);
            return null;
        }
    }

    private static String formatDate(LocalDate date) {
        return date == null ? null : date.toString();
    }

    private static int firstNonNull(Integer first, Integer second, int fallback) {
        if (first != null) {
            return first;
        }
        return second != null ? second : fallback;
    }

    private static String firstNonBlank(String first, String second, String fallback) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : fallback;
    }

    private static String firstNonBlank(String first, String fallback) {
        return firstNonBlank(first, null, fallback);
    }
}
