package com.gt.tutor.profile.converter;

import com.gt.tutor.model.DifficultyProgress;
import com.gt.tutor.model.DifficultyTier;
import com.gt.tutor.model.ExerciseCategory;
import com.gt.tutor.model.ItemKind;
import com.gt.tutor.model.LearningItem;
import com.gt.tutor.model.LearningPreferences;
import com.gt.tutor.model.TierProgress;
import com.gt.tutor.profile.model.StoredDifficultyProgress;
import com.gt.tutor.profile.model.StoredLearningItem;
import com.gt.tutor.profile.model.StoredPreferences;
import com.gt.tutor.profile.model.StoredTierProgress;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.gt.tutor.util.TestUtils.TODAY;
import static com.gt.tutor.util.TestUtils.masteredGrammar;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProfileConverterTests {

    @Test
    public void testLegacyItemFields() {
        StoredLearningItem storedItem = new StoredLearningItem(2.2, null, 6, null, 3, 3, 1, null, null, null, null,
                null, 7, null, "2025-01-02", null, "2025-03-01T10:00:00", "2025-03-07", null);

        LearningItem item = ProfileConverter.convertStoredLearningItem("은_는", ItemKind.Grammar, storedItem);

        assertEquals(6, item.intervalDays());
        assertEquals(3, item.repetitions());
        assertEquals(7, item.exposureCount());
        assertEquals(7, item.totalAttempts());
        assertEquals(LocalDate.of(2025, 1, 2), item.firstSeenDate());
        assertEquals(LocalDate.of(2025, 3, 1), item.lastReviewedDate());
        assertEquals(LocalDate.of(2025, 3, 7), item.nextReviewDate());
        assertNull(item.masteryDate());
    }

    @Test
    public void testMissingEaseMarkedForRepair() {
        StoredLearningItem storedItem = new StoredLearningItem(null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null);

        LearningItem item = ProfileConverter.convertStoredLearningItem("물", ItemKind.Vocabulary, storedItem);

        assertTrue(Double.isNaN(item.easeFactor()));
        assertEquals(0, item.intervalDays());
        assertNull(item.nextReviewDate());
    }

    @Test
    public void testItemRoundTripKeepsState() {
        LearningItem item = masteredGrammar("은_는").toBuilder().masteryDate(TODAY).build();

        assertEquals(item, ProfileConverter.convertStoredLearningItem("은_는", ItemKind.Grammar,
                ProfileConverter.convertLearningItem(item)));
    }

    @Test
    public void testPreferencesFallBackToDefaults() {
        LearningPreferences defaults = new LearningPreferences(10, 10, 2, 5, 5, 1, List.of(ExerciseCategory.Translation));

        LearningPreferences preferences = ProfileConverter.convertStoredPreferences(
                new StoredPreferences(4, null, null, 3, null, 2, List.of("multiple_choice", "bogus")), defaults);

        assertEquals(4, preferences.reviewsPerSession());
        assertEquals(10, preferences.vocabReviewsPerSession());
        assertEquals(2, preferences.newGrammarPerSession());
        assertEquals(3, preferences.newVocabPerSession());
        assertEquals(5, preferences.maxNewItemsPerSession());
        assertEquals(2, preferences.consolidationSessions());
        assertEquals(List.of(ExerciseCategory.MultipleChoice), preferences.preferredExerciseTypes());

        assertEquals(defaults, ProfileConverter.convertStoredPreferences(null, defaults));
    }

    @Test
    public void testParseDate() {
        assertEquals(LocalDate.of(2025, 3, 12), ProfileConverter.parseDate("2025-03-12T09:30:00", "test"));
        assertEquals(LocalDate.of(2025, 3, 12), ProfileConverter.parseDate(" 2025-03-12 ", "test"));
        assertNull(ProfileConverter.parseDate("", "test"));
        assertNull(ProfileConverter.parseDate("next tuesday", "test"));
    }

    @Test
    public void testStoredDifficultyProgressClamped() {
        StoredDifficultyProgress storedProgress = new StoredDifficultyProgress(7, List.of(1, 2), Map.of(
                "1", new StoredTierProgress(4, null, 2, 3, 1.7, null, null, null, "2025-03-09", null),
                "x", new StoredTierProgress(1, 0, 1, 1, 1.0, 1, null, null, null, null)));

        DifficultyProgress progress = ProfileConverter.convertStoredDifficultyProgress("은_는", storedProgress);

        assertEquals(DifficultyTier.FreeProduction, progress.currentMaxTier());
        assertEquals(Set.of(DifficultyTier.Recognition), progress.tierProgress().keySet());
        TierProgress recognition = progress.tierProgress().get(DifficultyTier.Recognition);
        assertEquals(4, recognition.intervalDays());
        assertEquals(1.0, recognition.recentAccuracy());
        assertEquals(0, recognition.lapses());
        assertEquals(LocalDate.of(2025, 3, 9), recognition.nextReviewDate());
    }
}
