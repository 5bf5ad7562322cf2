package com.gt.tutor.srs;

import com.gt.tutor.model.ItemKind;
import com.gt.tutor.model.LearningItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Random;

import static com.gt.tutor.util.TestUtils.TODAY;
import static com.gt.tutor.util.TestUtils.grammarItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SrsUpdateEngineTests {

    private static final double DELTA = 1e-9;

    private SrsUpdateEngine srsUpdateEngine;

    @BeforeEach
    public void setup() {
        srsUpdateEngine = new SrsUpdateEngine(SrsSettings.defaults());
    }

    @Test
    public void testNewItem() {
        LearningItem item = srsUpdateEngine.newItem("은_는", ItemKind.Grammar, TODAY);

        assertEquals("은_는", item.id());
        assertEquals(2.5, item.easeFactor(), DELTA);
        assertEquals(1, item.intervalDays());
        assertEquals(0, item.repetitions());
        assertEquals(TODAY, item.firstSeenDate());
        assertEquals(TODAY.plusDays(1), item.nextReviewDate());
    }

    @Test
    public void testStreakGatedAdvancementThenFailure() {
        LearningItem item = grammarItem("은_는").repetitions(0).easeFactor(2.5).intervalDays(1).build();

        for (int i = 1; i <= 3; i++) {
            item = srsUpdateEngine.applyOutcome(item, true, TODAY);
            assertEquals(0, item.repetitions());
            assertEquals(1, item.intervalDays());
            assertEquals(i, item.successStreak());
        }

        item = srsUpdateEngine.applyOutcome(item, true, TODAY);
        assertEquals(1, item.repetitions());
        assertEquals(2, item.intervalDays());
        assertEquals(0, item.successStreak());
        assertEquals(4, item.consecutiveCorrect());
        assertEquals(2.6, item.easeFactor(), DELTA);
        assertEquals(TODAY.plusDays(2), item.nextReviewDate());

        item = srsUpdateEngine.applyOutcome(item, false, TODAY);
        assertEquals(0, item.repetitions());
        assertEquals(1, item.intervalDays());
        assertEquals(1, item.lapses());
        assertEquals(0, item.consecutiveCorrect());
        assertEquals(0, item.successStreak());
        assertEquals(5, item.totalAttempts());
        assertEquals(0.0, item.recentAccuracy(), DELTA);
        assertEquals(2.4, item.easeFactor(), DELTA);
        assertEquals(TODAY.plusDays(1), item.nextReviewDate());
        assertEquals(TODAY, item.lastReviewedDate());
    }

    @Test
    public void testFailureResetsTwoLevels() {
        LearningItem item = grammarItem("이_가").repetitions(4).intervalDays(12).build();

        LearningItem updated = srsUpdateEngine.applyOutcome(item, false, TODAY);

        assertEquals(2, updated.repetitions());
        assertEquals(4, updated.intervalDays());
    }

    @Test
    public void testLapsePenaltyEscalates() {
        LearningItem item = grammarItem("을_를").easeFactor(2.0).lapses(2).build();

        LearningItem updated = srsUpdateEngine.applyOutcome(item, false, TODAY);

        assertEquals(3, updated.lapses());
        assertEquals(1.7, updated.easeFactor(), DELTA);
    }

    @Test
    public void testEaseFloor() {
        LearningItem item = grammarItem("을_를").easeFactor(1.35).lapses(5).build();

        LearningItem updated = srsUpdateEngine.applyOutcome(item, false, TODAY);

        assertEquals(1.3, updated.easeFactor(), DELTA);
    }

    @Test
    public void testGrowthPastTableIsDampened() {
        LearningItem item = grammarItem("에서").repetitions(5).intervalDays(12).easeFactor(2.8).successStreak(1).build();

        LearningItem updated = srsUpdateEngine.applyOutcome(item, true, TODAY);

        assertEquals(6, updated.repetitions());
        assertEquals(18, updated.intervalDays());
        assertEquals(TODAY.plusDays(18), updated.nextReviewDate());
    }

    @Test
    public void testInsufficientStreakKeepsLevel() {
        LearningItem item = grammarItem("에").repetitions(3).intervalDays(7).successStreak(1).build();

        LearningItem updated = srsUpdateEngine.applyOutcome(item, true, TODAY);

        assertEquals(3, updated.repetitions());
        assertEquals(7, updated.intervalDays());
        assertEquals(2, updated.successStreak());
        assertEquals(TODAY.plusDays(7), updated.nextReviewDate());
    }

    @Test
    public void testRecentAccuracy() {
        assertEquals(0.0, srsUpdateEngine.calculateRecentAccuracy(0, 0), DELTA);
        assertEquals(1.0, srsUpdateEngine.calculateRecentAccuracy(3, 3), DELTA);
        assertEquals(0.5, srsUpdateEngine.calculateRecentAccuracy(4, 20), DELTA);
        assertEquals(1.0, srsUpdateEngine.calculateRecentAccuracy(12, 20), DELTA);
    }

    @Test
    public void testBoundsHoldForAnyOutcomeSequence() {
        SrsSettings settings = srsUpdateEngine.getSettings();
        Random random = new Random(42);

        for (int run = 0; run < 20; run++) {
            LearningItem item = srsUpdateEngine.newItem("item" + run, ItemKind.Vocabulary, TODAY);
            LocalDate day = TODAY;
            double correctRate = random.nextDouble();

            for (int step = 0; step < 300; step++) {
                int previousRepetitions = item.repetitions();
                boolean correct = random.nextDouble() < correctRate;

                item = srsUpdateEngine.applyOutcome(item, correct, day);

                assertTrue(item.easeFactor() >= settings.minEase() && item.easeFactor() <= settings.maxEase());
                assertTrue(item.intervalDays() >= 1 && item.intervalDays() <= settings.maxIntervalDays());
                assertTrue(item.recentAccuracy() >= 0 && item.recentAccuracy() <= 1);
                assertEquals(item.lastReviewedDate().plusDays(item.intervalDays()), item.nextReviewDate());
                if (!correct) {
                    assertTrue(item.repetitions() <= previousRepetitions);
                } else {
                    assertTrue(item.repetitions() - previousRepetitions <= 1);
                }

                day = item.nextReviewDate();
            }
        }
    }

    @Test
    public void testIntervalForLevel() {
        assertEquals(1, srsUpdateEngine.intervalForLevel(0));
        assertEquals(12, srsUpdateEngine.intervalForLevel(4));
        assertEquals(18, srsUpdateEngine.intervalForLevel(5));
        assertEquals(41, srsUpdateEngine.intervalForLevel(7));
        assertEquals(90, srsUpdateEngine.intervalForLevel(50));
    }

    @Test
    public void testRepairLeavesHealthyItemAlone() {
        LearningItem item = grammarItem("은_는").build();

        assertSame(item, srsUpdateEngine.repair(item, TODAY));
    }

    @Test
    public void testRepairRecomputesCorruptInterval() {
        LearningItem item = grammarItem("은_는")
                .repetitions(3)
                .easeFactor(3.5)
                .intervalDays(400)
                .lastReviewedDate(TODAY.minusDays(1))
                .nextReviewDate(TODAY.plusDays(399))
                .build();

        LearningItem repaired = srsUpdateEngine.repair(item, TODAY);

        assertEquals(2.8, repaired.easeFactor(), DELTA);
        assertEquals(7, repaired.intervalDays());
        assertEquals(TODAY.minusDays(1), repaired.lastReviewedDate());
        assertEquals(TODAY.plusDays(6), repaired.nextReviewDate());
        assertEquals(3, repaired.repetitions());
    }

    @Test
    public void testRepairFarFutureReviewDate() {
        LearningItem item = grammarItem("이_가")
                .repetitions(1)
                .intervalDays(2)
                .lastReviewedDate(TODAY.minusDays(1))
                .nextReviewDate(TODAY.plusYears(2))
                .build();

        LearningItem repaired = srsUpdateEngine.repair(item, TODAY);

        assertEquals(2, repaired.intervalDays());
        assertEquals(TODAY.plusDays(1), repaired.nextReviewDate());
    }

    @Test
    public void testRepairFillsMissingValues() {
        LearningItem item = grammarItem("을_를")
                .easeFactor(Double.NaN)
                .intervalDays(0)
                .repetitions(-2)
                .recentAccuracy(1.7)
                .firstSeenDate(null)
                .lastReviewedDate(null)
                .nextReviewDate(null)
                .build();

        LearningItem repaired = srsUpdateEngine.repair(item, TODAY);

        assertEquals(2.5, repaired.easeFactor(), DELTA);
        assertEquals(0, repaired.repetitions());
        assertEquals(1, repaired.intervalDays());
        assertEquals(1.0, repaired.recentAccuracy(), DELTA);
        assertEquals(TODAY, repaired.lastReviewedDate());
        assertEquals(TODAY, repaired.firstSeenDate());
        assertEquals(TODAY.plusDays(1), repaired.nextReviewDate());
    }

    @Test
    public void testRepairInfersLastReviewedFromNextReview() {
        LearningItem item = grammarItem("에")
                .repetitions(2)
                .intervalDays(4)
                .firstSeenDate(TODAY.minusDays(10))
                .lastReviewedDate(null)
                .nextReviewDate(TODAY.plusDays(1))
                .build();

        LearningItem repaired = srsUpdateEngine.repair(item, TODAY);

        assertEquals(TODAY.minusDays(3), repaired.lastReviewedDate());
        assertEquals(TODAY.plusDays(1), repaired.nextReviewDate());
        assertEquals(4, repaired.intervalDays());
    }

    @Test
    public void testRepairRaisesAttemptsToStreak() {
        LearningItem item = grammarItem("은_는")
                .exposureCount(10)
                .repetitions(5)
                .consecutiveCorrect(5)
                .recentAccuracy(1.0)
                .build();

        LearningItem repaired = srsUpdateEngine.repair(item, TODAY);

        assertEquals(5, repaired.totalAttempts());
        assertEquals(item.nextReviewDate(), repaired.nextReviewDate());
    }
}
