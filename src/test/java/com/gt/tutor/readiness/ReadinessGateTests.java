package com.gt.tutor.readiness;

import com.gt.tutor.mastery.MasteryClassifier;
import com.gt.tutor.mastery.MasteryThresholds;
import com.gt.tutor.model.LearningItem;
import com.gt.tutor.model.LearningPreferences;
import com.gt.tutor.model.Profile;
import com.gt.tutor.model.ReadinessDecision;
import com.gt.tutor.model.SessionTracking;
import com.gt.tutor.planner.PlannerSettings;
import com.gt.tutor.planner.PriorityTierClassifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.gt.tutor.util.TestUtils.TODAY;
import static com.gt.tutor.util.TestUtils.grammarItem;
import static com.gt.tutor.util.TestUtils.masteredGrammar;
import static com.gt.tutor.util.TestUtils.profileWithGrammar;
import static com.gt.tutor.util.TestUtils.strugglingGrammar;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ReadinessGateTests {

    private final MasteryClassifier masteryClassifier = new MasteryClassifier(MasteryThresholds.defaults());
    private final ReadinessGate readinessGate = new ReadinessGate(masteryClassifier,
            new PriorityTierClassifier(masteryClassifier, PlannerSettings.defaults()), ReadinessSettings.defaults());

    @Test
    public void testNoKnownItemsAllowed() {
        assertTrue(readinessGate.isNewContentAllowed(profileWithGrammar(), TODAY));
    }

    @Test
    public void testUnexposedItemsAreNotKnown() {
        Profile profile = profileWithGrammar(grammarItem("seen_in_curriculum_only").build());

        assertTrue(readinessGate.isNewContentAllowed(profile, TODAY));
    }

    @Test
    public void testSingleSolidItemAllowed() {
        LearningItem item = singleItem(10);

        assertTrue(readinessGate.isNewContentAllowed(profileWithGrammar(item), TODAY));
    }

    @Test
    public void testSingleItemWithoutRecordedAttemptsAllowed() {
        LearningItem item = grammarItem("은_는")
                .exposureCount(10)
                .repetitions(5)
                .consecutiveCorrect(5)
                .recentAccuracy(1.0)
                .intervalDays(18)
                .lastReviewedDate(TODAY.minusDays(1))
                .nextReviewDate(TODAY.plusDays(17))
                .build();

        assertTrue(readinessGate.isNewContentAllowed(profileWithGrammar(item), TODAY));
        assertFalse(readinessGate.isNewContentAllowed(profileWithGrammar(item.toBuilder().exposureCount(2).build()), TODAY));
    }

    @Test
    public void testSingleUnderexposedItemBlocked() {
        LearningItem item = singleItem(2);

        assertFalse(readinessGate.isNewContentAllowed(profileWithGrammar(item), TODAY));
    }

    @Test
    public void testSingleItemNeedsRepetitions() {
        LearningItem item = singleItem(10).toBuilder().repetitions(2).build();

        assertFalse(readinessGate.isNewContentAllowed(profileWithGrammar(item), TODAY));
    }

    @Test
    public void testSmallSetNeedsThreeQuartersMastered() {
        LearningItem reviewing = grammarItem("reviewing").exposureCount(8).totalAttempts(8).repetitions(3)
                .consecutiveCorrect(2).recentAccuracy(0.75).nextReviewDate(TODAY.plusDays(3)).lastReviewedDate(TODAY.minusDays(4))
                .intervalDays(7).build();

        assertTrue(readinessGate.isNewContentAllowed(profileWithGrammar(
                masteredGrammar("a"), masteredGrammar("b"), masteredGrammar("c"), reviewing), TODAY));
        assertFalse(readinessGate.isNewContentAllowed(profileWithGrammar(
                masteredGrammar("a"), masteredGrammar("b"), reviewing), TODAY));
    }

    @Test
    public void testSmallSetBlockedByAnyStrugglingItem() {
        ReadinessDecision decision = readinessGate.checkMastery(List.of(masteredGrammar("a"), masteredGrammar("b"),
                masteredGrammar("c"), strugglingGrammar("weak", TODAY.plusDays(2))));

        assertFalse(decision.allowed());
        assertTrue(decision.reason().contains("struggling"));
    }

    @Test
    public void testLargeSetProportionalLimits() {
        LearningItem weak = strugglingGrammar("weak", TODAY.plusDays(2));
        LearningItem learning = grammarItem("learning").exposureCount(3).totalAttempts(3).repetitions(1)
                .consecutiveCorrect(3).recentAccuracy(1.0).intervalDays(2).nextReviewDate(TODAY.plusDays(1))
                .lastReviewedDate(TODAY.minusDays(1)).build();

        // 6 known, 1 struggling (<= 1.5), 2 unmastered (<= 2)
        assertTrue(readinessGate.checkMastery(List.of(masteredGrammar("a"), masteredGrammar("b"),
                masteredGrammar("c"), masteredGrammar("d"), weak, learning)).allowed());

        // 5 known, 2 unmastered (> 1.67)
        assertFalse(readinessGate.checkMastery(List.of(masteredGrammar("a"), masteredGrammar("b"),
                masteredGrammar("c"), weak, learning)).allowed());

        // 8 known, 3 struggling (> 2)
        assertFalse(readinessGate.checkMastery(List.of(masteredGrammar("a"), masteredGrammar("b"),
                masteredGrammar("c"), masteredGrammar("d"), masteredGrammar("e"), strugglingGrammar("w1", TODAY.plusDays(2)),
                strugglingGrammar("w2", TODAY.plusDays(2)), strugglingGrammar("w3", TODAY.plusDays(2)))).allowed());

        // 7 known, all mastered but one learning
        assertTrue(readinessGate.isNewContentAllowed(profileWithGrammar(masteredGrammar("a"), masteredGrammar("b"),
                masteredGrammar("c"), masteredGrammar("d"), masteredGrammar("e"), masteredGrammar("f"), learning), TODAY));
    }

    @Test
    public void testUrgentItemBlocks() {
        Profile profile = profileWithGrammar(masteredGrammar("a"), masteredGrammar("b"), masteredGrammar("c"),
                masteredGrammar("d"), masteredGrammar("e"), masteredGrammar("f"), strugglingGrammar("due", TODAY));

        ReadinessDecision decision = readinessGate.evaluate(profile, TODAY);

        assertFalse(decision.allowed());
        assertTrue(decision.reason().contains("urgent"));
    }

    @Test
    public void testStrugglingItemBlocksBeforeItIsDue() {
        Profile profile = profileWithGrammar(masteredGrammar("a"), masteredGrammar("b"), masteredGrammar("c"),
                masteredGrammar("d"), masteredGrammar("e"), masteredGrammar("f"), strugglingGrammar("weak", TODAY.plusDays(1)));

        ReadinessDecision decision = readinessGate.evaluate(profile, TODAY);

        assertFalse(decision.allowed());
        assertTrue(decision.reason().contains("urgent"));
    }

    @Test
    public void testOverdueLowLevelItemBlocks() {
        LearningItem overdue = grammarItem("overdue").exposureCount(1).totalAttempts(1).consecutiveCorrect(1)
                .recentAccuracy(1.0).lastReviewedDate(TODAY.minusDays(4)).nextReviewDate(TODAY.minusDays(3)).build();
        Profile profile = profileWithGrammar(masteredGrammar("a"), masteredGrammar("b"), masteredGrammar("c"),
                masteredGrammar("d"), masteredGrammar("e"), masteredGrammar("f"), overdue);

        assertFalse(readinessGate.isNewContentAllowed(profile, TODAY));
    }

    @Test
    public void testConsolidationWindowBlocksRegardlessOfMastery() {
        Profile justIntroduced = profileWithGrammar(masteredGrammar("a"))
                .withTracking(new SessionTracking(3, 0, TODAY.minusDays(1), 10, 9));
        Profile consolidated = justIntroduced
                .withTracking(new SessionTracking(4, 1, TODAY, 10, 9));

        assertFalse(readinessGate.isNewContentAllowed(justIntroduced, TODAY));
        assertTrue(readinessGate.isNewContentAllowed(consolidated, TODAY));
    }

    @Test
    public void testConsolidationWindowFollowsPreferences() {
        Profile profile = profileWithGrammar(masteredGrammar("a"))
                .withTracking(new SessionTracking(4, 1, TODAY, 10, 9))
                .withPreferences(new LearningPreferences(10, 10, 2, 5, 5, 2, List.of()));

        assertFalse(readinessGate.isNewContentAllowed(profile, TODAY));
    }

    private LearningItem singleItem(int exposures) {
        return grammarItem("은_는")
                .exposureCount(exposures)
                .totalAttempts(10)
                .repetitions(5)
                .consecutiveCorrect(5)
                .recentAccuracy(1.0)
                .intervalDays(18)
                .lastReviewedDate(TODAY.minusDays(1))
                .nextReviewDate(TODAY.plusDays(17))
                .build();
    }
}
