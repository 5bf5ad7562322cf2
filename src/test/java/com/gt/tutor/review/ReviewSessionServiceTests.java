package com.gt.tutor.review;

import com.gt.tutor.difficulty.DifficultyAdvisor;
import com.gt.tutor.difficulty.DifficultyProgressTracker;
import com.gt.tutor.difficulty.DifficultySettings;
import com.gt.tutor.mastery.MasteryClassifier;
import com.gt.tutor.mastery.MasteryThresholds;
import com.gt.tutor.model.DifficultyProgress;
import com.gt.tutor.model.DifficultyTier;
import com.gt.tutor.model.ExerciseCategory;
import com.gt.tutor.model.ExerciseOutcome;
import com.gt.tutor.model.ItemKind;
import com.gt.tutor.model.ItemMasterySummary;
import com.gt.tutor.model.LearningItem;
import com.gt.tutor.model.LearningPreferences;
import com.gt.tutor.model.MasteryLevel;
import com.gt.tutor.model.Profile;
import com.gt.tutor.model.ReviewSession;
import com.gt.tutor.model.SessionSelection;
import com.gt.tutor.model.SessionSummary;
import com.gt.tutor.planner.PlannerSettings;
import com.gt.tutor.planner.PriorityTierClassifier;
import com.gt.tutor.planner.SessionPlanner;
import com.gt.tutor.profile.ProfileService;
import com.gt.tutor.readiness.ReadinessGate;
import com.gt.tutor.readiness.ReadinessSettings;
import com.gt.tutor.report.MasteryReportService;
import com.gt.tutor.srs.SrsSettings;
import com.gt.tutor.srs.SrsUpdateEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static com.gt.tutor.util.TestUtils.TODAY;
import static com.gt.tutor.util.TestUtils.grammarItem;
import static com.gt.tutor.util.TestUtils.masteredGrammar;
import static com.gt.tutor.util.TestUtils.profileWithGrammar;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class ReviewSessionServiceTests {

    private static final Clock FIXED_CLOCK = Clock.fixed(TODAY.atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);

    private ReviewSessionService reviewSessionService;

    @Mock private ProfileService profileService;
    @Mock private SessionPlanner sessionPlanner;

    @BeforeEach
    public void setup() {
        MasteryClassifier masteryClassifier = new MasteryClassifier(MasteryThresholds.defaults());
        DifficultyProgressTracker difficultyProgressTracker = new DifficultyProgressTracker(DifficultySettings.defaults());
        PriorityTierClassifier priorityTierClassifier = new PriorityTierClassifier(masteryClassifier, PlannerSettings.defaults());
        MasteryReportService masteryReportService = new MasteryReportService(profileService, masteryClassifier,
                priorityTierClassifier,
                new ReadinessGate(masteryClassifier, priorityTierClassifier, ReadinessSettings.defaults()),
                difficultyProgressTracker,
                FIXED_CLOCK);

        reviewSessionService = new ReviewSessionService(profileService,
                sessionPlanner,
                new OutcomeProcessor(new SrsUpdateEngine(SrsSettings.defaults()), masteryClassifier, difficultyProgressTracker),
                new DifficultyAdvisor(difficultyProgressTracker),
                masteryClassifier,
                masteryReportService,
                FIXED_CLOCK);
    }

    private static LearningItem learningGrammar(String id) {
        return grammarItem(id).repetitions(1).exposureCount(2).totalAttempts(2).consecutiveCorrect(1).recentAccuracy(0.5).build();
    }

    @Test
    public void testStartSession() {
        LearningPreferences defaults = LearningPreferences.defaults();
        LearningPreferences preferences = new LearningPreferences(defaults.reviewsPerSession(),
                defaults.vocabReviewsPerSession(), defaults.newGrammarPerSession(), defaults.newVocabPerSession(),
                defaults.maxNewItemsPerSession(), defaults.consolidationSessions(),
                List.of(ExerciseCategory.FillInBlank, ExerciseCategory.Translation));
        Profile profile = profileWithGrammar(learningGrammar("은_는"))
                .withPreferences(preferences)
                .withDifficultyProgress(Map.of("은_는", new DifficultyProgress(DifficultyTier.GuidedProduction, Map.of())));

        when(profileService.load(TODAY)).thenReturn(profile);
        when(sessionPlanner.select(profile, TODAY))
                .thenReturn(new SessionSelection(List.of("은_는"), List.of(), List.of("이_가"), List.of("사람")));

        ReviewSession session = reviewSessionService.startSession();

        assertEquals(1, session.sessionNumber());
        assertEquals(TODAY, session.sessionDate());
        assertEquals(ExerciseCategory.FillInBlank, session.recommendedCategories().get("은_는"));
        assertEquals(ExerciseCategory.MultipleChoice, session.recommendedCategories().get("이_가"));
        assertEquals(Map.of("은_는", MasteryLevel.Learning), session.startingGrammarLevels());

        ArgumentCaptor<Profile> savedProfileCaptor = ArgumentCaptor.forClass(Profile.class);
        verify(profileService).save(savedProfileCaptor.capture());
        Profile saved = savedProfileCaptor.getValue();
        assertEquals(1, saved.tracking().sessionsStarted());
        assertEquals(0, saved.tracking().sessionsSinceNewContent());
        assertEquals(TODAY, saved.tracking().lastSessionDate());
        assertEquals(profile.grammarSummary(), saved.grammarSummary());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testRecordOutcomesReturnsTouchedItems() {
        Profile profile = profileWithGrammar(learningGrammar("은_는"));
        when(profileService.update(eq(TODAY), any(UnaryOperator.class)))
                .thenAnswer(invocation -> invocation.<UnaryOperator<Profile>>getArgument(1).apply(profile));

        List<ItemMasterySummary> touched = reviewSessionService.recordOutcomes(List.of(
                new ExerciseOutcome(List.of("은/는"), List.of("물"), true, ExerciseCategory.FillInBlank),
                new ExerciseOutcome(List.of("은는"), List.of(), false, ExerciseCategory.FillInBlank)));

        assertEquals(2, touched.size());
        assertEquals("은_는", touched.get(0).id());
        assertEquals(ItemKind.Grammar, touched.get(0).kind());
        assertEquals("물", touched.get(1).id());
        assertEquals(ItemKind.Vocabulary, touched.get(1).kind());
        assertEquals(TODAY.plusDays(1), touched.get(0).nextReviewDate());
    }

    @Test
    public void testEndSessionSummary() {
        Map<String, LearningItem> grammarSummary = new LinkedHashMap<>();
        grammarSummary.put("은_는", masteredGrammar("은_는"));
        grammarSummary.put("이_가", learningGrammar("이_가"));
        when(profileService.load(TODAY)).thenReturn(profileWithGrammar().withGrammarSummary(grammarSummary));

        Map<String, MasteryLevel> startingLevels = new LinkedHashMap<>();
        startingLevels.put("은_는", MasteryLevel.Learning);
        startingLevels.put("이_가", MasteryLevel.New);
        ReviewSession session = new ReviewSession(3, TODAY,
                new SessionSelection(List.of("은_는"), List.of(), List.of("이_가"), List.of()), Map.of(), startingLevels);

        SessionSummary summary = reviewSessionService.endSession(session, List.of(
                new ExerciseOutcome(List.of("은_는"), List.of(), true, null),
                new ExerciseOutcome(List.of("이_가"), List.of(), true, null),
                new ExerciseOutcome(List.of("이_가"), List.of(), false, null)));

        assertEquals(3, summary.totalExercises());
        assertEquals(2, summary.correctExercises());
        assertEquals(66.7, summary.accuracyRate(), 1e-9);
        assertEquals(1, summary.promotions());
    }

    @Test
    public void testEndSessionWithoutOutcomes() {
        when(profileService.load(TODAY)).thenReturn(profileWithGrammar());
        ReviewSession session = new ReviewSession(1, TODAY,
                new SessionSelection(List.of(), List.of(), List.of(), List.of()), Map.of(), Map.of());

        SessionSummary summary = reviewSessionService.endSession(session, List.of());

        assertEquals(0, summary.totalExercises());
        assertEquals(0.0, summary.accuracyRate(), 1e-9);
        assertEquals(0, summary.promotions());
    }
}
