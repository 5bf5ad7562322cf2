package com.gt.tutor.review;

import com.gt.tutor.difficulty.DifficultyAdvisor;
import com.gt.tutor.mastery.MasteryClassifier;
import com.gt.tutor.model.ExerciseCategory;
import com.gt.tutor.model.ExerciseOutcome;
import com.gt.tutor.model.ItemMasterySummary;
import com.gt.tutor.model.LearningItem;
import com.gt.tutor.model.MasteryLevel;
import com.gt.tutor.model.Profile;
import com.gt.tutor.model.ReviewSession;
import com.gt.tutor.model.SessionSelection;
import com.gt.tutor.model.SessionSummary;
import com.gt.tutor.planner.SessionPlanner;
import com.gt.tutor.profile.ProfileService;
import com.gt.tutor.report.MasteryReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Entry point for one study session: plan the session, fold in evaluated outcomes as they arrive, summarize at the
 * end. Each call is a separate load, transform, save cycle on the profile.
 */
@Component
public class ReviewSessionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionService.class);

    private final ProfileService profileService;
    private final SessionPlanner sessionPlanner;
    private final OutcomeProcessor outcomeProcessor;
    private final DifficultyAdvisor difficultyAdvisor;
    private final MasteryClassifier masteryClassifier;
    private final MasteryReportService masteryReportService;
    private final Clock clock;

    @Autowired
    public ReviewSessionService(ProfileService profileService,
                                SessionPlanner sessionPlanner,
                                OutcomeProcessor outcomeProcessor,
                                DifficultyAdvisor difficultyAdvisor,
                                MasteryClassifier masteryClassifier,
                                MasteryReportService masteryReportService,
                                Clock clock) {
        this.profileService = profileService;
        this.sessionPlanner = sessionPlanner;
        this.outcomeProcessor = outcomeProcessor;
        this.difficultyAdvisor = difficultyAdvisor;
        this.masteryClassifier = masteryClassifier;
        this.masteryReportService = masteryReportService;
        this.clock = clock;
    }

    public ReviewSession startSession() {
        LocalDate today = LocalDate.now(clock);
        Profile profile = profileService.load(today);

        SessionSelection selection = sessionPlanner.select(profile, today);

        Map<String, ExerciseCategory> recommendedCategories = new LinkedHashMap<>();
        Stream.concat(selection.reviewGrammar().stream(), selection.newGrammar().stream())
                .forEach(grammarId -> recommendedCategories.put(grammarId,
                        difficultyAdvisor.recommend(profile.difficultyProgress().get(grammarId), profile.preferences(), today)));

        Map<String, MasteryLevel> startingGrammarLevels = new LinkedHashMap<>();
        for (LearningItem item : profile.grammarSummary().values()) {
            startingGrammarLevels.put(item.id(), masteryClassifier.classify(item));
        }

        Profile updated = profile.withTracking(profile.tracking().withSessionStarted(today, selection.hasNewContent()));
        profileService.save(updated);

        log.info("Started session {} with {} item(s){}", updated.tracking().sessionsStarted(), selection.size(),
                selection.hasNewContent() ? ", including new content" : "");

        return new ReviewSession(updated.tracking().sessionsStarted(), today, selection, recommendedCategories,
                startingGrammarLevels);
    }

    public List<ItemMasterySummary> recordOutcomes(List<ExerciseOutcome> outcomes) {
        LocalDate today = LocalDate.now(clock);
        Profile updated = profileService.update(today, profile -> outcomeProcessor.apply(profile, outcomes, today));

        List<ItemMasterySummary> touchedItems = new ArrayList<>();
        for (ExerciseOutcome outcome : outcomes) {
            for (String grammarId : OutcomeProcessor.canonicalIds(outcome.grammarIds())) {
                addSummary(touchedItems, updated.grammarSummary().get(grammarId), today);
            }
            for (String vocabId : OutcomeProcessor.canonicalIds(outcome.vocabIds())) {
                addSummary(touchedItems, updated.vocabSummary().get(vocabId), today);
            }
        }
        return touchedItems;
    }

    public SessionSummary endSession(ReviewSession session, List<ExerciseOutcome> sessionOutcomes) {
        LocalDate today = LocalDate.now(clock);
        Profile profile = profileService.load(today);

        int totalExercises = sessionOutcomes.size();
        int correctExercises = (int) sessionOutcomes.stream().filter(ExerciseOutcome::correct).count();
        double accuracyRate = totalExercises == 0
                ? 0.0
                : Math.round(correctExercises * 1000.0 / totalExercises) / 10.0;

        int promotions = 0;
        for (Map.Entry<String, MasteryLevel> startingLevel : session.startingGrammarLevels().entrySet()) {
            LearningItem item = profile.grammarSummary().get(startingLevel.getKey());
            if (startingLevel.getValue() != MasteryLevel.Mastered && item != null && masteryClassifier.isMastered(item)) {
                promotions++;
            }
        }

        log.info("Session {} complete: {} of {} correct ({}%), {} promotion(s)", session.sessionNumber(),
                correctExercises, totalExercises, accuracyRate, promotions);

        return new SessionSummary(totalExercises, correctExercises, accuracyRate, promotions);
    }

    private void addSummary(List<ItemMasterySummary> summaries, LearningItem item, LocalDate today) {
        if (item == null) {
            return;
        }
        boolean alreadyAdded = summaries.stream()
                .anyMatch(summary -> summary.kind() == item.kind() && summary.id().equals(item.id()));
        if (!alreadyAdded) {
            summaries.add(masteryReportService.summarize(item, today));
        }
    }
}
