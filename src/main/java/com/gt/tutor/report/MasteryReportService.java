package com.gt.tutor.report;

import com.gt.tutor.difficulty.DifficultyProgressTracker;
import com.gt.tutor.mastery.MasteryClassifier;
import com.gt.tutor.model.DifficultySummary;
import com.gt.tutor.model.ItemMasterySummary;
import com.gt.tutor.model.LearningItem;
import com.gt.tutor.model.MasteryReport;
import com.gt.tutor.model.Profile;
import com.gt.tutor.planner.PriorityTierClassifier;
import com.gt.tutor.profile.ProfileService;
import com.gt.tutor.readiness.ReadinessGate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

@Component
public class MasteryReportService {

    private final ProfileService profileService;
    private final MasteryClassifier masteryClassifier;
    private final PriorityTierClassifier priorityTierClassifier;
    private final ReadinessGate readinessGate;
    private final DifficultyProgressTracker difficultyProgressTracker;
    private final Clock clock;

    @Autowired
    public MasteryReportService(ProfileService profileService,
                                MasteryClassifier masteryClassifier,
                                PriorityTierClassifier priorityTierClassifier,
                                ReadinessGate readinessGate,
                                DifficultyProgressTracker difficultyProgressTracker,
                                Clock clock) {
        this.profileService = profileService;
        this.masteryClassifier = masteryClassifier;
        this.priorityTierClassifier = priorityTierClassifier;
        this.readinessGate = readinessGate;
        this.difficultyProgressTracker = difficultyProgressTracker;
        this.clock = clock;
    }

    public MasteryReport getReport() {
        LocalDate today = LocalDate.now(clock);
        return buildReport(profileService.load(today), today);
    }

    public MasteryReport buildReport(Profile profile, LocalDate today) {
        return new MasteryReport(
                today,
                summarize(profile.grammarSummary().values(), today),
                summarize(profile.vocabSummary().values(), today),
                masteryClassifier.countByLevel(profile.grammarSummary().values()),
                masteryClassifier.countByLevel(profile.vocabSummary().values()),
                summarizeDifficulty(profile, today),
                readinessGate.isNewContentAllowed(profile, today));
    }

    public ItemMasterySummary summarize(LearningItem item, LocalDate today) {
        return new ItemMasterySummary(
                item.id(),
                item.kind(),
                masteryClassifier.classify(item),
                item.srsLevel(),
                item.nextReviewDate(),
                item.recentAccuracy(),
                priorityTierClassifier.classify(item, today),
                item.masteryDate());
    }

    private List<ItemMasterySummary> summarize(Collection<LearningItem> items, LocalDate today) {
        return items.stream()
                .map(item -> summarize(item, today))
                .sorted(Comparator.comparing(ItemMasterySummary::tier).thenComparing(ItemMasterySummary::id))
                .toList();
    }

    // Every grammar item, practiced at a difficulty tier or not, ordered by id
    private List<DifficultySummary> summarizeDifficulty(Profile profile, LocalDate today) {
        return profile.grammarSummary().keySet().stream()
                .sorted()
                .map(grammarId -> difficultyProgressTracker.summarize(grammarId,
                        profile.difficultyProgress().get(grammarId), today))
                .toList();
    }
}
