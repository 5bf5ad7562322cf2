package com.gt.tutor.readiness;

import com.gt.tutor.mastery.MasteryClassifier;
import com.gt.tutor.model.LearningItem;
import com.gt.tutor.model.PriorityTier;
import com.gt.tutor.model.ReadinessDecision;
import com.gt.tutor.model.Profile;
import com.gt.tutor.model.SessionTracking;
import com.gt.tutor.planner.PriorityTierClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Decides whether new material may be introduced. The consolidation window, the urgent-item override and the
 * mastery policy are independent gates; new content is allowed only when all of them allow it.
 */
@Component
public class ReadinessGate {

    private static final Logger log = LoggerFactory.getLogger(ReadinessGate.class);

    private final MasteryClassifier masteryClassifier;
    private final PriorityTierClassifier priorityTierClassifier;
    private final ReadinessSettings settings;

    @Autowired
    public ReadinessGate(MasteryClassifier masteryClassifier,
                         PriorityTierClassifier priorityTierClassifier,
                         ReadinessSettings settings) {
        this.masteryClassifier = masteryClassifier;
        this.priorityTierClassifier = priorityTierClassifier;
        this.settings = settings;
    }

    public boolean isNewContentAllowed(Profile profile, LocalDate today) {
        return evaluate(profile, today).allowed();
    }

    public ReadinessDecision evaluate(Profile profile, LocalDate today) {
        ReadinessDecision decision = evaluateGates(profile, today);

        log.info("New content {}: {}", decision.allowed() ? "allowed" : "blocked", decision.reason());

        return decision;
    }

    private ReadinessDecision evaluateGates(Profile profile, LocalDate today) {
        ReadinessDecision consolidation = checkConsolidationWindow(profile);
        if (!consolidation.allowed()) {
            return consolidation;
        }

        List<LearningItem> knownItems = profile.grammarSummary().values().stream()
                .filter(item -> item.exposureCount() > 0)
                .toList();

        // same rule the planner uses to put an item at the front of the review queue
        long urgentCount = knownItems.stream()
                .filter(item -> priorityTierClassifier.classify(item, today) == PriorityTier.Urgent)
                .count();
        if (urgentCount > 0) {
            return ReadinessDecision.block(urgentCount + " urgent item(s) need review first");
        }

        return checkMastery(knownItems);
    }

    private ReadinessDecision checkConsolidationWindow(Profile profile) {
        SessionTracking tracking = profile.tracking();
        int requiredSessions = profile.preferences().consolidationSessions();

        // never introduced new content, nothing to consolidate
        if (tracking.sessionsSinceNewContent() == null) {
            return ReadinessDecision.allow("no new content introduced yet");
        }

        if (tracking.sessionsSinceNewContent() < requiredSessions) {
            return ReadinessDecision.block("consolidating, " + tracking.sessionsSinceNewContent() + " of "
                    + requiredSessions + " review-only session(s) completed");
        }

        return ReadinessDecision.allow("consolidation complete");
    }

    ReadinessDecision checkMastery(List<LearningItem> knownItems) {
        int total = knownItems.size();

        if (total == 0) {
            return ReadinessDecision.allow("no known items");
        }

        if (total == 1) {
            return meetsSingleItemBar(knownItems.get(0))
                    ? ReadinessDecision.allow("only known item is solid")
                    : ReadinessDecision.block("only known item '" + knownItems.get(0).id() + "' is not solid yet");
        }

        long strugglingCount = knownItems.stream().filter(masteryClassifier::isStruggling).count();
        long masteredCount = knownItems.stream().filter(masteryClassifier::isMastered).count();
        long unmasteredCount = total - masteredCount;

        if (total <= settings.smallSetMaxSize()) {
            if (strugglingCount > 0) {
                return ReadinessDecision.block(strugglingCount + " of " + total + " known item(s) struggling");
            }
            if (masteredCount < total * settings.smallSetMasteredShare()) {
                return ReadinessDecision.block(masteredCount + " of " + total + " known item(s) mastered");
            }
            return ReadinessDecision.allow(masteredCount + " of " + total + " known item(s) mastered");
        }

        if (strugglingCount > (double) total / settings.largeSetStrugglingDivisor()) {
            return ReadinessDecision.block(strugglingCount + " of " + total + " known item(s) struggling");
        }
        if (unmasteredCount > (double) total / settings.largeSetUnmasteredDivisor()) {
            return ReadinessDecision.block(unmasteredCount + " of " + total + " known item(s) not mastered");
        }

        return ReadinessDecision.allow(masteredCount + " of " + total + " known item(s) mastered, "
                + strugglingCount + " struggling");
    }

    private boolean meetsSingleItemBar(LearningItem item) {
        return item.exposureCount() >= settings.singleItemMinExposures()
                && item.consecutiveCorrect() >= settings.singleItemMinStreak()
                && item.recentAccuracy() >= settings.singleItemMinAccuracy()
                && masteryClassifier.attempts(item) >= settings.singleItemMinAttempts()
                && item.repetitions() >= settings.singleItemMinRepetitions();
    }
}
