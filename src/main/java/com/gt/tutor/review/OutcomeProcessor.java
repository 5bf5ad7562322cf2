package com.gt.tutor.review;

import com.gt.tutor.difficulty.DifficultyProgressTracker;
import com.gt.tutor.mastery.MasteryClassifier;
import com.gt.tutor.model.DifficultyProgress;
import com.gt.tutor.model.DifficultyTier;
import com.gt.tutor.model.ExerciseOutcome;
import com.gt.tutor.model.ItemKind;
import com.gt.tutor.model.LearningItem;
import com.gt.tutor.model.Profile;
import com.gt.tutor.model.TierProgress;
import com.gt.tutor.srs.SrsUpdateEngine;
import com.gt.tutor.util.IdentifierNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds evaluated exercise outcomes into a profile. Items are created on first exposure; grammar items also count
 * the exposure itself. Outcomes that name an exercise category also feed the difficulty progress of their grammar
 * items. Returns a new profile and leaves the given one untouched.
 */
@Component
public class OutcomeProcessor {

    private static final Logger log = LoggerFactory.getLogger(OutcomeProcessor.class);

    private final SrsUpdateEngine srsUpdateEngine;
    private final MasteryClassifier masteryClassifier;
    private final DifficultyProgressTracker difficultyProgressTracker;

    @Autowired
    public OutcomeProcessor(SrsUpdateEngine srsUpdateEngine,
                            MasteryClassifier masteryClassifier,
                            DifficultyProgressTracker difficultyProgressTracker) {
        this.srsUpdateEngine = srsUpdateEngine;
        this.masteryClassifier = masteryClassifier;
        this.difficultyProgressTracker = difficultyProgressTracker;
    }

    public Profile apply(Profile profile, List<ExerciseOutcome> outcomes, LocalDate today) {
        Map<String, LearningItem> grammarSummary = new LinkedHashMap<>(profile.grammarSummary());
        Map<String, LearningItem> vocabSummary = new LinkedHashMap<>(profile.vocabSummary());
        Map<String, DifficultyProgress> difficultyProgress = new LinkedHashMap<>(profile.difficultyProgress());
        int correctCount = 0;

        for (ExerciseOutcome outcome : outcomes) {
            for (String grammarId : canonicalIds(outcome.grammarIds())) {
                applyToItem(grammarSummary, grammarId, ItemKind.Grammar, outcome.correct(), today);
                if (outcome.category() != null) {
                    applyToDifficulty(difficultyProgress, grammarId, outcome, today);
                }
            }
            for (String vocabId : canonicalIds(outcome.vocabIds())) {
                applyToItem(vocabSummary, vocabId, ItemKind.Vocabulary, outcome.correct(), today);
            }
            if (outcome.correct()) {
                correctCount++;
            }
        }

        log.info("Applied {} outcome(s), {} correct", outcomes.size(), correctCount);

        return profile
                .withGrammarSummary(grammarSummary)
                .withVocabSummary(vocabSummary)
                .withDifficultyProgress(difficultyProgress)
                .withTracking(profile.tracking().withExercises(outcomes.size(), correctCount));
    }

    // Canonical ids of an outcome, each once, unusable ids dropped
    public static Set<String> canonicalIds(Collection<String> rawIds) {
        Set<String> canonicalIds = new LinkedHashSet<>();
        for (String rawId : rawIds) {
            String canonicalId = IdentifierNormalizer.normalize(rawId);
            if (canonicalId.isEmpty()) {
                log.warn("Ignoring unusable item id '{}'", rawId);
            } else {
                canonicalIds.add(canonicalId);
            }
        }
        return canonicalIds;
    }

    private void applyToItem(Map<String, LearningItem> summary, String id, ItemKind kind, boolean correct, LocalDate today) {
        LearningItem item = summary.get(id);
        if (item == null) {
            item = srsUpdateEngine.newItem(id, kind, today);
        }
        if (kind == ItemKind.Grammar) {
            item = item.toBuilder().exposureCount(item.exposureCount() + 1).build();
        }

        LearningItem updated = srsUpdateEngine.applyOutcome(item, correct, today);

        if (updated.masteryDate() == null && masteryClassifier.isMastered(updated)) {
            updated = updated.toBuilder().masteryDate(today).build();
            log.info("{} '{}' mastered", kind, id);
        }

        summary.put(id, updated);
    }

    private void applyToDifficulty(Map<String, DifficultyProgress> difficultyProgress, String grammarId,
                                   ExerciseOutcome outcome, LocalDate today) {
        DifficultyProgress progress = difficultyProgress.getOrDefault(grammarId, DifficultyProgress.initial());
        DifficultyTier tier = outcome.category().getTier();

        DifficultyProgress updated = difficultyProgressTracker.recordOutcome(progress, outcome.category(),
                outcome.correct(), today);

        if (updated.currentMaxTier() != progress.currentMaxTier()) {
            log.info("Grammar '{}' unlocked {}", grammarId, updated.currentMaxTier());
        }
        if (masteryDate(progress, tier) == null && masteryDate(updated, tier) != null) {
            log.info("Grammar '{}' mastered at {}", grammarId, tier);
        }

        difficultyProgress.put(grammarId, updated);
    }

    private static LocalDate masteryDate(DifficultyProgress progress, DifficultyTier tier) {
        TierProgress tierProgress = progress.progressAt(tier);
        return tierProgress == null ? null : tierProgress.masteryDate();
    }
}
