package com.gt.tutor.planner;

import com.gt.tutor.curriculum.CurriculumService;
import com.gt.tutor.model.CurriculumPoint;
import com.gt.tutor.model.LearningItem;
import com.gt.tutor.model.LearningPreferences;
import com.gt.tutor.model.PriorityTier;
import com.gt.tutor.model.Profile;
import com.gt.tutor.model.SessionSelection;
import com.gt.tutor.model.VocabEntry;
import com.gt.tutor.readiness.ReadinessGate;
import com.gt.tutor.util.IdentifierNormalizer;
import com.gt.tutor.vocab.VocabularyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the items of one session. Reviews come first: grammar by priority tier, vocabulary by due date. New
 * grammar and vocabulary are only added when the readiness gate allows it, and both draw on one shared cap so new
 * grammar crowds out new vocabulary.
 * <p>
 * The result depends only on the profile, the date, the preferences and the collaborators' data.
 */
@Component
public class SessionPlanner {

    private static final Logger log = LoggerFactory.getLogger(SessionPlanner.class);

    private static final Comparator<LearningItem> DUE_DATE_ORDER = Comparator
            .comparing(LearningItem::nextReviewDate, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(LearningItem::id);

    private final PriorityTierClassifier priorityTierClassifier;
    private final ReadinessGate readinessGate;
    private final CurriculumService curriculumService;
    private final VocabularyProvider vocabularyProvider;

    @Autowired
    public SessionPlanner(PriorityTierClassifier priorityTierClassifier,
                          ReadinessGate readinessGate,
                          CurriculumService curriculumService,
                          VocabularyProvider vocabularyProvider) {
        this.priorityTierClassifier = priorityTierClassifier;
        this.readinessGate = readinessGate;
        this.curriculumService = curriculumService;
        this.vocabularyProvider = vocabularyProvider;
    }

    public SessionSelection select(Profile profile, LocalDate today) {
        return select(profile, today, profile.preferences());
    }

    public SessionSelection select(Profile profile, LocalDate today, LearningPreferences preferences) {
        List<String> reviewGrammar = selectGrammarReviews(profile, today, preferences.reviewsPerSession());
        List<String> reviewVocab = selectVocabReviews(profile, today, preferences.vocabReviewsPerSession());

        List<String> newGrammar = List.of();
        List<String> newVocab = List.of();
        int newItemCap = preferences.maxNewItemsPerSession();

        if (newItemCap > 0 && readinessGate.isNewContentAllowed(profile, today)) {
            newGrammar = curriculumService.getUnseenGrammarPoints(
                            profile.targetLanguage(),
                            profile.level(),
                            profile.grammarSummary().keySet(),
                            Math.min(preferences.newGrammarPerSession(), newItemCap))
                    .stream()
                    .map(CurriculumPoint::id)
                    .toList();

            int remainingCap = newItemCap - newGrammar.size();
            newVocab = vocabularyProvider.getNewWords(
                            profile.level(),
                            profile.vocabSummary().keySet(),
                            Math.min(preferences.newVocabPerSession(), remainingCap))
                    .stream()
                    .map(VocabEntry::word)
                    .map(IdentifierNormalizer::normalize)
                    .filter(id -> !id.isEmpty())
                    .distinct()
                    .toList();
        }

        SessionSelection selection = new SessionSelection(reviewGrammar, reviewVocab, newGrammar, newVocab);

        log.info("Selected {} grammar review(s), {} vocab review(s), {} new grammar, {} new vocab for {}",
                reviewGrammar.size(), reviewVocab.size(), newGrammar.size(), newVocab.size(), today);

        return selection;
    }

    public Map<String, PriorityTier> tiers(Profile profile, LocalDate today) {
        Map<String, PriorityTier> tiers = new LinkedHashMap<>();
        for (LearningItem item : profile.grammarSummary().values()) {
            tiers.put(item.id(), priorityTierClassifier.classify(item, today));
        }
        return tiers;
    }

    private List<String> selectGrammarReviews(Profile profile, LocalDate today, int limit) {
        Map<String, PriorityTier> tiers = tiers(profile, today);

        return profile.grammarSummary().values().stream()
                .filter(item -> isReviewTier(tiers.get(item.id())))
                .sorted(Comparator.<LearningItem, PriorityTier>comparing(item -> tiers.get(item.id()))
                        .thenComparing(DUE_DATE_ORDER))
                .limit(limit)
                .map(LearningItem::id)
                .toList();
    }

    private List<String> selectVocabReviews(Profile profile, LocalDate today, int limit) {
        return profile.vocabSummary().values().stream()
                .filter(item -> item.isDue(today))
                .sorted(DUE_DATE_ORDER)
                .limit(limit)
                .map(LearningItem::id)
                .toList();
    }

    private boolean isReviewTier(PriorityTier tier) {
        return tier == PriorityTier.Urgent || tier == PriorityTier.Regular;
    }
}
