package com.gt.tutor.mastery;

import com.gt.tutor.model.ItemKind;
import com.gt.tutor.model.LearningItem;
import com.gt.tutor.model.MasteryLevel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Derives a mastery level from an item's metrics. Every check is a lower bound on a metric, so improving any input
 * can only keep or raise the resulting level.
 */
@Component
public class MasteryClassifier {

    private final MasteryThresholds thresholds;

    @Autowired
    public MasteryClassifier(MasteryThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public MasteryLevel classify(LearningItem item) {
        if (exposures(item) == 0) {
            return MasteryLevel.New;
        }

        if (item.repetitions() < thresholds.learningMinRepetitions()
                || item.consecutiveCorrect() < thresholds.learningMinStreak()
                || attempts(item) < thresholds.learningMinAttempts()) {
            return MasteryLevel.Learning;
        }

        if (item.recentAccuracy() < thresholds.masteryMinAccuracy()
                || item.consecutiveCorrect() < thresholds.masteryMinStreak()) {
            return MasteryLevel.Reviewing;
        }

        return MasteryLevel.Mastered;
    }

    public boolean isMastered(LearningItem item) {
        return classify(item) == MasteryLevel.Mastered;
    }

    public boolean isStruggling(LearningItem item) {
        int attempts = attempts(item);
        if (attempts == 0) {
            return false;
        }

        return item.recentAccuracy() < thresholds.strugglingAccuracy()
                || (item.consecutiveCorrect() == 0 && attempts >= thresholds.strugglingMinAttempts());
    }

    // Vocabulary does not track exposures separately; every attempt is an exposure
    public int exposures(LearningItem item) {
        return item.kind() == ItemKind.Vocabulary
                ? Math.max(item.exposureCount(), attempts(item))
                : item.exposureCount();
    }

    // Each correct answer in a streak was an attempt, so the streaks bound the attempt count from below
    public int attempts(LearningItem item) {
        return Math.max(item.totalAttempts(), Math.max(item.consecutiveCorrect(), item.successStreak()));
    }

    public Map<MasteryLevel, Integer> countByLevel(Collection<LearningItem> items) {
        Map<MasteryLevel, Integer> counts = new EnumMap<>(MasteryLevel.class);
        for (MasteryLevel level : MasteryLevel.values()) {
            counts.put(level, 0);
        }
        for (LearningItem item : items) {
            counts.merge(classify(item), 1, Integer::sum);
        }
        return counts;
    }
}
