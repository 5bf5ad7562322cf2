package com.gt.tutor.planner;

import com.gt.tutor.mastery.MasteryClassifier;
import com.gt.tutor.model.LearningItem;
import com.gt.tutor.model.PriorityTier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

@Component
public class PriorityTierClassifier {

    private final MasteryClassifier masteryClassifier;
    private final PlannerSettings settings;

    @Autowired
    public PriorityTierClassifier(MasteryClassifier masteryClassifier, PlannerSettings settings) {
        this.masteryClassifier = masteryClassifier;
        this.settings = settings;
    }

    public PriorityTier classify(LearningItem item, LocalDate today) {
        if (masteryClassifier.isStruggling(item)
                || (item.isOverdue(today) && item.repetitions() < settings.urgentMaxRepetitions())) {
            return PriorityTier.Urgent;
        }

        if (item.isDue(today)) {
            return PriorityTier.Regular;
        }

        return masteryClassifier.isMastered(item) ? PriorityTier.Maintenance : PriorityTier.Scheduled;
    }
}
