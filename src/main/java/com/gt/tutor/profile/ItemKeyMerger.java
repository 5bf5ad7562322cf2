package com.gt.tutor.profile;

import com.gt.tutor.model.DifficultyProgress;
import com.gt.tutor.model.ItemKind;
import com.gt.tutor.model.LearningItem;
import com.gt.tutor.util.IdentifierNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Re-keys a summary by canonical id. When several stored keys collapse into one, the record with the most
 * repetitions survives; on a tie the one met first wins. Difficulty progress merges the same way, keeping the
 * record with the highest unlocked tier.
 */
@Component
public class ItemKeyMerger {

    private static final Logger log = LoggerFactory.getLogger(ItemKeyMerger.class);

    public MergedSummary merge(Map<String, LearningItem> summary, ItemKind kind) {
        Map<String, LearningItem> merged = new LinkedHashMap<>();
        int mergedCount = 0;
        int renamedCount = 0;

        for (Map.Entry<String, LearningItem> entry : summary.entrySet()) {
            String canonicalId = IdentifierNormalizer.normalize(entry.getKey());
            if (canonicalId.isEmpty()) {
                log.warn("Dropping {} entry with unusable id '{}'", kind, entry.getKey());
                continue;
            }

            LearningItem candidate = entry.getValue();
            if (!canonicalId.equals(candidate.id()) || candidate.kind() != kind) {
                candidate = candidate.toBuilder().id(canonicalId).kind(kind).build();
            }
            if (!canonicalId.equals(entry.getKey())) {
                renamedCount++;
            }

            LearningItem existing = merged.get(canonicalId);
            if (existing == null) {
                merged.put(canonicalId, candidate);
                continue;
            }

            mergedCount++;
            if (candidate.repetitions() > existing.repetitions()) {
                merged.put(canonicalId, candidate);
                log.info("Merged {} '{}' into '{}', keeping '{}' with {} repetitions over {}",
                        kind, entry.getKey(), canonicalId, entry.getKey(), candidate.repetitions(), existing.repetitions());
            } else {
                log.info("Merged {} '{}' into '{}', keeping the earlier record with {} repetitions over {}",
                        kind, entry.getKey(), canonicalId, existing.repetitions(), candidate.repetitions());
            }
        }

        if (renamedCount > 0) {
            log.info("Normalized {} {} key(s), {} merged", renamedCount, kind, mergedCount);
        }

        return new MergedSummary(merged, mergedCount);
    }

    public Map<String, DifficultyProgress> mergeDifficultyProgress(Map<String, DifficultyProgress> difficultyProgress) {
        Map<String, DifficultyProgress> merged = new LinkedHashMap<>();

        for (Map.Entry<String, DifficultyProgress> entry : difficultyProgress.entrySet()) {
            String canonicalId = IdentifierNormalizer.normalize(entry.getKey());
            if (canonicalId.isEmpty()) {
                log.warn("Dropping difficulty progress with unusable id '{}'", entry.getKey());
                continue;
            }

            DifficultyProgress existing = merged.get(canonicalId);
            if (existing == null
                    || entry.getValue().currentMaxTier().getRank() > existing.currentMaxTier().getRank()) {
                merged.put(canonicalId, entry.getValue());
            }
            if (existing != null) {
                log.info("Merged difficulty progress '{}' into '{}'", entry.getKey(), canonicalId);
            }
        }

        return merged;
    }

    public record MergedSummary(Map<String, LearningItem> summary, int mergedCount) { }
}
