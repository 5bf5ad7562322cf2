package com.gt.tutor.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Difficulty tiers a grammar item has been practiced at. Tiers unlock in order, so every tier up to
 * {@code currentMaxTier} is unlocked.
 */
public record DifficultyProgress(DifficultyTier currentMaxTier, Map<DifficultyTier, TierProgress> tierProgress) {

    public DifficultyProgress {
        currentMaxTier = currentMaxTier == null ? DifficultyTier.Recognition : currentMaxTier;
        tierProgress = tierProgress == null || tierProgress.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(tierProgress));
    }

    public static DifficultyProgress initial() {
        return new DifficultyProgress(DifficultyTier.Recognition, Map.of());
    }

    public List<DifficultyTier> unlockedTiers() {
        return Arrays.stream(DifficultyTier.values())
                .filter(this::isUnlocked)
                .toList();
    }

    public boolean isUnlocked(DifficultyTier tier) {
        return tier.getRank() <= currentMaxTier.getRank();
    }

    public TierProgress progressAt(DifficultyTier tier) {
        return tierProgress.get(tier);
    }

    public DifficultyProgress withTierProgress(DifficultyTier tier, TierProgress progress) {
        Map<DifficultyTier, TierProgress> updated = new EnumMap<>(DifficultyTier.class);
        updated.putAll(tierProgress);
        updated.put(tier, progress);
        return new DifficultyProgress(currentMaxTier, updated);
    }

    public DifficultyProgress withCurrentMaxTier(DifficultyTier tier) {
        return new DifficultyProgress(tier, tierProgress);
    }
}
