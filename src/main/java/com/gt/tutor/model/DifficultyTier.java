package com.gt.tutor.model;

import java.util.Arrays;
import java.util.Optional;

public enum DifficultyTier {
    Recognition(1),
    GuidedProduction(2),
    StructuredProduction(3),
    FreeProduction(4);

    private final int rank;

    DifficultyTier(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public Optional<DifficultyTier> next() {
        return fromRank(rank + 1);
    }

    public static Optional<DifficultyTier> fromRank(int rank) {
        return Arrays.stream(values()).filter(tier -> tier.rank == rank).findFirst();
    }
}
