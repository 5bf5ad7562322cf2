package com.gt.tutor.model;

// Ordered from least to most mastered; rank comparisons rely on declaration order.
public enum MasteryLevel {
    New,
    Learning,
    Reviewing,
    Mastered;

    public boolean isAtLeast(MasteryLevel other) {
        return this.ordinal() >= other.ordinal();
    }
}
