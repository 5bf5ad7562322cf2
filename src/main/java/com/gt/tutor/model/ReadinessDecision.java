package com.gt.tutor.model;

public record ReadinessDecision(boolean allowed, String reason) {

    public static ReadinessDecision allow(String reason) {
        return new ReadinessDecision(true, reason);
    }

    public static ReadinessDecision block(String reason) {
        return new ReadinessDecision(false, reason);
    }
}
