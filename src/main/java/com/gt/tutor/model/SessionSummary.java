package com.gt.tutor.model;

public record SessionSummary(int totalExercises, int correctExercises, double accuracyRate, int promotions) { }
