package com.gt.tutor.model;

public record CurriculumPoint(String id, String description, String level, int learningOrder) { }
