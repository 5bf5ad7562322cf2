package com.gt.tutor.model;

public record VocabEntry(String word,
                         String translation,
                         Integer frequencyRank,
                         String topikLevel,
                         String tags) { }
