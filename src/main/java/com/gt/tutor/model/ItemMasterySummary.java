package com.gt.tutor.model;

import java.time.LocalDate;

public record ItemMasterySummary(String id,
                                 ItemKind kind,
                                 MasteryLevel mastery,
                                 int srsLevel,
                                 LocalDate nextReviewDate,
                                 double recentAccuracy,
                                 PriorityTier tier,
                                 LocalDate masteryDate) { }
