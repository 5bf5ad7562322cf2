package com.gt.tutor.model;

public enum PriorityTier {
    Urgent,
    Regular,
    Maintenance,
    Scheduled
}
