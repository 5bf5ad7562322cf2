package com.gt.tutor.model;

public enum ItemKind {
    Grammar,
    Vocabulary
}
