package org.knowhub.entity;

public enum FeedbackKind {
    POSITIVE,
    NEGATIVE,
    NEUTRAL,
    // 撤回之前的表态
    REMOVED
}
