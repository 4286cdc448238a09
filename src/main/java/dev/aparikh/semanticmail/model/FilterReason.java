package dev.aparikh.semanticmail.model;

public enum FilterReason {
    NONE,
    MARKETING,
    AUTOMATED,
    PROCESSING_ERROR
}
