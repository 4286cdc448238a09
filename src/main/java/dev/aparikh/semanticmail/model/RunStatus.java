package dev.aparikh.semanticmail.model;

public enum RunStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
