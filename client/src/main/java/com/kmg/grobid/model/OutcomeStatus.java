package com.kmg.grobid.model;

public enum OutcomeStatus {
    WRITTEN,
    SKIPPED,
    FAILED
}
