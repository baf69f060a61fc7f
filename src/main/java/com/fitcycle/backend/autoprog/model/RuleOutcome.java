package com.fitcycle.backend.autoprog.model;

public enum RuleOutcome {
    APPLIED,
    SKIPPED_NOT_DUE,
    FAILED
}
