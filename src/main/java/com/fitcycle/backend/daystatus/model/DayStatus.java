package com.fitcycle.backend.daystatus.model;

public enum DayStatus {
    PLANNED,
    DONE,
    SKIPPED
}
