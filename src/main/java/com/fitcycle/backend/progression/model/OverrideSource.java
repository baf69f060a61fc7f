package com.fitcycle.backend.progression.model;

public enum OverrideSource {
    USER,
    AUTOPROG
}
