package com.fitcycle.backend.plan.model;

import java.util.Locale;

public enum Level {
    EASY,
    MEDIUM,
    HARD;

    public static Level parseOrNull(String raw) {
        if (raw == null) return null;
        String s = raw.trim().toUpperCase(Locale.ROOT);
        for (Level l : values()) {
            if (l.name().equals(s)) return l;
        }
        return null;
    }
}
