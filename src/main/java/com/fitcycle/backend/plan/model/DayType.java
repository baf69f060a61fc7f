package com.fitcycle.backend.plan.model;

import java.util.Locale;

public enum DayType {
    TRAIN,
    REST;

    /** sheet / json 寫法是小寫 train / rest，這裡統一轉 enum；不認得回 null */
    public static DayType parseOrNull(String raw) {
        if (raw == null) return null;
        String s = raw.trim().toUpperCase(Locale.ROOT);
        for (DayType t : values()) {
            if (t.name().equals(s)) return t;
        }
        return null;
    }
}
