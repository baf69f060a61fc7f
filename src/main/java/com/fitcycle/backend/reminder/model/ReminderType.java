package com.fitcycle.backend.reminder.model;

import java.time.DayOfWeek;
import java.util.Locale;

public enum ReminderType {
    WATER(null, false, null),
    MEAL(null, false, null),
    WORKOUT(null, false, null),
    SLEEP(null, false, null),
    PROGRESS(null, false, null),
    DAILY_REPORT("23:00", true, null),
    WEEKLY_PDF("20:00", true, DayOfWeek.SUNDAY);

    private final String defaultTime;
    private final boolean defaultEnabled;
    private final DayOfWeek defaultDay;

    ReminderType(String defaultTime, boolean defaultEnabled, DayOfWeek defaultDay) {
        this.defaultTime = defaultTime;
        this.defaultEnabled = defaultEnabled;
        this.defaultDay = defaultDay;
    }

    /** api / json 用的小寫 key，例如 daily_report */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean weekly() {
        return defaultDay != null;
    }

    public String defaultTime() { return defaultTime; }
    public boolean defaultEnabled() { return defaultEnabled; }
    public DayOfWeek defaultDay() { return defaultDay; }

    public static ReminderType parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("REMINDER_TYPE_REQUIRED");
        String k = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ReminderType t : values()) {
            if (t.name().equals(k)) return t;
        }
        throw new IllegalArgumentException("REMINDER_TYPE_UNKNOWN");
    }
}
