package com.fitcycle.backend.reminder.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

public final class ReminderTimes {

    private static final String[] DAYS = {"mon", "tue", "wed", "thu", "fri", "sat", "sun"};

    private ReminderTimes() {}

    /** "HH:mm"，小時 0-23、分鐘 0-59，小時允許一位數（"9:05"） */
    public static LocalTime parseTime(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("REMINDER_TIME_REQUIRED");
        String[] parts = raw.trim().split(":", -1);
        if (parts.length != 2) throw new IllegalArgumentException("REMINDER_TIME_INVALID");
        int h;
        int m;
        try {
            h = Integer.parseInt(parts[0]);
            m = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("REMINDER_TIME_INVALID");
        }
        if (h < 0 || h > 23 || m < 0 || m > 59) throw new IllegalArgumentException("REMINDER_TIME_INVALID");
        return LocalTime.of(h, m);
    }

    public static String format(LocalTime t) {
        return String.format("%02d:%02d", t.getHour(), t.getMinute());
    }

    public static DayOfWeek parseDay(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("REMINDER_DAY_REQUIRED");
        String d = raw.trim().toLowerCase(Locale.ROOT);
        for (int i = 0; i < DAYS.length; i++) {
            if (DAYS[i].equals(d)) return DayOfWeek.of(i + 1);
        }
        throw new IllegalArgumentException("REMINDER_DAY_INVALID");
    }

    public static String dayKey(DayOfWeek d) {
        return DAYS[d.getValue() - 1];
    }

    /**
     * now 之後（嚴格大於）的下一次觸發；day == null 代表每天。
     * 夏令時間跳過的時刻由 ZonedDateTime 往後推。
     */
    public static Instant next(LocalTime time, DayOfWeek day, ZoneId zone, Instant now) {
        ZonedDateTime nowZ = ZonedDateTime.ofInstant(now, zone);
        ZonedDateTime candidate = ZonedDateTime.of(nowZ.toLocalDate(), time, zone);

        if (day == null) {
            if (!candidate.isAfter(nowZ)) candidate = ZonedDateTime.of(nowZ.toLocalDate().plusDays(1), time, zone);
            return candidate.toInstant();
        }

        candidate = ZonedDateTime.of(nowZ.toLocalDate().with(TemporalAdjusters.nextOrSame(day)), time, zone);
        if (!candidate.isAfter(nowZ)) {
            candidate = ZonedDateTime.of(nowZ.toLocalDate().with(TemporalAdjusters.next(day)), time, zone);
        }
        return candidate.toInstant();
    }
}
