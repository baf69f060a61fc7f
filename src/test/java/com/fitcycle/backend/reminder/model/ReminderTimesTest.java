package com.fitcycle.backend.reminder.model;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReminderTimesTest {

    private static final ZoneId MSK = ZoneId.of("Europe/Moscow"); // UTC+3, 無夏令時間

    @Test
    void parses_hh_mm_and_rejects_out_of_range() {
        assertThat(ReminderTimes.parseTime("9:05")).isEqualTo(LocalTime.of(9, 5));
        assertThat(ReminderTimes.parseTime(" 23:59 ")).isEqualTo(LocalTime.of(23, 59));

        assertThatThrownBy(() -> ReminderTimes.parseTime("24:00")).hasMessage("REMINDER_TIME_INVALID");
        assertThatThrownBy(() -> ReminderTimes.parseTime("10:60")).hasMessage("REMINDER_TIME_INVALID");
        assertThatThrownBy(() -> ReminderTimes.parseTime("1000")).hasMessage("REMINDER_TIME_INVALID");
        assertThatThrownBy(() -> ReminderTimes.parseTime("aa:bb")).hasMessage("REMINDER_TIME_INVALID");
    }

    @Test
    void daily_next_is_today_if_still_ahead_otherwise_tomorrow() {
        Instant now = Instant.parse("2024-05-01T06:00:00Z"); // 09:00 MSK

        assertThat(ReminderTimes.next(LocalTime.of(10, 0), null, MSK, now))
                .isEqualTo(Instant.parse("2024-05-01T07:00:00Z"));
        assertThat(ReminderTimes.next(LocalTime.of(8, 0), null, MSK, now))
                .isEqualTo(Instant.parse("2024-05-02T05:00:00Z"));
    }

    @Test
    void trigger_exactly_now_moves_to_next_occurrence() {
        Instant now = Instant.parse("2024-05-01T07:00:00Z"); // 10:00 MSK

        assertThat(ReminderTimes.next(LocalTime.of(10, 0), null, MSK, now))
                .isEqualTo(Instant.parse("2024-05-02T07:00:00Z"));
    }

    @Test
    void weekly_next_lands_on_configured_day() {
        // 2024-05-01 是星期三
        Instant wed = Instant.parse("2024-05-01T06:00:00Z");
        assertThat(ReminderTimes.next(LocalTime.of(20, 0), DayOfWeek.SUNDAY, MSK, wed))
                .isEqualTo(Instant.parse("2024-05-05T17:00:00Z"));

        // 星期日 20:00 已過 → 下週日
        Instant sunLate = Instant.parse("2024-05-05T18:00:00Z");
        assertThat(ReminderTimes.next(LocalTime.of(20, 0), DayOfWeek.SUNDAY, MSK, sunLate))
                .isEqualTo(Instant.parse("2024-05-12T17:00:00Z"));
    }

    @Test
    void day_keys_round_trip() {
        assertThat(ReminderTimes.parseDay("Sun")).isEqualTo(DayOfWeek.SUNDAY);
        assertThat(ReminderTimes.dayKey(DayOfWeek.MONDAY)).isEqualTo("mon");
        assertThatThrownBy(() -> ReminderTimes.parseDay("sunday")).hasMessage("REMINDER_DAY_INVALID");
    }
}
