package com.fitcycle.backend.reminder.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fitcycle.backend.reminder.dto.NextTriggerDto;
import com.fitcycle.backend.reminder.dto.ReminderDto;
import com.fitcycle.backend.reminder.dto.SetReminderRequest;
import com.fitcycle.backend.settings.entity.UserPlanSettings;
import com.fitcycle.backend.settings.repo.UserPlanSettingsRepository;
import com.fitcycle.backend.settings.service.UserSettingsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReminderServiceTest {

    private static final Long UID = 5L;

    @Mock UserSettingsService settings;
    @Mock UserPlanSettingsRepository repo;

    private UserPlanSettings row;
    private ReminderService svc;

    @BeforeEach
    void setUp() {
        row = new UserPlanSettings();
        row.setUserId(UID);
        row.setTimezone("Europe/Moscow");

        lenient().when(settings.getOrCreate(UID)).thenReturn(row);
        lenient().when(settings.zoneOf(UID)).thenReturn(ZoneId.of("Europe/Moscow"));
        lenient().when(repo.save(any(UserPlanSettings.class))).thenAnswer(inv -> inv.getArgument(0));

        // 2024-05-01（三）09:00 MSK
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T06:00:00Z"), ZoneOffset.UTC);
        svc = new ReminderService(settings, repo, new ObjectMapper(), clock);
    }

    @Test
    void defaults_enable_only_report_types() {
        List<ReminderDto> all = svc.list(UID);

        assertThat(all).extracting(ReminderDto::type)
                .containsExactly("water", "meal", "workout", "sleep", "progress", "daily_report", "weekly_pdf");
        assertThat(all).filteredOn(ReminderDto::enabled)
                .extracting(ReminderDto::type)
                .containsExactly("daily_report", "weekly_pdf");
        assertThat(all).filteredOn(r -> r.type().equals("weekly_pdf"))
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.time()).isEqualTo("20:00");
                    assertThat(r.day()).isEqualTo("sun");
                });
    }

    @Test
    void set_then_next_triggers_are_sorted_by_time() {
        svc.set(UID, "water", new SetReminderRequest("10:00", null, null));

        List<NextTriggerDto> next = svc.nextTriggers(UID);

        assertThat(next).extracting(NextTriggerDto::type)
                .containsExactly("water", "daily_report", "weekly_pdf");
        assertThat(next.get(0).at()).isEqualTo(Instant.parse("2024-05-01T07:00:00Z"));
        assertThat(next.get(1).at()).isEqualTo(Instant.parse("2024-05-01T20:00:00Z"));
        assertThat(next.get(2).at()).isEqualTo(Instant.parse("2024-05-05T17:00:00Z"));
    }

    @Test
    void disable_keeps_time_and_drops_from_next_triggers() {
        ReminderDto off = svc.disable(UID, "daily_report");

        assertThat(off.enabled()).isFalse();
        assertThat(off.time()).isEqualTo("23:00");
        assertThat(svc.nextTriggers(UID)).extracting(NextTriggerDto::type).containsExactly("weekly_pdf");
    }

    @Test
    void weekly_day_can_be_changed() {
        ReminderDto r = svc.set(UID, "weekly_pdf", new SetReminderRequest("19:30", true, "fri"));

        assertThat(r.day()).isEqualTo("fri");
        assertThat(r.time()).isEqualTo("19:30");
    }

    @Test
    void day_on_daily_type_is_rejected() {
        assertThatThrownBy(() -> svc.set(UID, "water", new SetReminderRequest("10:00", true, "mon")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("REMINDER_DAY_NOT_SUPPORTED");
    }

    @Test
    void enabling_type_without_time_is_rejected() {
        assertThatThrownBy(() -> svc.set(UID, "sleep", new SetReminderRequest(null, true, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("REMINDER_TIME_REQUIRED");
    }

    @Test
    void unknown_type_is_rejected() {
        assertThatThrownBy(() -> svc.set(UID, "motivation", new SetReminderRequest("10:00", true, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("REMINDER_TYPE_UNKNOWN");
    }
}
