package com.fitcycle.backend.reminder.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fitcycle.backend.reminder.dto.NextTriggerDto;
import com.fitcycle.backend.reminder.dto.ReminderDto;
import com.fitcycle.backend.reminder.dto.SetReminderRequest;
import com.fitcycle.backend.reminder.model.ReminderSetting;
import com.fitcycle.backend.reminder.model.ReminderTimes;
import com.fitcycle.backend.reminder.model.ReminderType;
import com.fitcycle.backend.settings.entity.UserPlanSettings;
import com.fitcycle.backend.settings.repo.UserPlanSettingsRepository;
import com.fitcycle.backend.settings.service.UserSettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 提醒設定只負責存與算下一次觸發時間，真正發送交給 bot 端。
 * daily_report / weekly_pdf 有預設值（沒設定也算啟用），其他類型要使用者自己打開。
 */
@Slf4j
@Service
public class ReminderService {

    private static final TypeReference<Map<String, ReminderSetting>> MAP_TYPE = new TypeReference<>() {};

    private final UserSettingsService settings;
    private final UserPlanSettingsRepository repo;
    private final ObjectMapper om;
    private final Clock clock;

    public ReminderService(UserSettingsService settings, UserPlanSettingsRepository repo, ObjectMapper om, Clock clock) {
        this.settings = settings;
        this.repo = repo;
        this.om = om;
        this.clock = clock;
    }

    public List<ReminderDto> list(Long userId) {
        Map<String, ReminderSetting> stored = read(settings.getOrCreate(userId));
        List<ReminderDto> out = new ArrayList<>();
        for (ReminderType t : ReminderType.values()) {
            ReminderSetting s = effective(t, stored.get(t.key()));
            out.add(new ReminderDto(t.key(), s.time(), s.enabled(), s.day()));
        }
        return out;
    }

    public ReminderDto set(Long userId, String rawType, SetReminderRequest req) {
        ReminderType type = ReminderType.parse(rawType);
        UserPlanSettings row = settings.getOrCreate(userId);
        Map<String, ReminderSetting> stored = read(row);
        ReminderSetting current = effective(type, stored.get(type.key()));

        String time = current.time();
        String day = current.day();
        boolean enabled = true;

        if (req != null) {
            if (req.time() != null) time = ReminderTimes.format(ReminderTimes.parseTime(req.time()));
            if (req.enabled() != null) enabled = req.enabled();
            if (req.day() != null) {
                if (!type.weekly()) throw new IllegalArgumentException("REMINDER_DAY_NOT_SUPPORTED");
                day = ReminderTimes.dayKey(ReminderTimes.parseDay(req.day()));
            }
        }
        if (enabled && time == null) throw new IllegalArgumentException("REMINDER_TIME_REQUIRED");

        ReminderSetting next = new ReminderSetting(time, enabled, day);
        stored.put(type.key(), next);
        write(row, stored);
        return new ReminderDto(type.key(), next.time(), next.enabled(), next.day());
    }

    /** 關掉；時間保留，之後重新打開不用再填 */
    public ReminderDto disable(Long userId, String rawType) {
        ReminderType type = ReminderType.parse(rawType);
        UserPlanSettings row = settings.getOrCreate(userId);
        Map<String, ReminderSetting> stored = read(row);
        ReminderSetting current = effective(type, stored.get(type.key()));

        ReminderSetting next = new ReminderSetting(current.time(), false, current.day());
        stored.put(type.key(), next);
        write(row, stored);
        return new ReminderDto(type.key(), next.time(), false, next.day());
    }

    public List<NextTriggerDto> nextTriggers(Long userId) {
        UserPlanSettings row = settings.getOrCreate(userId);
        ZoneId zone = settings.zoneOf(userId);
        return nextTriggers(read(row), zone, clock.instant());
    }

    /** 依觸發時間排序 */
    public static List<NextTriggerDto> nextTriggers(Map<String, ReminderSetting> stored, ZoneId zone, Instant now) {
        List<NextTriggerDto> out = new ArrayList<>();
        for (ReminderType t : ReminderType.values()) {
            ReminderSetting s = effective(t, stored.get(t.key()));
            if (!s.enabled() || s.time() == null) continue;

            LocalTime time = ReminderTimes.parseTime(s.time());
            DayOfWeek day = t.weekly() ? ReminderTimes.parseDay(s.day()) : null;
            out.add(new NextTriggerDto(t.key(), ReminderTimes.next(time, day, zone, now)));
        }
        out.sort(Comparator.comparing(NextTriggerDto::at));
        return out;
    }

    static ReminderSetting effective(ReminderType type, ReminderSetting stored) {
        String defaultDay = type.weekly() ? ReminderTimes.dayKey(type.defaultDay()) : null;
        if (stored == null) return new ReminderSetting(type.defaultTime(), type.defaultEnabled(), defaultDay);

        String time = (stored.time() != null) ? stored.time() : type.defaultTime();
        String day = type.weekly() ? (stored.day() != null ? stored.day() : defaultDay) : null;
        return new ReminderSetting(time, stored.enabled(), day);
    }

    private Map<String, ReminderSetting> read(UserPlanSettings row) {
        String json = row.getRemindersJson();
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            Map<String, ReminderSetting> m = om.readValue(json, MAP_TYPE);
            return (m == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(m);
        } catch (JsonProcessingException e) {
            log.warn("reminders_json unreadable for userId={}, falling back to defaults: {}", row.getUserId(), e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    private void write(UserPlanSettings row, Map<String, ReminderSetting> stored) {
        try {
            row.setRemindersJson(om.writeValueAsString(stored));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("REMINDERS_SERIALIZE_FAILED", e);
        }
        repo.save(row);
    }
}
