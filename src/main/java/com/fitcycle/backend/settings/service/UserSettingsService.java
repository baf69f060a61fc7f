package com.fitcycle.backend.settings.service;

import com.fitcycle.backend.settings.dto.SettingsDto;
import com.fitcycle.backend.settings.entity.UserPlanSettings;
import com.fitcycle.backend.settings.repo.UserPlanSettingsRepository;
import com.fitcycle.backend.users.config.UserProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Locale;

/**
 * 每位使用者的 cycle 起始日與時區。
 * 第一次讀取時建立：起始日 = 使用者當地的「今天」（之後只有 setCycleStart 會改）。
 */
@Slf4j
@Service
public class UserSettingsService {

    private final UserPlanSettingsRepository repo;
    private final UserProperties props;
    private final Clock clock;

    public UserSettingsService(UserPlanSettingsRepository repo, UserProperties props, Clock clock) {
        this.repo = repo;
        this.props = props;
        this.clock = clock;
    }

    public UserPlanSettings getOrCreate(Long userId) {
        if (userId == null) throw new IllegalArgumentException("USER_ID_REQUIRED");
        return repo.findById(userId).orElseGet(() -> create(userId));
    }

    private UserPlanSettings create(Long userId) {
        ZoneId zone = defaultZone();
        UserPlanSettings s = new UserPlanSettings();
        s.setUserId(userId);
        s.setTimezone(zone.getId());
        s.setCycleStartDate(LocalDate.now(clock.withZone(zone)));
        try {
            return repo.saveAndFlush(s);
        } catch (DataIntegrityViolationException race) {
            return repo.findById(userId).orElseThrow(() -> race);
        }
    }

    public ZoneId zoneOf(Long userId) {
        return repo.findById(userId)
                .map(s -> nullSafeZone(s.getTimezone()))
                .orElseGet(this::defaultZone);
    }

    /** 時鐘只在這裡與排程讀；核心邏輯一律吃外部傳入的日期 */
    public LocalDate today(Long userId) {
        return LocalDate.now(clock.withZone(zoneOf(userId)));
    }

    public SettingsDto view(Long userId) {
        UserPlanSettings s = getOrCreate(userId);
        ZoneId zone = nullSafeZone(s.getTimezone());
        return new SettingsDto(s.getCycleStartDate(), zone.getId(), LocalDate.now(clock.withZone(zone)));
    }

    public SettingsDto setCycleStart(Long userId, String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("DATE_REQUIRED");
        UserPlanSettings s = getOrCreate(userId);
        LocalDate start = "today".equals(raw.trim().toLowerCase(Locale.ROOT))
                ? LocalDate.now(clock.withZone(nullSafeZone(s.getTimezone())))
                : LocalDate.parse(raw.trim()); // DateTimeParseException → 400

        s.setCycleStartDate(start);
        repo.save(s);
        log.info("Cycle start changed: user={}, start={}", userId, start);
        return view(userId);
    }

    public SettingsDto setTimezone(Long userId, String tz) {
        ZoneId zone = ZoneId.of(tz.trim()); // DateTimeException → 400
        UserPlanSettings s = getOrCreate(userId);
        s.setTimezone(zone.getId());
        repo.save(s);
        return view(userId);
    }

    private ZoneId defaultZone() {
        return nullSafeZone(props.getDefaultTimezone());
    }

    private static ZoneId nullSafeZone(String tz) {
        try { return (tz == null || tz.isBlank()) ? ZoneId.of("UTC") : ZoneId.of(tz); }
        catch (Exception e) { return ZoneId.of("UTC"); }
    }
}
