package com.fitcycle.backend.autoprog.job;

import com.fitcycle.backend.autoprog.config.AutoprogProperties;
import com.fitcycle.backend.autoprog.model.AutoprogRunResult;
import com.fitcycle.backend.autoprog.model.RuleOutcome;
import com.fitcycle.backend.autoprog.repo.AutoprogRuleRepository;
import com.fitcycle.backend.autoprog.service.AutoprogressionEngine;
import com.fitcycle.backend.settings.service.UserSettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

// 每天 06:00（app.autoprog.zone）觸發；只掃有規則的使用者。
// 每位使用者的 today 依他自己的時區算，engine 內以 last_applied_date 擋重複，重跑安全。
@Slf4j
@Component
public class AutoprogressionJob {

    private final AutoprogRuleRepository rules;
    private final AutoprogressionEngine engine;
    private final UserSettingsService settings;
    private final AutoprogProperties props;
    private final Clock clock;

    public AutoprogressionJob(
            AutoprogRuleRepository rules,
            AutoprogressionEngine engine,
            UserSettingsService settings,
            AutoprogProperties props,
            Clock clock
    ) {
        this.rules = rules;
        this.engine = engine;
        this.settings = settings;
        this.props = props;
        this.clock = clock;
    }

    @Scheduled(cron = "${app.autoprog.cron:0 0 6 * * *}", zone = "${app.autoprog.zone:Europe/Moscow}")
    @Async("autoprogExecutor")
    public void run() {
        if (!props.isEnabled()) {
            log.debug("Autoprogression job disabled");
            return;
        }
        runAll();
    }

    /** 回傳處理的使用者數 */
    public int runAll() {
        int pageSize = Math.max(1, props.getPageSize());
        int page = 0;
        int users = 0;
        int applied = 0;
        int failedUsers = 0;

        while (true) {
            Page<Long> pg = rules.findDistinctUserIds(PageRequest.of(page, pageSize));
            if (pg.isEmpty()) break;

            for (Long uid : pg) {
                users++;
                try {
                    ZoneId zone = settings.zoneOf(uid);
                    LocalDate today = LocalDate.now(clock.withZone(zone));
                    AutoprogRunResult r = engine.runOnce(uid, today);
                    applied += r.count(RuleOutcome.APPLIED);
                } catch (RuntimeException ex) {
                    failedUsers++;
                    log.warn("Autoprogression failed for user={}: {}", uid, ex.toString());
                }
            }

            if (!pg.hasNext()) break;
            page++;
        }
        log.info("AutoprogressionJob finished: users={}, applied={}, failedUsers={}", users, applied, failedUsers);
        return users;
    }
}
