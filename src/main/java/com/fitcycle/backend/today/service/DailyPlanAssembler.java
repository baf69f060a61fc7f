package com.fitcycle.backend.today.service;

import com.fitcycle.backend.cycle.CyclePosition;
import com.fitcycle.backend.cycle.CycleResolver;
import com.fitcycle.backend.plan.model.DayContent;
import com.fitcycle.backend.plan.model.DayType;
import com.fitcycle.backend.plan.model.Level;
import com.fitcycle.backend.plan.model.PlanSnapshot;
import com.fitcycle.backend.plan.service.PlanStore;
import com.fitcycle.backend.progression.service.OverlaidExercise;
import com.fitcycle.backend.progression.service.ProgressionLedger;
import com.fitcycle.backend.settings.entity.UserPlanSettings;
import com.fitcycle.backend.settings.service.UserSettingsService;
import com.fitcycle.backend.today.dto.DayPlanView;
import com.fitcycle.backend.today.dto.WorkoutView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 「某天的計畫」唯一讀取路徑：CycleResolver → PlanStore → ProgressionLedger。
 * 過去的日期也用「現在」生效的 cycle 重新解析，不凍結歷史。
 */
@Slf4j
@Service
public class DailyPlanAssembler {

    public static final String WARN_CONTENT_MISSING = "WORKOUT_CONTENT_MISSING";
    static final int MAX_RANGE_DAYS = 62;

    private final PlanStore planStore;
    private final CycleResolver resolver;
    private final ProgressionLedger ledger;
    private final UserSettingsService settings;

    public DailyPlanAssembler(PlanStore planStore, CycleResolver resolver,
                              ProgressionLedger ledger, UserSettingsService settings) {
        this.planStore = planStore;
        this.resolver = resolver;
        this.ledger = ledger;
        this.settings = settings;
    }

    public DayPlanView assemble(Long userId, LocalDate date) {
        PlanSnapshot plan = planStore.current();
        UserPlanSettings s = settings.getOrCreate(userId);
        return assemble(userId, date, plan, s.getCycleStartDate());
    }

    /** 月曆用：整段日期用同一份 snapshot 解析 */
    public List<DayPlanView> assembleRange(Long userId, LocalDate from, LocalDate to) {
        if (from == null || to == null) throw new IllegalArgumentException("DATE_RANGE_REQUIRED");
        if (to.isBefore(from)) throw new IllegalArgumentException("DATE_RANGE_INVALID");
        if (ChronoUnit.DAYS.between(from, to) + 1 > MAX_RANGE_DAYS) {
            throw new IllegalArgumentException("DATE_RANGE_TOO_LARGE");
        }

        PlanSnapshot plan = planStore.current();
        LocalDate start = settings.getOrCreate(userId).getCycleStartDate();

        List<DayPlanView> out = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            out.add(assemble(userId, d, plan, start));
        }
        return out;
    }

    DayPlanView assemble(Long userId, LocalDate date, PlanSnapshot plan, LocalDate cycleStart) {
        CyclePosition pos = resolver.resolve(cycleStart, date, plan);

        if (pos.dayType() == DayType.REST) {
            String warning = null;
            if (!PlanSnapshot.isReservedRestKey(pos.workoutKey())) {
                // 不是保留的 rest key 卻沒有內容：當休息日，但標記出來
                warning = WARN_CONTENT_MISSING;
                log.warn("Workout content missing: key={}, date={}, planVersion={}",
                        pos.workoutKey(), date, plan.version());
            }
            return new DayPlanView(date, pos.position(), pos.workoutKey(), DayType.REST,
                    PlanStore.getMacros(plan, DayType.REST), null, warning, plan.version());
        }

        Optional<DayContent> content = plan.dayContent(pos.workoutKey());
        if (content.isEmpty()) {
            return new DayPlanView(date, pos.position(), pos.workoutKey(), DayType.REST,
                    PlanStore.getMacros(plan, DayType.REST), null, WARN_CONTENT_MISSING, plan.version());
        }

        Map<Level, List<OverlaidExercise>> levels = new EnumMap<>(Level.class);
        for (Level level : Level.values()) {
            levels.put(level, ledger.overlay(userId, content.get().exercises(level)));
        }

        return new DayPlanView(date, pos.position(), pos.workoutKey(), DayType.TRAIN,
                PlanStore.getMacros(plan, DayType.TRAIN),
                new WorkoutView(content.get().title(), levels),
                null, plan.version());
    }
}
