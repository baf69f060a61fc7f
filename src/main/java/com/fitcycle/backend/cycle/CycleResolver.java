package com.fitcycle.backend.cycle;

import com.fitcycle.backend.plan.model.DayType;
import com.fitcycle.backend.plan.model.PlanSnapshot;
import com.fitcycle.backend.plan.web.PlanConfigurationException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * 日期 → cycle 位置。純函式，不讀時鐘。
 * 起始日之前的日期也適用：用 floorMod，所以 cycle 兩個方向都是週期性的。
 */
@Component
public class CycleResolver {

    public static int position(LocalDate start, LocalDate target, int cycleLength) {
        if (cycleLength <= 0) {
            throw new PlanConfigurationException("CYCLE_EMPTY", "Cycle length must be > 0");
        }
        if (start == null) {
            throw new PlanConfigurationException("CYCLE_START_MISSING", "Cycle start date is not set");
        }
        if (target == null) throw new IllegalArgumentException("DATE_REQUIRED");

        long diffDays = ChronoUnit.DAYS.between(start, target);
        return (int) Math.floorMod(diffDays, (long) cycleLength);
    }

    public CyclePosition resolve(LocalDate start, LocalDate target, PlanSnapshot plan) {
        int pos = position(start, target, plan.cycleLength());
        String key = plan.cycleOrder().get(pos);
        return new CyclePosition(pos, key, dayTypeOf(plan, key));
    }

    /** 保留 key "rest" 或沒有內容的 key 都當休息日 */
    static DayType dayTypeOf(PlanSnapshot plan, String workoutKey) {
        if (PlanSnapshot.isReservedRestKey(workoutKey)) return DayType.REST;
        return plan.dayContent(workoutKey).isPresent() ? DayType.TRAIN : DayType.REST;
    }
}
