package com.fitcycle.backend.plan.service;

import com.fitcycle.backend.plan.model.DayContent;
import com.fitcycle.backend.plan.model.DayType;
import com.fitcycle.backend.plan.model.ExerciseEntry;
import com.fitcycle.backend.plan.model.Level;
import com.fitcycle.backend.plan.model.MacroTarget;
import com.fitcycle.backend.plan.model.PlanDefinition;
import com.fitcycle.backend.plan.model.PlanSnapshot;
import com.fitcycle.backend.plan.web.PlanConfigurationException;
import com.fitcycle.backend.plan.web.PlanValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 目前生效的計畫版本。
 * - load：先完整驗證，通過才整份替換（all-or-nothing）
 * - 讀取端拿到的是不可變 snapshot，同一次 assemble 內不會看到半新半舊
 * - 替換計畫不會動到 progression / autoprog 資料（以 exercise_name 對應）
 */
@Slf4j
@Component
public class PlanStore {

    private final AtomicReference<PlanSnapshot> active = new AtomicReference<>();
    private final Clock clock;

    public PlanStore(Clock clock) {
        this.clock = clock;
    }

    public PlanSnapshot load(PlanDefinition definition) {
        PlanSnapshot next = prepare(definition);
        install(next);
        return next;
    }

    /** 只驗證並產生下一版 snapshot，不替換（給需要先落庫再生效的流程用） */
    public PlanSnapshot prepare(PlanDefinition definition) {
        PlanSnapshot cur = active.get();
        long nextVersion = (cur == null) ? 1L : cur.version() + 1;
        return validate(definition, nextVersion);
    }

    /** 指定版本號（從 DB 還原、或要接在已落庫的最大版本之後） */
    public PlanSnapshot prepare(PlanDefinition definition, long version) {
        if (version < 1) throw new IllegalArgumentException("PLAN_VERSION_INVALID");
        return validate(definition, version);
    }

    public long currentVersion() {
        PlanSnapshot cur = active.get();
        return cur == null ? 0L : cur.version();
    }

    public void install(PlanSnapshot snapshot) {
        if (snapshot == null) throw new IllegalArgumentException("PLAN_REQUIRED");
        active.set(snapshot);
        log.info("Plan installed: version={}, cycleLength={}, workouts={}",
                snapshot.version(), snapshot.cycleLength(), snapshot.workouts().size());
    }

    public PlanSnapshot current() {
        PlanSnapshot s = active.get();
        if (s == null) throw new PlanConfigurationException("PLAN_NOT_LOADED", "No plan has been loaded yet");
        return s;
    }

    public Optional<PlanSnapshot> currentIfLoaded() {
        return Optional.ofNullable(active.get());
    }

    public Optional<DayContent> getDayContent(String workoutKey) {
        return current().dayContent(workoutKey);
    }

    public MacroTarget getMacros(DayType dayType) {
        return getMacros(current(), dayType);
    }

    public static MacroTarget getMacros(PlanSnapshot snapshot, DayType dayType) {
        return snapshot.macrosFor(dayType).orElseThrow(() -> new PlanConfigurationException(
                "MACROS_MISSING", "Macro target missing for day type " + dayType));
    }

    PlanSnapshot validate(PlanDefinition def, long version) {
        if (def == null) throw new PlanValidationException("PLAN_REQUIRED", "Plan definition is required");

        List<String> cycle = def.cycleOrder();
        if (cycle == null || cycle.isEmpty()) {
            throw new PlanValidationException("CYCLE_EMPTY", "cycle_order must contain at least one workout key");
        }
        List<String> cleanCycle = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            String key = cycle.get(i);
            if (key == null || key.isBlank()) {
                throw new PlanValidationException("CYCLE_KEY_BLANK", "cycle_order[" + i + "] is blank");
            }
            cleanCycle.add(key.trim());
        }

        Map<String, DayContent> workouts = new LinkedHashMap<>();
        if (def.workouts() != null) {
            for (var e : def.workouts().entrySet()) {
                String key = e.getKey();
                if (key == null || key.isBlank()) {
                    throw new PlanValidationException("WORKOUT_KEY_BLANK", "workout key is blank");
                }
                DayContent content = e.getValue();
                if (content == null) {
                    throw new PlanValidationException("WORKOUT_CONTENT_MISSING", "workout " + key + " has no content");
                }
                workouts.put(key.trim(), normalize(key.trim(), content));
            }
        }

        Map<DayType, MacroTarget> macros = new EnumMap<>(DayType.class);
        if (def.macros() != null) macros.putAll(def.macros());
        for (DayType t : DayType.values()) {
            MacroTarget m = macros.get(t);
            if (m == null) {
                throw new PlanValidationException("MACROS_MISSING",
                        "macro target for day type " + t.name().toLowerCase() + " is missing");
            }
            if (m.kcal() < 0 || m.protein() < 0 || m.fat() < 0 || m.carbs() < 0) {
                throw new PlanValidationException("MACROS_INVALID", "macro values must be >= 0 for " + t);
            }
            if (m.dayType() != t) {
                macros.put(t, new MacroTarget(t, m.kcal(), m.protein(), m.fat(), m.carbs()));
            }
        }

        return new PlanSnapshot(version, cleanCycle, workouts, macros, clock.instant());
    }

    private static DayContent normalize(String key, DayContent content) {
        for (Level level : Level.values()) {
            for (ExerciseEntry ex : content.exercises(level)) {
                if (ex == null || ex.name() == null || ex.name().isBlank()) {
                    throw new PlanValidationException("EXERCISE_NAME_BLANK",
                            "workout " + key + " level " + level + " has an exercise without name");
                }
                if (ex.sets() < 0) {
                    throw new PlanValidationException("EXERCISE_SETS_INVALID",
                            "workout " + key + " exercise " + ex.name() + " has negative sets");
                }
            }
        }
        String title = (content.title() == null || content.title().isBlank()) ? key : content.title().trim();
        return new DayContent(title, content.levels());
    }
}
