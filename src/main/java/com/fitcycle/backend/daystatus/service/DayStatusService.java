package com.fitcycle.backend.daystatus.service;

import com.fitcycle.backend.daystatus.dto.AttendanceDto;
import com.fitcycle.backend.daystatus.dto.DayStatusDto;
import com.fitcycle.backend.daystatus.dto.WeeklyStatsDto;
import com.fitcycle.backend.daystatus.entity.CalendarDay;
import com.fitcycle.backend.daystatus.model.AttendanceMark;
import com.fitcycle.backend.daystatus.model.DayStatus;
import com.fitcycle.backend.daystatus.repo.CalendarDayRepository;
import com.fitcycle.backend.plan.model.DayType;
import com.fitcycle.backend.plan.model.MacroTarget;
import com.fitcycle.backend.progress.entity.BodyProgressLog;
import com.fitcycle.backend.progress.repo.BodyProgressLogRepo;
import com.fitcycle.backend.today.dto.DayPlanView;
import com.fitcycle.backend.today.service.DailyPlanAssembler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 每位使用者每一天一筆 calendar_days：完成 / 跳過 / 備註、出勤表與 7 天統計。
 * 任何讀寫前先把「今天以前還沒結案的訓練日」標成 SKIPPED。
 * today 一律由呼叫端以使用者時區算好傳進來。
 */
@Slf4j
@Service
public class DayStatusService {

    public static final int NOTE_MAX = 500;
    static final int MAX_RANGE_DAYS = 62;
    static final int WEEK_DAYS = 7;

    private final CalendarDayRepository repo;
    private final DailyPlanAssembler assembler;
    private final BodyProgressLogRepo progress;

    public DayStatusService(CalendarDayRepository repo, DailyPlanAssembler assembler, BodyProgressLogRepo progress) {
        this.repo = repo;
        this.assembler = assembler;
        this.progress = progress;
    }

    public DayStatusDto day(Long userId, LocalDate date, LocalDate today) {
        if (date == null) throw new IllegalArgumentException("DATE_REQUIRED");
        closeMissedDays(userId, today);
        return DayStatusDto.of(ensure(userId, date));
    }

    public DayStatusDto markDone(Long userId, LocalDate date, LocalDate today) {
        return changeStatus(userId, date, today, DayStatus.DONE);
    }

    public DayStatusDto markSkipped(Long userId, LocalDate date, LocalDate today) {
        return changeStatus(userId, date, today, DayStatus.SKIPPED);
    }

    public DayStatusDto comment(Long userId, LocalDate date, String note, LocalDate today) {
        requireNotFuture(date, today);
        closeMissedDays(userId, today);

        CalendarDay d = ensure(userId, date);
        d.setNote(cleanNote(note));
        return DayStatusDto.of(repo.save(d));
    }

    public AttendanceDto attendance(Long userId, LocalDate from, LocalDate to, LocalDate today) {
        if (from == null || to == null) throw new IllegalArgumentException("DATE_RANGE_REQUIRED");
        if (to.isBefore(from)) throw new IllegalArgumentException("DATE_RANGE_INVALID");
        if (ChronoUnit.DAYS.between(from, to) + 1 > MAX_RANGE_DAYS) {
            throw new IllegalArgumentException("DATE_RANGE_TOO_LARGE");
        }
        closeMissedDays(userId, today);

        List<DayStatusDto> days = repo.findByUserIdAndDayDateBetweenOrderByDayDateAsc(userId, from, to).stream()
                .map(DayStatusDto::of)
                .toList();

        Map<AttendanceMark, Long> counts = new EnumMap<>(AttendanceMark.class);
        for (AttendanceMark m : AttendanceMark.values()) counts.put(m, 0L);
        for (DayStatusDto d : days) counts.merge(d.mark(), 1L, Long::sum);

        return new AttendanceDto(from, to, counts, days);
    }

    /** 今天往回共 7 天（含今天） */
    public WeeklyStatsDto weeklyStats(Long userId, LocalDate today) {
        if (today == null) throw new IllegalArgumentException("DATE_REQUIRED");
        LocalDate from = today.minusDays(WEEK_DAYS - 1);
        closeMissedDays(userId, today);

        List<CalendarDay> rows = repo.findByUserIdAndDayDateBetweenOrderByDayDateAsc(userId, from, today);

        long trainDone = count(rows, DayType.TRAIN, DayStatus.DONE);
        long trainSkipped = count(rows, DayType.TRAIN, DayStatus.SKIPPED);
        long restDone = count(rows, DayType.REST, DayStatus.DONE);

        return new WeeklyStatsDto(from, today, trainDone, trainSkipped, restDone, rows.size(),
                averages(rows), weightChange(userId, from, today));
    }

    // ===== internal =====

    private DayStatusDto changeStatus(Long userId, LocalDate date, LocalDate today, DayStatus status) {
        requireNotFuture(date, today);
        closeMissedDays(userId, today);

        CalendarDay d = ensure(userId, date);
        DayStatus before = d.getStatus();
        d.setStatus(status);
        CalendarDay saved = repo.save(d);
        log.info("Day status changed: user={}, date={}, {} -> {}", userId, date, before, status);
        return DayStatusDto.of(saved);
    }

    /** 沒有紀錄就用當下組出的計畫建一筆 PLANNED */
    CalendarDay ensure(Long userId, LocalDate date) {
        return repo.findByUserIdAndDayDate(userId, date).orElseGet(() -> create(userId, date));
    }

    private CalendarDay create(Long userId, LocalDate date) {
        DayPlanView view = assembler.assemble(userId, date);
        MacroTarget m = view.macros();

        CalendarDay d = new CalendarDay();
        d.setUserId(userId);
        d.setDayDate(date);
        d.setDayType(view.dayType());
        d.setWorkoutKey(view.workoutKey());
        d.setStatus(DayStatus.PLANNED);
        if (m != null) {
            d.setKcal(m.kcal());
            d.setProtein(m.protein());
            d.setFat(m.fat());
            d.setCarbs(m.carbs());
        }
        try {
            return repo.saveAndFlush(d);
        } catch (DataIntegrityViolationException race) {
            return repo.findByUserIdAndDayDate(userId, date).orElseThrow(() -> race);
        }
    }

    void closeMissedDays(Long userId, LocalDate today) {
        if (userId == null) throw new IllegalArgumentException("USER_ID_REQUIRED");
        if (today == null) throw new IllegalArgumentException("DATE_REQUIRED");
        int n = repo.transitionBefore(userId, today, DayType.TRAIN,
                DayStatus.PLANNED, DayStatus.SKIPPED, Instant.now());
        if (n > 0) log.info("Missed training days marked skipped: user={}, count={}", userId, n);
    }

    private static void requireNotFuture(LocalDate date, LocalDate today) {
        if (date == null) throw new IllegalArgumentException("DATE_REQUIRED");
        if (today != null && date.isAfter(today)) throw new IllegalArgumentException("DAY_IN_FUTURE");
    }

    private static long count(List<CalendarDay> rows, DayType type, DayStatus status) {
        return rows.stream().filter(d -> d.getDayType() == type && d.getStatus() == status).count();
    }

    private static WeeklyStatsDto.MacroAverages averages(List<CalendarDay> rows) {
        if (rows.isEmpty()) return new WeeklyStatsDto.MacroAverages(0, 0, 0, 0);
        int n = rows.size();
        return new WeeklyStatsDto.MacroAverages(
                rows.stream().mapToInt(CalendarDay::getKcal).sum() / n,
                rows.stream().mapToInt(CalendarDay::getProtein).sum() / n,
                rows.stream().mapToInt(CalendarDay::getFat).sum() / n,
                rows.stream().mapToInt(CalendarDay::getCarbs).sum() / n);
    }

    private BigDecimal weightChange(Long userId, LocalDate from, LocalDate to) {
        List<BodyProgressLog> logs = progress.findInRange(userId, from, to);
        if (logs.size() < 2) return null;
        return logs.get(logs.size() - 1).getWeight().subtract(logs.get(0).getWeight());
    }

    private static String cleanNote(String note) {
        if (note == null) return null;
        String t = note.trim();
        if (t.isEmpty() || "-".equals(t)) return null;
        if (t.length() > NOTE_MAX) throw new IllegalArgumentException("NOTE_TOO_LONG");
        return t;
    }
}
