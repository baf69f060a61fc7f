package com.fitcycle.backend.daystatus.service;

import com.fitcycle.backend.daystatus.dto.AttendanceDto;
import com.fitcycle.backend.daystatus.dto.DayStatusDto;
import com.fitcycle.backend.daystatus.dto.WeeklyStatsDto;
import com.fitcycle.backend.daystatus.model.AttendanceMark;
import com.fitcycle.backend.daystatus.model.DayStatus;
import com.fitcycle.backend.daystatus.repo.CalendarDayRepository;
import com.fitcycle.backend.plan.model.DayType;
import com.fitcycle.backend.progress.entity.BodyProgressLog;
import com.fitcycle.backend.progress.repo.BodyProgressLogRepo;
import com.fitcycle.backend.testsupport.BaseSpringTest;
import com.fitcycle.backend.testsupport.PlanFixtures;
import com.fitcycle.backend.today.dto.DayPlanView;
import com.fitcycle.backend.today.service.DailyPlanAssembler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@SpringBootTest
@TestPropertySource(properties =
        "spring.datasource.url=jdbc:h2:mem:fitcycle_days;MODE=MySQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE")
class DayStatusServiceTest extends BaseSpringTest {

    private static final Long UID = 41L;
    // 偶數日 = 訓練日，奇數日 = 休息日
    private static final LocalDate TRAIN_1 = LocalDate.of(2024, 6, 10);
    private static final LocalDate REST_1 = LocalDate.of(2024, 6, 11);
    private static final LocalDate TRAIN_2 = LocalDate.of(2024, 6, 12);

    @Autowired DayStatusService svc;
    @Autowired CalendarDayRepository days;
    @Autowired BodyProgressLogRepo progress;

    @MockitoBean DailyPlanAssembler assembler;

    @BeforeEach
    void setUp() {
        days.deleteAll();
        progress.deleteAll();
        when(assembler.assemble(eq(UID), any())).thenAnswer(inv -> view(inv.getArgument(1)));
    }

    private static DayPlanView view(LocalDate d) {
        if (d.getDayOfMonth() % 2 == 0) {
            return new DayPlanView(d, 0, "A", DayType.TRAIN, PlanFixtures.TRAIN_MACROS, null, null, 1L);
        }
        return new DayPlanView(d, 1, "rest", DayType.REST, PlanFixtures.REST_MACROS, null, null, 1L);
    }

    private static BodyProgressLog weighIn(LocalDate d, String weight) {
        BodyProgressLog p = new BodyProgressLog();
        p.setUserId(UID);
        p.setLogDate(d);
        p.setWeight(new BigDecimal(weight));
        p.setWaist(new BigDecimal("90.0"));
        p.setBelly(new BigDecimal("95.0"));
        p.setBiceps(new BigDecimal("36.0"));
        p.setChest(new BigDecimal("104.0"));
        return p;
    }

    @Test
    void first_read_snapshots_assembled_plan_as_planned() {
        DayStatusDto d = svc.day(UID, TRAIN_1, TRAIN_1);

        assertThat(d.status()).isEqualTo(DayStatus.PLANNED);
        assertThat(d.mark()).isEqualTo(AttendanceMark.PLANNED);
        assertThat(d.dayType()).isEqualTo(DayType.TRAIN);
        assertThat(d.workoutKey()).isEqualTo("A");
        assertThat(d.macros().kcal()).isEqualTo(2400);

        // 第二次讀取用既有那筆，不再組計畫
        svc.day(UID, TRAIN_1, TRAIN_1);
        verify(assembler, times(1)).assemble(UID, TRAIN_1);
        assertThat(days.findAll()).hasSize(1);
    }

    @Test
    void planned_rest_day_is_shown_as_rest() {
        DayStatusDto d = svc.day(UID, REST_1, REST_1);

        assertThat(d.status()).isEqualTo(DayStatus.PLANNED);
        assertThat(d.mark()).isEqualTo(AttendanceMark.REST);
    }

    @Test
    void mark_done_then_skip_overwrites_status() {
        assertThat(svc.markDone(UID, TRAIN_1, TRAIN_1).status()).isEqualTo(DayStatus.DONE);
        assertThat(svc.markSkipped(UID, TRAIN_1, TRAIN_1).status()).isEqualTo(DayStatus.SKIPPED);

        assertThat(days.findByUserIdAndDayDate(UID, TRAIN_1).orElseThrow().getStatus())
                .isEqualTo(DayStatus.SKIPPED);
    }

    @Test
    void rest_day_can_be_marked_done() {
        DayStatusDto d = svc.markDone(UID, REST_1, REST_1);

        assertThat(d.dayType()).isEqualTo(DayType.REST);
        assertThat(d.mark()).isEqualTo(AttendanceMark.DONE);
    }

    @Test
    void future_day_cannot_be_marked() {
        assertThatThrownBy(() -> svc.markDone(UID, TRAIN_2, TRAIN_1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("DAY_IN_FUTURE");
        assertThat(days.findAll()).isEmpty();
    }

    @Test
    void missed_training_days_become_skipped_rest_days_stay_planned() {
        svc.day(UID, TRAIN_1, TRAIN_1);
        svc.day(UID, REST_1, REST_1);

        AttendanceDto a = svc.attendance(UID, TRAIN_1, TRAIN_2, TRAIN_2);

        assertThat(a.days()).extracting(DayStatusDto::date).containsExactly(TRAIN_1, REST_1);
        assertThat(a.days().get(0).status()).isEqualTo(DayStatus.SKIPPED);
        assertThat(a.days().get(1).status()).isEqualTo(DayStatus.PLANNED);
        assertThat(a.counts())
                .containsEntry(AttendanceMark.SKIPPED, 1L)
                .containsEntry(AttendanceMark.REST, 1L)
                .containsEntry(AttendanceMark.DONE, 0L)
                .containsEntry(AttendanceMark.PLANNED, 0L);
    }

    @Test
    void today_is_never_auto_skipped() {
        svc.day(UID, TRAIN_2, TRAIN_2);

        AttendanceDto a = svc.attendance(UID, TRAIN_2, TRAIN_2, TRAIN_2);

        assertThat(a.days().get(0).status()).isEqualTo(DayStatus.PLANNED);
    }

    @Test
    void comment_is_trimmed_and_dash_or_blank_clears_it() {
        assertThat(svc.comment(UID, TRAIN_1, "  тяжело, но ок ", TRAIN_1).note()).isEqualTo("тяжело, но ок");
        assertThat(svc.comment(UID, TRAIN_1, "-", TRAIN_1).note()).isNull();

        svc.comment(UID, TRAIN_1, "again", TRAIN_1);
        assertThat(svc.comment(UID, TRAIN_1, "   ", TRAIN_1).note()).isNull();
    }

    @Test
    void attendance_range_is_bounded() {
        assertThatThrownBy(() -> svc.attendance(UID, TRAIN_1, TRAIN_1.plusDays(62), TRAIN_1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("DATE_RANGE_TOO_LARGE");
        assertThatThrownBy(() -> svc.attendance(UID, TRAIN_2, TRAIN_1, TRAIN_1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("DATE_RANGE_INVALID");
    }

    @Test
    void weekly_stats_count_statuses_average_macros_and_weight_change() {
        LocalDate today = TRAIN_2;
        svc.markDone(UID, TRAIN_1, today);
        svc.markDone(UID, REST_1, today);
        svc.day(UID, today, today);
        // 7 天區間外的紀錄不算
        svc.markDone(UID, today.minusDays(8), today);

        progress.save(weighIn(today.minusDays(5), "82.4"));
        progress.save(weighIn(today.minusDays(1), "81.9"));
        progress.save(weighIn(today, "81.6"));

        WeeklyStatsDto w = svc.weeklyStats(UID, today);

        assertThat(w.from()).isEqualTo(today.minusDays(6));
        assertThat(w.to()).isEqualTo(today);
        assertThat(w.trainDone()).isEqualTo(1);
        assertThat(w.trainSkipped()).isZero();
        assertThat(w.restDone()).isEqualTo(1);
        assertThat(w.recordedDays()).isEqualTo(3);
        // (2400 + 2000 + 2400) / 3
        assertThat(w.averages().kcal()).isEqualTo(2266);
        assertThat(w.weightChange()).isEqualByComparingTo("-0.8");
    }

    @Test
    void weekly_weight_change_needs_two_weigh_ins() {
        progress.save(weighIn(TRAIN_2, "80.0"));

        WeeklyStatsDto w = svc.weeklyStats(UID, TRAIN_2);

        assertThat(w.weightChange()).isNull();
        assertThat(w.recordedDays()).isZero();
        assertThat(w.averages().kcal()).isZero();
    }
}
