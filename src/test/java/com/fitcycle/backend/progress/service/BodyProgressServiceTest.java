package com.fitcycle.backend.progress.service;

import com.fitcycle.backend.progress.dto.AddProgressRequest;
import com.fitcycle.backend.progress.dto.ProgressItemDto;
import com.fitcycle.backend.progress.dto.UpdateProgressRequest;
import com.fitcycle.backend.progress.entity.BodyProgressLog;
import com.fitcycle.backend.progress.repo.BodyProgressLogRepo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BodyProgressServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 5, 1);

    private static BodyProgressLog existing() {
        BodyProgressLog p = new BodyProgressLog();
        p.setId(10L);
        p.setUserId(1L);
        p.setLogDate(LocalDate.of(2024, 4, 20));
        p.setWeight(new BigDecimal("82.0"));
        p.setWaist(new BigDecimal("90.0"));
        p.setBelly(new BigDecimal("95.0"));
        p.setBiceps(new BigDecimal("36.0"));
        p.setChest(new BigDecimal("104.0"));
        p.setNote("before cut");
        return p;
    }

    @Test
    void add_defaults_log_date_to_today_and_rounds_to_one_decimal() {
        BodyProgressLogRepo repo = mock(BodyProgressLogRepo.class);
        when(repo.save(any(BodyProgressLog.class))).thenAnswer(inv -> inv.getArgument(0));
        BodyProgressService svc = new BodyProgressService(repo);

        svc.add(1L, new AddProgressRequest(null,
                new BigDecimal("81.46"), new BigDecimal("89"), new BigDecimal("94"),
                new BigDecimal("36.5"), new BigDecimal("103"), "  week 2  "), TODAY);

        ArgumentCaptor<BodyProgressLog> captor = ArgumentCaptor.forClass(BodyProgressLog.class);
        verify(repo).save(captor.capture());
        BodyProgressLog saved = captor.getValue();

        assertThat(saved.getUserId()).isEqualTo(1L);
        assertThat(saved.getLogDate()).isEqualTo(TODAY);
        assertThat(saved.getWeight()).isEqualByComparingTo("81.5");
        assertThat(saved.getNote()).isEqualTo("week 2");
    }

    @Test
    void add_rejects_non_positive_measurement() {
        BodyProgressLogRepo repo = mock(BodyProgressLogRepo.class);
        BodyProgressService svc = new BodyProgressService(repo);

        assertThatThrownBy(() -> svc.add(1L, new AddProgressRequest(TODAY,
                new BigDecimal("80"), BigDecimal.ZERO, new BigDecimal("94"),
                new BigDecimal("36"), new BigDecimal("103"), null), TODAY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("WAIST_INVALID");
        verify(repo, never()).save(any());
    }

    @Test
    void partial_update_changes_only_given_fields() {
        BodyProgressLogRepo repo = mock(BodyProgressLogRepo.class);
        when(repo.findByIdAndUserId(10L, 1L)).thenReturn(Optional.of(existing()));
        when(repo.save(any(BodyProgressLog.class))).thenAnswer(inv -> inv.getArgument(0));
        BodyProgressService svc = new BodyProgressService(repo);

        ProgressItemDto dto = svc.update(1L, 10L,
                new UpdateProgressRequest(null, null, new BigDecimal("88.0"), null, null, null, null));

        assertThat(dto.waist()).isEqualByComparingTo("88.0");
        assertThat(dto.weight()).isEqualByComparingTo("82.0");
        assertThat(dto.logDate()).isEqualTo(LocalDate.of(2024, 4, 20));
        assertThat(dto.note()).isEqualTo("before cut");
    }

    @Test
    void update_of_other_users_row_is_not_found() {
        BodyProgressLogRepo repo = mock(BodyProgressLogRepo.class);
        when(repo.findByIdAndUserId(10L, 2L)).thenReturn(Optional.empty());
        BodyProgressService svc = new BodyProgressService(repo);

        assertThatThrownBy(() -> svc.update(2L, 10L, new UpdateProgressRequest(null, null, null, null, null, null, null)))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessage("PROGRESS_NOT_FOUND");
    }

    @Test
    void latest_asks_repo_for_fifty_rows() {
        BodyProgressLogRepo repo = mock(BodyProgressLogRepo.class);
        when(repo.findLatest(eq(1L), any(Pageable.class))).thenReturn(List.of(existing()));
        BodyProgressService svc = new BodyProgressService(repo);

        assertThat(svc.latest(1L)).hasSize(1);

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(repo).findLatest(eq(1L), page.capture());
        assertThat(page.getValue().getPageSize()).isEqualTo(50);
    }
}
