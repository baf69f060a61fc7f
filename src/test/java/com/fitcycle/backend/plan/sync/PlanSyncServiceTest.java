package com.fitcycle.backend.plan.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fitcycle.backend.plan.config.PlanProperties;
import com.fitcycle.backend.plan.entity.PlanSnapshotEntity;
import com.fitcycle.backend.plan.model.PlanSnapshot;
import com.fitcycle.backend.plan.repo.PlanSnapshotRepository;
import com.fitcycle.backend.plan.service.PlanStore;
import com.fitcycle.backend.plan.web.PlanValidationException;
import com.fitcycle.backend.plan.web.SheetFetchException;
import com.fitcycle.backend.testsupport.PlanFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlanSyncServiceTest {

    @Mock PlanSnapshotRepository repo;
    @Mock SheetCsvClient sheetClient;
    @Mock PlatformTransactionManager txManager;

    private final ObjectMapper om = new ObjectMapper();
    private PlanStore store;
    private PlanProperties props;
    private PlanSyncService sync;

    @BeforeEach
    void setUp() {
        store = new PlanStore(Clock.fixed(Instant.parse("2024-02-01T00:00:00Z"), ZoneOffset.UTC));
        props = new PlanProperties();
        props.getSheet().setId("sheet-1");
        props.getSheet().setGidPlan("0");
        props.getSheet().setGidMacros("11");
        props.getSheet().setGidCycle("22");
        sync = new PlanSyncService(store, repo, sheetClient, new PlanTableParser(), props, om, txManager);
        lenient().when(repo.findTopByOrderByVersionDescIdDesc()).thenReturn(Optional.empty());
    }

    @Test
    void sheet_sync_persists_then_installs() {
        when(sheetClient.fetchCsv("sheet-1", "0")).thenReturn("""
                workout_key,title,level,name,sets,reps,weight
                A,Upper,medium,Bench press,4,8,40 kg
                """);
        when(sheetClient.fetchCsv("sheet-1", "11")).thenReturn("""
                day_type,kcal,protein,fat,carbs
                train,2400,160,70,280
                rest,2000,150,70,190
                """);
        when(sheetClient.fetchCsv("sheet-1", "22")).thenReturn("""
                workout_key
                A
                rest
                """);

        PlanSnapshot s = sync.syncFromSheet(null);

        assertThat(s.version()).isEqualTo(1L);
        assertThat(store.current()).isSameAs(s);

        ArgumentCaptor<PlanSnapshotEntity> saved = ArgumentCaptor.forClass(PlanSnapshotEntity.class);
        verify(repo).save(saved.capture());
        assertThat(saved.getValue().getSource()).isEqualTo(PlanSyncService.SOURCE_SHEET);
        assertThat(saved.getValue().getVersion()).isEqualTo(1L);
        assertThat(saved.getValue().getPayload()).contains("Bench press");
    }

    @Test
    void invalid_sheet_row_rejects_sync_and_keeps_old_plan() {
        PlanSnapshot before = store.load(PlanFixtures.abPlan());
        when(sheetClient.fetchCsv(eq("sheet-1"), any())).thenReturn("""
                workout_key,title,level,name,sets,reps,weight
                A,Upper,brutal,Bench press,4,8,40 kg
                """);

        assertThatThrownBy(() -> sync.syncFromSheet(null)).isInstanceOf(PlanValidationException.class);

        assertThat(store.current()).isSameAs(before);
        verify(repo, never()).save(any());
    }

    @Test
    void persistence_failure_keeps_old_plan() {
        PlanSnapshot before = store.load(PlanFixtures.abPlan());
        when(repo.save(any(PlanSnapshotEntity.class))).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> sync.upload(PlanFixtures.abPlan()))
                .isInstanceOf(DataAccessResourceFailureException.class);

        assertThat(store.current()).isSameAs(before);
    }

    @Test
    void fetch_failure_propagates_without_touching_store() {
        when(sheetClient.fetchCsv(eq("sheet-1"), any())).thenThrow(new SheetFetchException(403, "SHEET_HTTP_403", null));

        assertThatThrownBy(() -> sync.syncFromSheet(new PlanSyncService.SheetSource(null, null, null, null)))
                .isInstanceOf(SheetFetchException.class);
        assertThat(store.currentIfLoaded()).isEmpty();
    }

    @Test
    void new_version_follows_highest_persisted_version() {
        PlanSnapshotEntity latest = new PlanSnapshotEntity();
        latest.setVersion(9L);
        when(repo.findTopByOrderByVersionDescIdDesc()).thenReturn(Optional.of(latest));

        PlanSnapshot s = sync.upload(PlanFixtures.abPlan());

        assertThat(s.version()).isEqualTo(10L);
    }

    @Test
    void restore_latest_installs_persisted_version() throws Exception {
        PlanSnapshotEntity latest = new PlanSnapshotEntity();
        latest.setVersion(4L);
        latest.setPayload(om.writeValueAsString(PlanFixtures.abPlan()));
        when(repo.findTopByOrderByVersionDescIdDesc()).thenReturn(Optional.of(latest));

        Optional<PlanSnapshot> restored = sync.restoreLatest();

        assertThat(restored).isPresent();
        assertThat(store.current().version()).isEqualTo(4L);
        assertThat(store.current().cycleOrder()).containsExactly("A", "rest", "B");
    }

    @Test
    void missing_sheet_id_is_bad_request() {
        props.getSheet().setId(null);

        assertThatThrownBy(() -> sync.syncFromSheet(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("SHEET_ID_REQUIRED");
        verifyNoInteractions(sheetClient);
    }
}
