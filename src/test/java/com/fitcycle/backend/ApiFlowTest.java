package com.fitcycle.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fitcycle.backend.testsupport.BaseSpringTest;
import com.fitcycle.backend.testsupport.InitDataSigner;
import com.fitcycle.backend.testsupport.PlanFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class ApiFlowTest extends BaseSpringTest {

    private static final String BOT_TOKEN = "test-token";
    private static final long ADMIN_TG_ID = 900001L;

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;

    private static String initData(long tgId) {
        return InitDataSigner.sign(BOT_TOKEN, tgId, "Tester", Instant.now().getEpochSecond());
    }

    @Test
    void health_is_public() throws Exception {
        mvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void plan_requires_init_data() throws Exception {
        mvc.perform(get("/api/v1/plan/today"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    void forged_init_data_is_rejected() throws Exception {
        String forged = InitDataSigner.sign("other-token", 555L, "Mallory", Instant.now().getEpochSecond());

        mvc.perform(get("/api/v1/plan/today").header("X-Tg-Init-Data", forged))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("INIT_DATA_SIGNATURE_INVALID"));
    }

    @Test
    void first_day_of_cycle_is_position_zero() throws Exception {
        mvc.perform(get("/api/v1/plan/today").header("X-Tg-Init-Data", initData(100200L)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.position").value(0))
                .andExpect(jsonPath("$.planVersion").isNumber())
                .andExpect(jsonPath("$.macros").exists());
    }

    @Test
    void plan_upload_is_admin_only_and_bumps_version() throws Exception {
        String body = om.writeValueAsString(PlanFixtures.abPlan());

        mvc.perform(put("/api/v1/admin/plan")
                        .header("X-Tg-Init-Data", initData(100300L))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("ADMIN_REQUIRED"));

        String before = mvc.perform(get("/api/v1/admin/plan").header("X-Tg-Init-Data", initData(ADMIN_TG_ID)))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        long versionBefore = om.readTree(before).get("version").asLong();

        String after = mvc.perform(put("/api/v1/admin/plan")
                        .header("X-Tg-Init-Data", initData(ADMIN_TG_ID))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode uploaded = om.readTree(after);

        assertThat(uploaded.get("version").asLong()).isGreaterThan(versionBefore);
        assertThat(uploaded.get("cycleOrder")).hasSize(3);
    }

    @Test
    void invalid_plan_upload_is_422_and_keeps_current_plan() throws Exception {
        String before = mvc.perform(get("/api/v1/admin/plan").header("X-Tg-Init-Data", initData(ADMIN_TG_ID)))
                .andReturn().getResponse().getContentAsString();

        mvc.perform(put("/api/v1/admin/plan")
                        .header("X-Tg-Init-Data", initData(ADMIN_TG_ID))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cycleOrder\":[],\"workouts\":{},\"macros\":{}}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.requestId").exists());

        String after = mvc.perform(get("/api/v1/admin/plan").header("X-Tg-Init-Data", initData(ADMIN_TG_ID)))
                .andReturn().getResponse().getContentAsString();
        assertThat(om.readTree(after).get("version")).isEqualTo(om.readTree(before).get("version"));
    }

    @Test
    void day_can_be_marked_done_and_shows_up_in_weekly_stats() throws Exception {
        String init = initData(100500L);

        String today = mvc.perform(get("/api/v1/days/today").header("X-Tg-Init-Data", init))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PLANNED"))
                .andReturn().getResponse().getContentAsString();
        String date = om.readTree(today).get("date").asText();

        mvc.perform(post("/api/v1/days/" + date + "/done").header("X-Tg-Init-Data", init))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DONE"));

        mvc.perform(put("/api/v1/days/" + date + "/comment")
                        .header("X-Tg-Init-Data", init)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"note\":\"legs sore\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.note").value("legs sore"));

        mvc.perform(get("/api/v1/days/stats/week").header("X-Tg-Init-Data", init))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.to").value(date))
                .andExpect(jsonPath("$.recordedDays").value(1));
    }

    @Test
    void med_log_is_listed_for_its_owner_only() throws Exception {
        mvc.perform(post("/api/v1/meds")
                        .header("X-Tg-Init-Data", initData(100600L))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Vitamin D\",\"amountMg\":0.05}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Vitamin D"));

        mvc.perform(get("/api/v1/meds").header("X-Tg-Init-Data", initData(100600L)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
        mvc.perform(get("/api/v1/meds").header("X-Tg-Init-Data", initData(100700L)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }
}
