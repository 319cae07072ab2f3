package com.gantry.dispatch.api;

import com.gantry.core.admission.DegradationLevel;
import com.gantry.core.admission.LaneSnapshot;
import com.gantry.core.health.HealthCheckService;
import com.gantry.core.health.HealthStatus;
import com.gantry.core.health.OpsStatus;
import com.gantry.core.health.OpsStatusService;
import com.gantry.core.model.Lane;
import com.gantry.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest({HealthController.class, OpsController.class})
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @MockitoBean
    private OpsStatusService opsStatusService;

    @Nested
    @DisplayName("GET /api/v1/health")
    class Health {

        @Test
        void allUpReturns200() throws Exception {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("state-store", HealthStatus.Status.UP, "Backend memory", Map.of()),
                    new HealthStatus("executors", HealthStatus.Status.UP, "1 of 1 executors available",
                            Map.of("claude", "CLOSED, 0 in flight"))));

            mockMvc.perform(get("/api/v1/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("UP"))
                    .andExpect(jsonPath("$.components['state-store'].status").value("UP"))
                    .andExpect(jsonPath("$.components['state-store'].metadata").doesNotExist())
                    .andExpect(jsonPath("$.components.executors.metadata.claude").value("CLOSED, 0 in flight"));
        }

        @Test
        void degradedComponentKeeps200() throws Exception {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("state-store", HealthStatus.Status.UP, "Backend memory", Map.of()),
                    new HealthStatus("degradation", HealthStatus.Status.DEGRADED, "Failure rate high", Map.of())));

            mockMvc.perform(get("/api/v1/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("DEGRADED"));
        }

        @Test
        void downComponentReturns503() throws Exception {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("executors", HealthStatus.Status.DOWN, "No executors registered", Map.of()),
                    new HealthStatus("degradation", HealthStatus.Status.DEGRADED, "Failure rate high", Map.of())));

            mockMvc.perform(get("/api/v1/health"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.status").value("DOWN"))
                    .andExpect(jsonPath("$.components.executors.detail").value("No executors registered"));
        }
    }

    @Nested
    @DisplayName("GET /api/v1/ops")
    class Ops {

        private final List<LaneSnapshot> lanes = List.of(
                new LaneSnapshot(Lane.FASTLANE, 1, 4, 0),
                new LaneSnapshot(Lane.MAINLANE, 3, 3, 2));

        @Test
        void statusReportsLevelCountsAndLanes() throws Exception {
            when(opsStatusService.status()).thenReturn(new OpsStatus(DegradationLevel.DEGRADED, 0.4, 0.75,
                    Map.of(TaskStatus.READY, 2L, TaskStatus.IN_PROGRESS, 4L), 4, lanes, List.of()));

            mockMvc.perform(get("/api/v1/ops/status"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.degradationLevel").value("DEGRADED"))
                    .andExpect(jsonPath("$.runningJobs").value(4))
                    .andExpect(jsonPath("$.tasksByStatus.READY").value(2))
                    .andExpect(jsonPath("$.lanes", hasSize(2)))
                    .andExpect(jsonPath("$.breakers", empty()));
        }

        @Test
        void lanesListsSnapshots() throws Exception {
            when(opsStatusService.lanes()).thenReturn(lanes);

            mockMvc.perform(get("/api/v1/ops/lanes"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[1].lane").value("MAINLANE"))
                    .andExpect(jsonPath("$[1].inProgress").value(3))
                    .andExpect(jsonPath("$[1].wipLimit").value(3))
                    .andExpect(jsonPath("$[1].waiting").value(2));
        }
    }
}
