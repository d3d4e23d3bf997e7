package com.auditq.api;

import com.auditq.AuditQNotFoundException;
import com.auditq.ResourceAccessPolicy;
import com.auditq.admission.QueueFullException;
import com.auditq.monitoring.MonitoringConfig;
import com.auditq.monitoring.MonitoringConfigDefinition;
import com.auditq.monitoring.MonitoringRun;
import com.auditq.monitoring.RecurringMonitor;
import com.auditq.monitoring.RunTrigger;
import com.auditq.monitoring.ScheduleInterval;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MonitoringControllerTest {

    private RecurringMonitor recurringMonitor;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        recurringMonitor = mock(RecurringMonitor.class);
        ResourceAccessPolicy policy = (principal, resourceId) -> !resourceId.startsWith("private-");
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        mockMvc = MockMvcBuilders.standaloneSetup(new MonitoringController(recurringMonitor, policy))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    @Test
    void shouldCreateConfig() throws Exception {
        when(recurringMonitor.createConfig(any(MonitoringConfigDefinition.class))).thenAnswer(invocation -> {
            MonitoringConfigDefinition definition = invocation.getArgument(0);
            return new MonitoringConfig(UUID.randomUUID(), definition.resourceId(), definition.targets(),
                    definition.thresholds(), definition.scheduleInterval());
        });

        mockMvc.perform(post("/monitoring/configs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"resourceId": "site-1", "targets": ["https://a.example"],
                                 "thresholds": {"performance": 85}, "scheduleInterval": "hourly",
                                 "avoidPeakHours": true, "peakStart": "09:00", "peakEnd": "17:00"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.resourceId").value("site-1"))
                .andExpect(jsonPath("$.scheduleInterval").value("hourly"));

        ArgumentCaptor<MonitoringConfigDefinition> definition =
                ArgumentCaptor.forClass(MonitoringConfigDefinition.class);
        verify(recurringMonitor).createConfig(definition.capture());
        assertThat(definition.getValue().scheduleInterval()).isEqualTo(ScheduleInterval.HOURLY);
        assertThat(definition.getValue().peakStart()).isEqualTo(LocalTime.of(9, 0));
        assertThat(definition.getValue().thresholds()).containsEntry("performance", 85.0);
    }

    @Test
    void shouldRejectConfigForForeignResource() throws Exception {
        mockMvc.perform(post("/monitoring/configs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"resourceId": "private-7", "targets": ["https://a.example"],
                                 "scheduleInterval": "daily"}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("AccessDenied"));
        verify(recurringMonitor, never()).createConfig(any());
    }

    @Test
    void shouldRejectUnknownScheduleInterval() throws Exception {
        mockMvc.perform(post("/monitoring/configs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resourceId\": \"site-1\", \"scheduleInterval\": \"monthly\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldAcceptManualRun() throws Exception {
        MonitoringConfig config = config("site-1");
        MonitoringRun run = new MonitoringRun(UUID.randomUUID(), config.getId(), RunTrigger.UPSTREAM_EVENT, 1);
        when(recurringMonitor.findConfig(config.getId())).thenReturn(config);
        when(recurringMonitor.trigger(eq(config.getId()), eq(RunTrigger.UPSTREAM_EVENT), any())).thenReturn(run);

        mockMvc.perform(post("/monitoring/{configId}/run", config.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"triggerType\": \"deployment_hook\", \"triggerContext\": {\"release\": \"v42\"}}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").value(run.getId().toString()));

        ArgumentCaptor<JsonNode> context = ArgumentCaptor.forClass(JsonNode.class);
        verify(recurringMonitor).trigger(eq(config.getId()), eq(RunTrigger.UPSTREAM_EVENT), context.capture());
        assertThat(context.getValue().path("release").asText()).isEqualTo("v42");
    }

    @Test
    void shouldRejectScheduledTriggerFromClients() throws Exception {
        UUID configId = UUID.randomUUID();
        when(recurringMonitor.findConfig(configId)).thenReturn(config("site-1"));
        when(recurringMonitor.trigger(configId, RunTrigger.SCHEDULED, null))
                .thenThrow(new IllegalArgumentException("Scheduled runs are created by the monitor"));

        mockMvc.perform(post("/monitoring/{configId}/run", configId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"triggerType\": \"scheduled\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("InvalidRequest"));
    }

    @Test
    void shouldReturnNotFoundForUnknownConfig() throws Exception {
        UUID configId = UUID.randomUUID();
        when(recurringMonitor.findConfig(configId)).thenThrow(AuditQNotFoundException.monitoringConfig(configId));

        mockMvc.perform(post("/monitoring/{configId}/run", configId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"triggerType\": \"manual\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldMapFullQueueOnManualRun() throws Exception {
        MonitoringConfig config = config("site-1");
        when(recurringMonitor.findConfig(config.getId())).thenReturn(config);
        when(recurringMonitor.trigger(eq(config.getId()), eq(RunTrigger.MANUAL), any()))
                .thenThrow(new QueueFullException(98, 3, 100, Duration.ofSeconds(30)));

        mockMvc.perform(post("/monitoring/{configId}/run", config.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"triggerType\": \"manual\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "30"));
    }

    @Test
    void shouldHideRunsOfForeignResource() throws Exception {
        MonitoringConfig config = config("private-7");
        when(recurringMonitor.findConfig(config.getId())).thenReturn(config);

        mockMvc.perform(get("/monitoring/{configId}/runs", config.getId()))
                .andExpect(status().isForbidden());
        verify(recurringMonitor, never()).runsFor(any());
    }

    @Test
    void shouldListAlertsOfRun() throws Exception {
        MonitoringConfig config = config("site-1");
        MonitoringRun run = new MonitoringRun(UUID.randomUUID(), config.getId(), RunTrigger.MANUAL, 1);
        when(recurringMonitor.findRun(run.getId())).thenReturn(run);
        when(recurringMonitor.findConfig(config.getId())).thenReturn(config);
        when(recurringMonitor.alertsFor(run.getId())).thenReturn(List.of());

        mockMvc.perform(get("/monitoring/runs/{runId}/alerts", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    void shouldRequireActiveFlag() throws Exception {
        mockMvc.perform(post("/monitoring/configs/{configId}/active", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldToggleActive() throws Exception {
        MonitoringConfig config = config("site-1");
        MonitoringConfig inactive = config("site-1");
        inactive.setActive(false);
        when(recurringMonitor.findConfig(config.getId())).thenReturn(config);
        when(recurringMonitor.setActive(config.getId(), false)).thenReturn(inactive);

        mockMvc.perform(post("/monitoring/configs/{configId}/active", config.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));
    }

    @Test
    void shouldReportProcessedRuns() throws Exception {
        MonitoringRun run = new MonitoringRun(UUID.randomUUID(), UUID.randomUUID(), RunTrigger.SCHEDULED, 2);
        when(recurringMonitor.tick()).thenReturn(List.of(run));

        mockMvc.perform(post("/monitoring/process"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processedRunIds[0]").value(run.getId().toString()));
    }

    private static MonitoringConfig config(String resourceId) {
        return new MonitoringConfig(UUID.randomUUID(), resourceId, List.of("https://a.example"), Map.of(),
                ScheduleInterval.DAILY);
    }
}
