package com.auditq.api;

import com.auditq.AuditQNotFoundException;
import com.auditq.ResourceAccessPolicy;
import com.auditq.broadcast.SseBroadcaster;
import com.auditq.monitoring.MonitoringConfig;
import com.auditq.monitoring.RecurringMonitor;
import com.auditq.monitoring.ScheduleInterval;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class EventStreamControllerTest {

    private SseBroadcaster broadcaster;
    private ObjectProvider<SseBroadcaster> broadcasterProvider;
    private RecurringMonitor recurringMonitor;
    private MockMvc mockMvc;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        broadcaster = new SseBroadcaster(Duration.ofMinutes(1));
        broadcasterProvider = mock(ObjectProvider.class);
        when(broadcasterProvider.getIfAvailable()).thenReturn(broadcaster);
        recurringMonitor = mock(RecurringMonitor.class);
        ResourceAccessPolicy policy = (principal, resourceId) -> !resourceId.startsWith("private-");
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new EventStreamController(broadcasterProvider, recurringMonitor, policy))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void shouldSubscribeToResourceTopic() throws Exception {
        mockMvc.perform(get("/events/resource:site-1"))
                .andExpect(request().asyncStarted());

        assertEquals(1, broadcaster.subscriberCount("resource:site-1"));
    }

    @Test
    void shouldResolveMonitoringTopicToItsResource() throws Exception {
        MonitoringConfig config = new MonitoringConfig(UUID.randomUUID(), "private-3",
                List.of("https://a.example"), Map.of(), ScheduleInterval.DAILY);
        when(recurringMonitor.findConfig(config.getId())).thenReturn(config);

        mockMvc.perform(get("/events/monitoring:" + config.getId()))
                .andExpect(status().isForbidden());
        assertEquals(0, broadcaster.subscriberCount("monitoring:" + config.getId()));
    }

    @Test
    void shouldReturnNotFoundForUnknownMonitoringConfig() throws Exception {
        UUID configId = UUID.randomUUID();
        when(recurringMonitor.findConfig(configId)).thenThrow(AuditQNotFoundException.monitoringConfig(configId));

        mockMvc.perform(get("/events/monitoring:" + configId))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectUnknownTopics() throws Exception {
        mockMvc.perform(get("/events/jobs:all"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/events/monitoring:not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnNotFoundWithoutSseBroadcaster() throws Exception {
        when(broadcasterProvider.getIfAvailable()).thenReturn(null);

        mockMvc.perform(get("/events/resource:site-1"))
                .andExpect(status().isNotFound());
    }
}
