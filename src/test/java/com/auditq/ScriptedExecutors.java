package com.auditq;

import com.auditq.monitoring.AuditExecutor;
import com.auditq.monitoring.AuditResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Executors whose behavior each test scripts, plus a clock the tests move by hand.
 */
@TestConfiguration(proxyBeanMethods = false)
public class ScriptedExecutors {

    public static final String START = "2025-01-06T10:00:00Z";

    @Bean
    public MutableClock mutableClock() {
        return MutableClock.at(START);
    }

    @Bean
    public ManualExecutor manualExecutor() {
        return new ManualExecutor();
    }

    @Bean
    public ScriptedAuditExecutor scriptedAuditExecutor() {
        return new ScriptedAuditExecutor();
    }

    @FunctionalInterface
    public interface Behavior {
        JsonNode run(UUID jobId, TriggerData.Manual data, JobExecutionContext context) throws Exception;
    }

    public static class ManualExecutor implements JobExecutor<TriggerData.Manual> {

        private final List<UUID> executed = new CopyOnWriteArrayList<>();
        private volatile Behavior behavior = (jobId, data, context) -> null;

        @Override
        public JsonNode execute(UUID jobId, TriggerData.Manual triggerData, JobExecutionContext context)
                throws Exception {
            executed.add(jobId);
            return behavior.run(jobId, triggerData, context);
        }

        public void behave(Behavior behavior) {
            this.behavior = behavior;
        }

        public List<UUID> executed() {
            return executed;
        }

        public void reset() {
            executed.clear();
            behavior = (jobId, data, context) -> null;
        }
    }

    public static class ScriptedAuditExecutor implements AuditExecutor {

        private final Map<String, Map<String, Double>> scores = new ConcurrentHashMap<>();
        private final List<String> audited = new CopyOnWriteArrayList<>();

        @Override
        public AuditResult audit(String target) throws Exception {
            audited.add(target);
            Map<String, Double> result = scores.get(target);
            if (result == null) {
                throw new IllegalStateException("Audit of " + target + " timed out");
            }
            return AuditResult.of(result);
        }

        public void score(String target, Map<String, Double> result) {
            scores.put(target, result);
        }

        public List<String> audited() {
            return audited;
        }

        public void reset() {
            scores.clear();
            audited.clear();
        }
    }
}
