package com.auditq.monitoring;

/**
 * Audits one monitoring target, for example a Lighthouse run against a URL. Supplied by the host
 * application.
 */
@FunctionalInterface
public interface AuditExecutor {

    /**
     * @param target the audit subject, as configured on the monitoring config
     * @return metric name to score (0..100); an empty result counts as a failed target
     * @throws Exception if the audit could not be performed
     */
    AuditResult audit(String target) throws Exception;
}
