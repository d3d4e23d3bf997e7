package com.auditq;

/**
 * A job, monitoring configuration or run that does not exist.
 */
public class AuditQNotFoundException extends RuntimeException {

    public AuditQNotFoundException(String message) {
        super(message);
    }

    public static AuditQNotFoundException job(Object id) {
        return new AuditQNotFoundException("Job " + id + " not found");
    }

    public static AuditQNotFoundException monitoringConfig(Object id) {
        return new AuditQNotFoundException("Monitoring config " + id + " not found");
    }

    public static AuditQNotFoundException monitoringRun(Object id) {
        return new AuditQNotFoundException("Monitoring run " + id + " not found");
    }
}
