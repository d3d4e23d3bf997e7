package com.auditq.api;

import com.auditq.AuditQNotFoundException;
import com.auditq.admission.AdmissionException;
import com.auditq.admission.QueueFullException;
import com.auditq.admission.ResourceAccessDeniedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders AuditQ errors as {@code {error, message}} JSON.
 */
@RestControllerAdvice(assignableTypes = {JobController.class, MonitoringController.class,
        EventStreamController.class})
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AuditQNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(AuditQNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("NotFound", e.getMessage()));
    }

    @ExceptionHandler(QueueFullException.class)
    public ResponseEntity<Map<String, Object>> queueFull(QueueFullException e) {
        long retryAfterSeconds = Math.max(1, e.getRetryAfter().toSeconds());
        Map<String, Object> body = body(e.errorCode(), e.getMessage());
        body.put("queueSize", e.getQueueSize());
        body.put("maxSize", e.getMaxSize());
        body.put("retryAfterSeconds", retryAfterSeconds);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, Long.toString(retryAfterSeconds))
                .body(body);
    }

    @ExceptionHandler(AdmissionException.class)
    public ResponseEntity<Map<String, Object>> admission(AdmissionException e) {
        HttpStatus status = e instanceof ResourceAccessDeniedException
                ? HttpStatus.FORBIDDEN
                : HttpStatus.TOO_MANY_REQUESTS;
        return ResponseEntity.status(status).body(body(e.errorCode(), e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(body("InvalidRequest", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body", e);
        return ResponseEntity.badRequest().body(body("InvalidRequest", "Malformed request body"));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body("Conflict", e.getMessage()));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
