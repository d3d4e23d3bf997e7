package com.auditq;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Payload handed to a {@link JobExecutor}. The {@code kind} discriminator always matches the job's
 * {@link TriggerType}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TriggerData.Manual.class, name = "manual"),
        @JsonSubTypes.Type(value = TriggerData.Scheduled.class, name = "scheduled"),
        @JsonSubTypes.Type(value = TriggerData.UpstreamEvent.class, name = "upstream_event"),
        @JsonSubTypes.Type(value = TriggerData.FileUpload.class, name = "file_upload")
})
public sealed interface TriggerData
        permits TriggerData.Manual, TriggerData.Scheduled, TriggerData.UpstreamEvent, TriggerData.FileUpload {

    default TriggerType triggerType() {
        return TriggerType.forDataClass(getClass());
    }

    /**
     * Started by a user from the dashboard.
     */
    record Manual(String requestedBy, String note) implements TriggerData {
    }

    /**
     * Fired by a schedule owned by the host application.
     */
    record Scheduled(String scheduleName, OffsetDateTime firedAt) implements TriggerData {
    }

    /**
     * Raised by an upstream system, for example a commit hook or a deployment.
     */
    record UpstreamEvent(String source, String reference, Map<String, String> attributes) implements TriggerData {
        public UpstreamEvent {
            attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        }
    }

    record FileUpload(String fileName, String storageKey, Long sizeBytes) implements TriggerData {
        public FileUpload {
            if (fileName == null || fileName.isBlank()) {
                throw new IllegalArgumentException("fileName must not be blank for file uploads");
            }
        }
    }
}
