package com.auditq.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.auditq.TriggerData;
import jakarta.persistence.Converter;

import java.util.List;
import java.util.Map;

/**
 * JSON text converters for the structured columns of the AuditQ tables.
 */
public final class JsonColumns {

    private JsonColumns() {
    }

    @Converter
    public static class TriggerDataConverter extends JsonColumnConverter<TriggerData> {
        public TriggerDataConverter() {
            super(TriggerData.class);
        }
    }

    @Converter
    public static class JsonNodeConverter extends JsonColumnConverter<JsonNode> {
        public JsonNodeConverter() {
            super(JsonNode.class);
        }
    }

    @Converter
    public static class StringListConverter extends JsonColumnConverter<List<String>> {
        public StringListConverter() {
            super(new TypeReference<List<String>>() {
            });
        }

        @Override
        protected List<String> emptyValue() {
            return List.of();
        }
    }

    @Converter
    public static class ScoreMapConverter extends JsonColumnConverter<Map<String, Double>> {
        public ScoreMapConverter() {
            super(new TypeReference<Map<String, Double>>() {
            });
        }

        @Override
        protected Map<String, Double> emptyValue() {
            return Map.of();
        }
    }
}
