package com.facilityhub.realtime.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Map;

/**
 * Debezium change envelope as published on the per-table CDC topics.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CdcEnvelope {

    private Map<String, Object> before;
    private Map<String, Object> after;
    private Source source;

    /** c=create, u=update, d=delete, r=snapshot read */
    private String op;

    @JsonProperty("ts_ms")
    private Long tsMs;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Source {
        private String connector;
        private String db;
        private String schema;
        private String table;

        @JsonProperty("ts_ms")
        private Long tsMs;
    }
}
