package com.dqlproxy.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Data-frame payload consumed by the dashboard's time series panels.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeseriesResponse {

    public static final String TIME_FIELD = "Time";
    public static final String VALUE_FIELD = "Value";

    @JsonProperty("schema")
    private String schema;

    @JsonProperty("frames")
    private List<Frame> frames;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Frame {
        @JsonProperty("name")
        private String name;

        /**
         * Always two fields: Time (epoch ms) then Value.
         */
        @JsonProperty("fields")
        private List<Field> fields;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Field {
        @JsonProperty("name")
        private String name;

        @JsonProperty("type")
        private String type;

        @JsonProperty("values")
        private List<Object> values;
    }
}
