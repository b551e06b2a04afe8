package com.dqlproxy.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Table payload consumed by the dashboard's table panels.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableResponse {

    @JsonProperty("schema")
    private String schema;

    @JsonProperty("columns")
    private List<Column> columns;

    /**
     * Cells are positionally aligned with {@link #columns}; absent cells are null.
     */
    @JsonProperty("rows")
    private List<List<Object>> rows;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Column {
        @JsonProperty("text")
        private String text;
    }
}
