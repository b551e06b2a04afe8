package com.dqlproxy.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records flattened to a fixed column list. Every row is exactly as wide as the columns;
 * missing cells are null.
 */
@Value
public class TableView {

    List<String> columns;
    List<List<JsonNode>> rows;

    public TableView(List<String> columns, List<List<JsonNode>> rows) {
        List<List<JsonNode>> copied = new ArrayList<>(rows.size());
        for (List<JsonNode> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(
                        "Row width " + row.size() + " does not match " + columns.size() + " columns");
            }
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.columns = List.copyOf(columns);
        this.rows = Collections.unmodifiableList(copied);
    }
}
