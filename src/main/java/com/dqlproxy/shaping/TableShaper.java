package com.dqlproxy.shaping;

import com.dqlproxy.config.DqlProxyProperties;
import com.dqlproxy.model.RawRecordSet;
import com.dqlproxy.model.TableView;
import com.dqlproxy.model.dto.TableResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flattens Grail records into a table whose columns are the union of all record fields.
 *
 * Column order: names containing "time" (any case) first, then the rest; each group
 * sorted lexicographically. No record is assumed to be representative of the others.
 */
@Slf4j
@Component
public class TableShaper {

    public static final String SCHEMA = "table";

    static final Comparator<String> COLUMN_ORDER = Comparator
            .comparing((String name) -> isTimeLike(name) ? 0 : 1)
            .thenComparing(Comparator.naturalOrder());

    private final String schema;

    public TableShaper(DqlProxyProperties properties) {
        this.schema = properties.getShaping().getSchemaPrefix() + SCHEMA;
    }

    public TableView shape(RawRecordSet records) {
        Set<String> union = new TreeSet<>(COLUMN_ORDER);
        for (ObjectNode record : records.getRecords()) {
            Iterator<String> names = record.fieldNames();
            while (names.hasNext()) {
                union.add(names.next());
            }
        }
        List<String> columns = new ArrayList<>(union);

        List<List<JsonNode>> rows = new ArrayList<>(records.size());
        for (ObjectNode record : records.getRecords()) {
            List<JsonNode> row = new ArrayList<>(columns.size());
            for (String column : columns) {
                row.add(RawRecordSet.field(record, column));
            }
            rows.add(row);
        }

        log.debug("Shaped {} records into {} columns", records.size(), columns.size());
        return new TableView(columns, rows);
    }

    public TableResponse toResponse(TableView view) {
        List<TableResponse.Column> columns = new ArrayList<>(view.getColumns().size());
        for (String name : view.getColumns()) {
            columns.add(new TableResponse.Column(name));
        }
        List<List<Object>> rows = new ArrayList<>(view.getRows().size());
        for (List<JsonNode> row : view.getRows()) {
            rows.add(new ArrayList<>(row));
        }
        return TableResponse.builder()
                .schema(schema)
                .columns(columns)
                .rows(rows)
                .build();
    }

    static boolean isTimeLike(String name) {
        return name.toLowerCase(Locale.ROOT).contains("time");
    }
}
