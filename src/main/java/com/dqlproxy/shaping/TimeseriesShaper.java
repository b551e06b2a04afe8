package com.dqlproxy.shaping;

import com.dqlproxy.config.DqlProxyProperties;
import com.dqlproxy.model.RawRecordSet;
import com.dqlproxy.model.SeriesView;
import com.dqlproxy.model.dto.TimeseriesResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Groups Grail records into time series.
 *
 * A record becomes one point of the series named by its label field (or of the single
 * series "series" when no label field is given). Records without a usable timestamp or
 * without a value are dropped. Points are sorted by time within each series; series keep
 * the order in which their label was first seen.
 */
@Slf4j
@Component
public class TimeseriesShaper {

    public static final String SCHEMA = "timeseries";
    public static final String DEFAULT_SERIES = "series";

    private static final String MISSING_LABEL = "null";

    private final String schema;

    public TimeseriesShaper(DqlProxyProperties properties) {
        this.schema = properties.getShaping().getSchemaPrefix() + SCHEMA;
    }

    /**
     * @param timeField  field holding the timestamp (seconds, millis or ISO text)
     * @param valueField field holding the point value
     * @param labelField field naming the series, or null for a single series
     */
    public SeriesView shape(RawRecordSet records, String timeField, String valueField, String labelField) {
        Map<String, List<SeriesView.Point>> groups = new LinkedHashMap<>();
        int skipped = 0;

        for (ObjectNode record : records.getRecords()) {
            String key = labelField == null ? DEFAULT_SERIES : labelOf(record, labelField);
            OptionalLong timestamp = TimestampNormalizer.toEpochMillis(RawRecordSet.field(record, timeField));
            JsonNode value = RawRecordSet.field(record, valueField);

            if (timestamp.isEmpty() || value == null) {
                skipped++;
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>())
                    .add(new SeriesView.Point(timestamp.getAsLong(), value));
        }

        List<SeriesView.Series> series = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<SeriesView.Point>> group : groups.entrySet()) {
            List<SeriesView.Point> points = group.getValue();
            // stable: equal timestamps keep record order
            points.sort(Comparator.comparingLong(SeriesView.Point::getTimestampMs));
            series.add(new SeriesView.Series(group.getKey(), points));
        }

        if (skipped > 0) {
            log.debug("Skipped {} of {} records missing '{}' or '{}'",
                    skipped, records.size(), timeField, valueField);
        }
        return new SeriesView(series);
    }

    public TimeseriesResponse toResponse(SeriesView view) {
        List<TimeseriesResponse.Frame> frames = new ArrayList<>(view.getSeries().size());
        for (SeriesView.Series series : view.getSeries()) {
            List<Object> times = new ArrayList<>(series.getPoints().size());
            List<Object> values = new ArrayList<>(series.getPoints().size());
            for (SeriesView.Point point : series.getPoints()) {
                times.add(point.getTimestampMs());
                values.add(point.getValue());
            }
            frames.add(TimeseriesResponse.Frame.builder()
                    .name(series.getName())
                    .fields(List.of(
                            TimeseriesResponse.Field.builder()
                                    .name(TimeseriesResponse.TIME_FIELD)
                                    .type("time")
                                    .values(times)
                                    .build(),
                            TimeseriesResponse.Field.builder()
                                    .name(TimeseriesResponse.VALUE_FIELD)
                                    .type("number")
                                    .values(values)
                                    .build()))
                    .build());
        }
        return TimeseriesResponse.builder()
                .schema(schema)
                .frames(frames)
                .build();
    }

    private static String labelOf(ObjectNode record, String labelField) {
        JsonNode label = RawRecordSet.field(record, labelField);
        if (label == null) {
            return MISSING_LABEL;
        }
        return label.isValueNode() ? label.asText() : label.toString();
    }
}
