package com.dqlproxy.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Records grouped into named series of time-sorted points.
 */
@Value
public class SeriesView {

    List<Series> series;

    public SeriesView(List<Series> series) {
        this.series = List.copyOf(series);
    }

    @Value
    public static class Series {
        @NonNull
        String name;
        List<Point> points;

        public Series(String name, List<Point> points) {
            this.name = name;
            this.points = List.copyOf(points);
        }
    }

    @Value
    public static class Point {
        long timestampMs;
        @NonNull
        JsonNode value;
    }
}
