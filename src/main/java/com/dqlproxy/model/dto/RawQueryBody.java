package com.dqlproxy.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON body of the raw query endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawQueryBody {

    public static final String DEFAULT_FROM = "now()-1h";
    public static final String DEFAULT_TO = "now()";

    @JsonProperty("dql")
    private String dql;

    @JsonProperty("from")
    private String from;

    @JsonProperty("to")
    private String to;

    public String fromOrDefault() {
        return from == null ? DEFAULT_FROM : from;
    }

    public String toOrDefault() {
        return to == null ? DEFAULT_TO : to;
    }
}
