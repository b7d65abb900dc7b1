package com.skanga.mysqlmcp.tools;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of a successful statement.
 *
 * @param rows      rows as returned by the server, keyed by column label
 * @param elapsedMs wall-clock duration in milliseconds with exactly one decimal digit, e.g. {@code "12.3"}
 */
@JsonPropertyOrder({"rows", "elapsed_ms"})
public record ExecutionReport(
        @JsonProperty("rows") List<Map<String, Object>> rows,
        @JsonProperty("elapsed_ms") String elapsedMs) {

    public static String formatElapsed(long elapsedNanos) {
        return String.format(Locale.ROOT, "%.1f", elapsedNanos / 1_000_000.0);
    }
}
