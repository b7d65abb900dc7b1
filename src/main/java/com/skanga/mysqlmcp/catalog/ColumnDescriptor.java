package com.skanga.mysqlmcp.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Structure of one column as reported by {@code information_schema.columns}.
 */
@JsonPropertyOrder({"column_name", "data_type", "is_nullable", "column_default", "column_key"})
public record ColumnDescriptor(
        @JsonProperty("column_name") String columnName,
        @JsonProperty("data_type") String dataType,
        @JsonProperty("is_nullable") String isNullable,
        @JsonProperty("column_default") String columnDefault,
        @JsonProperty("column_key") String columnKey) {
}
