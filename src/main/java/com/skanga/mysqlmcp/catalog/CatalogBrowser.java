package com.skanga.mysqlmcp.catalog;

import com.skanga.mysqlmcp.db.ConnectionPool;
import com.skanga.mysqlmcp.db.DatabaseException;
import com.skanga.mysqlmcp.db.QueryRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lists the tables and views visible to the gateway account and describes their columns,
 * using {@code information_schema}. Nothing is cached; every call queries the server.
 */
public class CatalogBrowser {
    private static final Logger logger = LoggerFactory.getLogger(CatalogBrowser.class);

    /** Server-internal schemas that are never surfaced. */
    public static final List<String> EXCLUDED_SCHEMAS =
            List.of("information_schema", "mysql", "performance_schema", "sys");

    static final String LIST_ENTRIES_SQL =
            "SELECT table_schema AS table_schema, table_name AS table_name " +
            "FROM information_schema.tables " +
            "WHERE table_schema NOT IN (" +
            EXCLUDED_SCHEMAS.stream().map(schema -> "'" + schema + "'").collect(Collectors.joining(", ")) + ") " +
            "ORDER BY table_schema, table_name";

    static final String DESCRIBE_ENTRY_SQL =
            "SELECT column_name AS column_name, data_type AS data_type, is_nullable AS is_nullable, " +
            "column_default AS column_default, column_key AS column_key " +
            "FROM information_schema.columns " +
            "WHERE table_schema = ? AND table_name = ? " +
            "ORDER BY ordinal_position";

    private final ConnectionPool connectionPool;

    public CatalogBrowser(ConnectionPool connectionPool) {
        this.connectionPool = connectionPool;
    }

    /**
     * Lists every user-visible table and view, ordered by schema and then name.
     *
     * @return catalog entries, never {@code null}
     * @throws DatabaseException if the catalog query fails
     */
    public List<CatalogEntry> listEntries() throws DatabaseException {
        QueryRows queryRows = connectionPool.execute(LIST_ENTRIES_SQL, List.of());

        List<CatalogEntry> catalogEntries = new ArrayList<>(queryRows.rowCount());
        for (Map<String, Object> row : queryRows.rows()) {
            String schema = asText(row.get("table_schema"));
            String object = asText(row.get("table_name"));
            if (schema == null || object == null || isExcludedSchema(schema)) {
                continue;
            }
            catalogEntries.add(new CatalogEntry(schema, object));
        }
        logger.debug("Listed {} catalog entries", catalogEntries.size());
        return catalogEntries;
    }

    /**
     * Describes the columns of the entry named by {@code locator}, in declaration order.
     * An unknown entry yields an empty list.
     *
     * @param locator a locator of the form {@code mysql://<schema>/<object>}
     * @throws IllegalArgumentException if the locator is malformed
     * @throws DatabaseException if the catalog query fails
     */
    public List<ColumnDescriptor> describeEntry(String locator) throws DatabaseException {
        return describeEntry(CatalogEntry.fromLocator(locator));
    }

    public List<ColumnDescriptor> describeEntry(CatalogEntry catalogEntry) throws DatabaseException {
        QueryRows queryRows = connectionPool.execute(DESCRIBE_ENTRY_SQL,
                List.of(catalogEntry.schema(), catalogEntry.object()));

        List<ColumnDescriptor> columnDescriptors = new ArrayList<>(queryRows.rowCount());
        for (Map<String, Object> row : queryRows.rows()) {
            columnDescriptors.add(new ColumnDescriptor(
                    asText(row.get("column_name")),
                    asText(row.get("data_type")),
                    asText(row.get("is_nullable")),
                    asText(row.get("column_default")),
                    asText(row.get("column_key"))));
        }
        if (columnDescriptors.isEmpty()) {
            logger.debug("No columns found for {}", catalogEntry.displayName());
        }
        return columnDescriptors;
    }

    static boolean isExcludedSchema(String schema) {
        return EXCLUDED_SCHEMAS.contains(schema.toLowerCase(Locale.ROOT));
    }

    // Some server versions report information_schema text columns as binary strings
    private static String asText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return value.toString();
    }
}
