package com.skanga.mysqlmcp.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.skanga.mysqlmcp.JsonUtils;
import com.skanga.mysqlmcp.config.ResourceManager;
import com.skanga.mysqlmcp.db.ConnectionPool;
import com.skanga.mysqlmcp.db.DatabaseException;
import com.skanga.mysqlmcp.db.QueryRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs caller-supplied SQL through the pool and shapes the outcome into a {@link ToolResult}.
 * Statements are passed through unchanged; the account's privileges are the only restriction.
 */
public class QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);
    public static final String TOOL_NAME = "mysql_query";
    public static final String ERROR_PREFIX = "SQL Error: ";
    private static final int SQL_PREVIEW_LENGTH = 100;

    private final ConnectionPool connectionPool;

    public QueryExecutor(ConnectionPool connectionPool) {
        this.connectionPool = connectionPool;
    }

    /**
     * Executes a statement and reports its rows along with the elapsed time.
     *
     * @param sqlText statement to run
     * @return rows and elapsed milliseconds
     * @throws DatabaseException if the statement fails
     */
    public ExecutionReport execute(String sqlText) throws DatabaseException {
        long startNanos = System.nanoTime();
        QueryRows queryRows = connectionPool.execute(sqlText, List.of());
        long elapsedNanos = System.nanoTime() - startNanos;

        ExecutionReport executionReport = new ExecutionReport(queryRows.rows(), ExecutionReport.formatElapsed(elapsedNanos));
        logger.debug("Query returned {} rows in {}ms", queryRows.rowCount(), executionReport.elapsedMs());
        return executionReport;
    }

    /**
     * Executes a statement and never throws: database failures come back as an error envelope
     * carrying the server's message.
     */
    public ToolResult runQuery(String sqlText) {
        logger.info("Executing query: {}", preview(sqlText));
        try {
            return ToolResult.success(JsonUtils.toPrettyJson(execute(sqlText)));
        } catch (DatabaseException e) {
            logger.warn("Query failed ({}): {}", e.getKind(), e.getMessage());
            return ToolResult.error(ERROR_PREFIX + e.getMessage());
        } catch (JsonProcessingException e) {
            logger.error("Could not serialize query result", e);
            return ToolResult.error(ResourceManager.getErrorMessage("query.result.serialization.failed",
                    e.getOriginalMessage()));
        }
    }

    static String preview(String sqlText) {
        String singleLine = sqlText.replaceAll("\\s+", " ").trim();
        return singleLine.length() > SQL_PREVIEW_LENGTH ? singleLine.substring(0, SQL_PREVIEW_LENGTH) + "..." : singleLine;
    }
}
