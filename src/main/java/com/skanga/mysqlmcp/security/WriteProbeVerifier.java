package com.skanga.mysqlmcp.security;

import com.skanga.mysqlmcp.config.ResourceManager;
import com.skanga.mysqlmcp.db.ConnectionPool;
import com.skanga.mysqlmcp.db.DatabaseErrorKind;
import com.skanga.mysqlmcp.db.DatabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Legacy strategy: attempts to create a session-scoped temporary table and expects the server to refuse.
 * Only a classified permission denial counts as proof; any other failure is reported as the fault it is.
 * The probe needs a default database, since MySQL rejects an unqualified table name without one.
 */
public class WriteProbeVerifier implements ReadOnlyVerifier {
    private static final Logger logger = LoggerFactory.getLogger(WriteProbeVerifier.class);
    static final String PROBE_SQL = "CREATE TEMPORARY TABLE _readonly_check (id INT)";

    private final ConnectionPool connectionPool;

    public WriteProbeVerifier(ConnectionPool connectionPool) {
        this.connectionPool = connectionPool;
    }

    @Override
    public void verifyReadOnly() throws StartupFault {
        try {
            connectionPool.execute(PROBE_SQL, List.of());
        } catch (DatabaseException e) {
            if (e.getKind() == DatabaseErrorKind.PERMISSION_DENIED) {
                logger.info("Read-only access verified (write probe denied: {})", e.getMessage());
                return;
            }
            logger.debug("Write probe failed for a reason other than a permission denial", e);
            throw StartupFault.from(e);
        }

        // The temporary table lives only as long as its session, which ends when the pool closes
        logger.error("Write probe succeeded; the account can create tables");
        throw StartupFault.writePrivileges(
                ResourceManager.getErrorMessage("startup.policy.write.probe"), List.of());
    }
}
