package com.skanga.mysqlmcp.security;

import com.skanga.mysqlmcp.config.ResourceManager;
import com.skanga.mysqlmcp.db.ConnectionPool;
import com.skanga.mysqlmcp.db.DatabaseException;
import com.skanga.mysqlmcp.db.QueryRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Verifies read-only status by reading the account's own grants. This is the default strategy:
 * it changes nothing on the server and fails closed on any error.
 */
public class GrantInspectionVerifier implements ReadOnlyVerifier {
    private static final Logger logger = LoggerFactory.getLogger(GrantInspectionVerifier.class);
    static final String SHOW_GRANTS_SQL = "SHOW GRANTS FOR CURRENT_USER()";

    private final ConnectionPool connectionPool;

    public GrantInspectionVerifier(ConnectionPool connectionPool) {
        this.connectionPool = connectionPool;
    }

    @Override
    public void verifyReadOnly() throws StartupFault {
        GrantSet grantSet;
        try {
            grantSet = loadGrants();
        } catch (DatabaseException e) {
            logger.debug("Could not read grants", e);
            throw StartupFault.from(e);
        }

        if (grantSet.hasWritePrivileges()) {
            boolean onlyRoles = grantSet.writeGrants().equals(grantSet.roleGrants());
            logger.error(onlyRoles ? "Role grants cannot be inspected. Current grants:"
                    : "Write privileges detected. Current grants:");
            grantSet.grants().forEach(grant -> logger.error("  {}", grant));
            throw StartupFault.writePrivileges(ResourceManager.getErrorMessage(onlyRoles
                    ? "startup.policy.role.grants" : "startup.policy.write.privileges"), grantSet.grants());
        }

        if (grantSet.isEmpty()) {
            logger.warn("No grants reported for the current user; treating the account as read-only");
        }
        logger.info("Read-only access verified ({} grants inspected)", grantSet.grants().size());
    }

    GrantSet loadGrants() throws DatabaseException {
        QueryRows queryRows = connectionPool.execute(SHOW_GRANTS_SQL, List.of());
        if (queryRows.fields().isEmpty()) {
            return new GrantSet(List.of());
        }

        String grantColumn = queryRows.fields().get(0);
        List<String> grants = new ArrayList<>(queryRows.rowCount());
        for (Map<String, Object> row : queryRows.rows()) {
            Object grant = row.get(grantColumn);
            if (grant instanceof byte[] bytes) {
                grants.add(new String(bytes, StandardCharsets.UTF_8));
            } else if (grant != null) {
                grants.add(grant.toString());
            }
        }
        logger.debug("Grants for current user: {}", grants);
        return new GrantSet(grants);
    }
}
