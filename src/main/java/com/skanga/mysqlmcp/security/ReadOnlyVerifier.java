package com.skanga.mysqlmcp.security;

import com.skanga.mysqlmcp.config.VerificationStrategy;
import com.skanga.mysqlmcp.db.ConnectionPool;

/**
 * Startup gate that proves the configured account cannot modify data or schema.
 */
public interface ReadOnlyVerifier {

    /**
     * Returns normally only when the account is confirmed read-only.
     *
     * @throws StartupFault if the account can write, or if read-only status cannot be established
     */
    void verifyReadOnly() throws StartupFault;

    static ReadOnlyVerifier forStrategy(VerificationStrategy strategy, ConnectionPool connectionPool) {
        return switch (strategy) {
            case GRANTS -> new GrantInspectionVerifier(connectionPool);
            case PROBE -> new WriteProbeVerifier(connectionPool);
        };
    }
}
