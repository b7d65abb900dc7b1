package com.skanga.mysqlmcp.security;

import com.skanga.mysqlmcp.config.ConfigParams;
import com.skanga.mysqlmcp.config.ResourceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link StartupFault} into operator-facing guidance written to the log (stderr).
 */
public final class StartupDiagnostics {
    private static final Logger logger = LoggerFactory.getLogger(StartupDiagnostics.class);

    private StartupDiagnostics() {
    }

    /**
     * Builds the diagnostic lines for a fault. Each fault kind names the settings an operator should check.
     */
    public static List<String> describe(StartupFault startupFault, ConfigParams configParams) {
        List<String> diagnosticLines = new ArrayList<>();
        switch (startupFault.getKind()) {
            case CONNECTIVITY -> {
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.connectivity.title"));
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.connectivity.details", configParams.endpoint()));
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.connectivity.hint"));
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.upstream.error", startupFault.getMessage()));
            }
            case AUTHENTICATION -> {
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.auth.title"));
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.auth.user", configParams.user()));
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.auth.database", configParams.databaseOrNone()));
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.auth.hint"));
                if (configParams.database() == null) {
                    diagnosticLines.add(ResourceManager.getErrorMessage("startup.auth.no.database.hint"));
                }
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.upstream.error", startupFault.getMessage()));
            }
            case SCHEMA -> {
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.schema.title"));
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.schema.database", configParams.databaseOrNone()));
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.schema.hint"));
            }
            case POLICY -> {
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.policy.title"));
                diagnosticLines.add(startupFault.getMessage());
                if (!startupFault.getGrants().isEmpty()) {
                    diagnosticLines.add(ResourceManager.getErrorMessage("startup.policy.grants"));
                    startupFault.getGrants().forEach(grant -> diagnosticLines.add("  " + grant));
                }
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.policy.hint", configParams.user()));
            }
            case UNEXPECTED -> {
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.unexpected.title"));
                diagnosticLines.add(ResourceManager.getErrorMessage("startup.upstream.error", startupFault.getMessage()));
            }
        }
        return diagnosticLines;
    }

    /**
     * Logs the diagnostic lines for a fault at error level.
     */
    public static void report(StartupFault startupFault, ConfigParams configParams) {
        for (String diagnosticLine : describe(startupFault, configParams)) {
            logger.error(diagnosticLine);
        }
        logger.debug("Startup fault detail", startupFault);
    }
}
