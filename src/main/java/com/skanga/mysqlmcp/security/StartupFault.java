package com.skanga.mysqlmcp.security;

import com.skanga.mysqlmcp.db.DatabaseException;

import java.util.List;

/**
 * A fatal problem detected before the gateway starts serving requests.
 */
public class StartupFault extends Exception {

    public enum Kind {
        /** The server could not be reached. */
        CONNECTIVITY,
        /** The server rejected the credentials or the account may not use the database. */
        AUTHENTICATION,
        /** The configured database does not exist. */
        SCHEMA,
        /** The account holds privileges that allow writes. */
        POLICY,
        /** Anything else, including failures that leave read-only status unproven. */
        UNEXPECTED
    }

    private final Kind kind;
    private final List<String> grants;

    public StartupFault(Kind kind, String message, List<String> grants, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.grants = grants == null ? List.of() : List.copyOf(grants);
    }

    public StartupFault(Kind kind, String message, Throwable cause) {
        this(kind, message, List.of(), cause);
    }

    /**
     * A policy fault carrying the grants that made the account write-capable.
     */
    public static StartupFault writePrivileges(String message, List<String> grants) {
        return new StartupFault(Kind.POLICY, message, grants, null);
    }

    /**
     * Maps a classified database failure to the startup fault it implies.
     */
    public static StartupFault from(DatabaseException databaseException) {
        Kind kind = switch (databaseException.getKind()) {
            case CONNECTION_REFUSED -> Kind.CONNECTIVITY;
            case ACCESS_DENIED -> Kind.AUTHENTICATION;
            case UNKNOWN_DATABASE -> Kind.SCHEMA;
            case PERMISSION_DENIED, SQL_ERROR -> Kind.UNEXPECTED;
        };
        return new StartupFault(kind, databaseException.getMessage(), databaseException);
    }

    public Kind getKind() {
        return kind;
    }

    public List<String> getGrants() {
        return grants;
    }
}
