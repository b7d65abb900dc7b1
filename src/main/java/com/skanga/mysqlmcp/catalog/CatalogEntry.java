package com.skanga.mysqlmcp.catalog;

import com.skanga.mysqlmcp.config.ResourceManager;

/**
 * One schema-qualified table or view exposed for browsing.
 *
 * @param schema owning schema (database) name
 * @param object table or view name
 */
public record CatalogEntry(String schema, String object) {
    public static final String URI_SCHEME = "mysql";
    public static final String URI_PREFIX = URI_SCHEME + "://";
    public static final String MIME_TYPE = "application/json";

    /**
     * Resource locator in the form {@code mysql://<schema>/<object>}.
     */
    public String locator() {
        return URI_PREFIX + schema + "/" + object;
    }

    /**
     * Human-readable name in the form {@code <schema>.<object>}.
     */
    public String displayName() {
        return schema + "." + object;
    }

    /**
     * Parses a locator produced by {@link #locator()}. Everything after the first slash
     * following the schema is the object name.
     *
     * @throws IllegalArgumentException if the scheme is not {@code mysql} or either part is empty
     */
    public static CatalogEntry fromLocator(String locator) {
        if (locator == null || !locator.startsWith(URI_PREFIX)) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("catalog.locator.invalid", locator));
        }
        String remainder = locator.substring(URI_PREFIX.length());
        int slashIndex = remainder.indexOf('/');
        if (slashIndex <= 0 || slashIndex == remainder.length() - 1) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("catalog.locator.invalid", locator));
        }
        return new CatalogEntry(remainder.substring(0, slashIndex), remainder.substring(slashIndex + 1));
    }
}
