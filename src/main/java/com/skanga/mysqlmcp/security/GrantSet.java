package com.skanga.mysqlmcp.security;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The grant statements reported by {@code SHOW GRANTS FOR CURRENT_USER()}, with a check for
 * privileges that allow changing data or schema.
 *
 * <p>Only the privilege list between {@code GRANT} and {@code ON} is inspected, so object and
 * user names can never trigger a match. Role grants ({@code GRANT `role` TO ...}) have no
 * {@code ON} clause and their privileges are not listed, so they count as write grants.
 */
public final class GrantSet {
    static final Set<String> WRITE_PRIVILEGES =
            Set.of("INSERT", "UPDATE", "DELETE", "CREATE", "DROP", "ALTER", "INDEX", "GRANT", "ALL");
    private static final String GRANT_KEYWORD = "GRANT ";
    private static final String ON_KEYWORD = " ON ";
    private static final String TO_KEYWORD = " TO ";
    private static final String GRANT_OPTION_SUFFIX = "WITH GRANT OPTION";

    private final List<String> grants;

    public GrantSet(List<String> grants) {
        this.grants = List.copyOf(grants);
    }

    public List<String> grants() {
        return grants;
    }

    public boolean isEmpty() {
        return grants.isEmpty();
    }

    public boolean hasWritePrivileges() {
        return grants.stream().anyMatch(GrantSet::isWriteGrant);
    }

    /**
     * Grants that on their own make the account write-capable.
     */
    public List<String> writeGrants() {
        return grants.stream().filter(GrantSet::isWriteGrant).toList();
    }

    /**
     * Role grants, whose privileges {@code SHOW GRANTS FOR CURRENT_USER()} does not report.
     */
    public List<String> roleGrants() {
        return grants.stream().filter(GrantSet::isRoleGrant).toList();
    }

    static boolean isRoleGrant(String grant) {
        String upperGrant = grant.trim().toUpperCase(Locale.ROOT);
        return upperGrant.startsWith(GRANT_KEYWORD) && findOnClause(upperGrant) < 0
                && upperGrant.contains(TO_KEYWORD);
    }

    static boolean isWriteGrant(String grant) {
        String upperGrant = grant.trim().toUpperCase(Locale.ROOT);
        if (!upperGrant.startsWith(GRANT_KEYWORD)) {
            return false;
        }
        int onIndex = findOnClause(upperGrant);
        if (onIndex < 0) {
            // Role privileges are unknown here
            return upperGrant.contains(TO_KEYWORD);
        }
        if (upperGrant.endsWith(GRANT_OPTION_SUFFIX)) {
            return true;
        }
        String privilegeList = upperGrant.substring(GRANT_KEYWORD.length(), onIndex);
        for (String privilege : splitPrivileges(privilegeList)) {
            if (WRITE_PRIVILEGES.contains(firstWord(privilege))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Position of the {@code ON} keyword that closes the privilege list, skipping quoted
     * identifiers and column lists. Returns -1 for role grants.
     */
    static int findOnClause(String upperGrant) {
        int depth = 0;
        char quote = 0;
        for (int i = GRANT_KEYWORD.length() - 1; i < upperGrant.length(); i++) {
            char ch = upperGrant.charAt(i);
            if (quote != 0) {
                if (ch == quote) {
                    quote = 0;
                }
            } else if (ch == '`' || ch == '\'' || ch == '"') {
                quote = ch;
            } else if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && upperGrant.startsWith(ON_KEYWORD, i)) {
                return i;
            }
        }
        return -1;
    }

    static List<String> splitPrivileges(String privilegeList) {
        List<String> privileges = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < privilegeList.length(); i++) {
            char ch = privilegeList.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth = Math.max(0, depth - 1);
            } else if (ch == ',' && depth == 0) {
                privileges.add(privilegeList.substring(start, i).trim());
                start = i + 1;
            }
        }
        privileges.add(privilegeList.substring(start).trim());
        return privileges;
    }

    private static String firstWord(String privilege) {
        int end = 0;
        while (end < privilege.length() &&
                (Character.isLetter(privilege.charAt(end)) || privilege.charAt(end) == '_')) {
            end++;
        }
        return privilege.substring(0, end);
    }

    @Override
    public String toString() {
        return "GrantSet" + grants;
    }
}
