package com.qcollector.backend.util;

import java.util.regex.Pattern;

/**
 * Guards for names and types that end up inside SQL text. Form tables and columns are created
 * by the engine itself, so anything outside these patterns is rejected rather than escaped.
 *
 * <p>Names are lower case only. DDL and rollback statements use them unquoted, which PostgreSQL
 * folds to lower case, while row reads and restores quote them; both spellings then resolve to
 * the same column.
 */
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");
    private static final Pattern DATA_TYPE = Pattern.compile("^[A-Za-z][A-Za-z0-9_ ]*(\\(\\s*\\d+(\\s*,\\s*\\d+)?\\s*\\))?(\\[\\])?$");

    private SqlIdentifiers() {
    }

    public static boolean isValid(String identifier) {
        return identifier != null && IDENTIFIER.matcher(identifier).matches();
    }

    public static boolean isValidType(String dataType) {
        return dataType != null && DATA_TYPE.matcher(dataType.trim()).matches();
    }

    public static String requireValid(String identifier) {
        if (!isValid(identifier)) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
        }
        return identifier;
    }

    public static String quote(String identifier) {
        return "\"" + requireValid(identifier) + "\"";
    }
}
