package dk.cloudcreate.eventcore.common.persistence;

import java.util.regex.Pattern;

import static dk.cloudcreate.eventcore.common.MessageFormatter.msg;

/**
 * Table and column names are concatenated into SQL statements, so they're restricted to plain identifiers
 */
public final class SqlIdentifiers {
    private static final Pattern VALID_IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]{0,62}");

    private SqlIdentifiers() {
    }

    /**
     * @param identifier the table or column name
     * @return the <code>identifier</code>
     * @throws IllegalArgumentException if the identifier isn't a plain SQL identifier
     */
    public static String requireValidSqlIdentifier(String identifier) {
        if (identifier == null || !VALID_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException(msg("'{}' isn't a valid table or column name", identifier));
        }
        return identifier;
    }
}
