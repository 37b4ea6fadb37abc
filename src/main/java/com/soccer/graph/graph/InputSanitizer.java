package com.soccer.graph.graph;

import com.soccer.graph.core.model.EntityKind;

import java.util.regex.Pattern;

/**
 * Guards on what the exporter puts into a Cypher statement. Labels, relationship types
 * and property names are spliced into the statement text; keys and string values travel
 * as parameters but are still bounded.
 */
public final class InputSanitizer {

    public static final int MAX_KEY_LENGTH = 1000;

    public static final int MAX_CYPHER_VALUE_LENGTH = 4000;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private InputSanitizer() {
        // utility class
    }

    /**
     * Checks the identity key of a node: team or stadium name, match key, player id.
     * Keys are single-line, so every control character is refused.
     *
     * @return the key
     * @throws IllegalArgumentException if the key is blank, too long or holds a control character
     */
    public static String requireKey(EntityKind kind, String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException(kind.label() + " key is blank");
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException(kind.label() + " key has " + key.length()
                    + " characters, at most " + MAX_KEY_LENGTH + " are allowed");
        }
        for (int i = 0; i < key.length(); i++) {
            if (Character.isISOControl(key.charAt(i))) {
                throw new IllegalArgumentException(kind.label() + " key has a control character at "
                        + i + ": '" + key.substring(0, i) + "...'");
            }
        }
        return key;
    }

    /**
     * Checks a name that goes into the statement text unquoted.
     *
     * @return the identifier
     * @throws IllegalArgumentException unless it is a letter or underscore followed by letters, digits or underscores
     */
    public static String requireIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Not a Cypher identifier: '" + identifier + "'");
        }
        return identifier;
    }

    /**
     * @return the value, which may be null
     * @throws IllegalArgumentException if the value is longer than {@link #MAX_CYPHER_VALUE_LENGTH}
     */
    public static String requireValueLength(String value) {
        if (value != null && value.length() > MAX_CYPHER_VALUE_LENGTH) {
            throw new IllegalArgumentException("String value has " + value.length()
                    + " characters, at most " + MAX_CYPHER_VALUE_LENGTH + " are allowed");
        }
        return value;
    }
}
