package hrl.core.model;

import hrl.core.error.ValidationException;

import java.util.regex.Pattern;

/**
 * Identifier grammar shared by every public entry point.
 *
 * <p>All identifiers end up inside store keys, where {@code #} separates key
 * components, so {@code #} is rejected everywhere.
 */
public final class Identifiers {

    public static final int MAX_IDENTIFIER_LENGTH = 256;
    public static final int MAX_RESOURCE_LENGTH = 96;
    public static final int MAX_NAME_LENGTH = 64;

    /** Resource name under which an entity keeps its fallback limits. */
    public static final String DEFAULT_RESOURCE = "_default_";

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_\\-.:@]*$");
    private static final Pattern RESOURCE = Pattern.compile("^[A-Za-z][A-Za-z0-9_\\-./]*$");
    private static final Pattern NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_\\-.]*$");
    private static final Pattern NAMESPACE = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_\\-.]*$");

    private Identifiers() {
    }

    /** Entity and parent ids. */
    public static String entityId(String value) {
        return identifier("entity_id", value);
    }

    public static String principal(String value) {
        return identifier("principal", value);
    }

    public static String identifier(String field, String value) {
        check(field, value, MAX_IDENTIFIER_LENGTH);
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new ValidationException(field, value,
                "must start with a letter or digit and contain only letters, digits, '_', '-', '.', ':' or '@'");
        }
        return value;
    }

    public static String resource(String value) {
        check("resource", value, MAX_RESOURCE_LENGTH);
        if (!RESOURCE.matcher(value).matches()) {
            throw new ValidationException("resource", value,
                "must start with a letter and contain only letters, digits, '_', '-', '.' or '/'");
        }
        return value;
    }

    /** Like {@link #resource(String)} but also accepts {@link #DEFAULT_RESOURCE}. */
    public static String configResource(String value) {
        if (DEFAULT_RESOURCE.equals(value)) return value;
        return resource(value);
    }

    public static String limitName(String value) {
        check("limit_name", value, MAX_NAME_LENGTH);
        if (!NAME.matcher(value).matches()) {
            throw new ValidationException("limit_name", value,
                "must start with a letter and contain only letters, digits, '_', '-' or '.'");
        }
        return value;
    }

    public static String namespace(String value) {
        check("namespace", value, MAX_NAME_LENGTH);
        if (!NAMESPACE.matcher(value).matches()) {
            throw new ValidationException("namespace", value,
                "must start with a letter or digit and contain only letters, digits, '_', '-' or '.'");
        }
        return value;
    }

    private static void check(String field, String value, int maxLength) {
        if (value == null || value.isEmpty()) {
            throw new ValidationException(field, "", "must not be empty");
        }
        if (value.length() > maxLength) {
            throw new ValidationException(field, value, "must not exceed " + maxLength + " characters");
        }
        if (value.indexOf('#') >= 0) {
            throw new ValidationException(field, value, "must not contain '#'");
        }
    }
}
