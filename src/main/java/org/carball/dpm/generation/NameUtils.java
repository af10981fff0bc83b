package org.carball.dpm.generation;

import javax.lang.model.SourceVersion;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case conversions between source database identifiers and Java identifiers.
 */
public final class NameUtils {

    private static final Pattern WORD_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])|([A-Z])([A-Z][a-z])");
    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^A-Za-z0-9]+");

    private NameUtils() {
    }

    /**
     * {@code ConceptGUID} becomes {@code concept_guid}, {@code HTMLCode} becomes {@code html_code}.
     */
    public static String toSnakeCase(String name) {
        String separated = WORD_BOUNDARY.matcher(name).replaceAll("$1$3_$2$4");
        String cleaned = NON_IDENTIFIER.matcher(separated).replaceAll("_");
        return trimUnderscores(cleaned).toLowerCase(Locale.ROOT);
    }

    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal.isEmpty()) {
            return pascal;
        }
        return Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
    }

    public static String toPascalCase(String name) {
        StringBuilder result = new StringBuilder();
        for (String part : toSnakeCase(name).split("_")) {
            if (!part.isEmpty()) {
                result.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        return leadingDigitSafe(result.toString());
    }

    /**
     * Enum constant for a raw domain value: {@code "Non-negative"} becomes {@code NON_NEGATIVE}.
     */
    public static String toConstantName(String value) {
        String constant = toSnakeCase(value).toUpperCase(Locale.ROOT);
        if (constant.isEmpty()) {
            return "EMPTY";
        }
        return escapeKeyword(leadingDigitSafe(constant));
    }

    public static String escapeKeyword(String identifier) {
        return SourceVersion.isKeyword(identifier) ? identifier + "_" : identifier;
    }

    /**
     * English plural for collection field names. Covers the regular forms found in table names.
     */
    public static String pluralize(String noun) {
        String lower = noun.toLowerCase(Locale.ROOT);
        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("ch") || lower.endsWith("sh")) {
            return noun + "es";
        }
        if (lower.endsWith("y") && lower.length() > 1 && "aeiou".indexOf(lower.charAt(lower.length() - 2)) < 0) {
            return noun.substring(0, noun.length() - 1) + "ies";
        }
        return noun + "s";
    }

    private static String leadingDigitSafe(String identifier) {
        if (!identifier.isEmpty() && Character.isDigit(identifier.charAt(0))) {
            return "_" + identifier;
        }
        return identifier;
    }

    private static String trimUnderscores(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '_') {
            end--;
        }
        return value.substring(start, end);
    }
}
