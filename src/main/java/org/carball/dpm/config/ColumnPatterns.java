package org.carball.dpm.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Naming conventions used to recognise column kinds. All matches are case-insensitive.
 */
@Data
public class ColumnPatterns {

    @JsonProperty("enum_suffixes")
    private List<String> enumSuffixes = new ArrayList<>(List.of(
            "type", "status", "sign", "optionality", "direction", "number",
            "endorsement", "source", "severity", "errorcode"));

    @JsonProperty("identifier_suffixes")
    private List<String> identifierSuffixes = new ArrayList<>(List.of("guid"));

    @JsonProperty("boolean_prefixes")
    private List<String> booleanPrefixes = new ArrayList<>(List.of("is", "has"));

    @JsonProperty("date_suffixes")
    private List<String> dateSuffixes = new ArrayList<>(List.of("date"));

    public boolean isIdentifier(String column) {
        return endsWithAny(column, identifierSuffixes);
    }

    public boolean isDate(String column) {
        return endsWithAny(column, dateSuffixes);
    }

    public boolean isBoolean(String column) {
        String lower = column.toLowerCase(Locale.ROOT);
        return booleanPrefixes.stream().anyMatch(p -> lower.startsWith(p.toLowerCase(Locale.ROOT)));
    }

    public boolean isEnum(String column) {
        return endsWithAny(column, enumSuffixes);
    }

    private static boolean endsWithAny(String column, List<String> suffixes) {
        String lower = column.toLowerCase(Locale.ROOT);
        return suffixes.stream().anyMatch(s -> lower.endsWith(s.toLowerCase(Locale.ROOT)));
    }
}
