package org.carball.dpm.transform;

import org.carball.dpm.config.ColumnPatterns;
import org.carball.dpm.config.ConversionConfig;
import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.LogicalType;
import org.carball.dpm.model.schema.RawType;

import java.sql.Types;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Corrects the loosely typed physical schema of the source. The source stores GUIDs,
 * dates and flags in generic integer or text columns, so the name of a column is a
 * better guide to its meaning than its declared type.
 * <p>
 * Rules are evaluated in order and the first match wins:
 * <ol>
 *   <li>exact-name override</li>
 *   <li>identifier suffix, e.g. {@code RowGUID}</li>
 *   <li>date suffix, e.g. {@code ValidFromDate}</li>
 *   <li>boolean prefix, e.g. {@code IsAbstract}</li>
 *   <li>the physical type widened to its generic class</li>
 * </ol>
 */
public class TypeRefiner {

    private final List<TypeRule> rules;

    public TypeRefiner(ConversionConfig config) {
        Map<String, LogicalType> overrides = config.getColumnTypeOverrides();
        ColumnPatterns patterns = config.getPatterns();

        this.rules = List.of(
                new TypeRule("override",
                        (column, raw) -> overrides.containsKey(column),
                        (column, raw) -> overrides.get(column)),
                TypeRule.fixed("identifier-suffix", (column, raw) -> patterns.isIdentifier(column), LogicalType.IDENTIFIER),
                TypeRule.fixed("date-suffix", (column, raw) -> patterns.isDate(column), LogicalType.DATE),
                TypeRule.fixed("boolean-prefix", (column, raw) -> patterns.isBoolean(column), LogicalType.BOOLEAN),
                new TypeRule("widen", (column, raw) -> true, (column, raw) -> widen(raw)));
    }

    public List<TypeRule> getRules() {
        return rules;
    }

    public LogicalType refine(String columnName, RawType rawType) {
        for (TypeRule rule : rules) {
            if (rule.appliesTo(columnName, rawType)) {
                return rule.apply(columnName, rawType);
            }
        }
        throw new IllegalStateException("No refinement rule matched " + columnName);
    }

    public Column refine(Column column) {
        return column.toBuilder()
                .type(refine(column.getName(), column.getRawType()))
                .build();
    }

    /**
     * Collapses driver-specific storage types to one generic type per family, so that
     * e.g. BYTE, SHORT and LONG columns all end up as {@link LogicalType#INTEGER}.
     */
    static LogicalType widen(RawType raw) {
        switch (raw.jdbcType()) {
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
                return LogicalType.INTEGER;
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE:
                return LogicalType.FLOAT;
            case Types.CHAR:
            case Types.VARCHAR:
            case Types.LONGVARCHAR:
            case Types.NCHAR:
            case Types.NVARCHAR:
            case Types.LONGNVARCHAR:
            case Types.CLOB:
            case Types.NCLOB:
                return LogicalType.TEXT;
            case Types.DATE:
                return LogicalType.DATE;
            case Types.TIME:
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return LogicalType.DATETIME;
            case Types.BIT:
            case Types.BOOLEAN:
                return LogicalType.BOOLEAN;
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return LogicalType.BINARY;
            case Types.NUMERIC:
            case Types.DECIMAL:
                return widenByName(raw.typeName(), LogicalType.DECIMAL);
            default:
                return widenByName(raw.typeName(), LogicalType.TEXT);
        }
    }

    // Drivers report affinity-only codes for some declarations, so fall back on the type name
    private static LogicalType widenByName(String typeName, LogicalType fallback) {
        if (typeName == null) {
            return fallback;
        }
        String upper = typeName.toUpperCase(Locale.ROOT);
        if (upper.contains("INT") || upper.equals("COUNTER") || upper.equals("LONG") || upper.equals("BYTE")) {
            return LogicalType.INTEGER;
        } else if (upper.contains("BOOL") || upper.equals("BIT") || upper.equals("YESNO")) {
            return LogicalType.BOOLEAN;
        } else if (upper.contains("TIMESTAMP") || upper.contains("DATETIME")) {
            return LogicalType.DATETIME;
        } else if (upper.contains("DATE")) {
            return LogicalType.DATE;
        } else if (upper.contains("CHAR") || upper.contains("TEXT") || upper.contains("MEMO") || upper.contains("CLOB")) {
            return LogicalType.TEXT;
        } else if (upper.contains("DEC") || upper.contains("NUMERIC") || upper.contains("MONEY") || upper.contains("CURRENCY")) {
            return LogicalType.DECIMAL;
        } else if (upper.contains("REAL") || upper.contains("FLOA") || upper.contains("DOUB") || upper.contains("SINGLE")) {
            return LogicalType.FLOAT;
        } else if (upper.contains("BLOB") || upper.contains("BINARY") || upper.contains("OLE")) {
            return LogicalType.BINARY;
        }
        return fallback;
    }
}
