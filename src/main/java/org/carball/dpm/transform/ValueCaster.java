package org.carball.dpm.transform;

import lombok.extern.slf4j.Slf4j;
import org.carball.dpm.model.schema.Column;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Locale;
import java.util.Set;

/**
 * Converts raw driver values to the Java type matching a column's refined type.
 * A value that cannot be converted becomes null instead of failing its row.
 */
@Slf4j
public class ValueCaster {

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "y", "t", "on", "1", "-1");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "n", "f", "off", "0", "");

    public Object cast(String tableName, Column column, Object value) {
        if (value == null) {
            return null;
        }
        switch (column.getType()) {
            case DATE:
                return castDate(tableName, column, value);
            case DATETIME:
                return castDateTime(tableName, column, value);
            case BOOLEAN:
                return castBoolean(value);
            case IDENTIFIER:
                return value instanceof String ? value : String.valueOf(value);
            default:
                return value;
        }
    }

    private LocalDate castDate(String tableName, Column column, Object value) {
        if (value instanceof LocalDate date) {
            return date;
        } else if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        } else if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime().toLocalDate();
        } else if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        } else if (value instanceof Date date) {
            return date.toInstant().atZone(ZoneId.systemDefault()).toLocalDate();
        } else if (value instanceof String text) {
            try {
                return LocalDate.parse(datePart(text.trim()));
            } catch (DateTimeParseException e) {
                log.debug("Unparseable date '{}' in {}.{}, storing null", text, tableName, column.getName());
                return null;
            }
        }
        log.debug("Unexpected {} value in date column {}.{}, storing null",
                value.getClass().getSimpleName(), tableName, column.getName());
        return null;
    }

    private LocalDateTime castDateTime(String tableName, Column column, Object value) {
        if (value instanceof LocalDateTime dateTime) {
            return dateTime;
        } else if (value instanceof LocalDate date) {
            return date.atStartOfDay();
        } else if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        } else if (value instanceof java.sql.Date date) {
            return date.toLocalDate().atStartOfDay();
        } else if (value instanceof Date date) {
            return LocalDateTime.ofInstant(date.toInstant(), ZoneId.systemDefault());
        } else if (value instanceof String text) {
            String trimmed = text.trim();
            try {
                if (trimmed.length() == 10) {
                    return LocalDate.parse(trimmed).atStartOfDay();
                }
                return LocalDateTime.parse(trimmed.replace(' ', 'T'));
            } catch (DateTimeParseException e) {
                log.debug("Unparseable date-time '{}' in {}.{}, storing null", text, tableName, column.getName());
                return null;
            }
        }
        log.debug("Unexpected {} value in date-time column {}.{}, storing null",
                value.getClass().getSimpleName(), tableName, column.getName());
        return null;
    }

    static Boolean castBoolean(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        } else if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        String word = value.toString().trim().toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(word)) {
            return true;
        } else if (FALSE_WORDS.contains(word)) {
            return false;
        }
        return !word.isEmpty();
    }

    // Accepts date-time strings in date columns by keeping the date part only
    private static String datePart(String text) {
        if (text.length() > 10 && (text.charAt(10) == 'T' || text.charAt(10) == ' ')) {
            return text.substring(0, 10);
        }
        return text;
    }
}
