package org.carball.dpm.transform;

import org.carball.dpm.model.schema.LogicalType;
import org.carball.dpm.model.schema.RawType;

import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * One entry of the refinement rule table: when {@code matches} holds for a column name
 * and physical type, {@code outcome} decides its logical type.
 */
public record TypeRule(String name,
                       BiPredicate<String, RawType> matches,
                       BiFunction<String, RawType, LogicalType> outcome) {

    public static TypeRule fixed(String name, BiPredicate<String, RawType> matches, LogicalType type) {
        return new TypeRule(name, matches, (column, raw) -> type);
    }

    public boolean appliesTo(String column, RawType raw) {
        return matches.test(column, raw);
    }

    public LogicalType apply(String column, RawType raw) {
        return outcome.apply(column, raw);
    }
}
