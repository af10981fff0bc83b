package org.carball.dpm.generation;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Identifiers already taken within one generated scope. A name that is already taken is
 * given the first free numeric suffix starting at 2.
 */
@Slf4j
class NameRegistry {

    private final String scope;
    private final Set<String> used = new HashSet<>();

    NameRegistry(String scope) {
        this.scope = scope;
    }

    NameRegistry(String scope, Collection<String> reserved) {
        this(scope);
        reserved.forEach(this::reserve);
    }

    void reserve(String name) {
        used.add(key(name));
    }

    boolean isTaken(String name) {
        return used.contains(key(name));
    }

    String claim(String candidate) {
        if (used.add(key(candidate))) {
            return candidate;
        }
        int suffix = 2;
        while (isTaken(candidate + suffix)) {
            suffix++;
        }
        String resolved = candidate + suffix;
        used.add(key(resolved));
        log.warn("Name {} already used in {}, using {}", candidate, scope, resolved);
        return resolved;
    }

    // Nested types compile to class files named after them, so case must not matter
    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
