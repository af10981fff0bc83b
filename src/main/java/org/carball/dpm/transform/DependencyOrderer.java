package org.carball.dpm.transform;

import lombok.extern.slf4j.Slf4j;
import org.carball.dpm.model.schema.DatabaseSchema;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Orders tables so that each comes after the tables it references. Uses Kahn's
 * algorithm with name order among ready tables. When no table is ready, the first table
 * by name that lies on a cycle is released early and an advisory is recorded; tables
 * that merely depend on a cycle keep waiting for it. The sort never fails.
 */
@Slf4j
public class DependencyOrderer {

    public TableOrder order(DatabaseSchema schema) {
        Map<String, Set<String>> dependencies = new TreeMap<>();
        Map<String, Set<String>> dependents = new HashMap<>();
        for (String table : schema.getTableNames()) {
            Set<String> deps = schema.dependenciesOf(table);
            dependencies.put(table, deps);
            for (String dep : deps) {
                dependents.computeIfAbsent(dep, k -> new TreeSet<>()).add(table);
            }
        }

        Map<String, Integer> inDegree = new HashMap<>();
        TreeSet<String> ready = new TreeSet<>();
        dependencies.forEach((table, deps) -> {
            inDegree.put(table, deps.size());
            if (deps.isEmpty()) {
                ready.add(table);
            }
        });

        List<String> ordered = new ArrayList<>(dependencies.size());
        List<String> advisories = new ArrayList<>();
        Set<String> emitted = new HashSet<>();

        while (ordered.size() < dependencies.size()) {
            if (ready.isEmpty()) {
                String forced = firstCycleMember(dependencies, emitted);
                Set<String> waitingOn = new TreeSet<>(dependencies.get(forced));
                waitingOn.removeAll(emitted);
                String advisory = String.format("Dependency cycle broken at %s (still waiting on %s)",
                        forced, String.join(", ", waitingOn));
                log.warn(advisory);
                advisories.add(advisory);
                ready.add(forced);
            }

            String next = ready.pollFirst();
            ordered.add(next);
            emitted.add(next);

            for (String dependent : dependents.getOrDefault(next, Set.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0 && !emitted.contains(dependent)) {
                    ready.add(dependent);
                }
            }
        }

        return new TableOrder(List.copyOf(ordered), List.copyOf(advisories));
    }

    // Every remaining table waits on another remaining one, so at least one cycle exists
    private static String firstCycleMember(Map<String, Set<String>> dependencies, Set<String> emitted) {
        for (String candidate : dependencies.keySet()) {
            if (!emitted.contains(candidate) && reachesItself(candidate, dependencies, emitted)) {
                return candidate;
            }
        }
        throw new IllegalStateException("No table is ready and none of the remaining tables is on a cycle");
    }

    private static boolean reachesItself(String start, Map<String, Set<String>> dependencies, Set<String> emitted) {
        Deque<String> pending = new ArrayDeque<>(dependencies.get(start));
        Set<String> visited = new HashSet<>();
        while (!pending.isEmpty()) {
            String next = pending.pop();
            if (next.equals(start)) {
                return true;
            }
            if (emitted.contains(next) || !visited.add(next)) {
                continue;
            }
            pending.addAll(dependencies.get(next));
        }
        return false;
    }
}
