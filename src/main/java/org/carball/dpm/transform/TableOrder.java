package org.carball.dpm.transform;

import java.util.List;

/**
 * Creation order of the tables, dependencies first, plus a note for every point where
 * a dependency cycle had to be broken.
 */
public record TableOrder(List<String> tables, List<String> advisories) {

    public boolean hasCycles() {
        return !advisories.isEmpty();
    }

    public int positionOf(String table) {
        return tables.indexOf(table);
    }
}
