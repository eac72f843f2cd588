package com.gaming.rewire.api;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Result of one reachability check.
 *
 * @param unvisited      areas not reached, in graph order.
 * @param records        reached areas in the order they were reached.
 * @param unvisitedItems key items none of whose locations was reached.
 */
public record CheckRecord(Set<String> unvisited, Map<String, NodeRecord> records, Set<String> unvisitedItems) {

    public CheckRecord {
        unvisited = Collections.unmodifiableSet(unvisited);
        records = Collections.unmodifiableMap(records);
        unvisitedItems = Collections.unmodifiableSet(unvisitedItems);
    }

    public NodeRecord record(String area) {
        return records.get(area);
    }

    public boolean reached(String area) {
        return records.containsKey(area);
    }
}
