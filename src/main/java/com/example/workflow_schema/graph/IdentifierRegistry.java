package com.example.workflow_schema.graph;

import java.util.HashSet;
import java.util.Set;

/**
 * Identifiers already handed out within one record. Create one per record and drop it
 * afterwards; sharing an instance across records leaks suffixes between unrelated graphs.
 */
public final class IdentifierRegistry {

    private final Set<String> seen = new HashSet<>();

    /** Returns {@code base}, or {@code base_2}, {@code base_3}, ... whichever is free first, and claims it. */
    public String claim(String base) {
        String candidate = base;
        int counter = 2;
        while (seen.contains(candidate)) {
            candidate = base + "_" + counter;
            counter++;
        }
        seen.add(candidate);
        return candidate;
    }

    public boolean isTaken(String id) {
        return seen.contains(id);
    }

    public int size() {
        return seen.size();
    }
}
