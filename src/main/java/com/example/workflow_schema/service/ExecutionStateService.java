package com.example.workflow_schema.service;

import com.example.workflow_schema.config.ExtractionOptions;
import com.example.workflow_schema.dto.ExecutionStateItem;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Folds enumerated paths into a prefix-keyed state map.
 *
 * <p>Paths {@code [A, B, C]} and {@code [A, B, D]} share the prefix {@code [A, B]}, whose
 * state then lists both {@code C} and {@code D} as available next.
 */
@Service
public class ExecutionStateService {

    public List<ExecutionStateItem> buildExecutionStates(List<List<String>> uniquePaths, ExtractionOptions opt) {
        Map<List<String>, Set<String>> stateMap = new LinkedHashMap<>();
        Set<List<String>> terminal = new HashSet<>();

        int limit = Math.min(uniquePaths.size(), opt.getMaxPaths());
        for (List<String> path : uniquePaths.subList(0, limit)) {
            for (int step = 0; step <= path.size(); step++) {
                List<String> completed = List.copyOf(path.subList(0, step));
                Set<String> available = stateMap.computeIfAbsent(completed, k -> new TreeSet<>());
                if (step < path.size()) {
                    available.add(path.get(step));
                } else {
                    terminal.add(completed);
                }
            }
        }

        List<ExecutionStateItem> states = new ArrayList<>(stateMap.size());
        for (Map.Entry<List<String>, Set<String>> e : stateMap.entrySet()) {
            states.add(new ExecutionStateItem(
                    new ArrayList<>(e.getKey()),
                    new ArrayList<>(e.getValue()),
                    terminal.contains(e.getKey())));
        }
        return states;
    }
}
