package com.example.workflow_schema.service;

import static org.assertj.core.api.Assertions.*;

import com.example.workflow_schema.config.ExtractionOptions;
import com.example.workflow_schema.dto.ExecutionStateItem;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExecutionStateServiceTest {

    private final ExecutionStateService service = new ExecutionStateService();

    @Test
    @DisplayName("should merge shared prefixes and sort the available actions")
    void testSharedPrefix() {
        // Given
        List<List<String>> paths = List.of(List.of("a", "b", "d"), List.of("a", "b", "c"));

        // When
        List<ExecutionStateItem> states = service.buildExecutionStates(paths, new ExtractionOptions());

        // Then
        assertThat(states).extracting(ExecutionStateItem::getCompletedActions).containsExactly(
                List.of(), List.of("a"), List.of("a", "b"), List.of("a", "b", "d"), List.of("a", "b", "c"));
        assertThat(states.get(2).getAvailableNext()).containsExactly("c", "d");
        assertThat(states.get(2).canTerminate()).isFalse();
        assertThat(states.get(3).getAvailableNext()).isEmpty();
        assertThat(states.get(3).canTerminate()).isTrue();
    }

    @Test
    @DisplayName("should mark a prefix that both ends a path and continues another")
    void testTerminalPrefix() {
        // Given
        List<List<String>> paths = List.of(List.of("a"), List.of("a", "b"));

        // When
        List<ExecutionStateItem> states = service.buildExecutionStates(paths, new ExtractionOptions());

        // Then
        assertThat(states).hasSize(3);
        assertThat(states.get(1).getCompletedActions()).containsExactly("a");
        assertThat(states.get(1).getAvailableNext()).containsExactly("b");
        assertThat(states.get(1).getCanTerminate()).isTrue();
        assertThat(states.get(0).getCanTerminate()).isNull();
    }

    @Test
    @DisplayName("should fold only the first maxPaths paths")
    void testMaxPaths() {
        // Given
        List<List<String>> paths = List.of(List.of("a"), List.of("b"), List.of("c"));

        // When
        List<ExecutionStateItem> states = service.buildExecutionStates(paths, new ExtractionOptions().maxPaths(2));

        // Then
        assertThat(states.get(0).getAvailableNext()).containsExactly("a", "b");
        assertThat(states).hasSize(3);
    }

    @Test
    @DisplayName("should give an empty terminal state for a single empty path and nothing for no paths")
    void testEmptyInputs() {
        // When
        List<ExecutionStateItem> fromEmptyPath =
                service.buildExecutionStates(List.of(List.of()), new ExtractionOptions());
        List<ExecutionStateItem> fromNoPaths =
                service.buildExecutionStates(List.of(), new ExtractionOptions());

        // Then
        assertThat(fromEmptyPath).hasSize(1);
        assertThat(fromEmptyPath.get(0).getAvailableNext()).isEmpty();
        assertThat(fromEmptyPath.get(0).canTerminate()).isTrue();
        assertThat(fromNoPaths).isEmpty();
    }
}
