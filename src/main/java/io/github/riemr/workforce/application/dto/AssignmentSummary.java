package io.github.riemr.workforce.application.dto;

import java.util.List;

public record AssignmentSummary(
    int assignedCount,
    int unassignedCount,
    List<Long> unassignedTaskIds,
    int distinctPositionCount
) {
    public AssignmentSummary {
        unassignedTaskIds = List.copyOf(unassignedTaskIds);
    }
}
