package io.github.riemr.workforce.optimization.strategy;

import io.github.riemr.workforce.domain.model.Assignment;
import io.github.riemr.workforce.domain.model.Task;
import io.github.riemr.workforce.optimization.entity.CapacityLedger;

import java.util.List;

/**
 * 戦略の出力。割当済み・未割当・台帳の三つ組で、KPI 計算にそのまま渡す。
 */
public record AssignmentOutcome(List<Assignment> assignments,
                                List<Task> unassignedTasks,
                                CapacityLedger ledger) {

    public AssignmentOutcome {
        assignments = List.copyOf(assignments);
        unassignedTasks = List.copyOf(unassignedTasks);
    }

    public int assignedHours() {
        return assignments.stream().mapToInt(Assignment::getHours).sum();
    }
}
