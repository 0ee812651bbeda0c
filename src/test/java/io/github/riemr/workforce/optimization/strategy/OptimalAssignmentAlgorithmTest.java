package io.github.riemr.workforce.optimization.strategy;

import io.github.riemr.workforce.domain.model.Assignment;
import io.github.riemr.workforce.domain.model.Position;
import io.github.riemr.workforce.domain.model.Task;
import io.github.riemr.workforce.domain.model.Worker;
import io.github.riemr.workforce.exception.SolverFailureException;
import io.github.riemr.workforce.optimization.solver.BinaryProgram;
import io.github.riemr.workforce.optimization.solver.BinaryProgramSolver;
import io.github.riemr.workforce.optimization.solver.BranchAndBoundBinaryProgramSolver;
import io.github.riemr.workforce.optimization.solver.OrToolsBinaryProgramSolver;
import io.github.riemr.workforce.optimization.solver.SolverBackend;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.assertj.core.groups.Tuple.tuple;

class OptimalAssignmentAlgorithmTest {

    private static final LocalDate D1 = LocalDate.of(2025, 1, 11);
    private static final LocalDate D2 = LocalDate.of(2025, 1, 12);
    private static final Position P1 = new Position(1L, "Position 1");
    private static final Position P2 = new Position(2L, "Position 2");

    private final OptimalAssignmentAlgorithm algorithm =
            new OptimalAssignmentAlgorithm(new BranchAndBoundBinaryProgramSolver(1_000_000));

    @Test
    void twoWorkersCoverEightAndSixHourTasks() {
        Worker w1 = new Worker(1L, "Worker 1", P1);
        Worker w2 = new Worker(2L, "Worker 2", P1);
        List<Task> tasks = List.of(new Task(1L, P1, 8, D1), new Task(2L, P1, 6, D1));

        AssignmentOutcome outcome = algorithm.assign(tasks, List.of(w1, w2), 8);

        assertThat(outcome.unassignedTasks()).isEmpty();
        assertThat(outcome.assignments()).extracting(a -> a.getWorker().getId()).doesNotHaveDuplicates();
        assertThat(outcome.ledger().maxLoad()).isEqualTo(8);
    }

    @Test
    void beatsGreedyWhenShortestFirstWastesCapacity() {
        // 貪欲法は 3h を先に入れて 6h が入らなくなる。厳密解は 6h + 2h を選ぶ
        Worker w = new Worker(1L, "Worker 1", P1);
        List<Task> tasks = List.of(
                new Task(1L, P1, 3, D1),
                new Task(2L, P1, 6, D1),
                new Task(3L, P1, 2, D1));

        AssignmentOutcome exact = algorithm.assign(tasks, List.of(w), 8);
        AssignmentOutcome greedy = new GreedyAssignmentAlgorithm().assign(tasks, List.of(w), 8);

        assertThat(exact.assignedHours()).isEqualTo(8);
        assertThat(greedy.assignedHours()).isEqualTo(5);
        assertThat(exact.assignments()).extracting(a -> a.getTask().getId()).containsExactly(2L, 3L);
    }

    @Test
    void fiveThreeHourTasksFitTwoPerDay() {
        Worker w = new Worker(1L, "Worker 1", P1);
        List<Task> tasks = new ArrayList<>();
        for (long i = 1; i <= 5; i++) tasks.add(new Task(i, P1, 3, D1));

        AssignmentOutcome outcome = algorithm.assign(tasks, List.of(w), 8);

        assertThat(outcome.assignedHours()).isEqualTo(6);
        assertThat(outcome.unassignedTasks()).hasSize(3);
    }

    @Test
    void noEligibleWorkerSkipsSolver() {
        BinaryProgramSolver solver = mock(BinaryProgramSolver.class);
        OptimalAssignmentAlgorithm exact = new OptimalAssignmentAlgorithm(solver);
        List<Task> tasks = List.of(new Task(1L, P2, 4, D1), new Task(2L, P2, 2, D1));

        AssignmentOutcome outcome = exact.assign(tasks, List.of(new Worker(1L, "Worker 1", P1)), 8);

        assertThat(outcome.assignments()).isEmpty();
        assertThat(outcome.unassignedTasks()).extracting(Task::getId).containsExactly(1L, 2L);
        verify(solver, never()).solve(any());
    }

    @Test
    void onlyMatchingPairsBecomeVariables() {
        BinaryProgramSolver solver = mock(BinaryProgramSolver.class);
        when(solver.solve(any())).thenReturn(new boolean[]{true, false, true});
        OptimalAssignmentAlgorithm exact = new OptimalAssignmentAlgorithm(solver);
        Worker w1 = new Worker(1L, "Worker 1", P1);
        Worker w2 = new Worker(2L, "Worker 2", P1);
        Worker w3 = new Worker(3L, "Worker 3", P2);
        List<Task> tasks = List.of(
                new Task(1L, P1, 4, D1),
                new Task(2L, P2, 5, D1),
                new Task(3L, null, 2, D1));

        AssignmentOutcome outcome = exact.assign(tasks, List.of(w1, w2, w3), 8);

        ArgumentCaptor<BinaryProgram> captor = ArgumentCaptor.forClass(BinaryProgram.class);
        verify(solver).solve(captor.capture());
        BinaryProgram program = captor.getValue();
        // task1 x {w1, w2}, task2 x {w3}; task3 には候補なし
        assertThat(program.variableCount()).isEqualTo(3);
        assertThat(program.objectiveCoefficient(0)).isEqualTo(4.0);
        assertThat(program.objectiveCoefficient(2)).isEqualTo(5.0);
        assertThat(outcome.assignments())
                .extracting(a -> a.getTask().getId(), a -> a.getWorker().getId())
                .containsExactly(
                        tuple(1L, 1L),
                        tuple(2L, 3L));
        assertThat(outcome.unassignedTasks()).extracting(Task::getId).containsExactly(3L);
        assertThat(outcome.ledger().load(3L, D1)).isEqualTo(5);
    }

    @Test
    void solverFailurePropagates() {
        BinaryProgramSolver solver = mock(BinaryProgramSolver.class);
        when(solver.solve(any())).thenThrow(new SolverFailureException("NOT_SOLVED", "time limit"));
        OptimalAssignmentAlgorithm exact = new OptimalAssignmentAlgorithm(solver);
        List<Task> tasks = List.of(new Task(1L, P1, 4, D1));

        assertThatThrownBy(() -> exact.assign(tasks, List.of(new Worker(1L, "Worker 1", P1)), 8))
                .isInstanceOf(SolverFailureException.class)
                .extracting("solverStatus").isEqualTo("NOT_SOLVED");
    }

    @Test
    void neverAssignsLessThanGreedyOnRandomInputs() {
        Random random = new Random(42);
        Position[] positions = {P1, P2, null};
        LocalDate[] dates = {D1, D2};
        GreedyAssignmentAlgorithm greedy = new GreedyAssignmentAlgorithm();

        for (int round = 0; round < 40; round++) {
            List<Worker> workers = new ArrayList<>();
            int workerCount = 1 + random.nextInt(3);
            for (long i = 1; i <= workerCount; i++) {
                workers.add(new Worker(i, "Worker " + i, positions[random.nextInt(positions.length)]));
            }
            List<Task> tasks = new ArrayList<>();
            int taskCount = random.nextInt(9);
            for (long i = 1; i <= taskCount; i++) {
                tasks.add(new Task(i, positions[random.nextInt(positions.length)],
                        1 + random.nextInt(8), dates[random.nextInt(dates.length)]));
            }

            AssignmentOutcome exact = algorithm.assign(tasks, workers, 8);
            AssignmentOutcome heuristic = greedy.assign(tasks, workers, 8);

            assertThat(exact.assignedHours()).isGreaterThanOrEqualTo(heuristic.assignedHours());
            assertThat(exact.assignments().size() + exact.unassignedTasks().size()).isEqualTo(tasks.size());
            for (Assignment a : exact.assignments()) {
                assertThat(a.getWorker().positionKey()).isEqualTo(a.getTask().positionKey());
            }
            exact.ledger().entries().values().forEach(h -> assertThat(h).isBetween(0, 8));
        }
    }

    @Test
    void equalTasksAreTreatedAsSeparateTasks() {
        Worker w = new Worker(1L, "Worker 1", P1);
        Task task = new Task(1L, P1, 5, D1);
        List<Task> tasks = List.of(task, new Task(1L, P1, 5, D1));

        AssignmentOutcome exact = algorithm.assign(tasks, List.of(w), 8);
        AssignmentOutcome greedy = new GreedyAssignmentAlgorithm().assign(tasks, List.of(w), 8);

        assertThat(exact.assignments()).hasSize(1);
        assertThat(exact.unassignedTasks()).hasSize(1);
        assertThat(exact.ledger().load(1L, D1)).isEqualTo(5);
        assertThat(exact.assignedHours()).isEqualTo(greedy.assignedHours());
    }

    @Test
    void equalTasksCanGoToDifferentWorkers() {
        List<Worker> workers = List.of(new Worker(1L, "Worker 1", P1), new Worker(2L, "Worker 2", P1));
        List<Task> tasks = List.of(new Task(1L, P1, 5, D1), new Task(1L, P1, 5, D1));

        AssignmentOutcome outcome = algorithm.assign(tasks, workers, 8);

        assertThat(outcome.unassignedTasks()).isEmpty();
        assertThat(outcome.assignments()).extracting(a -> a.getWorker().getId()).containsExactlyInAnyOrder(1L, 2L);
    }

    @Test
    void scipBackendSolvesSharedCapacityScenarios() {
        OptimalAssignmentAlgorithm scip = new OptimalAssignmentAlgorithm(
                new OrToolsBinaryProgramSolver(SolverBackend.SCIP, Duration.ofSeconds(30)));
        List<Worker> workers = List.of(new Worker(1L, "Worker 1", P1), new Worker(2L, "Worker 2", P1));
        List<Task> tasks = List.of(
                new Task(1L, P1, 8, D1),
                new Task(2L, P1, 6, D1),
                new Task(3L, P1, 2, D1),
                new Task(4L, P2, 3, D1));

        AssignmentOutcome outcome = scip.assign(tasks, workers, 8);

        assertThat(outcome.assignedHours()).isEqualTo(16);
        assertThat(outcome.unassignedTasks()).extracting(Task::getId).containsExactly(4L);
        assertThat(outcome.ledger().maxLoad()).isEqualTo(8);
        for (Assignment a : outcome.assignments()) {
            assertThat(a.getWorker().positionKey()).isEqualTo(a.getTask().positionKey());
        }
    }
}
