package io.github.riemr.workforce.optimization.strategy;

import io.github.riemr.workforce.domain.model.Assignment;
import io.github.riemr.workforce.domain.model.PositionKey;
import io.github.riemr.workforce.domain.model.Task;
import io.github.riemr.workforce.domain.model.Worker;
import io.github.riemr.workforce.optimization.entity.CapacityLedger;
import io.github.riemr.workforce.optimization.entity.WorkerDay;
import io.github.riemr.workforce.optimization.solver.BinaryProgram;
import io.github.riemr.workforce.optimization.solver.BinaryProgramSolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 0-1 整数計画による厳密な割当。
 * <ul>
 *   <li>変数: 職種が一致する (タスク, 作業者) の組ごとに1つ。不一致の組は生成しない</li>
 *   <li>目的: Σ 所要時間 × x を最大化（= 未割当時間の最小化）</li>
 *   <li>制約A: 各タスクの担当者は高々1人</li>
 *   <li>制約B: 作業者×日付ごとに Σ 所要時間 × x ≤ 日次上限</li>
 * </ul>
 * ソルバーが最適解に到達しない場合は {@link io.github.riemr.workforce.exception.SolverFailureException}
 * をそのまま伝播させる。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OptimalAssignmentAlgorithm implements AssignmentAlgorithm {

    private final BinaryProgramSolver solver;

    @Override
    public AssignmentStrategy strategy() {
        return AssignmentStrategy.LP;
    }

    @Override
    public AssignmentOutcome assign(List<Task> tasks, List<Worker> workers, int dailyCapacity) {
        Map<PositionKey, List<Worker>> workersByPosition = new LinkedHashMap<>();
        for (Worker w : workers) {
            workersByPosition.computeIfAbsent(w.positionKey(), k -> new ArrayList<>()).add(w);
        }

        BinaryProgram.Builder model = BinaryProgram.builder();
        List<Candidate> candidates = new ArrayList<>();
        // タスクは入力リスト上の位置で識別する（値が等しいタスクも別々に扱う）
        Map<Integer, Map<Integer, Double>> perTask = new LinkedHashMap<>();
        Map<WorkerDay, Map<Integer, Double>> perWorkerDay = new LinkedHashMap<>();

        for (int t = 0; t < tasks.size(); t++) {
            Task task = tasks.get(t);
            List<Worker> eligible = workersByPosition.getOrDefault(task.positionKey(), List.of());
            for (Worker w : eligible) {
                int index = model.addVariable("x_" + task.getId() + "_" + w.getId(), task.getDuration());
                candidates.add(new Candidate(t, w));
                perTask.computeIfAbsent(t, k -> new LinkedHashMap<>()).put(index, 1.0);
                perWorkerDay.computeIfAbsent(new WorkerDay(w.getId(), task.getDate()), k -> new LinkedHashMap<>())
                        .put(index, (double) task.getDuration());
            }
        }

        if (candidates.isEmpty()) {
            // 適格な作業者が1人もいない: ソルバーを呼ばずに全件未割当
            return new AssignmentOutcome(List.of(), tasks, new CapacityLedger(dailyCapacity));
        }

        for (var e : perTask.entrySet()) {
            model.addConstraint("one_worker_" + e.getKey() + "_" + tasks.get(e.getKey()).getId(), e.getValue(), 1);
        }
        for (var e : perWorkerDay.entrySet()) {
            model.addConstraint("capacity_" + e.getKey().workerId() + "_" + e.getKey().date(), e.getValue(), dailyCapacity);
        }

        BinaryProgram program = model.build();
        log.debug("LP model vars={} constraints={} solver={}",
                program.variableCount(), program.constraints().size(), solver.name());
        boolean[] selected = solver.solve(program);

        Worker[] chosen = new Worker[tasks.size()];
        for (int i = 0; i < selected.length; i++) {
            if (!selected[i]) continue;
            Candidate c = candidates.get(i);
            if (chosen[c.taskIndex()] != null) {
                throw new IllegalStateException(
                        "task " + tasks.get(c.taskIndex()).getId() + " selected for more than one worker");
            }
            chosen[c.taskIndex()] = c.worker();
        }

        List<Assignment> assignments = new ArrayList<>();
        List<Task> unassigned = new ArrayList<>();
        for (int t = 0; t < tasks.size(); t++) {
            Task task = tasks.get(t);
            Worker w = chosen[t];
            if (w == null) {
                unassigned.add(task);
            } else {
                assignments.add(Assignment.of(task, w));
            }
        }
        CapacityLedger ledger = CapacityLedger.fromAssignments(assignments, dailyCapacity);
        return new AssignmentOutcome(assignments, unassigned, ledger);
    }

    private record Candidate(int taskIndex, Worker worker) {
    }
}
