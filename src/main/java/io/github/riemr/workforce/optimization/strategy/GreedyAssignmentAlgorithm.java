package io.github.riemr.workforce.optimization.strategy;

import io.github.riemr.workforce.domain.model.Assignment;
import io.github.riemr.workforce.domain.model.PositionKey;
import io.github.riemr.workforce.domain.model.Task;
import io.github.riemr.workforce.domain.model.Worker;
import io.github.riemr.workforce.optimization.entity.CapacityLedger;
import io.github.riemr.workforce.optimization.entity.TaskGroupKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 貪欲法による割当。
 * <ul>
 *   <li>タスクを (日付, 職種) で、作業者を職種でグループ化</li>
 *   <li>グループ内は所要時間の短い順に処理（件数を優先する first-fit）</li>
 *   <li>当日の負荷が最も小さく、余力のある作業者へ割当</li>
 * </ul>
 * 負荷が同じ作業者同士は名簿の並び順で先に現れた方を選ぶ。ID 順などの安定キーは保証しない。
 * 総割当時間の最大化は保証しない。
 */
@Component
@Slf4j
public class GreedyAssignmentAlgorithm implements AssignmentAlgorithm {

    @Override
    public AssignmentStrategy strategy() {
        return AssignmentStrategy.GREEDY;
    }

    @Override
    public AssignmentOutcome assign(List<Task> tasks, List<Worker> workers, int dailyCapacity) {
        CapacityLedger ledger = new CapacityLedger(dailyCapacity);

        Map<TaskGroupKey, List<Task>> tasksByGroup = new LinkedHashMap<>();
        for (Task t : tasks) {
            tasksByGroup.computeIfAbsent(TaskGroupKey.of(t), k -> new ArrayList<>()).add(t);
        }
        Map<PositionKey, List<Worker>> workersByPosition = new LinkedHashMap<>();
        for (Worker w : workers) {
            workersByPosition.computeIfAbsent(w.positionKey(), k -> new ArrayList<>()).add(w);
        }

        List<Assignment> assignments = new ArrayList<>();
        List<Task> unassigned = new ArrayList<>();

        for (var entry : tasksByGroup.entrySet()) {
            TaskGroupKey group = entry.getKey();
            List<Worker> eligible = workersByPosition.getOrDefault(group.positionKey(), List.of());
            if (eligible.isEmpty()) {
                log.debug("GREEDY no worker for group {}: {} task(s) unassigned", group, entry.getValue().size());
                unassigned.addAll(entry.getValue());
                continue;
            }

            // List.sort は安定ソート: 同じ所要時間なら入力順
            List<Task> ordered = new ArrayList<>(entry.getValue());
            ordered.sort(Comparator.comparingInt(Task::getDuration));

            for (Task task : ordered) {
                Worker chosen = pickLeastLoaded(eligible, task, ledger);
                if (chosen == null) {
                    unassigned.add(task);
                    continue;
                }
                ledger.commit(chosen.getId(), task.getDate(), task.getDuration());
                assignments.add(Assignment.of(task, chosen));
            }
        }

        log.debug("GREEDY assigned={} unassigned={}", assignments.size(), unassigned.size());
        return new AssignmentOutcome(assignments, unassigned, ledger);
    }

    private Worker pickLeastLoaded(List<Worker> eligible, Task task, CapacityLedger ledger) {
        Worker best = null;
        int bestLoad = Integer.MAX_VALUE;
        for (Worker w : eligible) {
            int load = ledger.load(w.getId(), task.getDate());
            if (!ledger.hasHeadroom(w.getId(), task.getDate(), task.getDuration())) continue;
            if (load < bestLoad) { // 厳密に小さい場合のみ更新 = 先勝ち
                best = w;
                bestLoad = load;
            }
        }
        return best;
    }
}
