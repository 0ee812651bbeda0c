package io.github.riemr.workforce.optimization.service;

import io.github.riemr.workforce.application.dto.AssignmentResult;
import io.github.riemr.workforce.application.dto.AssignmentSummary;
import io.github.riemr.workforce.application.dto.KpiReport;
import io.github.riemr.workforce.domain.model.PositionKey;
import io.github.riemr.workforce.domain.model.Task;
import io.github.riemr.workforce.domain.model.Worker;
import io.github.riemr.workforce.optimization.strategy.AssignmentAlgorithm;
import io.github.riemr.workforce.optimization.strategy.AssignmentOutcome;
import io.github.riemr.workforce.optimization.strategy.AssignmentStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 割当エンジンの入口。
 * <ul>
 *   <li>戦略名を解釈（未知の名前は計算前に拒否）</li>
 *   <li>選択された戦略を実行</li>
 *   <li>KPI とサマリを付けて戦略非依存の結果に詰める</li>
 * </ul>
 * 呼び出しごとに台帳を新規に作るため、呼び出し間で共有される可変状態はない。
 */
@Service
@Slf4j
public class TaskAssignmentEngine {

    private final Map<AssignmentStrategy, AssignmentAlgorithm> algorithms = new EnumMap<>(AssignmentStrategy.class);
    private final KpiCalculator kpiCalculator;
    private final int defaultDailyCapacity;

    public TaskAssignmentEngine(List<AssignmentAlgorithm> algorithms,
                                KpiCalculator kpiCalculator,
                                @Value("${assignment.daily-capacity:8}") int defaultDailyCapacity) {
        for (AssignmentAlgorithm a : algorithms) {
            AssignmentAlgorithm dup = this.algorithms.put(a.strategy(), a);
            if (dup != null) {
                throw new IllegalStateException("Duplicate algorithm for strategy " + a.strategy());
            }
        }
        this.kpiCalculator = kpiCalculator;
        this.defaultDailyCapacity = defaultDailyCapacity;
    }

    public int getDefaultDailyCapacity() {
        return defaultDailyCapacity;
    }

    public AssignmentResult assign(List<Task> tasks, List<Worker> workers, String strategyName) {
        return assign(tasks, workers, strategyName, defaultDailyCapacity);
    }

    public AssignmentResult assign(List<Task> tasks, List<Worker> workers, String strategyName, int dailyCapacity) {
        return assign(tasks, workers, AssignmentStrategy.fromCode(strategyName), dailyCapacity);
    }

    public AssignmentResult assign(List<Task> tasks, List<Worker> workers, AssignmentStrategy strategy, int dailyCapacity) {
        if (dailyCapacity < 0) {
            throw new IllegalArgumentException("dailyCapacity must not be negative: " + dailyCapacity);
        }
        AssignmentAlgorithm algorithm = algorithms.get(strategy);
        if (algorithm == null) {
            throw new IllegalStateException("No algorithm registered for strategy " + strategy);
        }

        // 呼び出し元のコレクションと共有しない
        List<Task> taskList = List.copyOf(tasks);
        List<Worker> workerList = List.copyOf(workers);

        long started = System.currentTimeMillis();
        AssignmentOutcome outcome = algorithm.assign(taskList, workerList, dailyCapacity);
        KpiReport kpis = kpiCalculator.compute(
                outcome.assignments(), outcome.unassignedTasks(), outcome.ledger(), workerList, dailyCapacity);
        AssignmentSummary summary = summarize(outcome, workerList);

        log.info("ASSIGN strategy={} tasks={} workers={} assigned={} unassigned={} hours={} elapsed={}ms",
                strategy.getCode(), taskList.size(), workerList.size(), summary.assignedCount(),
                summary.unassignedCount(), kpis.getTotalAssignedHours(), System.currentTimeMillis() - started);

        return AssignmentResult.builder()
                .strategy(strategy)
                .assignments(outcome.assignments())
                .kpis(kpis)
                .summary(summary)
                .build();
    }

    private AssignmentSummary summarize(AssignmentOutcome outcome, List<Worker> workers) {
        List<Long> unassignedIds = outcome.unassignedTasks().stream().map(Task::getId).toList();
        // 職種未設定の作業者がいれば、それも1職種として数える
        Set<PositionKey> positions = workers.stream().map(Worker::positionKey).collect(Collectors.toSet());
        return new AssignmentSummary(
                outcome.assignments().size(),
                outcome.unassignedTasks().size(),
                unassignedIds,
                positions.size());
    }
}
