package io.github.riemr.workforce.application.service;

import io.github.riemr.workforce.application.dto.AssignmentResult;
import io.github.riemr.workforce.application.repository.TaskRepository;
import io.github.riemr.workforce.application.repository.WorkerRepository;
import io.github.riemr.workforce.domain.model.Task;
import io.github.riemr.workforce.domain.model.Worker;
import io.github.riemr.workforce.optimization.service.TaskAssignmentEngine;
import io.github.riemr.workforce.optimization.strategy.AssignmentStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * 期間指定の割当。期間内のタスクと作業者名簿をポート経由で取得し、エンジンに渡す。
 * 結果は保存しない。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskAssignmentService {

    private final TaskRepository taskRepository;
    private final WorkerRepository workerRepository;
    private final TaskAssignmentEngine engine;

    public AssignmentResult assignForPeriod(LocalDate startDate, LocalDate endDate) {
        return assignForPeriod(startDate, endDate, AssignmentStrategy.DEFAULT.getCode());
    }

    /**
     * @param startDate 期間開始日（必須）
     * @param endDate   期間終了日。null の場合は開始日と同日
     * @param strategy  "lp" または "greedy"
     */
    public AssignmentResult assignForPeriod(LocalDate startDate, LocalDate endDate, String strategy) {
        if (startDate == null) {
            throw new IllegalArgumentException("startDate is required");
        }
        LocalDate end = endDate == null ? startDate : endDate;
        if (end.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate must not be before startDate: " + startDate + " > " + end);
        }
        // 未知の戦略はデータ取得前に弾く
        AssignmentStrategy parsed = AssignmentStrategy.fromCode(strategy);

        List<Task> tasks = taskRepository.findByDateBetween(startDate, end);
        List<Worker> workers = workerRepository.findAll();
        log.debug("Loaded {} task(s) for {}..{} and {} worker(s)", tasks.size(), startDate, end, workers.size());

        return engine.assign(tasks, workers, parsed, engine.getDefaultDailyCapacity());
    }
}
