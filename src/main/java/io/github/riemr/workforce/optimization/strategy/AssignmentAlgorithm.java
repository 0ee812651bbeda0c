package io.github.riemr.workforce.optimization.strategy;

import io.github.riemr.workforce.domain.model.Task;
import io.github.riemr.workforce.domain.model.Worker;

import java.util.List;

public interface AssignmentAlgorithm {

    AssignmentStrategy strategy();

    /**
     * タスクを作業者へ割り当てる。割当不能なタスクは例外ではなく未割当として返す。
     *
     * @param tasks         対象タスク（順序の前提なし）
     * @param workers       作業者名簿
     * @param dailyCapacity 作業者1人1日あたりの上限時間
     */
    AssignmentOutcome assign(List<Task> tasks, List<Worker> workers, int dailyCapacity);
}
