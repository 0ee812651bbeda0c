package io.github.riemr.workforce.optimization.entity;

import io.github.riemr.workforce.domain.model.PositionKey;
import io.github.riemr.workforce.domain.model.Task;

import java.time.LocalDate;

/** 貪欲法のグルーピングキー: 日付 × 職種 */
public record TaskGroupKey(LocalDate date, PositionKey positionKey) {

    public static TaskGroupKey of(Task task) {
        return new TaskGroupKey(task.getDate(), task.positionKey());
    }

    @Override
    public String toString() {
        return date + ":" + positionKey;
    }
}
