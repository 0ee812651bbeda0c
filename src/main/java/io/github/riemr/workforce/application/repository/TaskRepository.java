package io.github.riemr.workforce.application.repository;

import io.github.riemr.workforce.domain.model.Task;

import java.time.LocalDate;
import java.util.List;

/**
 * タスクの参照用ポート。永続化の実装はホスト側が提供する。
 */
public interface TaskRepository {

    /** 実施日が {@code [from, to]} に含まれるタスク */
    List<Task> findByDateBetween(LocalDate from, LocalDate to);
}
