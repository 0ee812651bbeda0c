package io.github.riemr.workforce.domain.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * エンジンが出力する割当。タスクは分割せず、所要時間をそのまま1人の作業者に割り当てる。
 */
@Value
public class Assignment {
    Task task;
    Worker worker;
    LocalDate workDate;
    int hours;

    public static Assignment of(Task task, Worker worker) {
        return new Assignment(task, worker, task.getDate(), task.getDuration());
    }
}
