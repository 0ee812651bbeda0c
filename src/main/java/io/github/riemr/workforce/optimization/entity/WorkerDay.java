package io.github.riemr.workforce.optimization.entity;

import java.time.LocalDate;

/** 台帳キー: 作業者 × 日付 */
public record WorkerDay(Long workerId, LocalDate date) {
}
