package io.github.riemr.workforce.application.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 割当結果の KPI。
 * <ul>
 *   <li>utilizationRate: 割当時間 / (作業者数 × 日次上限 × 対象日数)</li>
 *   <li>maxWorkerLoad: 作業者×日付の最大負荷</li>
 *   <li>unassignedHours: 割り当てられなかったタスクの合計時間</li>
 *   <li>giniCoefficient: 作業者別総負荷の不平等度（0 = 完全に均等）</li>
 * </ul>
 */
@Value
@Builder
public class KpiReport {
    int totalWorkers;
    int totalTasks;
    int totalAssignedHours;
    int unassignedHours;
    double utilizationRate;
    int maxWorkerLoad;
    double giniCoefficient;
}
