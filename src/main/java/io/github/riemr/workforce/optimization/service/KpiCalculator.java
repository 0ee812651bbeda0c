package io.github.riemr.workforce.optimization.service;

import io.github.riemr.workforce.application.dto.KpiReport;
import io.github.riemr.workforce.domain.model.Assignment;
import io.github.riemr.workforce.domain.model.Task;
import io.github.riemr.workforce.domain.model.Worker;
import io.github.riemr.workforce.optimization.entity.CapacityLedger;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;

/**
 * 割当結果から KPI を算出する。入力を変更せず、退化した入力でも例外を出さずに 0 を返す。
 */
@Component
public class KpiCalculator {

    public KpiReport compute(List<Assignment> assignments,
                             List<Task> unassignedTasks,
                             CapacityLedger ledger,
                             List<Worker> workers,
                             int dailyCapacity) {
        int totalWorkers = workers.size();
        int totalTasks = assignments.size() + unassignedTasks.size();
        int totalAssignedHours = assignments.stream().mapToInt(Assignment::getHours).sum();
        int unassignedHours = unassignedTasks.stream().mapToInt(Task::getDuration).sum();

        int numDays = ledger.isEmpty() ? 1 : ledger.dates().size();
        long maxPossibleHours = Math.max(1L, (long) totalWorkers * dailyCapacity * numDays);
        double utilizationRate = round3((double) totalAssignedHours / maxPossibleHours);

        double[] totals = new double[totalWorkers];
        for (int i = 0; i < totalWorkers; i++) {
            totals[i] = ledger.totalFor(workers.get(i).getId());
        }

        return KpiReport.builder()
                .totalWorkers(totalWorkers)
                .totalTasks(totalTasks)
                .totalAssignedHours(totalAssignedHours)
                .unassignedHours(unassignedHours)
                .utilizationRate(utilizationRate)
                .maxWorkerLoad(ledger.maxLoad())
                .giniCoefficient(round3(gini(totals)))
                .build();
    }

    /**
     * ジニ係数。昇順・1始まりの順位 i で
     * {@code (2 Σ i·v_i) / (n Σ v) - (n + 1) / n}。
     * 作業者が1人以下、または総負荷が 0 の場合は 0。
     */
    static double gini(double[] values) {
        int n = values.length;
        if (n <= 1) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double sum = 0;
        double weighted = 0;
        for (int i = 0; i < n; i++) {
            sum += sorted[i];
            weighted += (i + 1) * sorted[i];
        }
        if (sum <= 0) {
            return 0.0;
        }
        double g = (2 * weighted) / (n * sum) - (double) (n + 1) / n;
        return Math.min(1.0, Math.max(0.0, g));
    }

    private static double round3(double value) {
        return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_EVEN).doubleValue();
    }
}
