package io.github.riemr.workforce.application.dto;

import io.github.riemr.workforce.domain.model.Assignment;
import io.github.riemr.workforce.optimization.strategy.AssignmentStrategy;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/** 戦略に依存しない割当結果 */
@Value
@Builder
public class AssignmentResult {
    AssignmentStrategy strategy;
    @Singular
    List<Assignment> assignments;
    KpiReport kpis;
    AssignmentSummary summary;
}
