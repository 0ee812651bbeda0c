package io.github.riemr.workforce.optimization.config;

import io.github.riemr.workforce.optimization.solver.BinaryProgramSolver;
import io.github.riemr.workforce.optimization.solver.BranchAndBoundBinaryProgramSolver;
import io.github.riemr.workforce.optimization.solver.OrToolsBinaryProgramSolver;
import io.github.riemr.workforce.optimization.solver.SolverBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 割当エンジンの構成。ホストアプリケーションはこのクラスを {@code @Import} する。
 */
@Configuration
@ComponentScan(basePackages = {
        "io.github.riemr.workforce.optimization.strategy",
        "io.github.riemr.workforce.optimization.service",
        "io.github.riemr.workforce.application.service"
})
@Slf4j
public class AssignmentEngineConfig {

    @Bean
    public BinaryProgramSolver binaryProgramSolver(
            @Value("${assignment.solver.backend:SCIP}") SolverBackend backend,
            @Value("${assignment.solver.time-limit:PT30S}") Duration timeLimit, // ISO-8601
            @Value("${assignment.solver.node-limit:2000000}") long nodeLimit) {
        log.info("Assignment solver backend={} timeLimit={} nodeLimit={}", backend, timeLimit, nodeLimit);
        if (backend == SolverBackend.BRANCH_AND_BOUND) {
            return new BranchAndBoundBinaryProgramSolver(nodeLimit);
        }
        return new OrToolsBinaryProgramSolver(backend, timeLimit);
    }
}
