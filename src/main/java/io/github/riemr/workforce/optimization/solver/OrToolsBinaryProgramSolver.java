package io.github.riemr.workforce.optimization.solver;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import io.github.riemr.workforce.exception.SolverFailureException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Locale;

/**
 * OR-tools の MPSolver（SCIP / CBC）で 0-1 整数計画を解く。
 * OPTIMAL 以外の終了状態（時間切れの FEASIBLE を含む）はすべて失敗として扱う。
 */
@Slf4j
public class OrToolsBinaryProgramSolver implements BinaryProgramSolver {

    private final SolverBackend backend;
    private final Duration timeLimit;
    private final Runnable nativeLoader;
    private volatile boolean nativeLoaded;

    public OrToolsBinaryProgramSolver(SolverBackend backend, Duration timeLimit) {
        this(backend, timeLimit, Loader::loadNativeLibraries);
    }

    OrToolsBinaryProgramSolver(SolverBackend backend, Duration timeLimit, Runnable nativeLoader) {
        if (backend.orToolsId() == null) {
            throw new IllegalArgumentException("not an OR-tools backend: " + backend);
        }
        this.backend = backend;
        this.timeLimit = timeLimit;
        this.nativeLoader = nativeLoader;
    }

    @Override
    public String name() {
        return "ortools-" + backend.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean[] solve(BinaryProgram program) {
        loadNativeLibraries();
        MPSolver solver = MPSolver.createSolver(backend.orToolsId());
        if (solver == null) {
            throw new SolverFailureException("UNAVAILABLE", "Could not create solver " + backend.orToolsId());
        }
        try {
            if (timeLimit != null && !timeLimit.isZero() && !timeLimit.isNegative()) {
                solver.setTimeLimit(timeLimit.toMillis());
            }

            int n = program.variableCount();
            MPVariable[] x = new MPVariable[n];
            for (int i = 0; i < n; i++) {
                x[i] = solver.makeIntVar(0, 1, program.variableName(i));
            }

            double infinity = MPSolver.infinity();
            for (BinaryProgram.Constraint c : program.constraints()) {
                MPConstraint constraint = solver.makeConstraint(-infinity, c.upperBound(), c.name());
                for (int k = 0; k < c.variables().length; k++) {
                    constraint.setCoefficient(x[c.variables()[k]], c.coefficients()[k]);
                }
            }

            MPObjective objective = solver.objective();
            for (int i = 0; i < n; i++) {
                objective.setCoefficient(x[i], program.objectiveCoefficient(i));
            }
            objective.setMaximization();

            MPSolver.ResultStatus status = solver.solve();
            if (status != MPSolver.ResultStatus.OPTIMAL) {
                log.warn("{} finished without optimal solution: status={} vars={} constraints={}",
                        name(), status, n, program.constraints().size());
                throw new SolverFailureException(status.name(),
                        "Solver " + name() + " did not reach an optimal solution: " + status);
            }

            boolean[] selection = new boolean[n];
            for (int i = 0; i < n; i++) {
                // 連続緩和の誤差を丸めて 0/1 に戻す
                selection[i] = Math.round(x[i].solutionValue()) == 1L;
            }
            log.debug("{} objective={} wallTime={}ms", name(), objective.value(), solver.wallTime());
            return selection;
        } finally {
            solver.delete();
        }
    }

    private void loadNativeLibraries() {
        if (!nativeLoaded) {
            synchronized (this) {
                if (!nativeLoaded) {
                    try {
                        nativeLoader.run();
                    } catch (RuntimeException | LinkageError e) {
                        log.warn("{} could not load OR-tools native libraries", name(), e);
                        throw new SolverFailureException("UNAVAILABLE",
                                "OR-tools native libraries could not be loaded for " + name(), e);
                    }
                    nativeLoaded = true;
                }
            }
        }
    }
}
