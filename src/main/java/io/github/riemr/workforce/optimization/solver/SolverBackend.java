package io.github.riemr.workforce.optimization.solver;

public enum SolverBackend {
    SCIP,
    CBC,
    BRANCH_AND_BOUND;

    /** OR-tools {@code MPSolver.createSolver} に渡す識別子 */
    public String orToolsId() {
        return this == BRANCH_AND_BOUND ? null : name();
    }
}
