package io.github.riemr.workforce.exception;

/**
 * 整数計画ソルバーが利用可能な解を返さなかった。
 * 「適格な作業者がいない」未割当とは区別され、空の割当として握りつぶしてはならない。
 */
public class SolverFailureException extends AssignmentException {

    private final String solverStatus;

    public SolverFailureException(String solverStatus, String message) {
        super("SOLVER_FAILURE", message, solverStatus);
        this.solverStatus = solverStatus;
    }

    public SolverFailureException(String solverStatus, String message, Throwable cause) {
        super("SOLVER_FAILURE", message, cause, solverStatus);
        this.solverStatus = solverStatus;
    }

    public String getSolverStatus() {
        return solverStatus;
    }
}
