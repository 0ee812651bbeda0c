package io.github.riemr.workforce.exception;

/**
 * 未知の割当戦略名が指定された。計算開始前に送出される。
 */
public class InvalidStrategyException extends AssignmentException {

    private final String strategyName;

    public InvalidStrategyException(String strategyName) {
        super("INVALID_STRATEGY", "Unknown assignment strategy: " + strategyName, strategyName);
        this.strategyName = strategyName;
    }

    public String getStrategyName() {
        return strategyName;
    }
}
