package io.github.riemr.workforce.optimization.strategy;

import io.github.riemr.workforce.exception.InvalidStrategyException;

import java.util.Locale;

/**
 * 割当戦略。呼び出し側の文字列はここでのみ解釈する。
 */
public enum AssignmentStrategy {
    /** 整数計画による厳密解 */
    LP("lp"),
    /** 最小負荷優先の貪欲法 */
    GREEDY("greedy");

    public static final AssignmentStrategy DEFAULT = LP;

    private final String code;

    AssignmentStrategy(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 戦略名を解釈する。null/空白は既定の {@link #LP}。
     *
     * @throws InvalidStrategyException 未知の戦略名
     */
    public static AssignmentStrategy fromCode(String name) {
        if (name == null || name.isBlank()) {
            return DEFAULT;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (AssignmentStrategy s : values()) {
            if (s.code.equals(normalized)) {
                return s;
            }
        }
        throw new InvalidStrategyException(name);
    }
}
