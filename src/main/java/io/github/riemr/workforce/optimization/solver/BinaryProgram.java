package io.github.riemr.workforce.optimization.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * ソルバー非依存の 0-1 整数計画モデル。
 * 目的関数は最大化、制約はすべて {@code Σ coef·x <= upperBound} の形。
 */
public final class BinaryProgram {

    private final List<String> variableNames;
    private final double[] objective;
    private final List<Constraint> constraints;

    private BinaryProgram(List<String> variableNames, double[] objective, List<Constraint> constraints) {
        this.variableNames = Collections.unmodifiableList(variableNames);
        this.objective = objective;
        this.constraints = Collections.unmodifiableList(constraints);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int variableCount() {
        return objective.length;
    }

    public String variableName(int index) {
        return variableNames.get(index);
    }

    public double objectiveCoefficient(int index) {
        return objective[index];
    }

    public List<Constraint> constraints() {
        return constraints;
    }

    public double objectiveValue(boolean[] selection) {
        double sum = 0;
        for (int i = 0; i < objective.length; i++) {
            if (selection[i]) sum += objective[i];
        }
        return sum;
    }

    public record Constraint(String name, int[] variables, double[] coefficients, double upperBound) {
    }

    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final List<Double> weights = new ArrayList<>();
        private final List<Constraint> constraints = new ArrayList<>();

        private Builder() {
        }

        /** @return 変数インデックス */
        public int addVariable(String name, double objectiveCoefficient) {
            names.add(name);
            weights.add(objectiveCoefficient);
            return names.size() - 1;
        }

        public Builder addConstraint(String name, Map<Integer, Double> terms, double upperBound) {
            if (terms.isEmpty()) {
                return this;
            }
            int[] vars = new int[terms.size()];
            double[] coefs = new double[terms.size()];
            int i = 0;
            for (var e : terms.entrySet()) {
                if (e.getKey() < 0 || e.getKey() >= names.size()) {
                    throw new IllegalArgumentException("unknown variable index " + e.getKey() + " in " + name);
                }
                vars[i] = e.getKey();
                coefs[i] = e.getValue();
                i++;
            }
            constraints.add(new Constraint(name, vars, coefs, upperBound));
            return this;
        }

        public BinaryProgram build() {
            double[] objective = new double[weights.size()];
            for (int i = 0; i < objective.length; i++) {
                objective[i] = weights.get(i);
            }
            return new BinaryProgram(new ArrayList<>(names), objective, new ArrayList<>(constraints));
        }
    }
}
