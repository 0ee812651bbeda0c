package io.github.riemr.workforce.optimization.solver;

import io.github.riemr.workforce.exception.SolverFailureException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * ネイティブライブラリを使わない深さ優先の分枝限定法。
 * 係数がすべて非負の {@code <=} 制約のみを扱う。上界は残り変数の正の目的係数の総和。
 * 探索ノード数が上限を超えた場合は最適性を保証できないため失敗とする。
 */
@Slf4j
public class BranchAndBoundBinaryProgramSolver implements BinaryProgramSolver {

    private static final double EPS = 1e-9;

    private final long nodeLimit;

    public BranchAndBoundBinaryProgramSolver(long nodeLimit) {
        this.nodeLimit = nodeLimit;
    }

    @Override
    public String name() {
        return "branch-and-bound";
    }

    @Override
    public boolean[] solve(BinaryProgram program) {
        return new Search(program, nodeLimit).run();
    }

    private static final class Search {
        private final BinaryProgram program;
        private final long nodeLimit;
        private final Integer[] order;
        private final double[] suffixBound;
        private final int[][] constraintsOfVar;
        private final double[][] coefOfVar;
        private final double[] slack;
        private final boolean[] current;
        private boolean[] best;
        private double bestValue = -1;
        private long nodes;

        Search(BinaryProgram program, long nodeLimit) {
            this.program = program;
            this.nodeLimit = nodeLimit;
            int n = program.variableCount();

            List<BinaryProgram.Constraint> constraints = program.constraints();
            slack = new double[constraints.size()];
            List<List<int[]>> refs = new ArrayList<>();
            for (int i = 0; i < n; i++) refs.add(new ArrayList<>());
            for (int c = 0; c < constraints.size(); c++) {
                BinaryProgram.Constraint con = constraints.get(c);
                if (con.upperBound() < -EPS) {
                    throw new SolverFailureException("INFEASIBLE", "Constraint " + con.name() + " has negative bound");
                }
                slack[c] = con.upperBound();
                for (int k = 0; k < con.variables().length; k++) {
                    if (con.coefficients()[k] < 0) {
                        throw new IllegalArgumentException("negative coefficient in " + con.name());
                    }
                    refs.get(con.variables()[k]).add(new int[]{c, k});
                }
            }
            constraintsOfVar = new int[n][];
            coefOfVar = new double[n][];
            for (int i = 0; i < n; i++) {
                List<int[]> r = refs.get(i);
                constraintsOfVar[i] = new int[r.size()];
                coefOfVar[i] = new double[r.size()];
                for (int j = 0; j < r.size(); j++) {
                    int c = r.get(j)[0];
                    constraintsOfVar[i][j] = c;
                    coefOfVar[i][j] = constraints.get(c).coefficients()[r.get(j)[1]];
                }
            }

            order = new Integer[n];
            for (int i = 0; i < n; i++) order[i] = i;
            Arrays.sort(order, Comparator.comparingDouble((Integer i) -> program.objectiveCoefficient(i)).reversed());

            suffixBound = new double[n + 1];
            for (int d = n - 1; d >= 0; d--) {
                suffixBound[d] = suffixBound[d + 1] + Math.max(0, program.objectiveCoefficient(order[d]));
            }
            current = new boolean[n];
            best = new boolean[n];
        }

        boolean[] run() {
            dfs(0, 0);
            log.debug("branch-and-bound objective={} nodes={}", bestValue, nodes);
            return best;
        }

        private void dfs(int depth, double value) {
            if (++nodes > nodeLimit) {
                throw new SolverFailureException("NODE_LIMIT",
                        "Branch and bound exceeded node limit " + nodeLimit + " with "
                                + program.variableCount() + " variables");
            }
            if (value > bestValue + EPS) {
                bestValue = value;
                best = current.clone();
            }
            if (depth == order.length || value + suffixBound[depth] <= bestValue + EPS) {
                return;
            }
            int var = order[depth];
            double weight = program.objectiveCoefficient(var);
            if (weight > 0 && fits(var)) {
                apply(var, -1);
                current[var] = true;
                dfs(depth + 1, value + weight);
                current[var] = false;
                apply(var, 1);
            }
            dfs(depth + 1, value);
        }

        private boolean fits(int var) {
            int[] cs = constraintsOfVar[var];
            for (int j = 0; j < cs.length; j++) {
                if (coefOfVar[var][j] > slack[cs[j]] + EPS) return false;
            }
            return true;
        }

        private void apply(int var, int sign) {
            int[] cs = constraintsOfVar[var];
            for (int j = 0; j < cs.length; j++) {
                slack[cs[j]] += sign * coefOfVar[var][j];
            }
        }
    }
}
