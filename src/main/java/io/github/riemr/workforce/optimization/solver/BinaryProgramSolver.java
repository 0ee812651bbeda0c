package io.github.riemr.workforce.optimization.solver;

import io.github.riemr.workforce.exception.SolverFailureException;

/**
 * 0-1 整数計画ソルバーの境界。バックエンドの差し替えは実装クラスの追加だけで済む。
 */
public interface BinaryProgramSolver {

    /**
     * 目的関数を最大化する 0-1 解を返す。
     *
     * @return 変数インデックスごとの採否
     * @throws SolverFailureException 最適性が確認できる解が得られなかった場合
     */
    boolean[] solve(BinaryProgram program);

    String name();
}
