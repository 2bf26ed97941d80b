package io.github.yok.sse.core.solver;

import io.github.yok.sse.core.model.IsingModel;
import io.github.yok.sse.core.operator.OperatorStringValidator;
import io.github.yok.sse.core.stats.MomentAccumulator;
import io.github.yok.sse.core.sweep.ProjectorState;
import io.github.yok.sse.core.sweep.SweepDriver;
import io.github.yok.sse.core.sweep.SweepResult;
import java.util.Locale;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * 1 本のマルコフ連鎖（アンサンブルの 1 メンバ）を実行するクラスです。
 *
 * <p>
 * 平衡化スイープ（delay 回）の後、測定スイープ（sweeps 回）で磁化の 2 次・4 次モーメントを集計します。
 * </p>
 */
@Slf4j
public final class MonteCarloSimulation {

    /**
     * スイープドライバです（この連鎖専用）。
     */
    private final SweepDriver driver;

    /**
     * 演算子列の半分の長さ m です。
     */
    private final int halfLength;

    /**
     * 測定スイープ数です。
     */
    private final int sweeps;

    /**
     * 平衡化スイープ数です。
     */
    private final int delay;

    /**
     * 毎スイープ後に整合性検証を行う場合の検証器です（行わない場合は null）。
     */
    private final OperatorStringValidator validator;

    /**
     * シミュレーションを生成します。
     *
     * @param driver スイープドライバです（null 不可）
     * @param halfLength 演算子列の半分の長さ m です（1 以上）
     * @param sweeps 測定スイープ数です（1 以上）
     * @param delay 平衡化スイープ数です（0 以上）
     * @param validateEverySweep 毎スイープ後に整合性検証を行うかどうかです
     */
    public MonteCarloSimulation(SweepDriver driver, int halfLength, int sweeps, int delay,
            boolean validateEverySweep) {
        if (driver == null) {
            throw new IllegalArgumentException("driver は null 不可です");
        }
        if (halfLength <= 0) {
            throw new IllegalArgumentException("halfLength は 1 以上が必要です: " + halfLength);
        }
        if (sweeps <= 0) {
            throw new IllegalArgumentException("sweeps は 1 以上が必要です: " + sweeps);
        }
        if (delay < 0) {
            throw new IllegalArgumentException("delay は 0 以上が必要です: " + delay);
        }
        this.driver = driver;
        this.halfLength = halfLength;
        this.sweeps = sweeps;
        this.delay = delay;
        this.validator = validateEverySweep ? new OperatorStringValidator() : null;
    }

    /**
     * ランダムな初期状態から連鎖を実行します。
     *
     * @param random この連鎖専用の乱数源です
     * @return 集計結果です
     */
    public MemberResult run(RandomGenerator random) {
        IsingModel model = driver.getModel();
        ProjectorState state = ProjectorState.random(model.siteCount(), halfLength, random);
        return run(state, random);
    }

    /**
     * 与えた初期状態から連鎖を実行します。状態はその場で更新されます。
     *
     * @param state 初期状態です
     * @param random この連鎖専用の乱数源です
     * @return 集計結果です
     */
    public MemberResult run(ProjectorState state, RandomGenerator random) {
        IsingModel model = driver.getModel();
        MomentAccumulator moments = new MomentAccumulator();

        double sumDiagonal = 0.0;
        double sumOffDiagonal = 0.0;
        double sumBond = 0.0;

        int total = delay + sweeps;
        for (int step = 0; step < total; step++) {
            SweepResult r = driver.sweep(state, random);

            if (validator != null) {
                validator.validate(model, state.getOperators(), state.getBoundary());
            }

            if (step < delay) {
                continue;
            }
            moments.add(r.getMagnetization());
            sumDiagonal += r.getDiagonalFieldCount();
            sumOffDiagonal += r.getOffDiagonalFieldCount();
            sumBond += r.getBondCount();
        }

        MemberResult result = new MemberResult(moments.samples(), moments.meanSquare(),
                moments.meanFourth(), moments.binderCumulant(), sumDiagonal / sweeps,
                sumOffDiagonal / sweeps, sumBond / sweeps);
        log.debug("連鎖を終了しました。平衡化={}、測定={}、<m^2>={}、<m^4>={}、Binder={}、平均ボンド数={}", delay,
                sweeps, fmt5(result.getMeanSquare()), fmt5(result.getMeanFourth()),
                fmt5(result.getBinderCumulant()), fmt5(result.getMeanBondCount()));
        return result;
    }

    /**
     * 数値を小数点以下 5 桁でフォーマットします。
     *
     * @param v 数値です
     * @return フォーマット済み文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    /**
     * 1 メンバの集計結果です。
     */
    @Value
    public static class MemberResult {

        /**
         * 測定サンプル数です。
         */
        long samples;

        /**
         * {@code <m^2>} です。
         */
        double meanSquare;

        /**
         * {@code <m^4>} です。
         */
        double meanFourth;

        /**
         * Binder キュムラントです。
         */
        double binderCumulant;

        /**
         * 1 スイープあたりの対角横磁場演算子数の平均です。
         */
        double meanDiagonalFieldCount;

        /**
         * 1 スイープあたりの非対角横磁場演算子数の平均です。
         */
        double meanOffDiagonalFieldCount;

        /**
         * 1 スイープあたりのボンド演算子数の平均です。
         */
        double meanBondCount;
    }
}
