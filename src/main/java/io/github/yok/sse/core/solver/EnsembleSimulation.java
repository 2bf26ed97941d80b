package io.github.yok.sse.core.solver;

import io.github.yok.sse.app.SseProperties;
import io.github.yok.sse.core.model.IsingModel;
import io.github.yok.sse.core.observable.MagnetizationObservable;
import io.github.yok.sse.core.sampling.InsertionProbabilityTable;
import io.github.yok.sse.core.solver.MonteCarloSimulation.MemberResult;
import io.github.yok.sse.core.sweep.SweepDriver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.stat.StatUtils;

/**
 * 独立なマルコフ連鎖（アンサンブル）を逐次実行し、Binder キュムラントなどを集計するクラスです。
 *
 * <p>
 * メンバ k は専用の {@link SweepDriver} と {@code MersenneTwister(seed + k)} を使います。
 * 挿入確率表は不変なので全メンバで共有します。
 * </p>
 */
@Getter
@Slf4j
public final class EnsembleSimulation {

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
     * アンサンブルのメンバ数です。
     */
    private final int repetitions;

    /**
     * 乱数シードの基準値です。
     */
    private final long seed;

    /**
     * 1 スロットあたりの挿入試行回数の上限です。
     */
    private final int maxInsertionAttempts;

    /**
     * 毎スイープ後に整合性検証を行うかどうかです。
     */
    private final boolean validateEverySweep;

    /**
     * アンサンブル計算を生成します。
     *
     * @param simulation モンテカルロ計算の設定です（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public EnsembleSimulation(SseProperties.Simulation simulation) {
        if (simulation == null) {
            throw new IllegalArgumentException("simulation は null 不可です");
        }
        if (simulation.getHalfLength() <= 0) {
            throw new IllegalArgumentException(
                    "simulation.halfLength は 1 以上が必要です: " + simulation.getHalfLength());
        }
        if (simulation.getSweeps() <= 0) {
            throw new IllegalArgumentException(
                    "simulation.sweeps は 1 以上が必要です: " + simulation.getSweeps());
        }
        if (simulation.getDelay() < 0) {
            throw new IllegalArgumentException(
                    "simulation.delay は 0 以上が必要です: " + simulation.getDelay());
        }
        if (simulation.getRepetitions() <= 0) {
            throw new IllegalArgumentException(
                    "simulation.repetitions は 1 以上が必要です: " + simulation.getRepetitions());
        }
        if (simulation.getMaxInsertionAttempts() <= 0) {
            throw new IllegalArgumentException("simulation.maxInsertionAttempts は 1 以上が必要です: "
                    + simulation.getMaxInsertionAttempts());
        }
        this.halfLength = simulation.getHalfLength();
        this.sweeps = simulation.getSweeps();
        this.delay = simulation.getDelay();
        this.repetitions = simulation.getRepetitions();
        this.seed = simulation.getSeed();
        this.maxInsertionAttempts = simulation.getMaxInsertionAttempts();
        this.validateEverySweep = simulation.isValidateEverySweep();
    }

    /**
     * 全メンバを実行して集計結果を返します。
     *
     * @param model 横磁場イジング模型です（null 不可）
     * @param observable 観測する磁化です（null 不可）
     * @return 集計結果です
     * @throws IllegalArgumentException 模型の重みが退化している場合などに発生します
     */
    public EnsembleResult run(IsingModel model, MagnetizationObservable observable) {
        if (model == null) {
            throw new IllegalArgumentException("model は null 不可です");
        }
        if (observable == null) {
            throw new IllegalArgumentException("observable は null 不可です");
        }

        // 退化した重みはここで設定エラーとして弾かれます。
        InsertionProbabilityTable table = new InsertionProbabilityTable(model);

        log.info("アンサンブル計算を開始します。N={}、m={}、平衡化={}、測定={}、メンバ数={}、seed={}", model.siteCount(),
                halfLength, delay, sweeps, repetitions, seed);

        List<MemberResult> members = new ArrayList<>(repetitions);
        double[] binders = new double[repetitions];
        double[] squares = new double[repetitions];

        for (int k = 0; k < repetitions; k++) {
            long started = System.nanoTime();

            SweepDriver driver =
                    new SweepDriver(model, table, observable, maxInsertionAttempts);
            MonteCarloSimulation simulation =
                    new MonteCarloSimulation(driver, halfLength, sweeps, delay, validateEverySweep);
            MemberResult member = simulation.run(new MersenneTwister(seed + k));

            members.add(member);
            binders[k] = member.getBinderCumulant();
            squares[k] = member.getMeanSquare();

            double elapsedSec = (System.nanoTime() - started) / 1e9;
            log.info("メンバ{}/{} 完了：<m^2>={}、Binder={}、平均ボンド数={}、経過={} 秒", k + 1, repetitions,
                    fmt5(member.getMeanSquare()), fmt5(member.getBinderCumulant()),
                    fmt5(member.getMeanBondCount()), fmt5(elapsedSec));
        }

        EnsembleResult result = new EnsembleResult(Collections.unmodifiableList(members),
                StatUtils.mean(binders), standardError(binders), StatUtils.mean(squares),
                standardError(squares));

        log.info("アンサンブル計算を終了しました。Binder={} ± {}、<m^2>={} ± {}",
                fmt5(result.getBinderMean()), fmt5(result.getBinderStandardError()),
                fmt5(result.getMeanSquareMean()), fmt5(result.getMeanSquareStandardError()));
        return result;
    }

    /**
     * 平均値の標準誤差（標本分散 / n の平方根）を返します。要素が 1 個なら 0 です。
     *
     * @param values 標本です
     * @return 標準誤差です
     */
    static double standardError(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return Math.sqrt(StatUtils.variance(values) / values.length);
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
     * アンサンブル全体の集計結果です。
     */
    @Value
    public static class EnsembleResult {

        /**
         * メンバごとの結果です（メンバ番号順）。
         */
        List<MemberResult> members;

        /**
         * Binder キュムラントのメンバ平均です。
         */
        double binderMean;

        /**
         * Binder キュムラントの標準誤差です。
         */
        double binderStandardError;

        /**
         * {@code <m^2>} のメンバ平均です。
         */
        double meanSquareMean;

        /**
         * {@code <m^2>} の標準誤差です。
         */
        double meanSquareStandardError;
    }
}
