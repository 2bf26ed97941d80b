package io.github.yok.sse.core.sweep;

import io.github.yok.sse.core.cluster.ClusterStatistics;
import io.github.yok.sse.core.cluster.ClusterUpdater;
import io.github.yok.sse.core.cluster.FlipDecision;
import io.github.yok.sse.core.graph.SpaceTimeGraph;
import io.github.yok.sse.core.graph.SpaceTimeGraphBuilder;
import io.github.yok.sse.core.model.IsingModel;
import io.github.yok.sse.core.observable.MagnetizationObservable;
import io.github.yok.sse.core.operator.OperatorString;
import io.github.yok.sse.core.operator.OperatorType;
import io.github.yok.sse.core.sampling.InsertionProbabilityTable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * 1 モンテカルロステップ（局所更新 → 時空グラフ構築 → クラスタ更新 → 観測）を実行するクラスです。
 *
 * <p>
 * 局所（対角）更新では、境界状態から伝播させたスピン配置 α を持ち回りながらスロットを先頭から走査します。
 * </p>
 *
 * <ul>
 * <li>非対角の横磁場演算子: α のそのサイトを反転して次へ進みます。</li>
 * <li>それ以外: 挿入確率表から (i, j) を引き直し、受理されるまで繰り返します。 i==j なら対角の横磁場演算子、 J>0 かつ α_i≠α_j または
 * J&lt;0 かつ α_i==α_j ならボンド演算子として受理します。</li>
 * </ul>
 *
 * <p>
 * 同じ走査の中で時空グラフの頂点を作り、終了後にクラスタ更新を行います。 h が正のサイトでは i==j
 * の候補が常に正の確率を持つため、棄却ループは確率 1 で有限回で終わります。 上限を超えた場合は ExhaustedSamplingException を投げます。
 * </p>
 *
 * <p>
 * グラフ・訪問済み配列を再利用するため、スレッドセーフではありません。 1 本のマルコフ連鎖につき 1 インスタンスを使います。
 * </p>
 */
@Slf4j
@Getter
public final class SweepDriver {

    /**
     * 横磁場イジング模型です。
     */
    private final IsingModel model;

    /**
     * 挿入候補のサンプリング表です。
     */
    private final InsertionProbabilityTable table;

    /**
     * 観測する磁化です。
     */
    private final MagnetizationObservable observable;

    /**
     * 1 スロットあたりの挿入試行回数の上限です。
     */
    private final int maxInsertionAttempts;

    /**
     * 時空グラフの組み立て器です。
     */
    @Getter(AccessLevel.NONE)
    private final SpaceTimeGraphBuilder graphBuilder;

    /**
     * クラスタ更新です。
     */
    @Getter(AccessLevel.NONE)
    private final ClusterUpdater clusterUpdater = new ClusterUpdater();

    /**
     * 再利用する時空グラフです（演算子列長が変わったときに確保し直します）。
     */
    @Getter(AccessLevel.NONE)
    private SpaceTimeGraph graph;

    /**
     * スイープドライバを生成します。
     *
     * @param model 横磁場イジング模型です（null 不可）
     * @param table 挿入候補のサンプリング表です（null 不可、サイト数が一致すること）
     * @param observable 観測する磁化です（null 不可、サイト数が一致すること）
     * @param maxInsertionAttempts 1 スロットあたりの挿入試行回数の上限です（1 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public SweepDriver(IsingModel model, InsertionProbabilityTable table,
            MagnetizationObservable observable, int maxInsertionAttempts) {
        if (model == null) {
            throw new IllegalArgumentException("model は null 不可です");
        }
        if (table == null) {
            throw new IllegalArgumentException("table は null 不可です");
        }
        if (observable == null) {
            throw new IllegalArgumentException("observable は null 不可です");
        }
        if (table.siteCount() != model.siteCount()
                || observable.siteCount() != model.siteCount()) {
            throw new IllegalArgumentException("model/table/observable のサイト数が一致しません");
        }
        if (maxInsertionAttempts <= 0) {
            throw new IllegalArgumentException(
                    "maxInsertionAttempts は 1 以上が必要です: " + maxInsertionAttempts);
        }
        this.model = model;
        this.table = table;
        this.observable = observable;
        this.maxInsertionAttempts = maxInsertionAttempts;
        this.graphBuilder = new SpaceTimeGraphBuilder(model.siteCount());
    }

    /**
     * 公平なコイン投げでクラスタを反転する 1 スイープを実行します。
     *
     * @param state モンテカルロ状態です（その場で更新します）
     * @param random このスイープで使う乱数源です
     * @return スイープの出力です
     */
    public SweepResult sweep(ProjectorState state, RandomGenerator random) {
        return sweep(state, random, FlipDecision.fairCoin(random));
    }

    /**
     * クラスタの反転判定を指定して 1 スイープを実行します。
     *
     * @param state モンテカルロ状態です（その場で更新します）
     * @param random 局所更新で使う乱数源です
     * @param decision クラスタごとの反転判定です
     * @return スイープの出力です
     * @throws ExhaustedSamplingException 挿入試行回数の上限に達した場合に発生します
     */
    public SweepResult sweep(ProjectorState state, RandomGenerator random,
            FlipDecision decision) {
        if (state == null || random == null || decision == null) {
            throw new IllegalArgumentException("state/random/decision は null 不可です");
        }
        if (state.siteCount() != model.siteCount()) {
            throw new IllegalArgumentException(
                    "状態のサイト数が一致しません: " + state.siteCount() + " vs " + model.siteCount());
        }

        OperatorString operators = state.getOperators();
        boolean[] boundary = state.getBoundary();

        SpaceTimeGraph g = graphFor(operators);
        graphBuilder.begin(g);

        // 1) 局所更新（対角演算子の引き直し）と頂点の作成
        LocalCounts counts = diagonalUpdate(operators, boundary, random);
        g = graphBuilder.finish();

        // 2) 大域更新（クラスタ反転）
        ClusterStatistics clusters = clusterUpdater.update(g, operators, boundary, decision);

        // 3) 虚時間中央の配置から観測
        boolean[] mid = operators.midpointConfiguration(boundary);
        double magnetization = observable.measure(mid);

        if (log.isDebugEnabled()) {
            log.debug("スイープ完了：磁化={}、対角h={}、非対角h={}、ボンド={}、棄却={}、クラスタ={}（反転={}、境界反転={}）",
                    magnetization, counts.diagonalField, counts.offDiagonalField, counts.bond,
                    counts.rejected, clusters.getClusterCount(), clusters.getFlippedClusterCount(),
                    clusters.getBoundaryFlipCount());
        }

        return new SweepResult(magnetization, mid, counts.diagonalField, counts.offDiagonalField,
                counts.bond, counts.rejected, clusters);
    }

    /**
     * 局所更新を行い、各スロットの頂点をグラフに追加します。
     *
     * @param operators 演算子列です
     * @param boundary 境界状態です（変更しません）
     * @param random 乱数源です
     * @return 演算子数の集計です
     */
    private LocalCounts diagonalUpdate(OperatorString operators, boolean[] boundary,
            RandomGenerator random) {
        LocalCounts counts = new LocalCounts();
        boolean[] alpha = boundary.clone();

        for (int p = 0; p < operators.length(); p++) {
            if (operators.typeAt(p) == OperatorType.OFF_DIAGONAL_FIELD) {
                int s = operators.firstSite(p);
                alpha[s] = !alpha[s];
                counts.offDiagonalField++;
                graphBuilder.addFieldVertex(p, s);
                continue;
            }

            int attempts = 0;
            while (true) {
                if (++attempts > maxInsertionAttempts) {
                    throw new ExhaustedSamplingException(p, maxInsertionAttempts);
                }
                int i = table.sampleFirst(random.nextDouble());
                int j = table.sampleSecond(i, random.nextDouble());

                if (i == j) {
                    operators.setDiagonalField(p, i);
                    counts.diagonalField++;
                    graphBuilder.addFieldVertex(p, i);
                    break;
                }

                double jij = model.coupling(i, j);
                boolean antiferro = jij > 0.0 && alpha[i] != alpha[j];
                boolean ferro = jij < 0.0 && alpha[i] == alpha[j];
                if (antiferro || ferro) {
                    operators.setBond(p, i, j);
                    counts.bond++;
                    graphBuilder.addBondVertex(p, i, j);
                    break;
                }
                counts.rejected++;
            }
        }
        return counts;
    }

    /**
     * 演算子列の長さに合った時空グラフを返します。
     *
     * @param operators 演算子列です
     * @return 時空グラフです
     */
    private SpaceTimeGraph graphFor(OperatorString operators) {
        if (graph == null || graph.slotCount() != operators.length()) {
            graph = new SpaceTimeGraph(model.siteCount(), operators.length());
        }
        return graph;
    }

    /**
     * 局所更新での演算子数の集計です。
     */
    private static final class LocalCounts {
        int diagonalField;
        int offDiagonalField;
        int bond;
        long rejected;
    }
}
