package io.github.yok.sse.core.exact;

import io.github.yok.sse.core.linearalgebra.GroundStateBackend;
import io.github.yok.sse.core.linearalgebra.GroundStateBackend.GroundState;
import io.github.yok.sse.core.model.IsingModel;
import io.github.yok.sse.core.observable.MagnetizationObservable;
import io.github.yok.sse.core.stats.MomentAccumulator;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 小さい系の横磁場イジング模型を厳密対角化し、基底状態の磁化モーメントを求めるクラスです。
 *
 * <p>
 * ハミルトニアンはサンプラーが実現するものと同じ
 * {@code H = Σ_{i<j} 2 J_ij σz_i σz_j − Σ_s h_s σx_s} です。 基底はビット s が 1 のときサイト s が上向きの
 * 2^N 個の σz 固有状態です。
 * </p>
 */
@Slf4j
public final class ExactGroundStateReference {

    /**
     * 扱えるサイト数の上限です（2^14 次元の密行列まで）。
     */
    public static final int MAX_SITES = 14;

    /**
     * 基底状態がほぼ縮退しているとみなすギャップの閾値です。
     */
    private static final double DEGENERACY_TOLERANCE = 1e-9;

    /**
     * 最低固有対を求めるバックエンドです。
     */
    private final GroundStateBackend backend;

    /**
     * 参照計算器を生成します。
     *
     * @param backend 最低固有対を求めるバックエンドです（null 不可）
     */
    public ExactGroundStateReference(GroundStateBackend backend) {
        if (backend == null) {
            throw new IllegalArgumentException("backend は null 不可です");
        }
        this.backend = backend;
    }

    /**
     * 基底状態のエネルギーと磁化モーメントを計算します。
     *
     * @param model 横磁場イジング模型です（N は {@link #MAX_SITES} 以下）
     * @param observable 磁化の定義です（サイト数が一致すること）
     * @return 厳密な参照値です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public ExactResult compute(IsingModel model, MagnetizationObservable observable) {
        if (model == null || observable == null) {
            throw new IllegalArgumentException("model/observable は null 不可です");
        }
        int n = model.siteCount();
        if (n > MAX_SITES) {
            throw new IllegalArgumentException(
                    "厳密対角化のサイト数上限を超えています: N=" + n + "（上限 " + MAX_SITES + "）");
        }
        if (observable.siteCount() != n) {
            throw new IllegalArgumentException(
                    "observable のサイト数が一致しません: " + observable.siteCount() + " vs " + n);
        }

        GroundState ground = backend.lowest(hamiltonian(model));
        if (ground.getGap() < DEGENERACY_TOLERANCE) {
            log.warn("基底状態がほぼ縮退しています（ギャップ={}）。モーメントは縮退空間内の一状態に対する値です。",
                    ground.getGap());
        }

        double[] psi = ground.getVector();
        boolean[] config = new boolean[n];
        double m2 = 0.0;
        double m4 = 0.0;
        for (int b = 0; b < psi.length; b++) {
            double weight = psi[b] * psi[b];
            if (weight == 0.0) {
                continue;
            }
            decode(b, config);
            double m = observable.measure(config);
            double sq = m * m;
            m2 += weight * sq;
            m4 += weight * sq * sq;
        }

        return new ExactResult(n, ground.getEnergy(), ground.getGap(), m2, m4,
                MomentAccumulator.binderCumulant(m2, m4));
    }

    /**
     * σz 基底でのハミルトニアン密行列を組み立てます。
     *
     * @param model 横磁場イジング模型です
     * @return 2^N × 2^N の実対称行列です
     */
    static DMatrixRMaj hamiltonian(IsingModel model) {
        int n = model.siteCount();
        int dim = 1 << n;
        DMatrixRMaj h = new DMatrixRMaj(dim, dim);

        for (int b = 0; b < dim; b++) {
            double diagonal = 0.0;
            for (int i = 0; i < n; i++) {
                int si = spin(b, i);
                for (int j = i + 1; j < n; j++) {
                    double jij = model.coupling(i, j);
                    if (jij != 0.0) {
                        diagonal += 2.0 * jij * si * spin(b, j);
                    }
                }
            }
            h.set(b, b, diagonal);

            for (int s = 0; s < n; s++) {
                double field = model.field(s);
                if (field != 0.0) {
                    h.set(b, b ^ (1 << s), -field);
                }
            }
        }
        return h;
    }

    /**
     * 基底番号のビット s から σz 固有値（±1）を返します。
     */
    private static int spin(int basis, int site) {
        return ((basis >> site) & 1) == 1 ? 1 : -1;
    }

    /**
     * 基底番号をスピン配置に展開します。
     */
    private static void decode(int basis, boolean[] config) {
        for (int s = 0; s < config.length; s++) {
            config[s] = ((basis >> s) & 1) == 1;
        }
    }

    /**
     * 厳密対角化による参照値です。
     */
    @Value
    public static class ExactResult {

        /**
         * サイト数です。
         */
        int siteCount;

        /**
         * 基底エネルギーです。
         */
        double groundStateEnergy;

        /**
         * 第 1 励起状態とのエネルギー差です。
         */
        double gap;

        /**
         * 基底状態での {@code <m^2>} です。
         */
        double meanSquare;

        /**
         * 基底状態での {@code <m^4>} です。
         */
        double meanFourth;

        /**
         * 基底状態での Binder キュムラントです。
         */
        double binderCumulant;
    }
}
