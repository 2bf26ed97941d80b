package io.github.yok.sse.core.sampling;

import io.github.yok.sse.core.model.IsingModel;
import org.ejml.data.DMatrixRMaj;

/**
 * 演算子挿入候補 (i, j) を重み行列 M に比例してサンプリングする 2 段階の累積分布表です。
 *
 * <ul>
 * <li>{@code M[i][i] = h_i}（横磁場演算子の候補）</li>
 * <li>{@code M[i][j] = 2|J_ij|}（i≠j、ボンド演算子の候補）</li>
 * </ul>
 *
 * <p>
 * 1 段目で行和に比例して i を、2 段目で行 i の中で M[i][j] に比例して j を選びます。 結果として
 * {@code P(i, j) = M[i][j] / ΣM} になります。 生成後は不変で、全スイープ・全挿入試行で共有できます。
 * </p>
 */
public final class InsertionProbabilityTable {

    /**
     * サイト数です。
     */
    private final int siteCount;

    /**
     * 重み行列 M です。
     */
    private final DMatrixRMaj weights;

    /**
     * 行和に基づく累積分布（正規化済み、末尾は 1）です。
     */
    private final double[] marginal;

    /**
     * 行ごとの条件付き累積分布（正規化済み、末尾は 1）です。
     */
    private final double[][] conditional;

    /**
     * 模型から累積分布表を構築します。
     *
     * @param model 横磁場イジング模型です（null 不可）
     * @throws IllegalArgumentException 重みが 0 のサイトがある場合に発生します（サンプリングが終わらない構成を事前に排除します）
     */
    public InsertionProbabilityTable(IsingModel model) {
        if (model == null) {
            throw new IllegalArgumentException("model は null 不可です");
        }
        int n = model.siteCount();
        this.siteCount = n;
        this.weights = new DMatrixRMaj(n, n);

        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double w = (i == j) ? model.field(i) : 2.0 * Math.abs(model.coupling(i, j));
                weights.set(i, j, w);
            }
        }

        double[] rowSums = new double[n];
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            double s = 0.0;
            for (int j = 0; j < n; j++) {
                s += weights.get(i, j);
            }
            if (!(s > 0.0)) {
                throw new IllegalArgumentException(
                        "サイト " + i + " は横磁場・結合がすべて 0 です（挿入候補の重みが 0 のサイトは扱えません）");
            }
            rowSums[i] = s;
            total += s;
        }

        this.marginal = cumulative(rowSums, total);
        this.conditional = new double[n][];
        for (int i = 0; i < n; i++) {
            double[] row = new double[n];
            for (int j = 0; j < n; j++) {
                row[j] = weights.get(i, j);
            }
            conditional[i] = cumulative(row, rowSums[i]);
        }
    }

    /**
     * 1 段目（行）のインデックス i をサンプリングします。
     *
     * @param u [0, 1) の一様乱数です
     * @return サイトインデックス i です
     */
    public int sampleFirst(double u) {
        return search(marginal, u);
    }

    /**
     * 2 段目（列）のインデックス j をサンプリングします。
     *
     * @param first 1 段目で得たインデックス i です
     * @param u [0, 1) の一様乱数です
     * @return サイトインデックス j です（i と等しい場合は横磁場演算子の候補です）
     */
    public int sampleSecond(int first, double u) {
        return search(conditional[first], u);
    }

    /**
     * サイト数 N を返します。
     *
     * @return サイト数です
     */
    public int siteCount() {
        return siteCount;
    }

    /**
     * 重み M[i][j] を返します。
     *
     * @param i 行インデックスです
     * @param j 列インデックスです
     * @return 重みです
     */
    public double weight(int i, int j) {
        return weights.get(i, j);
    }

    /**
     * 重みの総和 ΣM を返します。
     *
     * @return 重みの総和です
     */
    public double totalWeight() {
        double s = 0.0;
        for (int k = 0; k < weights.getNumElements(); k++) {
            s += weights.get(k);
        }
        return s;
    }

    /**
     * 正規化した累積分布を作ります。
     *
     * <p>
     * 丸め誤差で末尾の重み 0 の成分が選ばれないよう、最後の正の重み以降の累積値を 1 に固定します。
     * </p>
     *
     * @param values 非負の重みです
     * @param sum 重みの総和です（正）
     * @return 累積分布です
     */
    private static double[] cumulative(double[] values, double sum) {
        double[] cdf = new double[values.length];
        double acc = 0.0;
        int lastPositive = 0;
        for (int k = 0; k < values.length; k++) {
            acc += values[k];
            cdf[k] = acc / sum;
            if (values[k] > 0.0) {
                lastPositive = k;
            }
        }
        for (int k = lastPositive; k < values.length; k++) {
            cdf[k] = 1.0;
        }
        return cdf;
    }

    /**
     * 累積値が u を超える最初のインデックスを二分探索で返します。
     *
     * <p>
     * u は [0, 1) なので、重み 0 の成分（累積値が直前と同じ）は選ばれません。
     * </p>
     *
     * @param cdf 累積分布です
     * @param u [0, 1) の一様乱数です
     * @return インデックスです
     */
    private static int search(double[] cdf, double u) {
        int lo = 0;
        int hi = cdf.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (cdf[mid] > u) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }
}
