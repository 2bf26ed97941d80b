package io.github.yok.sse.core.model;

import java.util.Arrays;
import org.ejml.data.DMatrixRMaj;

/**
 * 横磁場イジング模型の結合定数 J と横磁場 h を保持するクラスです。
 *
 * <p>
 * ハミルトニアンは {@code H = Σ_{i<j} 2 J_ij σ^z_i σ^z_j - Σ_s h_s σ^x_s} です。 J_ij > 0
 * が反強磁性、J_ij &lt; 0 が強磁性を表します。 生成後は変更しません（入力配列・行列はコピーして保持します）。
 * </p>
 */
public final class IsingModel {

    /**
     * サイト数です。
     */
    private final int siteCount;

    /**
     * 結合行列 J（N×N、対称、対角 0）です。
     */
    private final DMatrixRMaj couplings;

    /**
     * 横磁場 h（長さ N）です。
     */
    private final double[] fields;

    /**
     * 横磁場イジング模型を生成します。
     *
     * @param couplings 結合行列 J です（N×N、対称、対角 0、有限値）
     * @param fields 横磁場 h です（長さ N、0 以上の有限値）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public IsingModel(DMatrixRMaj couplings, double[] fields) {
        if (couplings == null) {
            throw new IllegalArgumentException("couplings は null 不可です");
        }
        if (fields == null) {
            throw new IllegalArgumentException("fields は null 不可です");
        }
        int n = fields.length;
        if (n <= 0) {
            throw new IllegalArgumentException("サイト数は 1 以上が必要です: " + n);
        }
        if (couplings.numRows != n || couplings.numCols != n) {
            throw new IllegalArgumentException("couplings は " + n + "x" + n + " が必要です: "
                    + couplings.numRows + "x" + couplings.numCols);
        }
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(fields[i]) || fields[i] < 0.0) {
                throw new IllegalArgumentException(
                        "横磁場 h は 0 以上の有限値が必要です: h[" + i + "]=" + fields[i]);
            }
            if (couplings.get(i, i) != 0.0) {
                throw new IllegalArgumentException(
                        "J の対角成分は 0 が必要です: J[" + i + "][" + i + "]=" + couplings.get(i, i));
            }
            for (int j = i + 1; j < n; j++) {
                double jij = couplings.get(i, j);
                if (!Double.isFinite(jij)) {
                    throw new IllegalArgumentException(
                            "J は有限値が必要です: J[" + i + "][" + j + "]=" + jij);
                }
                if (jij != couplings.get(j, i)) {
                    throw new IllegalArgumentException("J は対称行列が必要です: J[" + i + "][" + j + "]="
                            + jij + ", J[" + j + "][" + i + "]=" + couplings.get(j, i));
                }
            }
        }
        this.siteCount = n;
        this.couplings = couplings.copy();
        this.fields = fields.clone();
    }

    /**
     * 全サイト一様な横磁場 h を持つ模型を生成します。
     *
     * @param couplings 結合行列 J です
     * @param field 一様横磁場 h です
     * @return 模型です
     */
    public static IsingModel withUniformField(DMatrixRMaj couplings, double field) {
        if (couplings == null) {
            throw new IllegalArgumentException("couplings は null 不可です");
        }
        double[] h = new double[couplings.numRows];
        Arrays.fill(h, field);
        return new IsingModel(couplings, h);
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
     * 結合定数 J_ij を返します。
     *
     * @param i サイトインデックスです
     * @param j サイトインデックスです
     * @return 結合定数です
     */
    public double coupling(int i, int j) {
        return couplings.get(i, j);
    }

    /**
     * 横磁場 h_s を返します。
     *
     * @param site サイトインデックスです
     * @return 横磁場です
     */
    public double field(int site) {
        return fields[site];
    }

    /**
     * 結合行列 J のコピーを返します。
     *
     * @return 結合行列のコピーです
     */
    public DMatrixRMaj couplingMatrix() {
        return couplings.copy();
    }
}
