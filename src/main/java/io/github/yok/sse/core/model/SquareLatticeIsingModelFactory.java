package io.github.yok.sse.core.model;

import io.github.yok.sse.core.lattice.SquareLattice2D;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 正方格子上の最近接結合と一様横磁場から {@link IsingModel} を組み立てるクラスです。
 *
 * <p>
 * 異方性角 θ に対して、横ボンドは {@code J cos θ}、縦ボンドは {@code J sin θ} とします。 θ=45° で等方的（ただし大きさは
 * {@code J/√2}）になります。
 * </p>
 */
@Slf4j
@Getter
public final class SquareLatticeIsingModelFactory {

    /**
     * 絶対値がこれ未満の結合は 0 とみなします（cos 90° などの丸め誤差対策）。
     */
    private static final double COUPLING_EPSILON = 1e-12;

    /**
     * 格子です。
     */
    private final SquareLattice2D lattice;

    /**
     * 結合の大きさ J です（正で反強磁性）。
     */
    private final double coupling;

    /**
     * 一様横磁場 h です。
     */
    private final double field;

    /**
     * モデル生成器を作成します。
     *
     * @param lattice 格子です（null 不可）
     * @param coupling 結合の大きさ J です（有限値）
     * @param field 一様横磁場 h です（0 以上の有限値）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public SquareLatticeIsingModelFactory(SquareLattice2D lattice, double coupling, double field) {
        if (lattice == null) {
            throw new IllegalArgumentException("lattice は null 不可です");
        }
        if (!Double.isFinite(coupling)) {
            throw new IllegalArgumentException("coupling は有限値が必要です: " + coupling);
        }
        if (!Double.isFinite(field) || field < 0.0) {
            throw new IllegalArgumentException("field は 0 以上の有限値が必要です: " + field);
        }
        this.lattice = lattice;
        this.coupling = coupling;
        this.field = field;
    }

    /**
     * 異方性角 θ（度）に対応する模型を生成します。
     *
     * @param angleDegrees 異方性角 θ（度）です
     * @return 横磁場イジング模型です
     */
    public IsingModel create(double angleDegrees) {
        if (!Double.isFinite(angleDegrees)) {
            throw new IllegalArgumentException("異方性角は有限値が必要です: " + angleDegrees);
        }
        double theta = Math.toRadians(angleDegrees);
        double jx = roundToZero(coupling * Math.cos(theta));
        double jy = roundToZero(coupling * Math.sin(theta));

        int n = lattice.siteCount();
        DMatrixRMaj j = new DMatrixRMaj(n, n);

        for (int site = 0; site < n; site++) {
            for (int neighbor : lattice.neighborsOf(site)) {
                // 周期境界で同じ組が 2 回現れても加算せずに上書きします
                double value = lattice.isHorizontalPair(site, neighbor) ? jx : jy;
                j.set(site, neighbor, value);
                j.set(neighbor, site, value);
            }
        }

        log.debug("模型を生成しました。θ={}度、Jx={}、Jy={}、h={}、N={}", angleDegrees, jx, jy, field, n);
        return IsingModel.withUniformField(j, field);
    }

    /**
     * 丸め誤差程度の値を 0 に揃えます。
     *
     * @param v 値です
     * @return 丸めた値です
     */
    private static double roundToZero(double v) {
        return (Math.abs(v) < COUPLING_EPSILON) ? 0.0 : v;
    }
}
