package io.github.yok.sse.core.observable;

import io.github.yok.sse.app.SseProperties;
import io.github.yok.sse.core.lattice.Lattice;
import io.github.yok.sse.core.lattice.SquareLattice2D;

/**
 * 一辺 √N の正方格子を仮定したチェッカーボード符号で重み付けしたスタッガード磁化です。
 *
 * <p>
 * {@code m_s = (1/N) Σ (-1)^(x+y) σ_i} です。 N が平方数でない場合は生成時に拒否します。
 * </p>
 */
public final class StaggeredMagnetization implements MagnetizationObservable {

    /**
     * サイトごとの副格子符号です。
     */
    private final int[] signs;

    /**
     * サイト数 N に対するスタッガード磁化を生成します。
     *
     * @param siteCount サイト数です（平方数）
     * @throws IllegalArgumentException siteCount が平方数でない場合に発生します
     */
    public StaggeredMagnetization(int siteCount) {
        this(new SquareLattice2D(sideOf(siteCount), sideOf(siteCount),
                SseProperties.Lattice.Boundary.OPEN));
    }

    /**
     * 格子の副格子符号を使うスタッガード磁化を生成します。
     *
     * @param lattice 格子です
     */
    public StaggeredMagnetization(Lattice lattice) {
        if (lattice == null) {
            throw new IllegalArgumentException("lattice は null 不可です");
        }
        this.signs = new int[lattice.siteCount()];
        for (int i = 0; i < signs.length; i++) {
            signs[i] = lattice.sublatticeSign(i);
        }
    }

    @Override
    public int siteCount() {
        return signs.length;
    }

    @Override
    public double measure(boolean[] configuration) {
        if (configuration == null || configuration.length != signs.length) {
            throw new IllegalArgumentException("スピン配置の長さがサイト数と一致しません");
        }
        int sum = 0;
        for (int i = 0; i < signs.length; i++) {
            sum += configuration[i] ? signs[i] : -signs[i];
        }
        return sum / (double) signs.length;
    }

    /**
     * 平方数 N の一辺 √N を返します。
     *
     * @param siteCount サイト数です
     * @return 一辺の長さです
     * @throws IllegalArgumentException siteCount が正の平方数でない場合に発生します
     */
    static int sideOf(int siteCount) {
        if (siteCount <= 0) {
            throw new IllegalArgumentException("サイト数は 1 以上が必要です: " + siteCount);
        }
        int side = (int) Math.round(Math.sqrt(siteCount));
        if (side * side != siteCount) {
            throw new IllegalArgumentException(
                    "スタッガード磁化は一辺 √N の正方格子を仮定するため、N は平方数が必要です: N=" + siteCount);
        }
        return side;
    }
}
