package io.github.yok.sse.core.lattice;

import io.github.yok.sse.app.SseProperties;

/**
 * 2 次元の正方格子（4 近傍）を表すクラスです。
 *
 * <p>
 * インデックス変換は {@code index = y * lx + x} です。 チェッカーボード（副格子）の符号 {@code (-1)^(x+y)} も提供します。
 * </p>
 */
public final class SquareLattice2D implements Lattice {

    /**
     * x 方向サイズです。
     */
    private final int lx;

    /**
     * y 方向サイズです。
     */
    private final int ly;

    /**
     * 境界条件です。
     */
    private final SseProperties.Lattice.Boundary boundary;

    /**
     * 2 次元正方格子を生成します。
     *
     * @param lx x 方向サイズです（1 以上）
     * @param ly y 方向サイズです（1 以上）
     * @param boundary 境界条件です（null 不可）
     * @throws IllegalArgumentException lx/ly が 1 未満、または boundary が null の場合に発生します
     */
    public SquareLattice2D(int lx, int ly, SseProperties.Lattice.Boundary boundary) {
        if (lx <= 0 || ly <= 0) {
            throw new IllegalArgumentException("lx/ly は 1 以上が必要です: " + lx + "x" + ly);
        }
        if (boundary == null) {
            throw new IllegalArgumentException("boundary は null 不可です");
        }
        this.lx = lx;
        this.ly = ly;
        this.boundary = boundary;
    }

    /**
     * x 方向サイズ（Lx）を返します。
     *
     * @return x 方向サイズです
     */
    public int lx() {
        return lx;
    }

    /**
     * y 方向サイズ（Ly）を返します。
     *
     * @return y 方向サイズです
     */
    public int ly() {
        return ly;
    }

    /**
     * 座標 (x, y) をサイトインデックスに変換します。
     *
     * @param x x 座標です（0 以上 lx 未満）
     * @param y y 座標です（0 以上 ly 未満）
     * @return サイトインデックスです
     */
    public int indexOf(int x, int y) {
        return y * lx + x;
    }

    /**
     * サイトインデックスから x 座標を返します。
     *
     * @param siteIndex サイトインデックスです（0 以上 N 未満）
     * @return x 座標です
     */
    public int xOf(int siteIndex) {
        return siteIndex % lx;
    }

    /**
     * サイトインデックスから y 座標を返します。
     *
     * @param siteIndex サイトインデックスです（0 以上 N 未満）
     * @return y 座標です
     */
    public int yOf(int siteIndex) {
        return siteIndex / lx;
    }

    /**
     * チェッカーボード塗り分けの符号 {@code (-1)^(x+y)} を返します。
     *
     * @param siteIndex サイトインデックスです（0 以上 N 未満）
     * @return +1 または -1 です
     */
    @Override
    public int sublatticeSign(int siteIndex) {
        return ((xOf(siteIndex) + yOf(siteIndex)) % 2 == 0) ? 1 : -1;
    }

    /**
     * 2 サイトが x 方向（横）の最近接ボンドで結ばれているかを返します。
     *
     * @param i サイトインデックスです
     * @param j サイトインデックスです
     * @return 同じ行に属する場合は true です
     */
    public boolean isHorizontalPair(int i, int j) {
        return yOf(i) == yOf(j);
    }

    /**
     * サイト数 N を返します。
     *
     * @return サイト数です
     */
    @Override
    public int siteCount() {
        return lx * ly;
    }

    /**
     * 4 近傍の隣接サイトインデックスを返します。
     *
     * <p>
     * 周期境界で一辺が 1 または 2 の場合に生じる自己ループ・重複は取り除きます。
     * </p>
     *
     * @param siteIndex サイトインデックスです（0 以上 N 未満）
     * @return 隣接サイトインデックス配列です（null にはしません）
     */
    @Override
    public int[] neighborsOf(int siteIndex) {
        int x = xOf(siteIndex);
        int y = yOf(siteIndex);

        int[] buf = new int[4];
        int count = 0;

        // 左右隣接サイト
        if (boundary == SseProperties.Lattice.Boundary.PERIODIC) {
            count = addDistinct(buf, count, siteIndex, indexOf((x - 1 + lx) % lx, y));
            count = addDistinct(buf, count, siteIndex, indexOf((x + 1) % lx, y));
        } else {
            if (x > 0)
                buf[count++] = indexOf(x - 1, y);
            if (x < lx - 1)
                buf[count++] = indexOf(x + 1, y);
        }

        // 上下隣接サイト
        if (boundary == SseProperties.Lattice.Boundary.PERIODIC) {
            count = addDistinct(buf, count, siteIndex, indexOf(x, (y - 1 + ly) % ly));
            count = addDistinct(buf, count, siteIndex, indexOf(x, (y + 1) % ly));
        } else {
            if (y > 0)
                buf[count++] = indexOf(x, y - 1);
            if (y < ly - 1)
                buf[count++] = indexOf(x, y + 1);
        }

        int[] out = new int[count];
        System.arraycopy(buf, 0, out, 0, count);
        return out;
    }

    /**
     * 自分自身と既出のサイトを除いて隣接サイトを追加します。
     *
     * @param buf 追加先バッファです
     * @param count 現在の要素数です
     * @param self 基準サイトです
     * @param candidate 追加候補です
     * @return 追加後の要素数です
     */
    private static int addDistinct(int[] buf, int count, int self, int candidate) {
        if (candidate == self) {
            return count;
        }
        for (int k = 0; k < count; k++) {
            if (buf[k] == candidate) {
                return count;
            }
        }
        buf[count] = candidate;
        return count + 1;
    }
}
