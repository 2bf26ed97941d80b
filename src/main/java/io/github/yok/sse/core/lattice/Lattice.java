package io.github.yok.sse.core.lattice;

/**
 * 量子モンテカルロ計算で使用する格子（サイト集合）を表すインタフェースです。
 *
 * <p>
 * モデル構築側・観測量側は格子の具体形状を意識せず、サイト数・隣接情報・副格子の符号のみを利用します。
 * </p>
 */
public interface Lattice {

    /**
     * サイト数 N を返します。
     *
     * @return サイト数です
     */
    int siteCount();

    /**
     * 指定サイトに隣接するサイトのインデックス配列を返します。
     *
     * @param siteIndex サイトインデックスです（0 以上 N 未満）
     * @return 隣接サイトのインデックス配列です（null にはしません）
     */
    int[] neighborsOf(int siteIndex);

    /**
     * 2 副格子に塗り分けたときの符号（+1 / -1）を返します。
     *
     * <p>
     * 反強磁性秩序を検出するスタッガード磁化の重みとして使用します。
     * </p>
     *
     * @param siteIndex サイトインデックスです（0 以上 N 未満）
     * @return +1 または -1 です
     */
    int sublatticeSign(int siteIndex);
}
