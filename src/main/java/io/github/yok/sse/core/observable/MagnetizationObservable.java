package io.github.yok.sse.core.observable;

/**
 * スピン配置から磁化（1 サイトあたり）を計算するインタフェースです。
 *
 * <p>
 * 一様磁化・スタッガード磁化など、秩序の種類に応じて差し替えるための境界です。
 * </p>
 */
public interface MagnetizationObservable {

    /**
     * 対象のサイト数 N を返します。
     *
     * @return サイト数です
     */
    int siteCount();

    /**
     * スピン配置（true が上向き）の磁化を返します。
     *
     * @param configuration スピン配置です（長さ N）
     * @return 磁化（-1 以上 1 以下）です
     */
    double measure(boolean[] configuration);
}
