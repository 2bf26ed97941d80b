package io.github.yok.sse.core.operator;

import lombok.Getter;

/**
 * 演算子列にボンドの符号規則を満たさないボンド演算子が含まれていることを表す例外です。
 *
 * <p>
 * 正しく実装されたスイープでは発生しません。発生した場合はサンプリングまたはクラスタ更新の不具合を意味します。
 * </p>
 */
@Getter
public final class InvalidBondStateException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 違反の種類です。
     */
    public enum Kind {

        /**
         * 反強磁性ボンド（J>0）の両端スピンが揃っています。
         */
        ANTIFERROMAGNETIC_BOND_ON_ALIGNED_SPINS,

        /**
         * 強磁性ボンド（J&lt;0）の両端スピンが揃っていません。
         */
        FERROMAGNETIC_BOND_ON_MISALIGNED_SPINS,

        /**
         * 結合 0 のサイト対にボンド演算子が置かれています。
         */
        BOND_ON_ZERO_COUPLING
    }

    /**
     * 違反の種類です。
     */
    private final Kind kind;

    /**
     * 違反が見つかったスロットです。
     */
    private final int slot;

    /**
     * ボンドの 1 番目のサイトです。
     */
    private final int firstSite;

    /**
     * ボンドの 2 番目のサイトです。
     */
    private final int secondSite;

    /**
     * 例外を生成します。
     *
     * @param kind 違反の種類です
     * @param slot スロットです
     * @param firstSite 1 番目のサイトです
     * @param secondSite 2 番目のサイトです
     */
    public InvalidBondStateException(Kind kind, int slot, int firstSite, int secondSite) {
        super("ボンド演算子の符号規則違反: kind=" + kind + ", slot=" + slot + ", sites=(" + firstSite
                + ", " + secondSite + ")");
        this.kind = kind;
        this.slot = slot;
        this.firstSite = firstSite;
        this.secondSite = secondSite;
    }
}
