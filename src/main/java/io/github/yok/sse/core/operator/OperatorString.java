package io.github.yok.sse.core.operator;

import com.google.common.base.Preconditions;

/**
 * 長さ 2m の演算子列（虚時間の境界から境界まで）を保持するクラスです。
 *
 * <p>
 * 各スロットは {@link OperatorType} と作用するサイト（ボンドは 2 サイト）を持ちます。 スイープごとにその場で書き換えます。
 * </p>
 */
public final class OperatorString {

    /**
     * ボンド以外のスロットで 2 番目のサイトに入れる値です。
     */
    private static final int NO_SITE = -1;

    /**
     * 演算子列の半分の長さ m です。
     */
    private final int halfLength;

    /**
     * スロットごとの演算子の種類です。
     */
    private final OperatorType[] types;

    /**
     * スロットごとの 1 番目のサイトです。
     */
    private final int[] firstSites;

    /**
     * スロットごとの 2 番目のサイト（ボンドのみ）です。
     */
    private final int[] secondSites;

    /**
     * 全スロットを対角の横磁場演算子で埋めた演算子列を生成します。
     *
     * <p>
     * 対角演算子は最初のスイープで全て再サンプリングされるため、初期のサイトは {@code p mod N} とします。
     * </p>
     *
     * @param halfLength 演算子列の半分の長さ m です（1 以上）
     * @param siteCount サイト数 N です（1 以上）
     */
    public OperatorString(int halfLength, int siteCount) {
        Preconditions.checkArgument(halfLength > 0, "halfLength は 1 以上が必要です: %s", halfLength);
        Preconditions.checkArgument(siteCount > 0, "siteCount は 1 以上が必要です: %s", siteCount);
        this.halfLength = halfLength;
        int length = 2 * halfLength;
        this.types = new OperatorType[length];
        this.firstSites = new int[length];
        this.secondSites = new int[length];
        for (int p = 0; p < length; p++) {
            setDiagonalField(p, p % siteCount);
        }
    }

    /**
     * コピーを生成します。
     *
     * @param source コピー元です
     */
    private OperatorString(OperatorString source) {
        this.halfLength = source.halfLength;
        this.types = source.types.clone();
        this.firstSites = source.firstSites.clone();
        this.secondSites = source.secondSites.clone();
    }

    /**
     * 演算子列のコピーを返します。
     *
     * @return コピーです
     */
    public OperatorString copy() {
        return new OperatorString(this);
    }

    /**
     * 演算子列の半分の長さ m を返します。
     *
     * @return m です
     */
    public int halfLength() {
        return halfLength;
    }

    /**
     * スロット数 2m を返します。
     *
     * @return スロット数です
     */
    public int length() {
        return types.length;
    }

    /**
     * スロット p の演算子の種類を返します。
     *
     * @param slot スロットです
     * @return 演算子の種類です
     */
    public OperatorType typeAt(int slot) {
        return types[slot];
    }

    /**
     * スロット p の 1 番目のサイト（横磁場演算子ではそのサイト）を返します。
     *
     * @param slot スロットです
     * @return サイトインデックスです
     */
    public int firstSite(int slot) {
        return firstSites[slot];
    }

    /**
     * スロット p の 2 番目のサイトを返します（ボンド以外では -1）。
     *
     * @param slot スロットです
     * @return サイトインデックスです
     */
    public int secondSite(int slot) {
        return secondSites[slot];
    }

    /**
     * スロット p に対角の横磁場演算子を置きます。
     *
     * @param slot スロットです
     * @param site サイトです
     */
    public void setDiagonalField(int slot, int site) {
        set(slot, OperatorType.DIAGONAL_FIELD, site, NO_SITE);
    }

    /**
     * スロット p に非対角の横磁場演算子を置きます。
     *
     * @param slot スロットです
     * @param site サイトです
     */
    public void setOffDiagonalField(int slot, int site) {
        set(slot, OperatorType.OFF_DIAGONAL_FIELD, site, NO_SITE);
    }

    /**
     * スロット p にボンド演算子 (i, j) を置きます。
     *
     * @param slot スロットです
     * @param i 1 番目のサイトです
     * @param j 2 番目のサイトです（i と異なること）
     * @throws IllegalArgumentException i == j の場合に発生します
     */
    public void setBond(int slot, int i, int j) {
        if (i == j) {
            throw new IllegalArgumentException("ボンド演算子は異なる 2 サイトが必要です: i=j=" + i);
        }
        set(slot, OperatorType.BOND, i, j);
    }

    /**
     * 横磁場演算子の対角・非対角表現を入れ替えます（クラスタ反転の実体です）。
     *
     * @param slot スロットです
     * @throws IllegalStateException スロットがボンド演算子の場合に発生します
     */
    public void toggleFieldRepresentation(int slot) {
        types[slot] = types[slot].toggled();
    }

    /**
     * 境界状態をスロット 0 から endExclusive 直前まで伝播させたスピン配置を返します。
     *
     * <p>
     * 非対角の横磁場演算子を通過するたびにそのサイトのスピンを反転します。 引数の配列は変更しません。
     * </p>
     *
     * @param boundary 左端の境界状態です
     * @param endExclusive 伝播を止めるスロットです（0 以上 2m 以下）
     * @return 伝播後のスピン配置です
     */
    public boolean[] propagate(boolean[] boundary, int endExclusive) {
        Preconditions.checkArgument(endExclusive >= 0 && endExclusive <= types.length,
                "endExclusive が範囲外です: %s", endExclusive);
        boolean[] alpha = boundary.clone();
        for (int p = 0; p < endExclusive; p++) {
            if (types[p] == OperatorType.OFF_DIAGONAL_FIELD) {
                int s = firstSites[p];
                alpha[s] = !alpha[s];
            }
        }
        return alpha;
    }

    /**
     * 演算子列中央（スロット m）の直前までの伝播結果を返します。
     *
     * @param boundary 左端の境界状態です
     * @return 虚時間中央のスピン配置です
     */
    public boolean[] midpointConfiguration(boolean[] boundary) {
        return propagate(boundary, halfLength);
    }

    /**
     * 種類ごとの演算子数を数えます。
     *
     * @param type 演算子の種類です
     * @return 個数です
     */
    public int count(OperatorType type) {
        int c = 0;
        for (OperatorType t : types) {
            if (t == type) {
                c++;
            }
        }
        return c;
    }

    private void set(int slot, OperatorType type, int first, int second) {
        types[slot] = type;
        firstSites[slot] = first;
        secondSites[slot] = second;
    }
}
