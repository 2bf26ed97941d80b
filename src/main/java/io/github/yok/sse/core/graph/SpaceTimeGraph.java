package io.github.yok.sse.core.graph;

import java.util.Arrays;

/**
 * 演算子列から作る時空グラフ（頂点はスロット番号で引くアリーナ）です。
 *
 * <p>
 * 頂点はスロットごとに 1 つで、種類は {@link VertexKind} です。 各頂点は 4 本の脚（LOWER_1, LOWER_2, UPPER_1,
 * UPPER_2）を持ち、脚は {@code 4 * slot + direction} の整数で表します。 脚のリンク先は他の頂点の脚か、境界センチネルです。
 * </p>
 *
 * <ul>
 * <li>下側境界センチネル（サイト s）: {@code -(2s + 2)}</li>
 * <li>上側境界センチネル（サイト s）: {@code -(2s + 3)}</li>
 * <li>未接続: {@link #UNLINKED}</li>
 * </ul>
 *
 * <p>
 * 1 スイープ中は単一のドライバが占有し、次のスイープの開始時に {@link #reset()} で使い回します。
 * </p>
 */
public final class SpaceTimeGraph {

    /**
     * 下側の 1 番目の脚です（横磁場頂点はこちらのみ使用します）。
     */
    public static final int LOWER_1 = 0;

    /**
     * 下側の 2 番目の脚です（ボンド頂点の 2 番目のサイト）。
     */
    public static final int LOWER_2 = 1;

    /**
     * 上側の 1 番目の脚です。
     */
    public static final int UPPER_1 = 2;

    /**
     * 上側の 2 番目の脚です。
     */
    public static final int UPPER_2 = 3;

    /**
     * 1 頂点あたりの脚の数です。
     */
    public static final int LEGS_PER_VERTEX = 4;

    /**
     * 未接続の脚を表す値です。
     */
    public static final int UNLINKED = -1;

    /**
     * 頂点の種類です。
     */
    public enum VertexKind {

        /**
         * 横磁場頂点（クラスタの終端）です。
         */
        FIELD,

        /**
         * ボンド頂点（クラスタを素通しします）です。
         */
        BOND
    }

    /**
     * サイト数です。
     */
    private final int siteCount;

    /**
     * スロット数（頂点数）です。
     */
    private final int slotCount;

    /**
     * スロットごとの頂点の種類です。
     */
    private final VertexKind[] kinds;

    /**
     * 脚ごとのリンク先です。
     */
    private final int[] links;

    /**
     * クラスタの起点になりうる脚（横磁場頂点の上下の脚）です。
     */
    private final int[] seedLegs;

    /**
     * seedLegs の有効要素数です。
     */
    private int seedLegCount;

    /**
     * 空の時空グラフを確保します。
     *
     * @param siteCount サイト数です（1 以上）
     * @param slotCount スロット数 2m です（1 以上）
     */
    public SpaceTimeGraph(int siteCount, int slotCount) {
        if (siteCount <= 0 || slotCount <= 0) {
            throw new IllegalArgumentException(
                    "siteCount/slotCount は 1 以上が必要です: " + siteCount + ", " + slotCount);
        }
        this.siteCount = siteCount;
        this.slotCount = slotCount;
        this.kinds = new VertexKind[slotCount];
        this.links = new int[LEGS_PER_VERTEX * slotCount];
        this.seedLegs = new int[2 * slotCount];
        reset();
    }

    /**
     * 全ての頂点・リンク・起点脚を消去します。
     */
    public void reset() {
        Arrays.fill(kinds, null);
        Arrays.fill(links, UNLINKED);
        seedLegCount = 0;
    }

    /**
     * スロットと方向から脚を求めます。
     *
     * @param slot スロットです
     * @param direction 方向（LOWER_1 など）です
     * @return 脚です
     */
    public static int legOf(int slot, int direction) {
        return LEGS_PER_VERTEX * slot + direction;
    }

    /**
     * 脚が属するスロットを返します。
     *
     * @param leg 脚です（0 以上）
     * @return スロットです
     */
    public static int slotOf(int leg) {
        return leg / LEGS_PER_VERTEX;
    }

    /**
     * 脚の方向を返します。
     *
     * @param leg 脚です（0 以上）
     * @return 方向です
     */
    public static int directionOf(int leg) {
        return leg % LEGS_PER_VERTEX;
    }

    /**
     * サイト s の下側境界センチネルを返します。
     *
     * @param site サイトです
     * @return リンク先の値です
     */
    public static int lowerBoundary(int site) {
        return -(2 * site + 2);
    }

    /**
     * サイト s の上側境界センチネルを返します。
     *
     * @param site サイトです
     * @return リンク先の値です
     */
    public static int upperBoundary(int site) {
        return -(2 * site + 3);
    }

    /**
     * リンク先が境界センチネルかどうかを返します。
     *
     * @param target リンク先です
     * @return 境界センチネルの場合は true です
     */
    public static boolean isBoundary(int target) {
        return target <= -2;
    }

    /**
     * リンク先が下側境界センチネルかどうかを返します。
     *
     * @param target リンク先です
     * @return 下側境界センチネルの場合は true です
     */
    public static boolean isLowerBoundary(int target) {
        return isBoundary(target) && ((-target - 2) % 2 == 0);
    }

    /**
     * 境界センチネルのサイトを返します。
     *
     * @param target 境界センチネルです
     * @return サイトです
     */
    public static int boundarySite(int target) {
        return (-target - 2) / 2;
    }

    /**
     * サイト数を返します。
     *
     * @return サイト数です
     */
    public int siteCount() {
        return siteCount;
    }

    /**
     * スロット数を返します。
     *
     * @return スロット数です
     */
    public int slotCount() {
        return slotCount;
    }

    /**
     * 脚の総数（4 × スロット数）を返します。
     *
     * @return 脚の総数です
     */
    public int legCapacity() {
        return links.length;
    }

    /**
     * スロットの頂点の種類を返します。
     *
     * @param slot スロットです
     * @return 頂点の種類です（未作成なら null）
     */
    public VertexKind kindOf(int slot) {
        return kinds[slot];
    }

    /**
     * 脚のリンク先を返します。
     *
     * @param leg 脚です
     * @return リンク先（脚、境界センチネル、または UNLINKED）です
     */
    public int linkOf(int leg) {
        return links[leg];
    }

    /**
     * クラスタの起点になりうる脚の数を返します。
     *
     * @return 起点脚の数です
     */
    public int seedLegCount() {
        return seedLegCount;
    }

    /**
     * k 番目の起点脚を返します。
     *
     * @param index 0 以上 seedLegCount 未満です
     * @return 脚です
     */
    public int seedLeg(int index) {
        if (index < 0 || index >= seedLegCount) {
            throw new IndexOutOfBoundsException("seedLeg index: " + index + " / " + seedLegCount);
        }
        return seedLegs[index];
    }

    void markVertex(int slot, VertexKind kind) {
        kinds[slot] = kind;
    }

    void setLink(int leg, int target) {
        links[leg] = target;
    }

    void addSeedLeg(int leg) {
        seedLegs[seedLegCount++] = leg;
    }
}
