package io.github.yok.sse.core.graph;

import io.github.yok.sse.core.graph.SpaceTimeGraph.VertexKind;

/**
 * 演算子列を先頭から 1 回走査しながら時空グラフを組み立てるクラスです。
 *
 * <p>
 * サイトごとに「上向きのリンクを待っている脚（フロンティア）」を保持し、 新しい頂点を作るたびにフロンティアの脚へ後からリンクを書き込みます（バックパッチ）。
 * フロンティアの初期値は各サイトの下側境界センチネルです。
 * </p>
 *
 * <p>
 * スレッドセーフではありません。1 本のマルコフ連鎖につき 1 インスタンスを使います。
 * </p>
 */
public final class SpaceTimeGraphBuilder {

    /**
     * サイトごとのフロンティア（脚または下側境界センチネル）です。
     */
    private final int[] frontier;

    /**
     * 組み立て中のグラフです。
     */
    private SpaceTimeGraph graph;

    /**
     * 組み立て器を生成します。
     *
     * @param siteCount サイト数です（1 以上）
     */
    public SpaceTimeGraphBuilder(int siteCount) {
        if (siteCount <= 0) {
            throw new IllegalArgumentException("siteCount は 1 以上が必要です: " + siteCount);
        }
        this.frontier = new int[siteCount];
    }

    /**
     * 組み立てを開始します。グラフは消去され、全サイトのフロンティアは下側境界に戻ります。
     *
     * @param target 書き込み先のグラフです（サイト数が一致すること）
     */
    public void begin(SpaceTimeGraph target) {
        if (target == null) {
            throw new IllegalArgumentException("target は null 不可です");
        }
        if (target.siteCount() != frontier.length) {
            throw new IllegalArgumentException("グラフのサイト数が一致しません: " + target.siteCount()
                    + " vs " + frontier.length);
        }
        target.reset();
        for (int s = 0; s < frontier.length; s++) {
            frontier[s] = SpaceTimeGraph.lowerBoundary(s);
        }
        this.graph = target;
    }

    /**
     * 横磁場頂点（対角・非対角どちらの表現でも同じ）を追加します。
     *
     * @param slot スロットです
     * @param site サイトです
     */
    public void addFieldVertex(int slot, int site) {
        ensureStarted();
        graph.markVertex(slot, VertexKind.FIELD);

        int lower = SpaceTimeGraph.legOf(slot, SpaceTimeGraph.LOWER_1);
        int upper = SpaceTimeGraph.legOf(slot, SpaceTimeGraph.UPPER_1);

        link(lower, frontier[site]);
        frontier[site] = upper;

        graph.addSeedLeg(lower);
        graph.addSeedLeg(upper);
    }

    /**
     * ボンド頂点 (i, j) を追加します。ボンドの脚は起点脚に含めません。
     *
     * @param slot スロットです
     * @param i 1 番目のサイトです
     * @param j 2 番目のサイトです
     */
    public void addBondVertex(int slot, int i, int j) {
        ensureStarted();
        graph.markVertex(slot, VertexKind.BOND);

        link(SpaceTimeGraph.legOf(slot, SpaceTimeGraph.LOWER_1), frontier[i]);
        link(SpaceTimeGraph.legOf(slot, SpaceTimeGraph.LOWER_2), frontier[j]);

        frontier[i] = SpaceTimeGraph.legOf(slot, SpaceTimeGraph.UPPER_1);
        frontier[j] = SpaceTimeGraph.legOf(slot, SpaceTimeGraph.UPPER_2);
    }

    /**
     * 各サイトの残ったフロンティアを上側境界センチネルへ接続して組み立てを終えます。
     *
     * <p>
     * 演算子が 1 つもないサイトは下側境界と上側境界が直接つながるだけで、脚は生じません。
     * </p>
     *
     * @return 完成したグラフです
     */
    public SpaceTimeGraph finish() {
        ensureStarted();
        for (int s = 0; s < frontier.length; s++) {
            link(frontier[s], SpaceTimeGraph.upperBoundary(s));
        }
        SpaceTimeGraph done = graph;
        graph = null;
        return done;
    }

    /**
     * 2 つの接続点をリンクします。脚同士の場合は両端に書き込みます。
     *
     * @param a 接続点（脚または境界センチネル）です
     * @param b 接続点（脚または境界センチネル）です
     */
    private void link(int a, int b) {
        if (a >= 0) {
            graph.setLink(a, b);
        }
        if (b >= 0) {
            graph.setLink(b, a);
        }
    }

    private void ensureStarted() {
        if (graph == null) {
            throw new IllegalStateException("begin が呼ばれていません");
        }
    }
}
