package io.github.yok.sse.core.cluster;

import io.github.yok.sse.core.graph.SpaceTimeGraph;
import io.github.yok.sse.core.graph.SpaceTimeGraph.VertexKind;
import io.github.yok.sse.core.operator.OperatorString;
import java.util.Arrays;

/**
 * 時空グラフ上でクラスタを識別し、クラスタごとに独立なコイン投げで反転する大域更新です。
 *
 * <p>
 * 走査規則は頂点の種類で決まります。
 * </p>
 *
 * <ul>
 * <li>横磁場頂点: 終端です。到達した脚を訪問済みにし、反転するなら対角・非対角表現を入れ替えます。 上下の脚は別々のクラスタに属しえます。</li>
 * <li>ボンド頂点: 素通しです。初回到達時に 4 本すべての脚の先へ同じ判定を伝えます。 両端のサイトは必ず一緒に反転するため、ボンドの符号規則は保たれます。</li>
 * <li>下側境界センチネル: 反転するならそのサイトの境界状態を反転します。</li>
 * <li>上側境界センチネル: 何もしません。</li>
 * </ul>
 *
 * <p>
 * 再帰ではなく明示的なスタックで走査します。 訪問済み配列は再利用するため、スレッドセーフではありません。
 * </p>
 */
public final class ClusterUpdater {

    /**
     * 訪問済みの脚です。
     */
    private boolean[] visitedLegs = new boolean[0];

    /**
     * 訪問済みのボンド頂点（スロット）です。
     */
    private boolean[] visitedBonds = new boolean[0];

    /**
     * 走査用スタックです。
     */
    private int[] stack = new int[64];

    /**
     * クラスタ更新を実行し、演算子列と境界状態をその場で書き換えます。
     *
     * @param graph 今回のスイープで作った時空グラフです
     * @param operators 演算子列です（graph と同じ長さ）
     * @param boundary 左端の境界状態です（graph と同じサイト数）
     * @param decision クラスタごとの反転判定です
     * @return 集計です
     */
    public ClusterStatistics update(SpaceTimeGraph graph, OperatorString operators,
            boolean[] boundary, FlipDecision decision) {
        if (graph == null || operators == null || boundary == null || decision == null) {
            throw new IllegalArgumentException("graph/operators/boundary/decision は null 不可です");
        }
        if (operators.length() != graph.slotCount()) {
            throw new IllegalArgumentException("演算子列とグラフのスロット数が一致しません: "
                    + operators.length() + " vs " + graph.slotCount());
        }
        if (boundary.length != graph.siteCount()) {
            throw new IllegalArgumentException("境界状態とグラフのサイト数が一致しません: " + boundary.length
                    + " vs " + graph.siteCount());
        }

        prepare(graph);

        int clusters = 0;
        int flipped = 0;
        int boundaryFlips = 0;

        for (int k = 0; k < graph.seedLegCount(); k++) {
            int seed = graph.seedLeg(k);
            if (visitedLegs[seed]) {
                continue;
            }

            boolean flip = decision.nextFlip();
            clusters++;
            if (flip) {
                flipped++;
            }

            visitedLegs[seed] = true;
            if (flip) {
                operators.toggleFieldRepresentation(SpaceTimeGraph.slotOf(seed));
            }

            int top = 0;
            top = push(top, graph.linkOf(seed));

            while (top > 0) {
                int target = stack[--top];

                if (SpaceTimeGraph.isBoundary(target)) {
                    if (flip && SpaceTimeGraph.isLowerBoundary(target)) {
                        int site = SpaceTimeGraph.boundarySite(target);
                        boundary[site] = !boundary[site];
                        boundaryFlips++;
                    }
                    continue;
                }

                int slot = SpaceTimeGraph.slotOf(target);
                if (graph.kindOf(slot) == VertexKind.FIELD) {
                    if (visitedLegs[target]) {
                        continue;
                    }
                    visitedLegs[target] = true;
                    if (flip) {
                        operators.toggleFieldRepresentation(slot);
                    }
                    continue;
                }

                // ボンド頂点: 4 本の脚の先へ同じ判定を伝える
                if (visitedBonds[slot]) {
                    continue;
                }
                visitedBonds[slot] = true;
                for (int d = 0; d < SpaceTimeGraph.LEGS_PER_VERTEX; d++) {
                    top = push(top, graph.linkOf(SpaceTimeGraph.legOf(slot, d)));
                }
            }
        }

        return new ClusterStatistics(clusters, flipped, boundaryFlips);
    }

    /**
     * 訪問済み配列をグラフの大きさに合わせて確保・消去します。
     *
     * @param graph 時空グラフです
     */
    private void prepare(SpaceTimeGraph graph) {
        if (visitedLegs.length != graph.legCapacity()) {
            visitedLegs = new boolean[graph.legCapacity()];
            visitedBonds = new boolean[graph.slotCount()];
        } else {
            Arrays.fill(visitedLegs, false);
            Arrays.fill(visitedBonds, false);
        }
    }

    private int push(int top, int target) {
        if (target == SpaceTimeGraph.UNLINKED) {
            throw new IllegalStateException("未接続の脚を辿りました（グラフ構築の不具合です）");
        }
        if (top == stack.length) {
            stack = Arrays.copyOf(stack, stack.length * 2);
        }
        stack[top] = target;
        return top + 1;
    }
}
