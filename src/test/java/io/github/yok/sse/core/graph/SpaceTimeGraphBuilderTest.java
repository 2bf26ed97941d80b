package io.github.yok.sse.core.graph;

import static io.github.yok.sse.core.graph.SpaceTimeGraph.LOWER_1;
import static io.github.yok.sse.core.graph.SpaceTimeGraph.LOWER_2;
import static io.github.yok.sse.core.graph.SpaceTimeGraph.UNLINKED;
import static io.github.yok.sse.core.graph.SpaceTimeGraph.UPPER_1;
import static io.github.yok.sse.core.graph.SpaceTimeGraph.UPPER_2;
import static io.github.yok.sse.core.graph.SpaceTimeGraph.legOf;
import static io.github.yok.sse.core.graph.SpaceTimeGraph.lowerBoundary;
import static io.github.yok.sse.core.graph.SpaceTimeGraph.upperBoundary;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.sse.core.graph.SpaceTimeGraph.VertexKind;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * {@link SpaceTimeGraphBuilder} のテストです。
 */
class SpaceTimeGraphBuilderTest {

    /**
     * N=2: field(0), bond(0,1), field(1), field(0) の順に並べたグラフです。
     */
    private static SpaceTimeGraph sample() {
        SpaceTimeGraphBuilder builder = new SpaceTimeGraphBuilder(2);
        builder.begin(new SpaceTimeGraph(2, 4));
        builder.addFieldVertex(0, 0);
        builder.addBondVertex(1, 0, 1);
        builder.addFieldVertex(2, 1);
        builder.addFieldVertex(3, 0);
        return builder.finish();
    }

    @Test
    void legsAreLinkedAlongEachSiteWorldLine() {
        SpaceTimeGraph g = sample();

        assertEquals(VertexKind.FIELD, g.kindOf(0));
        assertEquals(VertexKind.BOND, g.kindOf(1));

        assertEquals(lowerBoundary(0), g.linkOf(legOf(0, LOWER_1)));
        assertEquals(legOf(1, LOWER_1), g.linkOf(legOf(0, UPPER_1)));
        assertEquals(lowerBoundary(1), g.linkOf(legOf(1, LOWER_2)));
        assertEquals(legOf(3, LOWER_1), g.linkOf(legOf(1, UPPER_1)));
        assertEquals(legOf(2, LOWER_1), g.linkOf(legOf(1, UPPER_2)));
        assertEquals(upperBoundary(1), g.linkOf(legOf(2, UPPER_1)));
        assertEquals(upperBoundary(0), g.linkOf(legOf(3, UPPER_1)));

        // 横磁場頂点の 2 番目の脚は使わない
        assertEquals(UNLINKED, g.linkOf(legOf(0, LOWER_2)));
        assertEquals(UNLINKED, g.linkOf(legOf(0, UPPER_2)));
    }

    @Test
    void linksBetweenLegsAreSymmetric() {
        SpaceTimeGraph g = sample();

        for (int leg = 0; leg < g.legCapacity(); leg++) {
            int target = g.linkOf(leg);
            if (target >= 0) {
                assertEquals(leg, g.linkOf(target), "leg=" + leg);
            }
        }
    }

    @Test
    void seedLegsAreExactlyTheFieldVertexLegs() {
        SpaceTimeGraph g = sample();

        Set<Integer> seeds = new HashSet<>();
        for (int k = 0; k < g.seedLegCount(); k++) {
            seeds.add(g.seedLeg(k));
        }
        assertEquals(Set.of(legOf(0, LOWER_1), legOf(0, UPPER_1), legOf(2, LOWER_1),
                legOf(2, UPPER_1), legOf(3, LOWER_1), legOf(3, UPPER_1)), seeds);
    }

    @Test
    void siteWithoutOperatorsContributesNoLegs() {
        SpaceTimeGraphBuilder builder = new SpaceTimeGraphBuilder(3);
        builder.begin(new SpaceTimeGraph(3, 2));
        builder.addBondVertex(0, 0, 1);
        builder.addFieldVertex(1, 1);
        SpaceTimeGraph g = builder.finish();

        for (int leg = 0; leg < g.legCapacity(); leg++) {
            int target = g.linkOf(leg);
            assertNotEquals(lowerBoundary(2), target);
            assertNotEquals(upperBoundary(2), target);
        }
        assertEquals(upperBoundary(0), g.linkOf(legOf(0, UPPER_1)));
        assertEquals(legOf(1, LOWER_1), g.linkOf(legOf(0, UPPER_2)));
        assertEquals(2, g.seedLegCount());
    }

    @Test
    void everySiteReachesItsBoundariesWhenTheStringIsShorterThanTheSystem() {
        int n = 5;
        SpaceTimeGraphBuilder builder = new SpaceTimeGraphBuilder(n);
        builder.begin(new SpaceTimeGraph(n, 2));
        builder.addFieldVertex(0, 3);
        builder.addBondVertex(1, 0, 4);
        SpaceTimeGraph g = builder.finish();

        Set<Integer> targets = new HashSet<>();
        for (int leg = 0; leg < g.legCapacity(); leg++) {
            targets.add(g.linkOf(leg));
        }
        for (int s : new int[] {0, 3, 4}) {
            assertTrue(targets.contains(lowerBoundary(s)), "site=" + s);
            assertTrue(targets.contains(upperBoundary(s)), "site=" + s);
        }
        for (int s : new int[] {1, 2}) {
            assertFalse(targets.contains(lowerBoundary(s)), "site=" + s);
        }
    }

    @Test
    void sentinelsEncodeSiteAndSide() {
        for (int s = 0; s < 4; s++) {
            assertTrue(SpaceTimeGraph.isBoundary(lowerBoundary(s)));
            assertTrue(SpaceTimeGraph.isBoundary(upperBoundary(s)));
            assertTrue(SpaceTimeGraph.isLowerBoundary(lowerBoundary(s)));
            assertFalse(SpaceTimeGraph.isLowerBoundary(upperBoundary(s)));
            assertEquals(s, SpaceTimeGraph.boundarySite(lowerBoundary(s)));
            assertEquals(s, SpaceTimeGraph.boundarySite(upperBoundary(s)));
        }
        assertFalse(SpaceTimeGraph.isBoundary(UNLINKED));
        assertFalse(SpaceTimeGraph.isBoundary(legOf(0, LOWER_1)));
    }

    @Test
    void beginResetsAReusedGraph() {
        SpaceTimeGraphBuilder builder = new SpaceTimeGraphBuilder(2);
        SpaceTimeGraph g = new SpaceTimeGraph(2, 1);

        builder.begin(g);
        builder.addBondVertex(0, 0, 1);
        builder.finish();

        builder.begin(g);
        builder.addFieldVertex(0, 1);
        builder.finish();

        assertEquals(VertexKind.FIELD, g.kindOf(0));
        assertEquals(UNLINKED, g.linkOf(legOf(0, LOWER_2)));
        assertEquals(lowerBoundary(1), g.linkOf(legOf(0, LOWER_1)));
        assertEquals(2, g.seedLegCount());
    }

    @Test
    void graphSiteCountMustMatchBuilder() {
        SpaceTimeGraphBuilder builder = new SpaceTimeGraphBuilder(2);

        assertThrows(IllegalArgumentException.class, () -> builder.begin(new SpaceTimeGraph(3, 1)));
    }
}
