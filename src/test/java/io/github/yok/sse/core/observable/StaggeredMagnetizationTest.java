package io.github.yok.sse.core.observable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.sse.app.SseProperties;
import io.github.yok.sse.core.lattice.SquareLattice2D;
import org.junit.jupiter.api.Test;

/**
 * {@link StaggeredMagnetization} と {@link UniformMagnetization} のテストです。
 */
class StaggeredMagnetizationTest {

    @Test
    void neelStatesGiveFullStaggeredMagnetization() {
        StaggeredMagnetization m = new StaggeredMagnetization(9);
        boolean[] neel = new boolean[9];
        for (int s = 0; s < 9; s++) {
            neel[s] = ((s % 3) + (s / 3)) % 2 == 0;
        }
        boolean[] flipped = new boolean[9];
        for (int s = 0; s < 9; s++) {
            flipped[s] = !neel[s];
        }

        assertEquals(1.0, m.measure(neel), 1e-15);
        assertEquals(-1.0, m.measure(flipped), 1e-15);
    }

    @Test
    void uniformStateHasZeroStaggeredMagnetizationOnEvenSquare() {
        StaggeredMagnetization m = new StaggeredMagnetization(4);

        assertEquals(0.0, m.measure(new boolean[] {true, true, true, true}));
        assertEquals(0.5, m.measure(new boolean[] {true, true, false, true}), 1e-15);
    }

    @Test
    void siteCountThatIsNotAPerfectSquareIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new StaggeredMagnetization(6));
        assertThrows(IllegalArgumentException.class, () -> new StaggeredMagnetization(0));
        assertEquals(4, StaggeredMagnetization.sideOf(16));
    }

    @Test
    void rectangularLatticeUsesItsOwnCheckerboard() {
        SquareLattice2D lattice = new SquareLattice2D(3, 2, SseProperties.Lattice.Boundary.OPEN);
        StaggeredMagnetization m = new StaggeredMagnetization(lattice);

        // (x+y) が偶数のサイト: 0, 2, 4
        boolean[] neel = {true, false, true, false, true, false};
        assertEquals(6, m.siteCount());
        assertEquals(1.0, m.measure(neel), 1e-15);
    }

    @Test
    void configurationLengthMustMatch() {
        assertThrows(IllegalArgumentException.class,
                () -> new StaggeredMagnetization(4).measure(new boolean[3]));
        assertThrows(IllegalArgumentException.class,
                () -> new UniformMagnetization(4).measure(new boolean[5]));
    }

    @Test
    void uniformMagnetizationAveragesSpins() {
        UniformMagnetization m = new UniformMagnetization(4);

        assertEquals(1.0, m.measure(new boolean[] {true, true, true, true}));
        assertEquals(-0.5, m.measure(new boolean[] {false, true, false, false}));
    }
}
