package io.github.yok.sse.core.sweep;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.sse.app.SseProperties;
import io.github.yok.sse.core.lattice.SquareLattice2D;
import io.github.yok.sse.core.model.IsingModel;
import io.github.yok.sse.core.model.SquareLatticeIsingModelFactory;
import io.github.yok.sse.core.observable.MagnetizationObservable;
import io.github.yok.sse.core.observable.StaggeredMagnetization;
import io.github.yok.sse.core.observable.UniformMagnetization;
import io.github.yok.sse.core.operator.OperatorString;
import io.github.yok.sse.core.operator.OperatorStringValidator;
import io.github.yok.sse.core.operator.OperatorType;
import io.github.yok.sse.core.sampling.InsertionProbabilityTable;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

/**
 * {@link SweepDriver} のテストです。
 */
class SweepDriverTest {

    private final OperatorStringValidator validator = new OperatorStringValidator();

    private static SweepDriver driverFor(IsingModel model, MagnetizationObservable observable,
            int maxInsertionAttempts) {
        return new SweepDriver(model, new InsertionProbabilityTable(model), observable,
                maxInsertionAttempts);
    }

    private static IsingModel squareLattice(int side, double coupling, double field) {
        SquareLattice2D lattice =
                new SquareLattice2D(side, side, SseProperties.Lattice.Boundary.PERIODIC);
        return new SquareLatticeIsingModelFactory(lattice, coupling, field).create(45.0);
    }

    private static IsingModel randomCouplings(int n, RandomGenerator random) {
        DMatrixRMaj j = new DMatrixRMaj(n, n);
        double[] h = new double[n];
        for (int i = 0; i < n; i++) {
            h[i] = 0.2 + random.nextDouble();
            for (int k = i + 1; k < n; k++) {
                // 一部の組は結合 0 のまま残す
                double v = (random.nextDouble() < 0.25) ? 0.0 : 2.0 * random.nextDouble() - 1.0;
                j.set(i, k, v);
                j.set(k, i, v);
            }
        }
        return new IsingModel(j, h);
    }

    private void assertValidAfterEverySweep(IsingModel model, int halfLength, int sweeps,
            long seed) {
        RandomGenerator random = new MersenneTwister(seed);
        SweepDriver driver = driverFor(model, new UniformMagnetization(model.siteCount()), 1000);
        ProjectorState state = ProjectorState.random(model.siteCount(), halfLength, random);

        for (int k = 0; k < sweeps; k++) {
            driver.sweep(state, random);
            validator.validate(model, state.getOperators(), state.getBoundary());
        }
    }

    @Test
    void antiferromagnetStaysConsistent() {
        assertValidAfterEverySweep(squareLattice(3, 1.0, 1.0), 40, 300, 1L);
    }

    @Test
    void ferromagnetStaysConsistent() {
        assertValidAfterEverySweep(squareLattice(3, -1.0, 0.7), 40, 300, 2L);
    }

    @Test
    void mixedSignCouplingsStayConsistent() {
        RandomGenerator random = new MersenneTwister(3L);
        for (int trial = 0; trial < 5; trial++) {
            assertValidAfterEverySweep(randomCouplings(6, random), 30, 200, 100L + trial);
        }
    }

    @Test
    void operatorCountsAddUpToTheStringLength() {
        IsingModel model = squareLattice(2, 1.0, 1.0);
        RandomGenerator random = new MersenneTwister(4L);
        SweepDriver driver = driverFor(model, new StaggeredMagnetization(4), 1000);
        ProjectorState state = ProjectorState.random(4, 25, random);

        for (int k = 0; k < 100; k++) {
            SweepResult r = driver.sweep(state, random);
            assertEquals(50, r.getDiagonalFieldCount() + r.getOffDiagonalFieldCount()
                    + r.getBondCount());
        }
    }

    @Test
    void boundaryChangesMatchTheCountedBoundaryFlips() {
        IsingModel model = squareLattice(2, 1.0, 1.0);
        RandomGenerator random = new MersenneTwister(5L);
        SweepDriver driver = driverFor(model, new StaggeredMagnetization(4), 1000);
        ProjectorState state = ProjectorState.random(4, 20, random);

        for (int k = 0; k < 200; k++) {
            boolean[] before = state.getBoundary().clone();
            SweepResult r = driver.sweep(state, random);

            int changed = 0;
            for (int s = 0; s < before.length; s++) {
                if (before[s] != state.getBoundary()[s]) {
                    changed++;
                }
            }
            assertEquals(r.getClusterStatistics().getBoundaryFlipCount(), changed);
        }
    }

    @Test
    void magnetizationIsMeasuredOnTheMidpointConfiguration() {
        IsingModel model = squareLattice(2, 1.0, 1.0);
        RandomGenerator random = new MersenneTwister(6L);
        StaggeredMagnetization observable = new StaggeredMagnetization(4);
        SweepDriver driver = driverFor(model, observable, 1000);
        ProjectorState state = ProjectorState.random(4, 10, random);

        for (int k = 0; k < 50; k++) {
            SweepResult r = driver.sweep(state, random);
            boolean[] mid = state.getOperators().midpointConfiguration(state.getBoundary());
            assertArrayEquals(mid, r.getMidConfiguration());
            assertEquals(observable.measure(mid), r.getMagnetization(), 0.0);
        }
    }

    @Test
    void decoupledSitesProduceNoBondsAndNoRejections() {
        IsingModel model = IsingModel.withUniformField(new DMatrixRMaj(4, 4), 1.0);
        RandomGenerator random = new MersenneTwister(7L);
        SweepDriver driver = driverFor(model, new StaggeredMagnetization(4), 1000);
        ProjectorState state = ProjectorState.random(4, 20, random);

        for (int k = 0; k < 100; k++) {
            SweepResult r = driver.sweep(state, random);
            assertEquals(0, r.getBondCount());
            assertEquals(0L, r.getRejectedInsertionCount());
            assertEquals(0, state.getOperators().count(OperatorType.BOND));
        }
    }

    @Test
    void zeroFieldAntiferromagneticPairHoldsOnlyBondsOnAntiAlignedSpins() {
        DMatrixRMaj j = new DMatrixRMaj(2, 2);
        j.set(0, 1, 1.0);
        j.set(1, 0, 1.0);
        IsingModel model = IsingModel.withUniformField(j, 0.0);
        RandomGenerator random = new MersenneTwister(8L);
        SweepDriver driver = driverFor(model, new UniformMagnetization(2), 1000);
        ProjectorState state = new ProjectorState(new boolean[] {true, false},
                new OperatorString(5, 2));

        for (int k = 0; k < 20; k++) {
            SweepResult r = driver.sweep(state, random);
            assertEquals(10, r.getBondCount());
            assertEquals(0, r.getDiagonalFieldCount());
            assertEquals(0, r.getOffDiagonalFieldCount());
            assertEquals(0, r.getClusterStatistics().getClusterCount());
            assertArrayEquals(new boolean[] {true, false}, state.getBoundary());
            assertTrue(validator.findViolations(model, state.getOperators(), state.getBoundary())
                    .isEmpty());
        }
    }

    @Test
    void zeroFieldAntiferromagneticPairOnAlignedSpinsExhaustsSampling() {
        DMatrixRMaj j = new DMatrixRMaj(2, 2);
        j.set(0, 1, 1.0);
        j.set(1, 0, 1.0);
        IsingModel model = IsingModel.withUniformField(j, 0.0);
        RandomGenerator random = new MersenneTwister(9L);
        SweepDriver driver = driverFor(model, new UniformMagnetization(2), 100);
        ProjectorState state = new ProjectorState(new boolean[] {true, true},
                new OperatorString(2, 2));

        ExhaustedSamplingException e =
                assertThrows(ExhaustedSamplingException.class, () -> driver.sweep(state, random));

        assertEquals(0, e.getSlot());
        assertEquals(100, e.getAttempts());
    }

    @Test
    void stringShorterThanTheSystemStillUpdates() {
        IsingModel model = squareLattice(3, 1.0, 1.0);
        RandomGenerator random = new MersenneTwister(10L);
        SweepDriver driver = driverFor(model, new StaggeredMagnetization(9), 1000);
        ProjectorState state = ProjectorState.random(9, 2, random);

        for (int k = 0; k < 100; k++) {
            SweepResult r = driver.sweep(state, random);
            assertEquals(4, r.getDiagonalFieldCount() + r.getOffDiagonalFieldCount()
                    + r.getBondCount());
            validator.validate(model, state.getOperators(), state.getBoundary());
        }
    }

    @Test
    void stateWithWrongSiteCountIsRejected() {
        IsingModel model = squareLattice(2, 1.0, 1.0);
        SweepDriver driver = driverFor(model, new StaggeredMagnetization(4), 1000);
        ProjectorState state = new ProjectorState(new boolean[3], new OperatorString(2, 3));

        assertThrows(IllegalArgumentException.class,
                () -> driver.sweep(state, new MersenneTwister(11L)));
    }
}
