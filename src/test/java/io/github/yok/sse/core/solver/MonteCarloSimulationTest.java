package io.github.yok.sse.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.sse.core.model.IsingModel;
import io.github.yok.sse.core.observable.UniformMagnetization;
import io.github.yok.sse.core.operator.OperatorString;
import io.github.yok.sse.core.sampling.InsertionProbabilityTable;
import io.github.yok.sse.core.solver.MonteCarloSimulation.MemberResult;
import io.github.yok.sse.core.sweep.ProjectorState;
import io.github.yok.sse.core.sweep.SweepDriver;
import org.apache.commons.math3.random.MersenneTwister;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

/**
 * {@link MonteCarloSimulation} のテストです。
 */
class MonteCarloSimulationTest {

    private static SweepDriver antiferromagneticPair(double field) {
        DMatrixRMaj j = new DMatrixRMaj(2, 2);
        j.set(0, 1, 1.0);
        j.set(1, 0, 1.0);
        IsingModel model = IsingModel.withUniformField(j, field);
        return new SweepDriver(model, new InsertionProbabilityTable(model),
                new UniformMagnetization(2), 1000);
    }

    @Test
    void onlyMeasurementSweepsAreAccumulated() {
        MonteCarloSimulation simulation =
                new MonteCarloSimulation(antiferromagneticPair(1.0), 10, 150, 50, true);

        MemberResult result = simulation.run(new MersenneTwister(1L));

        assertEquals(150L, result.getSamples());
        assertEquals(20.0, result.getMeanDiagonalFieldCount() + result.getMeanOffDiagonalFieldCount()
                + result.getMeanBondCount(), 1e-9);
    }

    @Test
    void zeroFieldPairStaysInItsAntiAlignedSector() {
        MonteCarloSimulation simulation =
                new MonteCarloSimulation(antiferromagneticPair(0.0), 4, 100, 0, true);
        ProjectorState state =
                new ProjectorState(new boolean[] {false, true}, new OperatorString(4, 2));

        MemberResult result = simulation.run(state, new MersenneTwister(2L));

        // 一様磁化は常に 0 なので Binder キュムラントは定義されない
        assertEquals(0.0, result.getMeanSquare());
        assertEquals(8.0, result.getMeanBondCount());
        assertTrue(Double.isNaN(result.getBinderCumulant()));
    }

    @Test
    void invalidArgumentsAreRejected() {
        SweepDriver driver = antiferromagneticPair(1.0);

        assertThrows(IllegalArgumentException.class,
                () -> new MonteCarloSimulation(null, 10, 10, 0, false));
        assertThrows(IllegalArgumentException.class,
                () -> new MonteCarloSimulation(driver, 0, 10, 0, false));
        assertThrows(IllegalArgumentException.class,
                () -> new MonteCarloSimulation(driver, 10, 0, 0, false));
        assertThrows(IllegalArgumentException.class,
                () -> new MonteCarloSimulation(driver, 10, 10, -1, false));
    }
}
