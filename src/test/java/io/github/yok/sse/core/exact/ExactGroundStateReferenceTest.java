package io.github.yok.sse.core.exact;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.sse.app.SseProperties;
import io.github.yok.sse.core.exact.ExactGroundStateReference.ExactResult;
import io.github.yok.sse.core.lattice.SquareLattice2D;
import io.github.yok.sse.core.linearalgebra.EjmlGroundStateBackend;
import io.github.yok.sse.core.model.IsingModel;
import io.github.yok.sse.core.model.SquareLatticeIsingModelFactory;
import io.github.yok.sse.core.observable.StaggeredMagnetization;
import io.github.yok.sse.core.observable.UniformMagnetization;
import io.github.yok.sse.core.solver.EnsembleSimulation;
import io.github.yok.sse.core.solver.EnsembleSimulation.EnsembleResult;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

/**
 * {@link ExactGroundStateReference} のテストです。
 */
class ExactGroundStateReferenceTest {

    private final ExactGroundStateReference reference =
            new ExactGroundStateReference(new EjmlGroundStateBackend());

    /**
     * 2x2 開放端の正方格子で、縦横の結合を同じ値にした h=1 の模型です。
     */
    private static IsingModel plaquette(double coupling) {
        DMatrixRMaj j = new DMatrixRMaj(4, 4);
        int[][] bonds = {{0, 1}, {2, 3}, {0, 2}, {1, 3}};
        for (int[] b : bonds) {
            j.set(b[0], b[1], coupling);
            j.set(b[1], b[0], coupling);
        }
        return IsingModel.withUniformField(j, 1.0);
    }

    @Test
    void decoupledSpinsMatchTheProductState() {
        IsingModel model = IsingModel.withUniformField(new DMatrixRMaj(4, 4), 1.0);

        ExactResult exact = reference.compute(model, new StaggeredMagnetization(4));

        assertEquals(4, exact.getSiteCount());
        assertEquals(-4.0, exact.getGroundStateEnergy(), 1e-9);
        assertEquals(2.0, exact.getGap(), 1e-9);
        assertEquals(0.25, exact.getMeanSquare(), 1e-9);
        assertEquals(0.15625, exact.getMeanFourth(), 1e-9);
        assertEquals(1.0 / 6.0, exact.getBinderCumulant(), 1e-9);
    }

    @Test
    void hamiltonianUsesDoubledIsingCouplingAndNegativeField() {
        DMatrixRMaj j = new DMatrixRMaj(2, 2);
        j.set(0, 1, 0.5);
        j.set(1, 0, 0.5);
        IsingModel model = new IsingModel(j, new double[] {0.3, 0.7});

        DMatrixRMaj h = ExactGroundStateReference.hamiltonian(model);

        // 基底 b: ビット s が 1 ならサイト s が上向き
        assertEquals(1.0, h.get(0, 0));
        assertEquals(-1.0, h.get(1, 1));
        assertEquals(-1.0, h.get(2, 2));
        assertEquals(1.0, h.get(3, 3));
        assertEquals(-0.3, h.get(0, 1));
        assertEquals(-0.7, h.get(0, 2));
        assertEquals(-0.7, h.get(1, 3));
        assertEquals(0.0, h.get(0, 3));
        assertEquals(h.get(2, 0), h.get(0, 2));
    }

    @Test
    void antiferromagnetAndFerromagnetAreRelatedBySublatticeRotation() {
        ExactResult af = reference.compute(plaquette(0.25), new StaggeredMagnetization(4));
        ExactResult fm = reference.compute(plaquette(-0.25), new UniformMagnetization(4));

        assertEquals(af.getGroundStateEnergy(), fm.getGroundStateEnergy(), 1e-9);
        assertEquals(af.getMeanSquare(), fm.getMeanSquare(), 1e-9);
        assertEquals(0.44278, af.getMeanSquare(), 1e-4);
    }

    @Test
    void quantumMonteCarloAgreesWithExactDiagonalization() {
        SquareLattice2D lattice = new SquareLattice2D(2, 2, SseProperties.Lattice.Boundary.OPEN);
        // 45 度で Jx = Jy = 0.25 になるよう J を選びます
        IsingModel model = new SquareLatticeIsingModelFactory(lattice, 0.25 * Math.sqrt(2.0), 1.0)
                .create(45.0);
        StaggeredMagnetization observable = new StaggeredMagnetization(4);

        SseProperties.Simulation s = new SseProperties.Simulation();
        s.setHalfLength(50);
        s.setDelay(500);
        s.setSweeps(10_000);
        s.setRepetitions(2);
        s.setSeed(77L);

        EnsembleResult qmc = new EnsembleSimulation(s).run(model, observable);
        ExactResult exact = reference.compute(model, observable);

        assertEquals(exact.getMeanSquare(), qmc.getMeanSquareMean(), 0.03);
        assertEquals(exact.getBinderCumulant(), qmc.getBinderMean(), 0.05);
    }

    @Test
    void tooManySitesAreRejected() {
        int n = ExactGroundStateReference.MAX_SITES + 1;
        IsingModel model = IsingModel.withUniformField(new DMatrixRMaj(n, n), 1.0);

        assertThrows(IllegalArgumentException.class,
                () -> reference.compute(model, new UniformMagnetization(n)));
    }

    @Test
    void observableSizeMustMatch() {
        IsingModel model = IsingModel.withUniformField(new DMatrixRMaj(4, 4), 1.0);

        assertThrows(IllegalArgumentException.class,
                () -> reference.compute(model, new UniformMagnetization(9)));
    }
}
