package io.github.yok.sse.app;

import io.github.yok.sse.core.exact.ExactGroundStateReference;
import io.github.yok.sse.core.lattice.SquareLattice2D;
import io.github.yok.sse.core.linearalgebra.EjmlGroundStateBackend;
import io.github.yok.sse.core.linearalgebra.GroundStateBackend;
import io.github.yok.sse.core.model.SquareLatticeIsingModelFactory;
import io.github.yok.sse.core.observable.MagnetizationObservable;
import io.github.yok.sse.core.observable.StaggeredMagnetization;
import io.github.yok.sse.core.observable.UniformMagnetization;
import io.github.yok.sse.core.solver.EnsembleSimulation;
import io.github.yok.sse.out.CsvResultWriter;
import io.github.yok.sse.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 正方格子上の横磁場イジング模型 + 射影 SSE 計算の Bean 定義を行う設定クラスです。
 *
 * <p>
 * SquareLattice2D と SquareLatticeIsingModelFactory を用いて、アンサンブル計算一式を組み立てます。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class SquareLatticeTfimConfiguration {

    /**
     * sse-solver の設定値（sse.*）です。
     */
    private final SseProperties p;

    /**
     * 格子を生成します。
     *
     * @return 格子です
     */
    @Bean
    public SquareLattice2D lattice() {
        return new SquareLattice2D(p.getLattice().getLx(), p.getLattice().getLy(),
                p.getLattice().getBoundary());
    }

    /**
     * 異方性角から模型を生成するファクトリを生成します。
     *
     * @param lattice 格子です
     * @return 模型ファクトリです
     */
    @Bean
    public SquareLatticeIsingModelFactory isingModelFactory(SquareLattice2D lattice) {
        return new SquareLatticeIsingModelFactory(lattice, p.getModel().getCoupling(),
                p.getModel().getField());
    }

    /**
     * 観測する磁化を生成します。
     *
     * <p>
     * スタッガード磁化は一辺 √N の正方格子を仮定するため、lx と ly が等しい必要があります。
     * </p>
     *
     * @param lattice 格子です
     * @return 磁化の定義です
     * @throws IllegalStateException STAGGERED で lx と ly が異なる場合に発生します
     */
    @Bean
    public MagnetizationObservable magnetizationObservable(SquareLattice2D lattice) {
        if (p.getSimulation().getObservable() == SseProperties.Simulation.Observable.UNIFORM) {
            return new UniformMagnetization(lattice.siteCount());
        }
        if (lattice.lx() != lattice.ly()) {
            throw new IllegalStateException(
                    "simulation.observable=STAGGERED には lx == ly が必要です（UNIFORM を指定してください）: "
                            + lattice.lx() + "x" + lattice.ly());
        }
        return new StaggeredMagnetization(lattice.siteCount());
    }

    /**
     * アンサンブル計算を生成します。
     *
     * @return アンサンブル計算です
     */
    @Bean
    public EnsembleSimulation ensembleSimulation() {
        return new EnsembleSimulation(p.getSimulation());
    }

    /**
     * 最低固有対を求めるバックエンドを生成します。
     *
     * @return 固有分解バックエンドです
     */
    @Bean
    public GroundStateBackend groundStateBackend() {
        return new EjmlGroundStateBackend();
    }

    /**
     * 厳密対角化の参照計算を生成します。
     *
     * @param backend 固有分解バックエンドです
     * @return 参照計算です
     */
    @Bean
    public ExactGroundStateReference exactGroundStateReference(GroundStateBackend backend) {
        return new ExactGroundStateReference(backend);
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir(), p.getLattice().getLx(),
                p.getLattice().getLy(), p.getModel().getCoupling(), p.getModel().getField());
    }
}
