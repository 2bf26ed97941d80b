package io.github.yok.sse.app;

import io.github.yok.sse.core.exact.ExactGroundStateReference;
import io.github.yok.sse.core.exact.ExactGroundStateReference.ExactResult;
import io.github.yok.sse.core.model.IsingModel;
import io.github.yok.sse.core.model.SquareLatticeIsingModelFactory;
import io.github.yok.sse.core.observable.MagnetizationObservable;
import io.github.yok.sse.core.solver.EnsembleSimulation;
import io.github.yok.sse.core.solver.EnsembleSimulation.EnsembleResult;
import io.github.yok.sse.out.ResultWriter;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で sse-solver を実行するクラスです。
 *
 * <p>
 * 異方性角 θ をスキャンし、各 θ について射影 SSE のアンサンブル計算を行って Binder キュムラントを求めます。 系が小さい場合は厳密対角化の参照値も併せて出力します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SseCliRunner implements CommandLineRunner {

    /**
     * sse-solver の設定値（sse.*）です。
     */
    private final SseProperties properties;

    /**
     * 異方性角から模型を生成するファクトリです。
     */
    private final SquareLatticeIsingModelFactory modelFactory;

    /**
     * 観測する磁化です。
     */
    private final MagnetizationObservable observable;

    /**
     * アンサンブル計算です。
     */
    private final EnsembleSimulation ensembleSimulation;

    /**
     * 厳密対角化の参照計算です。
     */
    private final ExactGroundStateReference exactReference;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== sse-solver start: projector SSE for transverse-field Ising ===");
        System.out.print(properties.toMultilineString());

        // θ の一覧（異方性角）
        List<Double> angles = properties.getModel().getAnisotropyAngleScan().getValues();
        if (angles == null || angles.isEmpty()) {
            throw new IllegalStateException(
                    "anisotropyAngleScan.values は必須です（θ の一覧を指定してください）");
        }

        SseProperties.ExactReference ed = properties.getExactReference();

        for (int i = 0; i < angles.size(); i++) {
            Double thetaObj = angles.get(i);
            if (thetaObj == null) {
                throw new IllegalStateException("anisotropyAngleScan.values に null が含まれています");
            }
            double theta = thetaObj.doubleValue();

            System.out.println("=== 異方性角ごとの計算 ===");
            System.out.println("入力: θ=" + fmt5(theta) + "度（step=" + (i + 1) + "/" + angles.size()
                    + "）");

            IsingModel model = modelFactory.create(theta);
            EnsembleResult ensemble = ensembleSimulation.run(model, observable);

            ExactResult exact = null;
            if (ed.isEnabled() && model.siteCount() <= ed.getMaxSites()) {
                exact = exactReference.compute(model, observable);
                log.info("厳密対角化の参照値：E0={}、<m^2>={}、Binder={}", fmt5(exact.getGroundStateEnergy()),
                        fmt5(exact.getMeanSquare()), fmt5(exact.getBinderCumulant()));
            } else if (ed.isEnabled()) {
                log.info("N={} が exactReference.maxSites={} を超えるため、厳密対角化を省略します", model.siteCount(),
                        ed.getMaxSites());
            }

            resultWriter.write(theta, ensemble, exact);

            System.out.println("結果: Binder=" + fmt5(ensemble.getBinderMean()) + " ± "
                    + fmt5(ensemble.getBinderStandardError()) + ", <m^2>="
                    + fmt5(ensemble.getMeanSquareMean()) + " ± "
                    + fmt5(ensemble.getMeanSquareStandardError()));
            if (exact != null) {
                System.out.println("参照: Binder=" + fmt5(exact.getBinderCumulant()) + ", <m^2>="
                        + fmt5(exact.getMeanSquare()) + ", E0=" + fmt5(exact.getGroundStateEnergy()));
            }
        }
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
