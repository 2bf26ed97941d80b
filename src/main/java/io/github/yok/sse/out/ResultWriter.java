package io.github.yok.sse.out;

import io.github.yok.sse.core.exact.ExactGroundStateReference.ExactResult;
import io.github.yok.sse.core.solver.EnsembleSimulation.EnsembleResult;

/**
 * 計算結果を出力する処理のインタフェースです。
 *
 * <p>
 * 異方性角 θ をスキャンして計算することを前提とし、出力の命名規約に必要な {@code θ} を受け取ります。
 * </p>
 */
public interface ResultWriter {

    /**
     * アンサンブルの集計結果を出力します。
     *
     * @param anisotropyAngle 異方性角 θ（度）です
     * @param ensemble アンサンブルの集計結果です
     * @param exact 厳密対角化の参照値です（計算しなかった場合は null）
     */
    void write(double anisotropyAngle, EnsembleResult ensemble, ExactResult exact);
}
