package io.github.yok.sse.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 実対称行列の最低固有対（基底状態）を求めるバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリや疎行列向けの手法を差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface GroundStateBackend {

    /**
     * 実対称行列の最低固有値と、その規格化された固有ベクトルを返します。
     *
     * @param symmetricMatrix 実対称行列です
     * @return 基底状態です
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    GroundState lowest(DMatrixRMaj symmetricMatrix);

    /**
     * 最低固有対を保持するクラスです。
     */
    @Value
    class GroundState {

        /**
         * 最低固有値（基底エネルギー）です。
         */
        double energy;

        /**
         * 2 番目に低い固有値との差です（1 次元の場合は +∞）。
         */
        double gap;

        /**
         * 規格化された固有ベクトルです。
         */
        double[] vector;
    }
}
