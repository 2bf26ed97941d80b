package io.github.yok.sse.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * EJML を用いて、実対称行列の最低固有対を求めるクラスです。
 *
 * <p>
 * 全固有値を求めたうえで最小のものを選び、その固有ベクトルを 2 ノルム 1 に規格化して返します。
 * </p>
 */
public final class EjmlGroundStateBackend implements GroundStateBackend {

    /**
     * 実対称行列の最低固有値と、その規格化された固有ベクトルを返します。
     *
     * @param symmetricMatrix 実対称行列です
     * @return 基底状態です
     * @throws IllegalArgumentException symmetricMatrix が null または正方でない場合に発生します
     * @throws IllegalStateException 固有分解に失敗した場合に発生します
     */
    @Override
    public GroundState lowest(DMatrixRMaj symmetricMatrix) {
        if (symmetricMatrix == null) {
            throw new IllegalArgumentException("symmetricMatrix は null 不可です");
        }
        int dim = symmetricMatrix.numRows;
        if (dim == 0 || symmetricMatrix.numCols != dim) {
            throw new IllegalArgumentException(
                    "正方行列が必要です: " + symmetricMatrix.numRows + "x" + symmetricMatrix.numCols);
        }

        EigenDecomposition_F64<DMatrixRMaj> decomposition =
                DecompositionFactory_DDRM.eig(dim, true, true);

        // decompose は入力を書き換える場合があるためコピーを渡します。
        if (!decomposition.decompose(symmetricMatrix.copy())) {
            throw new IllegalStateException("固有分解に失敗しました（EJML）");
        }

        // 最小・2 番目の固有値を探します。
        int lowestIndex = -1;
        double lowest = Double.POSITIVE_INFINITY;
        double second = Double.POSITIVE_INFINITY;
        for (int k = 0; k < decomposition.getNumberOfEigenvalues(); k++) {
            double e = decomposition.getEigenvalue(k).getReal();
            if (e < lowest) {
                second = lowest;
                lowest = e;
                lowestIndex = k;
            } else if (e < second) {
                second = e;
            }
        }
        if (lowestIndex < 0) {
            throw new IllegalStateException("固有値が取得できません");
        }

        DMatrixRMaj vec = decomposition.getEigenVector(lowestIndex);
        if (vec == null) {
            throw new IllegalStateException("固有ベクトルが取得できません: index=" + lowestIndex);
        }

        double[] vector = new double[dim];
        double norm2 = 0.0;
        for (int row = 0; row < dim; row++) {
            vector[row] = vec.get(row, 0);
            norm2 += vector[row] * vector[row];
        }
        if (!(norm2 > 0.0)) {
            throw new IllegalStateException("固有ベクトルのノルムが 0 です");
        }
        double inv = 1.0 / Math.sqrt(norm2);
        for (int row = 0; row < dim; row++) {
            vector[row] *= inv;
        }

        return new GroundState(lowest, second - lowest, vector);
    }
}
