package io.github.yok.sse.core.sweep;

import io.github.yok.sse.core.cluster.ClusterStatistics;
import lombok.Value;

/**
 * 1 スイープの出力です。
 */
@Value
public class SweepResult {

    /**
     * 虚時間中央の配置で測った磁化です。
     */
    double magnetization;

    /**
     * 虚時間中央のスピン配置です（コピー）。
     */
    boolean[] midConfiguration;

    /**
     * 局所更新で数えた対角の横磁場演算子の数です。
     */
    int diagonalFieldCount;

    /**
     * 局所更新で数えた非対角の横磁場演算子の数です。
     */
    int offDiagonalFieldCount;

    /**
     * 局所更新で数えたボンド演算子の数です。
     */
    int bondCount;

    /**
     * 棄却された挿入候補の数です。
     */
    long rejectedInsertionCount;

    /**
     * クラスタ更新の集計です。
     */
    ClusterStatistics clusterStatistics;
}
