package io.github.yok.sse.core.cluster;

import lombok.Value;

/**
 * 1 回のクラスタ更新の集計です。
 */
@Value
public class ClusterStatistics {

    /**
     * 識別したクラスタ数です。
     */
    int clusterCount;

    /**
     * 反転したクラスタ数です。
     */
    int flippedClusterCount;

    /**
     * 反転した境界状態のビット数です。
     */
    int boundaryFlipCount;
}
