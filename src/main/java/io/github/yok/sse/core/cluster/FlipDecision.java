package io.github.yok.sse.core.cluster;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * クラスタごとの反転判定（公平なコイン投げ）を供給するインタフェースです。
 */
@FunctionalInterface
public interface FlipDecision {

    /**
     * 次のクラスタを反転するかどうかを返します。
     *
     * @return 反転する場合は true です
     */
    boolean nextFlip();

    /**
     * 乱数源から公平なコイン投げを作ります。
     *
     * @param random 乱数源です
     * @return 反転判定です
     */
    static FlipDecision fairCoin(RandomGenerator random) {
        return random::nextBoolean;
    }

    /**
     * 常に同じ判定を返します（検証用）。
     *
     * @param flip 判定です
     * @return 反転判定です
     */
    static FlipDecision constant(boolean flip) {
        return () -> flip;
    }
}
