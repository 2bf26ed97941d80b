package io.github.yok.sse.core.sweep;

import io.github.yok.sse.core.operator.OperatorString;
import lombok.Getter;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * スイープをまたいで持ち越すモンテカルロ状態（境界状態と演算子列）を保持するクラスです。
 *
 * <p>
 * どちらもその場で書き換えられ、同時に 1 つのスイープだけが扱います。
 * </p>
 */
@Getter
public final class ProjectorState {

    /**
     * 左端（虚時間の境界）のスピン配置です（true が上向き）。
     */
    private final boolean[] boundary;

    /**
     * 演算子列です。
     */
    private final OperatorString operators;

    /**
     * 境界状態と演算子列を指定して状態を生成します。配列はそのまま保持します。
     *
     * @param boundary 境界状態です（長さ N）
     * @param operators 演算子列です
     */
    public ProjectorState(boolean[] boundary, OperatorString operators) {
        if (boundary == null || boundary.length == 0) {
            throw new IllegalArgumentException("boundary は 1 サイト以上が必要です");
        }
        if (operators == null) {
            throw new IllegalArgumentException("operators は null 不可です");
        }
        this.boundary = boundary;
        this.operators = operators;
    }

    /**
     * 境界状態をランダムに、演算子列を全て対角の横磁場演算子にした初期状態を生成します。
     *
     * @param siteCount サイト数 N です
     * @param halfLength 演算子列の半分の長さ m です
     * @param random 乱数源です
     * @return 初期状態です
     */
    public static ProjectorState random(int siteCount, int halfLength, RandomGenerator random) {
        boolean[] boundary = new boolean[siteCount];
        for (int s = 0; s < siteCount; s++) {
            boundary[s] = random.nextBoolean();
        }
        return new ProjectorState(boundary, new OperatorString(halfLength, siteCount));
    }

    /**
     * サイト数 N を返します。
     *
     * @return サイト数です
     */
    public int siteCount() {
        return boundary.length;
    }
}
