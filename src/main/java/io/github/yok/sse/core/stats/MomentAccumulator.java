package io.github.yok.sse.core.stats;

/**
 * 磁化の 2 次・4 次モーメントを逐次集計するクラスです。
 *
 * <p>
 * Binder キュムラントは {@code U = 1 - <m^4> / (3 <m^2>^2)} です。
 * </p>
 */
public final class MomentAccumulator {

    private long samples;
    private double sumSquare;
    private double sumFourth;

    /**
     * 磁化 1 サンプルを追加します。
     *
     * @param magnetization 磁化です
     */
    public void add(double magnetization) {
        double m2 = magnetization * magnetization;
        sumSquare += m2;
        sumFourth += m2 * m2;
        samples++;
    }

    /**
     * サンプル数を返します。
     *
     * @return サンプル数です
     */
    public long samples() {
        return samples;
    }

    /**
     * {@code <m^2>} を返します（サンプルがなければ NaN）。
     *
     * @return 2 次モーメントです
     */
    public double meanSquare() {
        return (samples == 0) ? Double.NaN : sumSquare / samples;
    }

    /**
     * {@code <m^4>} を返します（サンプルがなければ NaN）。
     *
     * @return 4 次モーメントです
     */
    public double meanFourth() {
        return (samples == 0) ? Double.NaN : sumFourth / samples;
    }

    /**
     * Binder キュムラントを返します。
     *
     * @return Binder キュムラントです
     */
    public double binderCumulant() {
        return binderCumulant(meanSquare(), meanFourth());
    }

    /**
     * モーメントから Binder キュムラントを計算します。
     *
     * <p>
     * {@code <m^2> = 0}（全サンプルで磁化 0）の場合は NaN を返します。
     * </p>
     *
     * @param meanSquare {@code <m^2>} です
     * @param meanFourth {@code <m^4>} です
     * @return Binder キュムラントです
     */
    public static double binderCumulant(double meanSquare, double meanFourth) {
        if (!(meanSquare > 0.0)) {
            return Double.NaN;
        }
        return 1.0 - meanFourth / (3.0 * meanSquare * meanSquare);
    }
}
