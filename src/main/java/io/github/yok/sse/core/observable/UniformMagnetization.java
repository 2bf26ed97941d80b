package io.github.yok.sse.core.observable;

/**
 * 一様磁化 {@code m = (1/N) Σ σ_i} です。
 */
public final class UniformMagnetization implements MagnetizationObservable {

    private final int siteCount;

    /**
     * 一様磁化を生成します。
     *
     * @param siteCount サイト数です（1 以上）
     */
    public UniformMagnetization(int siteCount) {
        if (siteCount <= 0) {
            throw new IllegalArgumentException("サイト数は 1 以上が必要です: " + siteCount);
        }
        this.siteCount = siteCount;
    }

    @Override
    public int siteCount() {
        return siteCount;
    }

    @Override
    public double measure(boolean[] configuration) {
        if (configuration == null || configuration.length != siteCount) {
            throw new IllegalArgumentException("スピン配置の長さがサイト数と一致しません");
        }
        int sum = 0;
        for (boolean up : configuration) {
            sum += up ? 1 : -1;
        }
        return sum / (double) siteCount;
    }
}
