package io.github.yok.sse.core.sweep;

import lombok.Getter;

/**
 * 演算子挿入の棄却サンプリングが試行回数上限に達したことを表す例外です。
 *
 * <p>
 * 横磁場が 0 で、どのボンドも符号規則を満たさないスピン配置のときに起こります。
 * </p>
 */
@Getter
public final class ExhaustedSamplingException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 挿入に失敗したスロットです。
     */
    private final int slot;

    /**
     * 試行回数です。
     */
    private final int attempts;

    /**
     * 例外を生成します。
     *
     * @param slot スロットです
     * @param attempts 試行回数です
     */
    public ExhaustedSamplingException(int slot, int attempts) {
        super("演算子挿入が " + attempts + " 回の試行で受理されませんでした: slot=" + slot
                + "（横磁場が 0 で、どのボンドも符号規則を満たさない配置の可能性があります）");
        this.slot = slot;
        this.attempts = attempts;
    }
}
