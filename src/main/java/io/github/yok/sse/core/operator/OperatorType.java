package io.github.yok.sse.core.operator;

/**
 * 演算子スロットの種類です。
 */
public enum OperatorType {

    /**
     * 対角の横磁場演算子（恒等作用、重み h_s）です。
     */
    DIAGONAL_FIELD,

    /**
     * 非対角の横磁場演算子（伝播時にサイト s のスピンを反転）です。
     */
    OFF_DIAGONAL_FIELD,

    /**
     * 対角のボンド演算子（恒等作用、重み 2|J_ij|）です。
     */
    BOND;

    /**
     * 横磁場演算子（対角・非対角のいずれか）かどうかを返します。
     *
     * @return 横磁場演算子の場合は true です
     */
    public boolean isField() {
        return this != BOND;
    }

    /**
     * 横磁場演算子の対角・非対角を入れ替えた種類を返します。
     *
     * @return 入れ替えた種類です
     * @throws IllegalStateException ボンド演算子に対して呼んだ場合に発生します
     */
    public OperatorType toggled() {
        switch (this) {
            case DIAGONAL_FIELD:
                return OFF_DIAGONAL_FIELD;
            case OFF_DIAGONAL_FIELD:
                return DIAGONAL_FIELD;
            default:
                throw new IllegalStateException("ボンド演算子は対角・非対角を入れ替えられません");
        }
    }
}
