package io.github.yok.spin.core.operator;

/**
 * サイト数またはスピン量子数が異なる演算子同士を演算しようとした場合に発生する例外です。
 */
public class DimensionMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public DimensionMismatchException(String message) {
        super(message);
    }
}
