package io.github.yok.spin.core.label;

/**
 * ラベル文字列が文法に合わない場合、またはサイトインデックス・指数が範囲外の場合に発生する例外です。
 */
public class MalformedLabelException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public MalformedLabelException(String message) {
        super(message);
    }

    /**
     * 原因付きで例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public MalformedLabelException(String message, Throwable cause) {
        super(message, cause);
    }
}
