package io.github.yok.spin.core.operator;

/**
 * サイトの置換が長さ numSites の全単射になっていない場合に発生する例外です。
 */
public class InvalidPermutationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public InvalidPermutationException(String message) {
        super(message);
    }
}
