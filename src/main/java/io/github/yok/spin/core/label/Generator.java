package io.github.yok.spin.core.label;

/**
 * 1 サイトに作用するスピン演算子の生成子（X, Y, Z）です。
 *
 * <p>
 * 同一サイト上の生成子同士は非可換です。
 * </p>
 */
public enum Generator {

    /**
     * S_x です。
     */
    X,

    /**
     * S_y です。
     */
    Y,

    /**
     * S_z です。
     */
    Z;

    /**
     * ラベル中の 1 文字から生成子を返します。
     *
     * @param symbol ラベル中の文字です
     * @return 生成子です
     * @throws MalformedLabelException X/Y/Z 以外の文字の場合に発生します
     */
    public static Generator fromSymbol(char symbol) {
        switch (symbol) {
            case 'X':
                return X;
            case 'Y':
                return Y;
            case 'Z':
                return Z;
            default:
                throw new MalformedLabelException("未知の生成子です: " + symbol);
        }
    }

    /**
     * ラベル表記の 1 文字を返します。
     *
     * @return ラベル表記の文字です
     */
    public char symbol() {
        return name().charAt(0);
    }
}
