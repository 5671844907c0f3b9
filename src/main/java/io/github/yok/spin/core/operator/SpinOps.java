package io.github.yok.spin.core.operator;

/**
 * 交換子・反交換子などの演算子ユーティリティです。
 *
 * <p>
 * 結果は正規化しません。必要に応じて呼び出し側で {@code indexOrder().simplify()} を適用してください。
 * </p>
 */
public final class SpinOps {

    private SpinOps() {}

    /**
     * 交換子 {@code [a, b] = ab - ba} を返します。
     *
     * @param a 左側の演算子です
     * @param b 右側の演算子です
     * @return 交換子です
     * @throws DimensionMismatchException レジスタが一致しない場合に発生します
     */
    public static SpinOp commutator(SpinOp a, SpinOp b) {
        return a.compose(b).subtract(b.compose(a));
    }

    /**
     * 反交換子 {@code {a, b} = ab + ba} を返します。
     *
     * @param a 左側の演算子です
     * @param b 右側の演算子です
     * @return 反交換子です
     * @throws DimensionMismatchException レジスタが一致しない場合に発生します
     */
    public static SpinOp anticommutator(SpinOp a, SpinOp b) {
        return a.compose(b).add(b.compose(a));
    }

    /**
     * 対称化した二重交換子を返します。
     *
     * <ul>
     * <li>sign=false: {@code ([[a, b], c] + [a, [b, c]]) / 2}</li>
     * <li>sign=true: {@code ({[a, b], c} + {a, [b, c]}) / 2}</li>
     * </ul>
     *
     * @param a 演算子 a です
     * @param b 演算子 b です
     * @param c 演算子 c です
     * @param sign true の場合は外側を反交換子にします
     * @return 二重交換子です
     * @throws DimensionMismatchException レジスタが一致しない場合に発生します
     */
    public static SpinOp doubleCommutator(SpinOp a, SpinOp b, SpinOp c, boolean sign) {
        SpinOp ab = commutator(a, b);
        SpinOp bc = commutator(b, c);
        SpinOp sum = sign ? anticommutator(ab, c).add(anticommutator(a, bc))
                : commutator(ab, c).add(commutator(a, bc));
        return sum.scale(0.5);
    }
}
