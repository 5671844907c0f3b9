package io.github.yok.spin.core.operator;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.spin.core.label.Factor;
import io.github.yok.spin.core.label.LabelCodec;
import io.github.yok.spin.core.math.Complex;
import io.github.yok.spin.core.term.Term;
import java.util.List;
import lombok.Value;

/**
 * {@link SpinOp#terms()} が返す（因子列, 係数）の組です。
 *
 * <p>
 * 外部の写像処理（量子ビット演算子への変換など）は、この組だけを受け渡しすれば演算子を再構成できます。
 * </p>
 *
 * <p>
 * 因子は指数を保持したまま渡されます（例: {@code X_1^2}、{@code X_0^0}）。 指数 k の因子は同じ (生成子, サイト) を k
 * 回並べた積を表します。 (生成子, サイト) の組の列だけを扱う写像処理は、{@link #expanded()} で展開した組を使用してください。
 * </p>
 */
@Value
public class SpinTerm {

    /**
     * 因子列です（各因子は指数を持ちます）。
     */
    ImmutableList<Factor> factors;

    /**
     * 係数です。
     */
    Complex coefficient;

    /**
     * 組を生成します。
     *
     * @param factors 因子列です（null 不可）
     * @param coefficient 係数です（null 不可）
     * @return 組です
     */
    public static SpinTerm of(List<Factor> factors, Complex coefficient) {
        Preconditions.checkNotNull(factors, "factors は null 不可です");
        Preconditions.checkNotNull(coefficient, "coefficient は null 不可です");
        return new SpinTerm(ImmutableList.copyOf(factors), coefficient);
    }

    /**
     * 指数をすべて 1 に展開した組を返します（指数 0 の因子は取り除きます）。
     *
     * @return 各因子の指数が 1 の組です
     * @throws io.github.yok.spin.core.label.MalformedLabelException 展開後の因子数が上限を超える場合に発生します
     */
    public SpinTerm expanded() {
        return new SpinTerm(Term.of(factors).expanded().factors(), coefficient);
    }

    /**
     * 因子列のラベル文字列を返します。
     *
     * @return ラベル文字列です
     */
    public String label() {
        return LabelCodec.serialize(factors);
    }
}
