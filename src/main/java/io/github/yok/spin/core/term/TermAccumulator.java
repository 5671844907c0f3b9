package io.github.yok.spin.core.term;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.github.yok.spin.core.math.Complex;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 項ごとに係数を足し込むための可変バッファです。
 *
 * <p>
 * 同じ項が再度追加された場合は係数を加算し、最初に現れた位置（挿入順）を保ちます。 係数が 0 になっても項は削除しません（削除は正規化の責務です）。
 * </p>
 */
public final class TermAccumulator {

    /**
     * 項から係数への写像（挿入順）です。
     */
    private final Map<Term, Complex> coefficients;

    /**
     * 空のバッファを生成します。
     */
    public TermAccumulator() {
        this.coefficients = new LinkedHashMap<>();
    }

    /**
     * 想定サイズを指定して空のバッファを生成します。
     *
     * @param expectedSize 想定する項数です
     */
    public TermAccumulator(int expectedSize) {
        this.coefficients = new LinkedHashMap<>(Math.max(16, expectedSize * 4 / 3 + 1));
    }

    /**
     * 項と係数を足し込みます。
     *
     * @param term 項です（null 不可）
     * @param coefficient 係数です（null 不可）
     * @return このバッファです
     */
    public TermAccumulator add(Term term, Complex coefficient) {
        Preconditions.checkNotNull(term, "term は null 不可です");
        Preconditions.checkNotNull(coefficient, "coefficient は null 不可です");
        coefficients.merge(term, coefficient, Complex::plus);
        return this;
    }

    /**
     * 写像の全項を足し込みます。
     *
     * @param terms 項から係数への写像です
     * @return このバッファです
     */
    public TermAccumulator addAll(Map<Term, Complex> terms) {
        terms.forEach(this::add);
        return this;
    }

    /**
     * 現在の項数を返します。
     *
     * @return 項数です
     */
    public int size() {
        return coefficients.size();
    }

    /**
     * 挿入順を保った不変の写像を返します。
     *
     * @return 項から係数への不変写像です
     */
    public ImmutableMap<Term, Complex> build() {
        return ImmutableMap.copyOf(coefficients);
    }
}
