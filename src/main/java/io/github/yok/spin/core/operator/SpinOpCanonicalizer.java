package io.github.yok.spin.core.operator;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.github.yok.spin.core.math.Complex;
import io.github.yok.spin.core.term.Term;
import io.github.yok.spin.core.term.TermAccumulator;
import io.github.yok.spin.core.term.TermOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 演算子の正規化（simplify, indexOrder, permuteIndices, chop, sort）を行うクラスです。
 *
 * <p>
 * 正規形は {@code indexOrder()} の後に {@code simplify()} を適用したものです。 どちらも受け取った演算子は変更せず、新しい演算子を返します。
 * </p>
 */
final class SpinOpCanonicalizer {

    private SpinOpCanonicalizer() {}

    /**
     * 指数の展開、同一項の併合、ゼロ近傍係数の除去を行います。
     *
     * <ol>
     * <li>指数 k の因子を k 個の因子に展開します（指数 0 の因子は取り除きます）。</li>
     * <li>展開後に同一となった項の係数を合算します。</li>
     * <li>{@code |c| <= atol} の項を取り除きます。全項が消えた場合はゼロ演算子です。</li>
     * <li>係数 1 の恒等項だけが残った場合は単位演算子です。</li>
     * </ol>
     *
     * <p>
     * 同一サイト上の生成子の積（例: X_0 X_0）は、任意のスピンで成り立つ簡約規則が無いため簡約しません。
     * </p>
     *
     * @param op 対象の演算子です
     * @param tolerances 許容誤差です
     * @return 正規化した演算子です
     */
    static SpinOp simplify(SpinOp op, Tolerances tolerances) {
        Preconditions.checkNotNull(tolerances, "tolerances は null 不可です");

        TermAccumulator merged = new TermAccumulator(op.size());
        op.termMap().forEach((term, coefficient) -> merged.add(term.expanded(), coefficient));

        TermAccumulator kept = new TermAccumulator(merged.size());
        for (Map.Entry<Term, Complex> e : merged.build().entrySet()) {
            if (e.getValue().abs() > tolerances.getAtol()) {
                kept.add(e.getKey(), e.getValue());
            }
        }

        ImmutableMap<Term, Complex> terms = kept.build();
        if (terms.isEmpty()) {
            return SpinOp.zero(op.numSites(), op.spin());
        }
        if (terms.size() == 1) {
            Map.Entry<Term, Complex> only = terms.entrySet().iterator().next();
            if (only.getKey().isIdentity() && only.getValue().isCloseTo(Complex.ONE,
                    tolerances.getAtol(), tolerances.getRtol())) {
                return SpinOp.one(op.numSites(), op.spin());
            }
        }
        return SpinOp.create(terms, op.numSites(), op.spin());
    }

    /**
     * 各項の因子をサイトインデックスの昇順に安定ソートします。
     *
     * <p>
     * 同じサイト上の因子の相対順序は保ちます。 並べ替えで同一となった項は 1 つのキーに合算されますが、 ゼロ近傍係数の除去や指数の展開は行いません（それは
     * simplify の責務です）。
     * </p>
     *
     * @param op 対象の演算子です
     * @return サイト順に並べた演算子です
     */
    static SpinOp indexOrder(SpinOp op) {
        TermAccumulator acc = new TermAccumulator(op.size());
        op.termMap().forEach((term, coefficient) -> acc.add(term.indexOrdered(), coefficient));
        return SpinOp.create(acc.build(), op.numSites(), op.spin());
    }

    /**
     * サイトインデックスを置換 {@code i -> permutation[i]} で付け替えます。
     *
     * @param op 対象の演算子です
     * @param permutation 置換です（長さ numSites の全単射）
     * @return 付け替えた演算子です
     * @throws InvalidPermutationException 長さが numSites と異なる、または全単射でない場合に発生します
     */
    static SpinOp permuteIndices(SpinOp op, int[] permutation) {
        Preconditions.checkNotNull(permutation, "permutation は null 不可です");
        int n = op.numSites();
        if (permutation.length != n) {
            throw new InvalidPermutationException(
                    "置換の長さが numSites と一致しません: " + permutation.length + " != " + n);
        }
        boolean[] seen = new boolean[n];
        for (int target : permutation) {
            if (target < 0 || target >= n) {
                throw new InvalidPermutationException(
                        "置換の値が範囲外です: " + target + "（0 以上 " + n + " 未満が必要です）");
            }
            if (seen[target]) {
                throw new InvalidPermutationException("置換の値が重複しています: " + target);
            }
            seen[target] = true;
        }

        TermAccumulator acc = new TermAccumulator(op.size());
        op.termMap().forEach(
                (term, coefficient) -> acc.add(term.permuted(permutation), coefficient));
        return SpinOp.create(acc.build(), n, op.spin());
    }

    /**
     * 絶対値が atol 以下の実部・虚部を 0 に丸め、0 になった項を取り除きます。
     *
     * @param op 対象の演算子です
     * @param atol 丸めの閾値です（0 以上）
     * @return 丸めた演算子です
     */
    static SpinOp chop(SpinOp op, double atol) {
        Preconditions.checkArgument(atol >= 0.0, "atol は 0 以上が必要です: %s", atol);
        TermAccumulator acc = new TermAccumulator(op.size());
        op.termMap().forEach((term, c) -> {
            double re = Math.abs(c.getReal()) <= atol ? 0.0 : c.getReal();
            double im = Math.abs(c.getImag()) <= atol ? 0.0 : c.getImag();
            if (re != 0.0 || im != 0.0) {
                acc.add(term, Complex.of(re, im));
            }
        });
        return SpinOp.create(acc.build(), op.numSites(), op.spin());
    }

    /**
     * 項を {@link TermOrder} の順に並べ替えます（係数や項の構造は変えません）。
     *
     * @param op 対象の演算子です
     * @return 並べ替えた演算子です
     */
    static SpinOp sort(SpinOp op) {
        List<Map.Entry<Term, Complex>> entries = new ArrayList<>(op.termMap().entrySet());
        entries.sort(Map.Entry.comparingByKey(TermOrder.INSTANCE));
        TermAccumulator acc = new TermAccumulator(entries.size());
        for (Map.Entry<Term, Complex> e : entries) {
            acc.add(e.getKey(), e.getValue());
        }
        return SpinOp.create(acc.build(), op.numSites(), op.spin());
    }
}
