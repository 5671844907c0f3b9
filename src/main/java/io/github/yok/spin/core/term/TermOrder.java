package io.github.yok.spin.core.term;

import io.github.yok.spin.core.label.Factor;
import java.util.Comparator;
import java.util.List;

/**
 * 項の全順序です。
 *
 * <p>
 * 因子を先頭から {@code (サイト, 生成子, 指数)} の順に辞書式比較し、 一方が他方の接頭辞の場合は短い方を先とします。 項とラベル文字列は 1 対 1
 * に対応するため、異なる項が 0 を返すことはありません。
 * </p>
 */
public final class TermOrder implements Comparator<Term> {

    /**
     * 共有インスタンスです。
     */
    public static final TermOrder INSTANCE = new TermOrder();

    private TermOrder() {}

    @Override
    public int compare(Term a, Term b) {
        List<Factor> fa = a.factors();
        List<Factor> fb = b.factors();
        int n = Math.min(fa.size(), fb.size());
        for (int i = 0; i < n; i++) {
            int c = compareFactor(fa.get(i), fb.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(fa.size(), fb.size());
    }

    private static int compareFactor(Factor x, Factor y) {
        int c = Integer.compare(x.getSite(), y.getSite());
        if (c != 0) {
            return c;
        }
        c = x.getGenerator().compareTo(y.getGenerator());
        if (c != 0) {
            return c;
        }
        return Integer.compare(x.getExponent(), y.getExponent());
    }
}
