package io.github.yok.spin.core.term;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.spin.core.label.Factor;
import io.github.yok.spin.core.label.Generator;
import io.github.yok.spin.core.label.LabelCodec;
import io.github.yok.spin.core.label.MalformedLabelException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.EqualsAndHashCode;

/**
 * 因子 {@code (生成子, サイト, 指数)} の順序付き列で表される項です。
 *
 * <p>
 * 空の因子列は恒等演算子を表します。 項は不変で、変換操作はすべて新しい項を返します。 同じサイトを共有する因子は自動ではまとめません。
 * </p>
 */
@EqualsAndHashCode(of = "factors")
public final class Term {

    /**
     * 指数を展開したときに許容する因子数の上限です。
     */
    public static final int MAX_EXPANDED_FACTORS = 1 << 16;

    /**
     * 恒等演算子（空の因子列）です。
     */
    private static final Term IDENTITY = new Term(ImmutableList.of());

    /**
     * 因子列です。
     */
    private final ImmutableList<Factor> factors;

    /**
     * ラベル文字列のキャッシュです。
     */
    private final String label;

    private Term(ImmutableList<Factor> factors) {
        this.factors = factors;
        this.label = LabelCodec.serialize(factors);
    }

    /**
     * 恒等演算子を返します。
     *
     * @return 空の項です
     */
    public static Term identity() {
        return IDENTITY;
    }

    /**
     * 因子列から項を生成します。
     *
     * @param factors 因子列です（null 不可）
     * @return 項です
     */
    public static Term of(List<Factor> factors) {
        Preconditions.checkNotNull(factors, "factors は null 不可です");
        if (factors.isEmpty()) {
            return IDENTITY;
        }
        return new Term(ImmutableList.copyOf(factors));
    }

    /**
     * ラベル文字列を解析して項を生成します。
     *
     * @param label ラベル文字列です
     * @return 項です
     * @throws io.github.yok.spin.core.label.MalformedLabelException ラベルが文法に合わない場合に発生します
     */
    public static Term parse(String label) {
        return of(LabelCodec.parse(label));
    }

    /**
     * 因子列を返します。
     *
     * @return 不変の因子列です
     */
    public ImmutableList<Factor> factors() {
        return factors;
    }

    /**
     * 因子数を返します。
     *
     * @return 因子数です
     */
    public int size() {
        return factors.size();
    }

    /**
     * 因子を 1 つも持たない（恒等演算子）かどうかを返します。
     *
     * @return 空の項の場合は true です
     */
    public boolean isIdentity() {
        return factors.isEmpty();
    }

    /**
     * ラベル文字列（圧縮なし）を返します。
     *
     * @return ラベル文字列です
     */
    public String label() {
        return label;
    }

    /**
     * 連続する同一因子を指数にまとめたラベル文字列を返します。
     *
     * @return 圧縮したラベル文字列です
     */
    public String compactLabel() {
        return LabelCodec.serializeCompact(factors);
    }

    /**
     * 最大のサイトインデックスを返します。
     *
     * @return 最大サイトインデックスです（因子が無い場合は -1）
     */
    public int maxSite() {
        int max = -1;
        for (Factor f : factors) {
            max = Math.max(max, f.getSite());
        }
        return max;
    }

    /**
     * Y 因子の個数（指数を含めた繰り返し回数）を返します。
     *
     * @return Y の出現回数です
     */
    public int countY() {
        int count = 0;
        for (Factor f : factors) {
            if (f.getGenerator() == Generator.Y) {
                count += f.getExponent();
            }
        }
        return count;
    }

    /**
     * 後ろに別の項を連結した項を返します（演算子積 this・other に対応します）。
     *
     * @param other 後ろに連結する項です
     * @return 連結した項です
     */
    public Term concat(Term other) {
        if (other.isIdentity()) {
            return this;
        }
        if (isIdentity()) {
            return other;
        }
        return new Term(ImmutableList.<Factor>builderWithExpectedSize(size() + other.size())
                .addAll(factors).addAll(other.factors).build());
    }

    /**
     * 全因子のサイトインデックスを offset だけずらした項を返します。
     *
     * @param offset ずらす量です（0 以上）
     * @return サイトをずらした項です
     */
    public Term shiftSites(int offset) {
        if (offset == 0 || isIdentity()) {
            return this;
        }
        ImmutableList.Builder<Factor> b = ImmutableList.builderWithExpectedSize(size());
        for (Factor f : factors) {
            b.add(f.withSite(f.getSite() + offset));
        }
        return new Term(b.build());
    }

    /**
     * 因子の並びを逆順にした項を返します。
     *
     * @return 逆順の項です
     */
    public Term reversed() {
        if (size() < 2) {
            return this;
        }
        return new Term(factors.reverse());
    }

    /**
     * 指数 k の因子を k 個の因子に展開した項を返します（指数 0 の因子は取り除きます）。
     *
     * @return 展開した項です
     * @throws MalformedLabelException 展開後の因子数が {@link #MAX_EXPANDED_FACTORS} を超える場合に発生します
     */
    public Term expanded() {
        boolean plain = true;
        for (Factor f : factors) {
            if (f.getExponent() != 1) {
                plain = false;
                break;
            }
        }
        if (plain) {
            return this;
        }

        long length = 0L;
        for (Factor f : factors) {
            length += f.getExponent();
        }
        if (length > MAX_EXPANDED_FACTORS) {
            throw new MalformedLabelException("展開後の因子数が上限を超えます: " + length + " > "
                    + MAX_EXPANDED_FACTORS + ", label='" + label + "'");
        }

        List<Factor> out = new ArrayList<>((int) length);
        for (Factor f : factors) {
            Factor single = Factor.of(f.getGenerator(), f.getSite());
            for (int k = 0; k < f.getExponent(); k++) {
                out.add(single);
            }
        }
        return of(out);
    }

    /**
     * 因子をサイトインデックスの昇順に安定ソートした項を返します。
     *
     * <p>
     * 同じサイト上の因子は非可換なので、元の相対順序を保ちます。 異なるサイトの因子は可換なので、この並べ替えで演算子は変わりません。
     * </p>
     *
     * @return サイト順に並べた項です
     */
    public Term indexOrdered() {
        List<Factor> sorted = new ArrayList<>(factors);
        // List.sort は安定ソートです。
        sorted.sort(Comparator.comparingInt(Factor::getSite));
        return of(sorted);
    }

    /**
     * サイトインデックスを置換 {@code site -> permutation[site]} で付け替えた項を返します。
     *
     * @param permutation 置換です（全因子のサイトを添字として含む長さが必要です）
     * @return 付け替えた項です
     */
    public Term permuted(int[] permutation) {
        if (isIdentity()) {
            return this;
        }
        ImmutableList.Builder<Factor> b = ImmutableList.builderWithExpectedSize(size());
        for (Factor f : factors) {
            b.add(f.withSite(permutation[f.getSite()]));
        }
        return new Term(b.build());
    }

    @Override
    public String toString() {
        return label;
    }
}
