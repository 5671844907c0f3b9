package io.github.yok.spin.core.label;

import com.google.common.base.Preconditions;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 項を構成する 1 因子 {@code G_i^k} です。
 *
 * <p>
 * exponent は k 回の繰り返しを表し、通常は 1 です。 0 は「そのサイトに何もしない」を表し、正規化（simplify）で除去されます。
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Factor {

    /**
     * 生成子です。
     */
    Generator generator;

    /**
     * サイトインデックスです（0 以上）。
     */
    int site;

    /**
     * 繰り返し回数です（0 以上）。
     */
    int exponent;

    /**
     * 因子を生成します。
     *
     * @param generator 生成子です（null 不可）
     * @param site サイトインデックスです（0 以上）
     * @param exponent 繰り返し回数です（0 以上）
     * @return 因子です
     */
    public static Factor of(Generator generator, int site, int exponent) {
        Preconditions.checkNotNull(generator, "generator は null 不可です");
        if (site < 0) {
            throw new MalformedLabelException("サイトインデックスは 0 以上が必要です: " + site);
        }
        if (exponent < 0) {
            throw new MalformedLabelException("指数は 0 以上が必要です: " + exponent);
        }
        return new Factor(generator, site, exponent);
    }

    /**
     * 指数 1 の因子を生成します。
     *
     * @param generator 生成子です（null 不可）
     * @param site サイトインデックスです（0 以上）
     * @return 因子です
     */
    public static Factor of(Generator generator, int site) {
        return of(generator, site, 1);
    }

    /**
     * サイトだけを差し替えた因子を返します。
     *
     * @param newSite 新しいサイトインデックスです
     * @return 因子です
     */
    public Factor withSite(int newSite) {
        return of(generator, newSite, exponent);
    }

    /**
     * 同じ生成子・同じサイトかどうかを返します（指数は比較しません）。
     *
     * @param other 比較対象です
     * @return 同じ生成子・同じサイトの場合は true です
     */
    public boolean actsLike(Factor other) {
        return generator == other.generator && site == other.site;
    }

    @Override
    public String toString() {
        return LabelCodec.serializeFactor(this);
    }
}
