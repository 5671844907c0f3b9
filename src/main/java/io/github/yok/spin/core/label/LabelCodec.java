package io.github.yok.spin.core.label;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 項ラベル文字列と因子列を相互変換するクラスです。
 *
 * <p>
 * 文法は以下のとおりです。トークンの区切りは半角スペース 1 個のみを許可します。
 * </p>
 *
 * <pre>
 * term   := "" | factor (" " factor)*
 * factor := G "_" SITE ["^" EXPONENT]      (G は X, Y, Z のいずれか)
 * </pre>
 */
public final class LabelCodec {

    /**
     * 1 因子のトークンパターンです。
     */
    private static final Pattern FACTOR_PATTERN =
            Pattern.compile("([A-Za-z])_(\\d+)(?:\\^(\\d+))?");

    /**
     * トークンの区切り文字です。
     */
    private static final String SEPARATOR = " ";

    private LabelCodec() {}

    /**
     * ラベル文字列を因子列に変換します。
     *
     * <p>
     * 空文字列は恒等演算子（空の因子列）を表します。
     * </p>
     *
     * @param label ラベル文字列です（null 不可）
     * @return 因子列です（不変リスト）
     * @throws MalformedLabelException 文法違反、負のサイトインデックス、負の指数の場合に発生します
     */
    public static ImmutableList<Factor> parse(String label) {
        Preconditions.checkNotNull(label, "label は null 不可です");
        if (label.isEmpty()) {
            return ImmutableList.of();
        }

        // split の limit=-1 で前後や連続スペースによる空トークンも検出します。
        String[] tokens = label.split(SEPARATOR, -1);
        ImmutableList.Builder<Factor> factors =
                ImmutableList.builderWithExpectedSize(tokens.length);
        for (String token : tokens) {
            factors.add(parseFactor(token, label));
        }
        return factors.build();
    }

    /**
     * 1 トークンを因子に変換します。
     *
     * @param token トークンです
     * @param label エラーメッセージ用の元ラベルです
     * @return 因子です
     * @throws MalformedLabelException トークンが文法に合わない場合に発生します
     */
    private static Factor parseFactor(String token, String label) {
        Matcher m = FACTOR_PATTERN.matcher(token);
        if (!m.matches()) {
            throw new MalformedLabelException(
                    "ラベルのトークンが文法に合いません: token='" + token + "', label='" + label + "'");
        }

        Generator generator = Generator.fromSymbol(m.group(1).charAt(0));
        int site = parseNumber(m.group(2), "サイトインデックス", label);
        int exponent = (m.group(3) == null) ? 1 : parseNumber(m.group(3), "指数", label);

        return Factor.of(generator, site, exponent);
    }

    private static int parseNumber(String digits, String what, String label) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new MalformedLabelException(
                    what + "が int の範囲を超えています: " + digits + ", label='" + label + "'", e);
        }
    }

    /**
     * 因子列をラベル文字列に変換します。
     *
     * <p>
     * 因子は保持されている形のまま出力し、連続する同一因子の圧縮は行いません。
     * </p>
     *
     * @param factors 因子列です（null 不可）
     * @return ラベル文字列です
     */
    public static String serialize(List<Factor> factors) {
        Preconditions.checkNotNull(factors, "factors は null 不可です");
        StringBuilder sb = new StringBuilder(factors.size() * 4);
        for (Factor factor : factors) {
            if (sb.length() > 0) {
                sb.append(SEPARATOR);
            }
            appendFactor(sb, factor.getGenerator(), factor.getSite(), factor.getExponent());
        }
        return sb.toString();
    }

    /**
     * 因子列を、連続する同一の生成子・サイトを指数にまとめたラベル文字列に変換します。
     *
     * <p>
     * 例: {@code X_0 X_0 Z_0} は {@code X_0^2 Z_0} になります。 指数 0 の因子はそのまま出力します。
     * </p>
     *
     * @param factors 因子列です（null 不可）
     * @return 圧縮したラベル文字列です
     */
    public static String serializeCompact(List<Factor> factors) {
        Preconditions.checkNotNull(factors, "factors は null 不可です");
        StringBuilder sb = new StringBuilder(factors.size() * 4);

        int i = 0;
        while (i < factors.size()) {
            Factor head = factors.get(i);
            int exponent = head.getExponent();
            int j = i + 1;
            if (exponent > 0) {
                while (j < factors.size() && factors.get(j).actsLike(head)
                        && factors.get(j).getExponent() > 0) {
                    exponent += factors.get(j).getExponent();
                    j++;
                }
            }
            if (sb.length() > 0) {
                sb.append(SEPARATOR);
            }
            appendFactor(sb, head.getGenerator(), head.getSite(), exponent);
            i = j;
        }
        return sb.toString();
    }

    /**
     * 1 因子をラベル表記に変換します。
     *
     * @param factor 因子です
     * @return ラベル表記です
     */
    static String serializeFactor(Factor factor) {
        StringBuilder sb = new StringBuilder(6);
        appendFactor(sb, factor.getGenerator(), factor.getSite(), factor.getExponent());
        return sb.toString();
    }

    private static void appendFactor(StringBuilder sb, Generator generator, int site,
            int exponent) {
        sb.append(generator.symbol()).append('_').append(site);
        if (exponent != 1) {
            sb.append('^').append(exponent);
        }
    }
}
