package io.github.yok.spin.core.math;

import com.google.common.base.Preconditions;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * スピン量子数 s（正の半整数）です。
 *
 * <p>
 * 内部では 2s を整数で保持し、1 サイトあたりの次元 d = 2s + 1 を与えます。
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Spin {

    /**
     * s = 1/2 です（既定値）。
     */
    public static final Spin HALF = new Spin(1);

    /**
     * s = 1 です。
     */
    public static final Spin ONE = new Spin(2);

    /**
     * 2s の値です（1 以上）。
     */
    int twiceSpin;

    /**
     * 2s の値からスピン量子数を生成します。
     *
     * @param twiceSpin 2s の値です（1 以上）
     * @return スピン量子数です
     * @throws IllegalArgumentException twiceSpin が 1 未満の場合に発生します
     */
    public static Spin ofTwice(int twiceSpin) {
        Preconditions.checkArgument(twiceSpin > 0, "スピン量子数は正の半整数が必要です: 2s=%s", twiceSpin);
        return new Spin(twiceSpin);
    }

    /**
     * 整数スピン s からスピン量子数を生成します。
     *
     * @param spin s の値です（1 以上）
     * @return スピン量子数です
     */
    public static Spin ofInteger(int spin) {
        Preconditions.checkArgument(spin > 0, "スピン量子数は正の値が必要です: s=%s", spin);
        return ofTwice(Math.multiplyExact(2, spin));
    }

    /**
     * {@code "1/2"}, {@code "1"}, {@code "3/2"}, {@code "1.5"} 形式の文字列を解析します。
     *
     * @param text スピン量子数の文字列です
     * @return スピン量子数です
     * @throws IllegalArgumentException 正の半整数として解釈できない場合に発生します
     */
    public static Spin parse(String text) {
        Preconditions.checkNotNull(text, "text は null 不可です");
        String s = text.trim();
        try {
            int slash = s.indexOf('/');
            if (slash >= 0) {
                int numerator = Integer.parseInt(s.substring(0, slash).trim());
                int denominator = Integer.parseInt(s.substring(slash + 1).trim());
                if (denominator == 1) {
                    return ofInteger(numerator);
                }
                Preconditions.checkArgument(denominator == 2, "分母は 1 または 2 が必要です: %s", text);
                return ofTwice(numerator);
            }
            double twice = 2.0 * Double.parseDouble(s);
            Preconditions.checkArgument(twice == Math.rint(twice),
                    "スピン量子数は半整数が必要です: %s", text);
            return ofTwice((int) twice);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("スピン量子数を解釈できません: " + text, e);
        }
    }

    /**
     * 1 サイトあたりの次元 d = 2s + 1 を返します。
     *
     * @return 次元です
     */
    public int dimension() {
        return twiceSpin + 1;
    }

    /**
     * s の値を返します。
     *
     * @return s です
     */
    public double value() {
        return twiceSpin / 2.0;
    }

    @Override
    public String toString() {
        return (twiceSpin % 2 == 0) ? Integer.toString(twiceSpin / 2) : twiceSpin + "/2";
    }
}
