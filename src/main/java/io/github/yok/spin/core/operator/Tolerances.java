package io.github.yok.spin.core.operator;

import com.google.common.base.Preconditions;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 係数の打ち切り・比較に用いる許容誤差です。
 *
 * <p>
 * atol は正規化（simplify / chop）で係数をゼロとみなす閾値、 および等価判定の絶対許容誤差です。 rtol は等価判定の相対許容誤差です。
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Tolerances {

    /**
     * 既定の許容誤差（atol=1e-12, rtol=0）です。
     */
    public static final Tolerances DEFAULT = new Tolerances(1e-12, 0.0);

    /**
     * 絶対許容誤差です。
     */
    double atol;

    /**
     * 相対許容誤差です。
     */
    double rtol;

    /**
     * 許容誤差を生成します。
     *
     * @param atol 絶対許容誤差です（0 以上）
     * @param rtol 相対許容誤差です（0 以上）
     * @return 許容誤差です
     * @throws IllegalArgumentException 負の値や非有限値の場合に発生します
     */
    public static Tolerances of(double atol, double rtol) {
        Preconditions.checkArgument(Double.isFinite(atol) && atol >= 0.0,
                "atol は 0 以上の有限値が必要です: %s", atol);
        Preconditions.checkArgument(Double.isFinite(rtol) && rtol >= 0.0,
                "rtol は 0 以上の有限値が必要です: %s", rtol);
        return new Tolerances(atol, rtol);
    }

    /**
     * 絶対許容誤差のみの許容誤差を生成します。
     *
     * @param atol 絶対許容誤差です（0 以上）
     * @return 許容誤差です
     */
    public static Tolerances absolute(double atol) {
        return of(atol, 0.0);
    }
}
