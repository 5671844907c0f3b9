package io.github.yok.spin.core.math;

import java.util.Locale;
import lombok.Value;

/**
 * 演算子の係数として用いる不変の複素数です。
 *
 * <p>
 * -0.0 は生成時に 0.0 へ正規化します（構造的な等価判定で符号付きゼロを区別しないためです）。
 * </p>
 */
@Value
public class Complex {

    /**
     * 0 です。
     */
    public static final Complex ZERO = new Complex(0.0, 0.0);

    /**
     * 1 です。
     */
    public static final Complex ONE = new Complex(1.0, 0.0);

    /**
     * -1 です。
     */
    public static final Complex MINUS_ONE = new Complex(-1.0, 0.0);

    /**
     * 虚数単位 i です。
     */
    public static final Complex I = new Complex(0.0, 1.0);

    /**
     * 実部です。
     */
    double real;

    /**
     * 虚部です。
     */
    double imag;

    private Complex(double real, double imag) {
        this.real = real + 0.0;
        this.imag = imag + 0.0;
    }

    /**
     * 実部と虚部から複素数を生成します。
     *
     * @param real 実部です
     * @param imag 虚部です
     * @return 複素数です
     */
    public static Complex of(double real, double imag) {
        return new Complex(real, imag);
    }

    /**
     * 実数から複素数を生成します。
     *
     * @param real 実部です
     * @return 虚部 0 の複素数です
     */
    public static Complex ofReal(double real) {
        return new Complex(real, 0.0);
    }

    public Complex plus(Complex other) {
        return new Complex(real + other.real, imag + other.imag);
    }

    public Complex minus(Complex other) {
        return new Complex(real - other.real, imag - other.imag);
    }

    public Complex times(Complex other) {
        return new Complex(real * other.real - imag * other.imag,
                real * other.imag + imag * other.real);
    }

    public Complex times(double factor) {
        return new Complex(real * factor, imag * factor);
    }

    /**
     * 複素数で割った値を返します。
     *
     * @param other 除数です（0 不可）
     * @return 商です
     * @throws ArithmeticException 除数が 0 の場合に発生します
     */
    public Complex dividedBy(Complex other) {
        double denominator = other.real * other.real + other.imag * other.imag;
        if (denominator == 0.0) {
            throw new ArithmeticException("0 で割ることはできません");
        }
        return new Complex((real * other.real + imag * other.imag) / denominator,
                (imag * other.real - real * other.imag) / denominator);
    }

    public Complex conjugate() {
        return new Complex(real, -imag);
    }

    public Complex negate() {
        return new Complex(-real, -imag);
    }

    /**
     * 絶対値 |z| を返します。
     *
     * @return 絶対値です
     */
    public double abs() {
        return Math.hypot(real, imag);
    }

    /**
     * 実部・虚部ともに 0 かどうかを返します。
     *
     * @return 厳密に 0 の場合は true です
     */
    public boolean isZero() {
        return real == 0.0 && imag == 0.0;
    }

    /**
     * {@code |this - other| <= atol + rtol * |other|} を満たすかを返します。
     *
     * @param other 比較対象です
     * @param atol 絶対許容誤差です
     * @param rtol 相対許容誤差です
     * @return 許容誤差内で一致する場合は true です
     */
    public boolean isCloseTo(Complex other, double atol, double rtol) {
        return minus(other).abs() <= atol + rtol * other.abs();
    }

    @Override
    public String toString() {
        if (imag == 0.0) {
            return String.format(Locale.ROOT, "%s", real);
        }
        if (real == 0.0) {
            return String.format(Locale.ROOT, "%sj", imag);
        }
        return String.format(Locale.ROOT, "(%s%s%sj)", real, imag < 0 ? "-" : "+",
                Math.abs(imag));
    }
}
