package io.github.yok.spin.core.math;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ComplexTest {

    @Test
    void 積と商() {
        Complex a = Complex.of(1, 2);
        Complex b = Complex.of(3, -1);

        Complex product = a.times(b);

        assertThat(product).isEqualTo(Complex.of(5, 5));
        assertThat(product.dividedBy(b)).isEqualTo(a);
        assertThat(a.times(2.0)).isEqualTo(Complex.of(2, 4));
    }

    @Test
    void ゼロ除算は例外() {
        assertThatThrownBy(() -> Complex.ONE.dividedBy(Complex.ZERO))
                .isInstanceOf(ArithmeticException.class);
    }

    @Test
    void 負のゼロは正のゼロと等しい() {
        assertThat(Complex.of(-0.0, -0.0)).isEqualTo(Complex.ZERO);
        assertThat(Complex.of(-0.0, -0.0).hashCode()).isEqualTo(Complex.ZERO.hashCode());
        assertThat(Complex.ONE.negate().negate()).isEqualTo(Complex.ONE);
    }

    @Test
    void 共役と絶対値() {
        Complex z = Complex.of(3, 4);

        assertThat(z.conjugate()).isEqualTo(Complex.of(3, -4));
        assertThat(z.abs()).isEqualTo(5.0);
        assertThat(Complex.ZERO.isZero()).isTrue();
        assertThat(Complex.I.isZero()).isFalse();
    }

    @Test
    void 許容誤差内の一致() {
        Complex z = Complex.of(1, 1);

        assertThat(z.isCloseTo(Complex.of(1 + 1e-13, 1), 1e-12, 0.0)).isTrue();
        assertThat(z.isCloseTo(Complex.of(1 + 1e-6, 1), 1e-12, 0.0)).isFalse();
        assertThat(z.isCloseTo(Complex.of(1 + 1e-6, 1), 0.0, 1e-5)).isTrue();
    }

    @Test
    void 文字列表現() {
        assertThat(Complex.of(1, 0)).hasToString("1.0");
        assertThat(Complex.of(0, 2)).hasToString("2.0j");
        assertThat(Complex.of(1, 2)).hasToString("(1.0+2.0j)");
        assertThat(Complex.of(1, -2)).hasToString("(1.0-2.0j)");
    }
}
