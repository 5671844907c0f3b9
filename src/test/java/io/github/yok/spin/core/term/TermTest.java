package io.github.yok.spin.core.term;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableMap;
import io.github.yok.spin.core.label.MalformedLabelException;
import io.github.yok.spin.core.math.Complex;
import org.junit.jupiter.api.Test;

class TermTest {

    @Test
    void 恒等項() {
        Term identity = Term.parse("");

        assertThat(identity).isSameAs(Term.identity());
        assertThat(identity.isIdentity()).isTrue();
        assertThat(identity.label()).isEmpty();
        assertThat(identity.maxSite()).isEqualTo(-1);
    }

    @Test
    void 指数1の省略有無は同じ項() {
        assertThat(Term.parse("X_0^1 Y_1")).isEqualTo(Term.parse("X_0 Y_1"));
        assertThat(Term.parse("X_0^2")).isNotEqualTo(Term.parse("X_0 X_0"));
    }

    @Test
    void 最大サイトとYの個数() {
        Term term = Term.parse("Y_0^3 X_1 Y_2");

        assertThat(term.maxSite()).isEqualTo(2);
        assertThat(term.countY()).isEqualTo(4);
        assertThat(term.size()).isEqualTo(3);
    }

    @Test
    void 連結とサイトのシフト() {
        Term left = Term.parse("X_0 Y_0");
        Term right = Term.parse("X_0^2 Z_0");

        assertThat(left.concat(right).label()).isEqualTo("X_0 Y_0 X_0^2 Z_0");
        assertThat(left.concat(right.shiftSites(1)).label()).isEqualTo("X_0 Y_0 X_1^2 Z_1");
        assertThat(left.concat(Term.identity())).isSameAs(left);
    }

    @Test
    void 逆順() {
        assertThat(Term.parse("X_0 Y_1^2 Z_0").reversed().label()).isEqualTo("Z_0 Y_1^2 X_0");
    }

    @Test
    void 指数の展開() {
        assertThat(Term.parse("X_0^3 Y_1^0 Z_2").expanded().label())
                .isEqualTo("X_0 X_0 X_0 Z_2");
        assertThat(Term.parse("X_0^0").expanded().isIdentity()).isTrue();
    }

    @Test
    void 展開後の因子数には上限がある() {
        int limit = Term.MAX_EXPANDED_FACTORS;

        assertThat(Term.parse("X_0^" + limit).expanded().size()).isEqualTo(limit);
        assertThatThrownBy(() -> Term.parse("X_0^" + limit + " Y_1").expanded())
                .isInstanceOf(MalformedLabelException.class);
        assertThatThrownBy(() -> Term.parse("X_0^2147483647 Y_1^2147483647").expanded())
                .isInstanceOf(MalformedLabelException.class);
    }

    @Test
    void サイト順の安定ソート() {
        assertThat(Term.parse("X_2 Y_0 Z_1 X_0").indexOrdered().label())
                .isEqualTo("Y_0 X_0 Z_1 X_2");
        assertThat(Term.parse("Y_1 X_0").indexOrdered().label()).isEqualTo("X_0 Y_1");
    }

    @Test
    void サイトの置換() {
        assertThat(Term.parse("Z_1 X_2").permuted(new int[] {2, 1, 3, 0}).label())
                .isEqualTo("Z_1 X_3");
    }

    @Test
    void 同一項の係数は合算され消えない() {
        ImmutableMap<Term, Complex> merged = new TermAccumulator()
                .add(Term.parse("X_0"), Complex.ONE)
                .add(Term.parse("Y_0"), Complex.I)
                .add(Term.parse("X_0^1"), Complex.MINUS_ONE)
                .build();

        assertThat(merged).containsOnlyKeys(Term.parse("X_0"), Term.parse("Y_0"));
        assertThat(merged.get(Term.parse("X_0"))).isEqualTo(Complex.ZERO);
        assertThat(merged.keySet()).containsExactly(Term.parse("X_0"), Term.parse("Y_0"));
    }
}
