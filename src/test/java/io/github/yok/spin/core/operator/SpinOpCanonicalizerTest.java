package io.github.yok.spin.core.operator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.spin.core.label.MalformedLabelException;
import io.github.yok.spin.core.math.Complex;
import io.github.yok.spin.core.math.Spin;
import org.junit.jupiter.api.Test;

class SpinOpCanonicalizerTest {

    @Test
    void 異なる項は簡約しない() {
        SpinOp op = SpinOp.builder().term("X_0 Y_0", 1).term("X_0 X_0 X_0 Y_0", 1).build();

        assertThat(op.simplify()).isEqualTo(op);
    }

    @Test
    void 同一サイトの同じ生成子の積は恒等にしない() {
        SpinOp op = SpinOp.builder().term("X_0 X_0", 1).build();

        assertThat(op.simplify()).isEqualTo(op);
        assertThat(op.simplify().isOne()).isFalse();
    }

    @Test
    void 指数を展開する() {
        SpinOp op = SpinOp.builder().term("X_0^3", 1).build();

        assertThat(op.simplify())
                .isEqualTo(SpinOp.builder().term("X_0 X_0 X_0", 1).build());
    }

    @Test
    void 展開後に同一となる項を合算する() {
        SpinOp sum = SpinOp.builder().term("X_0 Y_0", 1).build()
                .add(SpinOp.builder().term("X_0^2 Z_0", 2).build());

        assertThat(sum.simplify()).isEqualTo(
                SpinOp.builder().term("X_0 Y_0", 1).term("X_0 X_0 Z_0", 2).build());

        SpinOp merged = SpinOp.builder().term("Y_1^2", 1).term("Y_1 Y_1", 2).numSites(2).build();

        assertThat(merged.simplify())
                .isEqualTo(SpinOp.builder().term("Y_1 Y_1", 3).numSites(2).build());
    }

    @Test
    void 係数1以外の恒等項は残る() {
        SpinOp op = SpinOp.builder().term("", 5).numSites(3).build();

        assertThat(op.simplify()).isEqualTo(op);
        assertThat(op.isOne()).isFalse();
    }

    @Test
    void 係数1の恒等項は単位演算子() {
        SpinOp op = SpinOp.builder().term("", 1).numSites(2).build();

        assertThat(op.simplify()).isEqualTo(SpinOp.one(2, Spin.HALF));
        assertThat(op.simplify().equiv(SpinOp.one())).isTrue();
        assertThat(op.simplify().equiv(SpinOp.builder().term("", 1).numSites(3).build()))
                .isTrue();
        assertThat(op.isOne()).isTrue();
    }

    @Test
    void 指数0の因子は恒等() {
        SpinOp op = SpinOp.builder().term("X_0^0", 1).build();

        SpinOp simplified = op.simplify();

        assertThat(op.numSites()).isEqualTo(1);
        assertThat(simplified.equiv(SpinOp.one())).isTrue();
        assertThat(SpinOp.one().equiv(simplified)).isTrue();
        assertThat(simplified.numSites()).isEqualTo(1);
    }

    @Test
    void 自身との差はゼロ演算子() {
        SpinOp a = SpinOp.builder().term("X_0 Y_0", 1).term("Z_1", 0, 2).build();

        SpinOp diff = a.subtract(a);

        assertThat(diff.size()).isEqualTo(2);
        assertThat(diff.simplify().equiv(SpinOp.zero())).isTrue();
        assertThat(SpinOp.zero().equiv(diff)).isTrue();
        assertThat(diff.simplify().numSites()).isEqualTo(2);
        assertThat(diff.isZero()).isTrue();
    }

    @Test
    void 展開しきれない指数は例外() {
        SpinOp op = SpinOp.builder().term("X_0^1500000000", 1).build();

        assertThatThrownBy(op::simplify).isInstanceOf(MalformedLabelException.class)
                .hasMessageContaining("上限");
        assertThatThrownBy(op::isZero).isInstanceOf(MalformedLabelException.class);
        assertThat(SpinOp.builder().term("Z_0^4096", 1).build().simplify().size())
                .isEqualTo(1);
    }

    @Test
    void 許容誤差以下の係数を取り除く() {
        SpinOp op = SpinOp.builder().term("X_0", 1e-13).term("Y_0", 1).build();

        assertThat(op.simplify()).isEqualTo(SpinOp.builder().term("Y_0", 1).build());
        assertThat(op.simplify(Tolerances.absolute(1e-14))).isEqualTo(op);
        assertThat(op.simplify(Tolerances.absolute(2.0)).isZero()).isTrue();
    }

    @Test
    void simplifyは冪等() {
        SpinOp op = SpinOp.builder().term("X_0^2 Y_1", 1).term("X_0 X_0 Y_1", -0.5)
                .term("Z_0^0 Z_1", 0, 3).term("", 1e-15).build();

        SpinOp once = op.simplify();

        assertThat(once.simplify()).isEqualTo(once);
        assertThat(once.coefficientOf("X_0 X_0 Y_1")).isEqualTo(Complex.ofReal(0.5));
    }

    @Test
    void 単一因子はサイト順でも変わらない() {
        SpinOp op = SpinOp.builder().term("Y_0", 1).build();

        assertThat(op.indexOrder()).isEqualTo(op);
    }

    @Test
    void 因子をサイト順に並べる() {
        assertThat(SpinOp.builder().term("X_1 X_0", 1).build().indexOrder())
                .isEqualTo(SpinOp.builder().term("X_0 X_1", 1).build());

        SpinOp op = SpinOp.builder().term("X_2 Y_0 Z_1 X_0", 1).term("Z_0 X_1", 2).build();

        assertThat(op.indexOrder()).isEqualTo(
                SpinOp.builder().term("Y_0 X_0 Z_1 X_2", 1).term("Z_0 X_1", 2).build());
    }

    @Test
    void サイト順で同一となる項は合算するが取り除かない() {
        SpinOp op = SpinOp.builder().term("X_0 Y_1", 1).term("Y_1 X_0", 1).term("", 0.0)
                .build();

        SpinOp ordered = op.indexOrder();

        assertThat(ordered.size()).isEqualTo(2);
        assertThat(ordered.coefficientOf("X_0 Y_1")).isEqualTo(Complex.ofReal(2));
        assertThat(ordered.simplify())
                .isEqualTo(SpinOp.builder().term("X_0 Y_1", 2).build());
    }

    @Test
    void サイト順の後に簡約する() {
        SpinOp op = SpinOp.builder().term("X_0 Y_0 X_1 Y_0", 1).term("X_0 X_1", 2).build();

        assertThat(op.indexOrder().simplify()).isEqualTo(
                SpinOp.builder().term("X_0 Y_0 Y_0 X_1", 1).term("X_0 X_1", 2).build());
    }

    @Test
    void サイトを置換する() {
        SpinOp op = SpinOp.builder().term("X_0 Y_1", 1).term("Z_1 X_2", 2).numSites(4).build();

        assertThat(op.permuteIndices(2, 1, 3, 0)).isEqualTo(
                SpinOp.builder().term("X_2 Y_1", 1).term("Z_1 X_3", 2).numSites(4).build());
    }

    @Test
    void 不正な置換は例外() {
        SpinOp op = SpinOp.builder().term("X_0 Y_1", 1).term("Z_1 X_2", 2).numSites(4).build();

        assertThatThrownBy(() -> op.permuteIndices(1, 0))
                .isInstanceOf(InvalidPermutationException.class);
        assertThatThrownBy(() -> op.permuteIndices(0, 0, 1, 2))
                .isInstanceOf(InvalidPermutationException.class);
        assertThatThrownBy(() -> op.permuteIndices(0, 1, 2, 4))
                .isInstanceOf(InvalidPermutationException.class);
    }

    @Test
    void 小さな実部と虚部を丸める() {
        SpinOp op = SpinOp.builder().term("X_0", 1, 1e-15).term("Y_0", 1e-14).term("Z_0", 0, -2)
                .build();

        assertThat(op.chop()).isEqualTo(
                SpinOp.builder().term("X_0", 1).term("Z_0", 0, -2).build());
        assertThat(op.chop(0.0)).isEqualTo(op);
    }

    @Test
    void 項を順序付けて並べる() {
        SpinOp op = SpinOp.builder().term("X_1", 1).term("Z_0", 2).term("X_0 Y_1", 3)
                .term("", 4).build();

        SpinOp sorted = op.sort();

        assertThat(sorted).isEqualTo(op);
        assertThat(sorted.labels().keySet()).containsExactly("", "X_0 Y_1", "Z_0", "X_1");
    }
}
