package io.github.yok.spin.core.operator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.spin.core.math.Complex;
import io.github.yok.spin.core.math.Spin;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.Test;

class SpinOpsTest {

    private static final double EPS = 1e-12;

    private final SpinOp x = SpinOp.builder().term("X_0", 1).build();

    private final SpinOp y = SpinOp.builder().term("Y_0", 1).build();

    private final SpinOp z = SpinOp.builder().term("Z_0", 1).build();

    @Test
    void 交換子はiZ() {
        SpinOp commutator = SpinOps.commutator(x, y);

        assertThat(commutator.labels()).hasSize(2);
        assertSameMatrix(commutator.toMatrix(), z.scale(Complex.I).toMatrix());
    }

    @Test
    void 反交換子() {
        SpinOp anticommutator = SpinOps.anticommutator(x, x).simplify();

        assertThat(anticommutator)
                .isEqualTo(SpinOp.builder().term("X_0 X_0", 2).build());
        assertSameMatrix(anticommutator.toMatrix(),
                SpinOp.builder().term("", 0.5).numSites(1).build().toMatrix());
    }

    @Test
    void 二重交換子() {
        SpinOp commutatorForm = SpinOps.doubleCommutator(x, y, z, false);
        SpinOp anticommutatorForm = SpinOps.doubleCommutator(x, y, z, true);

        assertSameMatrix(commutatorForm.toMatrix(), SpinOp.zero(1, Spin.HALF).toMatrix());
        assertSameMatrix(anticommutatorForm.toMatrix(),
                SpinOp.builder().term("", 0, 0.5).numSites(1).build().toMatrix());
    }

    @Test
    void レジスタが異なると例外() {
        SpinOp other = SpinOp.builder().term("X_1", 1).build();

        assertThatThrownBy(() -> SpinOps.commutator(x, other))
                .isInstanceOf(DimensionMismatchException.class);
    }

    private static void assertSameMatrix(ZMatrixRMaj actual, ZMatrixRMaj expected) {
        assertThat(actual.getNumRows()).isEqualTo(expected.getNumRows());
        for (int i = 0; i < expected.data.length; i++) {
            assertThat(actual.data[i]).as("data[%d]", i).isCloseTo(expected.data[i],
                    within(EPS));
        }
    }
}
