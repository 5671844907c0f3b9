package io.github.yok.spin.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.spin.core.linearalgebra.EjmlKroneckerSpinMatrixBackend;
import io.github.yok.spin.core.math.Spin;
import io.github.yok.spin.core.operator.SpinOp;
import io.github.yok.spin.core.operator.Tolerances;
import java.util.ArrayList;
import java.util.List;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.Test;

class SpinAlgebraCliRunnerTest {

    private final List<Object[]> written = new ArrayList<>();

    @Test
    void 正規形に変換して出力する() {
        SpinAlgebraProperties properties = properties(4,
                operator("ordered", "1/2", null, term("Y_1 X_0", 1), term("X_0 Y_1", 1),
                        term("Z_0^0", 1e-15)));

        SpinAlgebraCliRunner runner = runner(properties);
        runner.run();

        assertThat(written).hasSize(1);
        assertThat(written.get(0)[0]).isEqualTo("ordered");
        SpinOp canonical = (SpinOp) written.get(0)[1];
        assertThat(canonical).isEqualTo(SpinOp.builder().term("X_0 Y_1", 2).build());
        assertThat(written.get(0)[2]).isInstanceOf(ZMatrixRMaj.class);
        assertThat(written.get(0)[3]).isEqualTo(true);
    }

    @Test
    void サイト数が上限を超えると行列を省略する() {
        SpinAlgebraProperties properties =
                properties(1, operator("wide", "1", 3, term("Z_0 Z_2", 1)));

        SpinOp canonical = runner(properties).process(properties.getOperators().get(0));

        assertThat(canonical.numSites()).isEqualTo(3);
        assertThat(canonical.spin()).isEqualTo(Spin.ONE);
        assertThat(written.get(0)[2]).isNull();
    }

    @Test
    void 不正な定義は設定エラー() {
        SpinAlgebraProperties badSpin = properties(4, operator("bad", "1/3", null,
                term("X_0", 1)));
        SpinAlgebraProperties badLabel = properties(4, operator("bad", "1/2", 1,
                term("X_1", 1)));

        assertThatThrownBy(() -> runner(badSpin).run())
                .isInstanceOf(IllegalStateException.class).hasMessageContaining("bad");
        assertThatThrownBy(() -> runner(badLabel).run())
                .isInstanceOf(IllegalStateException.class);
        assertThat(written).isEmpty();
    }

    @Test
    void 設定値の整形() {
        SpinAlgebraProperties properties =
                properties(4, operator("heis", "1/2", null, term("X_0 X_1", 1)));

        assertThat(properties.toMultilineString()).contains("maxSites: 4", "operator[heis]:",
                "numSites: auto");
    }

    private SpinAlgebraCliRunner runner(SpinAlgebraProperties properties) {
        return new SpinAlgebraCliRunner(properties, new EjmlKroneckerSpinMatrixBackend(),
                Tolerances.DEFAULT,
                (name, op, matrix, hermitian) -> written
                        .add(new Object[] {name, op, matrix, hermitian}));
    }

    private static SpinAlgebraProperties properties(int maxSites,
            SpinAlgebraProperties.OperatorSpec... operators) {
        SpinAlgebraProperties p = new SpinAlgebraProperties();
        p.getMatrix().setMaxSites(maxSites);
        p.setOperators(List.of(operators));
        return p;
    }

    private static SpinAlgebraProperties.OperatorSpec operator(String name, String spin,
            Integer numSites, SpinAlgebraProperties.TermSpec... terms) {
        SpinAlgebraProperties.OperatorSpec spec = new SpinAlgebraProperties.OperatorSpec();
        spec.setName(name);
        spec.setSpin(spin);
        spec.setNumSites(numSites);
        spec.setTerms(List.of(terms));
        return spec;
    }

    private static SpinAlgebraProperties.TermSpec term(String label, double real) {
        SpinAlgebraProperties.TermSpec term = new SpinAlgebraProperties.TermSpec();
        term.setLabel(label);
        term.setReal(real);
        return term;
    }
}
