package io.github.yok.spin.app;

import io.github.yok.spin.core.linearalgebra.SpinMatrixBackend;
import io.github.yok.spin.core.math.Spin;
import io.github.yok.spin.core.operator.SpinOp;
import io.github.yok.spin.core.operator.Tolerances;
import io.github.yok.spin.out.ResultWriter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.ZMatrixRMaj;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で spin-algebra を実行するクラスです。
 *
 * <p>
 * 設定ファイルの演算子を順に構築し、正規形（indexOrder → simplify）に変換してから、 項一覧と（サイト数が上限以下なら）行列を出力します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpinAlgebraCliRunner implements CommandLineRunner {

    /**
     * spin-algebra の設定値（spin.*）です。
     */
    private final SpinAlgebraProperties properties;

    /**
     * 行列構築バックエンドです。
     */
    private final SpinMatrixBackend matrixBackend;

    /**
     * 正規化と比較に用いる許容誤差です。
     */
    private final Tolerances tolerances;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        log.info("=== spin-algebra start ==={}", properties.toMultilineString());

        int total = properties.getOperators().size();
        for (int i = 0; i < total; i++) {
            SpinAlgebraProperties.OperatorSpec spec = properties.getOperators().get(i);
            log.info("演算子を処理します: name={}（{}/{}）", spec.getName(), i + 1, total);
            process(spec);
        }
        log.info("=== spin-algebra end ===");
    }

    /**
     * 1 つの演算子を構築・正規化し、結果を出力します。
     *
     * @param spec 演算子の定義です
     * @return 正規形の演算子です
     * @throws IllegalStateException 定義が不正な場合に発生します
     */
    SpinOp process(SpinAlgebraProperties.OperatorSpec spec) {
        SpinOp op = build(spec);
        SpinOp canonical = op.indexOrder().simplify(tolerances);
        boolean hermitian = canonical.isHermitian(tolerances);

        log.info("正規形: {}", canonical);
        log.info("項数: {} → {}、エルミート: {}、1-ノルム: {}", op.size(), canonical.size(), hermitian,
                fmt5(canonical.inducedNorm(1)));

        ZMatrixRMaj matrix = null;
        int maxSites = properties.getMatrix().getMaxSites();
        if (canonical.numSites() <= maxSites) {
            matrix = canonical.toMatrix(matrixBackend);
        } else {
            log.warn("サイト数が上限を超えるため行列出力を省略します: name={}, numSites={}, maxSites={}",
                    spec.getName(), canonical.numSites(), maxSites);
        }

        resultWriter.write(spec.getName(), canonical, matrix, hermitian);
        return canonical;
    }

    /**
     * 定義から演算子を構築します。
     *
     * @param spec 演算子の定義です
     * @return 構築した演算子です
     * @throws IllegalStateException スピンやラベルが不正な場合に発生します
     */
    private static SpinOp build(SpinAlgebraProperties.OperatorSpec spec) {
        try {
            SpinOp.Builder builder = SpinOp.builder().spin(Spin.parse(spec.getSpin()));
            if (spec.getNumSites() != null) {
                builder.numSites(spec.getNumSites());
            }
            for (SpinAlgebraProperties.TermSpec t : spec.getTerms()) {
                builder.term(t.getLabel(), t.getReal(), t.getImag());
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                    "演算子の定義が不正です: name=" + spec.getName() + "（" + e.getMessage() + "）", e);
        }
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
