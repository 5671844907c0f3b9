package io.github.yok.spin.app;

import io.github.yok.spin.core.linearalgebra.EjmlKroneckerSpinMatrixBackend;
import io.github.yok.spin.core.linearalgebra.SpinMatrixBackend;
import io.github.yok.spin.core.operator.Tolerances;
import io.github.yok.spin.out.CsvResultWriter;
import io.github.yok.spin.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 行列バックエンド、許容誤差、結果出力の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class SpinAlgebraConfiguration {

    /**
     * spin-algebra の設定値（spin.*）です。
     */
    private final SpinAlgebraProperties p;

    /**
     * 行列構築バックエンドを生成します。
     *
     * @return EJML の Kronecker 展開バックエンドです
     */
    @Bean
    public SpinMatrixBackend spinMatrixBackend() {
        return new EjmlKroneckerSpinMatrixBackend();
    }

    /**
     * 正規化と比較に用いる許容誤差を生成します。
     *
     * @return 許容誤差です
     */
    @Bean
    public Tolerances tolerances() {
        return Tolerances.of(p.getTolerance().getAtol(), p.getTolerance().getRtol());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return CSV 出力です
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
