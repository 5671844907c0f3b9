package io.github.yok.spin.app;

import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * spin-algebra の設定値（spin.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI で構築する演算子と出力先を指定します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "spin")
public class SpinAlgebraProperties {

    /**
     * 構築する演算子の一覧です。
     */
    @Valid
    @NotEmpty
    private List<OperatorSpec> operators = new ArrayList<>();

    /**
     * 許容誤差の設定です。
     */
    @Valid
    private Tolerance tolerance = new Tolerance();

    /**
     * 行列出力の設定です。
     */
    @Valid
    private Matrix matrix = new Matrix();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "spin")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "tolerance",
                // atol: 絶対許容誤差
                "atol", tolerance.getAtol(),
                // rtol: 相対許容誤差
                "rtol", tolerance.getRtol());

        appendSection(sb, nl, "matrix",
                // maxSites: 行列を出力するサイト数の上限
                "maxSites", matrix.getMaxSites());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", output.getDir());

        for (OperatorSpec op : operators) {
            appendSection(sb, nl, "operator[" + op.getName() + "]",
                    "spin", op.getSpin(),
                    "numSites", op.getNumSites() == null ? "auto" : op.getNumSites(),
                    "terms", op.getTerms().size());
        }

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    /**
     * 1 つの演算子の定義です。
     */
    @Data
    public static class OperatorSpec {

        /**
         * 演算子名です（出力ファイル名に使用します）。
         */
        @NotEmpty
        private String name;

        /**
         * スピン量子数です（"1/2", "1", "3/2" など）。
         */
        @NotEmpty
        private String spin = "1/2";

        /**
         * サイト数です。未指定の場合はラベル中の最大サイト + 1 とします。
         */
        private Integer numSites;

        /**
         * 項の一覧です。
         */
        @Valid
        @NotEmpty
        private List<TermSpec> terms = new ArrayList<>();
    }

    /**
     * 項（ラベルと係数）の定義です。
     */
    @Data
    public static class TermSpec {

        /**
         * 項ラベルです（例: "X_0 Y_1^2"）。空文字は恒等項です。
         */
        @NotNull
        private String label;

        /**
         * 係数の実部です。
         */
        private double real;

        /**
         * 係数の虚部です。
         */
        private double imag;
    }

    @Data
    public static class Tolerance {

        /**
         * 絶対許容誤差です。
         */
        private double atol = 1e-12;

        /**
         * 相対許容誤差です。
         */
        private double rtol = 0.0;
    }

    @Data
    public static class Matrix {

        /**
         * 行列を出力するサイト数の上限です。
         */
        private int maxSites = 8;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "out";
    }
}
