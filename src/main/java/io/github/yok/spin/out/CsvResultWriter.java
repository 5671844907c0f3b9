package io.github.yok.spin.out;

import io.github.yok.spin.core.math.Complex;
import io.github.yok.spin.core.operator.SpinOp;
import io.github.yok.spin.core.term.Term;
import java.io.IOException;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.ejml.data.ZMatrixRMaj;

/**
 * 演算子と行列を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（name は設定ファイル上の演算子名）。
 * </p>
 *
 * <ul>
 * <li>{@code spin_terms_name.csv}（項ラベルと係数）</li>
 * <li>{@code spin_meta_name.csv}（サイト数・スピン・行列の次元・項数・ノルムなど）</li>
 * <li>{@code spin_matrix_name.csv}（行列の非ゼロ要素、行列を渡した場合のみ）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "spin";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 出力先が未指定の場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 演算子の項一覧・メタ情報・行列を出力します。
     *
     * @param name 演算子名です
     * @param operator 出力する演算子です
     * @param matrix 演算子の密行列です（null の場合は行列を出力しません）
     * @param hermitian エルミート判定の結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(String name, SpinOp operator, ZMatrixRMaj matrix, boolean hermitian) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name は必須です");
        }
        if (operator == null) {
            throw new IllegalArgumentException("operator は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 項（ラベル・係数）
            writeTermsCsv(name, operator);

            // 2) メタ（サイト数、スピン、項数、ノルム、エルミート性）
            writeMetaCsv(name, operator, hermitian);

            // 3) 行列（非ゼロ要素のみ）
            if (matrix != null) {
                writeMatrixCsv(name, matrix);
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 項のラベルと係数を出力します。
     *
     * @param name 演算子名です
     * @param operator 演算子です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeTermsCsv(String name, SpinOp operator) throws IOException {
        Path file = outputDir.resolve(buildFileName("terms", name));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("label", "compactLabel", "real", "imag").build().print(w)) {

            for (Map.Entry<Term, Complex> e : operator.termMap().entrySet()) {
                Term term = e.getKey();
                Complex c = e.getValue();
                pr.printRecord(term.label(), term.compactLabel(), c.getReal(), c.getImag());
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param name 演算子名です
     * @param operator 演算子です
     * @param hermitian エルミート判定の結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(String name, SpinOp operator, boolean hermitian)
            throws IOException {
        Path file = outputDir.resolve(buildFileName("meta", name));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("name", name);
            pr.printRecord("numSites", operator.numSites());
            pr.printRecord("spin", operator.spin());
            pr.printRecord("siteDimension", operator.spin().dimension());
            // 行列の次元 d^n
            pr.printRecord("dimension",
                    BigInteger.valueOf(operator.spin().dimension()).pow(operator.numSites()));
            pr.printRecord("termCount", operator.size());
            pr.printRecord("inducedNorm1", operator.inducedNorm(1));
            pr.printRecord("hermitian", hermitian);
        }
    }

    /**
     * 行列の非ゼロ要素を出力します。
     *
     * @param name 演算子名です
     * @param matrix 密行列です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMatrixCsv(String name, ZMatrixRMaj matrix) throws IOException {
        Path file = outputDir.resolve(buildFileName("matrix", name));

        int rows = matrix.getNumRows();
        int cols = matrix.getNumCols();
        double[] data = matrix.data;

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("row", "col", "real", "imag").build().print(w)) {

            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    int index = (r * cols + c) * 2;
                    if (data[index] != 0.0 || data[index + 1] != 0.0) {
                        pr.printRecord(r, c, data[index], data[index + 1]);
                    }
                }
            }
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code spin_terms_heisenberg.csv}
     * </p>
     *
     * @param kind 出力の識別子（terms/meta/matrix）
     * @param name 演算子名です
     * @return ファイル名です
     */
    private static String buildFileName(String kind, String name) {
        return FILE_HEAD + "_" + kind + "_" + name + ".csv";
    }
}
