package io.github.yok.spin.out;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.spin.core.operator.SpinOp;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvResultWriterTest {

    @TempDir
    Path dir;

    private final SpinOp heisenberg = SpinOp.builder().term("X_0 X_1", 1).term("Y_0 Y_1", 1)
            .term("Z_0^2 Z_1", 0, -0.5).build();

    @Test
    void 項とメタ情報と行列を出力する() throws IOException {
        ResultWriter writer = new CsvResultWriter(dir.toString());

        writer.write("heis", heisenberg, heisenberg.toMatrix(), false);

        List<String> terms = read("spin_terms_heis.csv");
        assertThat(terms).containsExactly("label,compactLabel,real,imag",
                "X_0 X_1,X_0 X_1,1.0,0.0", "Y_0 Y_1,Y_0 Y_1,1.0,0.0",
                "Z_0^2 Z_1,Z_0^2 Z_1,0.0,-0.5");

        List<String> meta = read("spin_meta_heis.csv");
        assertThat(meta).contains("key,value", "name,heis", "numSites,2", "spin,1/2",
                "siteDimension,2", "dimension,4", "termCount,3", "inducedNorm1,2.5",
                "hermitian,false");

        List<String> matrix = read("spin_matrix_heis.csv");
        assertThat(matrix.get(0)).isEqualTo("row,col,real,imag");
        assertThat(matrix).contains("1,2,0.5,0.0", "2,1,0.5,0.0");
        assertThat(matrix).noneMatch(line -> line.startsWith("0,1,"));
    }

    @Test
    void 行列が無い場合は行列ファイルを作らない() throws IOException {
        new CsvResultWriter(dir.resolve("nested").toString()).write("no-matrix", heisenberg, null,
                true);

        assertThat(dir.resolve("nested").resolve("spin_terms_no-matrix.csv")).exists();
        assertThat(dir.resolve("nested").resolve("spin_matrix_no-matrix.csv")).doesNotExist();
    }

    @Test
    void 引数の検証() {
        assertThatThrownBy(() -> new CsvResultWriter(""))
                .isInstanceOf(IllegalArgumentException.class);

        CsvResultWriter writer = new CsvResultWriter(dir.toString());
        assertThatThrownBy(() -> writer.write("", heisenberg, null, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> writer.write("x", null, null, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 出力先に書けない場合は例外() throws IOException {
        Path file = Files.createFile(dir.resolve("occupied"));
        CsvResultWriter writer = new CsvResultWriter(file.toString());

        assertThatThrownBy(() -> writer.write("x", heisenberg, null, true))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    private List<String> read(String fileName) throws IOException {
        return Files.readAllLines(dir.resolve(fileName), StandardCharsets.UTF_8);
    }
}
