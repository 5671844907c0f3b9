package io.github.yok.spin.core.linearalgebra;

import com.google.common.base.Preconditions;
import io.github.yok.spin.core.label.Generator;
import io.github.yok.spin.core.math.Spin;
import java.util.EnumMap;
import java.util.Map;
import org.ejml.data.ZMatrixRMaj;

/**
 * スピン s の 1 サイト演算子行列（S_x, S_y, S_z）を生成するクラスです。
 *
 * <p>
 * 基底は {@code m = s, s-1, ..., -s} の順で、行列インデックス i は {@code m = s - i} に対応します。
 * </p>
 * <ul>
 * <li>S+[i][i+1] = sqrt(s(s+1) - m(m+1))（m = s - i - 1）</li>
 * <li>X = (S+ + S-) / 2</li>
 * <li>Y = (S+ - S-) / (2i)</li>
 * <li>Z = diag(s, s-1, ..., -s)</li>
 * </ul>
 */
public final class SpinMatrices {

    private SpinMatrices() {}

    /**
     * 指定した生成子の d×d 行列を返します。
     *
     * @param spin スピン量子数です（null 不可）
     * @param generator 生成子です（null 不可）
     * @return 新しく確保した d×d 行列です
     */
    public static ZMatrixRMaj of(Spin spin, Generator generator) {
        Preconditions.checkNotNull(spin, "spin は null 不可です");
        Preconditions.checkNotNull(generator, "generator は null 不可です");

        int d = spin.dimension();
        double s = spin.value();
        ZMatrixRMaj matrix = new ZMatrixRMaj(d, d);

        if (generator == Generator.Z) {
            for (int i = 0; i < d; i++) {
                matrix.set(i, i, s - i, 0.0);
            }
            return matrix;
        }

        for (int i = 0; i + 1 < d; i++) {
            double m = s - i - 1;
            double raising = Math.sqrt(s * (s + 1) - m * (m + 1));
            if (generator == Generator.X) {
                // X は実対称です。
                matrix.set(i, i + 1, 0.5 * raising, 0.0);
                matrix.set(i + 1, i, 0.5 * raising, 0.0);
            } else {
                // Y = -i/2 (S+ - S-) は純虚数の反対称です。
                matrix.set(i, i + 1, 0.0, -0.5 * raising);
                matrix.set(i + 1, i, 0.0, 0.5 * raising);
            }
        }
        return matrix;
    }

    /**
     * 3 つの生成子すべての行列を返します。
     *
     * @param spin スピン量子数です（null 不可）
     * @return 生成子から行列への写像です
     */
    public static Map<Generator, ZMatrixRMaj> all(Spin spin) {
        Map<Generator, ZMatrixRMaj> matrices = new EnumMap<>(Generator.class);
        for (Generator g : Generator.values()) {
            matrices.put(g, of(spin, g));
        }
        return matrices;
    }
}
