package io.github.yok.spin.core.linearalgebra;

import com.google.common.base.Preconditions;
import io.github.yok.spin.core.label.Factor;
import io.github.yok.spin.core.label.Generator;
import io.github.yok.spin.core.math.Complex;
import io.github.yok.spin.core.math.Spin;
import io.github.yok.spin.core.term.Term;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;

/**
 * EJML の複素密行列を用いて、項の重み付き和を d^n × d^n 行列に展開するクラスです。
 *
 * <p>
 * 異なるサイトの因子は可換なので、項の行列は「サイトごとに因子を順に掛けた d×d 行列」の Kronecker 積に等しくなります。 本実装は d×d
 * の積だけを実際に計算し、Kronecker 構造は再帰的にたどって非ゼロ要素だけを出力行列へ足し込みます。 因子ごとの全サイズ行列は確保しません。
 * </p>
 */
@Slf4j
public final class EjmlKroneckerSpinMatrixBackend implements SpinMatrixBackend {

    /**
     * 出力配列（実部・虚部の 2 倍長）の上限要素数です。
     */
    private static final long MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8L;

    /**
     * {@code Σ c_t M(t)} の d^n × d^n 密行列を構築して返します。
     *
     * @param terms 項から係数への写像です（null 不可）
     * @param numSites サイト数 n です（0 以上）
     * @param spin スピン量子数です（null 不可）
     * @return 新しく確保した密行列です
     * @throws IllegalArgumentException 引数が不正、または次元が大きすぎる場合に発生します
     */
    @Override
    public ZMatrixRMaj buildMatrix(Map<Term, Complex> terms, int numSites, Spin spin) {
        Preconditions.checkNotNull(terms, "terms は null 不可です");
        Preconditions.checkNotNull(spin, "spin は null 不可です");
        Preconditions.checkArgument(numSites >= 0, "numSites は 0 以上が必要です: %s", numSites);

        int d = spin.dimension();
        int dim = checkedDimension(d, numSites);

        log.debug("行列を構築します。spin={}、サイト数={}、次元={}、項数={}", spin, numSites, dim,
                terms.size());

        Map<Generator, ZMatrixRMaj> generators = SpinMatrices.all(spin);
        ZMatrixRMaj out = new ZMatrixRMaj(dim, dim);

        for (Map.Entry<Term, Complex> entry : terms.entrySet()) {
            Complex coefficient = entry.getValue();
            if (coefficient.isZero()) {
                continue;
            }

            // サイトごとに因子を順に掛けた d×d 行列（null は恒等行列）
            ZMatrixRMaj[] perSite = perSiteProducts(entry.getKey(), numSites, generators);

            accumulate(out, perSite, 0, 0, 0, coefficient.getReal(), coefficient.getImag(), d,
                    dim);
        }
        return out;
    }

    /**
     * 項の因子をサイトごとに左から順に掛け合わせます。
     *
     * @param term 項です
     * @param numSites サイト数です
     * @param generators 生成子の d×d 行列です
     * @return サイトごとの積です（因子の無いサイトは null）
     */
    private static ZMatrixRMaj[] perSiteProducts(Term term, int numSites,
            Map<Generator, ZMatrixRMaj> generators) {
        ZMatrixRMaj[] perSite = new ZMatrixRMaj[numSites];
        for (Factor factor : term.factors()) {
            int site = factor.getSite();
            if (site >= numSites) {
                throw new IllegalArgumentException(
                        "サイトインデックスが numSites 以上です: " + site + " >= " + numSites);
            }
            if (factor.getExponent() == 0) {
                continue;
            }
            ZMatrixRMaj g = power(generators.get(factor.getGenerator()), factor.getExponent());
            if (perSite[site] == null) {
                perSite[site] = g;
            } else {
                ZMatrixRMaj product = new ZMatrixRMaj(g.getNumRows(), g.getNumCols());
                CommonOps_ZDRM.mult(perSite[site], g, product);
                perSite[site] = product;
            }
        }
        return perSite;
    }

    /**
     * d×d 行列の k 乗を二乗法で計算します。
     *
     * @param g 底の行列です
     * @param k 指数です（1 以上）
     * @return 新しく確保した {@code g^k} です
     */
    private static ZMatrixRMaj power(ZMatrixRMaj g, int k) {
        int d = g.getNumRows();
        ZMatrixRMaj result = null;
        ZMatrixRMaj base = new ZMatrixRMaj(g);
        int e = k;
        while (true) {
            if ((e & 1) != 0) {
                if (result == null) {
                    result = new ZMatrixRMaj(base);
                } else {
                    ZMatrixRMaj next = new ZMatrixRMaj(d, d);
                    CommonOps_ZDRM.mult(result, base, next);
                    result = next;
                }
            }
            e >>>= 1;
            if (e == 0) {
                return result;
            }
            ZMatrixRMaj squared = new ZMatrixRMaj(d, d);
            CommonOps_ZDRM.mult(base, base, squared);
            base = squared;
        }
    }

    /**
     * Kronecker 積の要素を再帰的にたどり、非ゼロ要素だけを出力行列へ足し込みます。
     *
     * <p>
     * site 番目のサイトで行・列インデックスの桁 (a, b) を選び、 {@code row = row * d + a}、{@code col = col * d + b}
     * として次のサイトへ進みます。
     * </p>
     *
     * @param out 出力行列です
     * @param perSite サイトごとの d×d 行列です（null は恒等行列）
     * @param site 現在のサイトです
     * @param row ここまでの行インデックスです
     * @param col ここまでの列インデックスです
     * @param re ここまでの積の実部です
     * @param im ここまでの積の虚部です
     * @param d 1 サイトの次元です
     * @param dim 全体の次元です
     */
    private static void accumulate(ZMatrixRMaj out, ZMatrixRMaj[] perSite, int site, int row,
            int col, double re, double im, int d, int dim) {
        if (site == perSite.length) {
            int index = (row * dim + col) * 2;
            out.data[index] += re;
            out.data[index + 1] += im;
            return;
        }

        ZMatrixRMaj m = perSite[site];
        if (m == null) {
            for (int a = 0; a < d; a++) {
                accumulate(out, perSite, site + 1, row * d + a, col * d + a, re, im, d, dim);
            }
            return;
        }

        double[] data = m.data;
        for (int a = 0; a < d; a++) {
            for (int b = 0; b < d; b++) {
                int index = (a * d + b) * 2;
                double mr = data[index];
                double mi = data[index + 1];
                if (mr == 0.0 && mi == 0.0) {
                    continue;
                }
                accumulate(out, perSite, site + 1, row * d + a, col * d + b,
                        re * mr - im * mi, re * mi + im * mr, d, dim);
            }
        }
    }

    /**
     * d^n を計算し、密行列として確保できる大きさかを検証します。
     *
     * @param d 1 サイトの次元です
     * @param numSites サイト数です
     * @return d^n です
     * @throws IllegalArgumentException 配列で表現できない大きさの場合に発生します
     */
    private static int checkedDimension(int d, int numSites) {
        long dim = 1L;
        for (int i = 0; i < numSites; i++) {
            dim *= d;
            if (dim * dim * 2L > MAX_ARRAY_LENGTH) {
                throw new IllegalArgumentException("行列が大きすぎます: d=" + d + ", numSites="
                        + numSites + "（呼び出し側で numSites を制限してください）");
            }
        }
        return (int) dim;
    }
}
