package io.github.yok.spin.core.linearalgebra;

import io.github.yok.spin.core.math.Complex;
import io.github.yok.spin.core.math.Spin;
import io.github.yok.spin.core.term.Term;
import java.util.Map;
import org.ejml.data.ZMatrixRMaj;

/**
 * 項の重み付き和から密行列を構築するバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリや構築方法（密・疎）を差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface SpinMatrixBackend {

    /**
     * {@code Σ c_t M(t)} の d^n × d^n 密行列を構築して返します。
     *
     * <p>
     * サイト 0 を Kronecker 積の最も左（最上位桁）に置きます。
     * </p>
     *
     * @param terms 項から係数への写像です（サイトはすべて numSites 未満であること）
     * @param numSites サイト数 n です（0 以上）
     * @param spin スピン量子数です
     * @return 新しく確保した密行列です
     * @throws IllegalArgumentException 次元が配列で表現できないほど大きい場合に発生します
     */
    ZMatrixRMaj buildMatrix(Map<Term, Complex> terms, int numSites, Spin spin);
}
