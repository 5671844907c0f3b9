package io.github.yok.spin.out;

import io.github.yok.spin.core.operator.SpinOp;
import org.ejml.data.ZMatrixRMaj;

/**
 * 正規化した演算子と、その行列を出力する処理のインタフェースです。
 *
 * <p>
 * 設定ファイルに記述した演算子ごとに呼び出されることを前提とし、出力の命名に用いる演算子名を受け取ります。
 * </p>
 */
public interface ResultWriter {

    /**
     * 演算子の項一覧・メタ情報・行列を出力します。
     *
     * @param name 演算子名です（ファイル名に使用します）
     * @param operator 出力する演算子（通常は正規形）です
     * @param matrix 演算子の密行列です（行列出力を省略する場合は null）
     * @param hermitian エルミート判定の結果です
     */
    void write(String name, SpinOp operator, ZMatrixRMaj matrix, boolean hermitian);
}
