package io.github.yok.spin.core.operator;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import io.github.yok.spin.core.label.MalformedLabelException;
import io.github.yok.spin.core.linearalgebra.EjmlKroneckerSpinMatrixBackend;
import io.github.yok.spin.core.linearalgebra.SpinMatrixBackend;
import io.github.yok.spin.core.math.Complex;
import io.github.yok.spin.core.math.Spin;
import io.github.yok.spin.core.term.Term;
import io.github.yok.spin.core.term.TermAccumulator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.EqualsAndHashCode;
import org.ejml.data.ZMatrixRMaj;

/**
 * サイト付き生成子列（項）の重み付き和で表されるスピン演算子です。
 *
 * <p>
 * 項から複素係数への写像（挿入順を保持）と、サイト数 numSites、スピン量子数 spin を持ちます。 インスタンスは不変で、すべての演算は新しいインスタンスを返します。
 * </p>
 *
 * <p>
 * {@link #equals(Object)} は正規化を行わない厳密な構造比較です（挿入順は無視します）。 演算子として等しいかどうかは
 * {@link #equiv(SpinOp, Tolerances)} で、両辺の正規形を許容誤差付きで比較します。
 * </p>
 */
@EqualsAndHashCode(of = {"terms", "numSites", "spin"})
public final class SpinOp {

    /**
     * 既定の行列構築バックエンドです。
     */
    private static final SpinMatrixBackend DEFAULT_BACKEND = new EjmlKroneckerSpinMatrixBackend();

    /**
     * 項から係数への写像（挿入順）です。
     */
    private final ImmutableMap<Term, Complex> terms;

    /**
     * サイト数です。
     */
    private final int numSites;

    /**
     * スピン量子数です。
     */
    private final Spin spin;

    private SpinOp(ImmutableMap<Term, Complex> terms, int numSites, Spin spin) {
        this.terms = terms;
        this.numSites = numSites;
        this.spin = spin;
    }

    /**
     * 検証済みの項写像から演算子を生成します。
     *
     * @param terms 項から係数への写像です
     * @param numSites サイト数です
     * @param spin スピン量子数です
     * @return 演算子です
     */
    static SpinOp create(ImmutableMap<Term, Complex> terms, int numSites, Spin spin) {
        return new SpinOp(terms, numSites, spin);
    }

    // ---------------------------------------------------------------------
    // 生成
    // ---------------------------------------------------------------------

    /**
     * ラベルから係数への写像で演算子を生成します（spin = 1/2、numSites は推定します）。
     *
     * @param labels ラベルから係数への写像です
     * @return 演算子です
     * @throws MalformedLabelException ラベルが文法に合わない場合に発生します
     */
    public static SpinOp of(Map<String, Complex> labels) {
        return of(labels, -1, Spin.HALF);
    }

    /**
     * ラベルから係数への写像とサイト数で演算子を生成します（spin = 1/2）。
     *
     * @param labels ラベルから係数への写像です
     * @param numSites サイト数です
     * @return 演算子です
     * @throws MalformedLabelException ラベルが文法に合わない、またはサイトが numSites 以上の場合に発生します
     */
    public static SpinOp of(Map<String, Complex> labels, int numSites) {
        Preconditions.checkArgument(numSites >= 0, "numSites は 0 以上が必要です: %s", numSites);
        return of(labels, numSites, Spin.HALF);
    }

    /**
     * ラベルから係数への写像、サイト数、スピン量子数で演算子を生成します。
     *
     * <p>
     * numSites に負の値を渡した場合は、最大サイトインデックス + 1（サイトが無ければ 0）を用います。 同じ項に解析されるラベルの係数は合算します。
     * </p>
     *
     * @param labels ラベルから係数への写像です（null 不可）
     * @param numSites サイト数です（負の場合は推定）
     * @param spin スピン量子数です（null 不可）
     * @return 演算子です
     * @throws MalformedLabelException ラベルが文法に合わない、またはサイトが numSites 以上の場合に発生します
     */
    public static SpinOp of(Map<String, Complex> labels, int numSites, Spin spin) {
        Preconditions.checkNotNull(labels, "labels は null 不可です");
        TermAccumulator acc = new TermAccumulator(labels.size());
        labels.forEach((label, coefficient) -> {
            Preconditions.checkNotNull(coefficient, "係数が null です: label='%s'", label);
            acc.add(Term.parse(label), coefficient);
        });
        return validated(acc.build(), numSites, spin);
    }

    /**
     * {@link #terms()} の出力から演算子を再構成します（spin = 1/2、numSites は推定します）。
     *
     * @param terms （因子列, 係数）の組の列です
     * @return 演算子です
     */
    public static SpinOp fromTerms(Iterable<SpinTerm> terms) {
        return fromTerms(terms, -1, Spin.HALF);
    }

    /**
     * {@link #terms()} の出力から演算子を再構成します。
     *
     * @param terms （因子列, 係数）の組の列です（null 不可）
     * @param numSites サイト数です（負の場合は推定）
     * @param spin スピン量子数です（null 不可）
     * @return 演算子です
     * @throws MalformedLabelException サイトが numSites 以上の場合に発生します
     */
    public static SpinOp fromTerms(Iterable<SpinTerm> terms, int numSites, Spin spin) {
        Preconditions.checkNotNull(terms, "terms は null 不可です");
        TermAccumulator acc = new TermAccumulator();
        for (SpinTerm t : terms) {
            acc.add(Term.of(t.getFactors()), t.getCoefficient());
        }
        return validated(acc.build(), numSites, spin);
    }

    /**
     * サイト範囲を検証して演算子を生成します。
     *
     * @param terms 項写像です
     * @param numSites サイト数です（負の場合は推定）
     * @param spin スピン量子数です
     * @return 演算子です
     * @throws MalformedLabelException サイトが numSites 以上の場合に発生します
     */
    private static SpinOp validated(ImmutableMap<Term, Complex> terms, int numSites, Spin spin) {
        Preconditions.checkNotNull(spin, "spin は null 不可です");
        int maxSite = -1;
        for (Term t : terms.keySet()) {
            maxSite = Math.max(maxSite, t.maxSite());
        }
        int n = (numSites < 0) ? maxSite + 1 : numSites;
        if (maxSite >= n) {
            throw new MalformedLabelException(
                    "サイトインデックスが numSites の範囲外です: site=" + maxSite + ", numSites=" + n);
        }
        return new SpinOp(terms, n, spin);
    }

    /**
     * ゼロ演算子（項を持たない、サイト数 0、spin = 1/2）を返します。
     *
     * @return ゼロ演算子です
     */
    public static SpinOp zero() {
        return zero(0, Spin.HALF);
    }

    /**
     * 指定したレジスタ上のゼロ演算子を返します。
     *
     * @param numSites サイト数です（0 以上）
     * @param spin スピン量子数です（null 不可）
     * @return ゼロ演算子です
     */
    public static SpinOp zero(int numSites, Spin spin) {
        Preconditions.checkArgument(numSites >= 0, "numSites は 0 以上が必要です: %s", numSites);
        Preconditions.checkNotNull(spin, "spin は null 不可です");
        return new SpinOp(ImmutableMap.of(), numSites, spin);
    }

    /**
     * 単位演算子（係数 1 の恒等項、サイト数 0、spin = 1/2）を返します。
     *
     * @return 単位演算子です
     */
    public static SpinOp one() {
        return one(0, Spin.HALF);
    }

    /**
     * 指定したレジスタ上の単位演算子を返します。
     *
     * @param numSites サイト数です（0 以上）
     * @param spin スピン量子数です（null 不可）
     * @return 単位演算子です
     */
    public static SpinOp one(int numSites, Spin spin) {
        Preconditions.checkArgument(numSites >= 0, "numSites は 0 以上が必要です: %s", numSites);
        Preconditions.checkNotNull(spin, "spin は null 不可です");
        return new SpinOp(ImmutableMap.of(Term.identity(), Complex.ONE), numSites, spin);
    }

    /**
     * 演算子の総和を返します。
     *
     * @param operators 演算子の列です（1 つ以上、すべて同じレジスタ）
     * @return 総和です
     * @throws IllegalArgumentException 空の場合に発生します
     * @throws DimensionMismatchException レジスタが一致しない場合に発生します
     */
    public static SpinOp sum(Iterable<SpinOp> operators) {
        Preconditions.checkNotNull(operators, "operators は null 不可です");
        SpinOp total = null;
        for (SpinOp op : operators) {
            total = (total == null) ? op : total.add(op);
        }
        Preconditions.checkArgument(total != null, "operators が空です");
        return total;
    }

    /**
     * ビルダーを返します。
     *
     * @return ビルダーです
     */
    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // 参照
    // ---------------------------------------------------------------------

    /**
     * サイト数を返します。
     *
     * @return サイト数です
     */
    public int numSites() {
        return numSites;
    }

    /**
     * スピン量子数を返します。
     *
     * @return スピン量子数です
     */
    public Spin spin() {
        return spin;
    }

    /**
     * 項数を返します。
     *
     * @return 項数です
     */
    public int size() {
        return terms.size();
    }

    /**
     * 項から係数への不変写像（挿入順）を返します。
     *
     * @return 項写像です
     */
    public ImmutableMap<Term, Complex> termMap() {
        return terms;
    }

    /**
     * ラベルから係数への不変写像（挿入順）を返します。
     *
     * @return ラベル写像です
     */
    public ImmutableMap<String, Complex> labels() {
        ImmutableMap.Builder<String, Complex> b = ImmutableMap.builderWithExpectedSize(size());
        terms.forEach((term, coefficient) -> b.put(term.label(), coefficient));
        return b.build();
    }

    /**
     * 指定したラベルの係数を返します（項が無い場合は 0）。
     *
     * @param label ラベル文字列です
     * @return 係数です
     */
    public Complex coefficientOf(String label) {
        return terms.getOrDefault(Term.parse(label), Complex.ZERO);
    }

    /**
     * （因子列, 係数）の組を挿入順に流す Stream を返します。
     *
     * <p>
     * 呼び出すたびに新しい Stream を返すため、何度でも先頭から走査できます。 因子の指数は展開しません（{@code X_1^2}
     * はそのまま渡されます）。 指数 1 の因子だけが必要な場合は {@link SpinTerm#expanded()} を使用してください。
     * </p>
     *
     * @return 組の Stream です
     */
    public Stream<SpinTerm> terms() {
        return terms.entrySet().stream()
                .map(e -> new SpinTerm(e.getKey().factors(), e.getValue()));
    }

    // ---------------------------------------------------------------------
    // 代数演算
    // ---------------------------------------------------------------------

    /**
     * 和を返します（項の和集合、共通項の係数は加算します）。
     *
     * @param other 加える演算子です
     * @return 和です
     * @throws DimensionMismatchException サイト数またはスピンが異なる場合に発生します
     */
    public SpinOp add(SpinOp other) {
        requireSameRegister(other, "add");
        return new SpinOp(new TermAccumulator(size() + other.size()).addAll(terms)
                .addAll(other.terms).build(), numSites, spin);
    }

    /**
     * 差を返します。
     *
     * @param other 引く演算子です
     * @return 差です
     * @throws DimensionMismatchException サイト数またはスピンが異なる場合に発生します
     */
    public SpinOp subtract(SpinOp other) {
        requireSameRegister(other, "subtract");
        return add(other.negate());
    }

    /**
     * 全係数に複素数を掛けます。
     *
     * @param factor 掛ける複素数です（null 不可）
     * @return スカラー倍した演算子です
     */
    public SpinOp scale(Complex factor) {
        Preconditions.checkNotNull(factor, "factor は null 不可です");
        ImmutableMap.Builder<Term, Complex> b = ImmutableMap.builderWithExpectedSize(size());
        terms.forEach((term, coefficient) -> b.put(term, coefficient.times(factor)));
        return new SpinOp(b.build(), numSites, spin);
    }

    /**
     * 全係数に実数を掛けます。
     *
     * @param factor 掛ける実数です
     * @return スカラー倍した演算子です
     */
    public SpinOp scale(double factor) {
        return scale(Complex.ofReal(factor));
    }

    /**
     * 全係数を複素数で割ります。
     *
     * @param divisor 除数です（0 不可）
     * @return 割った演算子です
     * @throws ArithmeticException 除数が 0 の場合に発生します
     */
    public SpinOp divide(Complex divisor) {
        Preconditions.checkNotNull(divisor, "divisor は null 不可です");
        return scale(Complex.ONE.dividedBy(divisor));
    }

    /**
     * 全係数を実数で割ります。
     *
     * @param divisor 除数です（0 不可）
     * @return 割った演算子です
     */
    public SpinOp divide(double divisor) {
        return divide(Complex.ofReal(divisor));
    }

    /**
     * 符号を反転した演算子を返します。
     *
     * @return -1 倍した演算子です
     */
    public SpinOp negate() {
        return scale(Complex.MINUS_ONE);
    }

    /**
     * 複素共役（行列の要素ごとの複素共役）を返します。
     *
     * <p>
     * 係数を複素共役にし、さらに Y 因子 1 個ごとに -1 を掛けます（Y 行列は純虚数で、conj(Y) = -Y です）。 項の構造は変えません。
     * </p>
     *
     * @return 複素共役です
     */
    public SpinOp conjugate() {
        ImmutableMap.Builder<Term, Complex> b = ImmutableMap.builderWithExpectedSize(size());
        terms.forEach((term, coefficient) -> b.put(term,
                withYParity(coefficient.conjugate(), term)));
        return new SpinOp(b.build(), numSites, spin);
    }

    /**
     * 転置を返します。
     *
     * <p>
     * 各項の因子を逆順にし、Y 因子 1 個ごとに -1 を掛けます（Yᵀ = -Y、Xᵀ = X、Zᵀ = Z です）。
     * </p>
     *
     * @return 転置です
     */
    public SpinOp transpose() {
        TermAccumulator acc = new TermAccumulator(size());
        terms.forEach((term, coefficient) -> acc.add(term.reversed(),
                withYParity(coefficient, term)));
        return new SpinOp(acc.build(), numSites, spin);
    }

    /**
     * エルミート共役（conjugate と transpose の合成）を返します。
     *
     * <p>
     * 生成子はそれぞれエルミートなので、因子を逆順にして係数を複素共役にするだけです（Y の符号は 2 回反転して打ち消し合います）。
     * </p>
     *
     * @return エルミート共役です
     */
    public SpinOp adjoint() {
        TermAccumulator acc = new TermAccumulator(size());
        terms.forEach((term, coefficient) -> acc.add(term.reversed(), coefficient.conjugate()));
        return new SpinOp(acc.build(), numSites, spin);
    }

    /**
     * 演算子積 {@code this · other}（this を左に置く合成）を返します。
     *
     * <p>
     * 全ての項の組 (tA, tB) について、因子列を連結した項 {@code tA ++ tB} に係数 {@code cA * cB} を足し込みます。 正規化は行いません。
     * </p>
     *
     * @param other 右側の演算子です
     * @return 合成した演算子です
     * @throws DimensionMismatchException サイト数またはスピンが異なる場合に発生します
     */
    public SpinOp compose(SpinOp other) {
        requireSameRegister(other, "compose");
        return new SpinOp(product(this, other, 0), numSites, spin);
    }

    /**
     * テンソル積 {@code this ⊗ other} を返します。
     *
     * <p>
     * other のサイトは this.numSites だけずらして後ろに置き、サイト数は両者の和になります。 行列としては
     * {@code kron(this, other)} に一致します。
     * </p>
     *
     * @param other 右側の演算子です
     * @return テンソル積です
     * @throws DimensionMismatchException スピンが異なる場合に発生します
     */
    public SpinOp tensor(SpinOp other) {
        Preconditions.checkNotNull(other, "other は null 不可です");
        if (!spin.equals(other.spin)) {
            throw new DimensionMismatchException(
                    "tensor: スピン量子数が一致しません: " + spin + " vs " + other.spin);
        }
        return new SpinOp(product(this, other, numSites), numSites + other.numSites, spin);
    }

    /**
     * 逆順のテンソル積 {@code other ⊗ this} を返します。
     *
     * @param other 左側に置く演算子です
     * @return テンソル積です
     * @throws DimensionMismatchException スピンが異なる場合に発生します
     */
    public SpinOp expand(SpinOp other) {
        Preconditions.checkNotNull(other, "other は null 不可です");
        return other.tensor(this);
    }

    /**
     * 項の直積を計算します。
     *
     * @param left 左側です
     * @param right 右側です
     * @param rightOffset 右側のサイトをずらす量です
     * @return 項写像です
     */
    private static ImmutableMap<Term, Complex> product(SpinOp left, SpinOp right,
            int rightOffset) {
        TermAccumulator acc = new TermAccumulator(left.size() * right.size());
        for (Map.Entry<Term, Complex> a : left.terms.entrySet()) {
            for (Map.Entry<Term, Complex> b : right.terms.entrySet()) {
                acc.add(a.getKey().concat(b.getKey().shiftSites(rightOffset)),
                        a.getValue().times(b.getValue()));
            }
        }
        return acc.build();
    }

    // ---------------------------------------------------------------------
    // 正規化
    // ---------------------------------------------------------------------

    /**
     * 既定の許容誤差で正規化（指数展開・併合・ゼロ除去）した演算子を返します。
     *
     * @return 正規化した演算子です
     */
    public SpinOp simplify() {
        return simplify(Tolerances.DEFAULT);
    }

    /**
     * 正規化（指数展開・併合・ゼロ除去）した演算子を返します。
     *
     * @param tolerances 許容誤差です
     * @return 正規化した演算子です
     */
    public SpinOp simplify(Tolerances tolerances) {
        return SpinOpCanonicalizer.simplify(this, tolerances);
    }

    /**
     * 各項の因子をサイト順に安定ソートした演算子を返します。
     *
     * @return サイト順に並べた演算子です
     */
    public SpinOp indexOrder() {
        return SpinOpCanonicalizer.indexOrder(this);
    }

    /**
     * サイトインデックスを置換した演算子を返します（サイト i は permutation[i] になります）。
     *
     * @param permutation 長さ numSites の置換です
     * @return 置換した演算子です
     * @throws InvalidPermutationException 長さが異なる、または全単射でない場合に発生します
     */
    public SpinOp permuteIndices(int... permutation) {
        return SpinOpCanonicalizer.permuteIndices(this, permutation);
    }

    /**
     * 既定の許容誤差で小さな実部・虚部を 0 に丸めた演算子を返します。
     *
     * @return 丸めた演算子です
     */
    public SpinOp chop() {
        return chop(Tolerances.DEFAULT.getAtol());
    }

    /**
     * 絶対値が atol 以下の実部・虚部を 0 に丸め、0 になった項を取り除いた演算子を返します。
     *
     * @param atol 丸めの閾値です
     * @return 丸めた演算子です
     */
    public SpinOp chop(double atol) {
        return SpinOpCanonicalizer.chop(this, atol);
    }

    /**
     * 項を全順序（サイト, 生成子, 指数 の辞書式）で並べ替えた演算子を返します。
     *
     * @return 並べ替えた演算子です
     */
    public SpinOp sort() {
        return SpinOpCanonicalizer.sort(this);
    }

    // ---------------------------------------------------------------------
    // 判定
    // ---------------------------------------------------------------------

    /**
     * 正規形がゼロ演算子かどうかを返します。
     *
     * @return ゼロ演算子の場合は true です
     */
    public boolean isZero() {
        return simplify().terms.isEmpty();
    }

    /**
     * 正規形が単位演算子かどうかを返します。
     *
     * @return 単位演算子の場合は true です
     */
    public boolean isOne() {
        return simplify().equals(one(numSites, spin));
    }

    /**
     * 既定の許容誤差で等価判定します。
     *
     * @param other 比較対象です
     * @return 等価な場合は true です
     */
    public boolean equiv(SpinOp other) {
        return equiv(other, Tolerances.DEFAULT);
    }

    /**
     * 両辺の正規形（indexOrder の後に simplify）を許容誤差付きで比較します。
     *
     * <p>
     * サイト数は比較しません。正規形の項と係数が一致すれば、0 サイトの {@link #zero()} や
     * {@link #one()} とも等価になります。 スピン量子数が異なる場合は false を返します（例外は発生しません）。
     * </p>
     *
     * @param other 比較対象です
     * @param tolerances 許容誤差です
     * @return 等価な場合は true です
     */
    public boolean equiv(SpinOp other, Tolerances tolerances) {
        Preconditions.checkNotNull(tolerances, "tolerances は null 不可です");
        if (other == null || !spin.equals(other.spin)) {
            return false;
        }
        Map<Term, Complex> a = indexOrder().simplify(tolerances).terms;
        Map<Term, Complex> b = other.indexOrder().simplify(tolerances).terms;
        for (Term term : Sets.union(a.keySet(), b.keySet())) {
            Complex ca = a.getOrDefault(term, Complex.ZERO);
            Complex cb = b.getOrDefault(term, Complex.ZERO);
            if (!ca.isCloseTo(cb, tolerances.getAtol(), tolerances.getRtol())) {
                return false;
            }
        }
        return true;
    }

    /**
     * 既定の許容誤差でエルミートかどうかを判定します。
     *
     * @return エルミートの場合は true です
     */
    public boolean isHermitian() {
        return isHermitian(Tolerances.DEFAULT);
    }

    /**
     * エルミート共役と記号的に等価かどうかを判定します。
     *
     * <p>
     * 同一サイト上の生成子の積は簡約しないため、これは十分条件です。 厳密な判定が必要な場合は行列で比較してください。
     * </p>
     *
     * @param tolerances 許容誤差です
     * @return エルミートの場合は true です
     */
    public boolean isHermitian(Tolerances tolerances) {
        return equiv(adjoint(), tolerances);
    }

    /**
     * 係数の誘導ノルム {@code (Σ |c|^order)^(1/order)} を返します。
     *
     * @param order 次数です（1 以上）
     * @return ノルムです
     */
    public double inducedNorm(int order) {
        Preconditions.checkArgument(order >= 1, "order は 1 以上が必要です: %s", order);
        double sum = 0.0;
        for (Complex c : terms.values()) {
            sum += Math.pow(c.abs(), order);
        }
        return Math.pow(sum, 1.0 / order);
    }

    // ---------------------------------------------------------------------
    // 行列
    // ---------------------------------------------------------------------

    /**
     * 既定のバックエンドで d^n × d^n の密行列を構築します。
     *
     * @return 密行列です
     * @throws IllegalArgumentException 次元が大きすぎる場合に発生します
     */
    public ZMatrixRMaj toMatrix() {
        return toMatrix(DEFAULT_BACKEND);
    }

    /**
     * 指定したバックエンドで d^n × d^n の密行列を構築します。
     *
     * @param backend 行列構築バックエンドです（null 不可）
     * @return 密行列です
     */
    public ZMatrixRMaj toMatrix(SpinMatrixBackend backend) {
        Preconditions.checkNotNull(backend, "backend は null 不可です");
        return backend.buildMatrix(terms, numSites, spin);
    }

    // ---------------------------------------------------------------------
    // 内部ヘルパ
    // ---------------------------------------------------------------------

    /**
     * 二項演算の相手が同じレジスタ（サイト数・スピン）かを検証します。
     *
     * @param other 相手の演算子です
     * @param operation 演算名です
     * @throws DimensionMismatchException 一致しない場合に発生します
     */
    private void requireSameRegister(SpinOp other, String operation) {
        Preconditions.checkNotNull(other, "other は null 不可です");
        if (numSites != other.numSites) {
            throw new DimensionMismatchException(operation + ": サイト数が一致しません: " + numSites
                    + " vs " + other.numSites);
        }
        if (!spin.equals(other.spin)) {
            throw new DimensionMismatchException(
                    operation + ": スピン量子数が一致しません: " + spin + " vs " + other.spin);
        }
    }

    /**
     * Y 因子の個数が奇数なら係数の符号を反転します。
     *
     * @param coefficient 係数です
     * @param term 項です
     * @return 符号を調整した係数です
     */
    private static Complex withYParity(Complex coefficient, Term term) {
        return (term.countY() % 2 == 0) ? coefficient : coefficient.negate();
    }

    @Override
    public String toString() {
        String body = terms.entrySet().stream().map(e -> e.getKey().label() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
        return "SpinOp(" + body + ", numSites=" + numSites + ", spin=" + spin + ")";
    }

    /**
     * ラベルと係数を順に追加して演算子を組み立てるビルダーです。
     *
     * <p>
     * 同じラベルを複数回追加した場合は係数を合算します。
     * </p>
     */
    public static final class Builder {

        /**
         * ラベルから係数への写像（挿入順）です。
         */
        private final Map<String, Complex> labels = new LinkedHashMap<>();

        /**
         * サイト数です（負の場合は推定）。
         */
        private int numSites = -1;

        /**
         * スピン量子数です。
         */
        private Spin spin = Spin.HALF;

        private Builder() {}

        /**
         * 項を追加します。
         *
         * @param label ラベル文字列です
         * @param coefficient 係数です
         * @return このビルダーです
         */
        public Builder term(String label, Complex coefficient) {
            Preconditions.checkNotNull(label, "label は null 不可です");
            Preconditions.checkNotNull(coefficient, "coefficient は null 不可です");
            labels.merge(label, coefficient, Complex::plus);
            return this;
        }

        public Builder term(String label, double real) {
            return term(label, Complex.ofReal(real));
        }

        public Builder term(String label, double real, double imag) {
            return term(label, Complex.of(real, imag));
        }

        /**
         * 因子列から項を追加します。
         *
         * @param term （因子列, 係数）の組です
         * @return このビルダーです
         */
        public Builder term(SpinTerm term) {
            Preconditions.checkNotNull(term, "term は null 不可です");
            return term(Term.of(term.getFactors()).label(), term.getCoefficient());
        }

        public Builder numSites(int numSites) {
            Preconditions.checkArgument(numSites >= 0, "numSites は 0 以上が必要です: %s", numSites);
            this.numSites = numSites;
            return this;
        }

        public Builder spin(Spin spin) {
            this.spin = Preconditions.checkNotNull(spin, "spin は null 不可です");
            return this;
        }

        /**
         * 演算子を生成します。
         *
         * @return 演算子です
         * @throws MalformedLabelException ラベルが文法に合わない、またはサイトが numSites 以上の場合に発生します
         */
        public SpinOp build() {
            return of(labels, numSites, spin);
        }
    }
}
