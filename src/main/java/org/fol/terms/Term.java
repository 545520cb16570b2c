package org.fol.terms;

import org.apache.commons.lang3.tuple.Pair;
import org.fol.arith.Polynomial;
import org.fol.core.Funsym;
import org.fol.core.InvariantViolationException;
import org.fol.sexp.Sexp;
import org.fol.sexp.SexpParser;
import org.fol.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 项：由变量和各理论中函数符号的应用构成，表示从结构到值的函数。
 *
 * <p>项是一个封闭的标签联合，变体见 {@link TermShape}。各变体的构造函数是包私有的，
 * 外部只能通过本类的静态构造函数得到项。构造函数会做保持语义的化简，因此对构造函数
 * {@code cons}，{@code cons(a, b)} 未必以 {@code a} 为真子项，也未必以 {@code Cons} 为主构造子。
 * 但构造函数保证不产生新的可解真子项：{@code solvableTrms(cons(a, b))} 中的每个项
 * 都出现在 {@code transitiveSolvables(a)} 或 {@code transitiveSolvables(b)} 中。
 * 等式求解器依赖这一性质。
 *
 * <p>项是不可变的值对象，可以在线程间自由共享。
 */
public abstract class Term implements Comparable<Term> {

    private static final Logger logger = LoggerFactory.getLogger(Term.class);

    public static final Term ZERO = new IntegerTerm(BigInteger.ZERO);
    public static final Term ONE = new IntegerTerm(BigInteger.ONE);

    Term() {
    }

    // ========== 变体接口 ==========

    public abstract TermShape getShape();

    public abstract TermKind classify();

    /**
     * 直接子项。
     */
    public abstract Stream<Term> trms();

    /**
     * 同形状的项之间的比较。
     */
    abstract int compareSameShape(Term other);

    /**
     * 对直接子项做带累积值的映射，并通过智能构造函数重建。
     * 所有子项均未改变（引用相同）时返回 this。
     */
    abstract <S> Pair<Term, S> foldMapTrms(S init, BiFunction<? super Term, S, Pair<Term, S>> f);

    abstract String format(Function<? super Var, Optional<VarStrength>> strength);

    /**
     * 检查本节点的局部不变式。
     * @throws InvariantViolationException 如果违反
     */
    abstract void checkNode();

    public abstract Sexp toSexp();

    // ========== 构造 ==========

    // 变量

    public static Term var(Var v) {
        return Objects.requireNonNull(v, "Term.var: 变量不能为 null");
    }

    // 算术

    public static Term zero() {
        return ZERO;
    }

    public static Term one() {
        return ONE;
    }

    public static Term integer(BigInteger z) {
        Objects.requireNonNull(z, "Term.integer: 值不能为 null");
        if (z.signum() == 0) {
            return ZERO;
        }
        if (z.equals(BigInteger.ONE)) {
            return ONE;
        }
        return new IntegerTerm(z);
    }

    public static Term integer(long z) {
        return integer(BigInteger.valueOf(z));
    }

    /**
     * 整数值的有理数得到 Z 字面量，其余得到 Q 字面量。
     */
    public static Term rational(Rational q) {
        Objects.requireNonNull(q, "Term.rational: 值不能为 null");
        if (q.isInteger()) {
            return integer(q.getNumerator());
        }
        return new RationalTerm(q);
    }

    public static Term neg(Term x) {
        return ArithEmbedding.project(ArithEmbedding.embed(x).negate());
    }

    public static Term add(Term x, Term y) {
        return ArithEmbedding.project(ArithEmbedding.embed(x).add(ArithEmbedding.embed(y)));
    }

    public static Term sub(Term x, Term y) {
        return ArithEmbedding.project(ArithEmbedding.embed(x).subtract(ArithEmbedding.embed(y)));
    }

    public static Term mulq(Rational q, Term x) {
        return ArithEmbedding.project(ArithEmbedding.embed(x).mulConst(q));
    }

    public static Term mul(Term x, Term y) {
        return ArithEmbedding.project(ArithEmbedding.embed(x).multiply(ArithEmbedding.embed(y), ArithEmbedding::reify));
    }

    /**
     * @throws ArithmeticException 如果除数为字面量零
     */
    public static Term div(Term x, Term y) {
        return ArithEmbedding.project(ArithEmbedding.embed(x).divide(ArithEmbedding.embed(y), ArithEmbedding::reify));
    }

    /**
     * @throws ArithmeticException 如果对字面量零求负次幂
     */
    public static Term pow(Term x, int exponent) {
        return ArithEmbedding.project(ArithEmbedding.embed(x).pow(exponent, ArithEmbedding::reify));
    }

    /**
     * 从任意多项式构造项。原子中的字面量与算术项会被重新嵌入并规范化。
     */
    public static Term arith(Polynomial<Term> poly) {
        Objects.requireNonNull(poly, "Term.arith: 多项式不能为 null");
        return ArithEmbedding.project(poly.map(ArithEmbedding::embed, ArithEmbedding::reify));
    }

    // 序列

    public static Term splat(Term x) {
        return SequenceSimplifier.splat(x);
    }

    public static Term sized(Term seq, Term siz) {
        return SequenceSimplifier.sized(seq, siz);
    }

    public static Term extract(Term seq, Term off, Term len) {
        return SequenceSimplifier.extract(seq, off, len);
    }

    public static Term concat(Term... xs) {
        return SequenceSimplifier.concat(Arrays.asList(xs));
    }

    public static Term concat(List<Term> xs) {
        return SequenceSimplifier.concat(xs);
    }

    // 未解释函数

    public static Term apply(Funsym f, Term... args) {
        return apply(f, Arrays.asList(args));
    }

    /**
     * @throws IllegalArgumentException 如果参数个数与函数符号的元数不一致
     */
    public static Term apply(Funsym f, List<Term> args) {
        Objects.requireNonNull(f, "Term.apply: 函数符号不能为 null");
        Objects.requireNonNull(args, "Term.apply: 参数不能为 null");
        if (args.size() != f.getArity()) {
            logger.error("Term.apply: {} 的元数为 {}，但给出了 {} 个参数", f, f.getArity(), args.size());
            throw new IllegalArgumentException("Term.apply: " + f + " 的元数为 " + f.getArity() + "，实际参数 " + args.size() + " 个");
        }
        return new Apply(f, args);
    }

    // ========== 析构 ==========

    /**
     * @return 仅当本项是 Z 字面量时返回其值
     */
    public Optional<BigInteger> getZ() {
        return Optional.empty();
    }

    /**
     * @return 当本项是 Q 或 Z 字面量时返回其值；不对算术项求值
     */
    public Optional<Rational> getQ() {
        return Optional.empty();
    }

    // ========== 分类 ==========

    /**
     * 变量，或未解释函数符号的应用（包括分类为未解释的非线性算术项）。
     * 即不是解释函数符号的应用（包括常量与零元应用）。
     */
    public boolean isNoninterpreted() {
        return classify().isNoninterpreted();
    }

    public boolean isInterpreted() {
        return !isNoninterpreted();
    }

    public boolean isUninterpreted() {
        return classify() == TermKind.UNINTERP_APP;
    }

    /**
     * 项中出现的极大非解释项。非解释项的可解项就是它自己。
     */
    public Stream<Term> solvables() {
        if (isNoninterpreted()) {
            return Stream.of(this);
        }
        return trms().flatMap(Term::solvables);
    }

    /**
     * 直接子项的可解项，即极大的非解释真子项。
     */
    public Stream<Term> solvableTrms() {
        return trms().flatMap(Term::solvables);
    }

    /**
     * 项中出现的所有非解释子项（传递的，不一定是真子项）。
     */
    public Stream<Term> transitiveSolvables() {
        Stream<Term> below = trms().flatMap(Term::transitiveSolvables);
        return isNoninterpreted() ? Stream.concat(Stream.of(this), below) : below;
    }

    // ========== 查询 ==========

    /**
     * 序列项静态已知的长度。
     * @throws InvariantViolationException 如果本项不是 Sized、Extract 或 Concat
     */
    public Term seqSizeExn() {
        logger.error("seqSizeExn: {} 不是有长度的序列项", this);
        throw new InvariantViolationException("seqSizeExn: " + this + " 不是有长度的序列项");
    }

    public Optional<Term> seqSize() {
        return Optional.empty();
    }

    /**
     * 没有值得递归的真子项：变量、字面量、空串联与零元应用。
     */
    public boolean isAtomic() {
        return false;
    }

    /**
     * 树高，没有子项的项高度为 0。
     */
    public int height() {
        OptionalInt max = trms().mapToInt(Term::height).max();
        return max.isPresent() ? max.getAsInt() + 1 : 0;
    }

    // ========== 遍历 ==========

    /**
     * 原子的自反传递子项。
     */
    public Stream<Term> atoms() {
        if (isAtomic()) {
            return Stream.of(this);
        }
        return trms().flatMap(Term::atoms);
    }

    /**
     * 项中出现的变量。
     */
    public Stream<Var> vars() {
        return atoms().flatMap(t -> Var.ofTrm(t).stream());
    }

    public VarSet fv() {
        return VarSet.of(vars().collect(Collectors.toList()));
    }

    // ========== 变换 ==========

    /**
     * 映射直接子项并通过智能构造函数重建。
     * @throws ArithmeticException 如果负次幂下的子项被替换为字面量零
     */
    public Term map(UnaryOperator<Term> f) {
        return this.<Void>foldMapTrms(null, (t, s) -> Pair.of(f.apply(t), s)).getLeft();
    }

    /**
     * 映射项中的变量。
     * @throws ArithmeticException 同 {@link #map}
     */
    public Term mapVars(UnaryOperator<Var> f) {
        return map(t -> t.mapVars(f));
    }

    /**
     * 映射项中的可解项，解释结构保持不变。
     */
    public Term mapSolvables(UnaryOperator<Term> f) {
        if (isNoninterpreted()) {
            return f.apply(this);
        }
        return map(t -> t.mapSolvables(f));
    }

    /**
     * 从左到右映射直接子项，同时传递累积值。
     * @return 重建后的项与最终的累积值
     * @throws ArithmeticException 同 {@link #map}
     */
    public <S> Pair<Term, S> foldMap(S init, BiFunction<? super Term, S, Pair<Term, S>> f) {
        return foldMapTrms(init, f);
    }

    // ========== 不变式 ==========

    /**
     * 递归检查项的结构不变式。
     * @throws InvariantViolationException 如果违反
     */
    public void invariant() {
        checkNode();
        trms().forEach(Term::invariant);
    }

    // ========== 打印与序列化 ==========

    /**
     * @param strength 变量的强度，只影响变量的打印
     */
    public String ppx(Function<? super Var, Optional<VarStrength>> strength) {
        return format(strength);
    }

    /**
     * 两个项不同时打印 "-- a ++ b"，相同时为空串。
     */
    public static String ppDiff(Term a, Term b) {
        if (a.equals(b)) {
            return "";
        }
        return "-- " + a + " ++ " + b;
    }

    @Override
    public String toString() {
        return format(v -> Optional.empty());
    }

    /**
     * @throws org.fol.sexp.SexpParseException 如果 S 表达式格式不对
     * @throws InvariantViolationException 如果解码出的项违反不变式
     */
    public static Term ofSexp(Sexp sexp) {
        return TermSexpCodec.decode(sexp);
    }

    public static Term ofString(String text) {
        return ofSexp(SexpParser.parse(text));
    }

    // ========== Object 方法 ==========

    @Override
    public int compareTo(Term other) {
        if (this == other) {
            return 0;
        }
        int cmp = getShape().compareTo(other.getShape());
        if (cmp != 0) {
            return cmp;
        }
        return compareSameShape(other);
    }

    static int compareLists(List<Term> xs, List<Term> ys) {
        Iterator<Term> xIt = xs.iterator();
        Iterator<Term> yIt = ys.iterator();
        while (xIt.hasNext() && yIt.hasNext()) {
            int cmp = xIt.next().compareTo(yIt.next());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(xs.size(), ys.size());
    }

    /**
     * 依次对 xs 的每个元素做带累积值的映射。
     * @return 映射后的列表（全部未改变时为 xs 本身）与最终累积值
     */
    static <S> Pair<List<Term>, S> foldMapList(List<Term> xs, S init, BiFunction<? super Term, S, Pair<Term, S>> f) {
        Term[] mapped = new Term[xs.size()];
        boolean changed = false;
        S acc = init;
        for (int i = 0; i < mapped.length; i++) {
            Term x = xs.get(i);
            Pair<Term, S> result = f.apply(x, acc);
            mapped[i] = result.getLeft();
            acc = result.getRight();
            changed |= mapped[i] != x;
        }
        return Pair.of(changed ? Arrays.asList(mapped) : xs, acc);
    }
}
