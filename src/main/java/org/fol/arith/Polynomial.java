package org.fol.arith;

import lombok.Getter;
import org.fol.sexp.Sexp;
import org.fol.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 规范形式的多项式，形式为 c1*m1 + c2*m2 + ... + const，其中 mi 是非单位的单项式。
 * 系数为零的单项式被丢弃，单项式按其全序排列，因此两个多项式语义相同当且仅当结构相同
 * （在原子被视为不透明的前提下）。
 * 此类是不可变的。
 *
 * @param <T> 原子类型
 */
@Getter
public final class Polynomial<T extends Comparable<? super T>> implements Comparable<Polynomial<T>> {

    private static final Logger logger = LoggerFactory.getLogger(Polynomial.class);

    private final SortedMap<Monomial<T>, Rational> coefficients;

    private final Rational constant;

    private final int hashCode;

    /**
     * 私有构造函数。
     * @param coefficients 单项式到其系数的映射，单位单项式会并入常数项。
     * @param constant 常数项。
     */
    private Polynomial(Map<Monomial<T>, Rational> coefficients, Rational constant) {
        Rational tempConstant = Objects.requireNonNull(constant, "Polynomial: 常数项不能为 null");
        SortedMap<Monomial<T>, Rational> tempCoefficients = new TreeMap<>();
        for (Map.Entry<Monomial<T>, Rational> entry : Objects.requireNonNull(coefficients, "Polynomial: 系数映射不能为 null").entrySet()) {
            Monomial<T> mono = Objects.requireNonNull(entry.getKey(), "Polynomial: 单项式不能为 null");
            Rational coeff = Objects.requireNonNull(entry.getValue(), "Polynomial: 系数不能为 null");
            if (mono.isUnit()) {
                tempConstant = tempConstant.add(coeff);
            } else if (!coeff.isZero()) {
                tempCoefficients.merge(mono, coeff, Rational::add);
                if (tempCoefficients.get(mono).isZero()) {
                    tempCoefficients.remove(mono);
                }
            }
        }
        this.coefficients = Collections.unmodifiableSortedMap(tempCoefficients);
        this.constant = tempConstant;
        this.hashCode = Objects.hash(this.coefficients, this.constant);
    }

    // --- 工厂方法 ---

    public static <T extends Comparable<? super T>> Polynomial<T> constant(Rational constant) {
        return new Polynomial<>(Collections.<Monomial<T>, Rational>emptyMap(), constant);
    }

    public static <T extends Comparable<? super T>> Polynomial<T> atom(T atom) {
        return new Polynomial<>(Map.of(Monomial.of(atom), Rational.ONE), Rational.ZERO);
    }

    public static <T extends Comparable<? super T>> Polynomial<T> of(Monomial<T> mono, Rational coefficient) {
        return new Polynomial<>(Map.of(mono, coefficient), Rational.ZERO);
    }

    public static <T extends Comparable<? super T>> Polynomial<T> of(Map<Monomial<T>, Rational> coefficients, Rational constant) {
        return new Polynomial<>(coefficients, constant);
    }

    // --- 运算 ---

    public Polynomial<T> add(Polynomial<T> other) {
        if (other.isZero()) {
            return this;
        }
        if (this.isZero()) {
            return other;
        }
        Map<Monomial<T>, Rational> newCoefficients = new HashMap<>(this.coefficients);
        other.coefficients.forEach((mono, coeff) -> newCoefficients.merge(mono, coeff, Rational::add));
        return new Polynomial<>(newCoefficients, this.constant.add(other.constant));
    }

    public Polynomial<T> negate() {
        return mulConst(Rational.MINUS_ONE);
    }

    public Polynomial<T> subtract(Polynomial<T> other) {
        return add(other.negate());
    }

    public Polynomial<T> mulConst(Rational factor) {
        if (factor.isOne()) {
            return this;
        }
        if (factor.isZero()) {
            return constant(Rational.ZERO);
        }
        Map<Monomial<T>, Rational> scaled = new HashMap<>();
        coefficients.forEach((mono, coeff) -> scaled.put(mono, coeff.multiply(factor)));
        return new Polynomial<>(scaled, constant.multiply(factor));
    }

    /**
     * 乘法。常数因子直接缩放；其余情况下每个因子若恰为系数为一的单项式则按单项式相乘，
     * 否则整体作为原子，因此积总是单个单项式，不按分配律展开。
     * @param reify 把非单项式的因子作为原子重新嵌入
     */
    public Polynomial<T> multiply(Polynomial<T> other, Function<Polynomial<T>, T> reify) {
        Optional<Rational> thisConst = this.getConst();
        if (thisConst.isPresent()) {
            return other.mulConst(thisConst.get());
        }
        Optional<Rational> otherConst = other.getConst();
        if (otherConst.isPresent()) {
            return this.mulConst(otherConst.get());
        }
        Monomial<T> m1 = this.getMono().orElseGet(() -> Monomial.of(reify.apply(this)));
        Monomial<T> m2 = other.getMono().orElseGet(() -> Monomial.of(reify.apply(other)));
        logger.debug("计算了 {} 和 {} 的积", this, other);
        return of(m1.multiply(m2), Rational.ONE);
    }

    /**
     * 除法。常数除数直接取倒数相乘，否则乘以除数的 -1 次幂。
     * @param reify 把无法表示为单项式的多项式作为原子重新嵌入
     * @throws ArithmeticException 如果除数为常数零
     */
    public Polynomial<T> divide(Polynomial<T> divisor, Function<Polynomial<T>, T> reify) {
        Optional<Rational> divisorConst = divisor.getConst();
        if (divisorConst.isPresent()) {
            if (divisorConst.get().isZero()) {
                logger.error("多项式除以常数零: {} / 0", this);
                throw new ArithmeticException("Polynomial: 除数为零 (" + this + " / 0)");
            }
            return mulConst(divisorConst.get().reciprocal());
        }
        return multiply(divisor.pow(-1, reify), reify);
    }

    /**
     * 整数次幂。
     * 常数直接求幂，系数为一的单项式对每个因子的指数相乘，其余多项式整体作为原子求幂。
     * @param reify 把非单项式的多项式作为原子重新嵌入
     * @throws ArithmeticException 如果对零求负次幂
     */
    public Polynomial<T> pow(int exponent, Function<Polynomial<T>, T> reify) {
        if (exponent == 1) {
            return this;
        }
        if (exponent == 0) {
            return constant(Rational.ONE);
        }
        Optional<Rational> c = getConst();
        if (c.isPresent()) {
            return constant(c.get().pow(exponent));
        }
        Optional<Monomial<T>> mono = getMono();
        if (mono.isPresent()) {
            return of(mono.get().pow(exponent), Rational.ONE);
        }
        return of(Monomial.of(reify.apply(this), exponent), Rational.ONE);
    }

    /**
     * 把每个原子替换为一个多项式并重新规范化。
     * @param f 原子的替换
     * @param reify 非单项式的因子作为原子重新嵌入
     * @throws ArithmeticException 如果某个负次幂的原子被替换为零
     */
    public Polynomial<T> map(Function<? super T, Polynomial<T>> f, Function<Polynomial<T>, T> reify) {
        Polynomial<T> result = constant(constant);
        for (Map.Entry<Monomial<T>, Rational> entry : coefficients.entrySet()) {
            Polynomial<T> term = constant(Rational.ONE);
            for (Map.Entry<T, Integer> factor : entry.getKey().getPowers().entrySet()) {
                term = term.multiply(f.apply(factor.getKey()).pow(factor.getValue(), reify), reify);
            }
            result = result.add(term.mulConst(entry.getValue()));
        }
        return result;
    }

    // --- 查询 ---

    public ArithClass classify() {
        if (coefficients.isEmpty()) {
            return ArithClass.CONST;
        }
        if (constant.isZero() && coefficients.size() == 1) {
            Map.Entry<Monomial<T>, Rational> entry = coefficients.entrySet().iterator().next();
            if (entry.getValue().isOne()) {
                return entry.getKey().getAtom().isPresent() ? ArithClass.TRM : ArithClass.UNINTERPRETED;
            }
        }
        return ArithClass.INTERPRETED;
    }

    public boolean isZero() {
        return coefficients.isEmpty() && constant.isZero();
    }

    public Optional<Rational> getConst() {
        return coefficients.isEmpty() ? Optional.of(constant) : Optional.empty();
    }

    /**
     * @return 当多项式恰为系数为一的单个单项式时返回该单项式
     */
    public Optional<Monomial<T>> getMono() {
        if (constant.isZero() && coefficients.size() == 1) {
            Map.Entry<Monomial<T>, Rational> entry = coefficients.entrySet().iterator().next();
            if (entry.getValue().isOne()) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public Optional<T> getAtom() {
        if (classify() == ArithClass.TRM) {
            return coefficients.firstKey().getAtom();
        }
        return Optional.empty();
    }

    /**
     * 多项式中出现的原子：按单项式顺序，再按单项式内因子顺序。
     * 同一原子在多个单项式中出现时会出现多次。
     */
    public Stream<T> atoms() {
        return coefficients.keySet().stream().flatMap(Monomial::atoms);
    }

    private void forEachTerm(BiConsumer<Monomial<T>, Rational> action) {
        coefficients.forEach(action);
        if (!constant.isZero()) {
            action.accept(Monomial.<T>unit(), constant);
        }
    }

    // --- 打印与 S 表达式 ---

    /**
     * @param atomPrinter 原子的打印方式
     */
    public String format(Function<? super T, String> atomPrinter) {
        if (coefficients.isEmpty()) {
            return constant.toString();
        }
        List<String> parts = new ArrayList<>();
        coefficients.forEach((mono, coeff) -> parts.add(
                coeff.isOne() ? mono.format(atomPrinter) : coeff + " × " + mono.format(atomPrinter)));
        if (!constant.isZero()) {
            parts.add(constant.toString());
        }
        return parts.stream().collect(Collectors.joining(" + ", "(", ")"));
    }

    /**
     * 编码为 (((factor...) coeff) ...)，其中 factor 为 (atom power)，常数项的因子表为空。
     */
    public Sexp toSexp(Function<? super T, Sexp> atomEncoder) {
        List<Sexp> entries = new ArrayList<>();
        forEachTerm((mono, coeff) -> {
            List<Sexp> factors = new ArrayList<>();
            mono.getPowers().forEach((atom, power) -> factors.add(Sexp.list(atomEncoder.apply(atom), Sexp.atom(power))));
            entries.add(Sexp.list(Sexp.list(factors), Sexp.atom(coeff.toString())));
        });
        return Sexp.list(entries);
    }

    public static <T extends Comparable<? super T>> Polynomial<T> ofSexp(Sexp sexp, Function<Sexp, T> atomDecoder) {
        Map<Monomial<T>, Rational> coefficients = new HashMap<>();
        for (Sexp entry : sexp.getItems()) {
            List<Sexp> pair = entry.expectList(2);
            Map<T, Integer> powers = new TreeMap<>();
            for (Sexp factor : pair.get(0).getItems()) {
                List<Sexp> atomAndPower = factor.expectList(2);
                int power = Integer.parseInt(atomAndPower.get(1).getAtomValue());
                powers.merge(atomDecoder.apply(atomAndPower.get(0)), power, Integer::sum);
            }
            Rational coeff = Rational.valueOf(pair.get(1).getAtomValue());
            coefficients.merge(Monomial.of(powers), coeff, Rational::add);
        }
        return new Polynomial<>(coefficients, Rational.ZERO);
    }

    // --- Object 方法 ---

    @Override
    public int compareTo(Polynomial<T> other) {
        Iterator<Map.Entry<Monomial<T>, Rational>> thisIt = this.coefficients.entrySet().iterator();
        Iterator<Map.Entry<Monomial<T>, Rational>> otherIt = other.coefficients.entrySet().iterator();
        while (thisIt.hasNext() && otherIt.hasNext()) {
            Map.Entry<Monomial<T>, Rational> thisE = thisIt.next();
            Map.Entry<Monomial<T>, Rational> otherE = otherIt.next();
            int cmp = thisE.getKey().compareTo(otherE.getKey());
            if (cmp != 0) {
                return cmp;
            }
            cmp = thisE.getValue().compareTo(otherE.getValue());
            if (cmp != 0) {
                return cmp;
            }
        }
        int cmp = Integer.compare(this.coefficients.size(), other.coefficients.size());
        if (cmp != 0) {
            return cmp;
        }
        return this.constant.compareTo(other.constant);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Polynomial<?> that = (Polynomial<?>) o;
        return coefficients.equals(that.coefficients) && constant.equals(that.constant);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return format(String::valueOf);
    }
}
