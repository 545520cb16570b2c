package org.fol.arith;

import lombok.Getter;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 原子的幂积 a1^k1 * a2^k2 * ...，指数为非零整数。
 * 空积即单位元 1。
 * 此类是不可变的。
 *
 * @param <T> 原子类型
 */
@Getter
public final class Monomial<T extends Comparable<? super T>> implements Comparable<Monomial<T>> {

    private final SortedMap<T, Integer> powers;

    private final int hashCode;

    private Monomial(Map<T, Integer> powers) {
        SortedMap<T, Integer> temp = new TreeMap<>();
        for (Map.Entry<T, Integer> entry : powers.entrySet()) {
            T atom = Objects.requireNonNull(entry.getKey(), "Monomial: 原子不能为 null");
            int power = Objects.requireNonNull(entry.getValue(), "Monomial: 指数不能为 null");
            if (power != 0) {
                temp.put(atom, power);
            }
        }
        this.powers = Collections.unmodifiableSortedMap(temp);
        this.hashCode = this.powers.hashCode();
    }

    public static <T extends Comparable<? super T>> Monomial<T> unit() {
        return new Monomial<>(Collections.<T, Integer>emptyMap());
    }

    public static <T extends Comparable<? super T>> Monomial<T> of(T atom) {
        return new Monomial<>(Map.of(atom, 1));
    }

    public static <T extends Comparable<? super T>> Monomial<T> of(T atom, int power) {
        return new Monomial<>(Map.of(atom, power));
    }

    public static <T extends Comparable<? super T>> Monomial<T> of(Map<T, Integer> powers) {
        return new Monomial<>(powers);
    }

    public Monomial<T> multiply(Monomial<T> other) {
        if (this.isUnit()) {
            return other;
        }
        if (other.isUnit()) {
            return this;
        }
        Map<T, Integer> product = new TreeMap<>(this.powers);
        other.powers.forEach((atom, power) -> product.merge(atom, power, Integer::sum));
        return new Monomial<>(product);
    }

    public Monomial<T> pow(int exponent) {
        if (exponent == 1) {
            return this;
        }
        Map<T, Integer> result = new TreeMap<>();
        powers.forEach((atom, power) -> result.put(atom, Math.multiplyExact(power, exponent)));
        return new Monomial<>(result);
    }

    public boolean isUnit() {
        return powers.isEmpty();
    }

    /**
     * @return 当单项式恰为某个原子的一次幂时返回该原子
     */
    public Optional<T> getAtom() {
        if (powers.size() == 1) {
            Map.Entry<T, Integer> entry = powers.entrySet().iterator().next();
            if (entry.getValue() == 1) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * 出现的原子，按原子顺序。
     */
    public Stream<T> atoms() {
        return powers.keySet().stream();
    }

    public int degree() {
        return powers.values().stream().mapToInt(Math::abs).sum();
    }

    /**
     * @param atomPrinter 原子的打印方式
     */
    public String format(Function<? super T, String> atomPrinter) {
        if (isUnit()) {
            return "1";
        }
        return powers.entrySet().stream()
                .map(entry -> entry.getValue() == 1
                        ? atomPrinter.apply(entry.getKey())
                        : atomPrinter.apply(entry.getKey()) + "^" + entry.getValue())
                .collect(Collectors.joining(" × "));
    }

    @Override
    public int compareTo(Monomial<T> other) {
        Iterator<Map.Entry<T, Integer>> thisIt = this.powers.entrySet().iterator();
        Iterator<Map.Entry<T, Integer>> otherIt = other.powers.entrySet().iterator();
        while (thisIt.hasNext() && otherIt.hasNext()) {
            Map.Entry<T, Integer> thisE = thisIt.next();
            Map.Entry<T, Integer> otherE = otherIt.next();
            int cmp = thisE.getKey().compareTo(otherE.getKey());
            if (cmp != 0) {
                return cmp;
            }
            cmp = Integer.compare(thisE.getValue(), otherE.getValue());
            if (cmp != 0) {
                return cmp;
            }
        }
        // 如果一个是另一个的前缀，则较长的更大
        return Integer.compare(this.powers.size(), other.powers.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Monomial<?> that = (Monomial<?>) o;
        return powers.equals(that.powers);
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
