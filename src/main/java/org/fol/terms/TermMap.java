package org.fol.terms;

import lombok.Getter;
import org.fol.sexp.Sexp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 以项为键、按键排序的不可变映射。
 * @param <V> 值的类型
 */
@Getter
public final class TermMap<V> {

    private static final Logger logger = LoggerFactory.getLogger(TermMap.class);

    private static final TermMap<?> EMPTY = new TermMap<>(Collections.emptyMap());

    private final SortedMap<Term, V> entries;

    private final int hashCode;

    /**
     * 私有构造函数。
     * @param entries 键值对，键和值都不能为 null。
     */
    private TermMap(Map<Term, ? extends V> entries) {
        Objects.requireNonNull(entries, "TermMap: 映射不能为 null");
        SortedMap<Term, V> temp = new TreeMap<>();
        entries.forEach((k, v) -> temp.put(
                Objects.requireNonNull(k, "TermMap: 键不能为 null"),
                Objects.requireNonNull(v, "TermMap: 值不能为 null")));
        this.entries = Collections.unmodifiableSortedMap(temp);
        this.hashCode = this.entries.hashCode();
    }

    @SuppressWarnings("unchecked")
    public static <V> TermMap<V> empty() {
        return (TermMap<V>) EMPTY;
    }

    public static <V> TermMap<V> of(Map<Term, ? extends V> entries) {
        if (entries.isEmpty()) {
            return empty();
        }
        return new TermMap<>(entries);
    }

    public static <V> TermMap<V> of(Term key, V value) {
        return new TermMap<>(Collections.singletonMap(key, value));
    }

    public TermMap<V> put(Term key, V value) {
        Map<Term, V> result = new TreeMap<>(entries);
        result.put(key, value);
        return new TermMap<>(result);
    }

    public TermMap<V> remove(Term key) {
        if (!entries.containsKey(key)) {
            return this;
        }
        Map<Term, V> result = new TreeMap<>(entries);
        result.remove(key);
        return new TermMap<>(result);
    }

    public Optional<V> get(Term key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(Term key) {
        return entries.containsKey(key);
    }

    public TermSet keySet() {
        return TermSet.of(entries.keySet());
    }

    public Set<Map.Entry<Term, V>> entrySet() {
        return entries.entrySet();
    }

    public void forEach(BiConsumer<? super Term, ? super V> action) {
        entries.forEach(action);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    // --- S 表达式 ---

    /**
     * 编码为 ((key value) ...)。
     */
    public Sexp toSexp(Function<? super V, Sexp> valueEncoder) {
        List<Sexp> items = new ArrayList<>();
        entries.forEach((k, v) -> items.add(Sexp.list(k.toSexp(), valueEncoder.apply(v))));
        return Sexp.list(items);
    }

    public static <V> TermMap<V> ofSexp(Sexp sexp, Function<Sexp, ? extends V> valueDecoder) {
        Map<Term, V> result = new TreeMap<>();
        for (Sexp item : sexp.getItems()) {
            List<Sexp> pair = item.expectList(2);
            Term key = Term.ofSexp(pair.get(0));
            if (result.containsKey(key)) {
                logger.warn("映射中键 {} 重复出现，保留后出现的值", key);
            }
            result.put(key, valueDecoder.apply(pair.get(1)));
        }
        return of(result);
    }

    // --- Object 方法 ---

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TermMap<?> that = (TermMap<?>) o;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "{" +
                entries.entrySet().stream()
                        .map(entry -> entry.getKey() + " ↦ " + entry.getValue())
                        .collect(Collectors.joining(", ")) +
                "}";
    }
}
