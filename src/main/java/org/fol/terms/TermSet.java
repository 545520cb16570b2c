package org.fol.terms;

import lombok.Getter;
import org.fol.sexp.Sexp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 按 {@link Term#compareTo} 排序的不可变项集合。
 * 所有修改操作都返回新的集合。
 */
@Getter
public final class TermSet implements Comparable<TermSet>, Iterable<Term> {

    private static final Logger logger = LoggerFactory.getLogger(TermSet.class);

    public static final TermSet EMPTY = new TermSet(Collections.emptySet());

    private final SortedSet<Term> elements;

    private final int hashCode;

    private TermSet(Collection<? extends Term> elements) {
        Objects.requireNonNull(elements, "TermSet: 元素集合不能为 null");
        this.elements = Collections.unmodifiableSortedSet(new TreeSet<>(elements));
        this.hashCode = this.elements.hashCode();
    }

    public static TermSet empty() {
        return EMPTY;
    }

    public static TermSet of(Term... elements) {
        return of(Arrays.asList(elements));
    }

    public static TermSet of(Collection<? extends Term> elements) {
        if (elements.isEmpty()) {
            return EMPTY;
        }
        return new TermSet(elements);
    }

    public TermSet add(Term t) {
        if (elements.contains(t)) {
            return this;
        }
        SortedSet<Term> result = new TreeSet<>(elements);
        result.add(t);
        return new TermSet(result);
    }

    public TermSet remove(Term t) {
        if (!elements.contains(t)) {
            return this;
        }
        SortedSet<Term> result = new TreeSet<>(elements);
        result.remove(t);
        return new TermSet(result);
    }

    public TermSet union(TermSet other) {
        SortedSet<Term> result = new TreeSet<>(elements);
        result.addAll(other.elements);
        return new TermSet(result);
    }

    public TermSet diff(TermSet other) {
        SortedSet<Term> result = new TreeSet<>(elements);
        result.removeAll(other.elements);
        return new TermSet(result);
    }

    public TermSet inter(TermSet other) {
        SortedSet<Term> result = new TreeSet<>(elements);
        result.retainAll(other.elements);
        return new TermSet(result);
    }

    public boolean contains(Term t) {
        return elements.contains(t);
    }

    public boolean containsAll(TermSet other) {
        return elements.containsAll(other.elements);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public int size() {
        return elements.size();
    }

    public Stream<Term> stream() {
        return elements.stream();
    }

    @Override
    public Iterator<Term> iterator() {
        return elements.iterator();
    }

    // --- 打印与 S 表达式 ---

    public Sexp toSexp() {
        List<Sexp> items = new ArrayList<>();
        for (Term t : elements) {
            items.add(t.toSexp());
        }
        return Sexp.list(items);
    }

    public static TermSet ofSexp(Sexp sexp) {
        List<Term> terms = new ArrayList<>();
        for (Sexp item : sexp.getItems()) {
            terms.add(Term.ofSexp(item));
        }
        return of(terms);
    }

    /**
     * 打印两个集合的差异："-- 只在 a 中的元素 ++ 只在 b 中的元素"，相等时为空串。
     */
    public static String ppDiff(TermSet a, TermSet b) {
        TermSet removed = a.diff(b);
        TermSet added = b.diff(a);
        List<String> parts = new ArrayList<>();
        if (!removed.isEmpty()) {
            parts.add("-- " + removed);
        }
        if (!added.isEmpty()) {
            parts.add("++ " + added);
        }
        logger.debug("集合差异: {} 个移除, {} 个新增", removed.size(), added.size());
        return String.join(" ", parts);
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
        TermSet that = (TermSet) o;
        return elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return elements.stream().map(Term::toString).collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public int compareTo(TermSet other) {
        Iterator<Term> thisIt = this.elements.iterator();
        Iterator<Term> otherIt = other.elements.iterator();
        while (thisIt.hasNext() && otherIt.hasNext()) {
            int cmp = thisIt.next().compareTo(otherIt.next());
            if (cmp != 0) {
                return cmp;
            }
        }
        // 一个集合是另一个的前缀时，较长的集合更大
        return Integer.compare(this.elements.size(), other.elements.size());
    }
}
