package org.fol.terms;

import lombok.Getter;
import org.fol.sexp.Sexp;
import org.fol.sexp.SexpParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 按 id 排序的不可变变量集合。
 */
@Getter
public final class VarSet implements Comparable<VarSet>, Iterable<Var> {

    private static final Logger logger = LoggerFactory.getLogger(VarSet.class);

    public static final VarSet EMPTY = new VarSet(Collections.emptySet());

    private final SortedSet<Var> vars;

    private final int hashCode;

    private VarSet(Collection<? extends Var> vars) {
        Objects.requireNonNull(vars, "VarSet: 变量集合不能为 null");
        this.vars = Collections.unmodifiableSortedSet(new TreeSet<>(vars));
        this.hashCode = this.vars.hashCode();
    }

    public static VarSet empty() {
        return EMPTY;
    }

    public static VarSet of(Var... vars) {
        return of(Arrays.asList(vars));
    }

    public static VarSet of(Collection<? extends Var> vars) {
        if (vars.isEmpty()) {
            return EMPTY;
        }
        return new VarSet(vars);
    }

    public VarSet add(Var v) {
        if (vars.contains(v)) {
            return this;
        }
        SortedSet<Var> result = new TreeSet<>(vars);
        result.add(v);
        return new VarSet(result);
    }

    public VarSet remove(Var v) {
        if (!vars.contains(v)) {
            return this;
        }
        SortedSet<Var> result = new TreeSet<>(vars);
        result.remove(v);
        return new VarSet(result);
    }

    public VarSet union(VarSet other) {
        SortedSet<Var> result = new TreeSet<>(vars);
        result.addAll(other.vars);
        return new VarSet(result);
    }

    public VarSet diff(VarSet other) {
        SortedSet<Var> result = new TreeSet<>(vars);
        result.removeAll(other.vars);
        return new VarSet(result);
    }

    public VarSet inter(VarSet other) {
        SortedSet<Var> result = new TreeSet<>(vars);
        result.retainAll(other.vars);
        return new VarSet(result);
    }

    public boolean contains(Var v) {
        return vars.contains(v);
    }

    public boolean isSubsetOf(VarSet other) {
        return other.vars.containsAll(vars);
    }

    public boolean isDisjoint(VarSet other) {
        return vars.stream().noneMatch(other.vars::contains);
    }

    public boolean isEmpty() {
        return vars.isEmpty();
    }

    public int size() {
        return vars.size();
    }

    /**
     * @return 最大的变量 id，空集时为 -1
     */
    public long maxId() {
        return vars.isEmpty() ? -1L : vars.last().getId();
    }

    public Stream<Var> stream() {
        return vars.stream();
    }

    @Override
    public Iterator<Var> iterator() {
        return vars.iterator();
    }

    public TermSet toTermSet() {
        return TermSet.of(vars);
    }

    // --- 打印与 S 表达式 ---

    /**
     * 按给定强度打印，例如 {@code {∀%x_1, ∃%y_2}}。
     */
    public String ppx(Function<? super Var, Optional<VarStrength>> strength) {
        return vars.stream().map(v -> v.ppx(strength)).collect(Collectors.joining(", ", "{", "}"));
    }

    public Sexp toSexp() {
        List<Sexp> items = new ArrayList<>();
        for (Var v : vars) {
            items.add(v.toSexp());
        }
        return Sexp.list(items);
    }

    public static VarSet ofSexp(Sexp sexp) {
        List<Var> result = new ArrayList<>();
        for (Sexp item : sexp.getItems()) {
            Term t = Term.ofSexp(item);
            Var v = Var.ofTrm(t).orElseThrow(() -> {
                logger.error("变量集合中出现了非变量项: {}", t);
                return new SexpParseException("期望变量，实际为: " + t);
            });
            result.add(v);
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
        VarSet that = (VarSet) o;
        return vars.equals(that.vars);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return vars.stream().map(Var::toString).collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public int compareTo(VarSet other) {
        Iterator<Var> thisIt = this.vars.iterator();
        Iterator<Var> otherIt = other.vars.iterator();
        while (thisIt.hasNext() && otherIt.hasNext()) {
            int cmp = thisIt.next().compareTo(otherIt.next());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(this.vars.size(), other.vars.size());
    }
}
