package org.fol.terms;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.fol.core.Funsym;
import org.fol.core.InvariantViolationException;
import org.fol.sexp.Sexp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 函数符号的应用 {@code f(a, b)}。零元应用是常量。
 */
@Getter
public final class Apply extends Term {

    private static final Logger logger = LoggerFactory.getLogger(Apply.class);

    private final Funsym funsym;
    private final List<Term> args;

    private final int hashCode;

    Apply(Funsym funsym, List<Term> args) {
        this.funsym = Objects.requireNonNull(funsym, "Apply: 函数符号不能为 null");
        this.args = List.copyOf(Objects.requireNonNull(args, "Apply: 参数不能为 null"));
        this.hashCode = Objects.hash(TermShape.APPLY, funsym, this.args);
        checkNode();
    }

    @Override
    public TermShape getShape() {
        return TermShape.APPLY;
    }

    @Override
    public TermKind classify() {
        return args.isEmpty() ? TermKind.INTERP_ATOM : TermKind.UNINTERP_APP;
    }

    @Override
    public Stream<Term> trms() {
        return args.stream();
    }

    @Override
    public boolean isAtomic() {
        return args.isEmpty();
    }

    @Override
    int compareSameShape(Term other) {
        Apply that = (Apply) other;
        int cmp = funsym.compareTo(that.funsym);
        if (cmp != 0) {
            return cmp;
        }
        return compareLists(args, that.args);
    }

    @Override
    <S> Pair<Term, S> foldMapTrms(S init, BiFunction<? super Term, S, Pair<Term, S>> f) {
        Pair<List<Term>, S> mapped = foldMapList(args, init, f);
        if (mapped.getLeft() == args) {
            return Pair.of(this, mapped.getRight());
        }
        return Pair.of(Term.apply(funsym, mapped.getLeft()), mapped.getRight());
    }

    @Override
    String format(Function<? super Var, Optional<VarStrength>> strength) {
        if (args.isEmpty()) {
            return funsym.toString();
        }
        return args.stream().map(a -> a.format(strength)).collect(Collectors.joining(", ", funsym + "(", ")"));
    }

    @Override
    void checkNode() {
        if (args.size() != funsym.getArity()) {
            logger.error("{} 的元数为 {}，实际参数 {} 个", funsym, funsym.getArity(), args.size());
            throw new InvariantViolationException("Apply: " + funsym + " 的元数与参数个数不一致");
        }
    }

    @Override
    public Sexp toSexp() {
        List<Sexp> items = new ArrayList<>();
        for (Term arg : args) {
            items.add(arg.toSexp());
        }
        return Sexp.tagged(TermShape.APPLY.getTag(), Sexp.list(funsym.toSexp(), Sexp.list(items)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Apply that = (Apply) o;
        return hashCode == that.hashCode && funsym.equals(that.funsym) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
