package org.fol.terms;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.fol.core.InvariantViolationException;
import org.fol.sexp.Sexp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 序列的串联。操作数个数不为 1，且操作数本身不是串联。
 * 空串联 {@code ⟨⟩} 是长度为零的序列。
 */
@Getter
public final class Concat extends Term {

    private static final Logger logger = LoggerFactory.getLogger(Concat.class);

    static final Concat EMPTY = new Concat(Collections.emptyList());

    private final List<Term> args;

    private final int hashCode;

    Concat(List<Term> args) {
        this.args = List.copyOf(Objects.requireNonNull(args, "Concat: 操作数不能为 null"));
        this.hashCode = 31 * TermShape.CONCAT.hashCode() + this.args.hashCode();
        checkNode();
    }

    @Override
    public TermShape getShape() {
        return TermShape.CONCAT;
    }

    @Override
    public TermKind classify() {
        return args.isEmpty() ? TermKind.INTERP_ATOM : TermKind.INTERP_APP;
    }

    @Override
    public Stream<Term> trms() {
        return args.stream();
    }

    @Override
    public boolean isAtomic() {
        return args.isEmpty();
    }

    /**
     * 各操作数长度之和。
     * @throws InvariantViolationException 如果某个操作数没有静态长度
     */
    @Override
    public Term seqSizeExn() {
        Term sum = Term.ZERO;
        for (Term arg : args) {
            sum = Term.add(sum, arg.seqSizeExn());
        }
        return sum;
    }

    @Override
    public Optional<Term> seqSize() {
        Term sum = Term.ZERO;
        for (Term arg : args) {
            Optional<Term> size = arg.seqSize();
            if (size.isEmpty()) {
                return Optional.empty();
            }
            sum = Term.add(sum, size.get());
        }
        return Optional.of(sum);
    }

    @Override
    int compareSameShape(Term other) {
        return compareLists(args, ((Concat) other).args);
    }

    @Override
    <S> Pair<Term, S> foldMapTrms(S init, BiFunction<? super Term, S, Pair<Term, S>> f) {
        Pair<List<Term>, S> mapped = foldMapList(args, init, f);
        if (mapped.getLeft() == args) {
            return Pair.of(this, mapped.getRight());
        }
        return Pair.of(Term.concat(mapped.getLeft()), mapped.getRight());
    }

    @Override
    String format(Function<? super Var, Optional<VarStrength>> strength) {
        if (args.isEmpty()) {
            return "⟨⟩";
        }
        return args.stream().map(a -> a.format(strength)).collect(Collectors.joining("^", "(", ")"));
    }

    @Override
    void checkNode() {
        if (args.size() == 1) {
            logger.error("单元素串联: {}", args);
            throw new InvariantViolationException("Concat 不能只有一个操作数: " + args.get(0));
        }
        for (Term arg : args) {
            if (arg.getShape() == TermShape.CONCAT) {
                logger.error("嵌套串联: {}", arg);
                throw new InvariantViolationException("Concat 的操作数不能是 Concat: " + arg);
            }
        }
    }

    @Override
    public Sexp toSexp() {
        List<Sexp> items = new ArrayList<>();
        for (Term arg : args) {
            items.add(arg.toSexp());
        }
        return Sexp.tagged(TermShape.CONCAT.getTag(), Sexp.list(items));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Concat that = (Concat) o;
        return hashCode == that.hashCode && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
