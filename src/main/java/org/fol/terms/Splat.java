package org.fol.terms;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.fol.sexp.Sexp;

import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * 每个字节都是同一值的序列 {@code x^}。
 */
@Getter
public final class Splat extends Term {

    private final Term elem;

    private final int hashCode;

    Splat(Term elem) {
        this.elem = Objects.requireNonNull(elem, "Splat: 元素不能为 null");
        this.hashCode = 31 * TermShape.SPLAT.hashCode() + elem.hashCode();
    }

    @Override
    public TermShape getShape() {
        return TermShape.SPLAT;
    }

    @Override
    public TermKind classify() {
        return TermKind.INTERP_APP;
    }

    @Override
    public Stream<Term> trms() {
        return Stream.of(elem);
    }

    @Override
    int compareSameShape(Term other) {
        return elem.compareTo(((Splat) other).elem);
    }

    @Override
    <S> Pair<Term, S> foldMapTrms(S init, BiFunction<? super Term, S, Pair<Term, S>> f) {
        Pair<Term, S> mapped = f.apply(elem, init);
        if (mapped.getLeft() == elem) {
            return Pair.of(this, mapped.getRight());
        }
        return Pair.of(Term.splat(mapped.getLeft()), mapped.getRight());
    }

    @Override
    String format(Function<? super Var, Optional<VarStrength>> strength) {
        return elem.format(strength) + "^";
    }

    @Override
    void checkNode() {
        // 任意元素都可以平铺
    }

    @Override
    public Sexp toSexp() {
        return Sexp.tagged(TermShape.SPLAT.getTag(), elem.toSexp());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return hashCode == ((Splat) o).hashCode && elem.equals(((Splat) o).elem);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
