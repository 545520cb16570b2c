package org.fol.terms;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.fol.sexp.Sexp;
import org.fol.utils.Rational;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * 整数字面量 (Z)。
 */
@Getter
public final class IntegerTerm extends Term {

    private final BigInteger value;

    IntegerTerm(BigInteger value) {
        this.value = Objects.requireNonNull(value, "IntegerTerm: value 不能为 null");
    }

    @Override
    public TermShape getShape() {
        return TermShape.Z;
    }

    @Override
    public TermKind classify() {
        return TermKind.INTERP_ATOM;
    }

    @Override
    public Stream<Term> trms() {
        return Stream.empty();
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public Optional<BigInteger> getZ() {
        return Optional.of(value);
    }

    @Override
    public Optional<Rational> getQ() {
        return Optional.of(Rational.valueOf(value));
    }

    @Override
    int compareSameShape(Term other) {
        return value.compareTo(((IntegerTerm) other).value);
    }

    @Override
    <S> Pair<Term, S> foldMapTrms(S init, BiFunction<? super Term, S, Pair<Term, S>> f) {
        return Pair.of(this, init);
    }

    @Override
    String format(Function<? super Var, Optional<VarStrength>> strength) {
        return value.toString();
    }

    @Override
    void checkNode() {
        // 任意整数都合法
    }

    @Override
    public Sexp toSexp() {
        return Sexp.tagged(TermShape.Z.getTag(), Sexp.atom(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(((IntegerTerm) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
