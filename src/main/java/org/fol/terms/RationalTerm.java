package org.fol.terms;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.fol.core.InvariantViolationException;
import org.fol.sexp.Sexp;
import org.fol.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * 非整数的有理数字面量 (Q)。整数值总是表示为 {@link IntegerTerm}。
 */
@Getter
public final class RationalTerm extends Term {

    private static final Logger logger = LoggerFactory.getLogger(RationalTerm.class);

    private final Rational value;

    RationalTerm(Rational value) {
        this.value = Objects.requireNonNull(value, "RationalTerm: value 不能为 null");
        checkNode();
    }

    @Override
    public TermShape getShape() {
        return TermShape.Q;
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
    public Optional<Rational> getQ() {
        return Optional.of(value);
    }

    @Override
    int compareSameShape(Term other) {
        return value.compareTo(((RationalTerm) other).value);
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
        if (value.isInteger()) {
            logger.error("Q 字面量 {} 是整数，应表示为 Z", value);
            throw new InvariantViolationException("Q 字面量不能是整数: " + value);
        }
    }

    @Override
    public Sexp toSexp() {
        return Sexp.tagged(TermShape.Q.getTag(), Sexp.atom(value.toString()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(((RationalTerm) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
