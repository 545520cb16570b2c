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
 * 长度为 siz 的序列 seq，打印为 {@code ⟨siz,seq⟩}。
 */
@Getter
public final class Sized extends Term {

    private final Term seq;
    private final Term siz;

    private final int hashCode;

    Sized(Term seq, Term siz) {
        this.seq = Objects.requireNonNull(seq, "Sized: seq 不能为 null");
        this.siz = Objects.requireNonNull(siz, "Sized: siz 不能为 null");
        this.hashCode = Objects.hash(TermShape.SIZED, seq, siz);
    }

    @Override
    public TermShape getShape() {
        return TermShape.SIZED;
    }

    @Override
    public TermKind classify() {
        return TermKind.INTERP_APP;
    }

    @Override
    public Stream<Term> trms() {
        return Stream.of(seq, siz);
    }

    @Override
    public Term seqSizeExn() {
        return siz;
    }

    @Override
    public Optional<Term> seqSize() {
        return Optional.of(siz);
    }

    @Override
    int compareSameShape(Term other) {
        Sized that = (Sized) other;
        int cmp = seq.compareTo(that.seq);
        if (cmp != 0) {
            return cmp;
        }
        return siz.compareTo(that.siz);
    }

    @Override
    <S> Pair<Term, S> foldMapTrms(S init, BiFunction<? super Term, S, Pair<Term, S>> f) {
        Pair<Term, S> newSeq = f.apply(seq, init);
        Pair<Term, S> newSiz = f.apply(siz, newSeq.getRight());
        if (newSeq.getLeft() == seq && newSiz.getLeft() == siz) {
            return Pair.of(this, newSiz.getRight());
        }
        return Pair.of(Term.sized(newSeq.getLeft(), newSiz.getLeft()), newSiz.getRight());
    }

    @Override
    String format(Function<? super Var, Optional<VarStrength>> strength) {
        return "⟨" + siz.format(strength) + "," + seq.format(strength) + "⟩";
    }

    @Override
    void checkNode() {
        // 长度与内容均无局部约束
    }

    @Override
    public Sexp toSexp() {
        return Sexp.tagged(TermShape.SIZED.getTag(), Sexp.list(
                Sexp.field("seq", seq.toSexp()),
                Sexp.field("siz", siz.toSexp())));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Sized that = (Sized) o;
        return hashCode == that.hashCode && seq.equals(that.seq) && siz.equals(that.siz);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
