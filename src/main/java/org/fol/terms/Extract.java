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
 * 序列 seq 从 off 开始长度为 len 的切片，打印为 {@code seq[off,len)}。
 */
@Getter
public final class Extract extends Term {

    private final Term seq;
    private final Term off;
    private final Term len;

    private final int hashCode;

    Extract(Term seq, Term off, Term len) {
        this.seq = Objects.requireNonNull(seq, "Extract: seq 不能为 null");
        this.off = Objects.requireNonNull(off, "Extract: off 不能为 null");
        this.len = Objects.requireNonNull(len, "Extract: len 不能为 null");
        this.hashCode = Objects.hash(TermShape.EXTRACT, seq, off, len);
    }

    @Override
    public TermShape getShape() {
        return TermShape.EXTRACT;
    }

    @Override
    public TermKind classify() {
        return TermKind.INTERP_APP;
    }

    @Override
    public Stream<Term> trms() {
        return Stream.of(seq, off, len);
    }

    @Override
    public Term seqSizeExn() {
        return len;
    }

    @Override
    public Optional<Term> seqSize() {
        return Optional.of(len);
    }

    @Override
    int compareSameShape(Term other) {
        Extract that = (Extract) other;
        int cmp = seq.compareTo(that.seq);
        if (cmp != 0) {
            return cmp;
        }
        cmp = off.compareTo(that.off);
        if (cmp != 0) {
            return cmp;
        }
        return len.compareTo(that.len);
    }

    @Override
    <S> Pair<Term, S> foldMapTrms(S init, BiFunction<? super Term, S, Pair<Term, S>> f) {
        Pair<Term, S> newSeq = f.apply(seq, init);
        Pair<Term, S> newOff = f.apply(off, newSeq.getRight());
        Pair<Term, S> newLen = f.apply(len, newOff.getRight());
        if (newSeq.getLeft() == seq && newOff.getLeft() == off && newLen.getLeft() == len) {
            return Pair.of(this, newLen.getRight());
        }
        return Pair.of(Term.extract(newSeq.getLeft(), newOff.getLeft(), newLen.getLeft()), newLen.getRight());
    }

    @Override
    String format(Function<? super Var, Optional<VarStrength>> strength) {
        return seq.format(strength) + "[" + off.format(strength) + "," + len.format(strength) + ")";
    }

    @Override
    void checkNode() {
        // 切片范围在符号层面无法检查
    }

    @Override
    public Sexp toSexp() {
        return Sexp.tagged(TermShape.EXTRACT.getTag(), Sexp.list(
                Sexp.field("seq", seq.toSexp()),
                Sexp.field("off", off.toSexp()),
                Sexp.field("len", len.toSexp())));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Extract that = (Extract) o;
        return hashCode == that.hashCode && seq.equals(that.seq) && off.equals(that.off) && len.equals(that.len);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
