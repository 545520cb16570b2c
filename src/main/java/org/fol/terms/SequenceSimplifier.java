package org.fol.terms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 序列项的智能构造函数。
 *
 * <p>化简只使用可由常数差证明的长度关系，产生的新子项都由参数的子项经算术构造得到，
 * 因此不会引入新的可解真子项。
 */
final class SequenceSimplifier {

    private static final Logger logger = LoggerFactory.getLogger(SequenceSimplifier.class);

    private SequenceSimplifier() {
    }

    static Term splat(Term x) {
        Objects.requireNonNull(x, "splat: 元素不能为 null");
        return new Splat(x);
    }

    static Term sized(Term seq, Term siz) {
        Objects.requireNonNull(seq, "sized: seq 不能为 null");
        Objects.requireNonNull(siz, "sized: siz 不能为 null");
        Optional<Term> known = seq.seqSize();
        if (known.isPresent() && known.get().equals(siz)) {
            return seq;
        }
        return new Sized(seq, siz);
    }

    static Term extract(Term seq, Term off, Term len) {
        Objects.requireNonNull(seq, "extract: seq 不能为 null");
        Objects.requireNonNull(off, "extract: off 不能为 null");
        Objects.requireNonNull(len, "extract: len 不能为 null");
        // 长度为零
        if (isZero(len)) {
            return Concat.EMPTY;
        }
        Term end = Term.add(off, len);
        switch (seq.getShape()) {
            case EXTRACT -> {
                // a[m,k)[off,len) ==> a[m+off,len)
                Extract inner = (Extract) seq;
                if (provablyGe(inner.getLen(), end)) {
                    logger.debug("合并嵌套切片: {}[{},{})", seq, off, len);
                    return extract(inner.getSeq(), Term.add(inner.getOff(), off), len);
                }
            }
            case SIZED -> {
                Sized sized = (Sized) seq;
                // ⟨n,e^⟩[off,len) ==> ⟨len,e^⟩
                if (sized.getSeq().getShape() == TermShape.SPLAT && provablyGe(sized.getSiz(), end)) {
                    return sized(sized.getSeq(), len);
                }
                // ⟨n,a⟩[0,n) ==> ⟨n,a⟩
                if (isZero(off) && sized.getSiz().equals(len)) {
                    return seq;
                }
            }
            case CONCAT -> {
                Optional<Term> distributed = distribute((Concat) seq, off, len);
                if (distributed.isPresent()) {
                    return distributed.get();
                }
            }
            default -> {
                // 无可用规则
            }
        }
        return new Extract(seq, off, len);
    }

    /**
     * 偏移、长度与各操作数长度都是整数字面量时，把切片分配到被覆盖的各操作数上。
     */
    private static Optional<Term> distribute(Concat seq, Term off, Term len) {
        Optional<BigInteger> offZ = off.getZ();
        Optional<BigInteger> lenZ = len.getZ();
        if (offZ.isEmpty() || lenZ.isEmpty()) {
            return Optional.empty();
        }
        List<BigInteger> sizes = new ArrayList<>();
        BigInteger total = BigInteger.ZERO;
        for (Term arg : seq.getArgs()) {
            Optional<BigInteger> size = arg.seqSize().flatMap(Term::getZ);
            if (size.isEmpty()) {
                return Optional.empty();
            }
            sizes.add(size.get());
            total = total.add(size.get());
        }
        BigInteger from = offZ.get();
        BigInteger to = from.add(lenZ.get());
        if (from.signum() < 0 || to.compareTo(total) > 0) {
            logger.warn("切片 [{},{}) 超出串联 {} 的长度 {}", from, to, seq, total);
            return Optional.empty();
        }
        List<Term> pieces = new ArrayList<>();
        BigInteger pos = BigInteger.ZERO;
        for (int i = 0; i < sizes.size(); i++) {
            BigInteger next = pos.add(sizes.get(i));
            BigInteger start = from.max(pos);
            BigInteger stop = to.min(next);
            if (stop.compareTo(start) > 0) {
                pieces.add(extract(seq.getArgs().get(i), Term.integer(start.subtract(pos)), Term.integer(stop.subtract(start))));
            }
            pos = next;
        }
        logger.debug("切片 [{},{}) 分配到串联 {} 上得到 {}", from, to, seq, pieces);
        return Optional.of(concat(pieces));
    }

    static Term concat(List<Term> xs) {
        Objects.requireNonNull(xs, "concat: 操作数不能为 null");
        List<Term> flat = new ArrayList<>();
        for (Term x : xs) {
            Objects.requireNonNull(x, "concat: 操作数不能为 null");
            if (x.getShape() == TermShape.CONCAT) {
                for (Term y : ((Concat) x).getArgs()) {
                    append(flat, y);
                }
            } else {
                append(flat, x);
            }
        }
        if (flat.isEmpty()) {
            return Concat.EMPTY;
        }
        if (flat.size() == 1) {
            return flat.get(0);
        }
        return new Concat(flat);
    }

    /**
     * 追加操作数，与末尾的相邻切片或相邻平铺合并。
     */
    private static void append(List<Term> acc, Term x) {
        if (!acc.isEmpty()) {
            Optional<Term> merged = merge(acc.get(acc.size() - 1), x);
            if (merged.isPresent()) {
                acc.remove(acc.size() - 1);
                if (merged.get() instanceof Concat c) {
                    c.getArgs().forEach(y -> append(acc, y));
                } else {
                    append(acc, merged.get());
                }
                return;
            }
        }
        acc.add(x);
    }

    private static Optional<Term> merge(Term left, Term right) {
        // a[o,k)^a[o+k,l) ==> a[o,k+l)
        if (left instanceof Extract l && right instanceof Extract r
                && l.getSeq().equals(r.getSeq())
                && Term.add(l.getOff(), l.getLen()).equals(r.getOff())) {
            return Optional.of(extract(l.getSeq(), l.getOff(), Term.add(l.getLen(), r.getLen())));
        }
        // ⟨m,e^⟩^⟨n,e^⟩ ==> ⟨m+n,e^⟩
        if (left instanceof Sized l && right instanceof Sized r
                && l.getSeq().getShape() == TermShape.SPLAT
                && l.getSeq().equals(r.getSeq())) {
            return Optional.of(sized(l.getSeq(), Term.add(l.getSiz(), r.getSiz())));
        }
        return Optional.empty();
    }

    private static boolean isZero(Term t) {
        return t.getZ().map(z -> z.signum() == 0).orElse(false);
    }

    /**
     * 仅当 a - b 是非负字面量时才认为 a ≥ b 成立。
     */
    private static boolean provablyGe(Term a, Term b) {
        return Term.sub(a, b).getQ().map(q -> q.signum() >= 0).orElse(false);
    }
}
