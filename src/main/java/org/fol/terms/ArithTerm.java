package org.fol.terms;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.fol.arith.ArithClass;
import org.fol.arith.Monomial;
import org.fol.arith.Polynomial;
import org.fol.core.InvariantViolationException;
import org.fol.sexp.Sexp;
import org.fol.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 算术项：以项为原子的规范多项式。
 * 多项式的分类总是 INTERPRETED 或 UNINTERPRETED，单原子与常数在构造时已投影为原子或字面量。
 * UNINTERPRETED 的直接子项是单项式的因子；INTERPRETED 的直接子项是各单项式，
 * 非一次原子的单项式作为 UNINTERPRETED 算术项出现。
 */
@Getter
public final class ArithTerm extends Term {

    private static final Logger logger = LoggerFactory.getLogger(ArithTerm.class);

    private final Polynomial<Term> poly;

    ArithTerm(Polynomial<Term> poly) {
        this.poly = Objects.requireNonNull(poly, "ArithTerm: 多项式不能为 null");
        checkNode();
    }

    @Override
    public TermShape getShape() {
        return TermShape.ARITH;
    }

    @Override
    public TermKind classify() {
        return poly.classify() == ArithClass.UNINTERPRETED ? TermKind.UNINTERP_APP : TermKind.INTERP_APP;
    }

    @Override
    public Stream<Term> trms() {
        if (poly.classify() == ArithClass.UNINTERPRETED) {
            return poly.atoms();
        }
        return poly.getCoefficients().keySet().stream().map(ArithTerm::monomialTrm);
    }

    private static Term monomialTrm(Monomial<Term> mono) {
        return mono.getAtom().orElseGet(() -> ArithEmbedding.project(Polynomial.of(mono, Rational.ONE)));
    }

    @Override
    int compareSameShape(Term other) {
        return poly.compareTo(((ArithTerm) other).poly);
    }

    @Override
    <S> Pair<Term, S> foldMapTrms(S init, BiFunction<? super Term, S, Pair<Term, S>> f) {
        List<Term> children = trms().collect(Collectors.toList());
        Pair<List<Term>, S> mapped = foldMapList(children, init, f);
        if (mapped.getLeft() == children) {
            return Pair.of(this, mapped.getRight());
        }
        Polynomial<Term> rebuilt;
        if (poly.classify() == ArithClass.UNINTERPRETED) {
            Map<Term, Term> subst = new HashMap<>();
            for (int i = 0; i < children.size(); i++) {
                subst.put(children.get(i), mapped.getLeft().get(i));
            }
            rebuilt = poly.map(a -> ArithEmbedding.embed(subst.get(a)), ArithEmbedding::reify);
        } else {
            // 子项与单项式一一对应，顺序相同
            rebuilt = Polynomial.constant(poly.getConstant());
            int i = 0;
            for (Rational coeff : poly.getCoefficients().values()) {
                rebuilt = rebuilt.add(ArithEmbedding.embed(mapped.getLeft().get(i++)).mulConst(coeff));
            }
        }
        return Pair.of(ArithEmbedding.project(rebuilt), mapped.getRight());
    }

    @Override
    String format(Function<? super Var, Optional<VarStrength>> strength) {
        return poly.format(a -> a.format(strength));
    }

    @Override
    void checkNode() {
        ArithClass cls = poly.classify();
        if (cls == ArithClass.TRM || cls == ArithClass.CONST) {
            logger.error("算术项的多项式 {} 分类为 {}，应已投影", poly, cls);
            throw new InvariantViolationException("Arith 项不能是 " + cls + " 类多项式: " + poly);
        }
        poly.atoms().forEach(a -> {
            if (a.getShape() == TermShape.Z || a.getShape() == TermShape.Q) {
                logger.error("算术项 {} 含有字面量原子 {}", poly, a);
                throw new InvariantViolationException("Arith 项的原子不能是字面量: " + a);
            }
            if (a.getShape() == TermShape.ARITH && a.classify() == TermKind.UNINTERP_APP) {
                logger.error("算术项 {} 含有单项式原子 {}", poly, a);
                throw new InvariantViolationException("Arith 项的原子不能是单项式: " + a);
            }
        });
    }

    @Override
    public Sexp toSexp() {
        return Sexp.tagged(TermShape.ARITH.getTag(), poly.toSexp(Term::toSexp));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return poly.equals(((ArithTerm) o).poly);
    }

    @Override
    public int hashCode() {
        return poly.hashCode();
    }
}
