package org.fol.terms;

import org.fol.arith.Polynomial;
import org.fol.core.InvariantViolationException;
import org.fol.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 项与多项式之间的嵌入：字面量作为常数，算术项作为其多项式，其余项作为原子。
 * 算术化简全部交给 {@link Polynomial}，这里只负责来回转换。
 */
final class ArithEmbedding {

    private static final Logger logger = LoggerFactory.getLogger(ArithEmbedding.class);

    private ArithEmbedding() {
    }

    static Polynomial<Term> embed(Term x) {
        return switch (x.getShape()) {
            case Z -> Polynomial.constant(Rational.valueOf(((IntegerTerm) x).getValue()));
            case Q -> Polynomial.constant(((RationalTerm) x).getValue());
            case ARITH -> ((ArithTerm) x).getPoly();
            default -> Polynomial.atom(x);
        };
    }

    /**
     * 把规范多项式投影回项：单个原子即原子本身，常数即字面量，其余为算术项。
     */
    static Term project(Polynomial<Term> poly) {
        return switch (poly.classify()) {
            case TRM -> poly.getAtom().orElseThrow(() -> new InvariantViolationException("TRM 类多项式没有原子: " + poly));
            case CONST -> Term.rational(poly.getConst().orElseThrow(() -> new InvariantViolationException("CONST 类多项式没有常数: " + poly)));
            case INTERPRETED, UNINTERPRETED -> {
                logger.debug("构造算术项: {}", poly);
                yield new ArithTerm(poly);
            }
        };
    }

    /**
     * 把多项式整体作为单项式中的原子。
     */
    static Term reify(Polynomial<Term> poly) {
        return project(poly);
    }
}
