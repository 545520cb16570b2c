package org.fol.terms;

import org.fol.arith.Polynomial;
import org.fol.core.Funsym;
import org.fol.sexp.Sexp;
import org.fol.sexp.SexpParseException;
import org.fol.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 项的 S 表达式解码。
 * 解码直接重建原始表示，不经过智能构造函数，最后检查结构不变式。
 */
final class TermSexpCodec {

    private static final Logger logger = LoggerFactory.getLogger(TermSexpCodec.class);

    private TermSexpCodec() {
    }

    static Term decode(Sexp sexp) {
        Term t = decodeRaw(sexp);
        t.invariant();
        return t;
    }

    private static Term decodeRaw(Sexp sexp) {
        List<Sexp> tagged = sexp.expectList(2);
        TermShape shape = TermShape.ofTag(tagged.get(0).getAtomValue());
        Sexp payload = tagged.get(1);
        try {
            return switch (shape) {
                case VAR -> Var.identified(
                        payload.getField("name").getAtomValue(),
                        Long.parseLong(payload.getField("id").getAtomValue()));
                case Z -> Term.integer(new BigInteger(payload.getAtomValue()));
                case Q -> new RationalTerm(Rational.valueOf(payload.getAtomValue()));
                case ARITH -> new ArithTerm(Polynomial.ofSexp(payload, TermSexpCodec::decodeRaw));
                case SPLAT -> new Splat(decodeRaw(payload));
                case SIZED -> new Sized(
                        decodeRaw(payload.getField("seq")),
                        decodeRaw(payload.getField("siz")));
                case EXTRACT -> new Extract(
                        decodeRaw(payload.getField("seq")),
                        decodeRaw(payload.getField("off")),
                        decodeRaw(payload.getField("len")));
                case CONCAT -> new Concat(decodeList(payload));
                case APPLY -> {
                    List<Sexp> parts = payload.expectList(2);
                    yield new Apply(Funsym.ofSexp(parts.get(0)), decodeList(parts.get(1)));
                }
            };
        } catch (NumberFormatException e) {
            logger.error("{} 项中的数字格式不对: {}", shape.getTag(), sexp);
            throw new SexpParseException("无效的数字: " + sexp, e);
        }
    }

    private static List<Term> decodeList(Sexp sexp) {
        List<Term> terms = new ArrayList<>();
        for (Sexp item : sexp.getItems()) {
            terms.add(decodeRaw(item));
        }
        return terms;
    }
}
