package org.fol.terms;

import org.fol.core.Funsym;
import org.fol.utils.Rational;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.BinaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 构造函数不会引入新的可解项：结果的可解真子项都出现在某个参数的传递可解项中。
 */
class InvariantPreservationTest {

    private static final Var x = Var.identified("x", 1);
    private static final Var y = Var.identified("y", 2);
    private static final Funsym f = Funsym.uninterp("f", 2);

    private static final List<Term> SAMPLES = List.of(
            x,
            y,
            Term.integer(2),
            Term.rational(Rational.HALF),
            Term.add(x, Term.ONE),
            Term.mul(x, y),
            Term.mul(Term.integer(2), x),
            Term.add(Term.mul(x, y), Term.ONE),
            Term.div(x, Term.add(y, Term.ONE)),
            Term.apply(f, x, y),
            Term.splat(x),
            Term.sized(x, Term.integer(3)),
            Term.sized(Term.splat(Term.ZERO), Term.integer(4)),
            Term.extract(x, Term.ZERO, y),
            Term.concat(Term.sized(x, Term.integer(2)), Term.sized(y, Term.integer(3))),
            Term.concat());

    private static TermSet solvableTrmsOf(Term t) {
        return TermSet.of(t.solvableTrms().collect(Collectors.toList()));
    }

    private static TermSet solvablesOf(Term... args) {
        return TermSet.of(Stream.of(args).flatMap(Term::solvables).collect(Collectors.toList()));
    }

    private static TermSet transitiveSolvablesOf(Term... args) {
        return TermSet.of(Stream.of(args).flatMap(Term::transitiveSolvables).collect(Collectors.toList()));
    }

    private static void checkBinary(String name, BinaryOperator<Term> cons) {
        for (Term a : SAMPLES) {
            for (Term b : SAMPLES) {
                Term result = cons.apply(a, b);
                TermSet introduced = solvableTrmsOf(result).diff(transitiveSolvablesOf(a, b));
                assertTrue(introduced.isEmpty(),
                        () -> name + "(" + a + ", " + b + ") = " + result + " 引入了新的可解项 " + introduced);
                assertDoesNotThrow(result::invariant);
            }
        }
    }

    @Nested
    @DisplayName("可解项不增加 (No New Solvables)")
    class NoNewSolvablesTests {

        @Test
        @DisplayName("算术构造函数")
        void testArithmetic() {
            checkBinary("add", Term::add);
            checkBinary("sub", Term::sub);
            checkBinary("mul", Term::mul);
            checkBinary("div", (a, b) -> b.getQ().map(Rational::isZero).orElse(false) ? a : Term.div(a, b));
        }

        @Test
        @DisplayName("序列构造函数")
        void testSequences() {
            checkBinary("concat", (a, b) -> Term.concat(a, b));
            checkBinary("sized", Term::sized);
        }

        @Test
        @DisplayName("函数应用")
        void testApply() {
            checkBinary("apply", (a, b) -> Term.apply(f, a, b));
        }

        @Test
        @DisplayName("切片")
        void testExtract() {
            List<Term> seqs = List.of(
                    x,
                    Term.sized(x, Term.integer(3)),
                    Term.sized(Term.splat(Term.ZERO), Term.integer(4)),
                    Term.extract(x, Term.ZERO, y),
                    Term.concat(Term.sized(x, Term.integer(2)), Term.sized(y, Term.integer(3))));
            List<Term> offs = List.of(Term.ZERO, Term.ONE, Term.integer(2), y);
            List<Term> lens = List.of(Term.ZERO, Term.ONE, Term.integer(2), x, y);

            for (Term seq : seqs) {
                for (Term off : offs) {
                    for (Term len : lens) {
                        Term result = Term.extract(seq, off, len);
                        TermSet introduced = solvableTrmsOf(result).diff(transitiveSolvablesOf(seq, off, len));
                        assertTrue(introduced.isEmpty(),
                                () -> "extract(" + seq + ", " + off + ", " + len + ") = " + result + " 引入了新的可解项 " + introduced);
                        assertDoesNotThrow(result::invariant);
                    }
                }
            }
        }
    }

    @Nested
    @DisplayName("不抵消时可解项相等 (Equality Without Cancellation)")
    class EqualityTests {

        @Test
        @DisplayName("参数的可解项原样保留")
        void testEquality() {
            Term sx = Term.sized(x, Term.integer(2));
            Term sy = Term.sized(y, Term.integer(3));

            assertAll("Equality",
                    () -> assertEquals(transitiveSolvablesOf(x, y), solvableTrmsOf(Term.apply(f, x, y))),
                    () -> assertEquals(transitiveSolvablesOf(sx, sy), solvableTrmsOf(Term.concat(sx, sy))),
                    () -> assertEquals(transitiveSolvablesOf(x, y), solvableTrmsOf(Term.add(x, y)))
            );
        }

        @Test
        @DisplayName("参数中极大的非解释项都是结果的可解子项")
        void testMaximalSolvablesAppear() {
            Term xy = Term.mul(x, y);
            Term twoX = Term.mul(Term.integer(2), x);
            Term sx = Term.sized(x, Term.integer(2));
            Term sy = Term.sized(y, Term.integer(3));

            assertAll("Maximal solvables",
                    () -> assertEquals(solvablesOf(x, y), solvableTrmsOf(Term.apply(f, x, y))),
                    () -> assertEquals(solvablesOf(sx, sy), solvableTrmsOf(Term.concat(sx, sy))),
                    () -> assertEquals(solvablesOf(x, y), solvableTrmsOf(Term.add(x, y))),
                    () -> assertEquals(solvablesOf(x, y), solvableTrmsOf(Term.mul(x, y))),
                    () -> assertEquals(solvablesOf(x, y), solvableTrmsOf(Term.div(x, y))),
                    () -> assertEquals(solvablesOf(xy, Term.ONE), solvableTrmsOf(Term.add(xy, Term.ONE))),
                    () -> assertEquals(TermSet.of(xy), solvableTrmsOf(Term.add(xy, Term.ONE))),
                    () -> assertEquals(solvablesOf(xy, twoX), solvableTrmsOf(Term.add(xy, twoX))),
                    () -> assertTrue(Term.add(xy, Term.ONE).solvableTrms().anyMatch(xy::equals)),
                    () -> assertTrue(Term.add(xy, Term.ONE).trms().anyMatch(xy::equals))
            );
        }

        @Test
        @DisplayName("非单项式因子相乘时整体作为原子，不引入展开后的单项式")
        void testProductOfSumsKeepsFactors() {
            Term x1 = Term.add(x, Term.ONE);
            Term y1 = Term.add(y, Term.ONE);
            Term product = Term.mul(x1, y1);

            assertAll("(x + 1) × (y + 1)",
                    () -> assertEquals(TermKind.UNINTERP_APP, product.classify()),
                    () -> assertEquals(TermSet.of(x1, y1), TermSet.of(product.trms().collect(Collectors.toList()))),
                    () -> assertEquals(solvablesOf(x1, y1), solvableTrmsOf(product)),
                    () -> assertEquals(product, Term.mul(y1, x1)),
                    () -> assertEquals(x1, Term.div(product, y1)),
                    () -> assertDoesNotThrow(product::invariant)
            );
        }

        @Test
        @DisplayName("抵消时可解项可能变少")
        void testCancellation() {
            Term t = Term.sub(Term.add(x, y), y);
            assertAll("Cancellation",
                    () -> assertEquals(x, t),
                    () -> assertTrue(solvableTrmsOf(t).isEmpty()),
                    () -> assertTrue(solvableTrmsOf(Term.extract(y, x, Term.ZERO)).isEmpty())
            );
        }
    }
}
