package org.fol.terms;

import org.apache.commons.lang3.tuple.Pair;
import org.fol.arith.Polynomial;
import org.fol.core.Funsym;
import org.fol.core.InvariantViolationException;
import org.fol.utils.Rational;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TermConstructionTest {

    // --- Test Setup ---
    private static Var x, y, a, b;
    private static Funsym f;

    @BeforeAll
    static void setUp() {
        x = Var.identified("x", 1);
        y = Var.identified("y", 2);
        a = Var.identified("a", 3);
        b = Var.identified("b", 4);
        f = Funsym.uninterp("f", 2);
    }

    private static Term z(long n) {
        return Term.integer(n);
    }

    @Nested
    @DisplayName("算术构造 (Arithmetic Constructors)")
    class ArithmeticTests {

        @Test
        @DisplayName("字面量运算直接得到字面量 (1 + 2 = 3, 1 / 2 = 1/2)")
        void testLiteralFolding() {
            Term three = Term.add(z(1), z(2));
            Term half = Term.div(z(1), z(2));

            assertAll("Literal folding",
                    () -> assertEquals(z(3), three),
                    () -> assertEquals(BigInteger.valueOf(3), three.getZ().orElseThrow()),
                    () -> assertEquals(TermShape.Q, half.getShape()),
                    () -> assertTrue(half.getZ().isEmpty()),
                    () -> assertEquals(Rational.HALF, half.getQ().orElseThrow()),
                    () -> assertEquals(z(2), Term.rational(Rational.valueOf(4, 2)))
            );
        }

        @Test
        @DisplayName("零和一是共享常量")
        void testSharedConstants() {
            assertAll("Shared constants",
                    () -> assertSame(Term.ZERO, Term.zero()),
                    () -> assertSame(Term.ZERO, Term.integer(0)),
                    () -> assertSame(Term.ONE, Term.integer(BigInteger.ONE)),
                    () -> assertSame(Term.ZERO, Term.add(x, Term.neg(x))),
                    () -> assertSame(Term.ONE, Term.pow(x, 0))
            );
        }

        @Test
        @DisplayName("单原子多项式投影为原子本身 (x + 0 = x, x^1 = x)")
        void testSingleAtomProjectsToAtom() {
            assertAll("Projection",
                    () -> assertSame(x, Term.add(x, Term.ZERO)),
                    () -> assertSame(x, Term.pow(x, 1)),
                    () -> assertSame(x, Term.mulq(Rational.ONE, x)),
                    () -> assertSame(x, Term.sub(Term.add(x, y), y)),
                    () -> assertSame(x, Term.var(x))
            );
        }

        @Test
        @DisplayName("线性项可解释，非线性单项式不可解释")
        void testArithClassification() {
            Term linear = Term.add(Term.mul(z(2), x), y);
            Term product = Term.mul(x, y);
            Term square = Term.pow(x, 2);

            assertAll("Arith classification",
                    () -> assertEquals(TermShape.ARITH, linear.getShape()),
                    () -> assertEquals(TermKind.INTERP_APP, linear.classify()),
                    () -> assertEquals(TermKind.UNINTERP_APP, product.classify()),
                    () -> assertEquals(TermKind.UNINTERP_APP, square.classify()),
                    () -> assertEquals(TermKind.INTERP_APP, Term.mulq(Rational.valueOf(3), product).classify())
            );
        }

        @Test
        @DisplayName("除以字面量零应抛出 ArithmeticException")
        void testDivisionByZero() {
            assertAll("Division by zero",
                    () -> assertThrows(ArithmeticException.class, () -> Term.div(x, Term.ZERO)),
                    () -> assertThrows(ArithmeticException.class, () -> Term.div(x, Term.sub(y, y))),
                    () -> assertThrows(ArithmeticException.class, () -> Term.pow(Term.ZERO, -1))
            );
        }

        @Test
        @DisplayName("除以和式时和式整体作为原子 (x / (y + 1))")
        void testDivisionBySum() {
            Term sum = Term.add(y, Term.ONE);
            Term quotient = Term.div(x, sum);

            assertAll("x / (y + 1)",
                    () -> assertEquals(TermShape.ARITH, quotient.getShape()),
                    () -> assertEquals(TermKind.UNINTERP_APP, quotient.classify()),
                    () -> assertEquals(List.of(x, sum), quotient.trms().collect(Collectors.toList())),
                    () -> assertEquals(List.of(x, y), quotient.solvableTrms().collect(Collectors.toList()))
            );
        }

        @Test
        @DisplayName("arith 重新规范化多项式中的字面量原子")
        void testArithFromPolynomial() {
            Polynomial<Term> p = Polynomial.<Term>atom(z(3)).add(Polynomial.atom(x));
            assertEquals(Term.add(x, z(3)), Term.arith(p));
        }

        @Test
        @DisplayName("场景1: 2x + 3 不是序列，也不是整数字面量")
        void testScenario_LinearArith() {
            Term t = Term.add(Term.mul(z(2), x), z(3));

            assertAll("2 × x + 3",
                    () -> assertThrows(InvariantViolationException.class, t::seqSizeExn),
                    () -> assertTrue(t.seqSize().isEmpty()),
                    () -> assertTrue(t.getZ().isEmpty()),
                    () -> assertTrue(t.getQ().isEmpty()),
                    () -> assertEquals("(2 × %x_1 + 3)", t.toString())
            );
        }
    }

    @Nested
    @DisplayName("序列构造 (Sequence Constructors)")
    class SequenceTests {

        @Test
        @DisplayName("长度为零的切片是空串联")
        void testZeroLengthExtract() {
            assertAll("Zero-length extract",
                    () -> assertEquals(Term.concat(), Term.extract(a, x, Term.ZERO)),
                    () -> assertTrue(Term.extract(a, Term.ZERO, Term.ZERO).isAtomic()),
                    () -> assertEquals("⟨⟩", Term.extract(a, x, Term.ZERO).toString())
            );
        }

        @Test
        @DisplayName("已知长度等于 siz 时 sized 返回原序列")
        void testSizedOfKnownSize() {
            Term e = Term.extract(a, Term.ZERO, y);
            assertAll("Sized",
                    () -> assertSame(e, Term.sized(e, y)),
                    () -> assertEquals(TermShape.SIZED, Term.sized(e, x).getShape()),
                    () -> assertEquals(TermShape.SIZED, Term.sized(a, y).getShape())
            );
        }

        @Test
        @DisplayName("嵌套切片在范围可证时合并 (a[1,10)[2,3) = a[3,3))")
        void testNestedExtract() {
            Term inner = Term.extract(a, z(1), z(10));
            assertAll("Nested extract",
                    () -> assertEquals(new Extract(a, z(3), z(3)), Term.extract(inner, z(2), z(3))),
                    () -> assertEquals(TermShape.EXTRACT,
                            ((Extract) Term.extract(Term.extract(a, Term.ZERO, y), z(2), z(3))).getSeq().getShape())
            );
        }

        @Test
        @DisplayName("平铺序列的切片仍是平铺 (⟨10,x^⟩[2,3) = ⟨3,x^⟩)")
        void testExtractOfSizedSplat() {
            Term s = Term.sized(Term.splat(x), z(10));
            assertEquals(Term.sized(Term.splat(x), z(3)), Term.extract(s, z(2), z(3)));
        }

        @Test
        @DisplayName("从零开始取满长度返回原序列 (⟨y,a⟩[0,y) = ⟨y,a⟩)")
        void testFullExtractOfSized() {
            Term s = Term.sized(a, y);
            assertSame(s, Term.extract(s, Term.ZERO, y));
        }

        @Test
        @DisplayName("字面量范围的切片分配到串联的各操作数")
        void testExtractDistributesOverConcat() {
            Term sa = Term.sized(a, z(2));
            Term sb = Term.sized(b, z(3));
            Term c = Term.concat(sa, sb);

            assertAll("Distribution",
                    () -> assertEquals(Term.concat(Term.extract(sa, Term.ONE, Term.ONE), Term.extract(sb, Term.ZERO, z(2))),
                            Term.extract(c, z(1), z(3))),
                    () -> assertSame(sb, Term.extract(c, z(2), z(3))),
                    () -> assertEquals(TermShape.EXTRACT, Term.extract(c, x, z(3)).getShape()),
                    () -> assertEquals(TermShape.EXTRACT, Term.extract(c, z(4), z(3)).getShape())
            );
        }

        @Test
        @DisplayName("串联展平嵌套串联，单元素返回元素本身")
        void testConcatFlattening() {
            Term inner = Term.concat(a, b);
            Term outer = Term.concat(inner, x);

            assertAll("Flattening",
                    () -> assertEquals(List.of(a, b, x), ((Concat) outer).getArgs()),
                    () -> assertSame(a, Term.concat(a)),
                    () -> assertSame(a, Term.concat(Term.concat(a))),
                    () -> assertSame(a, Term.concat(Term.concat(), a, Term.concat())),
                    () -> assertEquals(TermKind.INTERP_ATOM, Term.concat().classify())
            );
        }

        @Test
        @DisplayName("相邻切片与相邻平铺合并")
        void testConcatMergesAdjacent() {
            Term left = Term.extract(a, Term.ZERO, z(2));
            Term right = Term.extract(a, z(2), z(3));
            Term splat3 = Term.sized(Term.splat(x), z(3));
            Term splat2 = Term.sized(Term.splat(x), z(2));

            assertAll("Merging",
                    () -> assertEquals(Term.extract(a, Term.ZERO, z(5)), Term.concat(left, right)),
                    () -> assertEquals(Term.sized(Term.splat(x), z(5)), Term.concat(splat3, splat2)),
                    () -> assertEquals(TermShape.CONCAT, Term.concat(right, left).getShape())
            );
        }

        @Test
        @DisplayName("场景2: 两段平铺的串联没有可解子项，高度为 3")
        void testScenario_ConcatOfSplats() {
            Term t = Term.concat(
                    Term.sized(Term.splat(Term.ZERO), z(3)),
                    Term.sized(Term.splat(Term.ONE), z(2)));

            assertAll("⟨3,0^⟩^⟨2,1^⟩",
                    () -> assertEquals(0, t.transitiveSolvables().count()),
                    () -> assertEquals(3, t.height()),
                    () -> assertEquals(z(5), t.seqSizeExn()),
                    () -> assertEquals(TermKind.INTERP_APP, t.classify()),
                    () -> assertEquals("(⟨3,0^⟩^⟨2,1^⟩)", t.toString())
            );
        }
    }

    @Nested
    @DisplayName("函数应用 (Application)")
    class ApplyTests {

        @Test
        @DisplayName("元数不一致应抛出 IllegalArgumentException")
        void testArityMismatch() {
            assertAll("Arity",
                    () -> assertThrows(IllegalArgumentException.class, () -> Term.apply(f, x)),
                    () -> assertThrows(IllegalArgumentException.class, () -> Term.apply(f, x, y, a)),
                    () -> assertDoesNotThrow(() -> Term.apply(f, x, y))
            );
        }

        @Test
        @DisplayName("零元应用是解释原子")
        void testNullaryApply() {
            Term c = Term.apply(Funsym.uninterp("c", 0));
            assertAll("Nullary",
                    () -> assertEquals(TermKind.INTERP_ATOM, c.classify()),
                    () -> assertTrue(c.isAtomic()),
                    () -> assertEquals(0, c.height()),
                    () -> assertEquals("c", c.toString())
            );
        }

        @Test
        @DisplayName("场景3: f(x, y) 是自身唯一的可解项，直接可解子项为 x 和 y")
        void testScenario_Apply() {
            Term t = Term.apply(f, x, y);

            assertAll("f(x, y)",
                    () -> assertEquals(TermKind.UNINTERP_APP, t.classify()),
                    () -> assertEquals(List.of(t), t.solvables().collect(Collectors.toList())),
                    () -> assertEquals(List.of(x, y), t.solvableTrms().collect(Collectors.toList())),
                    () -> assertEquals(1, t.height()),
                    () -> assertEquals("f(%x_1, %y_2)", t.toString())
            );
        }
    }

    @Nested
    @DisplayName("幂等性 (Idempotence)")
    class IdempotenceTests {

        @Test
        @DisplayName("对化简结果重新应用构造函数得到相同的项")
        void testReconstruction() {
            List<Term> samples = List.of(
                    Term.add(Term.mul(z(2), x), z(3)),
                    Term.mul(x, y),
                    Term.div(x, Term.add(y, Term.ONE)),
                    Term.concat(Term.sized(a, z(2)), Term.extract(b, x, y)),
                    Term.extract(a, x, y),
                    Term.sized(Term.splat(x), y),
                    Term.apply(f, x, Term.add(y, Term.ONE)));

            for (Term t : samples) {
                Term rebuilt = t.map(s -> s);
                assertSame(t, rebuilt, "map(identity) should return the same instance for " + t);
                assertEquals(t, t.foldMap(0, (s, n) -> Pair.of(s, n)).getLeft());
                assertDoesNotThrow(t::invariant, "invariant should hold for " + t);
            }
        }
    }
}
