package org.fol.terms;

import org.apache.commons.lang3.tuple.Pair;
import org.fol.core.Funsym;
import org.fol.utils.Rational;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TermTransformTest {

    private static final Var x = Var.identified("x", 1);
    private static final Var y = Var.identified("y", 2);
    private static final Var z = Var.identified("z", 3);
    private static final Funsym f = Funsym.uninterp("f", 2);

    @Nested
    @DisplayName("映射 (Map)")
    class MapTests {

        @Test
        @DisplayName("恒等映射返回同一实例")
        void testIdentityMap() {
            Term t = Term.apply(f, Term.add(x, Term.ONE), Term.concat(Term.splat(y), Term.sized(z, y)));
            assertAll("Identity",
                    () -> assertSame(t, t.map(s -> s)),
                    () -> assertSame(t, t.mapVars(v -> v)),
                    () -> assertSame(t, t.mapSolvables(s -> s)),
                    () -> assertSame(x, x.map(s -> s))
            );
        }

        @Test
        @DisplayName("映射直接子项后经智能构造函数重建")
        void testMapRebuildsThroughConstructors() {
            Term seq = Term.concat(Term.sized(x, Term.integer(2)), y);
            // y 换成空串联后只剩一个操作数
            Term mapped = seq.map(s -> s.equals(y) ? Term.concat() : s);
            assertEquals(Term.sized(x, Term.integer(2)), mapped);
        }

        @Test
        @DisplayName("mapVars 替换变量并重新规范化算术 (x + 2y)[x := y] = 3y")
        void testMapVarsInArith() {
            Term t = Term.add(x, Term.mul(Term.integer(2), y));
            assertAll("mapVars",
                    () -> assertEquals(Term.mul(Term.integer(3), y), t.mapVars(v -> v.equals(x) ? y : v)),
                    () -> assertSame(Term.ZERO, Term.sub(x, y).mapVars(v -> x)),
                    () -> assertEquals(Term.apply(f, z, z), Term.apply(f, x, y).mapVars(v -> z))
            );
        }

        @Test
        @DisplayName("mapSolvables 只替换可解项，解释结构不变")
        void testMapSolvables() {
            Term fxy = Term.apply(f, x, y);
            Term t = Term.add(fxy, Term.integer(1));
            Term mapped = t.mapSolvables(s -> s.equals(fxy) ? z : s);

            assertAll("mapSolvables",
                    () -> assertEquals(Term.add(z, Term.integer(1)), mapped),
                    () -> assertEquals(t.getShape(), mapped.getShape()),
                    () -> assertEquals(z, fxy.mapSolvables(s -> z))
            );
        }

        @Test
        @DisplayName("负次幂下的子项替换为零应抛出 ArithmeticException")
        void testZeroUnderNegativePower() {
            Term quotient = Term.div(x, y);
            Term squareInverse = Term.pow(Term.add(y, Term.ONE), -2);
            assertAll("Zero substitution",
                    () -> assertThrows(ArithmeticException.class, () -> quotient.map(s -> s.equals(y) ? Term.ZERO : s)),
                    () -> assertThrows(ArithmeticException.class,
                            () -> quotient.foldMap(0, (s, n) -> Pair.of(s.equals(y) ? Term.ZERO : s, n + 1))),
                    () -> assertThrows(ArithmeticException.class,
                            () -> squareInverse.map(s -> Term.add(y, Term.ONE).equals(s) ? Term.ZERO : s)),
                    () -> assertEquals(Term.ZERO, quotient.map(s -> s.equals(x) ? Term.ZERO : s)),
                    () -> assertEquals(Term.mul(x, Term.rational(Rational.HALF)), quotient.map(s -> s.equals(y) ? Term.integer(2) : s))
            );
        }
    }

    @Nested
    @DisplayName("带累积值的映射 (foldMap)")
    class FoldMapTests {

        @Test
        @DisplayName("从左到右传递累积值")
        void testFoldMapThreadsLeftToRight() {
            Term t = Term.apply(f, x, y);
            List<Term> visited = new ArrayList<>();
            Pair<Term, Integer> result = t.foldMap(0, (s, n) -> {
                visited.add(s);
                return Pair.of(s, n + 1);
            });

            assertAll("Threading",
                    () -> assertSame(t, result.getLeft()),
                    () -> assertEquals(2, result.getRight()),
                    () -> assertEquals(List.of(x, y), visited)
            );
        }

        @Test
        @DisplayName("用累积值给每个子项换上编号变量")
        void testFoldMapRenumbers() {
            Term t = Term.apply(f, x, x);
            Pair<Term, Long> result = t.foldMap(10L, (s, n) -> Pair.of(Var.identified("v", n), n + 1));

            assertAll("Renumbering",
                    () -> assertEquals(Term.apply(f, Var.identified("v", 10), Var.identified("v", 11)), result.getLeft()),
                    () -> assertEquals(12L, result.getRight())
            );
        }
    }

    @Nested
    @DisplayName("变量替换 (VarSubst)")
    class VarSubstTests {

        @Test
        @DisplayName("applyTo 对项中每个变量应用替换")
        void testApplyTo() {
            VarSubst s = VarSubst.of(Map.of(x, z));
            Term t = Term.apply(f, x, Term.add(x, y));

            assertAll("applyTo",
                    () -> assertEquals(Term.apply(f, z, Term.add(z, y)), s.applyTo(t)),
                    () -> assertSame(t, VarSubst.empty().applyTo(t)),
                    () -> assertEquals(y, s.apply(y))
            );
        }
    }
}
