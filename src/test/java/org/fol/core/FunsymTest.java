package org.fol.core;

import org.fol.sexp.SexpParseException;
import org.fol.sexp.SexpParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FunsymTest {

    @Test
    @DisplayName("工厂方法设置种类、名字与元数")
    void testFactories() {
        Funsym f = Funsym.uninterp("f", 2);
        Funsym s8 = Funsym.signed(8);
        Funsym lbl = Funsym.label("main", "entry");

        assertAll("Factories",
                () -> assertEquals(Funsym.Kind.UNINTERP, f.getKind()),
                () -> assertEquals(2, f.getArity()),
                () -> assertEquals("s8", s8.getName()),
                () -> assertEquals(8, s8.getParam()),
                () -> assertEquals(1, s8.getArity()),
                () -> assertEquals("main.entry", lbl.toString()),
                () -> assertEquals(0, lbl.getArity()),
                () -> assertEquals(0, Funsym.floatLit("1.5").getArity()),
                () -> assertSame(Funsym.MUL, Funsym.ofOperator(Funsym.Kind.MUL))
        );
    }

    @Test
    @DisplayName("负元数与非运算符种类应抛出 IllegalArgumentException")
    void testInvalidArguments() {
        assertAll("Invalid arguments",
                () -> assertThrows(IllegalArgumentException.class, () -> Funsym.uninterp("f", -1)),
                () -> assertThrows(IllegalArgumentException.class, () -> Funsym.ofOperator(Funsym.Kind.LABEL))
        );
    }

    @Test
    @DisplayName("相等与比较看种类、名字、参数与元数")
    void testEqualityAndOrder() {
        assertAll("Equality",
                () -> assertEquals(Funsym.uninterp("f", 1), Funsym.uninterp("f", 1)),
                () -> assertNotEquals(Funsym.uninterp("f", 1), Funsym.uninterp("f", 2)),
                () -> assertNotEquals(Funsym.uninterp("f", 1), Funsym.external("f", 1)),
                () -> assertTrue(Funsym.uninterp("f", 1).compareTo(Funsym.uninterp("g", 1)) < 0),
                () -> assertEquals(Funsym.signed(8).hashCode(), Funsym.signed(8).hashCode())
        );
    }

    @Test
    @DisplayName("S 表达式往返")
    void testSexpRoundTrip() {
        Funsym f = Funsym.uninterp("f", 2);
        assertAll("Sexp",
                () -> assertEquals("(UNINTERP f 0 2)", f.toSexp().toString()),
                () -> assertEquals(f, Funsym.ofSexp(f.toSexp())),
                () -> assertEquals(Funsym.BIT_AND, Funsym.ofSexp(Funsym.BIT_AND.toSexp())),
                () -> assertThrows(SexpParseException.class, () -> Funsym.ofSexp(SexpParser.parse("(NOPE f 0 2)"))),
                () -> assertThrows(SexpParseException.class, () -> Funsym.ofSexp(SexpParser.parse("(UNINTERP f x 2)")))
        );
    }
}
