package org.fol.core;

import lombok.Getter;
import org.fol.sexp.Sexp;
import org.fol.sexp.SexpParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 函数符号，作为 Apply 项的头部。
 * 项代数从不解释函数符号的含义，只依赖其身份、比较与元数。
 * 此类是不可变的。
 */
@Getter
public final class Funsym implements Comparable<Funsym> {

    private static final Logger logger = LoggerFactory.getLogger(Funsym.class);

    /**
     * 函数符号的种类。
     */
    public enum Kind {
        UNINTERP,
        EXTERNAL,
        SIGNED,
        UNSIGNED,
        FLOAT,
        LABEL,
        MUL,
        DIV,
        REM,
        BIT_AND,
        BIT_OR,
        BIT_XOR,
        BIT_SHL,
        BIT_LSHR,
        BIT_ASHR
    }

    public static final Funsym MUL = new Funsym(Kind.MUL, "×", 0, 2);
    public static final Funsym DIV = new Funsym(Kind.DIV, "/", 0, 2);
    public static final Funsym REM = new Funsym(Kind.REM, "rem", 0, 2);
    public static final Funsym BIT_AND = new Funsym(Kind.BIT_AND, "&&", 0, 2);
    public static final Funsym BIT_OR = new Funsym(Kind.BIT_OR, "||", 0, 2);
    public static final Funsym BIT_XOR = new Funsym(Kind.BIT_XOR, "xor", 0, 2);
    public static final Funsym BIT_SHL = new Funsym(Kind.BIT_SHL, "shl", 0, 2);
    public static final Funsym BIT_LSHR = new Funsym(Kind.BIT_LSHR, "lshr", 0, 2);
    public static final Funsym BIT_ASHR = new Funsym(Kind.BIT_ASHR, "ashr", 0, 2);

    private final Kind kind;
    private final String name;
    // SIGNED/UNSIGNED 的位宽，其余种类为 0
    private final int param;
    private final int arity;

    private final int hashCode;

    private Funsym(Kind kind, String name, int param, int arity) {
        this.kind = Objects.requireNonNull(kind, "Funsym: kind 不能为 null");
        this.name = Objects.requireNonNull(name, "Funsym: name 不能为 null");
        if (arity < 0) {
            logger.error("Funsym {}: 元数 {} 为负", name, arity);
            throw new IllegalArgumentException("Funsym: 元数不能为负: " + arity);
        }
        this.param = param;
        this.arity = arity;
        this.hashCode = Objects.hash(kind, name, param, arity);
    }

    // --- 工厂方法 ---

    public static Funsym uninterp(String name, int arity) {
        return new Funsym(Kind.UNINTERP, name, 0, arity);
    }

    public static Funsym external(String name, int arity) {
        return new Funsym(Kind.EXTERNAL, name, 0, arity);
    }

    /**
     * 截断为 bits 位有符号整数的一元函数。
     */
    public static Funsym signed(int bits) {
        return new Funsym(Kind.SIGNED, "s" + bits, bits, 1);
    }

    /**
     * 截断为 bits 位无符号整数的一元函数。
     */
    public static Funsym unsigned(int bits) {
        return new Funsym(Kind.UNSIGNED, "u" + bits, bits, 1);
    }

    /**
     * 浮点字面量，表示为零元函数。
     */
    public static Funsym floatLit(String repr) {
        return new Funsym(Kind.FLOAT, repr, 0, 0);
    }

    /**
     * 代码标签（函数内的基本块名），表示为零元函数。
     */
    public static Funsym label(String parent, String name) {
        return new Funsym(Kind.LABEL, parent + "." + name, 0, 0);
    }

    /**
     * 二元运算符种类对应的预定义常量。
     */
    public static Funsym ofOperator(Kind kind) {
        return switch (kind) {
            case MUL -> MUL;
            case DIV -> DIV;
            case REM -> REM;
            case BIT_AND -> BIT_AND;
            case BIT_OR -> BIT_OR;
            case BIT_XOR -> BIT_XOR;
            case BIT_SHL -> BIT_SHL;
            case BIT_LSHR -> BIT_LSHR;
            case BIT_ASHR -> BIT_ASHR;
            default -> throw new IllegalArgumentException("Funsym: " + kind + " 不是二元运算符");
        };
    }

    // --- S 表达式 ---

    /**
     * 编码为 (KIND name param arity)。
     */
    public Sexp toSexp() {
        return Sexp.list(Sexp.atom(kind.name()), Sexp.atom(name), Sexp.atom(param), Sexp.atom(arity));
    }

    public static Funsym ofSexp(Sexp sexp) {
        List<Sexp> items = sexp.expectList(4);
        try {
            Kind kind = Kind.valueOf(items.get(0).getAtomValue());
            String name = items.get(1).getAtomValue();
            int param = Integer.parseInt(items.get(2).getAtomValue());
            int arity = Integer.parseInt(items.get(3).getAtomValue());
            return new Funsym(kind, name, param, arity);
        } catch (IllegalArgumentException e) {
            logger.error("无法解码 Funsym: {}", sexp);
            throw new SexpParseException("无效的 Funsym: " + sexp, e);
        }
    }

    // --- Object 方法 ---

    @Override
    public int compareTo(Funsym other) {
        int cmp = kind.compareTo(other.kind);
        if (cmp != 0) {
            return cmp;
        }
        cmp = name.compareTo(other.name);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(param, other.param);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(arity, other.arity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Funsym that = (Funsym) o;
        return kind == that.kind && param == that.param && arity == that.arity && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name;
    }
}
