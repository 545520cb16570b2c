package org.fol.terms;

import org.fol.sexp.SexpParseException;

/**
 * 项的形状（标签联合的变体标签），用于对项做只读的穷尽匹配。
 * 声明顺序即不同形状的项之间的比较顺序。
 */
public enum TermShape {

    VAR("Var"),
    Z("Z"),
    Q("Q"),
    ARITH("Arith"),
    SPLAT("Splat"),
    SIZED("Sized"),
    EXTRACT("Extract"),
    CONCAT("Concat"),
    APPLY("Apply");

    private final String tag;

    TermShape(String tag) {
        this.tag = tag;
    }

    /**
     * @return S 表达式编码中使用的标签
     */
    public String getTag() {
        return tag;
    }

    public static TermShape ofTag(String tag) {
        for (TermShape shape : values()) {
            if (shape.tag.equals(tag)) {
                return shape;
            }
        }
        throw new SexpParseException("未知的项标签: " + tag);
    }
}
