package org.fol.terms;

/**
 * 项的分类，决定哪些子项被等式求解器当作原子。
 */
public enum TermKind {

    /**
     * 解释函数的应用（算术、序列运算），其含义由理论固定。
     */
    INTERP_APP,
    /**
     * 变量。
     */
    NON_INTERP_ATOM,
    /**
     * 字面常量或零元的解释函数应用。
     */
    INTERP_ATOM,
    /**
     * 未解释函数的应用。
     */
    UNINTERP_APP;

    /**
     * 非解释项即等式求解器眼中的可解项：变量与未解释函数应用。
     */
    public boolean isNoninterpreted() {
        return switch (this) {
            case NON_INTERP_ATOM, UNINTERP_APP -> true;
            case INTERP_APP, INTERP_ATOM -> false;
        };
    }
}
