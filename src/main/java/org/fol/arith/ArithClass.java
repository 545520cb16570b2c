package org.fol.arith;

/**
 * 多项式的分类。
 */
public enum ArithClass {

    /**
     * 单个原子，系数为 1、次数为 1，例如 x。
     */
    TRM,
    /**
     * 常数。
     */
    CONST,
    /**
     * 由解释函数（加法、数乘）构成，例如 2*x + 1。
     */
    INTERPRETED,
    /**
     * 系数为 1 的非线性单项式，例如 x*y 或 x^2，视为未解释函数的应用。
     */
    UNINTERPRETED
}
