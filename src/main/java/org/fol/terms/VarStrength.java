package org.fol.terms;

/**
 * 变量的量词强度，仅用于打印时区分变量。
 */
public enum VarStrength {
    UNIVERSAL,
    EXISTENTIAL,
    ANONYMOUS
}
