package org.fol.sexp;

/**
 * S 表达式文本或结构不合法。
 */
public class SexpParseException extends IllegalArgumentException {

    public SexpParseException(String message) {
        super(message);
    }

    public SexpParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
