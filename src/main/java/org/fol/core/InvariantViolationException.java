package org.fol.core;

/**
 * 表示编程逻辑错误：某个项或操作违反了结构不变式。
 * 这类错误对当前查询是致命的，不应被重试。
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
