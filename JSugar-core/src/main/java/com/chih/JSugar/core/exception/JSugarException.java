package com.chih.JSugar.core.exception;

/**
 * JSugar 框架根异常
 */
public class JSugarException extends RuntimeException {
    public JSugarException(String message) {
        super(message);
    }

    public JSugarException(String message, Throwable cause) {
        super(message, cause);
    }
}
