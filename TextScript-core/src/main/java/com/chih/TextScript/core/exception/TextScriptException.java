package com.chih.TextScript.core.exception;

/**
 * TextScript 框架根异常
 */
public class TextScriptException extends RuntimeException {
    public TextScriptException(String message) {
        super(message);
    }

    public TextScriptException(String message, Throwable cause) {
        super(message, cause);
    }
}
