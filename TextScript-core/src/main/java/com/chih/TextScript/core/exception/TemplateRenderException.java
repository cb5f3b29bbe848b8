package com.chih.TextScript.core.exception;

public class TemplateRenderException extends TextScriptException {
    public TemplateRenderException(String key, Throwable cause) {
        super("Failed to render template: " + key, cause);
    }
}
