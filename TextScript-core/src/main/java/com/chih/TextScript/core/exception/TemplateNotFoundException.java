package com.chih.TextScript.core.exception;

public class TemplateNotFoundException extends TextScriptException {
    public TemplateNotFoundException(String key) {
        super("Template not found for key: " + key);
    }
}
