package com.chih.TextScript.core.exception;

import com.chih.TextScript.core.parsing.SourceSpan;

public class TemplateRecursionException extends ScriptRuntimeException {
    public TemplateRecursionException(SourceSpan span, int limit) {
        super(span, "Exceeding number of recursive depth limit `" + limit + "` for include or function call");
    }
}
