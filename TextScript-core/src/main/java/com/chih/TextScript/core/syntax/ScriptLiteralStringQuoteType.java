package com.chih.TextScript.core.syntax;

public enum ScriptLiteralStringQuoteType {
    DOUBLE_QUOTE,
    SIMPLE_QUOTE,
    VERBATIM
}
