package com.chih.TextScript.core.parsing;

public enum ParserMessageType {
    ERROR,
    WARNING
}
