package com.chih.TextScript.core.exception;

import com.chih.TextScript.core.parsing.LogMessage;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 模板存在词法/语法错误时无法求值
 */
public class TemplateParseException extends TextScriptException {

    private final List<LogMessage> messages;

    public TemplateParseException(List<LogMessage> messages) {
        super(join(messages));
        this.messages = List.copyOf(messages);
    }

    public List<LogMessage> getMessages() {
        return messages;
    }

    static String join(List<LogMessage> messages) {
        return messages.stream().map(LogMessage::toString).collect(Collectors.joining("\n"));
    }
}
