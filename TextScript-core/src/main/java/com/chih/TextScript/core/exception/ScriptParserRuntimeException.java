package com.chih.TextScript.core.exception;

import com.chih.TextScript.core.parsing.LogMessage;
import com.chih.TextScript.core.parsing.SourceSpan;

import java.util.List;

/**
 * 运行期解析子模板 (include) 失败
 */
public class ScriptParserRuntimeException extends ScriptRuntimeException {

    private final List<LogMessage> parserMessages;

    public ScriptParserRuntimeException(SourceSpan span, String message, List<LogMessage> parserMessages) {
        super(span, message + System.lineSeparator() + TemplateParseException.join(parserMessages));
        this.parserMessages = List.copyOf(parserMessages);
    }

    public List<LogMessage> getParserMessages() {
        return parserMessages;
    }
}
