package com.chih.TextScript.core.parsing;

/**
 * 词法分析选项 (不可变)
 *
 * @param mode                  解析模式
 * @param frontMatterMarker     front matter 分隔符，默认 {@code +++}
 * @param includeImplicitString Liquid 下 {@code include} 后的裸路径按字符串处理
 * @param startPosition         起始位置
 * @param keepTrivia            是否保留空白 token
 */
public record LexerOptions(ScriptMode mode,
                           String frontMatterMarker,
                           boolean includeImplicitString,
                           TextPosition startPosition,
                           boolean keepTrivia) {

    public static final String DEFAULT_FRONT_MATTER_MARKER = "+++";

    public static final LexerOptions DEFAULT =
            new LexerOptions(ScriptMode.DEFAULT, DEFAULT_FRONT_MATTER_MARKER, false, TextPosition.START, false);

    public LexerOptions {
        if (mode == null) {
            mode = ScriptMode.DEFAULT;
        }
        if (frontMatterMarker == null) {
            frontMatterMarker = DEFAULT_FRONT_MATTER_MARKER;
        }
        if (startPosition == null) {
            startPosition = TextPosition.START;
        }
    }

    public LexerOptions withMode(ScriptMode newMode) {
        return new LexerOptions(newMode, frontMatterMarker, includeImplicitString, startPosition, keepTrivia);
    }

    public LexerOptions withFrontMatterMarker(String marker) {
        return new LexerOptions(mode, marker, includeImplicitString, startPosition, keepTrivia);
    }

    public LexerOptions withIncludeImplicitString(boolean enabled) {
        return new LexerOptions(mode, frontMatterMarker, enabled, startPosition, keepTrivia);
    }

    public LexerOptions withKeepTrivia(boolean enabled) {
        return new LexerOptions(mode, frontMatterMarker, includeImplicitString, startPosition, enabled);
    }
}
