package com.chih.TextScript.core.parsing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * TextScript 词法分析器
 * <p>
 * 在三种块状态之间切换：
 * <ul>
 *   <li>RAW：{@code {{ }}} 之外的普通文本</li>
 *   <li>CODE：{@code {{ }}} / {@code {% %}} 之内的脚本</li>
 *   <li>ESCAPE：{@code {%{ ... }%}} 包围的原样输出文本，{@code %} 的数量即转义层数</li>
 * </ul>
 * 空白控制符 {@code -} (全部去除) 与 {@code ~} (保留换行) 以独立的 WHITESPACE / WHITESPACE_FULL token 输出，
 * 由解析器在生成 Raw 语句时跳过。
 * </p>
 * <p>
 * 一个 Lexer 实例同一时刻只能被一个迭代器使用，每次 {@link #iterator()} 都会重置游标状态。
 * 遇到第一个词法错误后输出 INVALID token 并结束。
 * </p>
 *
 * @since 2025/12/14
 */
public class Lexer implements Iterable<Token> {

    private static final char RAW_ESCAPE_CHAR = '%';

    private static final char STRIP_FULL_CHAR = '-';

    private static final char STRIP_RESTRICTED_CHAR = '~';

    private enum BlockType {
        CODE,
        ESCAPE,
        RAW
    }

    private final String text;
    private final int textLength;
    private final String sourcePath;
    private final LexerOptions options;
    private final boolean liquid;

    private final Deque<Token> pendingTokens = new ArrayDeque<>();
    private List<LogMessage> errors = new ArrayList<>();

    private TextPosition position;
    private char c;
    private Token token;
    private BlockType blockType;
    private boolean liquidTagBlock;
    private int openBraceCount;
    private int escapeRawCharCount;
    private boolean expectingFrontMatter;

    // isCodeEnterOrEscape 识别到的空白控制模式
    private TokenType enterWhitespaceMode = TokenType.INVALID;

    public Lexer(String text) {
        this(text, null, null);
    }

    public Lexer(String text, String sourcePath, LexerOptions options) {
        this.text = Objects.requireNonNull(text, "text");
        this.options = options != null ? options : LexerOptions.DEFAULT;
        if (this.options.startPosition().offset() > text.length()) {
            throw new IllegalArgumentException(String.format(
                    "The start position %d is out of range [0, %d]", this.options.startPosition().offset(), text.length()));
        }
        this.textLength = text.length();
        this.sourcePath = sourcePath != null ? sourcePath : "<input>";
        this.liquid = this.options.mode() == ScriptMode.LIQUID;
        reset();
    }

    public String getText() {
        return text;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public LexerOptions getOptions() {
        return options;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<LogMessage> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    @Override
    public Iterator<Token> iterator() {
        reset();
        return new Iterator<>() {
            private boolean fetched;
            private boolean available;

            @Override
            public boolean hasNext() {
                if (!fetched) {
                    available = moveNext();
                    fetched = true;
                }
                return available;
            }

            @Override
            public Token next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                fetched = false;
                return token;
            }
        };
    }

    private void reset() {
        position = options.startPosition();
        c = position.offset() < textLength ? text.charAt(position.offset()) : '\0';
        blockType = options.mode() == ScriptMode.SCRIPT_ONLY ? BlockType.CODE : BlockType.RAW;
        expectingFrontMatter = options.mode() == ScriptMode.FRONT_MATTER_ONLY
                || options.mode() == ScriptMode.FRONT_MATTER_AND_CONTENT;
        liquidTagBlock = false;
        openBraceCount = 0;
        escapeRawCharCount = 0;
        pendingTokens.clear();
        token = null;
        errors = new ArrayList<>();
    }

    private boolean moveNext() {
        TextPosition previousPosition = null;
        boolean firstLoop = true;
        while (true) {
            if (!pendingTokens.isEmpty()) {
                token = pendingTokens.poll();
                return true;
            }

            if (hasErrors() || (token != null && token.type() == TokenType.EOF)) {
                return false;
            }

            if (position.offset() == textLength) {
                token = Token.EOF;
                return true;
            }

            if (!firstLoop && position.equals(previousPosition)) {
                throw new IllegalStateException("Unexpected state: the lexer is stuck in a loop at " + position);
            }
            firstLoop = false;
            previousPosition = position;

            if (options.mode() != ScriptMode.SCRIPT_ONLY) {
                boolean hasEnter = false;
                if (blockType == BlockType.RAW) {
                    if (isCodeEnterOrEscape()) {
                        readCodeEnterOrEscape();
                        hasEnter = true;
                        if (blockType == BlockType.CODE || blockType == BlockType.RAW) {
                            return true;
                        }
                    } else if (expectingFrontMatter && tryParseFrontMatterMarker()) {
                        blockType = BlockType.CODE;
                        return true;
                    }
                }

                if (!hasEnter && blockType != BlockType.RAW && isCodeExit()) {
                    boolean wasInBlock = blockType == BlockType.CODE;
                    readCodeExitOrEscape();
                    if (wasInBlock) {
                        return true;
                    }
                    // 从 ESCAPE 块退出，回到 RAW 继续
                    continue;
                }

                if (blockType == BlockType.CODE && expectingFrontMatter && tryParseFrontMatterMarker()) {
                    // front matter 只出现一次
                    blockType = BlockType.RAW;
                    expectingFrontMatter = false;
                    return true;
                }
            }

            if (position.offset() == textLength) {
                token = Token.EOF;
                return true;
            }

            if (blockType == BlockType.CODE) {
                if (liquid ? readCodeLiquid() : readCode()) {
                    return true;
                }
            } else if (readRaw()) {
                return true;
            }
        }
    }

    private boolean tryParseFrontMatterMarker() {
        TextPosition start = position;
        TextPosition end = position;
        String marker = options.frontMatterMarker();

        int i = 0;
        for (; i < marker.length(); i++) {
            if (peekChar(i) != marker.charAt(i)) {
                return false;
            }
        }

        char pc = peekChar(i);
        while (pc == ' ' || pc == '\t') {
            i++;
            pc = peekChar(i);
        }

        boolean valid = false;
        if (pc == '\n') {
            valid = true;
        } else if (pc == '\r') {
            valid = true;
            if (peekChar(i + 1) == '\n') {
                i++;
            }
        }

        if (valid) {
            while (i-- >= 0) {
                end = position;
                nextChar();
            }
            token = new Token(TokenType.FRONT_MATTER_MARKER, start, end);
            return true;
        }
        return false;
    }

    private boolean isCodeEnterOrEscape() {
        enterWhitespaceMode = TokenType.INVALID;
        if (c == '{') {
            int i = 1;
            char nc = peekChar(i);
            if (!liquid) {
                while (nc == RAW_ESCAPE_CHAR) {
                    i++;
                    nc = peekChar(i);
                }
            }
            if (nc == '{' || (liquid && nc == '%')) {
                char charSpace = peekChar(i + 1);
                if (charSpace == STRIP_FULL_CHAR) {
                    enterWhitespaceMode = TokenType.WHITESPACE_FULL;
                } else if (!liquid && charSpace == STRIP_RESTRICTED_CHAR) {
                    enterWhitespaceMode = TokenType.WHITESPACE;
                }
                return true;
            }
        }
        return false;
    }

    private void readCodeEnterOrEscape() {
        TextPosition start = position;
        TextPosition end = position;

        nextChar(); // {
        if (!liquid) {
            while (c == RAW_ESCAPE_CHAR) {
                escapeRawCharCount++;
                end = end.nextColumn();
                nextChar();
            }
        }

        end = end.nextColumn();
        if (liquid && c == '%') {
            liquidTagBlock = true;
        }
        nextChar(); // { 或 %

        if (c == STRIP_FULL_CHAR || (!liquid && c == STRIP_RESTRICTED_CHAR)) {
            end = end.nextColumn();
            nextChar();
        }

        if (escapeRawCharCount > 0) {
            blockType = BlockType.ESCAPE;
        } else {
            if (liquid && liquidTagBlock && tryReadLiquidCommentOrRaw(start, end)) {
                return;
            }
            blockType = BlockType.CODE;
            token = new Token(liquidTagBlock ? TokenType.LIQUID_TAG_ENTER : TokenType.CODE_ENTER, start, end);
        }
    }

    /**
     * {@code {% comment %}...{% endcomment %}} 转为多行注释，
     * {@code {% raw %}...{% endraw %}} 转为一层转义文本
     */
    private boolean tryReadLiquidCommentOrRaw(TextPosition codeEnterStart, TextPosition codeEnterEnd) {
        TextPosition start = position;
        int offset = peekSkipSpaces(0);

        boolean isComment;
        int matched = tryMatchPeek("comment", offset);
        isComment = matched >= 0;
        if (!isComment) {
            matched = tryMatchPeek("raw", offset);
        }
        if (matched < 0) {
            return false;
        }

        offset = peekSkipSpaces(matched);
        offset = tryMatchPeek("%}", offset);
        if (offset < 0) {
            return false;
        }

        start = new TextPosition(start.offset() + offset, start.line(), start.column() + offset);
        // 回退到前一个字符，从正文开始逐字符扫描
        position = new TextPosition(start.offset() - 1, start.line(), start.column() - 1);
        c = '}';

        while (true) {
            TextPosition end = position;
            nextChar();
            if (c == '{') {
                nextChar();
                if (c == '%') {
                    nextChar();
                    if (c == '-') {
                        nextChar();
                    }
                    skipSpaces();
                    if (tryMatch(isComment ? "endcomment" : "endraw")) {
                        skipSpaces();
                        TextPosition codeExitStart = position;
                        if (c == '-') {
                            nextChar();
                        }
                        if (c == '%') {
                            nextChar();
                            if (c == '}') {
                                TextPosition codeExitEnd = position;
                                nextChar();
                                blockType = BlockType.RAW;
                                if (isComment) {
                                    token = new Token(TokenType.CODE_ENTER, codeEnterStart, codeEnterEnd);
                                    pendingTokens.add(new Token(TokenType.COMMENT_MULTI, start, end));
                                    pendingTokens.add(new Token(TokenType.CODE_EXIT, codeExitStart, codeExitEnd));
                                } else {
                                    token = new Token(TokenType.ESCAPE, start, end);
                                    pendingTokens.add(new Token(TokenType.ESCAPE_COUNT1, end, end));
                                }
                                return true;
                            }
                        }
                    }
                }
            } else if (c == '\0') {
                break;
            }
        }
        return false;
    }

    private void skipSpaces() {
        while (c == ' ' || c == '\t') {
            nextChar();
        }
    }

    private int peekSkipSpaces(int i) {
        while (true) {
            char nc = peekChar(i);
            if (nc == ' ' || nc == '\t') {
                i++;
            } else {
                return i;
            }
        }
    }

    /**
     * @return 匹配成功后的偏移量，失败返回 -1
     */
    private int tryMatchPeek(String expected, int offset) {
        for (int index = 0; index < expected.length(); offset++, index++) {
            if (peekChar(offset) != expected.charAt(index)) {
                return -1;
            }
        }
        return offset;
    }

    private boolean tryMatch(String expected) {
        for (int i = 0; i < expected.length(); i++) {
            if (c != expected.charAt(i)) {
                return false;
            }
            nextChar();
        }
        return true;
    }

    private boolean isCodeExit() {
        // 还有未闭合的 { 时由 readCode 处理
        if (openBraceCount > 0) {
            return false;
        }

        int start = 0;
        if (c == STRIP_FULL_CHAR || (!liquid && c == STRIP_RESTRICTED_CHAR)) {
            start = 1;
        }

        if (peekChar(start) != (liquidTagBlock ? '%' : '}')) {
            return false;
        }
        start++;

        if (!liquid) {
            for (int i = 0; i < escapeRawCharCount; i++) {
                if (peekChar(i + start) != RAW_ESCAPE_CHAR) {
                    return false;
                }
            }
        }
        return peekChar(escapeRawCharCount + start) == '}';
    }

    private void readCodeExitOrEscape() {
        TextPosition start = position;

        TokenType whitespaceMode = TokenType.INVALID;
        if (c == STRIP_FULL_CHAR) {
            whitespaceMode = TokenType.WHITESPACE_FULL;
            nextChar();
        } else if (!liquid && c == STRIP_RESTRICTED_CHAR) {
            whitespaceMode = TokenType.WHITESPACE;
            nextChar();
        }

        nextChar(); // } 或 %
        if (!liquid) {
            for (int i = 0; i < escapeRawCharCount; i++) {
                nextChar();
            }
        }
        TextPosition end = position;
        nextChar(); // }

        if (escapeRawCharCount > 0) {
            pendingTokens.add(new Token(TokenType.escapeCount(escapeRawCharCount), start, end));
            escapeRawCharCount = 0;
        } else {
            token = new Token(liquidTagBlock ? TokenType.LIQUID_TAG_EXIT : TokenType.CODE_EXIT, start, end);
        }

        if (whitespaceMode != TokenType.INVALID) {
            TextPosition startSpace = position;
            boolean restricted = whitespaceMode == TokenType.WHITESPACE;
            TextPosition endSpace = consumeWhitespace(restricted, restricted);
            if (endSpace != null) {
                pendingTokens.add(new Token(whitespaceMode, startSpace, endSpace));
            }
        }

        liquidTagBlock = false;
        blockType = BlockType.RAW;
    }

    private boolean readRaw() {
        TextPosition start = position;
        TextPosition end = null;
        boolean nextCodeEnterOrEscapeExit = false;
        TokenType whitespaceMode = TokenType.INVALID;
        boolean emptyRaw = false;

        TextPosition beforeSpaceFull = null;
        TextPosition beforeSpaceRestricted = null;
        TextPosition lastSpaceFull = null;
        TextPosition lastSpaceRestricted = null;

        while (c != '\0') {
            if (blockType == BlockType.RAW && isCodeEnterOrEscape()) {
                whitespaceMode = enterWhitespaceMode;
                emptyRaw = end == null;
                nextCodeEnterOrEscapeExit = true;
                break;
            }
            if (blockType == BlockType.ESCAPE && isCodeExit()) {
                emptyRaw = end == null;
                nextCodeEnterOrEscapeExit = true;
                break;
            }

            if (Character.isWhitespace(c)) {
                if (lastSpaceFull == null) {
                    lastSpaceFull = position;
                    beforeSpaceFull = end;
                }
                if (!(c == '\n' || (c == '\r' && peekChar(1) != '\n'))) {
                    if (lastSpaceRestricted == null) {
                        lastSpaceRestricted = position;
                        beforeSpaceRestricted = end;
                    }
                } else {
                    lastSpaceRestricted = null;
                    beforeSpaceRestricted = null;
                }
            } else {
                lastSpaceFull = null;
                beforeSpaceFull = null;
                lastSpaceRestricted = null;
                beforeSpaceRestricted = null;
            }

            end = position;
            nextChar();
        }

        if (end == null) {
            end = start;
        }

        TextPosition lastSpace = lastSpaceFull;
        TextPosition beforeSpace = beforeSpaceFull;
        if (whitespaceMode == TokenType.WHITESPACE) {
            lastSpace = lastSpaceRestricted;
            beforeSpace = beforeSpaceRestricted;
        }

        if (whitespaceMode != TokenType.INVALID && lastSpace != null) {
            pendingTokens.add(new Token(whitespaceMode, lastSpace, end));
            // 整段都是空白，不再输出 Raw
            if (beforeSpace == null) {
                return false;
            }
            end = beforeSpace;
        }

        if (nextCodeEnterOrEscapeExit && emptyRaw) {
            end = new TextPosition(start.offset() - 1, start.line(), start.column() - 1);
        }

        token = new Token(blockType == BlockType.ESCAPE ? TokenType.ESCAPE : TokenType.RAW, start, end);

        if (!nextCodeEnterOrEscapeExit) {
            nextChar();
        }
        return true;
    }

    private boolean readCode() {
        boolean hasTokens = true;
        TextPosition start = position;
        switch (c) {
            case '\n': {
                nextChar();
                TextPosition last = consumeWhitespace(false, false);
                token = new Token(TokenType.NEW_LINE, start, last != null ? last : start);
                break;
            }
            case ';':
                token = new Token(TokenType.SEMI_COLON, start, start);
                nextChar();
                break;
            case '\r': {
                nextChar();
                TextPosition newLineEnd = start;
                if (c == '\n') {
                    newLineEnd = position;
                    nextChar();
                }
                TextPosition last = consumeWhitespace(false, false);
                token = new Token(TokenType.NEW_LINE, start, last != null ? last : newLineEnd);
                break;
            }
            case ':':
                token = single(TokenType.COLON, start);
                break;
            case '@':
                token = single(TokenType.ARROBA, start);
                break;
            case '^':
                token = single(TokenType.CARET, start);
                break;
            case '*':
                token = single(TokenType.ASTERISK, start);
                break;
            case '/':
                nextChar();
                if (c == '/') {
                    token = new Token(TokenType.DOUBLE_DIVIDE, start, position);
                    nextChar();
                    break;
                }
                token = new Token(TokenType.DIVIDE, start, start);
                break;
            case '+':
                token = single(TokenType.PLUS, start);
                break;
            case '-':
                token = single(TokenType.MINUS, start);
                break;
            case '%':
                token = single(TokenType.PERCENT, start);
                break;
            case ',':
                token = single(TokenType.COMMA, start);
                break;
            case '&':
                nextChar();
                if (c == '&') {
                    token = new Token(TokenType.DOUBLE_AMP, start, position);
                    nextChar();
                    break;
                }
                // 单个 & 非法
                token = new Token(TokenType.INVALID, start, start);
                break;
            case '?':
                nextChar();
                if (c == '?') {
                    token = new Token(TokenType.DOUBLE_QUESTION, start, position);
                    nextChar();
                    break;
                }
                token = new Token(TokenType.QUESTION, start, start);
                break;
            case '|':
                nextChar();
                if (c == '|') {
                    token = new Token(TokenType.DOUBLE_PIPE, start, position);
                    nextChar();
                    break;
                }
                token = new Token(TokenType.PIPE, start, start);
                break;
            case '.':
                nextChar();
                if (c == '.') {
                    TextPosition index = position;
                    nextChar();
                    if (c == '<') {
                        token = new Token(TokenType.DOUBLE_DOT_LESS, start, position);
                        nextChar();
                        break;
                    }
                    token = new Token(TokenType.DOUBLE_DOT, start, index);
                    break;
                }
                token = new Token(TokenType.DOT, start, start);
                break;
            case '!':
                token = pair('=', TokenType.EXCLAMATION_EQUAL, TokenType.EXCLAMATION, start);
                break;
            case '=':
                token = pair('=', TokenType.DOUBLE_EQUAL, TokenType.EQUAL, start);
                break;
            case '<':
                nextChar();
                if (c == '=') {
                    token = new Token(TokenType.LESS_EQUAL, start, position);
                    nextChar();
                    break;
                }
                if (c == '<') {
                    token = new Token(TokenType.DOUBLE_LESS, start, position);
                    nextChar();
                    break;
                }
                token = new Token(TokenType.LESS, start, start);
                break;
            case '>':
                nextChar();
                if (c == '=') {
                    token = new Token(TokenType.GREATER_EQUAL, start, position);
                    nextChar();
                    break;
                }
                if (c == '>') {
                    token = new Token(TokenType.DOUBLE_GREATER, start, position);
                    nextChar();
                    break;
                }
                token = new Token(TokenType.GREATER, start, start);
                break;
            case '(':
                token = single(TokenType.OPEN_PAREN, start);
                break;
            case ')':
                token = single(TokenType.CLOSE_PAREN, start);
                break;
            case '[':
                token = single(TokenType.OPEN_BRACKET, start);
                break;
            case ']':
                token = single(TokenType.CLOSE_BRACKET, start);
                break;
            case '{':
                // 计数，避免把对象字面量的 } 误认为代码块结束
                openBraceCount++;
                token = single(TokenType.OPEN_BRACE, start);
                break;
            case '}':
                if (openBraceCount > 0) {
                    openBraceCount--;
                    token = single(TokenType.CLOSE_BRACE, start);
                } else if (options.mode() != ScriptMode.SCRIPT_ONLY && isCodeExit()) {
                    hasTokens = false;
                } else {
                    token = new Token(TokenType.CLOSE_BRACE, start, start);
                    addError("Unexpected `}` without a matching `{`", start, start);
                    nextChar();
                }
                break;
            case '#':
                readComment();
                break;
            case '"':
            case '\'':
                readString();
                break;
            case '`':
                readVerbatimString();
                break;
            case '\0':
                token = Token.EOF;
                break;
            default:
                hasTokens = readDefault(start, true);
                break;
        }
        return hasTokens;
    }

    private boolean readCodeLiquid() {
        boolean hasTokens = true;
        TextPosition start = position;
        switch (c) {
            case ':':
                token = single(TokenType.COLON, start);
                break;
            case ',':
                token = single(TokenType.COMMA, start);
                break;
            case '|':
                token = single(TokenType.PIPE, start);
                break;
            case '?':
                token = single(TokenType.QUESTION, start);
                break;
            case '.':
                nextChar();
                if (c == '.') {
                    token = new Token(TokenType.DOUBLE_DOT, start, position);
                    nextChar();
                    break;
                }
                token = new Token(TokenType.DOT, start, start);
                break;
            case '!':
                nextChar();
                if (c == '=') {
                    token = new Token(TokenType.EXCLAMATION_EQUAL, start, position);
                    nextChar();
                    break;
                }
                token = new Token(TokenType.INVALID, start, start);
                break;
            case '=':
                token = pair('=', TokenType.DOUBLE_EQUAL, TokenType.EQUAL, start);
                break;
            case '<':
                token = pair('=', TokenType.LESS_EQUAL, TokenType.LESS, start);
                break;
            case '>':
                token = pair('=', TokenType.GREATER_EQUAL, TokenType.GREATER, start);
                break;
            case '(':
                token = single(TokenType.OPEN_PAREN, start);
                break;
            case ')':
                token = single(TokenType.CLOSE_PAREN, start);
                break;
            case '[':
                token = single(TokenType.OPEN_BRACKET, start);
                break;
            case ']':
                token = single(TokenType.CLOSE_BRACKET, start);
                break;
            case '"':
            case '\'':
                readString();
                break;
            case '\0':
                token = Token.EOF;
                break;
            default:
                hasTokens = readDefault(start, false);
                break;
        }
        return hasTokens;
    }

    /**
     * 空白、标识符、数字及非法字符
     *
     * @return false 表示没有产生 token (空白被跳过)
     */
    private boolean readDefault(TextPosition start, boolean allowSpecialIdentifier) {
        TextPosition lastSpace = consumeWhitespace(true, false);
        if (lastSpace != null) {
            if (options.keepTrivia()) {
                token = new Token(TokenType.WHITESPACE, start, lastSpace);
                return true;
            }
            return false;
        }

        boolean specialIdentifier = allowSpecialIdentifier && c == '$';
        if (isFirstIdentifierLetter(c) || specialIdentifier) {
            readIdentifier(specialIdentifier);
            return true;
        }

        if (isDigit(c)) {
            readNumber();
            return true;
        }

        token = new Token(TokenType.INVALID, position, position);
        nextChar();
        return true;
    }

    private Token single(TokenType type, TextPosition start) {
        nextChar();
        return new Token(type, start, start);
    }

    private Token pair(char second, TokenType doubleType, TokenType singleType, TextPosition start) {
        nextChar();
        if (c == second) {
            Token result = new Token(doubleType, start, position);
            nextChar();
            return result;
        }
        return new Token(singleType, start, start);
    }

    /**
     * @return 最后一个被消费的空白位置，什么都没消费时返回 null
     */
    private TextPosition consumeWhitespace(boolean stopAtNewLine, boolean keepNewLine) {
        TextPosition lastSpace = null;
        while (Character.isWhitespace(c)) {
            if (stopAtNewLine && c == '\n') {
                if (keepNewLine) {
                    lastSpace = position;
                    nextChar();
                }
                break;
            }
            lastSpace = position;
            nextChar();
        }
        return lastSpace;
    }

    private void readIdentifier(boolean special) {
        TextPosition start = position;
        TextPosition beforePosition;
        boolean first = true;
        do {
            beforePosition = position;
            nextChar();
            // $$ 只允许出现在这里
            if (first && special && c == '$') {
                token = new Token(TokenType.IDENTIFIER_SPECIAL, start, position);
                nextChar();
                return;
            }
            first = false;
        } while (isIdentifierLetter(c));

        token = new Token(special ? TokenType.IDENTIFIER_SPECIAL : TokenType.IDENTIFIER, start, beforePosition);

        // Liquid: include 后面的裸路径作为隐式字符串
        if (liquid && options.includeImplicitString() && token.match("include", text) && Character.isWhitespace(c)) {
            TextPosition startSpace = position;
            TextPosition endSpace = consumeWhitespace(false, false);
            pendingTokens.add(new Token(TokenType.WHITESPACE, startSpace, endSpace != null ? endSpace : startSpace));
            // 带引号的名称按普通字符串读取
            if (c == '\'' || c == '"') {
                return;
            }

            TextPosition startPath = position;
            TextPosition endPath = startPath;
            while (!Character.isWhitespace(c) && c != '\0' && c != '%' && peekChar(1) != '}') {
                endPath = position;
                nextChar();
            }
            pendingTokens.add(new Token(TokenType.IMPLICIT_STRING, startPath, endPath));
        }
    }

    private static boolean isFirstIdentifierLetter(char ch) {
        return ch == '_' || Character.isLetter(ch);
    }

    private boolean isIdentifierLetter(char ch) {
        return isFirstIdentifierLetter(ch) || isDigit(ch) || (liquid && ch == '-');
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isHex(char ch) {
        return isDigit(ch) || (ch >= 'a' && ch <= 'f') || (ch >= 'A' && ch <= 'F');
    }

    private void readNumber() {
        TextPosition start = position;
        TextPosition end;
        boolean hasDot = false;

        do {
            end = position;
            nextChar();
        } while (isDigit(c));

        // 后面跟着 . 说明是区间运算符 1..3，不作为小数点
        if (c == '.' && peekChar(1) != '.') {
            hasDot = true;
            end = position;
            nextChar();
            while (isDigit(c)) {
                end = position;
                nextChar();
            }
        }

        if (c == 'e' || c == 'E') {
            end = position;
            nextChar();
            if (c == '+' || c == '-') {
                end = position;
                nextChar();
            }
            if (!isDigit(c)) {
                addError("Expecting at least one digit after the exponent", position, position);
                return;
            }
            while (isDigit(c)) {
                end = position;
                nextChar();
            }
        }

        token = new Token(hasDot ? TokenType.FLOAT : TokenType.INTEGER, start, end);
    }

    private void readString() {
        TextPosition start = position;
        TextPosition end = position;
        char startChar = c;
        nextChar();

        while (true) {
            if (c == '\\') {
                end = position;
                nextChar();
                StringBuilder badEscape = new StringBuilder();
                switch (c) {
                    case '\n':
                        end = position;
                        nextChar();
                        continue;
                    case '\r':
                        end = position;
                        nextChar();
                        if (c == '\n') {
                            end = position;
                            nextChar();
                        }
                        continue;
                    case '0':
                    case '\'':
                    case '"':
                    case 'b':
                    case 'f':
                    case 'n':
                    case 'r':
                    case 't':
                    case 'v':
                    case '\\':
                        end = position;
                        nextChar();
                        continue;
                    case 'u':
                    case 'x': {
                        int digits = c == 'u' ? 4 : 2;
                        badEscape.append(c);
                        end = position;
                        nextChar();
                        int count = 0;
                        while (count < digits && isHex(c)) {
                            badEscape.append(c);
                            end = position;
                            nextChar();
                            count++;
                        }
                        if (count == digits) {
                            continue;
                        }
                        if (c != '\0') {
                            badEscape.append(c);
                        }
                        break;
                    }
                    default:
                        badEscape.append(c);
                        break;
                }
                addError("Unexpected escape character `\\" + badEscape
                        + "` in string. Only \\' \\\" \\0 \\b \\f \\n \\r \\t \\v \\\\ \\uXXXX \\xXX are allowed",
                        position, position);
            } else if (c == '\0') {
                addError("Unexpected end of file while parsing a string not terminated by a " + startChar, end, end);
                return;
            } else if (c == startChar) {
                end = position;
                nextChar();
                break;
            } else {
                end = position;
                nextChar();
            }
        }

        // 存在错误时保留 INVALID token
        if (!hasErrors()) {
            token = new Token(TokenType.STRING, start, end);
        }
    }

    private void readVerbatimString() {
        TextPosition start = position;
        TextPosition end = position;
        char startChar = c;
        nextChar();

        while (true) {
            if (c == '\0') {
                addError("Unexpected end of file while parsing a verbatim string not terminated by a " + startChar, end, end);
                return;
            } else if (c == startChar) {
                end = position;
                nextChar();
                // 双反引号是转义
                if (c != startChar) {
                    break;
                }
                end = position;
                nextChar();
            } else {
                end = position;
                nextChar();
            }
        }

        token = new Token(TokenType.VERBATIM_STRING, start, end);
    }

    private void readComment() {
        TextPosition start = position;
        TextPosition end = position;
        nextChar();

        boolean multi = false;
        if (c == '#') {
            multi = true;
            end = position;
            nextChar();
            while (!isCodeExit()) {
                if (c == '\0') {
                    break;
                }
                boolean mayBeEndOfComment = c == '#';
                end = position;
                nextChar();
                if (mayBeEndOfComment && c == '#') {
                    end = position;
                    nextChar();
                    break;
                }
            }
        } else {
            while (!isCodeExit()) {
                if (c == '\0' || c == '\r' || c == '\n') {
                    break;
                }
                end = position;
                nextChar();
            }
        }

        token = new Token(multi ? TokenType.COMMENT_MULTI : TokenType.COMMENT, start, end);
    }

    private char peekChar(int count) {
        int offset = position.offset() + count;
        return offset >= 0 && offset < textLength ? text.charAt(offset) : '\0';
    }

    private void nextChar() {
        int nextOffset = position.offset() + 1;
        if (nextOffset < textLength) {
            char nc = text.charAt(nextOffset);
            if (c == '\n' || (c == '\r' && nc != '\n')) {
                position = new TextPosition(nextOffset, position.line() + 1, 0);
            } else {
                position = new TextPosition(nextOffset, position.line(), position.column() + 1);
            }
            c = nc;
        } else {
            position = new TextPosition(textLength, position.line(), position.column());
            c = '\0';
        }
    }

    private void addError(String message, TextPosition start, TextPosition end) {
        token = new Token(TokenType.INVALID, start, end);
        errors.add(LogMessage.error(new SourceSpan(sourcePath, start, end), message));
    }
}
