package com.chih.TextScript.core.parsing;

import com.chih.TextScript.core.functions.LiquidBuiltinsFunctions;
import com.chih.TextScript.core.syntax.ScriptAnonymousFunction;
import com.chih.TextScript.core.syntax.ScriptArrayInitializerExpression;
import com.chih.TextScript.core.syntax.ScriptAssignExpression;
import com.chih.TextScript.core.syntax.ScriptBinaryExpression;
import com.chih.TextScript.core.syntax.ScriptBinaryOperator;
import com.chih.TextScript.core.syntax.ScriptBlockStatement;
import com.chih.TextScript.core.syntax.ScriptBreakStatement;
import com.chih.TextScript.core.syntax.ScriptCaptureStatement;
import com.chih.TextScript.core.syntax.ScriptCaseStatement;
import com.chih.TextScript.core.syntax.ScriptConditionStatement;
import com.chih.TextScript.core.syntax.ScriptContinueStatement;
import com.chih.TextScript.core.syntax.ScriptElseStatement;
import com.chih.TextScript.core.syntax.ScriptExpression;
import com.chih.TextScript.core.syntax.ScriptExpressionStatement;
import com.chih.TextScript.core.syntax.ScriptForStatement;
import com.chih.TextScript.core.syntax.ScriptFunction;
import com.chih.TextScript.core.syntax.ScriptFunctionCall;
import com.chih.TextScript.core.syntax.ScriptIfStatement;
import com.chih.TextScript.core.syntax.ScriptImportStatement;
import com.chih.TextScript.core.syntax.ScriptIndexerExpression;
import com.chih.TextScript.core.syntax.ScriptIsEmptyExpression;
import com.chih.TextScript.core.syntax.ScriptLiteral;
import com.chih.TextScript.core.syntax.ScriptLiteralStringQuoteType;
import com.chih.TextScript.core.syntax.ScriptMemberExpression;
import com.chih.TextScript.core.syntax.ScriptNamedArgument;
import com.chih.TextScript.core.syntax.ScriptNestedExpression;
import com.chih.TextScript.core.syntax.ScriptNopStatement;
import com.chih.TextScript.core.syntax.ScriptObjectInitializerExpression;
import com.chih.TextScript.core.syntax.ScriptPage;
import com.chih.TextScript.core.syntax.ScriptPipeCall;
import com.chih.TextScript.core.syntax.ScriptRawStatement;
import com.chih.TextScript.core.syntax.ScriptReadOnlyStatement;
import com.chih.TextScript.core.syntax.ScriptReturnStatement;
import com.chih.TextScript.core.syntax.ScriptStatement;
import com.chih.TextScript.core.syntax.ScriptTableRowStatement;
import com.chih.TextScript.core.syntax.ScriptThisExpression;
import com.chih.TextScript.core.syntax.ScriptUnaryExpression;
import com.chih.TextScript.core.syntax.ScriptUnaryOperator;
import com.chih.TextScript.core.syntax.ScriptVariable;
import com.chih.TextScript.core.syntax.ScriptVariablePath;
import com.chih.TextScript.core.syntax.ScriptVariableScope;
import com.chih.TextScript.core.syntax.ScriptWhenStatement;
import com.chih.TextScript.core.syntax.ScriptWhileStatement;
import com.chih.TextScript.core.syntax.ScriptWithStatement;
import com.chih.TextScript.core.syntax.ScriptWrapStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * TextScript 语法分析器
 * <p>
 * 递归下降解析语句，表达式使用优先级爬升。原生语法与 Liquid 语法共用同一套表达式文法，
 * 只在语句层分别处理：原生语法用一个 {@code end} 关闭最近的块，Liquid 需要 {@code endif}/{@code endfor} 等显式结束标签。
 * </p>
 * <p>
 * 错误不会立即抛出，而是累积在 {@link #getMessages()} 中；少数错误 (例如语句结尾出现多余的 token) 是致命的，
 * 会直接结束解析。存在错误时返回的语法树不可用于求值。
 * </p>
 * <p>
 * 一个 Parser 实例只能使用一次。
 * </p>
 *
 * @since 2025/12/15
 */
public class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    /** 一元运算符的操作数只吸收后缀 (成员/索引)，不吸收任何二元运算 */
    private static final int UNARY_PRECEDENCE = 100;

    private static final Map<TokenType, ScriptBinaryOperator> BINARY_OPERATORS = new EnumMap<>(TokenType.class);

    private static final Map<String, ScriptBinaryOperator> LIQUID_BINARY_OPERATORS = Map.of(
            "or", ScriptBinaryOperator.OR,
            "and", ScriptBinaryOperator.AND,
            "contains", ScriptBinaryOperator.LIQUID_CONTAINS,
            "startsWith", ScriptBinaryOperator.LIQUID_STARTS_WITH,
            "endsWith", ScriptBinaryOperator.LIQUID_ENDS_WITH,
            "hasKey", ScriptBinaryOperator.LIQUID_HAS_KEY,
            "hasValue", ScriptBinaryOperator.LIQUID_HAS_VALUE);

    private static final Set<String> KEYWORDS = Set.of(
            "if", "else", "end", "for", "case", "when", "while", "break", "continue",
            "func", "import", "readonly", "with", "capture", "ret", "wrap", "do");

    static {
        BINARY_OPERATORS.put(TokenType.ASTERISK, ScriptBinaryOperator.MULTIPLY);
        BINARY_OPERATORS.put(TokenType.DIVIDE, ScriptBinaryOperator.DIVIDE);
        BINARY_OPERATORS.put(TokenType.DOUBLE_DIVIDE, ScriptBinaryOperator.DIVIDE_ROUND);
        BINARY_OPERATORS.put(TokenType.PLUS, ScriptBinaryOperator.ADD);
        BINARY_OPERATORS.put(TokenType.MINUS, ScriptBinaryOperator.SUBTRACT);
        BINARY_OPERATORS.put(TokenType.PERCENT, ScriptBinaryOperator.MODULUS);
        BINARY_OPERATORS.put(TokenType.DOUBLE_LESS, ScriptBinaryOperator.SHIFT_LEFT);
        BINARY_OPERATORS.put(TokenType.DOUBLE_GREATER, ScriptBinaryOperator.SHIFT_RIGHT);
        BINARY_OPERATORS.put(TokenType.DOUBLE_QUESTION, ScriptBinaryOperator.EMPTY_COALESCING);
        BINARY_OPERATORS.put(TokenType.DOUBLE_AMP, ScriptBinaryOperator.AND);
        BINARY_OPERATORS.put(TokenType.DOUBLE_PIPE, ScriptBinaryOperator.OR);
        BINARY_OPERATORS.put(TokenType.DOUBLE_EQUAL, ScriptBinaryOperator.COMPARE_EQUAL);
        BINARY_OPERATORS.put(TokenType.EXCLAMATION_EQUAL, ScriptBinaryOperator.COMPARE_NOT_EQUAL);
        BINARY_OPERATORS.put(TokenType.GREATER, ScriptBinaryOperator.COMPARE_GREATER);
        BINARY_OPERATORS.put(TokenType.GREATER_EQUAL, ScriptBinaryOperator.COMPARE_GREATER_OR_EQUAL);
        BINARY_OPERATORS.put(TokenType.LESS, ScriptBinaryOperator.COMPARE_LESS);
        BINARY_OPERATORS.put(TokenType.LESS_EQUAL, ScriptBinaryOperator.COMPARE_LESS_OR_EQUAL);
        BINARY_OPERATORS.put(TokenType.DOUBLE_DOT, ScriptBinaryOperator.RANGE_INCLUDE);
        BINARY_OPERATORS.put(TokenType.DOUBLE_DOT_LESS, ScriptBinaryOperator.RANGE_EXCLUDE);
    }

    /**
     * 正在解析的块的父语句类型
     */
    private enum FrameKind {
        PAGE,
        IF,
        ELSE,
        CASE,
        WHEN,
        FOR,
        TABLEROW,
        WHILE,
        WITH,
        WRAP,
        CAPTURE,
        FUNCTION,
        ANONYMOUS_FUNCTION
    }

    /**
     * 块栈中的一帧。else / elsif / 下一个 when 解析完成后挂在 continuation 上，由父语句在构造时读取
     */
    private static final class BlockFrame {

        private final FrameKind kind;

        private final String keyword;

        private final boolean elseIf;

        private ScriptConditionStatement continuation;

        private BlockFrame(FrameKind kind, String keyword, boolean elseIf) {
            this.kind = kind;
            this.keyword = keyword;
            this.elseIf = elseIf;
        }

        private boolean expectsEnd() {
            switch (kind) {
                case IF:
                    return !elseIf;
                case FOR:
                case TABLEROW:
                case CAPTURE:
                case WITH:
                case WHILE:
                case WRAP:
                case CASE:
                case FUNCTION:
                case ANONYMOUS_FUNCTION:
                    return true;
                default:
                    return false;
            }
        }
    }

    /**
     * 表达式所在位置，决定 {@code $$} 与 Liquid 过滤器冒号的合法性
     */
    private enum Host {
        STATEMENT,
        PIPE,
        OTHER
    }

    /**
     * 一次顶层表达式解析中共享的状态：出现匿名函数 ({@code do ... end}) 后不再继续解析运算符
     */
    private static final class ExpressionState {
        private boolean hasAnonymousFunction;
    }

    /**
     * 单条语句的解析结果
     */
    private static final class StatementSlot {
        private ScriptStatement statement;
        private boolean hasEnd;
    }

    private final Lexer lexer;
    private final String text;
    private final String fileName;
    private final ParserOptions options;
    private final boolean liquid;

    private final Iterator<Token> tokens;
    private final Deque<Token> preview = new ArrayDeque<>();
    private final Deque<BlockFrame> blocks = new ArrayDeque<>();
    private final List<LogMessage> messages = new ArrayList<>();

    private Token previous;
    private Token current;

    private ScriptMode mode;
    private boolean inCodeSection;
    private boolean liquidTagSection;
    private boolean inFrontMatter;
    private int blockLevel;
    private int expressionDepth;
    private int expressionLevel;
    private int allowNewLineLevel;
    private boolean expressionDepthLimitReached;
    private boolean fatalError;
    private boolean hasErrors;
    private boolean used;

    public Parser(Lexer lexer) {
        this(lexer, null);
    }

    public Parser(Lexer lexer, ParserOptions options) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
        this.text = lexer.getText();
        this.fileName = lexer.getSourcePath();
        this.options = options != null ? options : ParserOptions.DEFAULT;
        this.mode = lexer.getOptions().mode();
        this.liquid = mode == ScriptMode.LIQUID;
        this.tokens = lexer.iterator();
    }

    public List<LogMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public boolean hasErrors() {
        return hasErrors;
    }

    /**
     * 解析整个输入
     *
     * @return 语法树；存在错误时树可能不完整，应先检查 {@link #hasErrors()}
     */
    public ScriptPage run() {
        if (used) {
            throw new IllegalStateException("A parser instance can only be run once");
        }
        used = true;
        nextToken();

        TextPosition start = current.start().offset() >= 0 ? current.start() : TextPosition.START;
        ScriptMode parsingMode = mode;
        ScriptBlockStatement frontMatter = null;
        ScriptBlockStatement body;

        switch (parsingMode) {
            case FRONT_MATTER_ONLY:
            case FRONT_MATTER_AND_CONTENT:
                if (current.type() != TokenType.FRONT_MATTER_MARKER) {
                    logError(currentSpan(), String.format(
                            "When `%s` is enabled, expecting a `%s` at the beginning of the text instead of `%s`",
                            parsingMode, lexer.getOptions().frontMatterMarker(), tokenText(current)));
                    return finish(start, null, emptyBlock(start));
                }
                inFrontMatter = true;
                inCodeSection = true;
                nextToken();
                frontMatter = parseBlockStatement(new BlockFrame(FrameKind.PAGE, "front matter", false));
                if (inFrontMatter) {
                    logError(currentSpan(), String.format(
                            "End of front matter `%s` not found", lexer.getOptions().frontMatterMarker()));
                }
                if (parsingMode == ScriptMode.FRONT_MATTER_ONLY) {
                    return finish(start, frontMatter, emptyBlock(current.start()));
                }
                break;
            case SCRIPT_ONLY:
                inCodeSection = true;
                break;
            default:
                break;
        }

        body = parseBlockStatement(new BlockFrame(FrameKind.PAGE, "page", false));
        if (frontMatter != null) {
            body = trimRawAfterFrontMatter(body);
        }
        return finish(start, frontMatter, body);
    }

    private ScriptPage finish(TextPosition start, ScriptBlockStatement frontMatter, ScriptBlockStatement body) {
        if (lexer.hasErrors()) {
            for (LogMessage error : lexer.getErrors()) {
                log(error, false);
            }
        }
        if (hasErrors && log.isDebugEnabled()) {
            log.debug("Parsing of `{}` finished with {} message(s)", fileName, messages.size());
        }
        return new ScriptPage(spanFrom(start), frontMatter, body);
    }

    // ------------------------------------------------------------------
    // 语句
    // ------------------------------------------------------------------

    private ScriptBlockStatement parseBlockStatement(BlockFrame frame) {
        blocks.push(frame);
        blockLevel++;
        enterExpression();
        try {
            TextPosition start = current.start();
            List<ScriptStatement> statements = new ArrayList<>();
            StatementSlot slot = new StatementSlot();
            while (true) {
                Token before = current;
                boolean nextStatement = tryParseStatement(frame, slot);
                if (slot.statement != null) {
                    statements.add(slot.statement);
                }
                if (slot.hasEnd || !nextStatement) {
                    break;
                }
                if (before == current && slot.statement == null) {
                    logError(currentSpan(), String.format("Unexpected token `%s`", tokenText(current)), true);
                    break;
                }
            }

            if (!slot.hasEnd && blockLevel > 1) {
                if (liquid) {
                    logError(currentSpan(), String.format(
                            "The `end%s` statement was not found for the `%s` statement", frame.keyword, frame.keyword));
                } else {
                    logError(previousSpan(), "The `end` statement was not found");
                }
            }
            return new ScriptBlockStatement(spanFrom(start), statements);
        } finally {
            leaveExpression();
            blockLevel--;
            blocks.pop();
        }
    }

    /**
     * @return 是否继续解析同一块中的下一条语句
     */
    private boolean tryParseStatement(BlockFrame parent, StatementSlot slot) {
        slot.statement = null;
        slot.hasEnd = false;

        while (true) {
            if (fatalError) {
                return false;
            }
            switch (current.type()) {
                case EOF:
                    return false;

                case RAW:
                case ESCAPE: {
                    ScriptRawStatement raw = parseRawStatement();
                    // case 与第一个 when 之间的文本不输出
                    if (parent.kind == FrameKind.CASE) {
                        continue;
                    }
                    slot.statement = raw;
                    return true;
                }

                case CODE_ENTER:
                case LIQUID_TAG_ENTER: {
                    if (inCodeSection) {
                        logError(currentSpan(), "Unexpected token while already in a code block");
                    }
                    liquidTagSection = current.type() == TokenType.LIQUID_TAG_ENTER;
                    inCodeSection = true;
                    Token enter = current;
                    nextToken();
                    if (current.type() == TokenType.CODE_EXIT || current.type() == TokenType.LIQUID_TAG_EXIT) {
                        slot.statement = new ScriptNopStatement(spanOf(enter).withEnd(current.end()));
                        return true;
                    }
                    continue;
                }

                case FRONT_MATTER_MARKER:
                    if (inFrontMatter) {
                        inFrontMatter = false;
                        inCodeSection = false;
                        if (mode != ScriptMode.FRONT_MATTER_ONLY) {
                            nextToken();
                        }
                        mode = ScriptMode.DEFAULT;
                        return false;
                    }
                    logError(currentSpan(), String.format(
                            "Unexpected front matter marker `%s` while not inside a front matter",
                            lexer.getOptions().frontMatterMarker()));
                    nextToken();
                    continue;

                case CODE_EXIT:
                case LIQUID_TAG_EXIT:
                    if (!inCodeSection) {
                        logError(currentSpan(), "Unexpected code block exit `}}` while no code block enter `{{` has been found");
                    } else if (mode == ScriptMode.SCRIPT_ONLY) {
                        logError(currentSpan(), "Unexpected code block exit `}}` while parsing in script only mode. `}}` is not allowed");
                    }
                    liquidTagSection = false;
                    inCodeSection = false;
                    nextToken();
                    continue;

                default:
                    if (!inCodeSection) {
                        logError(currentSpan(), String.format(
                                "Unexpected token `%s` outside of a code block", tokenText(current)));
                        return false;
                    }
                    switch (current.type()) {
                        case NEW_LINE:
                        case SEMI_COLON:
                            nextToken();
                            continue;
                        case IDENTIFIER:
                        case IDENTIFIER_SPECIAL: {
                            String identifier = tokenText(current);
                            return liquid
                                    ? parseLiquidStatement(identifier, parent, slot)
                                    : parseNativeStatement(identifier, parent, slot);
                        }
                        default:
                            if (startAsExpression()) {
                                slot.statement = parseExpressionStatement();
                                return true;
                            }
                            logError(currentSpan(), String.format("Unexpected token `%s`", tokenText(current)));
                            return false;
                    }
            }
        }
    }

    private boolean parseNativeStatement(String identifier, BlockFrame parent, StatementSlot slot) {
        Token startToken = current;
        switch (identifier) {
            case "end":
                slot.hasEnd = true;
                nextToken();
                if (findFirstFrameExpectingEnd() == null) {
                    logError(spanOf(startToken), "Found an `end` statement without a matching statement to close");
                }
                expectEndOfStatement();
                return false;
            case "wrap":
                checkNotInCase(parent, startToken);
                slot.statement = parseWrapStatement();
                return true;
            case "if":
                checkNotInCase(parent, startToken);
                slot.statement = parseIfStatement(false, false, "if");
                return true;
            case "case":
                checkNotInCase(parent, startToken);
                slot.statement = parseCaseStatement();
                return true;
            case "when":
                return attachWhen(parent, slot, startToken);
            case "else": {
                ScriptConditionStatement next;
                if (peekToken().type() == TokenType.IDENTIFIER && "if".equals(tokenText(peekToken()))) {
                    nextToken(); // else
                    next = parseIfStatement(false, true, "if");
                } else {
                    next = parseElseStatement();
                }
                return attachElse(parent, slot, startToken, next, false);
            }
            case "for":
                checkNotInCase(parent, startToken);
                slot.statement = peekToken().type() == TokenType.DOT
                        ? parseExpressionStatement()
                        : parseForStatement(false);
                return true;
            case "tablerow":
                checkNotInCase(parent, startToken);
                slot.statement = peekToken().type() == TokenType.DOT
                        ? parseExpressionStatement()
                        : parseForStatement(true);
                return true;
            case "while":
                checkNotInCase(parent, startToken);
                slot.statement = peekToken().type() == TokenType.DOT
                        ? parseExpressionStatement()
                        : parseWhileStatement();
                return true;
            case "with":
                checkNotInCase(parent, startToken);
                slot.statement = parseWithStatement();
                return true;
            case "import":
                checkNotInCase(parent, startToken);
                slot.statement = parseImportStatement();
                return true;
            case "readonly":
                checkNotInCase(parent, startToken);
                slot.statement = parseReadOnlyStatement();
                return true;
            case "break":
                checkNotInCase(parent, startToken);
                nextToken();
                slot.statement = new ScriptBreakStatement(spanOf(startToken));
                expectEndOfStatement();
                return true;
            case "continue":
                checkNotInCase(parent, startToken);
                nextToken();
                slot.statement = new ScriptContinueStatement(spanOf(startToken));
                expectEndOfStatement();
                return true;
            case "func":
                checkNotInCase(parent, startToken);
                slot.statement = parseFunctionStatement(false);
                return true;
            case "ret":
                checkNotInCase(parent, startToken);
                slot.statement = parseReturnStatement();
                return true;
            case "capture":
                checkNotInCase(parent, startToken);
                slot.statement = parseCaptureStatement();
                return true;
            default:
                checkNotInCase(parent, startToken);
                slot.statement = parseExpressionStatement();
                return true;
        }
    }

    private boolean parseLiquidStatement(String identifier, BlockFrame parent, StatementSlot slot) {
        Token startToken = current;
        // {{ }} 中只有表达式
        if (!liquidTagSection) {
            checkNotInCase(parent, startToken);
            slot.statement = parseExpressionStatement();
            return true;
        }

        if (!"when".equals(identifier) && !"case".equals(identifier) && !identifier.startsWith("end")
                && parent.kind == FrameKind.CASE) {
            logError(spanOf(startToken), String.format("Unexpected statement `%s` inside a case block", identifier));
        }

        switch (identifier) {
            case "endif":
                return closeLiquidBlock(startToken, slot, "`if`/`else`", FrameKind.IF);
            case "endifchanged":
                return closeLiquidBlock(startToken, slot, "`ifchanged`", FrameKind.IF);
            case "endunless":
                return closeLiquidBlock(startToken, slot, "`unless`", FrameKind.IF);
            case "endfor":
                return closeLiquidBlock(startToken, slot, "`for`", FrameKind.FOR, FrameKind.TABLEROW);
            case "endcase":
                return closeLiquidBlock(startToken, slot, "`case`", FrameKind.CASE);
            case "endcapture":
                return closeLiquidBlock(startToken, slot, "`capture`", FrameKind.CAPTURE);
            case "endtablerow":
                return closeLiquidBlock(startToken, slot, "`tablerow`", FrameKind.TABLEROW);
            case "case":
                slot.statement = parseCaseStatement();
                return true;
            case "when":
                return attachWhen(parent, slot, startToken);
            case "if":
                slot.statement = parseIfStatement(false, false, "if");
                return true;
            case "ifchanged":
                slot.statement = parseLiquidIfChanged();
                return true;
            case "unless":
                checkNotInCase(parent, startToken);
                slot.statement = parseIfStatement(true, false, "unless");
                return true;
            case "else":
            case "elsif": {
                boolean isElseIf = "elsif".equals(identifier);
                ScriptConditionStatement next = isElseIf
                        ? parseIfStatement(false, true, "if")
                        : parseElseStatement();
                return attachElse(parent, slot, startToken, next, isElseIf);
            }
            case "for":
                slot.statement = parseForStatement(false);
                return true;
            case "tablerow":
                slot.statement = parseForStatement(true);
                return true;
            case "cycle":
                slot.statement = parseLiquidCycleStatement();
                return true;
            case "break":
                nextToken();
                slot.statement = new ScriptBreakStatement(spanOf(startToken));
                expectEndOfStatement();
                return true;
            case "continue":
                nextToken();
                slot.statement = new ScriptContinueStatement(spanOf(startToken));
                expectEndOfStatement();
                return true;
            case "assign": {
                nextToken(); // assign
                Token assignToken = current;
                ScriptExpressionStatement statement = parseExpressionStatement();
                if (!(statement.getExpression() instanceof ScriptAssignExpression)) {
                    logError(spanOf(assignToken), "Expecting an assignment expression after `assign`");
                }
                slot.statement = statement;
                return true;
            }
            case "capture":
                slot.statement = parseCaptureStatement();
                return true;
            case "increment":
                slot.statement = parseLiquidIncrementStatement(false);
                return true;
            case "decrement":
                slot.statement = parseLiquidIncrementStatement(true);
                return true;
            case "include":
                slot.statement = parseLiquidIncludeStatement();
                return true;
            default:
                checkNotInCase(parent, startToken);
                slot.statement = parseExpressionStatement();
                return true;
        }
    }

    private boolean closeLiquidBlock(Token startToken, StatementSlot slot, String pendingStart, FrameKind... kinds) {
        nextToken();
        slot.hasEnd = true;
        BlockFrame frame = findFirstFrameExpectingEnd();
        boolean matched = false;
        if (frame != null) {
            for (FrameKind kind : kinds) {
                if (frame.kind == kind) {
                    matched = true;
                    break;
                }
            }
        }
        if (!matched) {
            logError(spanOf(startToken), String.format(
                    "Unable to find a pending %s for this `%s`", pendingStart, tokenText(startToken)));
        }
        expectEndOfStatement();
        return false;
    }

    private boolean attachWhen(BlockFrame parent, StatementSlot slot, Token startToken) {
        ScriptWhenStatement when = parseWhenStatement();
        slot.hasEnd = true;
        if (parent.kind == FrameKind.WHEN) {
            parent.continuation = when;
        } else if (parent.kind == FrameKind.CASE) {
            slot.statement = when;
        } else {
            logError(spanOf(startToken), "A `when` condition must follow a `case` or another `when` statement");
            return false;
        }
        return true;
    }

    private boolean attachElse(BlockFrame parent, StatementSlot slot, Token startToken,
                               ScriptConditionStatement next, boolean isElseIf) {
        slot.hasEnd = true;
        if (parent.kind == FrameKind.IF) {
            parent.continuation = next;
        } else if (parent.kind == FrameKind.WHEN) {
            if (isElseIf) {
                logError(spanOf(startToken), "A `elsif` condition is not allowed inside a `when` statement");
            }
            parent.continuation = next;
        } else {
            logError(spanOf(startToken), "An `else` condition must follow an `if` or a `when` statement");
            return false;
        }
        return true;
    }

    private ScriptIfStatement parseIfStatement(boolean invert, boolean isElseIf, String keyword) {
        TextPosition start = current.start();
        nextToken(); // if / elsif / unless
        ScriptExpression condition = expectAndParseExpression();
        BlockFrame frame = new BlockFrame(FrameKind.IF, keyword, isElseIf);
        ScriptBlockStatement then = expectEndOfStatement() ? parseBlockStatement(frame) : emptyBlock(current.start());
        return new ScriptIfStatement(spanFrom(start), orMissing(condition, start), invert, then,
                frame.continuation, isElseIf);
    }

    private ScriptElseStatement parseElseStatement() {
        TextPosition start = current.start();
        nextToken(); // else
        BlockFrame frame = new BlockFrame(FrameKind.ELSE, "else", false);
        ScriptBlockStatement body = expectEndOfStatement() ? parseBlockStatement(frame) : emptyBlock(current.start());
        return new ScriptElseStatement(spanFrom(start), body, frame.continuation);
    }

    private ScriptCaseStatement parseCaseStatement() {
        TextPosition start = current.start();
        nextToken(); // case
        ScriptExpression value = expectAndParseExpression();
        ScriptBlockStatement body = expectEndOfStatement()
                ? parseBlockStatement(new BlockFrame(FrameKind.CASE, "case", false))
                : emptyBlock(current.start());
        return new ScriptCaseStatement(spanFrom(start), orMissing(value, start), body);
    }

    private ScriptWhenStatement parseWhenStatement() {
        TextPosition start = current.start();
        nextToken(); // when
        List<ScriptExpression> values = new ArrayList<>();
        while (isVariableOrLiteral(current)) {
            ScriptExpression value = parseVariableOrLiteral();
            if (value != null) {
                values.add(value);
            }
            if (current.type() == TokenType.COMMA
                    || (!liquid && current.type() == TokenType.DOUBLE_PIPE)
                    || (liquid && current.type() == TokenType.IDENTIFIER && "or".equals(tokenText(current)))) {
                nextToken();
            }
        }
        if (values.isEmpty()) {
            logError(currentSpan(), "A `when` condition expects at least one value");
        }
        BlockFrame frame = new BlockFrame(FrameKind.WHEN, "when", false);
        ScriptBlockStatement body = expectEndOfStatement() ? parseBlockStatement(frame) : emptyBlock(current.start());
        return new ScriptWhenStatement(spanFrom(start), values, body, frame.continuation);
    }

    private ScriptForStatement parseForStatement(boolean tableRow) {
        TextPosition start = current.start();
        String keyword = tableRow ? "tablerow" : "for";
        nextToken(); // for / tablerow

        ScriptExpression variable = expectAndParseExpression(Host.OTHER, null, new ExpressionState(), false, 0, true);
        ScriptExpression iterator = null;
        List<ScriptNamedArgument> namedArguments = new ArrayList<>();
        ScriptBlockStatement body = null;
        if (variable != null) {
            if (!(variable instanceof ScriptVariablePath)) {
                logError(variable.getSpan(), String.format("Expecting a variable instead of `%s`", variable));
            }
            if (current.type() != TokenType.IDENTIFIER || !"in".equals(tokenText(current))) {
                logError(currentSpan(), String.format(
                        "Expecting `in` after the loop variable instead of `%s`", tokenText(current)));
            } else {
                nextToken(); // in
            }
            iterator = expectAndParseExpression(Host.OTHER, namedArguments, new ExpressionState(), false, 0, false);
            if (expectEndOfStatement()) {
                body = parseBlockStatement(new BlockFrame(tableRow ? FrameKind.TABLEROW : FrameKind.FOR, keyword, false));
            }
        }
        if (body == null) {
            body = emptyBlock(current.start());
        }
        SourceSpan span = spanFrom(start);
        if (tableRow) {
            return new ScriptTableRowStatement(span, orMissing(variable, start), orMissing(iterator, start),
                    namedArguments, body);
        }
        return new ScriptForStatement(span, orMissing(variable, start), orMissing(iterator, start), namedArguments, body);
    }

    private ScriptWhileStatement parseWhileStatement() {
        TextPosition start = current.start();
        nextToken(); // while
        ScriptExpression condition = expectAndParseExpression();
        ScriptBlockStatement body = expectEndOfStatement()
                ? parseBlockStatement(new BlockFrame(FrameKind.WHILE, "while", false))
                : emptyBlock(current.start());
        return new ScriptWhileStatement(spanFrom(start), orMissing(condition, start), body);
    }

    private ScriptWithStatement parseWithStatement() {
        TextPosition start = current.start();
        nextToken(); // with
        ScriptExpression name = expectAndParseExpression();
        ScriptBlockStatement body = expectEndOfStatement()
                ? parseBlockStatement(new BlockFrame(FrameKind.WITH, "with", false))
                : emptyBlock(current.start());
        return new ScriptWithStatement(spanFrom(start), orMissing(name, start), body);
    }

    private ScriptWrapStatement parseWrapStatement() {
        TextPosition start = current.start();
        nextToken(); // wrap
        ScriptExpression target = expectAndParseExpression();
        ScriptBlockStatement body = expectEndOfStatement()
                ? parseBlockStatement(new BlockFrame(FrameKind.WRAP, "wrap", false))
                : emptyBlock(current.start());
        return new ScriptWrapStatement(spanFrom(start), orMissing(target, start), body);
    }

    private ScriptCaptureStatement parseCaptureStatement() {
        TextPosition start = current.start();
        nextToken(); // capture
        ScriptExpression target = expectAndParseExpression();
        ScriptBlockStatement body = expectEndOfStatement()
                ? parseBlockStatement(new BlockFrame(FrameKind.CAPTURE, "capture", false))
                : emptyBlock(current.start());
        return new ScriptCaptureStatement(spanFrom(start), orMissing(target, start), body);
    }

    private ScriptImportStatement parseImportStatement() {
        TextPosition start = current.start();
        nextToken(); // import
        ScriptExpression expression = expectAndParseExpression();
        expectEndOfStatement();
        return new ScriptImportStatement(spanFrom(start), orMissing(expression, start));
    }

    private ScriptReadOnlyStatement parseReadOnlyStatement() {
        TextPosition start = current.start();
        nextToken(); // readonly
        ScriptVariable variable = expectAndParseVariable();
        expectEndOfStatement();
        return variable != null ? new ScriptReadOnlyStatement(spanFrom(start), variable) : null;
    }

    private ScriptReturnStatement parseReturnStatement() {
        TextPosition start = current.start();
        nextToken(); // ret
        ScriptExpression expression = null;
        if (startAsExpression()) {
            expression = parseExpression(Host.OTHER, null, new ExpressionState(), false, 0, false);
        }
        expectEndOfStatement();
        return new ScriptReturnStatement(spanFrom(start), expression);
    }

    private ScriptFunction parseFunctionStatement(boolean anonymous) {
        TextPosition start = current.start();
        nextToken(); // func / do
        ScriptVariable name = null;
        if (!anonymous) {
            name = expectAndParseVariable();
        }
        expectEndOfStatement();
        BlockFrame frame = anonymous
                ? new BlockFrame(FrameKind.ANONYMOUS_FUNCTION, "do", false)
                : new BlockFrame(FrameKind.FUNCTION, "func", false);
        ScriptBlockStatement body = parseBlockStatement(frame);
        return new ScriptFunction(spanFrom(start), name, body);
    }

    private ScriptExpressionStatement parseExpressionStatement() {
        TextPosition start = current.start();
        ExpressionState state = new ExpressionState();
        ScriptExpression expression = null;
        if (startAsExpression()) {
            expression = transformKeyword(parseExpression(Host.STATEMENT, null, state, false, 0, false));
        } else {
            logError(currentSpan(), String.format("Expecting an expression instead of `%s`", tokenText(current)));
        }
        if (!state.hasAnonymousFunction) {
            expectEndOfStatement();
        }
        return new ScriptExpressionStatement(spanFrom(start), orMissing(expression, start));
    }

    private ScriptRawStatement parseRawStatement() {
        Token raw = current;
        int escapeCount = 0;
        if (raw.type() == TokenType.ESCAPE) {
            nextToken(); // escape
            if (current.type().isEscapeCount()) {
                escapeCount = current.type().escapeCount();
            } else {
                logError(currentSpan(), String.format(
                        "Expecting an escape count token instead of `%s`", tokenText(current)));
            }
        }
        nextToken(); // raw / escape count
        // 空的转义块 end < start
        String rawText = raw.end().offset() >= raw.start().offset()
                ? text.substring(raw.start().offset(), raw.end().offset() + 1)
                : "";
        return new ScriptRawStatement(spanOf(raw), rawText, escapeCount);
    }

    private ScriptStatement parseLiquidIfChanged() {
        TextPosition start = current.start();
        Token token = current;
        nextToken(); // ifchanged
        expectEndOfStatement();
        BlockFrame frame = new BlockFrame(FrameKind.IF, "ifchanged", false);
        ScriptBlockStatement then = parseBlockStatement(frame);
        ScriptVariable condition = ScriptVariable.LOOP_CHANGED.withSpan(spanOf(token));
        return new ScriptIfStatement(spanFrom(start), condition, false, then, frame.continuation, false);
    }

    /**
     * {@code cycle 'a', 'b'} 与 {@code cycle 'group': 'a', 'b'} 转为 {@code cycle ['a', 'b'] group: 'group'}
     */
    private ScriptExpressionStatement parseLiquidCycleStatement() {
        TextPosition start = current.start();
        ScriptExpression target = parseVariable();
        if (options.convertLiquidFunctions()) {
            target = convertLiquidFunction(target);
        }

        List<ScriptExpression> values = new ArrayList<>();
        ScriptNamedArgument group = null;
        boolean isFirst = true;
        while (isVariableOrLiteral(current)) {
            ScriptExpression value = parseVariableOrLiteral();
            if (value == null) {
                break;
            }
            if (isFirst && current.type() == TokenType.COLON) {
                nextToken(); // :
                group = new ScriptNamedArgument(value.getSpan(), "group", value);
                isFirst = false;
                continue;
            }
            values.add(value);
            if (current.type() == TokenType.COMMA) {
                nextToken();
            } else if (current.type() == TokenType.LIQUID_TAG_EXIT) {
                break;
            } else {
                logError(currentSpan(), String.format(
                        "Unexpected token `%s` after cycle value `%s`", tokenText(current), value));
                nextToken();
                break;
            }
        }

        List<ScriptExpression> arguments = new ArrayList<>();
        if (!values.isEmpty()) {
            SourceSpan valuesSpan = values.get(0).getSpan().withEnd(values.get(values.size() - 1).getSpan().end());
            arguments.add(new ScriptArrayInitializerExpression(valuesSpan, values));
        }
        if (group != null) {
            arguments.add(group);
        }
        ScriptFunctionCall call = new ScriptFunctionCall(spanFrom(start), target, arguments);
        expectEndOfStatement();
        return new ScriptExpressionStatement(spanFrom(start), call);
    }

    /**
     * {@code increment x} 转为 {@code x = (x ?? 0) + 1}，未赋值的计数器从 0 开始
     */
    private ScriptStatement parseLiquidIncrementStatement(boolean decrement) {
        TextPosition start = current.start();
        nextToken(); // increment / decrement
        ScriptVariable variable = expectAndParseVariable();
        expectEndOfStatement();
        if (variable == null) {
            return null;
        }
        SourceSpan span = spanFrom(start);
        ScriptNestedExpression seed = new ScriptNestedExpression(span, new ScriptBinaryExpression(span, variable,
                ScriptBinaryOperator.EMPTY_COALESCING, new ScriptLiteral(span, 0)));
        ScriptBinaryExpression value = new ScriptBinaryExpression(span, seed,
                decrement ? ScriptBinaryOperator.SUBTRACT : ScriptBinaryOperator.ADD, new ScriptLiteral(span, 1));
        return new ScriptExpressionStatement(span, new ScriptAssignExpression(span, variable, value));
    }

    /**
     * Liquid include 的三种写法：
     * <ul>
     *   <li>{@code include 'a' with x}：先执行 {@code this['a'] = x} 再 include</li>
     *   <li>{@code include 'a' for list}：对 list 的每一项赋给 {@code this['a']} 后 include</li>
     *   <li>{@code include 'a' k1: v1, k2: v2}：先赋值各变量再 include (可与 with / for 组合)</li>
     * </ul>
     */
    private ScriptStatement parseLiquidIncludeStatement() {
        TextPosition start = current.start();
        ScriptExpression target = parseVariable();
        Token nameToken = current;
        ScriptExpression templateName = expectAndParseExpression(Host.OTHER, null, new ExpressionState(), false, 0, true);
        List<ScriptExpression> arguments = new ArrayList<>();
        if (templateName != null) {
            boolean validName = (templateName instanceof ScriptLiteral && ((ScriptLiteral) templateName).getValue() instanceof String)
                    || templateName instanceof ScriptVariablePath;
            if (!validName) {
                logError(spanOf(nameToken), String.format("Unexpected include template name `%s`", templateName));
            }
            arguments.add(templateName);
        }
        ScriptFunctionCall include = new ScriptFunctionCall(spanFrom(start), target, arguments);
        ScriptExpressionStatement includeStatement = new ScriptExpressionStatement(include.getSpan(), include);

        List<ScriptStatement> assignments = new ArrayList<>();
        ScriptStatement main = includeStatement;
        if (current.type() == TokenType.IDENTIFIER) {
            String next = tokenText(current);
            if ("with".equals(next)) {
                Token with = current;
                nextToken(); // with
                TextPosition valueStart = current.start();
                ScriptExpression value = expectAndParseExpression(Host.OTHER, null, new ExpressionState(), false, 0, true);
                ScriptExpression variable = templateVariable(spanOf(with), templateName, start);
                SourceSpan span = spanFrom(valueStart);
                assignments.add(new ScriptExpressionStatement(span,
                        new ScriptAssignExpression(span, variable, orMissing(value, valueStart))));
            } else if ("for".equals(next)) {
                Token forToken = current;
                nextToken(); // for
                TextPosition iteratorStart = current.start();
                ScriptExpression iterator = expectAndParseExpression(Host.OTHER, null, new ExpressionState(), false, 0, true);
                ScriptExpression variable = templateVariable(spanOf(forToken), templateName, start);
                ScriptBlockStatement body = new ScriptBlockStatement(include.getSpan(), List.of(includeStatement));
                main = new ScriptForStatement(spanFrom(start), variable, orMissing(iterator, iteratorStart), List.of(), body);
            }

            while (current.type() == TokenType.IDENTIFIER) {
                Token variableToken = current;
                ScriptExpression variableObject = parseVariable();
                ScriptVariable variable = variableObject instanceof ScriptVariable ? (ScriptVariable) variableObject : null;
                if (variable == null) {
                    logError(spanOf(variableToken), String.format(
                            "Unexpected variable `%s` in include", tokenText(variableToken)));
                }
                if (current.type() == TokenType.COLON) {
                    nextToken(); // :
                } else {
                    logError(currentSpan(), String.format(
                            "Unexpected token `%s` after variable `%s`. Expecting `:`", tokenText(current), variable));
                }
                ScriptExpression value = expectAndParseExpression(Host.OTHER, null, new ExpressionState(), false, 0, true);
                if (variable != null) {
                    SourceSpan span = spanFrom(variableToken.start());
                    assignments.add(new ScriptExpressionStatement(span,
                            new ScriptAssignExpression(span, variable, orMissing(value, variableToken.start()))));
                }
                if (current.type() == TokenType.COMMA) {
                    nextToken();
                }
            }
        }
        expectEndOfStatement();

        if (assignments.isEmpty()) {
            return main;
        }
        List<ScriptStatement> statements = new ArrayList<>(assignments);
        statements.add(main);
        return new ScriptBlockStatement(spanFrom(start), statements);
    }

    private ScriptExpression templateVariable(SourceSpan span, ScriptExpression templateName, TextPosition start) {
        return new ScriptIndexerExpression(span, new ScriptThisExpression(span), orMissing(templateName, start));
    }

    private ScriptBlockStatement trimRawAfterFrontMatter(ScriptBlockStatement body) {
        List<ScriptStatement> statements = body.getStatements();
        if (statements.isEmpty() || !(statements.get(0) instanceof ScriptRawStatement)) {
            return body;
        }
        ScriptRawStatement raw = (ScriptRawStatement) statements.get(0);
        String rawText = raw.getText();
        int i = 0;
        while (i < rawText.length() && (rawText.charAt(i) == ' ' || rawText.charAt(i) == '\t')) {
            i++;
        }
        int skip;
        if (rawText.startsWith("\r\n", i)) {
            skip = i + 2;
        } else if (rawText.startsWith("\n", i)) {
            skip = i + 1;
        } else {
            return body;
        }
        SourceSpan span = raw.getSpan();
        TextPosition newStart = new TextPosition(span.start().offset() + skip, span.start().line() + 1, 0);
        List<ScriptStatement> fixed = new ArrayList<>(statements);
        fixed.set(0, new ScriptRawStatement(new SourceSpan(span.fileName(), newStart, span.end()),
                rawText.substring(skip), raw.getEscapeCount()));
        return new ScriptBlockStatement(body.getSpan(), fixed);
    }

    private void checkNotInCase(BlockFrame parent, Token token) {
        if (parent.kind == FrameKind.CASE) {
            logError(spanOf(token), String.format("Unexpected statement `%s` inside a case block", tokenText(token)));
        }
    }

    private BlockFrame findFirstFrameExpectingEnd() {
        for (BlockFrame frame : blocks) {
            if (frame.expectsEnd()) {
                return frame;
            }
        }
        return null;
    }

    private boolean expectEndOfStatement() {
        if (liquid) {
            if (current.type() == TokenType.CODE_EXIT
                    || (liquidTagSection && current.type() == TokenType.LIQUID_TAG_EXIT)) {
                return true;
            }
        } else if (current.type() == TokenType.NEW_LINE || current.type() == TokenType.CODE_EXIT
                || current.type() == TokenType.SEMI_COLON || current.type() == TokenType.EOF) {
            if (current.type() == TokenType.NEW_LINE || current.type() == TokenType.SEMI_COLON) {
                nextToken();
            }
            return true;
        }
        logError(currentSpan(), String.format(
                "Found token `%s` while expecting the end of the statement", tokenText(current)), true);
        return false;
    }

    private ScriptVariable expectAndParseVariable() {
        if (current.type() == TokenType.IDENTIFIER || current.type() == TokenType.IDENTIFIER_SPECIAL) {
            ScriptExpression variableOrLiteral = parseVariable();
            if (variableOrLiteral instanceof ScriptVariable
                    && ((ScriptVariable) variableOrLiteral).getScope() != ScriptVariableScope.LOOP) {
                return (ScriptVariable) variableOrLiteral;
            }
            logError(variableOrLiteral != null ? variableOrLiteral.getSpan() : currentSpan(),
                    String.format("Unexpected variable `%s`", variableOrLiteral));
        } else {
            logError(currentSpan(), String.format("Expecting a variable instead of `%s`", tokenText(current)));
        }
        return null;
    }

    // ------------------------------------------------------------------
    // 表达式
    // ------------------------------------------------------------------

    private ScriptExpression expectAndParseExpression() {
        return expectAndParseExpression(Host.OTHER, null, new ExpressionState(), false, 0, false);
    }

    private ScriptExpression expectAndParseExpression(Host host, List<ScriptNamedArgument> namedArguments,
                                                      ExpressionState state, boolean nested, int precedence,
                                                      boolean basic) {
        if (startAsExpression()) {
            return parseExpression(host, namedArguments, state, nested, precedence, basic);
        }
        logError(currentSpan(), String.format("Expecting an expression instead of `%s`", tokenText(current)));
        return null;
    }

    /**
     * 解析一个表达式
     *
     * @param host           表达式所在位置
     * @param namedArguments 非 null 时命名参数收集到这里 (for 语句)，而不是生成函数调用
     * @param state          顶层表达式共享状态
     * @param nested         位于函数调用参数或赋值右侧，此时不再把并列的表达式识别为新的函数调用
     * @param precedence     当前优先级，只吸收优先级更高的二元运算符
     * @param basic          只解析主表达式与成员/索引后缀
     */
    private ScriptExpression parseExpression(Host host, List<ScriptNamedArgument> namedArguments,
                                             ExpressionState state, boolean nested, int precedence,
                                             boolean basic) {
        int expressionCount = 0;
        expressionLevel++;
        int depthBeforeEntering = expressionDepth;
        enterExpression();
        try {
            ScriptExpression callTarget = null;
            List<ScriptExpression> callArguments = null;

            while (true) {
                expressionCount++;
                ScriptExpression leftOperand = null;
                switch (current.type()) {
                    case IDENTIFIER:
                    case IDENTIFIER_SPECIAL:
                        leftOperand = parseVariable();
                        // Liquid 过滤器名后的冒号: {{ x | truncate: 5 }}
                        if (liquid && host == Host.PIPE && current.type() == TokenType.COLON) {
                            nextToken();
                        }
                        if (ScriptVariable.BLOCK_DELEGATE.equals(leftOperand)) {
                            if (expressionCount != 1 || expressionLevel > 1) {
                                logError(leftOperand.getSpan(), "The block delegate `$$` cannot be used in a nested expression");
                            }
                            if (host != Host.STATEMENT) {
                                logError(leftOperand.getSpan(), "The block delegate `$$` can only be used as an expression statement");
                            }
                            return leftOperand;
                        }
                        break;
                    case INTEGER:
                        leftOperand = parseInteger();
                        break;
                    case FLOAT:
                        leftOperand = parseFloat();
                        break;
                    case STRING:
                        leftOperand = parseString();
                        break;
                    case IMPLICIT_STRING:
                        leftOperand = parseImplicitString();
                        break;
                    case VERBATIM_STRING:
                        leftOperand = parseVerbatimString();
                        break;
                    case OPEN_PAREN:
                        leftOperand = parseParenthesis(state);
                        break;
                    case OPEN_BRACE:
                        leftOperand = parseObjectInitializer();
                        break;
                    case OPEN_BRACKET:
                        leftOperand = parseArrayInitializer();
                        break;
                    case EXCLAMATION:
                    case MINUS:
                    case PLUS:
                    case ARROBA:
                    case CARET:
                        leftOperand = parseUnaryExpression(state);
                        break;
                    default:
                        break;
                }

                if (leftOperand == null) {
                    if (callTarget != null) {
                        logError(currentSpan(), String.format(
                                "Unexpected token `%s` while parsing function call `%s`", tokenText(current), callTarget));
                    } else {
                        logError(currentSpan(), String.format(
                                "Unexpected token `%s` while parsing an expression", tokenText(current)));
                    }
                    return null;
                }

                if (leftOperand instanceof ScriptAnonymousFunction) {
                    state.hasAnonymousFunction = true;
                }

                boolean nextArgument = false;
                while (!state.hasAnonymousFunction) {
                    if (liquid && current.type() == TokenType.COMMA && callTarget != null) {
                        nextToken(); // Liquid 过滤器参数之间的逗号
                    }

                    if (current.type() == TokenType.DOT) {
                        Token nextToken = peekToken();
                        if (nextToken.type() != TokenType.IDENTIFIER) {
                            logError(spanOf(nextToken), String.format(
                                    "Invalid token `%s` after `.`. Expecting an identifier", tokenText(nextToken)));
                            return null;
                        }
                        nextToken(); // .
                        if ("empty".equals(tokenText(current)) && peekToken().type() == TokenType.QUESTION) {
                            nextToken(); // empty
                            nextToken(); // ?
                            leftOperand = new ScriptIsEmptyExpression(spanFrom(leftOperand.getSpan().start()), leftOperand);
                        } else {
                            ScriptExpression member = parseVariable();
                            if (!(member instanceof ScriptVariable)) {
                                logError(member != null ? member.getSpan() : currentSpan(),
                                        String.format("Unexpected literal member `%s`", member));
                                return null;
                            }
                            leftOperand = new ScriptMemberExpression(spanFrom(leftOperand.getSpan().start()),
                                    leftOperand, (ScriptVariable) member);
                        }
                        continue;
                    }

                    // a[0] 是索引，a [0] 是以数组为参数的函数调用
                    if (current.type() == TokenType.OPEN_BRACKET && leftOperand instanceof ScriptVariablePath
                            && !isPreviousCharWhitespace()) {
                        nextToken(); // [
                        TextPosition indexStart = current.start();
                        ScriptExpression index = startAsExpression()
                                ? parseExpression(Host.OTHER, null, state, callTarget != null, 0, false)
                                : null;
                        if (index == null) {
                            logError(currentSpan(), String.format(
                                    "Expecting an index expression instead of `%s`", tokenText(current)));
                        }
                        if (current.type() != TokenType.CLOSE_BRACKET) {
                            logError(currentSpan(), String.format("Expecting `]` instead of `%s`", tokenText(current)));
                        } else {
                            nextToken(); // ]
                        }
                        leftOperand = new ScriptIndexerExpression(spanFrom(leftOperand.getSpan().start()),
                                leftOperand, orMissing(index, indexStart));
                        continue;
                    }

                    if (basic) {
                        break;
                    }

                    if (current.type() == TokenType.EQUAL) {
                        TextPosition assignStart = leftOperand.getSpan().start();
                        if (expressionLevel > 1) {
                            logError(currentSpan(), "An assignment is only allowed at the top level of an expression");
                        }
                        nextToken(); // =
                        ScriptExpression target = transformKeyword(leftOperand);
                        TextPosition valueStart = current.start();
                        ScriptExpression value = expectAndParseExpression(host, null, state, nested, 0, false);
                        leftOperand = new ScriptAssignExpression(spanFrom(assignStart), target, orMissing(value, valueStart));
                        continue;
                    }

                    ScriptBinaryOperator binaryOperator = BINARY_OPERATORS.get(current.type());
                    if (binaryOperator == null && liquid && current.type() == TokenType.IDENTIFIER) {
                        binaryOperator = LIQUID_BINARY_OPERATORS.get(tokenText(current));
                    }
                    if (binaryOperator != null) {
                        int newPrecedence = binaryOperator.getPrecedence();
                        // 同级运算符留给外层，保证左结合
                        if (newPrecedence <= precedence) {
                            break;
                        }
                        enterExpression();
                        TextPosition binaryStart = leftOperand.getSpan().start();
                        Token operatorToken = current;
                        nextToken(); // 运算符
                        ScriptExpression right = null;
                        if (startAsExpression()) {
                            right = parseExpression(Host.OTHER, null, state, nested || callTarget != null, newPrecedence, false);
                        } else {
                            logError(currentSpan(), String.format(
                                    "Expecting an expression on the right of `%s` instead of `%s`",
                                    tokenText(operatorToken), tokenText(current)));
                        }
                        leftOperand = new ScriptBinaryExpression(spanFrom(binaryStart), leftOperand, binaryOperator,
                                orMissing(right, operatorToken.end()));
                        continue;
                    }

                    if (precedence > 0) {
                        break;
                    }

                    if (startAsExpression()) {
                        // 已经在函数调用的参数中
                        if (nested) {
                            break;
                        }

                        // 命名参数: name: value 或单独的 name (值为 true)
                        if (current.type() == TokenType.IDENTIFIER
                                && (namedArguments != null || (!liquid && peekToken().type() == TokenType.COLON))) {
                            if (namedArguments == null) {
                                if (callTarget == null) {
                                    callTarget = leftOperand;
                                    callArguments = new ArrayList<>();
                                } else {
                                    callArguments.add(leftOperand);
                                }
                            }
                            while (current.type() == TokenType.IDENTIFIER) {
                                Token nameToken = current;
                                nextToken(); // 参数名
                                ScriptExpression value = null;
                                if (current.type() == TokenType.COLON) {
                                    nextToken(); // :
                                    value = expectAndParseExpression(host, null, state, false, 0, true);
                                }
                                ScriptNamedArgument argument =
                                        new ScriptNamedArgument(spanFrom(nameToken.start()), tokenText(nameToken), value);
                                if (namedArguments != null) {
                                    namedArguments.add(argument);
                                } else {
                                    callArguments.add(argument);
                                }
                            }
                            if (callTarget != null) {
                                leftOperand = new ScriptFunctionCall(spanFrom(callTarget.getSpan().start()),
                                        callTarget, callArguments);
                                callTarget = null;
                                callArguments = null;
                            }
                            // 命名参数之后不再接受其他内容
                            break;
                        }

                        if (callTarget == null) {
                            callTarget = liquid && options.convertLiquidFunctions()
                                    ? convertLiquidFunction(leftOperand)
                                    : leftOperand;
                            callArguments = new ArrayList<>();
                        } else {
                            callArguments.add(leftOperand);
                        }
                        nextArgument = true;
                        break;
                    }

                    if (current.type() == TokenType.PIPE) {
                        if (callTarget != null) {
                            callArguments.add(leftOperand);
                            leftOperand = new ScriptFunctionCall(spanFrom(callTarget.getSpan().start()),
                                    callTarget, callArguments);
                            callTarget = null;
                            callArguments = null;
                        }
                        TextPosition pipeStart = leftOperand.getSpan().start();
                        Token pipeToken = current;
                        nextToken(); // |
                        ScriptExpression to = expectAndParseExpression(Host.PIPE, null, state, false, 0, false);
                        return new ScriptPipeCall(spanFrom(pipeStart), leftOperand, orMissing(to, pipeToken.end()));
                    }
                    break;
                }

                if (nextArgument) {
                    continue;
                }

                if (callTarget != null) {
                    callArguments.add(leftOperand);
                    return new ScriptFunctionCall(spanFrom(callTarget.getSpan().start()), callTarget, callArguments);
                }
                return leftOperand;
            }
        } finally {
            leaveExpression();
            expressionDepth = depthBeforeEntering;
            expressionLevel--;
        }
    }

    private ScriptExpression parseArrayInitializer() {
        TextPosition start = current.start();
        // 在跳过 [ 之前进入，使其后的换行被忽略
        allowNewLineLevel++;
        nextToken(); // [
        List<ScriptExpression> values = new ArrayList<>();
        boolean expectingEnd = false;
        while (current.type() != TokenType.CLOSE_BRACKET) {
            if (expectingEnd) {
                logError(currentSpan(), String.format(
                        "Unexpected token `%s`. Expecting a `]` to close the array initializer", tokenText(current)));
                break;
            }
            ScriptExpression value = expectAndParseExpression();
            if (value == null) {
                break;
            }
            values.add(value);
            if (current.type() == TokenType.COMMA) {
                nextToken();
            } else {
                expectingEnd = true;
            }
        }
        allowNewLineLevel--;
        nextToken(); // ]
        return new ScriptArrayInitializerExpression(spanFrom(start), values);
    }

    private ScriptExpression parseObjectInitializer() {
        TextPosition start = current.start();
        allowNewLineLevel++;
        nextToken(); // {
        Map<String, ScriptObjectInitializerExpression.Member> members = new LinkedHashMap<>();
        boolean expectingEnd = false;
        while (current.type() != TokenType.CLOSE_BRACE) {
            if (expectingEnd || (current.type() != TokenType.IDENTIFIER && current.type() != TokenType.STRING)) {
                logError(currentSpan(), String.format(
                        "Unexpected token `%s` while parsing an object initializer. Expecting a member name",
                        tokenText(current)));
                break;
            }
            Token keyToken = current;
            ScriptExpression key = current.type() == TokenType.STRING ? parseString() : parseVariable();
            if (!(key instanceof ScriptVariable) && !(key instanceof ScriptLiteral
                    && ((ScriptLiteral) key).getValue() instanceof String)) {
                logError(spanOf(keyToken), String.format("Invalid object member name `%s`", tokenText(keyToken)));
                break;
            }
            if (key instanceof ScriptVariable && ((ScriptVariable) key).getScope() != ScriptVariableScope.GLOBAL) {
                logError(spanOf(keyToken), "Invalid object member name. Local or loop variables are not allowed");
                break;
            }
            if (current.type() != TokenType.COLON) {
                logError(currentSpan(), String.format(
                        "Unexpected token `%s` after object member `%s`. Expecting `:`", tokenText(current), tokenText(keyToken)));
                break;
            }
            nextToken(); // :
            if (!startAsExpression()) {
                logError(currentSpan(), String.format(
                        "Unexpected token `%s` for the value of object member `%s`", tokenText(current), tokenText(keyToken)));
                break;
            }
            ScriptExpression value = parseExpression(Host.OTHER, null, new ExpressionState(), false, 0, false);
            if (value == null) {
                break;
            }
            String name = ScriptObjectInitializerExpression.nameOf(key);
            ScriptObjectInitializerExpression.Member existing = members.get(name);
            // 重复的键保留首次出现的位置，值以最后一次为准
            members.put(name, new ScriptObjectInitializerExpression.Member(existing != null ? existing.key() : key, value));
            if (current.type() == TokenType.COMMA) {
                nextToken();
            } else {
                expectingEnd = true;
            }
        }
        allowNewLineLevel--;
        nextToken(); // }
        return new ScriptObjectInitializerExpression(spanFrom(start), new ArrayList<>(members.values()));
    }

    private ScriptExpression parseParenthesis(ExpressionState state) {
        TextPosition start = current.start();
        nextToken(); // (
        ScriptExpression expression = startAsExpression()
                ? parseExpression(Host.OTHER, null, state, false, 0, false)
                : null;
        if (expression == null) {
            logError(currentSpan(), String.format("Expecting an expression instead of `%s`", tokenText(current)));
        }
        if (current.type() == TokenType.CLOSE_PAREN) {
            nextToken();
        } else {
            logError(currentSpan(), String.format(
                    "Expecting `)` to close the parenthesis opened at %s instead of `%s`",
                    start.toStringSimple(), tokenText(current)));
        }
        return new ScriptNestedExpression(spanFrom(start), orMissing(expression, start));
    }

    private ScriptExpression parseUnaryExpression(ExpressionState state) {
        TextPosition start = current.start();
        ScriptUnaryOperator operator;
        switch (current.type()) {
            case EXCLAMATION:
                operator = ScriptUnaryOperator.NOT;
                break;
            case MINUS:
                operator = ScriptUnaryOperator.NEGATE;
                break;
            case PLUS:
                operator = ScriptUnaryOperator.PLUS;
                break;
            case ARROBA:
                operator = ScriptUnaryOperator.FUNCTION_ALIAS;
                break;
            case CARET:
                operator = ScriptUnaryOperator.FUNCTION_PARAMETERS_EXPAND;
                break;
            default:
                throw new IllegalStateException("Unexpected token for a unary expression: " + current.type());
        }
        nextToken(); // 运算符
        ScriptExpression right = expectAndParseExpression(Host.OTHER, null, state, false, UNARY_PRECEDENCE, false);
        return new ScriptUnaryExpression(spanFrom(start), operator, orMissing(right, start));
    }

    /**
     * Liquid 中对与原生关键字同名的变量赋值时，用括号包裹，避免写回原生语法后被当作关键字
     */
    private ScriptExpression transformKeyword(ScriptExpression expression) {
        if (liquid && expression instanceof ScriptVariablePath && !(expression instanceof ScriptNestedExpression)
                && KEYWORDS.contains(((ScriptVariablePath) expression).getFirstPath())) {
            return new ScriptNestedExpression(expression.getSpan(), expression);
        }
        return expression;
    }

    /**
     * {@code downcase} 转为 {@code string.downcase}
     */
    private ScriptExpression convertLiquidFunction(ScriptExpression target) {
        if (!(target instanceof ScriptVariable)) {
            return target;
        }
        LiquidBuiltinsFunctions.QualifiedName qualifiedName =
                LiquidBuiltinsFunctions.tryImportLiquid(((ScriptVariable) target).getName());
        if (qualifiedName == null) {
            return target;
        }
        SourceSpan span = target.getSpan();
        return new ScriptMemberExpression(span,
                new ScriptVariable(span, qualifiedName.library(), ScriptVariableScope.GLOBAL),
                new ScriptVariable(span, qualifiedName.member(), ScriptVariableScope.GLOBAL));
    }

    private boolean startAsExpression() {
        switch (current.type()) {
            case IDENTIFIER:
            case IDENTIFIER_SPECIAL:
            case INTEGER:
            case FLOAT:
            case STRING:
            case IMPLICIT_STRING:
            case VERBATIM_STRING:
            case OPEN_PAREN:
            case OPEN_BRACE:
            case OPEN_BRACKET:
            case EXCLAMATION:
            case MINUS:
            case PLUS:
            case ARROBA:
            case CARET:
                return true;
            default:
                return false;
        }
    }

    private boolean isPreviousCharWhitespace() {
        int position = current.start().offset() - 1;
        return position >= 0 && position < text.length() && Character.isWhitespace(text.charAt(position));
    }

    private void enterExpression() {
        expressionDepth++;
        int limit = options.expressionDepthLimit();
        if (limit > 0 && !expressionDepthLimitReached && expressionDepth > limit) {
            logError(previousSpan(), String.format("The statement depth limit `%d` was reached", limit));
            expressionDepthLimitReached = true;
        }
    }

    private void leaveExpression() {
        expressionDepth--;
    }

    // ------------------------------------------------------------------
    // 终结符
    // ------------------------------------------------------------------

    private static boolean isVariableOrLiteral(Token token) {
        switch (token.type()) {
            case IDENTIFIER:
            case IDENTIFIER_SPECIAL:
            case INTEGER:
            case FLOAT:
            case STRING:
            case IMPLICIT_STRING:
            case VERBATIM_STRING:
                return true;
            default:
                return false;
        }
    }

    private ScriptExpression parseVariableOrLiteral() {
        switch (current.type()) {
            case IDENTIFIER:
            case IDENTIFIER_SPECIAL:
                return parseVariable();
            case INTEGER:
                return parseInteger();
            case FLOAT:
                return parseFloat();
            case STRING:
                return parseString();
            case IMPLICIT_STRING:
                return parseImplicitString();
            case VERBATIM_STRING:
                return parseVerbatimString();
            default:
                logError(currentSpan(), String.format(
                        "Unexpected token `%s` while expecting a variable or a literal", tokenText(current)));
                return null;
        }
    }

    private ScriptLiteral parseInteger() {
        Token token = current;
        String value = tokenText(token);
        nextToken();
        try {
            long result = Long.parseLong(value);
            if (result >= Integer.MIN_VALUE && result <= Integer.MAX_VALUE) {
                return new ScriptLiteral(spanOf(token), (int) result);
            }
            return new ScriptLiteral(spanOf(token), result);
        } catch (NumberFormatException e) {
            logError(spanOf(token), String.format("Unable to parse the integer `%s`", value));
            return new ScriptLiteral(spanOf(token), 0);
        }
    }

    private ScriptLiteral parseFloat() {
        Token token = current;
        String value = tokenText(token);
        nextToken();
        try {
            return new ScriptLiteral(spanOf(token), Double.parseDouble(value));
        } catch (NumberFormatException e) {
            logError(spanOf(token), String.format("Unable to parse the float `%s`", value));
            return new ScriptLiteral(spanOf(token), 0.0d);
        }
    }

    private ScriptLiteral parseImplicitString() {
        Token token = current;
        nextToken();
        return new ScriptLiteral(spanOf(token), tokenText(token));
    }

    private ScriptLiteral parseString() {
        Token token = current;
        int startOffset = token.start().offset();
        int end = token.end().offset();
        ScriptLiteralStringQuoteType quoteType = text.charAt(startOffset) == '\''
                ? ScriptLiteralStringQuoteType.SIMPLE_QUOTE
                : ScriptLiteralStringQuoteType.DOUBLE_QUOTE;
        StringBuilder builder = new StringBuilder(Math.max(0, end - startOffset - 1));
        for (int i = startOffset + 1; i < end; i++) {
            char c = text.charAt(i);
            if (c != '\\') {
                builder.append(c);
                continue;
            }
            i++;
            char escaped = text.charAt(i);
            switch (escaped) {
                case '0':
                    builder.append('\0');
                    break;
                case '\n':
                    break;
                case '\r':
                    // \r\n 已由词法分析器校验
                    i++;
                    break;
                case '\'':
                case '"':
                case '\\':
                    builder.append(escaped);
                    break;
                case 'b':
                    builder.append('\b');
                    break;
                case 'f':
                    builder.append('\f');
                    break;
                case 'n':
                    builder.append('\n');
                    break;
                case 'r':
                    builder.append('\r');
                    break;
                case 't':
                    builder.append('\t');
                    break;
                case 'v':
                    builder.append('\u000B');
                    break;
                case 'u':
                    builder.appendCodePoint(Integer.parseInt(text.substring(i + 1, i + 5), 16));
                    i += 4;
                    break;
                case 'x':
                    builder.append((char) Integer.parseInt(text.substring(i + 1, i + 3), 16));
                    i += 2;
                    break;
                default:
                    logError(spanOf(token), String.format("Unexpected escape character `%s` in string", escaped));
                    break;
            }
        }
        nextToken();
        return new ScriptLiteral(spanOf(token), builder.toString(), quoteType);
    }

    private ScriptLiteral parseVerbatimString() {
        Token token = current;
        // 去掉首尾的反引号，两个连续的反引号表示一个反引号
        String inner = text.substring(token.start().offset() + 1, token.end().offset());
        nextToken();
        return new ScriptLiteral(spanOf(token), inner.replace("``", "`"), ScriptLiteralStringQuoteType.VERBATIM);
    }

    private ScriptExpression parseVariable() {
        Token token = current;
        SourceSpan tokenSpan = spanOf(token);
        String name = tokenText(token);

        switch (name) {
            case "null":
                nextToken();
                return new ScriptLiteral(tokenSpan, null);
            case "true":
                nextToken();
                return new ScriptLiteral(tokenSpan, Boolean.TRUE);
            case "false":
                nextToken();
                return new ScriptLiteral(tokenSpan, Boolean.FALSE);
            case "do": {
                ScriptFunction function = parseFunctionStatement(true);
                return new ScriptAnonymousFunction(function.getSpan(), function);
            }
            case "this":
                if (!liquid) {
                    nextToken();
                    return new ScriptThisExpression(tokenSpan);
                }
                break;
            default:
                break;
        }

        nextToken();
        TextPosition end = token.end();
        ScriptVariableScope scope = ScriptVariableScope.GLOBAL;

        if (name.startsWith("$")) {
            scope = ScriptVariableScope.LOCAL;
            name = name.substring(1);
            // $0, $1 ... 转为 $[0], $[1] ...
            if (!name.isEmpty() && name.chars().allMatch(Character::isDigit)) {
                try {
                    int index = Integer.parseInt(name);
                    return new ScriptIndexerExpression(tokenSpan, ScriptVariable.ARGUMENTS.withSpan(tokenSpan),
                            new ScriptLiteral(tokenSpan, index));
                } catch (NumberFormatException e) {
                    logError(tokenSpan, String.format("Invalid argument index `%s`", name));
                }
            }
        } else if (isLoopVariablePrefix(name)) {
            if (current.type() == TokenType.DOT) {
                nextToken(); // .
                if (current.type() == TokenType.IDENTIFIER) {
                    end = current.end();
                    String loopMember = tokenText(current);
                    nextToken();
                    scope = ScriptVariableScope.LOOP;
                    if (liquid) {
                        if ("index".equals(loopMember) || "rindex".equals(loopMember)) {
                            // forloop.index 从 1 开始
                            SourceSpan span = tokenSpan.withEnd(end);
                            ScriptVariable loopIndex = ("index".equals(loopMember)
                                    ? ScriptVariable.LOOP_INDEX : ScriptVariable.LOOP_RINDEX).withSpan(span);
                            return new ScriptNestedExpression(span, new ScriptBinaryExpression(span, loopIndex,
                                    ScriptBinaryOperator.ADD, new ScriptLiteral(span, 1)));
                        }
                        name = liquidLoopVariable(token, name, loopMember);
                    } else {
                        name = nativeLoopVariable(token, name, loopMember);
                    }
                } else {
                    logError(tokenSpan, String.format(
                            "Expecting an identifier after `%s.` instead of `%s`", name, tokenText(current)));
                }
            }
        } else if (liquid && "continue".equals(name)) {
            scope = ScriptVariableScope.LOCAL;
        }

        SourceSpan span = tokenSpan.withEnd(end);
        // Liquid 变量名可以包含 -，转为 this["a-b"]
        if (liquid && name.indexOf('-') >= 0) {
            return new ScriptIndexerExpression(span, new ScriptThisExpression(span), new ScriptLiteral(span, name));
        }
        return new ScriptVariable(span, name, scope);
    }

    private boolean isLoopVariablePrefix(String name) {
        return "for".equals(name) || "while".equals(name) || "tablerow".equals(name)
                || (liquid && ("forloop".equals(name) || "tablerowloop".equals(name)));
    }

    private String liquidLoopVariable(Token token, String prefix, String member) {
        switch (member) {
            case "first":
                return ScriptVariable.LOOP_FIRST.getName();
            case "last":
                return ScriptVariable.LOOP_LAST.getName();
            case "index0":
                return ScriptVariable.LOOP_INDEX.getName();
            case "rindex0":
                return ScriptVariable.LOOP_RINDEX.getName();
            case "length":
                return ScriptVariable.LOOP_LENGTH.getName();
            case "col":
                if (!"tablerowloop".equals(prefix)) {
                    logError(spanOf(token), String.format("The loop variable `%s.col` is not supported", prefix));
                }
                return ScriptVariable.TABLEROW_COL.getName();
            default:
                String name = prefix + "." + member;
                logError(spanOf(token), String.format("The Liquid loop variable `%s` is not supported", name));
                return name;
        }
    }

    private String nativeLoopVariable(Token token, String prefix, String member) {
        boolean isWhile = "while".equals(prefix);
        switch (member) {
            case "first":
                return ScriptVariable.LOOP_FIRST.getName();
            case "even":
                return ScriptVariable.LOOP_EVEN.getName();
            case "odd":
                return ScriptVariable.LOOP_ODD.getName();
            case "index":
                return ScriptVariable.LOOP_INDEX.getName();
            case "last":
            case "changed":
            case "length":
            case "rindex":
                // while 循环不知道总长度
                if (isWhile) {
                    logError(spanOf(token), String.format("The loop variable `while.%s` is not supported", member));
                }
                switch (member) {
                    case "last":
                        return ScriptVariable.LOOP_LAST.getName();
                    case "changed":
                        return ScriptVariable.LOOP_CHANGED.getName();
                    case "length":
                        return ScriptVariable.LOOP_LENGTH.getName();
                    default:
                        return ScriptVariable.LOOP_RINDEX.getName();
                }
            case "col":
                if (!"tablerow".equals(prefix)) {
                    logError(spanOf(token), String.format("The loop variable `%s.col` is not supported", prefix));
                }
                return ScriptVariable.TABLEROW_COL.getName();
            default:
                String name = prefix + "." + member;
                logError(spanOf(token), String.format("The loop variable `%s` is not supported", name));
                return name;
        }
    }

    // ------------------------------------------------------------------
    // token 流
    // ------------------------------------------------------------------

    private void nextToken() {
        previous = current;
        while (true) {
            Token token = preview.isEmpty() ? fetch() : preview.poll();
            if (!isHidden(token.type())) {
                current = token;
                return;
            }
        }
    }

    private Token peekToken() {
        for (Token token : preview) {
            if (!isHidden(token.type())) {
                return token;
            }
        }
        while (true) {
            Token token = fetch();
            preview.add(token);
            if (!isHidden(token.type())) {
                return token;
            }
        }
    }

    private Token fetch() {
        return tokens.hasNext() ? tokens.next() : Token.EOF;
    }

    private boolean isHidden(TokenType type) {
        return type == TokenType.COMMENT || type == TokenType.COMMENT_MULTI
                || type == TokenType.WHITESPACE || type == TokenType.WHITESPACE_FULL
                || (type == TokenType.NEW_LINE && allowNewLineLevel > 0);
    }

    private String tokenText(Token token) {
        return token.getText(text);
    }

    // ------------------------------------------------------------------
    // 区间与诊断
    // ------------------------------------------------------------------

    private SourceSpan spanOf(Token token) {
        if (token.type() == TokenType.EOF) {
            return previousSpan();
        }
        return new SourceSpan(fileName, token.start(), token.end());
    }

    private SourceSpan currentSpan() {
        return spanOf(current);
    }

    private SourceSpan previousSpan() {
        if (previous == null || previous.type() == TokenType.EOF) {
            return new SourceSpan(fileName, TextPosition.START, TextPosition.START);
        }
        return new SourceSpan(fileName, previous.end(), previous.end());
    }

    private SourceSpan spanFrom(TextPosition start) {
        TextPosition end = previous != null && previous.type() != TokenType.EOF ? previous.end() : start;
        if (start.offset() < 0) {
            start = end;
        }
        if (end.offset() < start.offset()) {
            end = start;
        }
        return new SourceSpan(fileName, start, end);
    }

    private ScriptBlockStatement emptyBlock(TextPosition position) {
        TextPosition start = position.offset() >= 0 ? position : TextPosition.START;
        SourceSpan span = new SourceSpan(fileName, start, start);
        return new ScriptBlockStatement(span, List.of());
    }

    /**
     * 出错时用 null 字面量占位，错误已经记录，语法树不会被求值
     */
    private ScriptExpression orMissing(ScriptExpression expression, TextPosition position) {
        if (expression != null) {
            return expression;
        }
        TextPosition start = position.offset() >= 0 ? position : TextPosition.START;
        return new ScriptLiteral(new SourceSpan(fileName, start, start), null);
    }

    private void logError(SourceSpan span, String message) {
        logError(span, message, false);
    }

    private void logError(SourceSpan span, String message, boolean fatal) {
        log(LogMessage.error(span, message), fatal);
    }

    private void log(LogMessage message, boolean fatal) {
        messages.add(message);
        if (message.isError()) {
            hasErrors = true;
        }
        if (fatal) {
            fatalError = true;
        }
    }
}
