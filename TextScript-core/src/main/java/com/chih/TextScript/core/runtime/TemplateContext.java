package com.chih.TextScript.core.runtime;

import com.chih.TextScript.core.Template;
import com.chih.TextScript.core.exception.ScriptRuntimeException;
import com.chih.TextScript.core.exception.TemplateRecursionException;
import com.chih.TextScript.core.functions.BuiltinFunctions;
import com.chih.TextScript.core.parsing.LexerOptions;
import com.chih.TextScript.core.parsing.ParserOptions;
import com.chih.TextScript.core.parsing.SourceSpan;
import com.chih.TextScript.core.runtime.accessors.ArrayAccessor;
import com.chih.TextScript.core.runtime.accessors.ListObjectAccessor;
import com.chih.TextScript.core.runtime.accessors.MapAccessor;
import com.chih.TextScript.core.runtime.accessors.NullAccessor;
import com.chih.TextScript.core.runtime.accessors.ScriptObjectAccessor;
import com.chih.TextScript.core.runtime.accessors.TypedObjectAccessor;
import com.chih.TextScript.core.syntax.ScriptBlockStatement;
import com.chih.TextScript.core.syntax.ScriptExpression;
import com.chih.TextScript.core.syntax.ScriptFlowState;
import com.chih.TextScript.core.syntax.ScriptFunction;
import com.chih.TextScript.core.syntax.ScriptFunctionCall;
import com.chih.TextScript.core.syntax.ScriptLoopStatementBase;
import com.chih.TextScript.core.syntax.ScriptNode;
import com.chih.TextScript.core.syntax.ScriptVariable;
import com.chih.TextScript.core.syntax.ScriptVariablePath;
import com.chih.TextScript.core.syntax.ScriptVariableScope;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 模板求值上下文
 * <p>
 * 持有一次渲染的全部可变状态：变量存储栈、输出缓冲栈、循环与函数调用栈、管道参数、控制流状态。
 * 语法树节点本身不可变，同一个 {@link Template} 可以被多个上下文并发渲染，但单个上下文不是线程安全的。
 * </p>
 * <p>
 * 变量按作用域分三类存储：
 * <ul>
 *     <li>全局变量沿全局对象栈自顶向下查找，写入总是落在栈顶 (见 {@link #getCurrentGlobal()})，栈底是内置函数对象</li>
 *     <li>{@code $name} 局部变量属于当前函数调用，每次调用压入新的存储</li>
 *     <li>{@code for.index} 等循环元数据属于最内层循环</li>
 * </ul>
 * </p>
 *
 * @since 2025/12/14
 */
public class TemplateContext {

    public static final int DEFAULT_LOOP_LIMIT = 1000;

    public static final int DEFAULT_RECURSIVE_LIMIT = 100;

    private final ScriptObject builtins;

    private final Deque<ScriptObject> globalStores = new ArrayDeque<>();

    private final Deque<ScriptObject> localStores = new ArrayDeque<>();

    private final Deque<ScriptObject> loopStores = new ArrayDeque<>();

    private final Deque<ScriptLoopStatementBase> loops = new ArrayDeque<>();

    private final Deque<int[]> loopSteps = new ArrayDeque<>();

    private final Deque<StringBuilder> outputs = new ArrayDeque<>();

    private final Deque<ScriptArray> pipeArguments = new ArrayDeque<>();

    private final Deque<ScriptBlockStatement> blockDelegates = new ArrayDeque<>();

    private final Deque<Object> caseValues = new ArrayDeque<>();

    private final Deque<String> sourceFiles = new ArrayDeque<>();

    private final Map<Object, Object> tags = new HashMap<>();

    private final Map<String, Template> cachedTemplates = new HashMap<>();

    private ScriptFlowState flowState = ScriptFlowState.NONE;

    private int recursionDepth;

    private int getOrSetValueLevel;

    private boolean functionCallDisabled;

    private TemplateLoader templateLoader;

    private LexerOptions templateLoaderLexerOptions = LexerOptions.DEFAULT;

    private ParserOptions templateLoaderParserOptions = ParserOptions.DEFAULT;

    private TryGetMemberCallback tryGetMember;

    private boolean enableOutput = true;

    private boolean enableRelaxedMemberAccess = true;

    private boolean enableBreakAndContinueAsReturnOutsideLoop;

    private boolean strictVariables;

    private int loopLimit = DEFAULT_LOOP_LIMIT;

    private int recursiveLimit = DEFAULT_RECURSIVE_LIMIT;

    private String newLine = "\n";

    public TemplateContext() {
        this(new BuiltinFunctions());
    }

    public TemplateContext(ScriptObject builtins) {
        this.builtins = Objects.requireNonNull(builtins, "builtins");
        globalStores.push(builtins);
        // 宿主未压入全局对象时，赋值落在这一层而不是内置对象上
        globalStores.push(new ScriptObject());
        localStores.push(new ScriptObject());
        outputs.push(new StringBuilder());
        pipeArguments.push(new ScriptArray());
    }

    // ==================== 求值 ====================

    public Object evaluate(ScriptNode node) {
        if (node == null) {
            return null;
        }
        try {
            return node.evaluate(this);
        } catch (ScriptRuntimeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ScriptRuntimeException(node.getSpan(), Objects.toString(e.getMessage(), e.getClass().getSimpleName()), e);
        }
    }

    /**
     * @param aliasReturnedFunction 为 true 时只取函数本身，不做无参自动调用 ({@code @func} 与调用目标)
     */
    public Object evaluate(ScriptNode node, boolean aliasReturnedFunction) {
        boolean previousFunctionCallDisabled = functionCallDisabled;
        int previousLevel = getOrSetValueLevel;
        try {
            getOrSetValueLevel = 0;
            functionCallDisabled = aliasReturnedFunction;
            return evaluate(node);
        } finally {
            functionCallDisabled = previousFunctionCallDisabled;
            getOrSetValueLevel = previousLevel;
        }
    }

    /**
     * 读取变量路径；取到的值是函数时按无参调用处理
     */
    public Object getValue(ScriptExpression target) {
        getOrSetValueLevel++;
        try {
            Object value = target instanceof ScriptVariablePath
                    ? ((ScriptVariablePath) target).getValue(this)
                    : evaluate(target);
            if ((!functionCallDisabled || getOrSetValueLevel > 1) && ScriptFunctionCall.isFunction(value)) {
                value = ScriptFunctionCall.call(this, target, value, getOrSetValueLevel == 1, null);
            }
            return value;
        } finally {
            getOrSetValueLevel--;
        }
    }

    public void setValue(ScriptExpression target, Object value) {
        if (!(target instanceof ScriptVariablePath)) {
            throw new ScriptRuntimeException(target.getSpan(), String.format(
                    "Unsupported expression for target for assignment: %s = ...", target));
        }
        getOrSetValueLevel++;
        try {
            ((ScriptVariablePath) target).setValue(this, value);
        } finally {
            getOrSetValueLevel--;
        }
    }

    public void setValue(ScriptVariable variable, Object value) {
        setVariableValue(variable, value, false);
    }

    public void setValue(ScriptVariable variable, Object value, boolean readOnly) {
        setVariableValue(variable, value, readOnly);
    }

    /**
     * 第一层 getValue 才把当前管道参数交给函数，嵌套的取值不消费管道参数
     */
    public boolean isPipeArgumentsAllowed() {
        return getOrSetValueLevel <= 1;
    }

    // ==================== 变量 ====================

    public Object getVariableValue(ScriptVariable variable) {
        String name = variable.getName();
        switch (variable.getScope()) {
            case LOCAL:
                return localStores.peek().getValue(name);
            case LOOP:
                return requireLoopStore(variable).getValue(name);
            default:
                for (ScriptObject store : globalStores) {
                    if (store.contains(name)) {
                        return store.getValue(name);
                    }
                }
                if (strictVariables) {
                    throw new ScriptRuntimeException(variable.getSpan(), String.format(
                            "The variable or function `%s` was not found", variable));
                }
                return null;
        }
    }

    public void setVariableValue(ScriptVariable variable, Object value, boolean readOnly) {
        ScriptObject store = getStoreForWrite(variable);
        String name = variable.getName();
        if (!store.canWrite(name)) {
            throw new ScriptRuntimeException(variable.getSpan(), String.format(
                    "Cannot set value on the readonly variable `%s`", variable));
        }
        store.setValue(name, value, readOnly);
    }

    public void setReadOnly(ScriptVariable variable, boolean readOnly) {
        ScriptObject store = getStoreForWrite(variable);
        String name = variable.getName();
        if (variable.getScope() == ScriptVariableScope.GLOBAL) {
            for (ScriptObject candidate : globalStores) {
                if (candidate.contains(name)) {
                    store = candidate;
                    break;
                }
            }
        }
        store.setReadOnly(name, readOnly);
    }

    private ScriptObject getStoreForWrite(ScriptVariable variable) {
        switch (variable.getScope()) {
            case LOCAL:
                return localStores.peek();
            case LOOP:
                return requireLoopStore(variable);
            default:
                // 下层存储中的只读变量同样不能被遮蔽
                for (ScriptObject store : globalStores) {
                    if (store.contains(variable.getName())) {
                        if (!store.canWrite(variable.getName())) {
                            throw new ScriptRuntimeException(variable.getSpan(), String.format(
                                    "Cannot set value on the readonly variable `%s`", variable));
                        }
                        break;
                    }
                }
                return globalStores.peek();
        }
    }

    private ScriptObject requireLoopStore(ScriptVariable variable) {
        ScriptObject store = loopStores.peek();
        if (store == null) {
            throw new ScriptRuntimeException(variable.getSpan(), String.format(
                    "Invalid usage of the loop variable `%s` not inside a loop", variable));
        }
        return store;
    }

    // ==================== 全局对象 ====================

    public void pushGlobal(ScriptObject global) {
        globalStores.push(Objects.requireNonNull(global, "global"));
    }

    public ScriptObject popGlobal() {
        // 内置对象与默认全局对象不可弹出
        if (globalStores.size() <= 2) {
            throw new IllegalStateException("Unexpected popGlobal() not matching a pushGlobal()");
        }
        return globalStores.pop();
    }

    public ScriptObject getCurrentGlobal() {
        return globalStores.peek();
    }

    public ScriptObject getBuiltins() {
        return builtins;
    }

    // ==================== 函数与递归 ====================

    public void enterFunction(ScriptNode caller) {
        enterRecursive(caller);
        localStores.push(new ScriptObject());
    }

    public void exitFunction() {
        localStores.pop();
        exitRecursive();
    }

    public void enterRecursive(ScriptNode caller) {
        recursionDepth++;
        if (recursiveLimit != 0 && recursionDepth > recursiveLimit) {
            recursionDepth--;
            throw new TemplateRecursionException(caller != null ? caller.getSpan() : null, recursiveLimit);
        }
    }

    public void exitRecursive() {
        recursionDepth--;
    }

    public void pushBlockDelegate(ScriptBlockStatement block) {
        blockDelegates.push(block);
    }

    public ScriptBlockStatement popBlockDelegate() {
        return blockDelegates.poll();
    }

    // ==================== 循环 ====================

    public void enterLoop(ScriptLoopStatementBase loop) {
        loops.push(loop);
        loopStores.push(new ScriptObject());
        loopSteps.push(new int[1]);
    }

    public void exitLoop(ScriptLoopStatementBase loop) {
        loopSteps.pop();
        loopStores.pop();
        loops.pop();
    }

    public boolean isInLoop() {
        return !loops.isEmpty();
    }

    /**
     * 每轮迭代调用一次，超出 {@link #getLoopLimit()} 时报错
     */
    public void stepLoop(ScriptLoopStatementBase loop) {
        int[] steps = loopSteps.peek();
        if (steps == null) {
            return;
        }
        steps[0]++;
        if (loopLimit != 0 && steps[0] > loopLimit) {
            throw new ScriptRuntimeException(loop.getSpan(), String.format(
                    "Exceeding number of iteration limit `%d` for loop statement.", loopLimit));
        }
    }

    // ==================== case / 管道 ====================

    public void pushCase(Object value) {
        caseValues.push(value == null ? NullValue.INSTANCE : value);
    }

    public Object popCase() {
        Object value = caseValues.pop();
        return value == NullValue.INSTANCE ? null : value;
    }

    public Object peekCase() {
        Object value = caseValues.peek();
        return value == NullValue.INSTANCE ? null : value;
    }

    public ScriptArray getPipeArguments() {
        return pipeArguments.peek();
    }

    public void pushPipeArguments() {
        pipeArguments.push(new ScriptArray());
    }

    public void popPipeArguments() {
        if (pipeArguments.size() <= 1) {
            throw new IllegalStateException("Unexpected popPipeArguments() not matching a pushPipeArguments()");
        }
        pipeArguments.pop();
    }

    public ScriptFlowState getFlowState() {
        return flowState;
    }

    public void setFlowState(ScriptFlowState flowState) {
        this.flowState = flowState;
    }

    // ==================== 输出 ====================

    public StringBuilder getOutput() {
        return outputs.peek();
    }

    public void pushOutput() {
        outputs.push(new StringBuilder());
    }

    public String popOutput() {
        if (outputs.size() <= 1) {
            throw new IllegalStateException("Unexpected popOutput() not matching a pushOutput()");
        }
        return outputs.pop().toString();
    }

    public TemplateContext write(String text) {
        if (text != null) {
            outputs.peek().append(text);
        }
        return this;
    }

    public TemplateContext write(SourceSpan span, Object value) {
        return write(toString(span, value));
    }

    public TemplateContext writeLine() {
        return write(newLine);
    }

    // ==================== 子模板 ====================

    public void pushSourceFile(String sourceFile) {
        sourceFiles.push(Objects.requireNonNull(sourceFile, "sourceFile"));
    }

    public String popSourceFile() {
        if (sourceFiles.isEmpty()) {
            throw new IllegalStateException("Unexpected popSourceFile() not matching a pushSourceFile()");
        }
        return sourceFiles.pop();
    }

    /**
     * 当前正在渲染的模板路径，没有时为 null；加载器据此解析相对路径
     */
    public String getCurrentSourceFile() {
        return sourceFiles.peek();
    }

    public Map<String, Template> getCachedTemplates() {
        return cachedTemplates;
    }

    /**
     * 函数之间共享的任意状态，例如 cycle 的游标
     */
    public Map<Object, Object> getTags() {
        return tags;
    }

    // ==================== 成员访问 ====================

    public ObjectAccessor getMemberAccessor(Object target) {
        if (target == null || isPrimitive(target)) {
            return NullAccessor.INSTANCE;
        }
        if (target instanceof ScriptObject) {
            return ScriptObjectAccessor.INSTANCE;
        }
        if (target instanceof Map) {
            return MapAccessor.INSTANCE;
        }
        if (target instanceof List) {
            return ListObjectAccessor.INSTANCE;
        }
        if (target.getClass().isArray()) {
            return ArrayAccessor.INSTANCE;
        }
        return TypedObjectAccessor.of(target.getClass());
    }

    /**
     * @return 目标不支持下标访问时为 null
     */
    public ListAccessor getListAccessor(Object target) {
        if (target instanceof List) {
            return ListObjectAccessor.INSTANCE;
        }
        if (target != null && target.getClass().isArray()) {
            return ArrayAccessor.INSTANCE;
        }
        return null;
    }

    public static boolean isPrimitive(Object value) {
        return value instanceof String || value instanceof Number
                || value instanceof Boolean || value instanceof Character;
    }

    // ==================== 类型转换 ====================

    /**
     * null 与 {@code empty} 输出为 null (即不输出)
     */
    public String toString(SourceSpan span, Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (value == null || value == EmptyScriptObject.DEFAULT) {
            return null;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "true" : "false";
        }
        if (value instanceof Double || value instanceof Float) {
            return formatFloatingPoint(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Number || value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        if (value instanceof ScriptObject) {
            return value.toString();
        }
        if (value instanceof Map) {
            return ScriptObject.from((Map<?, ?>) value).toString();
        }
        if (value instanceof ScriptCustomFunction || value instanceof ScriptFunction) {
            return "<function>";
        }
        if (value instanceof Iterable) {
            StringBuilder result = new StringBuilder("[");
            boolean first = true;
            for (Object item : (Iterable<?>) value) {
                if (!first) {
                    result.append(", ");
                }
                result.append(Objects.toString(toString(span, item), ""));
                first = false;
            }
            return result.append(']').toString();
        }
        if (value.getClass().isArray()) {
            StringBuilder result = new StringBuilder("[");
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                if (i > 0) {
                    result.append(", ");
                }
                result.append(Objects.toString(toString(span, Array.get(value, i)), ""));
            }
            return result.append(']').toString();
        }
        return value.toString();
    }

    private static String formatFloatingPoint(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        // 整数值不带小数部分：2.0 输出为 2
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * 只有 null、{@code empty} 与 false 为假
     */
    public boolean toBool(SourceSpan span, Object value) {
        if (value == null || value == EmptyScriptObject.DEFAULT) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return true;
    }

    public int toInt(SourceSpan span, Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        if (value instanceof Character) {
            return (Character) value;
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new ScriptRuntimeException(span, String.format("Unable to convert `%s` to int", value), e);
            }
        }
        throw new ScriptRuntimeException(span, String.format(
                "Unable to convert type `%s` to int", value.getClass().getSimpleName()));
    }

    /**
     * 转换为目标类型：数值之间互转，字符串按数字解析，布尔值按 1/0 参与数值运算
     */
    @SuppressWarnings("unchecked")
    public <T> T toObject(SourceSpan span, Object value, Class<T> type) {
        Objects.requireNonNull(type, "type");
        Class<?> target = boxed(type);
        if (target == String.class) {
            return (T) toString(span, value);
        }
        if (target == Integer.class) {
            return (T) Integer.valueOf(toInt(span, value));
        }
        if (target == Boolean.class) {
            return (T) Boolean.valueOf(toBool(span, value));
        }
        if (value == null) {
            if (target == Double.class) {
                return (T) Double.valueOf(0.0);
            } else if (target == Float.class) {
                return (T) Float.valueOf(0.0f);
            } else if (target == Long.class) {
                return (T) Long.valueOf(0L);
            } else if (target == BigDecimal.class) {
                return (T) BigDecimal.ZERO;
            }
            return null;
        }
        if (target.isInstance(value)) {
            return (T) value;
        }
        if (Number.class.isAssignableFrom(target)) {
            Number number = toNumber(span, value, target);
            if (number != null) {
                return (T) convertNumber(number, target);
            }
        }
        if (target == List.class || target == Iterable.class) {
            List<?> list = toList(span, value);
            if (list != null) {
                return (T) list;
            }
        }
        throw new ScriptRuntimeException(span, String.format(
                "Unable to convert type `%s` to `%s`", value.getClass().getSimpleName(), target.getSimpleName()));
    }

    private Number toNumber(SourceSpan span, Object value, Class<?> target) {
        if (value instanceof Number) {
            return (Number) value;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        if (value instanceof Character) {
            return (int) (Character) value;
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).ordinal();
        }
        if (value instanceof String) {
            try {
                return new BigDecimal(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new ScriptRuntimeException(span, String.format(
                        "Unable to convert `%s` to `%s`", value, target.getSimpleName()), e);
            }
        }
        return null;
    }

    private static Object convertNumber(Number number, Class<?> target) {
        if (target == Long.class) {
            return number.longValue();
        } else if (target == Double.class) {
            return number.doubleValue();
        } else if (target == Float.class) {
            return number.floatValue();
        } else if (target == Short.class) {
            return number.shortValue();
        } else if (target == Byte.class) {
            return number.byteValue();
        } else if (target == BigInteger.class) {
            return number instanceof BigDecimal ? ((BigDecimal) number).toBigInteger() : BigInteger.valueOf(number.longValue());
        } else if (target == BigDecimal.class) {
            if (number instanceof BigDecimal) {
                return number;
            }
            if (number instanceof Double || number instanceof Float) {
                return BigDecimal.valueOf(number.doubleValue());
            }
            return BigDecimal.valueOf(number.longValue());
        }
        return number.intValue();
    }

    private static Class<?> boxed(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) {
            return Integer.class;
        } else if (type == long.class) {
            return Long.class;
        } else if (type == double.class) {
            return Double.class;
        } else if (type == float.class) {
            return Float.class;
        } else if (type == boolean.class) {
            return Boolean.class;
        } else if (type == short.class) {
            return Short.class;
        } else if (type == byte.class) {
            return Byte.class;
        } else if (type == char.class) {
            return Character.class;
        }
        return type;
    }

    /**
     * @return null 表示值为 null；字符串不按字符迭代
     */
    public Object isEmpty(SourceSpan span, Object value) {
        if (value == null) {
            return null;
        }
        if (value == EmptyScriptObject.DEFAULT) {
            return true;
        }
        if (value instanceof List) {
            return ((List<?>) value).isEmpty();
        }
        if (value instanceof String) {
            return ((String) value).isEmpty();
        }
        if (value instanceof Iterable) {
            Iterator<?> iterator = ((Iterable<?>) value).iterator();
            return !iterator.hasNext();
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Character) {
            return false;
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        return getMemberAccessor(value).getMemberCount(this, span, value) == 0;
    }

    /**
     * @return 不可迭代时为 null
     */
    public List<?> toList(SourceSpan span, Object value) {
        if (value == null || value instanceof String) {
            return null;
        }
        if (value instanceof List) {
            return (List<?>) value;
        }
        if (value instanceof Iterable) {
            return ScriptArray.of((Iterable<?>) value);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            ScriptArray array = new ScriptArray(length);
            for (int i = 0; i < length; i++) {
                array.add(Array.get(value, i));
            }
            return array;
        }
        return null;
    }

    // ==================== 配置 ====================

    public TemplateLoader getTemplateLoader() {
        return templateLoader;
    }

    public void setTemplateLoader(TemplateLoader templateLoader) {
        this.templateLoader = templateLoader;
    }

    public LexerOptions getTemplateLoaderLexerOptions() {
        return templateLoaderLexerOptions;
    }

    public void setTemplateLoaderLexerOptions(LexerOptions templateLoaderLexerOptions) {
        this.templateLoaderLexerOptions = Objects.requireNonNull(templateLoaderLexerOptions, "templateLoaderLexerOptions");
    }

    public ParserOptions getTemplateLoaderParserOptions() {
        return templateLoaderParserOptions;
    }

    public void setTemplateLoaderParserOptions(ParserOptions templateLoaderParserOptions) {
        this.templateLoaderParserOptions = Objects.requireNonNull(templateLoaderParserOptions, "templateLoaderParserOptions");
    }

    public TryGetMemberCallback getTryGetMember() {
        return tryGetMember;
    }

    public void setTryGetMember(TryGetMemberCallback tryGetMember) {
        this.tryGetMember = tryGetMember;
    }

    public boolean isEnableOutput() {
        return enableOutput;
    }

    public void setEnableOutput(boolean enableOutput) {
        this.enableOutput = enableOutput;
    }

    public boolean isEnableRelaxedMemberAccess() {
        return enableRelaxedMemberAccess;
    }

    public void setEnableRelaxedMemberAccess(boolean enableRelaxedMemberAccess) {
        this.enableRelaxedMemberAccess = enableRelaxedMemberAccess;
    }

    public boolean isEnableBreakAndContinueAsReturnOutsideLoop() {
        return enableBreakAndContinueAsReturnOutsideLoop;
    }

    public void setEnableBreakAndContinueAsReturnOutsideLoop(boolean enabled) {
        this.enableBreakAndContinueAsReturnOutsideLoop = enabled;
    }

    public boolean isStrictVariables() {
        return strictVariables;
    }

    public void setStrictVariables(boolean strictVariables) {
        this.strictVariables = strictVariables;
    }

    public int getLoopLimit() {
        return loopLimit;
    }

    /**
     * @param loopLimit 单个循环的最大迭代次数，0 表示不限制
     */
    public void setLoopLimit(int loopLimit) {
        if (loopLimit < 0) {
            throw new IllegalArgumentException("loopLimit must be >= 0");
        }
        this.loopLimit = loopLimit;
    }

    public int getRecursiveLimit() {
        return recursiveLimit;
    }

    /**
     * @param recursiveLimit include 与函数调用的最大嵌套深度，0 表示不限制
     */
    public void setRecursiveLimit(int recursiveLimit) {
        if (recursiveLimit < 0) {
            throw new IllegalArgumentException("recursiveLimit must be >= 0");
        }
        this.recursiveLimit = recursiveLimit;
    }

    public String getNewLine() {
        return newLine;
    }

    public void setNewLine(String newLine) {
        this.newLine = Objects.requireNonNull(newLine, "newLine");
    }

    /**
     * case 栈中代替 null 的占位，ArrayDeque 不接受 null 元素
     */
    private enum NullValue {
        INSTANCE
    }
}
