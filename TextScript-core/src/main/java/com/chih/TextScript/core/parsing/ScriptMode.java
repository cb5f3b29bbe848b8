package com.chih.TextScript.core.parsing;

/**
 * 词法/语法解析模式
 */
public enum ScriptMode {

    /** 文本与 {{ }} 代码块混排 (默认) */
    DEFAULT,

    /** Liquid 方言：{{ }} 表达式 + {% %} 标签 */
    LIQUID,

    /** 只解析 +++ 包围的 front matter */
    FRONT_MATTER_ONLY,

    /** front matter + 正文 */
    FRONT_MATTER_AND_CONTENT,

    /** 纯脚本，没有 {{ }} 分隔符 */
    SCRIPT_ONLY
}
