package com.chih.TextScript.core.runtime;

/**
 * 模板路径的类型：任意、目录或文件
 */
public enum PathType {
    ANY,
    CONTAINER,
    LEAF
}
