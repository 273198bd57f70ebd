package com.litesql.backend.engine;

/**
 * 单元格的运行时类型。引擎是动态类型的，同一列在不同的行里可能取不同类型。
 */
public enum ValueType {
    NULL("null"),
    INTEGER("int"),
    FLOAT("double"),
    TEXT("text"),
    BLOB("blob");

    private final String tag;

    ValueType(String tag) {
        this.tag = tag;
    }

    /** 线协议里使用的类型标签 */
    public String tag() {
        return tag;
    }
}
