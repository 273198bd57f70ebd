package com.litesql.backend.engine;

import com.litesql.common.TypeMismatchException;

/**
 * 可绑定到预编译语句参数上的值，只允许 null / int64 / float64 / text 四种形态。
 */
public final class BindValue {

    public enum Kind {
        NULL,
        INT,
        DOUBLE,
        TEXT
    }

    private final Kind kind;
    private final Object value;

    private BindValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static BindValue ofNull() {
        return new BindValue(Kind.NULL, null);
    }

    public static BindValue ofLong(long v) {
        return new BindValue(Kind.INT, v);
    }

    public static BindValue ofDouble(double v) {
        return new BindValue(Kind.DOUBLE, v);
    }

    public static BindValue ofText(String v) {
        if(v == null) {
            throw new IllegalArgumentException("text value must not be null");
        }
        return new BindValue(Kind.TEXT, v);
    }

    /**
     * 按类型名解析客户端给出的值。类型名未知或值的形态与类型不符时抛出
     * {@link TypeMismatchException}，不会触碰引擎。
     *
     * @param type  null | int | double | text
     * @param value Number / String / null
     */
    public static BindValue from(String type, Object value) throws TypeMismatchException {
        if(type == null) {
            throw new TypeMismatchException("missing bind type");
        }
        switch (type) {
            case "null":
                return ofNull();
            case "int":
                if(!(value instanceof Number)) {
                    throw new TypeMismatchException("type mismatch: int expects a number");
                }
                return ofLong(((Number) value).longValue());
            case "double":
                if(!(value instanceof Number)) {
                    throw new TypeMismatchException("type mismatch: double expects a number");
                }
                return ofDouble(((Number) value).doubleValue());
            case "text":
                if(!(value instanceof String)) {
                    throw new TypeMismatchException("type mismatch: text expects a string");
                }
                return ofText((String) value);
            default:
                throw new TypeMismatchException("unsupported bind type: " + type);
        }
    }

    public Kind getKind() {
        return kind;
    }

    public long asLong() {
        return (Long) value;
    }

    public double asDouble() {
        return (Double) value;
    }

    public String asText() {
        return (String) value;
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }
}
