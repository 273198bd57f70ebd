package com.litesql.backend.engine;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Objects;

import com.google.common.io.BaseEncoding;

/**
 * 读取一行时得到的单个值：{NULL, INTEGER, FLOAT, TEXT, BLOB} 的带标签联合。
 * <p>
 * BLOB 保留原始字节，文本化时统一使用 base64，避免二进制内容被截断。
 * FLOAT 的文本形式与引擎自己转成文本时一致：最短可还原的有效数字，至少带一位小数，
 * 指数不在 [-4, 17) 内时用 {@code 1.0e+20} 这样的科学计数法。
 */
public final class Value {

    private static final Value NULL = new Value(ValueType.NULL, null);

    /** 有效数字位数，指数达到该值时改用科学计数法 */
    private static final int REAL_DIGITS = 17;

    private final ValueType type;
    private final Object raw;

    private Value(ValueType type, Object raw) {
        this.type = type;
        this.raw = raw;
    }

    public static Value ofNull() {
        return NULL;
    }

    public static Value ofLong(long v) {
        return new Value(ValueType.INTEGER, v);
    }

    public static Value ofDouble(double v) {
        return new Value(ValueType.FLOAT, v);
    }

    public static Value ofText(String v) {
        return v == null ? NULL : new Value(ValueType.TEXT, v);
    }

    public static Value ofBlob(byte[] v) {
        return v == null ? NULL : new Value(ValueType.BLOB, v.clone());
    }

    /**
     * 按 JDBC 驱动返回的 Java 对象判断运行时类型。
     */
    public static Value fromObject(Object obj) {
        if(obj == null) {
            return NULL;
        }
        if(obj instanceof Long || obj instanceof Integer || obj instanceof Short || obj instanceof Byte) {
            return ofLong(((Number) obj).longValue());
        }
        if(obj instanceof Double || obj instanceof Float) {
            return ofDouble(((Number) obj).doubleValue());
        }
        if(obj instanceof byte[]) {
            return ofBlob((byte[]) obj);
        }
        return ofText(obj.toString());
    }

    public ValueType getType() {
        return type;
    }

    public boolean isNull() {
        return type == ValueType.NULL;
    }

    public long asLong() {
        return ((Number) raw).longValue();
    }

    public double asDouble() {
        return ((Number) raw).doubleValue();
    }

    public byte[] asBytes() {
        return ((byte[]) raw).clone();
    }

    /**
     * 文本形式；NULL 返回 null，BLOB 返回 base64。
     */
    public String asText() {
        switch (type) {
            case NULL:
                return null;
            case BLOB:
                return BaseEncoding.base64().encode((byte[]) raw);
            case FLOAT:
                return formatReal(((Number) raw).doubleValue());
            default:
                return raw.toString();
        }
    }

    static String formatReal(double d) {
        if(Double.isNaN(d)) {
            return "NaN";
        }
        if(Double.isInfinite(d)) {
            return d > 0 ? "Inf" : "-Inf";
        }
        if(d == 0) {
            return "0.0";
        }
        String sign = d < 0 ? "-" : "";
        // Double.toString 给出能还原回同一个 double 的最短数字串
        BigDecimal bd = new BigDecimal(Double.toString(Math.abs(d))).stripTrailingZeros();
        String digits = bd.unscaledValue().toString();
        int exp = digits.length() - 1 - bd.scale();
        if(exp < -4 || exp >= REAL_DIGITS) {
            String fraction = digits.length() > 1 ? digits.substring(1) : "0";
            int absExp = Math.abs(exp);
            return sign + digits.charAt(0) + "." + fraction + "e" + (exp < 0 ? "-" : "+")
                    + (absExp < 10 ? "0" : "") + absExp;
        }
        String plain = bd.toPlainString();
        return sign + (plain.indexOf('.') < 0 ? plain + ".0" : plain);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Value)) {
            return false;
        }
        Value other = (Value) o;
        if(type != other.type) {
            return false;
        }
        if(type == ValueType.BLOB) {
            return Arrays.equals((byte[]) raw, (byte[]) other.raw);
        }
        return Objects.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return type == ValueType.BLOB ? Arrays.hashCode((byte[]) raw) : Objects.hash(type, raw);
    }

    @Override
    public String toString() {
        return type.tag() + ":" + asText();
    }
}
