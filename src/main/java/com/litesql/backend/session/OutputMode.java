package com.litesql.backend.session;

import java.util.Locale;

/**
 * 控制台查询结果的输出格式
 */
public enum OutputMode {
    LIST,
    CSV,
    TABS;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return 未知名称返回 null
     */
    public static OutputMode parse(String name) {
        for (OutputMode mode : values()) {
            if(mode.label().equals(name)) {
                return mode;
            }
        }
        return null;
    }
}
