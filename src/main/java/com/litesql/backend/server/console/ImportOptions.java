package com.litesql.backend.server.console;

import java.util.List;

import com.litesql.common.ProtocolException;

/**
 * {@code .import [--csv] [--tabs] [--separator X] [--skip N] <file> <table>} 的参数。
 */
class ImportOptions {

    static final String USAGE = "Usage: .import [--csv] [--tabs] [--separator X] [--skip N] <file> <table>";

    boolean csv;
    char separator;
    int skip;
    String file;
    String table;

    /**
     * @param defaultSeparator 未指定时使用的分隔字符（来自当前会话的输出选项）
     * @throws ProtocolException 参数不完整，message 为对应的用法提示
     */
    static ImportOptions parse(List<String> tokens, char defaultSeparator) throws ProtocolException {
        ImportOptions options = new ImportOptions();
        options.separator = defaultSeparator;
        int i = 0;
        for (; i < tokens.size(); i++) {
            String tok = tokens.get(i);
            if("--csv".equals(tok)) {
                options.csv = true;
                continue;
            }
            if("--tabs".equals(tok)) {
                options.csv = false;
                options.separator = '\t';
                continue;
            }
            if("--separator".equals(tok)) {
                if(i + 1 >= tokens.size()) {
                    throw new ProtocolException("Usage: .import --separator X <file> <table>");
                }
                options.separator = tokens.get(++i).charAt(0);
                options.csv = false;
                continue;
            }
            if("--skip".equals(tok)) {
                if(i + 1 >= tokens.size()) {
                    throw new ProtocolException("Usage: .import --skip N <file> <table>");
                }
                options.skip = Math.max(0, parseIntOrZero(tokens.get(++i)));
                continue;
            }
            break;
        }
        if(tokens.size() - i < 2) {
            throw new ProtocolException(USAGE);
        }
        options.file = tokens.get(i);
        options.table = tokens.get(i + 1);
        return options;
    }

    /**
     * 表名只允许字母、数字、下划线和点，它会被直接拼进 INSERT 语句。
     */
    static boolean isIdentifierLike(String name) {
        if(name == null || name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '_' || c == '.';
            if(!ok) {
                return false;
            }
        }
        return true;
    }

    private static int parseIntOrZero(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
