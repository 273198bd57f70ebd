package com.litesql.backend.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 将一段 SQL 文本按语句边界切分。
 * <p>
 * 边界判断与 SQLite 自身的语句完整性状态机一致：
 * <ul>
 *     <li>字符串、带引号的标识符、注释中的分号不切分</li>
 *     <li>{@code CREATE TRIGGER ... BEGIN ...; END;} 整体作为一条语句</li>
 *     <li>只有空白和注释的"空语句"被跳过</li>
 * </ul>
 * 切分是增量的：每次 {@link #next()} 只扫描到下一个边界。
 */
public class SqlSplitter {

    private static final int TK_SEMI = 0;
    private static final int TK_WS = 1;
    private static final int TK_OTHER = 2;
    private static final int TK_EXPLAIN = 3;
    private static final int TK_CREATE = 4;
    private static final int TK_TEMP = 5;
    private static final int TK_TRIGGER = 6;
    private static final int TK_END = 7;

    /**
     * 状态：0 初始, 1 语句结束, 2 普通语句中, 3 EXPLAIN 之后,
     * 4 CREATE 之后, 5 触发器体内, 6 触发器体内分号之后, 7 触发器体内 END 之后
     */
    private static final int[][] TRANS = {
            /*            SEMI WS OTHER EXPLAIN CREATE TEMP TRIGGER END */
            /* 0 */     { 1,   0,  2,    3,      4,     2,   2,      2 },
            /* 1 */     { 1,   1,  2,    3,      4,     2,   2,      2 },
            /* 2 */     { 1,   2,  2,    2,      2,     2,   2,      2 },
            /* 3 */     { 1,   3,  3,    2,      4,     2,   2,      2 },
            /* 4 */     { 1,   4,  2,    2,      2,     4,   5,      2 },
            /* 5 */     { 6,   5,  5,    5,      5,     5,   5,      5 },
            /* 6 */     { 6,   6,  5,    5,      5,     5,   5,      7 },
            /* 7 */     { 1,   7,  5,    5,      5,     5,   5,      5 },
    };

    private final String sql;
    private int pos;

    public SqlSplitter(String sql) {
        this.sql = sql == null ? "" : sql;
        this.pos = 0;
    }

    /**
     * 一次性切分全部语句。
     */
    public static List<String> split(String sql) {
        SqlSplitter splitter = new SqlSplitter(sql);
        List<String> statements = new ArrayList<>();
        String stmt;
        while((stmt = splitter.next()) != null) {
            statements.add(stmt);
        }
        return statements;
    }

    /**
     * 文本是否以一条完整语句结尾（最后一个有效 token 是真正的语句结束分号）。
     */
    public static boolean isComplete(String sql) {
        int state = 0;
        int i = 0;
        while(i < sql.length()) {
            int end = scanToken(sql, i);
            if(end < 0) {
                return false;
            }
            state = TRANS[state][tokenType(sql, i, end)];
            i = end;
        }
        return state == 1;
    }

    /**
     * 返回下一条非空语句（不含结尾分号，已去除首尾空白），没有更多语句时返回 null。
     */
    public String next() {
        int state = 0;
        int start = pos;
        boolean hasContent = false;
        while(pos < sql.length()) {
            int tokenStart = pos;
            int end = scanToken(sql, pos);
            if(end < 0) {
                // 未闭合的字符串或注释：剩余部分整体交给引擎报错
                pos = sql.length();
                hasContent = hasContent || !isCommentStart(sql, tokenStart);
                break;
            }
            int type = tokenType(sql, tokenStart, end);
            pos = end;
            int nextState = TRANS[state][type];
            if(type == TK_SEMI && nextState == 1) {
                if(hasContent) {
                    return sql.substring(start, tokenStart).trim();
                }
                start = pos;
                state = 1;
                continue;
            }
            if(type != TK_WS && type != TK_SEMI) {
                hasContent = true;
            }
            state = nextState;
        }
        if(hasContent) {
            String rest = sql.substring(start).trim();
            return rest.isEmpty() ? null : rest;
        }
        return null;
    }

    /**
     * 扫描从 i 开始的一个 token，返回其结束位置；字符串、标识符或块注释未闭合时返回 -1。
     */
    private static int scanToken(String s, int i) {
        char c = s.charAt(i);
        int n = s.length();
        switch (c) {
            case ';':
                return i + 1;
            case '/':
                if(i + 1 < n && s.charAt(i + 1) == '*') {
                    int close = s.indexOf("*/", i + 2);
                    return close < 0 ? -1 : close + 2;
                }
                return i + 1;
            case '-':
                if(i + 1 < n && s.charAt(i + 1) == '-') {
                    int nl = s.indexOf('\n', i + 2);
                    return nl < 0 ? n : nl + 1;
                }
                return i + 1;
            case '[': {
                int close = s.indexOf(']', i + 1);
                return close < 0 ? -1 : close + 1;
            }
            case '`':
            case '"':
            case '\'': {
                int close = s.indexOf(c, i + 1);
                return close < 0 ? -1 : close + 1;
            }
            default:
                if(Character.isWhitespace(c)) {
                    return i + 1;
                }
                if(isIdChar(c)) {
                    int j = i + 1;
                    while(j < n && isIdChar(s.charAt(j))) {
                        j++;
                    }
                    return j;
                }
                return i + 1;
        }
    }

    private static int tokenType(String s, int start, int end) {
        char c = s.charAt(start);
        if(c == ';') {
            return TK_SEMI;
        }
        if(Character.isWhitespace(c)) {
            return TK_WS;
        }
        if(end - start >= 2 && (s.startsWith("--", start) || s.startsWith("/*", start))) {
            return TK_WS;
        }
        if(!isIdChar(c)) {
            return TK_OTHER;
        }
        String word = s.substring(start, end).toLowerCase(Locale.ROOT);
        switch (word) {
            case "create":
                return TK_CREATE;
            case "trigger":
                return TK_TRIGGER;
            case "temp":
            case "temporary":
                return TK_TEMP;
            case "end":
                return TK_END;
            case "explain":
                return TK_EXPLAIN;
            default:
                return TK_OTHER;
        }
    }

    private static boolean isCommentStart(String s, int i) {
        return s.startsWith("/*", i);
    }

    private static boolean isIdChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c >= 0x80;
    }
}
