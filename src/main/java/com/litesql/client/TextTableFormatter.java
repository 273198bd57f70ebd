package com.litesql.client;

import java.util.List;

import com.google.common.base.Strings;

/**
 * 把查询结果渲染成类似 MySQL CLI 的 ASCII 表格，NULL 显示为 NULL。
 */
public final class TextTableFormatter {

    private TextTableFormatter() {}

    public static String format(List<String> headers, List<List<String>> rows) {
        int[] widths = new int[headers.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = headers.get(i).length();
        }
        for (List<String> row : rows) {
            for (int i = 0; i < widths.length; i++) {
                widths[i] = Math.max(widths[i], cell(row, i).length());
            }
        }
        String horizontal = horizontal(widths);
        StringBuilder sb = new StringBuilder();
        sb.append(horizontal).append('\n');
        sb.append(line(headers, widths)).append('\n');
        sb.append(horizontal).append('\n');
        for (List<String> row : rows) {
            sb.append(line(row, widths)).append('\n');
        }
        sb.append(horizontal);
        return sb.toString();
    }

    private static String cell(List<String> row, int i) {
        String value = i < row.size() ? row.get(i) : null;
        return value == null ? "NULL" : value;
    }

    private static String horizontal(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append(Strings.repeat("-", width + 2)).append('+');
        }
        return sb.toString();
    }

    private static String line(List<String> values, int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(Strings.padEnd(cell(values, i), widths[i], ' ')).append(" |");
        }
        return sb.toString();
    }
}
