package com.litesql.backend.server.console;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Splitter;

/**
 * .import 使用的单行字段拆分。
 * <ul>
 *     <li>csv：逗号分隔，字段可用双引号包裹，引号内 {@code ""} 表示一个引号；未加引号的字段去掉尾部空白</li>
 *     <li>其他：按单个分隔字符直接切分</li>
 * </ul>
 * 空行得到 0 个字段。
 */
public final class CsvLineParser {

    private CsvLineParser() {
    }

    public static List<String> parseCsv(String line) {
        List<String> fields = new ArrayList<>();
        int n = line.length();
        int i = 0;
        while(i < n) {
            StringBuilder field = new StringBuilder();
            if(line.charAt(i) == '"') {
                i++;
                while(i < n) {
                    char c = line.charAt(i);
                    if(c == '"' && i + 1 < n && line.charAt(i + 1) == '"') {
                        field.append('"');
                        i += 2;
                        continue;
                    }
                    if(c == '"') {
                        i++;
                        break;
                    }
                    field.append(c);
                    i++;
                }
                // 收尾引号之后到逗号之间的内容丢弃
                while(i < n && line.charAt(i) != ',') {
                    i++;
                }
                fields.add(field.toString());
            } else {
                int comma = line.indexOf(',', i);
                int end = comma < 0 ? n : comma;
                fields.add(stripTrailing(line.substring(i, end)));
                i = end;
            }
            if(i < n && line.charAt(i) == ',') {
                i++;
                if(i == n) {
                    fields.add("");
                }
            }
        }
        return fields;
    }

    public static List<String> split(String line, char separator) {
        if(line.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Splitter.on(separator).splitToList(line));
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while(end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }
}
