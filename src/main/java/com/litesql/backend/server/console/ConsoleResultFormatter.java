package com.litesql.backend.server.console;

import java.util.ArrayList;
import java.util.List;

import com.litesql.backend.engine.Value;
import com.litesql.backend.executor.MutationOutcome;
import com.litesql.backend.session.ConsoleOptions;
import com.litesql.backend.session.OutputMode;

/**
 * 控制台结果格式化器
 */
public class ConsoleResultFormatter {

    public String formatHeader(List<String> columns, ConsoleOptions options) {
        List<String> cells = new ArrayList<>(columns.size());
        for (String column : columns) {
            cells.add(quote(column, options));
        }
        return String.join(options.effectiveSeparator(), cells);
    }

    public String formatRow(List<Value> row, ConsoleOptions options) {
        List<String> cells = new ArrayList<>(row.size());
        for (Value value : row) {
            cells.add(value.isNull() ? options.getNullValue() : quote(value.asText(), options));
        }
        return String.join(options.effectiveSeparator(), cells);
    }

    public String formatMutation(MutationOutcome outcome) {
        return "OK (changes=" + outcome.getChanges() + " last_id=" + outcome.getLastInsertRowid() + ")";
    }

    public String formatError(String message) {
        return "ERR: " + message;
    }

    /**
     * csv 模式下含分隔符、引号或换行的字段加双引号，内部引号写两遍。
     */
    private String quote(String text, ConsoleOptions options) {
        if(options.getMode() != OutputMode.CSV || text == null) {
            return text;
        }
        String sep = options.effectiveSeparator();
        boolean needsQuote = (!sep.isEmpty() && text.contains(sep))
                || text.indexOf('"') >= 0 || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
        if(!needsQuote) {
            return text;
        }
        return "\"" + text.replace("\"", "\"\"") + "\"";
    }
}
