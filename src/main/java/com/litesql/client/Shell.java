package com.litesql.client;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Instant;
import java.util.Locale;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import com.google.gson.JsonObject;
import com.litesql.backend.executor.SqlSplitter;
import com.litesql.common.LiteSqlException;

/**
 * 交互式命令行：累积输入直到语句完整（以真正的语句结束分号结尾），
 * 再逐条通过 TCP 协议执行并打印表格。
 */
public class Shell {
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String PROMPT = ANSI_CYAN + "litesql> " + ANSI_RESET;
    private static final String CONT_PROMPT = ANSI_CYAN + "      -> " + ANSI_RESET;
    private final LiteSqlClient client;

    public Shell(LiteSqlClient client) {
        this.client = client;
    }

    public void run() {
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .appName("LiteSQL")
                    .history(new MergedHistory())
                    // 不忽略以空格开头的命令，保证历史可用
                    .option(LineReader.Option.HISTORY_IGNORE_SPACE, false)
                    .build();
            PrintStream out = System.out;
            out.println("connected (" + client.getProtocol() + ")");
            StringBuilder buffer = new StringBuilder();
            while (true) {
                String line;
                try {
                    line = reader.readLine(buffer.length() == 0 ? PROMPT : CONT_PROMPT);
                } catch (UserInterruptException ignore) {
                    // Ctrl+C 清空当前缓冲，回到主提示符
                    resetHistory(reader);
                    buffer.setLength(0);
                    continue;
                } catch (EndOfFileException eof) {
                    // Ctrl+D 退出
                    break;
                }
                if (line == null) continue;
                String trimmed = line.trim();
                // 仅在缓冲为空时响应退出命令
                if (buffer.length() == 0 &&
                        ("exit".equalsIgnoreCase(trimmed) || "quit".equalsIgnoreCase(trimmed))) {
                    break;
                }
                if (trimmed.isEmpty() && buffer.length() == 0) continue;
                buffer.append(line).append('\n');
                if (!SqlSplitter.isComplete(buffer.toString())) {
                    continue;
                }
                for (String sql : SqlSplitter.split(buffer.toString())) {
                    runStatement(sql, out);
                }
                buffer.setLength(0);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize console", e);
        } finally {
            closeClient();
        }
    }

    /**
     * 有结果列的语句按查询执行并打印表格，其余语句用 exec 执行以拿到影响行数。
     */
    void runStatement(String sql, PrintStream out) {
        long start = System.nanoTime();
        try {
            JsonObject prepared = client.prepare(sql);
            int stmt = prepared.get("stmt").getAsInt();
            int cols = prepared.get("cols").getAsInt();
            if (cols > 0) {
                QueryResult result = client.fetchAll(prepared);
                out.println(TextTableFormatter.format(result.getColumns(), result.getRows()));
                int rows = result.getRows().size();
                out.println(rows + (rows == 1 ? " row" : " rows") + " in set (" + elapsed(start) + " sec)");
            } else {
                client.finalizeStatement(stmt);
                JsonObject resp = client.exec(sql);
                int changes = resp.get("changes").getAsInt();
                out.println("Query OK, " + changes + (changes == 1 ? " row" : " rows")
                        + " affected (" + elapsed(start) + " sec)");
            }
        } catch (LiteSqlException e) {
            out.println("ERROR " + e.getCode() + ": " + e.getMessage());
        } catch (IOException e) {
            out.println("connection error: " + e.getMessage());
        }
        out.println();
    }

    private void closeClient() {
        try {
            client.close();
        } catch (IOException e) {
            System.err.println("close failed: " + e.getMessage());
        }
    }

    private static String elapsed(long startNanos) {
        return String.format(Locale.ROOT, "%.2f", (System.nanoTime() - startNanos) / 1_000_000_000d);
    }

    private void resetHistory(LineReader reader) {
        if(reader.getHistory() instanceof MergedHistory) {
            ((MergedHistory) reader.getHistory()).resetPending();
        }
    }

    /**
     * 合并多行输入为单行存入历史，模拟 MySQL CLI 压缩行为。
     */
    private static class MergedHistory extends DefaultHistory {
        private final StringBuilder pending = new StringBuilder();

        @Override
        public void add(Instant time, String line) {
            if(line == null) return;
            String trimmed = line.trim();
            if(trimmed.isEmpty()) return;
            pending.append(line).append('\n');
            if(!SqlSplitter.isComplete(pending.toString())) {
                return;
            }
            String merged = pending.toString().replaceAll("\\s+", " ").trim();
            pending.setLength(0);
            super.add(time, merged);
        }

        void resetPending() {
            pending.setLength(0);
        }
    }
}
