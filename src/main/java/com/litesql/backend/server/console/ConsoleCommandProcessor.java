package com.litesql.backend.server.console;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.litesql.backend.engine.BindValue;
import com.litesql.backend.engine.ChangeSummary;
import com.litesql.backend.engine.EngineConnection;
import com.litesql.backend.engine.EngineHandle;
import com.litesql.backend.engine.EngineStatement;
import com.litesql.backend.engine.Value;
import com.litesql.backend.executor.BatchExecutor;
import com.litesql.backend.executor.MutationOutcome;
import com.litesql.backend.executor.QueryOutcome;
import com.litesql.backend.executor.StatementOutcome;
import com.litesql.backend.session.ConsoleOptions;
import com.litesql.backend.session.OutputMode;
import com.litesql.backend.session.Session;
import com.litesql.common.EngineException;
import com.litesql.common.LiteSqlException;
import com.litesql.common.ProtocolException;
import com.litesql.transport.LineWriter;

/**
 * 控制台一行输入的处理：点命令或原始 SQL。
 * <p>
 * 显示选项取自会话自己的 {@link ConsoleOptions}，多个控制台客户端互不影响。
 * SQL 错误只输出 {@code ERR: ...}，不会断开连接。
 */
public class ConsoleCommandProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleCommandProcessor.class);

    private static final Splitter ARGS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults();

    static final String HELP =
            "Dot commands:\r\n"
            + "  .help\r\n"
            + "  .quit | .exit\r\n"
            + "  .tables\r\n"
            + "  .schema [table]\r\n"
            + "  .headers on|off\r\n"
            + "  .mode list|csv|tabs\r\n"
            + "  .separator <sep>\r\n"
            + "  .nullvalue <text>\r\n"
            + "  .timeout <ms>\r\n"
            + "  .echo on|off\r\n"
            + "  .dbinfo\r\n"
            + "  .read <file.sql>\r\n"
            + "  .import [--csv] [--tabs] [--separator X] [--skip N] <file> <table>\r\n"
            + "\r\n"
            + "Notes:\r\n"
            + "  - .read reads up to %d KB per file.\r\n"
            + "  - .import uses VALUES(...) and binds all fields as TEXT.\r\n"
            + "  - Use --skip 1 for CSV header lines.\r\n";

    private final Session session;
    private final ConsoleOptions options;
    private final EngineHandle engine;
    private final BatchExecutor executor;
    private final ConsoleResultFormatter formatter = new ConsoleResultFormatter();
    private final LineWriter out;
    private final Path fileRoot;
    private final long readMaxBytes;

    public ConsoleCommandProcessor(Session session, BatchExecutor executor, LineWriter out,
                                   Path fileRoot, long readMaxBytes) {
        this.session = session;
        this.options = session.getConsoleOptions();
        this.executor = executor;
        this.engine = executor.getEngine();
        this.out = out;
        this.fileRoot = fileRoot.toAbsolutePath().normalize();
        this.readMaxBytes = readMaxBytes;
    }

    /**
     * 处理一行输入。
     *
     * @return false 表示客户端要求退出
     */
    public boolean process(String rawLine) throws IOException {
        String line = rawLine.trim();
        try {
            if(line.isEmpty()) {
                return true;
            }
            if("exit".equalsIgnoreCase(line) || "quit".equalsIgnoreCase(line)) {
                out.writeLine("bye");
                return false;
            }
            if(line.charAt(0) == '.') {
                return dotCommand(line);
            }
            runSql(line);
            return true;
        } finally {
            out.flush();
        }
    }

    private boolean dotCommand(String line) throws IOException {
        int space = CharMatcher.whitespace().indexIn(line);
        String tok = space < 0 ? line : line.substring(0, space);
        String rest = space < 0 ? "" : line.substring(space).trim();
        switch (tok) {
            case ".help":
            case ".?":
                out.write(String.format(HELP, readMaxBytes / 1024));
                return true;
            case ".quit":
            case ".exit":
                out.writeLine("bye");
                return false;
            case ".tables":
                runSql("SELECT name FROM sqlite_master WHERE type='table' ORDER BY name;");
                return true;
            case ".schema":
                schema(rest);
                return true;
            case ".headers":
                headers(rest);
                return true;
            case ".mode":
                mode(rest);
                return true;
            case ".separator":
                if(rest.isEmpty()) {
                    out.writeLine("separator '" + options.getSeparator() + "'");
                } else {
                    options.setSeparator(rest);
                }
                return true;
            case ".nullvalue":
                options.setNullValue(rest);
                return true;
            case ".timeout":
                timeout(rest);
                return true;
            case ".echo":
                echo(rest);
                return true;
            case ".dbinfo":
                dbinfo();
                return true;
            case ".read":
                read(rest);
                return true;
            case ".import":
                importFile(rest);
                return true;
            default:
                out.writeLine("Unknown dot-command. Try .help");
                return true;
        }
    }

    /**
     * 执行一段（可能包含多条语句的）SQL，逐条输出结果。
     */
    void runSql(String sql) throws IOException {
        try {
            executor.execute(sql, result -> {
                while(result.hasNext()) {
                    StatementOutcome outcome = result.next();
                    if(outcome.isQuery()) {
                        printQuery((QueryOutcome) outcome);
                    } else {
                        out.writeLine(formatter.formatMutation((MutationOutcome) outcome));
                    }
                }
                if(result.hasError()) {
                    out.writeLine(formatter.formatError(result.error().getMessage()));
                }
                return null;
            });
        } catch (LiteSqlException e) {
            out.writeLine(formatter.formatError(e.getMessage()));
        }
    }

    private void printQuery(QueryOutcome query) throws IOException {
        if(options.isHeaders()) {
            out.writeLine(formatter.formatHeader(query.getColumns(), options));
        }
        Iterator<List<Value>> rows = query.rows();
        while(rows.hasNext()) {
            out.writeLine(formatter.formatRow(rows.next(), options));
        }
        out.flush();
    }

    private void schema(String table) throws IOException {
        if(table.isEmpty()) {
            runSql("SELECT sql FROM sqlite_master WHERE sql IS NOT NULL ORDER BY name;");
            return;
        }
        runSql("SELECT sql FROM sqlite_master WHERE sql IS NOT NULL AND name='"
                + table.replace("'", "''") + "';");
    }

    private void headers(String arg) throws IOException {
        if(arg.isEmpty()) {
            out.writeLine("headers " + onOff(options.isHeaders()));
        } else if("on".equals(arg)) {
            options.setHeaders(true);
        } else if("off".equals(arg)) {
            options.setHeaders(false);
        } else {
            out.writeLine("Usage: .headers on|off");
        }
    }

    private void mode(String arg) throws IOException {
        if(arg.isEmpty()) {
            out.writeLine("mode " + options.getMode().label());
            return;
        }
        OutputMode mode = OutputMode.parse(arg);
        if(mode == null) {
            out.writeLine("Usage: .mode list|csv|tabs");
            return;
        }
        options.setMode(mode);
    }

    private void echo(String arg) throws IOException {
        if(arg.isEmpty()) {
            out.writeLine("echo " + onOff(options.isEcho()));
        } else if("on".equals(arg)) {
            options.setEcho(true);
        } else if("off".equals(arg)) {
            options.setEcho(false);
        } else {
            out.writeLine("Usage: .echo on|off");
        }
    }

    private void timeout(String arg) throws IOException {
        int ms;
        try {
            ms = Math.max(0, Integer.parseInt(arg));
        } catch (NumberFormatException e) {
            out.writeLine("Usage: .timeout <ms>");
            return;
        }
        try {
            engine.withExclusiveAccess(conn -> {
                conn.setBusyTimeout(ms);
                return null;
            });
            out.writeLine("timeout " + ms + " ms");
        } catch (LiteSqlException e) {
            out.writeLine(formatter.formatError(e.getMessage()));
        }
    }

    private void dbinfo() throws IOException {
        try {
            String info = engine.withExclusiveAccess(conn -> {
                String version = conn.version();
                ChangeSummary summary = conn.changes();
                return "SQLite version: " + version + out.getLineEnding()
                        + "changes=" + summary.getChanges() + " last_insert_rowid=" + summary.getLastInsertRowid();
            });
            out.writeLine(info);
        } catch (LiteSqlException e) {
            out.writeLine(formatter.formatError(e.getMessage()));
        }
    }

    private void read(String arg) throws IOException {
        if(arg.isEmpty()) {
            out.writeLine("Usage: .read <file.sql>");
            return;
        }
        Path path = resolve(arg);
        if(path == null) {
            return;
        }
        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            out.writeLine("ERR: cannot open " + arg);
            return;
        }
        if(size > readMaxBytes) {
            out.writeLine("ERR: file too large (" + size + " bytes, max " + readMaxBytes + ")");
            return;
        }
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            out.writeLine("ERR: cannot open " + arg);
            return;
        }
        LOGGER.info("[{}] .read {} ({} bytes)", session.clientId(), path, content.length);
        out.writeLine("-- .read " + arg + " (" + content.length + " bytes)");
        runSql(new String(content, StandardCharsets.UTF_8));
    }

    private void importFile(String args) throws IOException {
        if(args.isEmpty()) {
            out.writeLine(ImportOptions.USAGE);
            return;
        }
        char defaultSep = options.effectiveSeparator().isEmpty() ? '|' : options.effectiveSeparator().charAt(0);
        ImportOptions opts;
        try {
            opts = ImportOptions.parse(ARGS.splitToList(args), defaultSep);
        } catch (ProtocolException e) {
            out.writeLine(e.getMessage());
            return;
        }
        if(!ImportOptions.isIdentifierLike(opts.table)) {
            out.writeLine("ERR: invalid table name (allowed: a-z A-Z 0-9 _ .)");
            return;
        }
        Path path = resolve(opts.file);
        if(path == null) {
            return;
        }
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String l;
            int skipped = 0;
            while((l = reader.readLine()) != null) {
                if(skipped < opts.skip) {
                    skipped++;
                    continue;
                }
                lines.add(l);
            }
        } catch (IOException e) {
            out.writeLine("ERR: cannot open " + opts.file);
            return;
        }
        if(lines.isEmpty()) {
            out.writeLine("ERR: empty file (after skip)");
            return;
        }
        int expected = splitFields(lines.get(0), opts).size();
        if(expected == 0) {
            out.writeLine("ERR: could not parse first row");
            return;
        }
        try {
            engine.withExclusiveAccess(conn -> {
                importRows(conn, opts, lines, expected);
                return null;
            });
        } catch (LiteSqlException e) {
            out.writeLine(formatter.formatError(e.getMessage()));
        }
    }

    /**
     * 单个事务内逐行插入，任一行失败则整体回滚。调用方已持有引擎锁。
     */
    private void importRows(EngineConnection conn, ImportOptions opts, List<String> lines, int expected)
            throws IOException, EngineException {
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(opts.table).append(" VALUES(");
        for (int c = 0; c < expected; c++) {
            sql.append(c == 0 ? "?" : ",?");
        }
        sql.append(");");

        conn.exec("BEGIN;");
        long rows = 0;
        boolean failed = false;
        EngineStatement stmt = null;
        try {
            stmt = conn.prepare(sql.toString());
            for (String line : lines) {
                List<String> fields = splitFields(line, opts);
                if(fields.size() != expected) {
                    out.writeLine(String.format("WARN: column count mismatch (got %d expected %d), skipping row",
                            fields.size(), expected));
                    continue;
                }
                stmt.reset(true);
                for (int c = 0; c < expected; c++) {
                    stmt.bind(c + 1, BindValue.ofText(Strings.nullToEmpty(fields.get(c))));
                }
                stmt.step();
                rows++;
            }
        } catch (EngineException e) {
            failed = true;
            out.writeLine(formatter.formatError(e.getMessage()));
        } finally {
            if(stmt != null) {
                stmt.close();
            }
        }
        if(failed) {
            rollback(conn);
            out.writeLine("Import failed (rolled back)");
            return;
        }
        try {
            conn.exec("COMMIT;");
        } catch (EngineException e) {
            out.writeLine(formatter.formatError(e.getMessage()));
            rollback(conn);
            out.writeLine("Import failed (rolled back)");
            return;
        }
        LOGGER.info("[{}] imported {} rows into {}", session.clientId(), rows, opts.table);
        out.writeLine("Imported " + rows + " rows into " + opts.table);
    }

    private void rollback(EngineConnection conn) throws IOException {
        try {
            conn.exec("ROLLBACK;");
        } catch (EngineException e) {
            out.writeLine(formatter.formatError(e.getMessage()));
        }
    }

    private static List<String> splitFields(String line, ImportOptions opts) {
        return opts.csv ? CsvLineParser.parseCsv(line) : CsvLineParser.split(line, opts.separator);
    }

    /**
     * 相对路径基于 file-root 解析，解析结果不允许跳出 file-root。
     */
    private Path resolve(String name) throws IOException {
        Path path = fileRoot.resolve(name).normalize();
        if(!path.startsWith(fileRoot)) {
            out.writeLine("ERR: path outside file root: " + name);
            return null;
        }
        return path;
    }

    private static String onOff(boolean flag) {
        return flag ? "on" : "off";
    }
}
