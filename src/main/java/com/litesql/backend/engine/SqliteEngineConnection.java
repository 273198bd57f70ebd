package com.litesql.backend.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import com.litesql.backend.executor.SqlSplitter;
import com.litesql.common.EngineException;

/**
 * 通过 SQLite JDBC 驱动打开的单个引擎连接，自动提交模式，不做任何隐式事务包装。
 */
public class SqliteEngineConnection implements EngineConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqliteEngineConnection.class);

    public static final String MEMORY = ":memory:";

    private final Connection connection;
    private final String location;

    private SqliteEngineConnection(Connection connection, String location) {
        this.connection = connection;
        this.location = location;
    }

    /**
     * 打开数据库文件（不存在则创建），并设置引擎内部的 busy 重试时长。
     *
     * @param path          数据库文件路径，或 {@code :memory:}
     * @param busyTimeoutMs 引擎内部文件锁冲突时的重试时长
     */
    public static SqliteEngineConnection open(String path, int busyTimeoutMs) throws EngineException {
        String url;
        String location;
        if(MEMORY.equals(path)) {
            url = "jdbc:sqlite::memory:";
            location = MEMORY;
        } else {
            Path file = Paths.get(path).toAbsolutePath();
            try {
                if(file.getParent() != null) {
                    Files.createDirectories(file.getParent());
                }
            } catch (IOException e) {
                throw new EngineException(EngineException.GENERIC, "cannot create directory for " + file, e);
            }
            url = "jdbc:sqlite:" + file;
            location = file.toString();
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(busyTimeoutMs);
        try {
            Connection conn = config.createConnection(url);
            LOGGER.info("SQLite database opened: {} (busy timeout {} ms)", location, busyTimeoutMs);
            return new SqliteEngineConnection(conn, location);
        } catch (SQLException e) {
            throw SqliteErrors.translate(e);
        }
    }

    public String getLocation() {
        return location;
    }

    @Override
    public EngineStatement prepare(String sql) throws EngineException {
        // 空白或只有注释的文本驱动会拿到空句柄，并把这条连接弄坏，必须在这里挡住
        if(sql == null || new SqlSplitter(sql).next() == null) {
            throw new EngineException(EngineException.GENERIC, "empty statement");
        }
        PreparedStatement ps;
        try {
            ps = connection.prepareStatement(sql);
        } catch (SQLException e) {
            throw SqliteErrors.translate(e);
        }
        try {
            List<String> names = columnNames(ps.getMetaData());
            int params = ps.getParameterMetaData().getParameterCount();
            return new SqliteEngineStatement(ps, names, params);
        } catch (SQLException e) {
            closeQuietly(ps);
            throw SqliteErrors.translate(e);
        }
    }

    @Override
    public void exec(String sql) throws EngineException {
        if(sql == null || new SqlSplitter(sql).next() == null) {
            return;
        }
        try (Statement st = connection.createStatement()) {
            st.executeUpdate(sql);
        } catch (SQLException e) {
            throw SqliteErrors.translate(e);
        }
    }

    @Override
    public ChangeSummary changes() throws EngineException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT changes(), total_changes(), last_insert_rowid()")) {
            rs.next();
            return new ChangeSummary(rs.getInt(1), rs.getLong(2), rs.getLong(3));
        } catch (SQLException e) {
            throw SqliteErrors.translate(e);
        }
    }

    @Override
    public void setBusyTimeout(int millis) throws EngineException {
        try (Statement st = connection.createStatement()) {
            st.execute("PRAGMA busy_timeout = " + Math.max(0, millis));
        } catch (SQLException e) {
            throw SqliteErrors.translate(e);
        }
    }

    @Override
    public String version() throws EngineException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT sqlite_version()")) {
            rs.next();
            return rs.getString(1);
        } catch (SQLException e) {
            throw SqliteErrors.translate(e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
            LOGGER.info("SQLite database closed: {}", location);
        } catch (SQLException e) {
            LOGGER.warn("close database {} failed: {}", location, e.getMessage());
        }
    }

    private List<String> columnNames(ResultSetMetaData md) throws SQLException {
        List<String> names = new ArrayList<>();
        if(md == null) {
            return names;
        }
        int count = columnCount(md);
        for (int i = 1; i <= count; i++) {
            String name = md.getColumnLabel(i);
            names.add(name == null ? "" : name);
        }
        return names;
    }

    /**
     * 驱动对没有结果列的语句调用 getColumnCount 会报列越界，这种情况按 0 列处理。
     */
    private int columnCount(ResultSetMetaData md) {
        try {
            return md.getColumnCount();
        } catch (SQLException e) {
            LOGGER.trace("statement has no result columns: {}", e.getMessage());
            return 0;
        }
    }

    private void closeQuietly(PreparedStatement ps) {
        try {
            ps.close();
        } catch (SQLException e) {
            LOGGER.warn("close statement failed: {}", e.getMessage());
        }
    }
}
