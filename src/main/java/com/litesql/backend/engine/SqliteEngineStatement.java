package com.litesql.backend.engine;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.litesql.common.EngineException;

/**
 * 基于 SQLite JDBC 驱动的预编译语句。
 * <p>
 * 状态机：READY → (step) → ROWS … → DONE，reset 回到 READY。
 * 无结果列的语句在第一次 step 时执行，之后保持 DONE 直到 reset。
 */
class SqliteEngineStatement implements EngineStatement {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqliteEngineStatement.class);

    private final PreparedStatement ps;
    private final List<String> columnNames;
    private final int parameterCount;

    private ResultSet rs;
    private boolean done;
    private boolean closed;

    SqliteEngineStatement(PreparedStatement ps, List<String> columnNames, int parameterCount) {
        this.ps = ps;
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        this.parameterCount = parameterCount;
    }

    @Override
    public int columnCount() {
        return columnNames.size();
    }

    @Override
    public List<String> columnNames() {
        return columnNames;
    }

    @Override
    public int parameterCount() {
        return parameterCount;
    }

    @Override
    public void bind(int index, BindValue value) throws EngineException {
        ensureOpen();
        if(index < 1 || index > parameterCount) {
            throw new EngineException(EngineException.RANGE,
                    "bind index " + index + " out of range [1," + parameterCount + "]");
        }
        try {
            switch (value.getKind()) {
                case NULL:
                    ps.setNull(index, Types.NULL);
                    break;
                case INT:
                    ps.setLong(index, value.asLong());
                    break;
                case DOUBLE:
                    ps.setDouble(index, value.asDouble());
                    break;
                case TEXT:
                    ps.setString(index, value.asText());
                    break;
                default:
                    throw new EngineException(EngineException.MISUSE, "unsupported bind kind " + value.getKind());
            }
        } catch (SQLException e) {
            throw SqliteErrors.translate(e);
        }
    }

    @Override
    public boolean step() throws EngineException {
        ensureOpen();
        if(done) {
            return false;
        }
        try {
            if(columnNames.isEmpty()) {
                ps.executeUpdate();
                done = true;
                return false;
            }
            if(rs == null) {
                rs = ps.executeQuery();
            }
            if(rs.next()) {
                return true;
            }
            done = true;
            closeResultSet();
            return false;
        } catch (SQLException e) {
            done = true;
            closeResultSet();
            throw SqliteErrors.translate(e);
        }
    }

    @Override
    public List<Value> currentRow() throws EngineException {
        ensureOpen();
        if(rs == null || done) {
            throw new EngineException(EngineException.MISUSE, "no current row");
        }
        List<Value> row = new ArrayList<>(columnNames.size());
        try {
            for (int i = 1; i <= columnNames.size(); i++) {
                row.add(Value.fromObject(rs.getObject(i)));
            }
        } catch (SQLException e) {
            throw SqliteErrors.translate(e);
        }
        return row;
    }

    @Override
    public void reset(boolean clearBindings) throws EngineException {
        ensureOpen();
        closeResultSet();
        done = false;
        if(clearBindings) {
            try {
                ps.clearParameters();
            } catch (SQLException e) {
                throw SqliteErrors.translate(e);
            }
        }
    }

    @Override
    public void close() {
        if(closed) {
            return;
        }
        closed = true;
        closeResultSet();
        try {
            ps.close();
        } catch (SQLException e) {
            LOGGER.warn("finalize statement failed: {}", e.getMessage());
        }
    }

    private void closeResultSet() {
        if(rs == null) {
            return;
        }
        try {
            rs.close();
        } catch (SQLException e) {
            LOGGER.warn("close result set failed: {}", e.getMessage());
        } finally {
            rs = null;
        }
    }

    private void ensureOpen() throws EngineException {
        if(closed) {
            throw new EngineException(EngineException.MISUSE, "statement already finalized");
        }
    }
}
