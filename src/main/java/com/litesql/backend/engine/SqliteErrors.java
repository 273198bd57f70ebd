package com.litesql.backend.engine;

import java.sql.SQLException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.sqlite.SQLiteException;

import com.litesql.common.EngineException;

/**
 * JDBC 异常 → {@link EngineException}，保留 SQLite 结果码和原始信息。
 * <p>
 * 驱动会把引擎信息包成 {@code [SQLITE_ERROR] SQL error or missing database (no such table: t)}，
 * 这里还原成引擎自己的 {@code no such table: t}；扩展结果码折叠为主结果码。
 */
final class SqliteErrors {

    /** [名称] 描述[:扩展码] (引擎信息) */
    private static final Pattern DRIVER_WRAPPED = Pattern.compile("^\\[[A-Z0-9_]+\\][^(]*\\((.*)\\)$", Pattern.DOTALL);
    /** 去掉 "[名称] 描述" 之后剩下的部分 */
    private static final Pattern WRAPPED_TAIL = Pattern.compile("^(?::-?\\d+)? \\((.*)\\)$", Pattern.DOTALL);

    private SqliteErrors() {
    }

    static EngineException translate(SQLException e) {
        return new EngineException(resultCode(e), engineMessage(e), e);
    }

    static int resultCode(SQLException e) {
        int rc = e.getErrorCode();
        if(e instanceof SQLiteException && ((SQLiteException) e).getResultCode() != null) {
            rc = ((SQLiteException) e).getResultCode().code;
        }
        rc = rc & 0xFF;
        return rc == 0 || rc == 0xFF ? EngineException.GENERIC : rc;
    }

    static String engineMessage(SQLException e) {
        String message = e.getMessage();
        if(message == null) {
            return "sqlite error";
        }
        Matcher m = DRIVER_WRAPPED.matcher(message);
        if(e instanceof SQLiteException && ((SQLiteException) e).getResultCode() != null) {
            // 按结果码自己的前缀切，引擎信息里的括号不会干扰
            String prefix = ((SQLiteException) e).getResultCode().toString();
            if(message.startsWith(prefix)) {
                m = WRAPPED_TAIL.matcher(message.substring(prefix.length()));
            }
        }
        if(m.matches() && !m.group(1).isEmpty()) {
            return m.group(1);
        }
        return message;
    }
}
