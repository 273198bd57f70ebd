package com.litesql.backend.executor;

import java.util.Iterator;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.litesql.backend.engine.ChangeSummary;
import com.litesql.backend.engine.EngineConnection;
import com.litesql.backend.engine.EngineStatement;
import com.litesql.common.EngineException;

/**
 * 一次批量执行的结果序列：有限、惰性、不可重来。
 * <p>
 * 每次取下一条结果时才去切分、编译、执行下一条语句；取下一条之前上一条查询会被 finalize。
 * 任何 prepare/step 错误都会终止序列，错误通过 {@link #error()} 获取，已经执行的语句不会回滚。
 */
public class BatchResult implements Iterator<StatementOutcome>, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchResult.class);

    private final EngineConnection connection;
    private final SqlSplitter splitter;

    private StatementOutcome pending;
    private QueryOutcome openQuery;
    private EngineException error;
    private boolean finished;
    private int executed;

    BatchResult(EngineConnection connection, String sql) {
        this.connection = connection;
        this.splitter = new SqlSplitter(sql);
    }

    @Override
    public boolean hasNext() {
        if(pending != null) {
            return true;
        }
        if(finished) {
            return false;
        }
        advance();
        return pending != null;
    }

    @Override
    public StatementOutcome next() {
        if(!hasNext()) {
            throw new NoSuchElementException();
        }
        StatementOutcome outcome = pending;
        pending = null;
        return outcome;
    }

    /**
     * 终止批次的错误；没有错误时返回 null。只有遍历结束后才是最终结果。
     */
    public EngineException error() {
        return error;
    }

    public boolean hasError() {
        return error != null;
    }

    /** 已经开始执行的语句数 */
    public int getExecutedCount() {
        return executed;
    }

    @Override
    public void close() {
        finished = true;
        pending = null;
        closeOpenQuery();
    }

    void fail(EngineException e) {
        if(error == null) {
            error = e;
        }
        finished = true;
    }

    private void advance() {
        closeOpenQuery();
        if(error != null) {
            finished = true;
            return;
        }
        String sql = splitter.next();
        if(sql == null) {
            finished = true;
            return;
        }
        EngineStatement statement;
        try {
            statement = connection.prepare(sql);
        } catch (EngineException e) {
            LOGGER.debug("prepare failed after {} statements: {}", executed, e.getMessage());
            fail(e);
            return;
        }
        executed++;
        if(statement.columnCount() > 0) {
            openQuery = new QueryOutcome(sql, statement, this);
            pending = openQuery;
            return;
        }
        try {
            statement.step();
            ChangeSummary summary = connection.changes();
            pending = new MutationOutcome(sql, summary.getChanges(), summary.getLastInsertRowid());
        } catch (EngineException e) {
            fail(e);
        } finally {
            statement.close();
        }
    }

    private void closeOpenQuery() {
        if(openQuery != null) {
            openQuery.close();
            openQuery = null;
        }
    }
}
