package com.litesql.backend.executor;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.litesql.backend.engine.EngineStatement;
import com.litesql.backend.engine.Value;
import com.litesql.common.EngineException;

/**
 * 查询结果。列名立即可用，行在遍历时才从引擎逐行读取，
 * 因此只能在持有引擎锁的临界区内消费。
 * <p>
 * 读取过程中出错时遍历提前结束，错误记录到所属的 {@link BatchResult}。
 */
public class QueryOutcome implements StatementOutcome {

    private final String sql;
    private final List<String> columns;
    private final EngineStatement statement;
    private final BatchResult owner;

    private List<Value> nextRow;
    private boolean done;
    private boolean iterated;

    QueryOutcome(String sql, EngineStatement statement, BatchResult owner) {
        this.sql = sql;
        this.statement = statement;
        this.columns = statement.columnNames();
        this.owner = owner;
    }

    @Override
    public String getSql() {
        return sql;
    }

    @Override
    public boolean isQuery() {
        return true;
    }

    public List<String> getColumns() {
        return columns;
    }

    /**
     * 行迭代器，只能获取一次。
     */
    public Iterator<List<Value>> rows() {
        if(iterated) {
            throw new IllegalStateException("rows of a query outcome can only be iterated once");
        }
        iterated = true;
        return new Iterator<List<Value>>() {
            @Override
            public boolean hasNext() {
                return fetch();
            }

            @Override
            public List<Value> next() {
                if(!fetch()) {
                    throw new NoSuchElementException();
                }
                List<Value> row = nextRow;
                nextRow = null;
                return row;
            }
        };
    }

    private boolean fetch() {
        if(nextRow != null) {
            return true;
        }
        if(done) {
            return false;
        }
        try {
            if(statement.step()) {
                nextRow = statement.currentRow();
                return true;
            }
        } catch (EngineException e) {
            owner.fail(e);
        }
        done = true;
        return false;
    }

    /** 剩余未读的行直接丢弃，然后 finalize */
    void close() {
        done = true;
        nextRow = null;
        statement.close();
    }
}
