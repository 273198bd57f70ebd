package com.litesql.backend.registry;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.litesql.backend.engine.BindValue;
import com.litesql.backend.engine.EngineCallback;
import com.litesql.backend.engine.EngineHandle;
import com.litesql.backend.engine.EngineStatement;
import com.litesql.common.EngineException;
import com.litesql.common.LiteSqlException;
import com.litesql.common.LockTimeoutException;
import com.litesql.common.StatementNotFoundException;
import com.litesql.common.StatementsExhaustedException;

/**
 * 每个会话一份的预编译语句注册表。
 * <p>
 * 槽位数有上限，id 在会话内单调递增、不复用。引擎语句对象只存在于这里，
 * 对外只暴露整数 id。所有触碰引擎的操作都经过 {@link EngineHandle} 的同一把锁。
 */
public class StatementRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(StatementRegistry.class);

    public static final int DEFAULT_CAPACITY = 8;

    /** releaseAll 获取引擎锁的重试次数 */
    private static final int RELEASE_ATTEMPTS = 3;

    private final EngineHandle engine;
    private final int capacity;
    private final Map<Integer, StatementSlot> slots = new LinkedHashMap<>();
    private int nextId = 1;

    public StatementRegistry(EngineHandle engine) {
        this(engine, DEFAULT_CAPACITY);
    }

    public StatementRegistry(EngineHandle engine, int capacity) {
        this.engine = engine;
        this.capacity = capacity;
    }

    /**
     * 分配一个空槽位。
     *
     * @throws StatementsExhaustedException 槽位已满
     */
    public synchronized int allocate() throws StatementsExhaustedException {
        if(slots.size() >= capacity) {
            throw new StatementsExhaustedException(capacity);
        }
        int id = nextId++;
        slots.put(id, new StatementSlot(id));
        return id;
    }

    /**
     * 分配槽位并编译 SQL。
     */
    public PrepareResult prepare(String sql) throws LiteSqlException {
        int id = allocate();
        return prepare(id, sql);
    }

    /**
     * 在已分配的槽位上编译 SQL；失败（包括等锁超时）时立刻释放该槽位。
     */
    public synchronized PrepareResult prepare(int id, String sql) throws LiteSqlException {
        StatementSlot slot = requireSlot(id);
        if(slot.isPrepared()) {
            throw new EngineException(EngineException.MISUSE, "stmt " + id + " already prepared");
        }
        boolean prepared = false;
        try {
            EngineStatement statement = locked(conn -> conn.prepare(sql));
            slot.attach(statement);
            prepared = true;
            return new PrepareResult(id, statement.columnNames());
        } finally {
            if(!prepared) {
                slots.remove(id);
            }
        }
    }

    public synchronized void bind(int id, int index, BindValue value) throws LiteSqlException {
        EngineStatement statement = requirePrepared(id);
        locked(conn -> {
            statement.bind(index, value);
            return null;
        });
    }

    /**
     * 推进一步。没有结果列的语句在第一次 step 时执行并返回 DONE，之后一直返回 DONE 直到 reset。
     */
    public synchronized StepResult step(int id) throws LiteSqlException {
        EngineStatement statement = requirePrepared(id);
        return locked(conn -> statement.step() ? StepResult.row(statement.currentRow()) : StepResult.done());
    }

    public synchronized void reset(int id, boolean clearBindings) throws LiteSqlException {
        EngineStatement statement = requirePrepared(id);
        locked(conn -> {
            statement.reset(clearBindings);
            return null;
        });
    }

    /**
     * 释放槽位。第二次 finalize 同一个 id 得到 NotFound。
     * 等锁超时时槽位保持不变，客户端可以重试。
     */
    public synchronized void finalizeStatement(int id) throws LiteSqlException {
        StatementSlot slot = requireSlot(id);
        locked(conn -> {
            slot.close();
            return null;
        });
        slots.remove(id);
    }

    /**
     * 会话结束时释放所有语句。拿不到锁时重试几次，仍然失败就不加锁直接释放。
     */
    public synchronized void releaseAll() {
        if(slots.isEmpty()) {
            return;
        }
        List<StatementSlot> pending = new ArrayList<>(slots.values());
        slots.clear();
        EngineCallback<Void> closeAll = conn -> {
            for (StatementSlot slot : pending) {
                slot.close();
            }
            return null;
        };
        for (int attempt = 1; attempt <= RELEASE_ATTEMPTS; attempt++) {
            try {
                engine.withExclusiveAccess(closeAll);
                return;
            } catch (LockTimeoutException e) {
                LOGGER.debug("releaseAll attempt {} timed out", attempt);
            } catch (LiteSqlException | IOException e) {
                LOGGER.warn("releaseAll failed: {}", e.getMessage());
                return;
            }
        }
        LOGGER.warn("engine lock unavailable, releasing {} statements without lock", pending.size());
        try {
            engine.withoutLock(closeAll);
        } catch (LiteSqlException | IOException e) {
            LOGGER.warn("releaseAll without lock failed: {}", e.getMessage());
        }
    }

    public synchronized int size() {
        return slots.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public synchronized boolean contains(int id) {
        return slots.containsKey(id);
    }

    private StatementSlot requireSlot(int id) throws StatementNotFoundException {
        StatementSlot slot = slots.get(id);
        if(slot == null) {
            throw new StatementNotFoundException(id);
        }
        return slot;
    }

    private EngineStatement requirePrepared(int id) throws LiteSqlException {
        StatementSlot slot = requireSlot(id);
        if(!slot.isPrepared()) {
            throw new EngineException(EngineException.MISUSE, "stmt " + id + " not prepared");
        }
        return slot.getStatement();
    }

    private <T> T locked(EngineCallback<T> callback) throws LiteSqlException {
        try {
            return engine.withExclusiveAccess(callback);
        } catch (IOException e) {
            throw new EngineException(EngineException.GENERIC, e.getMessage(), e);
        }
    }
}
