package com.litesql.backend.engine;

import java.util.List;

import com.litesql.common.EngineException;

/**
 * 引擎内的一条预编译语句。只能在 {@link EngineHandle#withExclusiveAccess} 的临界区内调用，
 * 并且不能泄露到语句注册表或批量执行器之外。
 */
public interface EngineStatement extends AutoCloseable {

    int columnCount();

    List<String> columnNames();

    int parameterCount();

    /**
     * @param index 从 1 开始的参数下标
     */
    void bind(int index, BindValue value) throws EngineException;

    /**
     * 推进一步。
     *
     * @return true 表示产生了一行，可通过 {@link #currentRow()} 读取；false 表示执行完毕
     */
    boolean step() throws EngineException;

    List<Value> currentRow() throws EngineException;

    void reset(boolean clearBindings) throws EngineException;

    /** finalize：释放引擎侧句柄，重复调用无副作用 */
    @Override
    void close();
}
