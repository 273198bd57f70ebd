package com.litesql.backend.engine;

import com.litesql.common.EngineException;

/**
 * 对嵌入式 SQL 引擎连接的最小抽象。实现本身不是线程安全的，
 * 所有调用都必须由 {@link EngineHandle} 串行化。
 */
public interface EngineConnection extends AutoCloseable {

    /**
     * 编译一条语句；文本中只应包含一条语句。
     */
    EngineStatement prepare(String sql) throws EngineException;

    /**
     * 由引擎直接执行整段 SQL（可包含多条语句），丢弃结果行。
     */
    void exec(String sql) throws EngineException;

    ChangeSummary changes() throws EngineException;

    void setBusyTimeout(int millis) throws EngineException;

    String version() throws EngineException;

    @Override
    void close();
}
