package com.litesql.backend.executor;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.litesql.backend.engine.EngineConnection;
import com.litesql.backend.engine.EngineHandle;
import com.litesql.common.LiteSqlException;

/**
 * 多语句 SQL 文本的流式执行器。
 * <p>
 * 整个批次只获取一次引擎锁，批次执行期间其他客户端的请求排队等待。
 * 不包隐式事务：第 k 条失败时前 k-1 条的效果保留。
 */
public class BatchExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchExecutor.class);

    private final EngineHandle engine;

    public BatchExecutor(EngineHandle engine) {
        this.engine = engine;
    }

    /**
     * 在已持有引擎锁的临界区内打开批次。
     */
    public BatchResult open(EngineConnection connection, String sql) {
        return new BatchResult(connection, sql);
    }

    /**
     * 获取引擎锁，把惰性结果交给 consumer，consumer 返回后 finalize 残留语句并释放锁。
     */
    public <T> T execute(String sql, BatchConsumer<T> consumer) throws LiteSqlException, IOException {
        return engine.withExclusiveAccess(conn -> {
            try (BatchResult result = open(conn, sql)) {
                T value = consumer.accept(result);
                LOGGER.debug("batch finished: {} statements, error={}", result.getExecutedCount(),
                        result.hasError() ? result.error().getMessage() : null);
                return value;
            }
        });
    }

    public EngineHandle getEngine() {
        return engine;
    }
}
