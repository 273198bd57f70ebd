package com.litesql.backend.executor;

import java.io.IOException;

import com.litesql.common.LiteSqlException;

/**
 * 在引擎锁内消费批量执行结果。
 */
@FunctionalInterface
public interface BatchConsumer<T> {

    T accept(BatchResult result) throws LiteSqlException, IOException;
}
