package com.litesql.backend.engine;

import java.io.IOException;

import com.litesql.common.LiteSqlException;

/**
 * 在独占引擎的临界区内执行的回调。
 */
@FunctionalInterface
public interface EngineCallback<T> {

    T apply(EngineConnection connection) throws LiteSqlException, IOException;
}
