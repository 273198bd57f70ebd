package com.litesql.backend.registry;

import com.litesql.backend.engine.EngineStatement;

/**
 * 注册表中的一个槽位。分配后处于空闲状态，prepare 成功后持有引擎语句。
 */
class StatementSlot {

    private final int id;
    private EngineStatement statement;

    StatementSlot(int id) {
        this.id = id;
    }

    int getId() {
        return id;
    }

    boolean isPrepared() {
        return statement != null;
    }

    EngineStatement getStatement() {
        return statement;
    }

    void attach(EngineStatement statement) {
        this.statement = statement;
    }

    /** finalize，未 prepare 的槽位什么也不做 */
    void close() {
        if(statement != null) {
            statement.close();
            statement = null;
        }
    }
}
