package com.litesql.common;

import java.time.Duration;

/**
 * 在限定时间内没有拿到引擎锁。此时回调从未执行，引擎状态未被触碰。
 */
public class LockTimeoutException extends LiteSqlException {

    public LockTimeoutException(Duration timeout) {
        super(ErrorCode.BUSY, "database busy: lock wait timed out after " + timeout.toMillis() + " ms");
    }

    public LockTimeoutException(String message) {
        super(ErrorCode.BUSY, message);
    }
}
