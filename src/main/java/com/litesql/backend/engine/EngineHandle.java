package com.litesql.backend.engine;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.litesql.common.EngineException;
import com.litesql.common.LiteSqlException;
import com.litesql.common.LockTimeoutException;

/**
 * 进程内唯一的引擎句柄：一条连接 + 一把锁。
 * <p>
 * 所有对引擎的调用都必须经过 {@link #withExclusiveAccess}，保证任意时刻最多只有一个调用在引擎内部执行。
 * 等待有上限，超时则回调不会被执行。
 */
public class EngineHandle implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineHandle.class);

    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final EngineConnection connection;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Duration lockTimeout;
    private volatile boolean closed;

    public EngineHandle(EngineConnection connection) {
        this(connection, DEFAULT_LOCK_TIMEOUT);
    }

    public EngineHandle(EngineConnection connection, Duration lockTimeout) {
        this.connection = connection;
        this.lockTimeout = lockTimeout;
    }

    /**
     * 打开数据库文件并创建句柄。
     */
    public static EngineHandle open(String path, int busyTimeoutMs, Duration lockTimeout) throws LiteSqlException {
        return new EngineHandle(SqliteEngineConnection.open(path, busyTimeoutMs), lockTimeout);
    }

    public <T> T withExclusiveAccess(EngineCallback<T> callback) throws LiteSqlException, IOException {
        return withExclusiveAccess(lockTimeout, callback);
    }

    /**
     * 在限定时间内获取引擎锁并执行回调，任何退出路径都会释放锁。
     *
     * @throws LockTimeoutException 超时未获得锁，回调未执行
     */
    public <T> T withExclusiveAccess(Duration timeout, EngineCallback<T> callback) throws LiteSqlException, IOException {
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException("database busy: interrupted while waiting for lock");
        }
        if(!acquired) {
            LOGGER.debug("engine lock wait timed out after {} ms", timeout.toMillis());
            throw new LockTimeoutException(timeout);
        }
        try {
            ensureOpen();
            return callback.apply(connection);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 不加锁直接访问连接，只用于会话拆除时拿不到锁的兜底释放。
     * 驱动对单个连接上的原生调用本身是串行的，这里不会破坏引擎状态。
     */
    public <T> T withoutLock(EngineCallback<T> callback) throws LiteSqlException, IOException {
        ensureOpen();
        return callback.apply(connection);
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public boolean isLocked() {
        return lock.isLocked();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * 关闭连接。会等待当前持锁者结束，等不到也照样关闭。
     */
    @Override
    public void close() {
        if(closed) {
            return;
        }
        boolean acquired = false;
        try {
            acquired = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if(!acquired) {
            LOGGER.warn("closing engine while the lock is still held");
        }
        try {
            closed = true;
            connection.close();
        } finally {
            if(acquired) {
                lock.unlock();
            }
        }
    }

    private void ensureOpen() throws EngineException {
        if(closed) {
            throw new EngineException(EngineException.MISUSE, "database is closed");
        }
    }
}
