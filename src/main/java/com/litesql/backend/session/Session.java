package com.litesql.backend.session;

import java.time.Instant;
import java.util.Locale;

import com.litesql.backend.registry.StatementRegistry;

/**
 * 一条长连接（TCP 或控制台）对应的会话状态。连接断开时销毁，销毁会释放其持有的所有语句。
 */
public class Session implements AutoCloseable {

    public enum Kind {
        TCP,
        CONSOLE
    }

    private final long id;
    private final Kind kind;
    private final String remoteAddress;
    private final StatementRegistry registry;
    private final ConsoleOptions consoleOptions;
    private final Instant createdAt = Instant.now();
    private volatile boolean closed;

    Session(long id, Kind kind, String remoteAddress, StatementRegistry registry, ConsoleOptions consoleOptions) {
        this.id = id;
        this.kind = kind;
        this.remoteAddress = remoteAddress;
        this.registry = registry;
        this.consoleOptions = consoleOptions;
    }

    public long getId() {
        return id;
    }

    public Kind getKind() {
        return kind;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public StatementRegistry getRegistry() {
        return registry;
    }

    /**
     * @return 只有控制台会话才有，TCP 会话返回 null
     */
    public ConsoleOptions getConsoleOptions() {
        return consoleOptions;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isClosed() {
        return closed;
    }

    /** 用于日志的客户端标识 */
    public String clientId() {
        return kind.name().toLowerCase(Locale.ROOT) + "#" + id + "@" + remoteAddress;
    }

    @Override
    public void close() {
        if(closed) {
            return;
        }
        closed = true;
        registry.releaseAll();
    }
}
