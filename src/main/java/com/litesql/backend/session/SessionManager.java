package com.litesql.backend.session;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import com.litesql.backend.engine.EngineHandle;
import com.litesql.backend.registry.StatementRegistry;

/**
 * 进程内会话表，负责创建、登记及关闭 TCP / 控制台会话。
 */
public class SessionManager implements DisposableBean {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

    private final EngineHandle engine;
    private final int maxStatementsPerSession;
    private final boolean defaultEcho;
    private final Map<Long, Session> sessions = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    public SessionManager(EngineHandle engine, int maxStatementsPerSession, boolean defaultEcho) {
        this.engine = engine;
        this.maxStatementsPerSession = maxStatementsPerSession;
        this.defaultEcho = defaultEcho;
    }

    /**
     * 创建一个新的会话并登记。
     */
    public Session open(Session.Kind kind, String remoteAddress) {
        long id = nextId.getAndIncrement();
        StatementRegistry registry = new StatementRegistry(engine, maxStatementsPerSession);
        ConsoleOptions options = kind == Session.Kind.CONSOLE ? new ConsoleOptions(defaultEcho) : null;
        Session session = new Session(id, kind, remoteAddress, registry, options);
        sessions.put(id, session);
        LOGGER.debug("session opened: {}", session.clientId());
        return session;
    }

    /**
     * 关闭并移除会话，释放其持有的全部语句。
     *
     * @return false 表示会话已经被关闭过
     */
    public boolean close(Session session) {
        Session removed = sessions.remove(session.getId());
        closeQuietly(session);
        return removed != null;
    }

    public int activeCount() {
        return sessions.size();
    }

    public void closeAll() {
        sessions.values().forEach(this::closeQuietly);
        sessions.clear();
    }

    @Override
    public void destroy() {
        closeAll();
    }

    private void closeQuietly(Session session) {
        try {
            session.close();
        } catch (RuntimeException ex) {
            LOGGER.warn("关闭 session {} 失败", session.clientId(), ex);
        }
    }
}
