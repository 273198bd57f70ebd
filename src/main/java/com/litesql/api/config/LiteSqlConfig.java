package com.litesql.api.config;

import java.nio.file.Paths;
import java.time.Duration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.litesql.backend.engine.EngineHandle;
import com.litesql.backend.executor.BatchExecutor;
import com.litesql.backend.server.console.ConsoleServer;
import com.litesql.backend.server.tcp.TcpRequestDispatcher;
import com.litesql.backend.server.tcp.TcpSqlServer;
import com.litesql.backend.session.SessionManager;
import com.litesql.common.LiteSqlException;

/**
 * 引擎、执行器、会话表以及两个 socket 服务器的装配。
 * 关闭顺序由依赖关系决定：先停服务器，再释放会话，最后关闭引擎。
 */
@Configuration
public class LiteSqlConfig {

    @Bean(destroyMethod = "close")
    public EngineHandle engineHandle(LiteSqlProperties properties) throws LiteSqlException {
        LiteSqlProperties.Engine engine = properties.getEngine();
        return EngineHandle.open(engine.getPath(), engine.getBusyTimeout(),
                Duration.ofMillis(engine.getLockTimeout()));
    }

    @Bean
    public BatchExecutor batchExecutor(EngineHandle engineHandle) {
        return new BatchExecutor(engineHandle);
    }

    @Bean
    public SessionManager sessionManager(EngineHandle engineHandle, LiteSqlProperties properties) {
        return new SessionManager(engineHandle, properties.getTcp().getMaxStatementsPerSession(),
                properties.getConsole().isEcho());
    }

    @Bean
    public TcpRequestDispatcher tcpRequestDispatcher(EngineHandle engineHandle) {
        return new TcpRequestDispatcher(engineHandle);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "litesql.tcp", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TcpSqlServer tcpSqlServer(LiteSqlProperties properties, SessionManager sessionManager,
                                     TcpRequestDispatcher dispatcher) {
        LiteSqlProperties.Tcp tcp = properties.getTcp();
        return new TcpSqlServer(tcp.getPort(), tcp.getMaxClients(), tcp.getRxLineMax(), tcp.getTxLineMax(),
                sessionManager, dispatcher);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "litesql.console", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ConsoleServer consoleServer(LiteSqlProperties properties, SessionManager sessionManager,
                                       BatchExecutor batchExecutor) {
        LiteSqlProperties.Console console = properties.getConsole();
        return new ConsoleServer(console.getPort(), console.getMaxClients(), console.getLineMax(),
                Paths.get(console.getFileRoot()), console.getReadMaxBytes(), sessionManager, batchExecutor);
    }
}
