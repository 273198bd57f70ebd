package com.litesql.backend.server.console;

import java.io.IOException;
import java.net.Socket;
import java.nio.file.Path;

import com.litesql.backend.executor.BatchExecutor;
import com.litesql.backend.server.SocketServer;
import com.litesql.backend.session.Session;
import com.litesql.backend.session.SessionManager;
import com.litesql.transport.LineWriter;

/**
 * 行模式文本控制台（可直接用 telnet / nc 连接），输出统一使用 CRLF。
 */
public class ConsoleServer extends SocketServer {

    static final String BANNER = "\r\nLiteSQL console\r\n"
            + "Dot commands: .help  | SQL: type statements directly\r\n"
            + "Files: .read init.sql  |  .import --csv --skip 1 data.csv mytable\r\n\r\n";

    static final String PROMPT = "sqlite> ";

    private final SessionManager sessionManager;
    private final BatchExecutor executor;
    private final int lineMax;
    private final Path fileRoot;
    private final long readMaxBytes;

    public ConsoleServer(int port, int maxClients, int lineMax, Path fileRoot, long readMaxBytes,
                         SessionManager sessionManager, BatchExecutor executor) {
        super("console", port, maxClients);
        this.sessionManager = sessionManager;
        this.executor = executor;
        this.lineMax = lineMax;
        this.fileRoot = fileRoot;
        this.readMaxBytes = readMaxBytes;
    }

    @Override
    protected void handle(Socket socket, String remote) throws IOException {
        LineWriter out = new LineWriter(socket.getOutputStream(), LineWriter.CRLF);
        Session session = sessionManager.open(Session.Kind.CONSOLE, remote);
        try {
            ConsoleCommandProcessor processor = new ConsoleCommandProcessor(session, executor, out, fileRoot, readMaxBytes);
            LineEditor editor = new LineEditor(socket.getInputStream(), out, lineMax);
            out.write(BANNER);
            while(true) {
                out.write(PROMPT);
                out.flush();
                String line = editor.readLine(session.getConsoleOptions().isEcho());
                if(line == null || !processor.process(line)) {
                    break;
                }
            }
            out.flush();
        } finally {
            sessionManager.close(session);
        }
    }

    @Override
    protected void reject(Socket socket) throws IOException {
        new LineWriter(socket.getOutputStream(), LineWriter.CRLF).sendLine("ERR: too many console clients");
    }
}
