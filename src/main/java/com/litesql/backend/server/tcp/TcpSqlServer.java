package com.litesql.backend.server.tcp;

import java.io.IOException;
import java.net.Socket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.litesql.backend.server.SocketServer;
import com.litesql.backend.session.Session;
import com.litesql.backend.session.SessionManager;
import com.litesql.common.ErrorCode;
import com.litesql.common.ProtocolException;
import com.litesql.transport.BoundedLineReader;
import com.litesql.transport.LineWriter;

/**
 * sqlite-tcp-v1 服务器：连接建立后先发问候行，之后每收到一行请求回一行响应。
 */
public class TcpSqlServer extends SocketServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TcpSqlServer.class);

    public static final int DEFAULT_RX_LINE_MAX = 8192;
    public static final int DEFAULT_TX_LINE_MAX = 65536;

    private final Gson gson = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
    private final SessionManager sessionManager;
    private final TcpRequestDispatcher dispatcher;
    private final int rxLineMax;
    private final int txLineMax;

    public TcpSqlServer(int port, int maxClients, int rxLineMax, int txLineMax,
                        SessionManager sessionManager, TcpRequestDispatcher dispatcher) {
        super("tcp", port, maxClients);
        this.sessionManager = sessionManager;
        this.dispatcher = dispatcher;
        this.rxLineMax = rxLineMax;
        this.txLineMax = txLineMax;
    }

    @Override
    protected void handle(Socket socket, String remote) throws IOException {
        BoundedLineReader reader = new BoundedLineReader(socket.getInputStream(), rxLineMax);
        LineWriter writer = new LineWriter(socket.getOutputStream(), LineWriter.LF);
        Session session = sessionManager.open(Session.Kind.TCP, remote);
        try {
            send(writer, dispatcher.greeting());
            while(true) {
                String line;
                try {
                    line = reader.readLine();
                } catch (ProtocolException e) {
                    send(writer, TcpRequestDispatcher.error(e.getCode(), e.getMessage()));
                    continue;
                }
                if(line == null) {
                    break;
                }
                if(line.trim().isEmpty()) {
                    continue;
                }
                send(writer, dispatcher.dispatch(session, line));
            }
        } finally {
            sessionManager.close(session);
        }
    }

    @Override
    protected void reject(Socket socket) throws IOException {
        LineWriter writer = new LineWriter(socket.getOutputStream(), LineWriter.LF);
        writer.sendLine(gson.toJson(TcpRequestDispatcher.error(ErrorCode.BUSY, "too many clients")));
    }

    /**
     * 序列化后超过发送上限的响应替换为 413 错误。
     */
    private void send(LineWriter writer, JsonObject response) throws IOException {
        String line = gson.toJson(response);
        if(line.length() > txLineMax) {
            LOGGER.debug("response of {} chars exceeds tx limit {}", line.length(), txLineMax);
            line = gson.toJson(TcpRequestDispatcher.error(ErrorCode.PAYLOAD_TOO_LARGE, "response too large"));
        }
        writer.sendLine(line);
    }
}
