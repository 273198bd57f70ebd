package com.litesql.client;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.litesql.common.ErrorCode;
import com.litesql.common.LiteSqlException;
import com.litesql.common.ProtocolException;
import com.litesql.transport.BoundedLineReader;
import com.litesql.transport.LineWriter;

/**
 * sqlite-tcp-v1 协议客户端，一个请求一行、一个响应一行。
 * 服务端返回 {@code ok:false} 时抛出携带服务端错误码的 {@link LiteSqlException}。
 */
public class LiteSqlClient implements AutoCloseable {

    private static final int RESPONSE_LINE_MAX = 1 << 20;

    private final Socket socket;
    private final BoundedLineReader reader;
    private final LineWriter writer;
    private final Gson gson = new Gson();
    private final String protocol;

    private LiteSqlClient(Socket socket) throws IOException, LiteSqlException {
        this.socket = socket;
        this.reader = new BoundedLineReader(socket.getInputStream(), RESPONSE_LINE_MAX);
        this.writer = new LineWriter(socket.getOutputStream(), LineWriter.LF);
        JsonObject hello = expectOk(readResponse());
        this.protocol = hello.has("hello") ? hello.get("hello").getAsString() : null;
    }

    /**
     * 建立连接并读取问候行。
     */
    public static LiteSqlClient connect(String host, int port, int timeoutMs) throws IOException, LiteSqlException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), timeoutMs);
            socket.setSoTimeout(timeoutMs);
            return new LiteSqlClient(socket);
        } catch (IOException | LiteSqlException e) {
            socket.close();
            throw e;
        }
    }

    public String getProtocol() {
        return protocol;
    }

    public void ping() throws IOException, LiteSqlException {
        JsonObject req = new JsonObject();
        req.addProperty("op", "ping");
        roundTrip(req);
    }

    /**
     * @return 包含 changes / total_changes / last_insert_rowid 的响应
     */
    public JsonObject exec(String sql) throws IOException, LiteSqlException {
        JsonObject req = new JsonObject();
        req.addProperty("op", "exec");
        req.addProperty("sql", sql);
        return roundTrip(req);
    }

    /**
     * @return 包含 stmt / cols / col_names 的响应
     */
    public JsonObject prepare(String sql) throws IOException, LiteSqlException {
        JsonObject req = new JsonObject();
        req.addProperty("op", "prepare");
        req.addProperty("sql", sql);
        return roundTrip(req);
    }

    /**
     * @param type  null | int | double | text
     * @param value Number / String，type 为 null 时忽略
     */
    public void bind(int stmt, int index, String type, Object value) throws IOException, LiteSqlException {
        JsonObject req = new JsonObject();
        req.addProperty("op", "bind");
        req.addProperty("stmt", stmt);
        req.addProperty("index", index);
        req.addProperty("type", type);
        if(value instanceof Number) {
            req.addProperty("value", (Number) value);
        } else if(value != null) {
            req.addProperty("value", value.toString());
        }
        roundTrip(req);
    }

    /**
     * @return 一行（row + types）或 done:true
     */
    public JsonObject step(int stmt) throws IOException, LiteSqlException {
        return roundTrip(stmtRequest("step", stmt));
    }

    public void reset(int stmt, boolean clearBinds) throws IOException, LiteSqlException {
        JsonObject req = stmtRequest("reset", stmt);
        req.addProperty("clear_binds", clearBinds);
        roundTrip(req);
    }

    public void finalizeStatement(int stmt) throws IOException, LiteSqlException {
        roundTrip(stmtRequest("finalize", stmt));
    }

    /**
     * prepare → step 直到 done → finalize，收集全部行（值保持服务端给出的文本形式）。
     */
    public QueryResult query(String sql) throws IOException, LiteSqlException {
        return fetchAll(prepare(sql));
    }

    /**
     * 对已 prepare 的语句一直 step 到 done，最后 finalize。
     *
     * @param prepared prepare 的响应
     */
    public QueryResult fetchAll(JsonObject prepared) throws IOException, LiteSqlException {
        int stmt = prepared.get("stmt").getAsInt();
        try {
            List<String> columns = new ArrayList<>();
            for (JsonElement name : prepared.getAsJsonArray("col_names")) {
                columns.add(name.getAsString());
            }
            List<List<String>> rows = new ArrayList<>();
            while(true) {
                JsonObject resp = step(stmt);
                if(resp.has("done")) {
                    break;
                }
                JsonArray row = resp.getAsJsonArray("row");
                List<String> values = new ArrayList<>(row.size());
                for (JsonElement v : row) {
                    values.add(v.isJsonNull() ? null : v.getAsString());
                }
                rows.add(values);
            }
            return new QueryResult(columns, rows);
        } finally {
            finalizeStatement(stmt);
        }
    }

    /**
     * 发送请求并读取响应；ok:false 转为异常。
     */
    public JsonObject roundTrip(JsonObject request) throws IOException, LiteSqlException {
        writer.sendLine(gson.toJson(request));
        return expectOk(readResponse());
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    private JsonObject stmtRequest(String op, int stmt) {
        JsonObject req = new JsonObject();
        req.addProperty("op", op);
        req.addProperty("stmt", stmt);
        return req;
    }

    private JsonObject readResponse() throws IOException, ProtocolException {
        String line = reader.readLine();
        if(line == null) {
            throw new IOException("server closed connection");
        }
        try {
            return JsonParser.parseString(line).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new ProtocolException("invalid response: " + line);
        }
    }

    private static JsonObject expectOk(JsonObject resp) throws LiteSqlException {
        if(resp.has("ok") && resp.get("ok").getAsBoolean()) {
            return resp;
        }
        JsonObject err = resp.has("error") && resp.get("error").isJsonObject()
                ? resp.getAsJsonObject("error") : new JsonObject();
        int code = err.has("code") ? err.get("code").getAsInt() : ErrorCode.ENGINE_ERROR;
        String message = err.has("message") ? err.get("message").getAsString() : "error";
        throw new LiteSqlException(code, message);
    }
}
