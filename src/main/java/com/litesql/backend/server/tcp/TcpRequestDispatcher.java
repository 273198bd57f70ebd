package com.litesql.backend.server.tcp;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.litesql.backend.engine.BindValue;
import com.litesql.backend.engine.ChangeSummary;
import com.litesql.backend.engine.EngineHandle;
import com.litesql.backend.engine.Value;
import com.litesql.backend.registry.PrepareResult;
import com.litesql.backend.registry.StatementRegistry;
import com.litesql.backend.registry.StepResult;
import com.litesql.backend.session.Session;
import com.litesql.common.EngineException;
import com.litesql.common.ErrorCode;
import com.litesql.common.LiteSqlException;
import com.litesql.common.ProtocolException;

/**
 * sqlite-tcp-v1 协议的请求分发：一行 JSON 请求 → 一个 JSON 响应对象。
 * <p>
 * 成功：{@code {"ok":true, ...}}；失败：{@code {"ok":false,"error":{"code":N,"message":"..."}}}。
 * 任何错误都只影响当前请求，不会导致连接关闭。
 */
public class TcpRequestDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(TcpRequestDispatcher.class);

    public static final String PROTOCOL = "sqlite-tcp-v1";

    private final EngineHandle engine;

    public TcpRequestDispatcher(EngineHandle engine) {
        this.engine = engine;
    }

    public JsonObject greeting() {
        JsonObject hello = ok();
        hello.addProperty("hello", PROTOCOL);
        return hello;
    }

    /**
     * 处理一行请求，永远返回一个响应对象。
     */
    public JsonObject dispatch(Session session, String line) {
        try {
            JsonObject req = parse(line);
            String op = getString(req, "op");
            if(op == null) {
                throw new ProtocolException("missing op");
            }
            switch (op) {
                case "ping":
                    return ping();
                case "exec":
                    return exec(req);
                case "prepare":
                    return prepare(session.getRegistry(), req);
                case "bind":
                    return bind(session.getRegistry(), req);
                case "step":
                    return step(session.getRegistry(), req);
                case "reset":
                    return reset(session.getRegistry(), req);
                case "finalize":
                    return finalizeStatement(session.getRegistry(), req);
                default:
                    return error(ErrorCode.NOT_IMPLEMENTED, "unknown op");
            }
        } catch (EngineException e) {
            LOGGER.debug("[{}] engine error: {}", session.clientId(), e.getMessage());
            return error(e.getCode(), "sqlite rc=" + e.getResultCode() + ": " + e.getMessage());
        } catch (LiteSqlException e) {
            return error(e.getCode(), e.getMessage());
        } catch (IOException e) {
            LOGGER.warn("[{}] request failed: {}", session.clientId(), e.getMessage());
            return error(ErrorCode.ENGINE_ERROR, e.getMessage());
        }
    }

    public static JsonObject error(int code, String message) {
        JsonObject root = new JsonObject();
        root.addProperty("ok", false);
        JsonObject err = new JsonObject();
        err.addProperty("code", code);
        err.addProperty("message", message == null ? "error" : message);
        root.add("error", err);
        return root;
    }

    private JsonObject ping() throws LiteSqlException, IOException {
        // 走一遍锁，引擎忙时 ping 也会报 503
        engine.withExclusiveAccess(conn -> null);
        JsonObject resp = ok();
        resp.addProperty("pong", true);
        return resp;
    }

    private JsonObject exec(JsonObject req) throws LiteSqlException, IOException {
        String sql = requireSql(req);
        ChangeSummary summary = engine.withExclusiveAccess(conn -> {
            conn.exec(sql);
            return conn.changes();
        });
        JsonObject resp = ok();
        resp.addProperty("changes", summary.getChanges());
        resp.addProperty("total_changes", summary.getTotalChanges());
        resp.addProperty("last_insert_rowid", summary.getLastInsertRowid());
        return resp;
    }

    private JsonObject prepare(StatementRegistry registry, JsonObject req) throws LiteSqlException {
        String sql = requireSql(req);
        PrepareResult result = registry.prepare(sql);
        JsonObject resp = ok();
        resp.addProperty("stmt", result.getStmtId());
        resp.addProperty("cols", result.getColumnCount());
        JsonArray names = new JsonArray();
        for (String name : result.getColumnNames()) {
            names.add(name);
        }
        resp.add("col_names", names);
        return resp;
    }

    private JsonObject bind(StatementRegistry registry, JsonObject req) throws LiteSqlException {
        Integer stmt = getInt(req, "stmt");
        Integer index = getInt(req, "index");
        String type = getString(req, "type");
        if(stmt == null || index == null || type == null) {
            throw new ProtocolException("missing stmt/index/type");
        }
        BindValue value = BindValue.from(type, toJava(req.get("value")));
        registry.bind(stmt, index, value);
        return ok();
    }

    private JsonObject step(StatementRegistry registry, JsonObject req) throws LiteSqlException {
        int stmt = requireStmt(req);
        StepResult result = registry.step(stmt);
        JsonObject resp = ok();
        if(result.isDone()) {
            resp.addProperty("done", true);
            return resp;
        }
        JsonArray row = new JsonArray();
        JsonArray types = new JsonArray();
        List<Value> values = result.getRow();
        for (Value v : values) {
            types.add(v.getType().tag());
            if(v.isNull()) {
                row.add(JsonNull.INSTANCE);
            } else {
                row.add(v.asText());
            }
        }
        resp.add("row", row);
        resp.add("types", types);
        return resp;
    }

    private JsonObject reset(StatementRegistry registry, JsonObject req) throws LiteSqlException {
        int stmt = requireStmt(req);
        boolean clear = true;
        JsonElement flag = req.get("clear_binds");
        if(flag != null && flag.isJsonPrimitive() && flag.getAsJsonPrimitive().isBoolean()) {
            clear = flag.getAsBoolean();
        }
        registry.reset(stmt, clear);
        return ok();
    }

    private JsonObject finalizeStatement(StatementRegistry registry, JsonObject req) throws LiteSqlException {
        int stmt = requireStmt(req);
        registry.finalizeStatement(stmt);
        return ok();
    }

    private static JsonObject parse(String line) throws ProtocolException {
        JsonElement root;
        try {
            root = JsonParser.parseString(line);
        } catch (JsonParseException e) {
            throw new ProtocolException("invalid json");
        }
        if(root == null || !root.isJsonObject()) {
            throw new ProtocolException("invalid json");
        }
        return root.getAsJsonObject();
    }

    private static JsonObject ok() {
        JsonObject resp = new JsonObject();
        resp.addProperty("ok", true);
        return resp;
    }

    private static String requireSql(JsonObject req) throws ProtocolException {
        String sql = getString(req, "sql");
        if(sql == null || sql.isEmpty()) {
            throw new ProtocolException("missing sql");
        }
        return sql;
    }

    private static int requireStmt(JsonObject req) throws ProtocolException {
        Integer stmt = getInt(req, "stmt");
        if(stmt == null) {
            throw new ProtocolException("missing stmt");
        }
        return stmt;
    }

    private static String getString(JsonObject obj, String key) {
        JsonElement e = obj.get(key);
        if(e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) {
            return null;
        }
        return e.getAsString();
    }

    private static Integer getInt(JsonObject obj, String key) {
        JsonElement e = obj.get(key);
        if(e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
            return null;
        }
        return e.getAsInt();
    }

    /**
     * JSON 值 → BindValue.from 能识别的 Java 值：数字、字符串或 null，其他形态原样交给类型检查拒绝。
     */
    private static Object toJava(JsonElement e) {
        if(e == null || e.isJsonNull()) {
            return null;
        }
        if(e.isJsonPrimitive()) {
            JsonPrimitive p = e.getAsJsonPrimitive();
            if(p.isNumber()) {
                return p.getAsNumber();
            }
            if(p.isString()) {
                return p.getAsString();
            }
            return p.getAsBoolean();
        }
        return e;
    }
}
