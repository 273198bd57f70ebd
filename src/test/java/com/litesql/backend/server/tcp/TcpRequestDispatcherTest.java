package com.litesql.backend.server.tcp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Duration;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.litesql.backend.engine.EngineHandle;
import com.litesql.backend.engine.LockHolder;
import com.litesql.backend.engine.SqliteEngineConnection;
import com.litesql.backend.session.Session;
import com.litesql.backend.session.SessionManager;

public class TcpRequestDispatcherTest {

    private EngineHandle engine;
    private SessionManager sessions;
    private TcpRequestDispatcher dispatcher;
    private Session session;

    @Before
    public void setUp() throws Exception {
        engine = EngineHandle.open(SqliteEngineConnection.MEMORY, 2000, Duration.ofMillis(200));
        sessions = new SessionManager(engine, 2, true);
        dispatcher = new TcpRequestDispatcher(engine);
        session = sessions.open(Session.Kind.TCP, "test");
    }

    @After
    public void tearDown() {
        sessions.closeAll();
        engine.close();
    }

    @Test
    public void testGreeting() {
        JsonObject hello = dispatcher.greeting();
        assertTrue(hello.get("ok").getAsBoolean());
        assertEquals("sqlite-tcp-v1", hello.get("hello").getAsString());
    }

    @Test
    public void testProtocolErrors() {
        assertError(dispatcher.dispatch(session, "{not json"), 400, "invalid json");
        assertError(dispatcher.dispatch(session, "[1,2]"), 400, "invalid json");
        assertError(dispatcher.dispatch(session, "{}"), 400, "missing op");
        assertError(dispatcher.dispatch(session, "{\"op\":\"exec\"}"), 400, "missing sql");
        assertError(dispatcher.dispatch(session, "{\"op\":\"step\"}"), 400, "missing stmt");
        assertError(dispatcher.dispatch(session, "{\"op\":\"bind\",\"stmt\":1}"), 400, "missing stmt/index/type");
        assertError(dispatcher.dispatch(session, "{\"op\":\"vacuum\"}"), 501, "unknown op");
    }

    @Test
    public void testExecReportsChanges() {
        assertTrue(ok("{\"op\":\"exec\",\"sql\":\"CREATE TABLE t(a)\"}").get("ok").getAsBoolean());
        JsonObject resp = ok("{\"op\":\"exec\",\"sql\":\"INSERT INTO t VALUES(1),(2),(3)\"}");
        assertEquals(3, resp.get("changes").getAsInt());
        assertEquals(3, resp.get("total_changes").getAsInt());
        assertEquals(3, resp.get("last_insert_rowid").getAsLong());
    }

    @Test
    public void testExecEngineErrorFormat() {
        JsonObject resp = dispatcher.dispatch(session, "{\"op\":\"exec\",\"sql\":\"SELEC 1\"}");
        assertFalse(resp.get("ok").getAsBoolean());
        JsonObject err = resp.getAsJsonObject("error");
        assertEquals(500, err.get("code").getAsInt());
        assertEquals("sqlite rc=1: near \"SELEC\": syntax error", err.get("message").getAsString());
    }

    @Test
    public void testPreparedStatementLifecycle() {
        ok("{\"op\":\"exec\",\"sql\":\"CREATE TABLE p(i INTEGER, d REAL, s TEXT, b BLOB)\"}");
        ok("{\"op\":\"exec\",\"sql\":\"INSERT INTO p VALUES(7, 1.5, 'hi', x'0102')\"}");

        JsonObject prepared = ok("{\"op\":\"prepare\",\"sql\":\"SELECT i, d, s, b, NULL AS n FROM p WHERE i = ?\"}");
        int stmt = prepared.get("stmt").getAsInt();
        assertEquals(1, stmt);
        assertEquals(5, prepared.get("cols").getAsInt());
        assertEquals("n", prepared.getAsJsonArray("col_names").get(4).getAsString());

        ok("{\"op\":\"bind\",\"stmt\":1,\"index\":1,\"type\":\"int\",\"value\":7}");
        JsonObject row = ok("{\"op\":\"step\",\"stmt\":1}");
        JsonArray values = row.getAsJsonArray("row");
        assertEquals("7", values.get(0).getAsString());
        assertEquals("1.5", values.get(1).getAsString());
        assertEquals("hi", values.get(2).getAsString());
        assertEquals("AQI=", values.get(3).getAsString());
        assertTrue(values.get(4).isJsonNull());
        JsonArray types = row.getAsJsonArray("types");
        assertEquals("[\"int\",\"double\",\"text\",\"blob\",\"null\"]", types.toString());

        assertTrue(ok("{\"op\":\"step\",\"stmt\":1}").get("done").getAsBoolean());

        ok("{\"op\":\"reset\",\"stmt\":1}");
        // 绑定已清除，i = NULL 不会匹配
        assertTrue(ok("{\"op\":\"step\",\"stmt\":1}").get("done").getAsBoolean());

        ok("{\"op\":\"finalize\",\"stmt\":1}");
        assertError(dispatcher.dispatch(session, "{\"op\":\"finalize\",\"stmt\":1}"), 404, "stmt not found: 1");
    }

    @Test
    public void testResetKeepsBindingsWhenAsked() {
        ok("{\"op\":\"prepare\",\"sql\":\"SELECT ?\"}");
        ok("{\"op\":\"bind\",\"stmt\":1,\"index\":1,\"type\":\"text\",\"value\":\"kept\"}");
        ok("{\"op\":\"step\",\"stmt\":1}");
        ok("{\"op\":\"reset\",\"stmt\":1,\"clear_binds\":false}");
        JsonObject row = ok("{\"op\":\"step\",\"stmt\":1}");
        assertEquals("kept", row.getAsJsonArray("row").get(0).getAsString());
    }

    @Test
    public void testBindTypeMismatch() {
        ok("{\"op\":\"prepare\",\"sql\":\"SELECT ?\"}");
        JsonObject resp = dispatcher.dispatch(session, "{\"op\":\"bind\",\"stmt\":1,\"index\":1,\"type\":\"int\",\"value\":\"x\"}");
        assertEquals(400, resp.getAsJsonObject("error").get("code").getAsInt());
        resp = dispatcher.dispatch(session, "{\"op\":\"bind\",\"stmt\":1,\"index\":1,\"type\":\"blob\",\"value\":\"x\"}");
        assertEquals(400, resp.getAsJsonObject("error").get("code").getAsInt());
    }

    @Test
    public void testSlotExhaustion() {
        ok("{\"op\":\"prepare\",\"sql\":\"SELECT 1\"}");
        ok("{\"op\":\"prepare\",\"sql\":\"SELECT 2\"}");
        JsonObject resp = dispatcher.dispatch(session, "{\"op\":\"prepare\",\"sql\":\"SELECT 3\"}");
        assertError(resp, 409, "no free stmt slots (limit 2)");
        ok("{\"op\":\"finalize\",\"stmt\":2}");
        assertEquals(3, ok("{\"op\":\"prepare\",\"sql\":\"SELECT 3\"}").get("stmt").getAsInt());
    }

    @Test
    public void testEmptyPrepareKeepsConnectionAndSlots() {
        String[] empties = {"{\"op\":\"prepare\",\"sql\":\"-- c\"}", "{\"op\":\"prepare\",\"sql\":\";\"}",
                "{\"op\":\"prepare\",\"sql\":\"   \"}", "{\"op\":\"prepare\",\"sql\":\";\"}"};
        for (String line : empties) {
            assertError(dispatcher.dispatch(session, line), 500, "sqlite rc=1: empty statement");
        }
        JsonObject prepared = ok("{\"op\":\"prepare\",\"sql\":\"SELECT 41 + 1\"}");
        int stmt = prepared.get("stmt").getAsInt();
        JsonObject row = ok("{\"op\":\"step\",\"stmt\":" + stmt + "}");
        assertEquals("42", row.getAsJsonArray("row").get(0).getAsString());
        ok("{\"op\":\"prepare\",\"sql\":\"SELECT 2\"}");
        assertEquals(2, session.getRegistry().size());
        assertTrue(ok("{\"op\":\"exec\",\"sql\":\";\"}").get("ok").getAsBoolean());
    }

    @Test
    public void testPingUnderContention() throws Exception {
        assertTrue(ok("{\"op\":\"ping\"}").get("pong").getAsBoolean());
        try (LockHolder ignored = LockHolder.hold(engine)) {
            JsonObject resp = dispatcher.dispatch(session, "{\"op\":\"ping\"}");
            assertFalse(resp.get("ok").getAsBoolean());
            assertEquals(503, resp.getAsJsonObject("error").get("code").getAsInt());
        }
        assertTrue(ok("{\"op\":\"ping\"}").get("pong").getAsBoolean());
    }

    private JsonObject ok(String line) {
        JsonObject resp = dispatcher.dispatch(session, line);
        assertTrue(resp.toString(), resp.get("ok").getAsBoolean());
        return resp;
    }

    private static void assertError(JsonObject resp, int code, String message) {
        assertFalse(resp.get("ok").getAsBoolean());
        JsonObject err = resp.getAsJsonObject("error");
        assertEquals(code, err.get("code").getAsInt());
        assertEquals(message, err.get("message").getAsString());
    }
}
