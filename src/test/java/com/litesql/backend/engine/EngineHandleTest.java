package com.litesql.backend.engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.litesql.common.EngineException;
import com.litesql.common.ErrorCode;
import com.litesql.common.LockTimeoutException;

public class EngineHandleTest {

    private EngineHandle engine;

    @Before
    public void setUp() throws Exception {
        engine = EngineHandle.open(SqliteEngineConnection.MEMORY, 2000, Duration.ofMillis(200));
    }

    @After
    public void tearDown() {
        engine.close();
    }

    @Test
    public void testCallbackResultReturned() throws Exception {
        String version = engine.withExclusiveAccess(EngineConnection::version);
        assertTrue(version.startsWith("3."));
        assertFalse(engine.isLocked());
    }

    @Test
    public void testLockTimeoutSkipsCallback() throws Exception {
        LockHolder holder = LockHolder.hold(engine);
        AtomicBoolean invoked = new AtomicBoolean(false);
        long start = System.nanoTime();
        try {
            engine.withExclusiveAccess(Duration.ofMillis(100), conn -> {
                invoked.set(true);
                return null;
            });
            fail("expected lock timeout");
        } catch (LockTimeoutException e) {
            assertEquals(ErrorCode.BUSY, e.getCode());
        }
        assertFalse(invoked.get());
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(90));

        holder.close();
        assertEquals(Integer.valueOf(1), engine.withExclusiveAccess(conn -> 1));
    }

    @Test
    public void testLockReleasedWhenCallbackFails() throws Exception {
        try {
            engine.withExclusiveAccess(conn -> {
                conn.exec("this is not sql");
                return null;
            });
            fail("expected engine error");
        } catch (EngineException e) {
            assertEquals(ErrorCode.ENGINE_ERROR, e.getCode());
            assertTrue(e.getMessage().contains("syntax error"));
        }
        assertFalse(engine.isLocked());
        engine.withExclusiveAccess(Duration.ofMillis(10), conn -> null);
    }

    @Test
    public void testStatementLifecycle() throws Exception {
        engine.withExclusiveAccess(conn -> {
            conn.exec("CREATE TABLE t(a INTEGER, b TEXT, c REAL, d BLOB)");
            try (EngineStatement insert = conn.prepare("INSERT INTO t VALUES(?, ?, ?, x'0102')")) {
                assertEquals(0, insert.columnCount());
                assertEquals(3, insert.parameterCount());
                insert.bind(1, BindValue.ofLong(7));
                insert.bind(2, BindValue.ofText("seven"));
                insert.bind(3, BindValue.ofDouble(7.5));
                assertFalse(insert.step());
                // 执行完之后继续 step 仍然是 DONE，不会重复插入
                assertFalse(insert.step());
            }
            ChangeSummary summary = conn.changes();
            assertEquals(1, summary.getChanges());
            assertEquals(1L, summary.getLastInsertRowid());

            try (EngineStatement select = conn.prepare("SELECT a, b AS name, c, d, NULL FROM t")) {
                assertEquals(Arrays.asList("a", "name", "c", "d", "NULL"), select.columnNames());
                assertTrue(select.step());
                List<Value> row = select.currentRow();
                assertEquals(Value.ofLong(7), row.get(0));
                assertEquals(Value.ofText("seven"), row.get(1));
                assertEquals(Value.ofDouble(7.5), row.get(2));
                assertEquals(ValueType.BLOB, row.get(3).getType());
                assertEquals("AQI=", row.get(3).asText());
                assertTrue(row.get(4).isNull());
                assertFalse(select.step());
                select.reset(true);
                assertTrue(select.step());
            }
            return null;
        });
    }

    @Test
    public void testBindIndexOutOfRange() throws Exception {
        engine.withExclusiveAccess(conn -> {
            try (EngineStatement stmt = conn.prepare("SELECT ?")) {
                stmt.bind(2, BindValue.ofLong(1));
                fail("expected range error");
            } catch (EngineException e) {
                assertEquals(EngineException.RANGE, e.getResultCode());
            }
            return null;
        });
    }

    @Test
    public void testBusyTimeoutCanBeChanged() throws Exception {
        int timeout = engine.withExclusiveAccess(conn -> {
            conn.setBusyTimeout(750);
            try (EngineStatement stmt = conn.prepare("PRAGMA busy_timeout")) {
                assertTrue(stmt.step());
                return (int) stmt.currentRow().get(0).asLong();
            }
        });
        assertEquals(750, timeout);
    }

    static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
