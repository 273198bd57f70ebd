package com.litesql.backend.registry;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.litesql.backend.engine.BindValue;
import com.litesql.backend.engine.EngineHandle;
import com.litesql.backend.engine.LockHolder;
import com.litesql.backend.engine.SqliteEngineConnection;
import com.litesql.backend.engine.Value;
import com.litesql.backend.engine.ValueType;
import com.litesql.common.EngineException;
import com.litesql.common.LockTimeoutException;
import com.litesql.common.StatementNotFoundException;
import com.litesql.common.StatementsExhaustedException;
import com.litesql.common.TypeMismatchException;

public class StatementRegistryTest {

    private EngineHandle engine;
    private StatementRegistry registry;

    @Before
    public void setUp() throws Exception {
        engine = EngineHandle.open(SqliteEngineConnection.MEMORY, 2000, Duration.ofMillis(200));
        registry = new StatementRegistry(engine);
    }

    @After
    public void tearDown() {
        registry.releaseAll();
        engine.close();
    }

    @Test
    public void testSelectOneRoundTrip() throws Exception {
        PrepareResult prepared = registry.prepare("SELECT 1");
        assertEquals(1, prepared.getStmtId());
        assertEquals(1, prepared.getColumnCount());
        assertEquals(Collections.singletonList("1"), prepared.getColumnNames());

        StepResult row = registry.step(prepared.getStmtId());
        assertFalse(row.isDone());
        assertEquals(Collections.singletonList(Value.ofLong(1)), row.getRow());
        assertEquals(Collections.singletonList(ValueType.INTEGER), row.getTypes());
        assertEquals("1", row.getRow().get(0).asText());

        assertTrue(registry.step(prepared.getStmtId()).isDone());
        registry.finalizeStatement(prepared.getStmtId());
    }

    @Test
    public void testFinalizeTwiceIsNotFound() throws Exception {
        int id = registry.prepare("SELECT 1").getStmtId();
        registry.finalizeStatement(id);
        try {
            registry.finalizeStatement(id);
            fail("expected not found");
        } catch (StatementNotFoundException e) {
            assertEquals(404, e.getCode());
        }
        try {
            registry.step(id);
            fail("expected not found");
        } catch (StatementNotFoundException e) {
            assertEquals("stmt not found: " + id, e.getMessage());
        }
    }

    @Test
    public void testSlotsExhaustedThenRecovered() throws Exception {
        for (int i = 1; i <= StatementRegistry.DEFAULT_CAPACITY; i++) {
            assertEquals(i, registry.prepare("SELECT " + i).getStmtId());
        }
        try {
            registry.prepare("SELECT 9");
            fail("expected exhausted");
        } catch (StatementsExhaustedException e) {
            assertEquals(409, e.getCode());
        }
        registry.finalizeStatement(3);
        // id 不复用
        assertEquals(9, registry.prepare("SELECT 9").getStmtId());
        assertEquals(StatementRegistry.DEFAULT_CAPACITY, registry.size());
    }

    @Test
    public void testFailedPrepareReleasesSlot() throws Exception {
        try {
            registry.prepare("SELEC nope");
            fail("expected engine error");
        } catch (EngineException e) {
            assertEquals(1, e.getResultCode());
            assertEquals("near \"SELEC\": syntax error", e.getMessage());
        }
        assertEquals(0, registry.size());
        assertEquals(2, registry.prepare("SELECT 2").getStmtId());
    }

    @Test
    public void testEmptyPrepareRejectedAndConnectionStillUsable() throws Exception {
        StatementRegistry small = new StatementRegistry(engine, 2);
        for (String sql : Arrays.asList("", "   ", ";", "-- only a comment", "/* c */ ;", "-- c\n;")) {
            try {
                small.prepare(sql);
                fail("expected engine error for [" + sql + "]");
            } catch (EngineException e) {
                assertEquals("empty statement", e.getMessage());
            }
            assertEquals(0, small.size());
            PrepareResult next = small.prepare("SELECT 1");
            assertEquals(Collections.singletonList(Value.ofLong(1)), small.step(next.getStmtId()).getRow());
            small.finalizeStatement(next.getStmtId());
        }
        // 空语句失败不会占住槽位
        for (int i = 0; i < 3; i++) {
            try {
                small.prepare(";");
                fail("expected engine error");
            } catch (EngineException e) {
                assertEquals(EngineException.GENERIC, e.getResultCode());
            }
        }
        small.prepare("SELECT 1");
        small.prepare("SELECT 2");
        assertEquals(2, small.size());
        small.releaseAll();
    }

    @Test
    public void testPrepareLockTimeoutReleasesSlot() throws Exception {
        try (LockHolder ignored = LockHolder.hold(engine)) {
            registry.prepare("SELECT 1");
            fail("expected lock timeout");
        } catch (LockTimeoutException e) {
            assertEquals(503, e.getCode());
        }
        assertEquals(0, registry.size());
    }

    @Test
    public void testBindTypesAndMismatch() throws Exception {
        int id = registry.prepare("SELECT ?, ?, ?, ?").getStmtId();
        registry.bind(id, 1, BindValue.from("int", 42));
        registry.bind(id, 2, BindValue.from("double", 2.5));
        registry.bind(id, 3, BindValue.from("text", "hi"));
        registry.bind(id, 4, BindValue.from("null", null));
        StepResult row = registry.step(id);
        assertEquals(Arrays.asList(Value.ofLong(42), Value.ofDouble(2.5), Value.ofText("hi"), Value.ofNull()),
                row.getRow());
        assertEquals(Arrays.asList(ValueType.INTEGER, ValueType.FLOAT, ValueType.TEXT, ValueType.NULL),
                row.getTypes());

        try {
            BindValue.from("int", "not a number");
            fail("expected mismatch");
        } catch (TypeMismatchException e) {
            assertEquals(400, e.getCode());
        }
        try {
            BindValue.from("blob", "AAAA");
            fail("expected mismatch");
        } catch (TypeMismatchException e) {
            assertTrue(e.getMessage().contains("blob"));
        }
        try {
            registry.bind(id, 5, BindValue.ofLong(1));
            fail("expected range error");
        } catch (EngineException e) {
            assertEquals(EngineException.RANGE, e.getResultCode());
        }
    }

    @Test
    public void testResetClearsBindingsAndRestarts() throws Exception {
        int id = registry.prepare("SELECT ?").getStmtId();
        registry.bind(id, 1, BindValue.ofText("a"));
        assertEquals(Value.ofText("a"), registry.step(id).getRow().get(0));
        assertTrue(registry.step(id).isDone());
        assertTrue(registry.step(id).isDone());

        registry.reset(id, false);
        assertEquals(Value.ofText("a"), registry.step(id).getRow().get(0));

        registry.reset(id, true);
        assertTrue(registry.step(id).getRow().get(0).isNull());
    }

    @Test
    public void testMutationExecutesOnceUntilReset() throws Exception {
        engine.withExclusiveAccess(conn -> {
            conn.exec("CREATE TABLE counter(n INTEGER)");
            return null;
        });
        int insert = registry.prepare("INSERT INTO counter VALUES(1)").getStmtId();
        assertTrue(registry.step(insert).isDone());
        assertTrue(registry.step(insert).isDone());
        registry.reset(insert, true);
        assertTrue(registry.step(insert).isDone());

        int count = registry.prepare("SELECT count(*) FROM counter").getStmtId();
        assertEquals(Value.ofLong(2), registry.step(count).getRow().get(0));
    }

    @Test
    public void testCommittedWritesVisibleToOtherSession() throws Exception {
        StatementRegistry other = new StatementRegistry(engine);
        engine.withExclusiveAccess(conn -> {
            conn.exec("CREATE TABLE shared(v TEXT)");
            return null;
        });
        int insert = registry.prepare("INSERT INTO shared VALUES(?)").getStmtId();
        registry.bind(insert, 1, BindValue.ofText("from A"));
        assertTrue(registry.step(insert).isDone());

        int select = other.prepare("SELECT v FROM shared").getStmtId();
        assertEquals(Value.ofText("from A"), other.step(select).getRow().get(0));
        other.releaseAll();
        assertEquals(0, other.size());
    }

    @Test
    public void testReleaseAllWithoutLock() throws Exception {
        registry.prepare("SELECT 1");
        registry.prepare("SELECT 2");
        try (LockHolder ignored = LockHolder.hold(engine)) {
            registry.releaseAll();
        }
        assertEquals(0, registry.size());
    }
}
