package com.litesql.backend.executor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.litesql.backend.engine.EngineHandle;
import com.litesql.backend.engine.LockHolder;
import com.litesql.backend.engine.SqliteEngineConnection;
import com.litesql.backend.engine.Value;
import com.litesql.common.LockTimeoutException;

public class BatchExecutorTest {

    private EngineHandle engine;
    private BatchExecutor executor;

    @Before
    public void setUp() throws Exception {
        engine = EngineHandle.open(SqliteEngineConnection.MEMORY, 2000, Duration.ofMillis(200));
        executor = new BatchExecutor(engine);
    }

    @After
    public void tearDown() {
        engine.close();
    }

    @Test
    public void testOutcomesInOrder() throws Exception {
        List<String> seen = executor.execute(
                "CREATE TABLE t(a, b); INSERT INTO t VALUES(1, 'x'); INSERT INTO t VALUES(2, NULL); SELECT * FROM t ORDER BY a;",
                result -> {
                    List<String> out = new ArrayList<>();
                    while(result.hasNext()) {
                        StatementOutcome outcome = result.next();
                        if(outcome.isQuery()) {
                            QueryOutcome q = (QueryOutcome) outcome;
                            out.add("columns " + q.getColumns());
                            Iterator<List<Value>> rows = q.rows();
                            while(rows.hasNext()) {
                                out.add("row " + rows.next());
                            }
                        } else {
                            MutationOutcome m = (MutationOutcome) outcome;
                            out.add("ok " + m.getChanges() + " " + m.getLastInsertRowid());
                        }
                    }
                    assertNull(result.error());
                    return out;
                });
        assertEquals(Arrays.asList(
                "ok 0 0",
                "ok 1 1",
                "ok 1 2",
                "columns [a, b]",
                "row [int:1, text:x]",
                "row [int:2, null:null]"), seen);
    }

    @Test
    public void testPrepareFailureStopsBatchWithoutRollback() throws Exception {
        int outcomes = executor.execute(
                "CREATE TABLE kept(v); INSERT INTO kept VALUES(1); INSERT INTO missing VALUES(2); INSERT INTO kept VALUES(3);",
                result -> {
                    int n = 0;
                    while(result.hasNext()) {
                        result.next();
                        n++;
                    }
                    assertNotNull(result.error());
                    assertEquals("no such table: missing", result.error().getMessage());
                    return n;
                });
        assertEquals(2, outcomes);
        assertEquals(Arrays.asList(Value.ofLong(1)), column("SELECT v FROM kept"));
    }

    @Test
    public void testStepErrorInsideQueryStopsBatch() throws Exception {
        executor.execute("CREATE TABLE n(v INTEGER); INSERT INTO n VALUES(1), (-9223372036854775808);", result -> {
            while(result.hasNext()) {
                result.next();
            }
            return null;
        });
        executor.execute("SELECT abs(v) FROM n; INSERT INTO n VALUES(99);", result -> {
            QueryOutcome q = (QueryOutcome) result.next();
            Iterator<List<Value>> rows = q.rows();
            assertTrue(rows.hasNext());
            assertEquals(Value.ofLong(1), rows.next().get(0));
            assertFalse(rows.hasNext());
            assertFalse(result.hasNext());
            assertEquals("integer overflow", result.error().getMessage());
            return null;
        });
        assertEquals(2, column("SELECT v FROM n").size());
    }

    @Test
    public void testUnreadRowsDiscardedWhenAdvancing() throws Exception {
        int count = executor.execute("SELECT 1 UNION ALL SELECT 2; SELECT 3;", result -> {
            int n = 0;
            while(result.hasNext()) {
                result.next();
                n++;
            }
            assertNull(result.error());
            return n;
        });
        assertEquals(2, count);
    }

    @Test
    public void testEmptyBatch() throws Exception {
        boolean any = executor.execute(" ; -- nothing\n", BatchResult::hasNext);
        assertFalse(any);
    }

    @Test
    public void testLockTimeoutNeverStartsBatch() throws Exception {
        AtomicBoolean invoked = new AtomicBoolean(false);
        try (LockHolder ignored = LockHolder.hold(engine)) {
            executor.execute("SELECT 1", result -> {
                invoked.set(true);
                return null;
            });
            fail("expected lock timeout");
        } catch (LockTimeoutException e) {
            assertTrue(e.getMessage().startsWith("database busy"));
        }
        assertFalse(invoked.get());
    }

    private List<Value> column(String sql) throws Exception {
        return executor.execute(sql, result -> {
            List<Value> values = new ArrayList<>();
            QueryOutcome q = (QueryOutcome) result.next();
            Iterator<List<Value>> rows = q.rows();
            while(rows.hasNext()) {
                values.add(rows.next().get(0));
            }
            return values;
        });
    }
}
