package com.litesql.api.service;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;

import javax.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import com.google.gson.stream.JsonWriter;
import com.litesql.backend.engine.Value;
import com.litesql.backend.executor.BatchExecutor;
import com.litesql.backend.executor.MutationOutcome;
import com.litesql.backend.executor.QueryOutcome;
import com.litesql.backend.executor.StatementOutcome;
import com.litesql.common.LiteSqlException;
import com.litesql.common.LockTimeoutException;

/**
 * POST /sql 的执行与流式输出。
 * <p>
 * 响应体 {@code {"results":[...],"error":null|"..."}} 在持有引擎锁期间逐条写出，
 * 每写完一条语句的结果就 flush 一次，不在内存中拼装完整结果。
 */
@Service
public class SqlService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqlService.class);

    private final BatchExecutor executor;

    public SqlService(BatchExecutor executor) {
        this.executor = executor;
    }

    /**
     * 执行 SQL 并把结果流式写入响应。等不到引擎锁时返回 503，响应体同样是结果信封。
     */
    public void execute(String sql, String clientId, HttpServletResponse response) throws IOException {
        LOGGER.info("[{}] executing batch ({} chars)", clientId, sql.length());
        try {
            executor.execute(sql, result -> {
                JsonWriter writer = open(response, HttpServletResponse.SC_OK);
                writer.beginObject();
                writer.name("results").beginArray();
                while(result.hasNext()) {
                    writeOutcome(writer, result.next());
                    writer.flush();
                }
                writer.endArray();
                writer.name("error");
                if(result.hasError()) {
                    LOGGER.info("[{}] batch stopped: {}", clientId, result.error().getMessage());
                    writer.value(result.error().getMessage());
                } else {
                    writer.nullValue();
                }
                writer.endObject();
                writer.flush();
                return null;
            });
        } catch (LockTimeoutException e) {
            LOGGER.warn("[{}] {}", clientId, e.getMessage());
            writeError(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, e.getMessage());
        } catch (LiteSqlException e) {
            LOGGER.error("[{}] batch failed", clientId, e);
            if(response.isCommitted()) {
                throw new IOException(e.getMessage(), e);
            }
            writeError(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    /**
     * 没有任何结果的错误信封。
     */
    public void writeError(HttpServletResponse response, int status, String message) throws IOException {
        JsonWriter writer = open(response, status);
        writer.beginObject();
        writer.name("results").beginArray().endArray();
        writer.name("error").value(message);
        writer.endObject();
        writer.flush();
    }

    private JsonWriter open(HttpServletResponse response, int status) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        JsonWriter writer = new JsonWriter(new OutputStreamWriter(response.getOutputStream(), StandardCharsets.UTF_8));
        writer.setSerializeNulls(true);
        return writer;
    }

    private void writeOutcome(JsonWriter writer, StatementOutcome outcome) throws IOException {
        writer.beginObject();
        if(outcome.isQuery()) {
            QueryOutcome query = (QueryOutcome) outcome;
            writer.name("type").value("select");
            writer.name("columns").beginArray();
            for (String column : query.getColumns()) {
                writer.value(column);
            }
            writer.endArray();
            writer.name("rows").beginArray();
            Iterator<List<Value>> rows = query.rows();
            while(rows.hasNext()) {
                writer.beginArray();
                for (Value value : rows.next()) {
                    writeValue(writer, value);
                }
                writer.endArray();
            }
            writer.endArray();
        } else {
            MutationOutcome mutation = (MutationOutcome) outcome;
            writer.name("type").value("ok");
            writer.name("changes").value(mutation.getChanges());
            writer.name("last_insert_rowid").value(mutation.getLastInsertRowid());
        }
        writer.endObject();
    }

    private void writeValue(JsonWriter writer, Value value) throws IOException {
        switch (value.getType()) {
            case NULL:
                writer.nullValue();
                break;
            case INTEGER:
                writer.value(value.asLong());
                break;
            case FLOAT:
                double d = value.asDouble();
                // JSON 没有 Infinity
                if(Double.isFinite(d)) {
                    writer.value(d);
                } else {
                    writer.value(value.asText());
                }
                break;
            default:
                writer.value(value.asText());
                break;
        }
    }
}
