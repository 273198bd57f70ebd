package com.litesql.api.controller;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import javax.validation.ConstraintViolation;
import javax.validation.Validator;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import com.google.common.io.ByteStreams;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.litesql.api.config.LiteSqlProperties;
import com.litesql.api.entity.request.SqlExecRequest;
import com.litesql.api.service.SqlService;

/**
 * {@code POST /sql}：一次请求执行一批 SQL。
 * <p>
 * 请求体自己读取（限制大小）并用 Gson 解析，响应由 {@link SqlService} 直接流式写出。
 */
@RestController
public class SqlController {

    private final SqlService sqlService;
    private final Validator validator;
    private final int maxBodyBytes;
    private final Gson gson = new Gson();

    public SqlController(SqlService sqlService, Validator validator, LiteSqlProperties properties) {
        this.sqlService = sqlService;
        this.validator = validator;
        this.maxBodyBytes = properties.getHttp().getMaxBodyBytes();
    }

    @PostMapping("/sql")
    public void execute(HttpServletRequest request, HttpServletResponse response) throws IOException {
        String contentType = request.getContentType();
        if(contentType == null
                || !contentType.toLowerCase(Locale.ROOT).startsWith(MediaType.APPLICATION_JSON_VALUE)) {
            sqlService.writeError(response, HttpServletResponse.SC_BAD_REQUEST, "content-type must be application/json");
            return;
        }
        if(request.getContentLengthLong() > maxBodyBytes) {
            sqlService.writeError(response, HttpServletResponse.SC_BAD_REQUEST, "body too large");
            return;
        }
        byte[] body;
        try {
            body = ByteStreams.toByteArray(ByteStreams.limit(request.getInputStream(), maxBodyBytes + 1L));
        } catch (IOException e) {
            sqlService.writeError(response, HttpServletResponse.SC_BAD_REQUEST, "cannot read body");
            return;
        }
        if(body.length > maxBodyBytes) {
            sqlService.writeError(response, HttpServletResponse.SC_BAD_REQUEST, "body too large");
            return;
        }
        SqlExecRequest req;
        try {
            req = gson.fromJson(new String(body, StandardCharsets.UTF_8), SqlExecRequest.class);
        } catch (JsonParseException e) {
            sqlService.writeError(response, HttpServletResponse.SC_BAD_REQUEST, "invalid json");
            return;
        }
        if(req == null) {
            sqlService.writeError(response, HttpServletResponse.SC_BAD_REQUEST, "invalid json");
            return;
        }
        Set<ConstraintViolation<SqlExecRequest>> violations = validator.validate(req);
        if(!violations.isEmpty()) {
            sqlService.writeError(response, HttpServletResponse.SC_BAD_REQUEST,
                    violations.iterator().next().getMessage());
            return;
        }
        sqlService.execute(req.getSql(), request.getRemoteAddr(), response);
    }
}
