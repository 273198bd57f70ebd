package com.litesql.api.entity.request;

import javax.validation.constraints.NotBlank;

public class SqlExecRequest {

    /**
     * 一条或多条以分号分隔的 SQL
     */
    @NotBlank(message = "missing sql")
    private String sql;

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }
}
