package com.litesql.backend.session;

/**
 * 控制台会话的显示选项，每个会话各自一份，互不影响。
 */
public class ConsoleOptions {

    private boolean headers = true;
    private boolean echo;
    private OutputMode mode = OutputMode.LIST;
    private String separator = "|";
    private String nullValue = "NULL";

    public ConsoleOptions(boolean echo) {
        this.echo = echo;
    }

    public boolean isHeaders() {
        return headers;
    }

    public void setHeaders(boolean headers) {
        this.headers = headers;
    }

    public boolean isEcho() {
        return echo;
    }

    public void setEcho(boolean echo) {
        this.echo = echo;
    }

    public OutputMode getMode() {
        return mode;
    }

    /**
     * 切换到 csv 时分隔符同时改为逗号。
     */
    public void setMode(OutputMode mode) {
        this.mode = mode;
        if(mode == OutputMode.CSV) {
            this.separator = ",";
        }
    }

    public String getSeparator() {
        return separator;
    }

    public void setSeparator(String separator) {
        this.separator = separator;
    }

    /** 列之间实际使用的分隔符，tabs 模式固定为制表符 */
    public String effectiveSeparator() {
        return mode == OutputMode.TABS ? "\t" : separator;
    }

    public String getNullValue() {
        return nullValue;
    }

    public void setNullValue(String nullValue) {
        this.nullValue = nullValue;
    }
}
