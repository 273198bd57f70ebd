package com.litesql.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "litesql")
public class LiteSqlProperties {

    private final Engine engine = new Engine();
    private final Http http = new Http();
    private final Tcp tcp = new Tcp();
    private final Console console = new Console();

    public Engine getEngine() {
        return engine;
    }

    public Http getHttp() {
        return http;
    }

    public Tcp getTcp() {
        return tcp;
    }

    public Console getConsole() {
        return console;
    }

    public static class Engine {

        /**
         * 数据库文件路径，{@code :memory:} 表示内存库
         */
        private String path = "data/litesql.db";

        /**
         * 引擎内部遇到文件锁冲突时的重试时长（毫秒）
         */
        private int busyTimeout = 2000;

        /**
         * 等待进程内引擎锁的上限（毫秒），超时返回 busy
         */
        private long lockTimeout = 5000;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getBusyTimeout() {
            return busyTimeout;
        }

        public void setBusyTimeout(int busyTimeout) {
            this.busyTimeout = busyTimeout;
        }

        public long getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(long lockTimeout) {
            this.lockTimeout = lockTimeout;
        }
    }

    public static class Http {

        /**
         * POST /sql 请求体上限（字节）
         */
        private int maxBodyBytes = 64 * 1024;

        public int getMaxBodyBytes() {
            return maxBodyBytes;
        }

        public void setMaxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
        }
    }

    public static class Tcp {

        private boolean enabled = true;
        private int port = 5555;
        private int maxClients = 8;
        private int maxStatementsPerSession = 8;

        /**
         * 单行请求上限（字节）
         */
        private int rxLineMax = 8192;

        /**
         * 单行响应上限（字符），超出返回 413
         */
        private int txLineMax = 65536;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getMaxClients() {
            return maxClients;
        }

        public void setMaxClients(int maxClients) {
            this.maxClients = maxClients;
        }

        public int getMaxStatementsPerSession() {
            return maxStatementsPerSession;
        }

        public void setMaxStatementsPerSession(int maxStatementsPerSession) {
            this.maxStatementsPerSession = maxStatementsPerSession;
        }

        public int getRxLineMax() {
            return rxLineMax;
        }

        public void setRxLineMax(int rxLineMax) {
            this.rxLineMax = rxLineMax;
        }

        public int getTxLineMax() {
            return txLineMax;
        }

        public void setTxLineMax(int txLineMax) {
            this.txLineMax = txLineMax;
        }
    }

    public static class Console {

        private boolean enabled = true;
        private int port = 2323;
        private int maxClients = 4;

        /**
         * 新会话默认是否回显输入
         */
        private boolean echo = true;
        private int lineMax = 4096;

        /**
         * .read / .import 的相对路径基准目录
         */
        private String fileRoot = "data";
        private long readMaxBytes = 256 * 1024;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getMaxClients() {
            return maxClients;
        }

        public void setMaxClients(int maxClients) {
            this.maxClients = maxClients;
        }

        public boolean isEcho() {
            return echo;
        }

        public void setEcho(boolean echo) {
            this.echo = echo;
        }

        public int getLineMax() {
            return lineMax;
        }

        public void setLineMax(int lineMax) {
            this.lineMax = lineMax;
        }

        public String getFileRoot() {
            return fileRoot;
        }

        public void setFileRoot(String fileRoot) {
            this.fileRoot = fileRoot;
        }

        public long getReadMaxBytes() {
            return readMaxBytes;
        }

        public void setReadMaxBytes(long readMaxBytes) {
            this.readMaxBytes = readMaxBytes;
        }
    }
}
