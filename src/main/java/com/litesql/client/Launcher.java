package com.litesql.client;

import java.io.IOException;

import com.litesql.common.LiteSqlException;

/**
 * 命令行客户端入口：{@code Launcher [host] [port]}，默认 127.0.0.1:5555。
 */
public class Launcher {
    public static void main(String[] args) throws IOException, LiteSqlException {
        String host = args.length > 0 ? args[0] : "127.0.0.1";
        int port = args.length > 1 ? Integer.parseInt(args[1]) : 5555;
        LiteSqlClient client = LiteSqlClient.connect(host, port, 30_000);
        Shell shell = new Shell(client);
        shell.run();
    }
}
