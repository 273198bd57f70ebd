package com.litesql.transport;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * 面向行的 UTF-8 输出，行尾由调用方决定（TCP 协议用 LF，控制台用 CRLF）。
 */
public class LineWriter {

    public static final String LF = "\n";
    public static final String CRLF = "\r\n";

    private final OutputStream out;
    private final String lineEnding;

    public LineWriter(OutputStream out, String lineEnding) {
        this.out = new BufferedOutputStream(out);
        this.lineEnding = lineEnding;
    }

    public synchronized void write(String text) throws IOException {
        out.write(text.getBytes(StandardCharsets.UTF_8));
    }

    public synchronized void writeRaw(byte[] bytes, int off, int len) throws IOException {
        out.write(bytes, off, len);
    }

    public synchronized void writeLine(String line) throws IOException {
        write(line);
        write(lineEnding);
    }

    /** 写一行并立即刷出 */
    public synchronized void sendLine(String line) throws IOException {
        writeLine(line);
        out.flush();
    }

    public synchronized void flush() throws IOException {
        out.flush();
    }

    public String getLineEnding() {
        return lineEnding;
    }
}
