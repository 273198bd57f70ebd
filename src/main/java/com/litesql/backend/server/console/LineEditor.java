package com.litesql.backend.server.console;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import com.litesql.transport.LineWriter;

/**
 * 控制台的行编辑：逐字节读入，CR 或 LF 结束一行，退格/DEL 删除一个字符。
 * <p>
 * 可打印 ASCII 和 UTF-8 多字节序列被接受，其他控制字节丢弃。
 * 开启回显时输入的字符原样回写，退格回写 {@code "\b \b"}。
 * 紧跟在 CR 之后的 LF 或 NUL 视为同一次回车。
 */
public class LineEditor {

    private static final int BS = 0x08;
    private static final int DEL = 0x7F;

    private final InputStream in;
    private final LineWriter echoOut;
    private final int maxBytes;
    private final ByteArrayOutputStream line = new ByteArrayOutputStream();
    private boolean lastWasCr;

    public LineEditor(InputStream in, LineWriter echoOut, int maxBytes) {
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
        this.echoOut = echoOut;
        this.maxBytes = maxBytes;
    }

    /**
     * 读取一行。回车本身会回写一个换行，以便后续输出从新行开始。
     *
     * @param echo 是否回显输入
     * @return 连接关闭时返回 null
     */
    public String readLine(boolean echo) throws IOException {
        line.reset();
        while(true) {
            int b = in.read();
            if(b < 0) {
                return null;
            }
            if(lastWasCr && (b == '\n' || b == 0)) {
                lastWasCr = false;
                continue;
            }
            lastWasCr = false;
            if(b == '\r' || b == '\n') {
                lastWasCr = b == '\r';
                echoOut.write(echoOut.getLineEnding());
                echoOut.flush();
                return new String(line.toByteArray(), StandardCharsets.UTF_8);
            }
            if(b == BS || b == DEL) {
                if(eraseLast() && echo) {
                    echoOut.write("\b \b");
                    echoOut.flush();
                }
                continue;
            }
            if(!accepts(b) || line.size() >= maxBytes) {
                continue;
            }
            line.write(b);
            if(echo) {
                echoOut.writeRaw(new byte[]{(byte) b}, 0, 1);
                if(in.available() == 0) {
                    echoOut.flush();
                }
            }
        }
    }

    private static boolean accepts(int b) {
        return (b >= 0x20 && b < DEL) || b >= 0x80;
    }

    /**
     * 删除最后一个字符（UTF-8 下是一个完整的码点）。
     */
    private boolean eraseLast() {
        byte[] bytes = line.toByteArray();
        int end = bytes.length;
        if(end == 0) {
            return false;
        }
        int cut = end - 1;
        while(cut > 0 && (bytes[cut] & 0xC0) == 0x80) {
            cut--;
        }
        line.reset();
        line.write(bytes, 0, cut);
        return true;
    }
}
