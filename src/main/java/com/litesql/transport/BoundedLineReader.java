package com.litesql.transport;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import com.litesql.common.ProtocolException;

/**
 * 按 LF 切分的行读取器，单行长度有上限（字节数）。
 * <p>
 * 超长的行会被整行丢弃（一直读到换行为止），然后抛出 {@link ProtocolException}，
 * 连接本身保持可用，下一次调用从下一行开始。
 */
public class BoundedLineReader {

    private final InputStream in;
    private final int maxBytes;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    public BoundedLineReader(InputStream in, int maxBytes) {
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
        this.maxBytes = maxBytes;
    }

    /**
     * 读取一行（不含行尾的 CR/LF）。
     *
     * @return 流结束且没有剩余数据时返回 null
     * @throws ProtocolException 行超过上限
     */
    public String readLine() throws IOException, ProtocolException {
        buffer.reset();
        boolean overflow = false;
        while(true) {
            int b = in.read();
            if(b < 0) {
                if(overflow) {
                    throw new ProtocolException("line too long");
                }
                return buffer.size() == 0 ? null : decode();
            }
            if(b == '\n') {
                if(overflow) {
                    throw new ProtocolException("line too long");
                }
                return decode();
            }
            if(overflow) {
                continue;
            }
            if(buffer.size() >= maxBytes) {
                overflow = true;
                buffer.reset();
                continue;
            }
            buffer.write(b);
        }
    }

    public int getMaxBytes() {
        return maxBytes;
    }

    private String decode() {
        byte[] bytes = buffer.toByteArray();
        int len = bytes.length;
        if(len > 0 && bytes[len - 1] == '\r') {
            len--;
        }
        return new String(bytes, 0, len, StandardCharsets.UTF_8);
    }
}
