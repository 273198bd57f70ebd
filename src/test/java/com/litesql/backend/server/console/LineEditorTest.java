package com.litesql.backend.server.console;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.Test;

import com.litesql.transport.LineWriter;

public class LineEditorTest {

    private final ByteArrayOutputStream echoed = new ByteArrayOutputStream();

    private LineEditor editor(byte[] input, int max) {
        return new LineEditor(new ByteArrayInputStream(input), new LineWriter(echoed, LineWriter.CRLF), max);
    }

    private LineEditor editor(String input) {
        return editor(input.getBytes(StandardCharsets.UTF_8), 64);
    }

    private String echoed() {
        return new String(echoed.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testLineEndings() throws IOException {
        LineEditor editor = editor("a\r\nb\r\0c\nd\re\n");
        assertEquals("a", editor.readLine(false));
        assertEquals("b", editor.readLine(false));
        assertEquals("c", editor.readLine(false));
        assertEquals("d", editor.readLine(false));
        assertEquals("e", editor.readLine(false));
        assertNull(editor.readLine(false));
        // 回车本身总会换行
        assertEquals("\r\n\r\n\r\n\r\n\r\n", echoed());
    }

    @Test
    public void testEchoAndBackspace() throws IOException {
        LineEditor editor = editor("selx\bect 2\u007f1\r\n");
        assertEquals("select 1", editor.readLine(true));
        assertEquals("selx\b \bect 2\b \b1\r\n", echoed());
    }

    @Test
    public void testBackspaceOnEmptyLineIsSilent() throws IOException {
        LineEditor editor = editor("\b\bok\n");
        assertEquals("ok", editor.readLine(true));
        assertEquals("ok\r\n", echoed());
    }

    @Test
    public void testNoEcho() throws IOException {
        LineEditor editor = editor("secret\b!\n");
        assertEquals("secre!", editor.readLine(false));
        assertEquals("\r\n", echoed());
    }

    @Test
    public void testControlBytesDropped() throws IOException {
        LineEditor editor = editor("a\u0001b\u001b[Ac\tz\n");
        assertEquals("ab[Acz", editor.readLine(false));
    }

    @Test
    public void testBackspaceRemovesWholeCodePoint() throws IOException {
        LineEditor editor = editor("café\bè\n");
        assertEquals("cafè", editor.readLine(false));
    }

    @Test
    public void testLengthCap() throws IOException {
        LineEditor editor = editor("abcdefgh\n".getBytes(StandardCharsets.US_ASCII), 4);
        assertEquals("abcd", editor.readLine(false));
    }

    @Test
    public void testEofWithoutNewline() throws IOException {
        assertNull(editor("partial").readLine(false));
    }
}
