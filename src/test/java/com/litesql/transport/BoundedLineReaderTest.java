package com.litesql.transport;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.Test;

import com.google.common.base.Strings;
import com.litesql.common.ProtocolException;

public class BoundedLineReaderTest {

    private static BoundedLineReader reader(String text, int max) {
        return new BoundedLineReader(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), max);
    }

    @Test
    public void testReadsLines() throws Exception {
        BoundedLineReader reader = reader("one\r\ntwo\n\nlast", 16);
        assertEquals("one", reader.readLine());
        assertEquals("two", reader.readLine());
        assertEquals("", reader.readLine());
        assertEquals("last", reader.readLine());
        assertNull(reader.readLine());
    }

    @Test
    public void testOverlongLineDiscardedThenRecovers() throws Exception {
        BoundedLineReader reader = reader(Strings.repeat("x", 40) + "\nok\n", 8);
        try {
            reader.readLine();
            fail("expected line too long");
        } catch (ProtocolException e) {
            assertEquals(400, e.getCode());
            assertEquals("line too long", e.getMessage());
        }
        assertEquals("ok", reader.readLine());
        assertNull(reader.readLine());
    }

    @Test
    public void testUtf8Decoding() throws Exception {
        assertEquals("héllo", reader("héllo\n", 16).readLine());
    }

    @Test
    public void testLineWriterEndings() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        LineWriter writer = new LineWriter(bytes, LineWriter.CRLF);
        writer.writeLine("a");
        writer.sendLine("b");
        assertEquals("a\r\nb\r\n", new String(bytes.toByteArray(), StandardCharsets.UTF_8));
    }
}
