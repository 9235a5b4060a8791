package org.netpreserve.sitemirror.ipc;

import org.junit.jupiter.api.Test;
import org.netpreserve.sitemirror.cdp.Cookie;
import org.netpreserve.sitemirror.util.Json;
import org.netpreserve.sitemirror.util.Url;

import java.io.IOException;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

class EnvelopeTest {
    private static final Cookie SESSION = new Cookie("session", "abc", ".notes.test", "/", -1.0, true, true, "Lax");

    private static Message decode(String json) throws ProtocolException {
        return Envelope.decode(json.getBytes(UTF_8));
    }

    @Test
    public void testEnvelopeShape() throws IOException, ProtocolException {
        var download = new Message.Download("w1-1700000000000", new Url("https://notes.test/Lab-1"),
                "a1100000000000000000000000000000", "/tmp/mirror/Week_1/Lab_1/index.html", List.of(SESSION));
        var tree = Json.MAPPER.readTree(Envelope.encode(download));
        assertEquals("DOWNLOAD", tree.get("type").asText());
        assertEquals("https://notes.test/Lab-1", tree.get("payload").get("url").asText());
        assertEquals("session", tree.get("payload").get("cookies").get(0).get("name").asText());

        assertEquals(download, Envelope.decode(Envelope.encode(download)));
    }

    @Test
    public void testResultPayloads() throws ProtocolException {
        var success = Message.Result.success("t1", new DownloadReport("p1", "/tmp/p1/index.html", 1234, 5));
        var decoded = (Message.Result) Envelope.decode(Envelope.encode(success));
        assertTrue(decoded.isSuccess());
        assertEquals(MessageType.DOWNLOAD, decoded.taskType());
        assertEquals(1234, decoded.data().bytes());

        var failure = Message.Result.failure("t2", ErrorInfo.of(new IllegalStateException("boom")));
        decoded = (Message.Result) Envelope.decode(Envelope.encode(failure));
        assertFalse(decoded.isSuccess());
        assertEquals("java.lang.IllegalStateException", decoded.error().type());
        assertEquals("boom", decoded.error().message());
        assertTrue(decoded.error().stackTrace().contains("EnvelopeTest"));
    }

    @Test
    public void testShutdownNeedsNoPayload() throws ProtocolException {
        assertInstanceOf(Message.Shutdown.class, decode("{\"type\":\"SHUTDOWN\"}"));
        assertInstanceOf(Message.Shutdown.class, Envelope.decode(Envelope.encode(new Message.Shutdown())));
    }

    @Test
    public void testUnknownFieldsAreIgnored() throws ProtocolException {
        var ready = decode("{\"type\":\"READY\",\"payload\":{\"workerId\":\"w1\",\"browserVersion\":\"Chrome/126\",\"pid\":42}}");
        assertEquals(new Message.Ready("w1", "Chrome/126"), ready);
    }

    @Test
    public void testInvalidFramesAreRejected() {
        assertThrows(ProtocolException.class, () -> decode("not json"));
        assertThrows(ProtocolException.class, () -> decode("[1,2]"));
        assertThrows(ProtocolException.class, () -> decode("{\"payload\":{}}"));
        assertThrows(ProtocolException.class, () -> decode("{\"type\":\"PING\",\"payload\":{}}"));
        assertThrows(ProtocolException.class, () -> decode("{\"type\":\"READY\",\"payload\":\"w1\"}"));
        assertThrows(ProtocolException.class, () -> decode("{\"type\":\"READY\",\"payload\":{}}"));
        // savePath must be absolute
        assertThrows(ProtocolException.class, () -> decode("{\"type\":\"DOWNLOAD\",\"payload\":{\"taskId\":\"t\","
                + "\"url\":\"https://notes.test/\",\"pageId\":\"p\",\"savePath\":\"relative/index.html\"}}"));
        assertThrows(ProtocolException.class, () -> decode("{\"type\":\"DOWNLOAD\",\"payload\":{\"taskId\":\"t\","
                + "\"url\":\"/relative\",\"pageId\":\"p\",\"savePath\":\"/tmp/index.html\"}}"));
        // exactly one of data and error
        assertThrows(ProtocolException.class, () -> decode("{\"type\":\"RESULT\",\"payload\":{\"taskId\":\"t\",\"taskType\":\"DOWNLOAD\"}}"));
        assertThrows(ProtocolException.class, () -> decode("{\"type\":\"INIT\",\"payload\":{\"workerId\":\"w1\",\"navigationTimeoutMs\":0}}"));
    }
}
