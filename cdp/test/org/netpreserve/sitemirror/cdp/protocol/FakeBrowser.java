package org.netpreserve.sitemirror.cdp.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.netpreserve.sitemirror.util.FramedPipe;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.channels.Pipe;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Speaks the browser's end of a CDP pipe. Commands are answered by a scripted handler per method.
 */
public class FakeBrowser implements AutoCloseable {
    public final CdpConnection connection;
    private final FramedPipe browserSide;
    private final Map<String, Function<ObjectNode, ObjectNode>> handlers = new ConcurrentHashMap<>();

    public FakeBrowser() throws IOException {
        Pipe toBrowser = Pipe.open();
        Pipe fromBrowser = Pipe.open();
        browserSide = new FramedPipe("FakeBrowser", Channels.newInputStream(toBrowser.source()),
                Channels.newOutputStream(fromBrowser.sink()), this::handleCommand);
        connection = new CdpConnection(Channels.newInputStream(fromBrowser.source()),
                Channels.newOutputStream(toBrowser.sink()));
    }

    /**
     * Answers {@code method} with the result the handler returns. A null result sends no response.
     */
    public FakeBrowser on(String method, Function<ObjectNode, ObjectNode> handler) {
        handlers.put(method, handler);
        return this;
    }

    public FakeBrowser onError(String method, int code, String message) {
        handlers.put(method, params -> {
            var error = CdpMessage.JSON.createObjectNode();
            error.putObject("error").put("code", code).put("message", message);
            return error;
        });
        return this;
    }

    private void handleCommand(byte[] frame) {
        try {
            ObjectNode command = (ObjectNode) CdpMessage.JSON.readTree(frame);
            String method = command.path("method").asText();
            var handler = handlers.get(method);
            if (handler == null) return;
            var params = command.has("params") ? (ObjectNode) command.get("params") : CdpMessage.JSON.createObjectNode();
            ObjectNode reply = handler.apply(params);
            if (reply == null) return;
            var response = CdpMessage.JSON.createObjectNode();
            response.put("id", command.path("id").asLong());
            if (reply.has("error")) {
                response.set("error", reply.get("error"));
            } else {
                response.set("result", reply);
            }
            if (command.hasNonNull("sessionId")) response.put("sessionId", command.get("sessionId").asText());
            browserSide.send(CdpMessage.JSON.writeValueAsBytes(response));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void sendEvent(String sessionId, String method, ObjectNode params) throws IOException {
        var event = CdpMessage.JSON.createObjectNode();
        event.put("method", method);
        event.set("params", params);
        if (sessionId != null) event.put("sessionId", sessionId);
        browserSide.send(CdpMessage.JSON.writeValueAsBytes(event));
    }

    public static ObjectNode result(String field, String value) {
        return CdpMessage.JSON.createObjectNode().put(field, value);
    }

    /**
     * Hangs up, as if the browser process exited.
     */
    public void disconnect() {
        browserSide.close();
    }

    @Override
    public void close() {
        connection.close();
        browserSide.close();
    }
}
