package org.netpreserve.sitemirror.cdp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Wire shapes of the DevTools protocol.
 */
public interface CdpMessage {
    ObjectMapper JSON = new ObjectMapper(new JsonFactoryBuilder()
            // serialized DOMs can be large
            .streamReadConstraints(StreamReadConstraints.builder().maxStringLength(300 * 1024 * 1024).build())
            .build())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    record Command(long id, String method, Map<String, Object> params, String sessionId) {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
    @JsonSubTypes({@JsonSubTypes.Type(Event.class), @JsonSubTypes.Type(Response.class)})
    sealed interface Incoming permits Event, Response {
        String sessionId();
    }

    record Event(String method, ObjectNode params, String sessionId) implements Incoming {
    }

    record Response(long id, ObjectNode result, Error error, String sessionId) implements Incoming {
    }

    record Error(int code, String message) {
    }
}
