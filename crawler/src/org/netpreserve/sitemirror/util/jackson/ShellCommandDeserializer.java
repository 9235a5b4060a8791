package org.netpreserve.sitemirror.util.jackson;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads command-line options given either as a list or as one shell-quoted string, so
 * {@code "--headless=new --user-agent='My Bot'"} becomes {@code ["--headless=new", "--user-agent=My Bot"]}.
 */
public class ShellCommandDeserializer extends JsonDeserializer<List<String>> {
    @Override
    public List<String> deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        JsonNode node = jsonParser.getCodec().readTree(jsonParser);
        if (node.isTextual()) {
            return split(node.asText());
        } else if (node.isArray()) {
            List<String> tokens = new ArrayList<>();
            for (JsonNode element : node) {
                tokens.add(element.asText());
            }
            return tokens;
        } else if (node.isNull()) {
            return List.of();
        } else {
            throw new JsonMappingException(jsonParser, "Invalid options: " + node + " (expected string or array of strings)");
        }
    }

    public static List<String> split(String commandLine) throws IOException {
        List<String> tokens = new ArrayList<>();
        StringBuilder token = new StringBuilder();
        char quote = 0;
        boolean inToken = false;
        for (int i = 0; i < commandLine.length(); i++) {
            char c = commandLine.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    token.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(token.toString());
                    token.setLength(0);
                    inToken = false;
                }
            } else {
                token.append(c);
                inToken = true;
            }
        }
        if (quote != 0) throw new IOException("Unterminated quote in: \"" + commandLine + "\"");
        if (inToken) tokens.add(token.toString());
        return tokens;
    }
}
