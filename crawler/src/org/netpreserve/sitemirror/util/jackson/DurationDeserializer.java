package org.netpreserve.sitemirror.util.jackson;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Accepts plain milliseconds ({@code 1500}), {@code "1500ms"}, short forms like {@code "2s"} or
 * {@code "1m30s"}, and ISO-8601 ({@code "PT2S"}).
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().strip();
        try {
            return parse(text);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new JsonMappingException(jsonParser, "Invalid duration: " + text, e);
        }
    }

    public static Duration parse(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.endsWith("ms")) return Duration.ofMillis(Long.parseLong(lower.substring(0, lower.length() - 2).strip()));
        if (lower.chars().allMatch(Character::isDigit) && !lower.isEmpty()) return Duration.ofMillis(Long.parseLong(lower));
        if (lower.startsWith("p")) return Duration.parse(text.toUpperCase(Locale.ROOT));
        return Duration.parse("PT" + text.toUpperCase(Locale.ROOT));
    }
}
