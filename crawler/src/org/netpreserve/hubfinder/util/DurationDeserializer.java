package org.netpreserve.hubfinder.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Accepts plain milliseconds, "250ms" or ISO-8601 durations without the "PT" prefix ("30s", "5m", "1h30m").
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().trim().toLowerCase(Locale.ROOT);
        if (text.endsWith("ms")) {
            return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
        }
        if (text.startsWith("pt")) return Duration.parse(text.toUpperCase(Locale.ROOT));
        return Duration.parse("PT" + text.toUpperCase(Locale.ROOT));
    }
}
