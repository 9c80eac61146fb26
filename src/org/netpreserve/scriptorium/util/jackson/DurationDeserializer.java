package org.netpreserve.scriptorium.util.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads durations as milliseconds ({@code 1500}), with a unit ({@code 1500ms}, {@code 30s}, {@code 10m},
 * {@code 2h}) or in ISO-8601 form ({@code PT1M30S}).
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    private static final Pattern UNIT_PATTERN = Pattern.compile("\\s*(\\d+)\\s*(ms|s|m|h)\\s*");

    @Override
    public Duration deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken().isNumeric()) return Duration.ofMillis(parser.getLongValue());
        String text = parser.getText();
        try {
            return parse(text);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new InvalidFormatException(parser, "Invalid duration: " + text, text, Duration.class);
        }
    }

    public static Duration parse(String text) {
        var matcher = UNIT_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            return switch (matcher.group(2)) {
                case "ms" -> Duration.ofMillis(amount);
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                default -> Duration.ofHours(amount);
            };
        }
        String upper = text.strip().toUpperCase(Locale.ROOT);
        return Duration.parse(upper.startsWith("P") ? upper : "PT" + upper);
    }
}
