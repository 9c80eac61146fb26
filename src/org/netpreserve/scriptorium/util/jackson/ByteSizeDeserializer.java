package org.netpreserve.scriptorium.util.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads a byte count written either as a plain number or with a binary unit suffix ("512", "1KB", "2.5 MiB").
 */
public class ByteSizeDeserializer extends JsonDeserializer<Long> {
    private static final Pattern SIZE_PATTERN =
            Pattern.compile("(?i)\\s*(\\d+(?:\\.\\d+)?)\\s*(?:([KMG])I?)?B?\\s*");

    @Override
    public Long deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken().isNumeric()) return parser.getLongValue();
        String text = parser.getText();
        var matcher = SIZE_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new InvalidFormatException(parser, "Invalid byte size: " + text, text, Long.class);
        }
        double value = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2) == null ? "" : matcher.group(2).toUpperCase(Locale.ROOT);
        long multiplier = switch (unit) {
            case "K" -> 1024L;
            case "M" -> 1024L * 1024;
            case "G" -> 1024L * 1024 * 1024;
            default -> 1L;
        };
        return Math.round(value * multiplier);
    }
}
