package io.esgradar.materiality.api.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * Reads ISO-8601 timestamps with or without fraction and offset. Offset timestamps are
 * shifted to the system zone, matching how feed dates are read.
 */
public class PublishedAtDeserializer extends StdDeserializer<LocalDateTime> {

    public PublishedAtDeserializer() {
        super(LocalDateTime.class);
    }

    @Override
    public LocalDateTime deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        String text = parser.getValueAsString();
        if (text == null || text.isBlank()) return null;

        try {
            return parse(text.trim());
        } catch (DateTimeException e) {
            return (LocalDateTime) context.handleWeirdStringValue(LocalDateTime.class, text,
                    "not an ISO-8601 date-time: %s", e.getMessage());
        }
    }

    public static LocalDateTime parse(String text) {
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parse(text);
        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return OffsetDateTime.from(parsed).atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
        }
        return LocalDateTime.from(parsed);
    }
}
