package com.logstuff.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.logstuff.storage.LogEvent;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Decoder for arbitrary JSON objects, stored as they are.
 *
 * <p>The event time is read from a configurable field holding an RFC 3339 timestamp or
 * epoch seconds; events without it get the time they were received. Every top-level string
 * value is indexed for full-text search.
 */
public class JsonEventDecoder implements EventDecoder {

    public static final String FORMAT = "json";

    private final ObjectMapper objectMapper;
    private final String timestampField;
    private final Clock clock;

    public JsonEventDecoder(ObjectMapper objectMapper, String timestampField, Clock clock) {
        this.objectMapper = objectMapper;
        this.timestampField = timestampField;
        this.clock = clock;
    }

    @Override
    public LogEvent decode(String line) {
        ObjectNode doc = (ObjectNode) RsyslogEventDecoder.readObject(objectMapper, line);
        return LogEvent.unsaved(timestampOf(doc, line), doc, searchText(doc));
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }

    private Instant timestampOf(ObjectNode doc, String line) {
        JsonNode value = doc.get(timestampField);
        if (value == null || value.isNull()) {
            return clock.instant();
        }
        if (value.isNumber()) {
            BigDecimal seconds = value.decimalValue();
            Instant timestamp;
            try {
                long whole = seconds.toBigInteger().longValueExact();
                long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
                timestamp = Instant.ofEpochSecond(whole, nanos);
            } catch (ArithmeticException | DateTimeException e) {
                throw new EventDecodeException("Timestamp out of range: " + seconds.toPlainString(), line, e);
            }
            return RsyslogEventDecoder.requireStorable(timestamp, line);
        }
        if (value.isTextual()) {
            return RsyslogEventDecoder.parseTimestamp(value.asText(), line);
        }
        throw new EventDecodeException("Field " + timestampField + " is neither a timestamp nor a number", line);
    }

    static String searchText(ObjectNode doc) {
        List<String> parts = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = doc.fields();
        while (fields.hasNext()) {
            JsonNode value = fields.next().getValue();
            if (value.isTextual()) {
                parts.add(value.asText());
            }
        }
        return String.join(" ", parts);
    }
}
