package com.logstuff.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.logstuff.storage.LogEvent;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decoder for rsyslog's {@code jsonmesg} property.
 *
 * <p>The stored document keeps the message and its routing metadata, with numeric facility
 * and severity replaced by their names and hyphenated keys written with underscores.
 * {@code rawmsg}, {@code pri} and {@code structured-data} are dropped as duplicates of other
 * fields. Message variables ({@code $!}) are flattened into top-level keys such as
 * {@code vars.user.name}. The event time is {@code timereported}.
 */
public class RsyslogEventDecoder implements EventDecoder {

    public static final String FORMAT = "rsyslog";

    private static final List<String> REQUIRED_FIELDS = List.of("msg", "timereported", "hostname");

    // source key -> document key, copied when present
    private static final Map<String, String> COPIED_FIELDS = Map.ofEntries(
        Map.entry("timegenerated", "timegenerated"),
        Map.entry("inputname", "inputname"),
        Map.entry("syslogtag", "syslogtag"),
        Map.entry("fromhost", "fromhost"),
        Map.entry("fromhost-ip", "fromhost_ip"),
        Map.entry("programname", "programname"),
        Map.entry("procid", "procid"),
        Map.entry("protocol-version", "protocol_version"),
        Map.entry("app-name", "app_name"),
        Map.entry("msgid", "msgid"),
        Map.entry("uuid", "uuid"));

    private static final Set<String> SEARCH_FIELDS = Set.of("hostname", "syslogtag", "msg");

    static final String VARS_PREFIX = "vars";

    // PostgreSQL timestamptz range, 4713 BC to 294276 AD
    static final Instant EARLIEST_STORABLE = LocalDateTime.of(-4712, 1, 1, 0, 0).toInstant(ZoneOffset.UTC);
    static final Instant LATEST_STORABLE =
        LocalDateTime.of(294276, 12, 31, 23, 59, 59, 999_999_000).toInstant(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;

    public RsyslogEventDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public LogEvent decode(String line) {
        JsonNode root = readObject(objectMapper, line);
        for (String field : REQUIRED_FIELDS) {
            if (!root.hasNonNull(field)) {
                throw new EventDecodeException("Missing field: " + field, line);
            }
        }

        ObjectNode doc = objectMapper.createObjectNode();
        doc.put("msg", root.get("msg").asText());
        doc.put("timereported", root.get("timereported").asText());
        doc.put("hostname", root.get("hostname").asText());
        COPIED_FIELDS.forEach((source, target) -> {
            JsonNode value = root.get(source);
            if (value != null && !value.isNull()) {
                doc.set(target, value);
            }
        });

        try {
            if (root.hasNonNull("syslogfacility")) {
                doc.put("syslogfacility", SyslogFacility.fromCode(root.get("syslogfacility").asText()).getLabel());
            }
            if (root.hasNonNull("syslogseverity")) {
                doc.put("syslogseverity", SyslogSeverity.fromCode(root.get("syslogseverity").asText()).getLabel());
            }
        } catch (IllegalArgumentException e) {
            throw new EventDecodeException(e.getMessage(), line, e);
        }

        JsonNode vars = root.get("$!");
        if (vars != null && vars.isObject()) {
            flatten(vars, VARS_PREFIX, doc);
        }

        Instant timestamp = parseTimestamp(root.get("timereported").asText(), line);
        return LogEvent.unsaved(timestamp, doc, searchText(doc));
    }

    @Override
    public String getFormat() {
        return FORMAT;
    }

    /**
     * Text indexed for full-text search: host, tag and message, plus every variable as key=value.
     */
    static String searchText(ObjectNode doc) {
        List<String> parts = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = doc.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (SEARCH_FIELDS.contains(field.getKey())) {
                parts.add(field.getValue().asText());
            } else if (field.getKey().startsWith(VARS_PREFIX + ".")) {
                JsonNode value = field.getValue();
                parts.add(field.getKey() + "=" + (value.isValueNode() ? value.asText() : value.toString()));
            }
        }
        return String.join(" ", parts);
    }

    /**
     * Copy nested objects into {@code target} with dotted keys. Arrays and scalars are kept as values.
     */
    static void flatten(JsonNode value, String prefix, ObjectNode target) {
        if (!value.isObject()) {
            target.set(prefix, value);
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            flatten(field.getValue(), prefix + "." + field.getKey(), target);
        }
    }

    static JsonNode readObject(ObjectMapper objectMapper, String line) {
        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new EventDecodeException("Invalid JSON: " + e.getOriginalMessage(), line, e);
        }
        if (root == null || !root.isObject()) {
            throw new EventDecodeException("Event is not a JSON object", line);
        }
        return root;
    }

    static Instant parseTimestamp(String text, String line) {
        Instant timestamp;
        try {
            timestamp = OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeException e) {
            throw new EventDecodeException("Invalid timestamp: " + text, line, e);
        }
        return requireStorable(timestamp, line);
    }

    /**
     * @throws EventDecodeException if the database cannot hold the timestamp
     */
    static Instant requireStorable(Instant timestamp, String line) {
        if (timestamp.isBefore(EARLIEST_STORABLE) || timestamp.isAfter(LATEST_STORABLE)) {
            throw new EventDecodeException("Timestamp out of range: " + timestamp, line);
        }
        return timestamp;
    }
}
