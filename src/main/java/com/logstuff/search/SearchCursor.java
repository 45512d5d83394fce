package com.logstuff.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Objects;

/**
 * Keyset position after the last event of a page. Travels to clients as an opaque
 * base64url string of {@code {"lastId":..,"lastTimestamp":".."}}.
 */
public final class SearchCursor {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final long lastId;
    private final Instant lastTimestamp;

    public SearchCursor(long lastId, Instant lastTimestamp) {
        this.lastId = lastId;
        this.lastTimestamp = Objects.requireNonNull(lastTimestamp, "lastTimestamp");
    }

    public long getLastId() {
        return lastId;
    }

    public Instant getLastTimestamp() {
        return lastTimestamp;
    }

    public String encode() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("lastId", lastId);
        node.put("lastTimestamp", lastTimestamp.toString());
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(node.toString().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws InvalidCursorException if {@code token} is not a cursor produced by {@link #encode()}
     */
    public static SearchCursor decode(String token) {
        JsonNode node;
        try {
            node = MAPPER.readTree(Base64.getUrlDecoder().decode(token.trim()));
        } catch (IllegalArgumentException | IOException e) {
            throw new InvalidCursorException("Invalid cursor: " + token, e);
        }
        if (node == null || !node.path("lastId").canConvertToLong() || !node.path("lastTimestamp").isTextual()) {
            throw new InvalidCursorException("Invalid cursor: " + token, null);
        }
        try {
            return new SearchCursor(node.get("lastId").asLong(), Instant.parse(node.get("lastTimestamp").asText()));
        } catch (DateTimeParseException e) {
            throw new InvalidCursorException("Invalid cursor: " + token, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchCursor)) return false;
        SearchCursor that = (SearchCursor) o;
        return lastId == that.lastId && lastTimestamp.equals(that.lastTimestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastId, lastTimestamp);
    }

    @Override
    public String toString() {
        return "SearchCursor{lastId=" + lastId + ", lastTimestamp=" + lastTimestamp + "}";
    }
}
