package com.logstuff.search;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchCursorTest {

    @Test
    void testTokenIsUrlSafeJson() {
        SearchCursor cursor = new SearchCursor(4711, Instant.parse("2024-03-15T10:20:30.123456Z"));

        String token = cursor.encode();

        assertThat(token).doesNotContain("=", "+", "/");
        assertThat(new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8))
            .isEqualTo("{\"lastId\":4711,\"lastTimestamp\":\"2024-03-15T10:20:30.123456Z\"}");
        assertThat(SearchCursor.decode(token)).isEqualTo(cursor);
    }

    @ParameterizedTest
    @ValueSource(strings = {"not a cursor", "e30", "eyJsYXN0SWQiOiJ4In0", "!!!"})
    void testInvalidTokensAreRejected(String token) {
        assertThatThrownBy(() -> SearchCursor.decode(token))
            .isInstanceOf(InvalidCursorException.class)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Invalid cursor");
    }

    @Test
    void testInvalidTimestampIsRejected() {
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(
            "{\"lastId\":1,\"lastTimestamp\":\"yesterday\"}".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> SearchCursor.decode(token)).isInstanceOf(InvalidCursorException.class);
    }

    @Test
    void testSortOrderParameter() {
        assertThat(SortOrder.fromParameter(null)).isEqualTo(SortOrder.DESC);
        assertThat(SortOrder.fromParameter(" asc ")).isEqualTo(SortOrder.ASC);
        assertThatThrownBy(() -> SortOrder.fromParameter("sideways"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testPageLimitBounds() {
        assertThat(PageRequest.first(1).getOrder()).isEqualTo(SortOrder.DESC);
        assertThatThrownBy(() -> PageRequest.first(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PageRequest.first(PageRequest.MAX_LIMIT + 1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
