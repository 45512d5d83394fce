package com.logstuff.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.mock;

class TopFieldsAggregatorTest {

    private static final List<String> SAMPLE = List.of(
        "{\"hostname\":\"web-1\",\"severity\":\"info\",\"tags\":[\"a\",\"b\"]}",
        "{\"hostname\":\"web-2\",\"severity\":\"info\",\"tags\":[\"a\"]}",
        "{\"hostname\":\"web-1\",\"severity\":\"error\",\"code\":500}",
        "{\"hostname\":\"db-1\",\"severity\":null,\"ctx\":{\"k\":1}}");

    @Test
    void testCountsMostFrequentFirst() {
        TopFields top = aggregator(5, List.of()).tally(SAMPLE);

        assertThat(top.getSampleCount()).isEqualTo(4);
        assertThat(top.getFields()).containsOnlyKeys("code", "ctx", "hostname", "severity", "tags");
        assertThat(top.getFields().get("hostname")).extracting(FieldValueShare::toString)
            .containsExactly("web-1=2 (50.0%)", "db-1=1 (25.0%)", "web-2=1 (25.0%)");
        assertThat(top.getFields().get("severity")).extracting(FieldValueShare::getValue)
            .containsExactly("info", "", "error");
    }

    @Test
    @DisplayName("Array elements count separately; objects and numbers by their JSON text")
    void testValueText() {
        TopFields top = aggregator(5, List.of()).tally(SAMPLE);

        assertThat(top.getFields().get("tags")).extracting(FieldValueShare::getValue, FieldValueShare::getCount)
            .containsExactly(tuple("a", 2L), tuple("b", 1L));
        assertThat(top.getFields().get("code").get(0).getValue()).isEqualTo("500");
        assertThat(top.getFields().get("ctx").get(0).getValue()).isEqualTo("{\"k\":1}");
    }

    @Test
    void testTopNAndKeyFilter() {
        TopFields top = aggregator(1, List.of("hostname", "missing")).tally(SAMPLE);

        assertThat(top.getFields()).containsOnlyKeys("hostname");
        assertThat(top.getFields().get("hostname")).hasSize(1);
        assertThat(top.getFields().get("hostname").get(0).getValue()).isEqualTo("web-1");
    }

    @Test
    void testEmptySample() {
        TopFields top = aggregator(5, List.of()).tally(List.of());

        assertThat(top.getFields()).isEmpty();
        assertThat(top.getSampleCount()).isZero();
    }

    @Test
    void testSettingsMustBePositive() {
        assertThatIllegalArgumentException().isThrownBy(() ->
            new TopFieldsAggregator(mock(JdbcTemplate.class), "logs", new ObjectMapper(), 0, 5, List.of()));
    }

    // ========== Helper Methods ==========

    private static TopFieldsAggregator aggregator(int topN, List<String> keys) {
        return new TopFieldsAggregator(mock(JdbcTemplate.class), "logs", new ObjectMapper(), 500, topN, keys);
    }
}
