package io.detabase.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FetchPayloadTest {

    @Test
    void booleanCursorIsTreatedAsAbsent() {
        Map<String, Object> payload = FetchPayload.encode(Map.of("age?gt", 10), 1000, Boolean.TRUE);

        assertThat(payload).containsEntry("last", null);
        assertThat(payload.get("query")).isEqualTo(List.of(Map.of("age?gt", 10)));
    }

    @Test
    void singleFilterIsWrappedAndListKept() {
        List<Map<String, Object>> filters = List.of(Map.of("a", 1), Map.of("b", 2));

        assertThat(FetchPayload.encode(filters, 10, "c1").get("query")).isEqualTo(filters);
        assertThat(FetchPayload.encode(filters, 10, "c1")).containsEntry("last", "c1").containsEntry("limit", 10);
    }

    @Test
    void queryIsOmittedWithoutFilter() {
        assertThat(FetchPayload.encode(null, 1000, null)).containsOnlyKeys("limit", "last");
        assertThat(FetchPayload.encode(Map.of(), 1000, null)).containsOnlyKeys("limit", "last");
        assertThat(FetchPayload.encode(List.of(), 1000, null)).containsOnlyKeys("limit", "last");
    }
}
