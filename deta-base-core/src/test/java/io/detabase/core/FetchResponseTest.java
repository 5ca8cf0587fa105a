package io.detabase.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FetchResponseTest {

    @Test
    void decodesPagingAndItems() {
        Map<String, Object> body = Map.of(
                "paging", Map.of("size", 2, "last", "k2"),
                "items", List.of(Map.of("key", "k1"), Map.of("key", "k2")));

        FetchResponse page = FetchResponse.decode(body);

        assertThat(page.count()).isEqualTo(2);
        assertThat(page.last()).contains("k2");
        assertThat(page.hasMore()).isTrue();
        assertThat(page.size()).isEqualTo(2);
        assertThat(page).extracting(item -> item.get("key")).containsExactly("k1", "k2");
    }

    @Test
    void missingFieldsDefault() {
        FetchResponse page = FetchResponse.decode(Map.of("paging", Map.of("size", 0)));

        assertThat(page).isEqualTo(new FetchResponse(0, null, List.of()));
        assertThat(page.last()).isEmpty();
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void nonObjectEntriesAreSkipped() {
        FetchResponse page = FetchResponse.decode(Map.of(
                "paging", Map.of("size", 3),
                "items", Arrays.asList(Map.of("key", "k1"), "stray", null)));

        assertThat(page.items()).containsExactly(Map.of("key", "k1"));
    }
}
