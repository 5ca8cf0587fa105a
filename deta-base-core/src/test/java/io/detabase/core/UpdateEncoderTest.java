package io.detabase.core;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UpdateEncoderTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void sortsEachMarkerIntoItsBucket() {
        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put("gone", UpdateOperation.trim());
        updates.put("visits", UpdateOperation.increment(5));
        updates.put("tags", UpdateOperation.append(List.of(1, 2)));
        updates.put("queue", UpdateOperation.prepend(0));

        Map<String, Object> payload = UpdateEncoder.encode(updates, Expiration.never(), clock);

        assertThat(payload).containsOnlyKeys("set", "increment", "append", "prepend", "delete");
        assertThat(payload.get("delete")).isEqualTo(List.of("gone"));
        assertThat(payload.get("increment")).isEqualTo(Map.of("visits", 5));
        assertThat(payload.get("append")).isEqualTo(Map.of("tags", List.of(1, 2)));
        assertThat(payload.get("prepend")).isEqualTo(Map.of("queue", List.of(0)));
        assertThat(payload.get("set")).isEqualTo(Map.of());
    }

    @Test
    void plainValuesAreSetIncludingNullAndNested() {
        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put("name", "Ada");
        updates.put("profile.age", 36);
        updates.put("nickname", null);
        updates.put("address", Map.of("city", "London"));

        Map<String, Object> payload = UpdateEncoder.encode(updates, Expiration.never(), clock);

        assertThat(payload.get("set")).isEqualTo(updates);
        assertThat(payload.get("delete")).isEqualTo(List.of());
    }

    @Test
    void emptyUpdatesProduceFiveEmptyBuckets() {
        Map<String, Object> payload = UpdateEncoder.encode(Map.of(), Expiration.never(), clock);

        assertThat(payload.keySet()).containsExactly("set", "increment", "append", "prepend", "delete");
        assertThat(payload.get("set")).isEqualTo(Map.of());
        assertThat(payload.get("increment")).isEqualTo(Map.of());
        assertThat(payload.get("append")).isEqualTo(Map.of());
        assertThat(payload.get("prepend")).isEqualTo(Map.of());
        assertThat(payload.get("delete")).isEqualTo(List.of());
    }

    @Test
    void expirationIsMergedIntoSet() {
        Map<String, Object> payload = UpdateEncoder.encode(
                Map.of("n", UpdateOperation.increment()), Expiration.in(10), clock);

        assertThat(payload.get("set")).isEqualTo(Map.of(Protocol.TTL_ATTRIBUTE, 1704067210L));
        assertThat(payload.get("increment")).isEqualTo(Map.of("n", 1));
    }

    @Test
    void appendKeepsListsAndWrapsScalars() {
        assertThat(((UpdateOperation.Append) UpdateOperation.append("x")).values()).containsExactly("x");
        assertThat(((UpdateOperation.Append) UpdateOperation.append(List.of("x", "y"))).values()).containsExactly("x", "y");
        assertThat(UpdateOperation.trim().kind()).isEqualTo(UpdateOperation.Kind.TRIM);
    }
}
