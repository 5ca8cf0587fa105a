package io.detabase.core;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ItemsTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void nonMappingIsWrappedAsValue() {
        assertThat(Items.wrap("hello")).isEqualTo(Map.of("value", "hello"));
        assertThat(Items.wrap(List.of(1, 2))).isEqualTo(Map.of("value", List.of(1, 2)));
    }

    @Test
    void explicitKeyOverridesAndCallerMapIsNotMutated() {
        Map<String, Object> data = new HashMap<>(Map.of("key", "old", "n", 1));

        Map<String, Object> item = Items.prepare(data, "new", Expiration.at(5), clock);

        assertThat(item).containsEntry("key", "new").containsEntry("n", 1).containsEntry(Protocol.TTL_ATTRIBUTE, 5L);
        assertThat(data).containsOnlyKeys("key", "n").containsEntry("key", "old");
    }

    @Test
    void noKeyIsInventedLocally() {
        assertThat(Items.prepare(Map.of("n", 1), null, Expiration.never(), clock)).doesNotContainKey("key");
        assertThat(Items.prepare(Map.of("n", 1), "", Expiration.never(), clock)).doesNotContainKey("key");
    }

    @Test
    void keysAreEncodedAsOnePathSegment() {
        assertThat(Keys.encode("a/b c~d*e")).isEqualTo("a%2Fb%20c~d%2Ae");
        assertThat(Keys.itemPath("ü")).isEqualTo("/items/%C3%BC");
        assertThatThrownBy(() -> Keys.itemPath(""))
                .isInstanceOf(BaseException.InvalidArgument.class);
    }
}
