package io.detabase.json.jackson;

import io.detabase.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    @Test
    void encodesNullsAndKeepsFieldOrder() throws Exception {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("limit", 10);
        payload.put("last", null);
        payload.put("query", List.of(Map.of("age?gt", 10)));

        String json = new String(codec.encode(payload), StandardCharsets.UTF_8);

        assertThat(json).isEqualTo("{\"limit\":10,\"last\":null,\"query\":[{\"age?gt\":10}]}");
    }

    @Test
    void decodesObjectsToOrderedMaps() throws Exception {
        Object decoded = codec.decode("{\"b\":1,\"a\":[true,null,\"x\"]}".getBytes(StandardCharsets.UTF_8));

        assertThat(decoded).isInstanceOf(Map.class);
        @SuppressWarnings("unchecked")
        Map<String, Object> object = (Map<String, Object>) decoded;
        assertThat(object.keySet()).containsExactly("b", "a");
        assertThat(object.get("a")).isEqualTo(Arrays.asList(true, null, "x"));
    }

    @Test
    void emptyInputDecodesToNull() throws Exception {
        assertThat(codec.decode(new byte[0])).isNull();
        assertThat(codec.decode(null)).isNull();
    }

    @Test
    void malformedInputIsReported() {
        assertThatThrownBy(() -> codec.decode("{nope".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(JsonException.class);
    }
}
