package io.detabase.json.spi;

/**
 * Minimal JSON codec used by transports to encode request payloads and decode responses.
 * Implementations wrap a specific JSON library.
 *
 * <p>Payloads are plain Java trees: {@code Map<String, Object>}, {@code List<Object>},
 * strings, numbers, booleans and {@code null}.
 */
public interface JsonCodec {

    /**
     * Encodes a payload tree.
     * @param value the payload
     * @return UTF-8 JSON bytes
     * @throws JsonException if the value cannot be encoded
     */
    byte[] encode(Object value) throws JsonException;

    /**
     * Decodes JSON into a plain tree.
     * @param data UTF-8 JSON bytes
     * @return maps for objects, lists for arrays, or a scalar; {@code null} for empty input
     * @throws JsonException if the data is not valid JSON
     */
    Object decode(byte[] data) throws JsonException;
}
