package io.detabase.core;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the canonical epoch-seconds expiration attribute into an item or update payload.
 */
public final class TtlNormalizer {
    private TtlNormalizer() {}

    /**
     * Resolves {@code expiration} against {@code clock} and stores the result under
     * {@code attribute}, replacing any previous value. Does nothing for {@link Expiration.Never}.
     *
     * @param target the mutable item or {@code set} mapping
     * @param attribute the reserved TTL attribute name
     * @param expiration the requested expiration
     * @param clock source of the current time for relative expirations
     */
    public static void apply(Map<String, Object> target, String attribute, Expiration expiration, Clock clock) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(clock, "clock");
        if (expiration == null) return;

        Long epochSeconds = resolve(expiration, clock);
        if (epochSeconds != null) {
            target.put(attribute, epochSeconds);
        }
    }

    /**
     * Returns the absolute expiration in epoch seconds, or {@code null} for {@link Expiration.Never}.
     * Relative expirations are truncated to the second before conversion.
     */
    public static Long resolve(Expiration expiration, Clock clock) {
        if (expiration instanceof Expiration.Absolute) {
            return ((Expiration.Absolute) expiration).epochSeconds();
        }
        if (expiration instanceof Expiration.Relative) {
            double seconds = ((Expiration.Relative) expiration).seconds();
            long whole = (long) Math.floor(seconds);
            long nanos = Math.round((seconds - whole) * 1_000_000_000d);
            Instant at = clock.instant().plusSeconds(whole).plusNanos(nanos);
            return at.truncatedTo(ChronoUnit.SECONDS).getEpochSecond();
        }
        return null;
    }
}
