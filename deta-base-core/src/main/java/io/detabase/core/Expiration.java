package io.detabase.core;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;

/**
 * Requested expiration of an item: none, relative to the time of the call, or absolute.
 *
 * <p>Relative and absolute expirations are mutually exclusive by construction. The
 * loosely-typed {@link #of(Number, Object)} factory enforces the same rule for callers
 * holding both values.
 */
public sealed interface Expiration permits Expiration.Never, Expiration.Relative, Expiration.Absolute {

    /**
     * No expiration requested.
     */
    record Never() implements Expiration {}

    /**
     * Expire {@code seconds} after the moment the request is built.
     *
     * @param seconds offset from the current time, may be fractional
     */
    record Relative(double seconds) implements Expiration {}

    /**
     * Expire at a fixed point in time.
     *
     * @param epochSeconds expiration time in whole seconds since the epoch
     */
    record Absolute(long epochSeconds) implements Expiration {}

    static Expiration never() {
        return new Never();
    }

    static Expiration in(Number seconds) {
        return new Relative(finite(seconds, "expireIn"));
    }

    static Expiration in(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        return new Relative(duration.getSeconds() + duration.getNano() / 1_000_000_000d);
    }

    static Expiration at(Number epochSeconds) {
        Objects.requireNonNull(epochSeconds, "epochSeconds");
        if (epochSeconds instanceof Long || epochSeconds instanceof Integer
                || epochSeconds instanceof Short || epochSeconds instanceof Byte) {
            return new Absolute(epochSeconds.longValue());
        }
        return new Absolute((long) finite(epochSeconds, "expireAt"));
    }

    static Expiration at(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        return new Absolute(instant.truncatedTo(ChronoUnit.SECONDS).getEpochSecond());
    }

    static Expiration at(ZonedDateTime dateTime) {
        Objects.requireNonNull(dateTime, "dateTime");
        return at(dateTime.toInstant());
    }

    static Expiration at(OffsetDateTime dateTime) {
        Objects.requireNonNull(dateTime, "dateTime");
        return at(dateTime.toInstant());
    }

    /**
     * A local date-time carries no zone; it is read in the system default zone.
     */
    static Expiration at(LocalDateTime dateTime) {
        Objects.requireNonNull(dateTime, "dateTime");
        return at(dateTime.atZone(ZoneId.systemDefault()));
    }

    /**
     * Builds an expiration from optional, loosely-typed inputs.
     *
     * <p>A {@code null} or zero value counts as absent. {@code expireAt} may be a
     * {@link Number} of epoch seconds, an {@link Instant}, a {@link ZonedDateTime},
     * an {@link OffsetDateTime}, a {@link LocalDateTime} or a {@link Date}.
     *
     * @param expireIn seconds from now, or {@code null}
     * @param expireAt absolute expiration, or {@code null}
     * @return the expiration
     * @throws BaseException.InvalidArgument if both are present, a number is not finite,
     *         or {@code expireAt} has an unsupported type
     */
    static Expiration of(Number expireIn, Object expireAt) {
        boolean hasIn = expireIn != null && expireIn.doubleValue() != 0d;
        boolean hasAt = expireAt != null
                && !(expireAt instanceof Number && ((Number) expireAt).doubleValue() == 0d);

        if (hasIn && hasAt) {
            throw new BaseException.InvalidArgument("'expireIn' and 'expireAt' are mutually exclusive parameters");
        }
        if (hasIn) {
            return in(expireIn);
        }
        if (!hasAt) {
            return never();
        }

        if (expireAt instanceof Number) {
            return at((Number) expireAt);
        } else if (expireAt instanceof Instant) {
            return at((Instant) expireAt);
        } else if (expireAt instanceof ZonedDateTime) {
            return at((ZonedDateTime) expireAt);
        } else if (expireAt instanceof OffsetDateTime) {
            return at((OffsetDateTime) expireAt);
        } else if (expireAt instanceof LocalDateTime) {
            return at((LocalDateTime) expireAt);
        } else if (expireAt instanceof Date) {
            return at(((Date) expireAt).toInstant());
        }
        throw new BaseException.InvalidArgument(
                "'expireAt' must be a number, Instant, ZonedDateTime, OffsetDateTime, LocalDateTime or Date but was "
                        + expireAt.getClass().getName());
    }

    private static double finite(Number value, String name) {
        Objects.requireNonNull(value, name);
        double d = value.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new BaseException.InvalidArgument("'" + name + "' must be a finite number but was " + d);
        }
        return d;
    }
}
