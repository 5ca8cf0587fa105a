package io.detabase.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpirationTest {

    @Test
    void bothPresentIsRejected() {
        assertThatThrownBy(() -> Expiration.of(300, 1704067200L))
                .isInstanceOf(BaseException.InvalidArgument.class)
                .hasMessageContaining("mutually exclusive");
    }

    @Test
    void bothPresentIsRejectedEvenWithUnsupportedType() {
        assertThatThrownBy(() -> Expiration.of(300, "tomorrow"))
                .isInstanceOf(BaseException.InvalidArgument.class)
                .hasMessageContaining("mutually exclusive");
    }

    @Test
    void zeroAndNullCountAsAbsent() {
        assertThat(Expiration.of(null, null)).isInstanceOf(Expiration.Never.class);
        assertThat(Expiration.of(0, 0)).isInstanceOf(Expiration.Never.class);
        assertThat(Expiration.of(0, 100L)).isEqualTo(new Expiration.Absolute(100L));
        assertThat(Expiration.of(30, 0.0)).isEqualTo(new Expiration.Relative(30d));
    }

    @Test
    void unsupportedExpireAtTypeIsRejected() {
        assertThatThrownBy(() -> Expiration.of(null, "2030-01-01"))
                .isInstanceOf(BaseException.InvalidArgument.class)
                .hasMessageContaining("java.lang.String");
    }

    @Test
    void acceptsDateAndInstant() {
        Instant at = Instant.parse("2030-01-01T00:00:00.400Z");

        assertThat(Expiration.of(null, at)).isEqualTo(new Expiration.Absolute(1893456000L));
        assertThat(Expiration.of(null, Date.from(at))).isEqualTo(new Expiration.Absolute(1893456000L));
    }

    @Test
    void durationKeepsFractionalSeconds() {
        assertThat(Expiration.in(Duration.ofMillis(1500))).isEqualTo(new Expiration.Relative(1.5));
    }

    @Test
    void nonFiniteNumbersAreRejected() {
        assertThatThrownBy(() -> Expiration.of(null, Double.NaN))
                .isInstanceOf(BaseException.InvalidArgument.class)
                .hasMessageContaining("expireAt");
        assertThatThrownBy(() -> Expiration.of(null, Double.POSITIVE_INFINITY))
                .isInstanceOf(BaseException.InvalidArgument.class);
        assertThatThrownBy(() -> Expiration.of(Double.NaN, null))
                .isInstanceOf(BaseException.InvalidArgument.class)
                .hasMessageContaining("expireIn");
        assertThatThrownBy(() -> Expiration.in(Float.NEGATIVE_INFINITY))
                .isInstanceOf(BaseException.InvalidArgument.class);
    }
}
