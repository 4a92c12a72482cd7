package com.metalend.core.service.oracle;

import com.metalend.core.event.LendingEventType;
import com.metalend.core.exception.ErrorCode;
import com.metalend.core.exception.PreconditionException;
import com.metalend.core.exception.UnauthorizedException;
import com.metalend.core.exception.ValidationException;
import com.metalend.core.support.LendingFixture;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static com.metalend.core.support.LendingFixture.ADMIN;
import static com.metalend.core.support.LendingFixture.DEED;
import static com.metalend.core.support.LendingFixture.FEED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValuationOracleTest {

    private final LendingFixture fixture = new LendingFixture();
    private final ValuationOracle oracle = fixture.oracle;

    @Test
    void rejectsSpotMoveBeyondMaxDeviation() {
        oracle.setSpotPrice(FEED, DEED, "1", new BigDecimal("10"));

        assertThatThrownBy(() -> oracle.setSpotPrice(FEED, DEED, "1", new BigDecimal("15")))
                .isInstanceOf(PreconditionException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.DEVIATION_EXCEEDED);
        assertThat(oracle.getPrice(DEED, "1")).isEqualByComparingTo("10");

        oracle.setSpotPrice(FEED, DEED, "1", new BigDecimal("11"));
        assertThat(oracle.getPrice(DEED, "1")).isEqualByComparingTo("11");
    }

    @Test
    void allowsMoveExactlyAtMaxDeviation() {
        oracle.setSpotPrice(FEED, DEED, "1", new BigDecimal("10"));

        oracle.setSpotPrice(FEED, DEED, "1", new BigDecimal("8"));

        assertThat(oracle.getPrice(DEED, "1")).isEqualByComparingTo("8");
    }

    @Test
    void expiredSpotFallsBackToFloor() {
        oracle.setFloorPrice(FEED, DEED, new BigDecimal("2"));
        oracle.setSpotPrice(FEED, DEED, "1", new BigDecimal("10"));

        fixture.clock.advance(Duration.ofHours(1));
        assertThat(oracle.isPriceValid(DEED, "1")).isTrue();
        assertThat(oracle.getPrice(DEED, "1")).isEqualByComparingTo("10");

        fixture.clock.advance(Duration.ofSeconds(1));
        assertThat(oracle.isPriceValid(DEED, "1")).isFalse();
        assertThat(oracle.getPrice(DEED, "1")).isEqualByComparingTo("2");
        assertThat(oracle.getFloorPrice(DEED)).hasValueSatisfying(floor -> assertThat(floor).isEqualByComparingTo("2"));
    }

    @Test
    void expiredSpotStillBoundsNextQuote() {
        oracle.setSpotPrice(FEED, DEED, "1", new BigDecimal("10"));
        fixture.clock.advance(Duration.ofDays(2));

        assertThatThrownBy(() -> oracle.setSpotPrice(FEED, DEED, "1", new BigDecimal("3")))
                .isInstanceOf(PreconditionException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.DEVIATION_EXCEEDED);
        assertThat(oracle.isPriceValid(DEED, "1")).isFalse();

        oracle.setSpotPrice(FEED, DEED, "1", new BigDecimal("8"));
        assertThat(oracle.getPrice(DEED, "1")).isEqualByComparingTo("8");
    }

    @Test
    void missingPriceIsUnavailable() {
        assertThatThrownBy(() -> oracle.getPrice(DEED, "404"))
                .isInstanceOf(PreconditionException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRICE_UNAVAILABLE);
    }

    @Test
    void unsupportedClassIsRejected() {
        assertThatThrownBy(() -> oracle.getPrice("painting", "1"))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.UNSUPPORTED_ASSET_CLASS);

        oracle.setAssetClassSupport(ADMIN, "painting", true);
        oracle.setFloorPrice(FEED, "painting", new BigDecimal("5"));

        assertThat(oracle.isSupported("painting")).isTrue();
        assertThat(oracle.getFloorPrice(DEED)).isEmpty();
        assertThat(oracle.getPrice("painting", "1")).isEqualByComparingTo("5");
    }

    @Test
    void batchUpdateIsAllOrNothing() {
        oracle.setSpotPrice(FEED, DEED, "2", new BigDecimal("10"));
        fixture.published.clear();

        assertThatThrownBy(() -> oracle.batchUpdatePrices(FEED, DEED, List.of("1", "2"),
                List.of(new BigDecimal("7"), new BigDecimal("50"))))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.DEVIATION_EXCEEDED);

        assertThat(oracle.isPriceValid(DEED, "1")).isFalse();
        assertThat(oracle.getPrice(DEED, "2")).isEqualByComparingTo("10");
        assertThat(fixture.published).isEmpty();

        oracle.batchUpdatePrices(FEED, DEED, List.of("1", "2"), List.of(new BigDecimal("7"), new BigDecimal("11")));
        assertThat(oracle.getPrice(DEED, "1")).isEqualByComparingTo("7");
        assertThat(fixture.eventTypes()).containsExactly(
                LendingEventType.SPOT_PRICE_UPDATED, LendingEventType.SPOT_PRICE_UPDATED);
    }

    @Test
    void batchRejectsLengthMismatch() {
        assertThatThrownBy(() -> oracle.batchUpdatePrices(FEED, DEED, List.of("1", "2"), List.of(BigDecimal.ONE)))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.BATCH_LENGTH_MISMATCH);
    }

    @Test
    void pricesRequireUpdaterRoleAndPositiveValues() {
        assertThatThrownBy(() -> oracle.setSpotPrice("mallory", DEED, "1", BigDecimal.TEN))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> oracle.setAssetClassSupport(FEED, "painting", true))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> oracle.setFloorPrice(FEED, DEED, BigDecimal.ZERO))
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_PRICE);
    }

    @Test
    void convertsIntoReferenceCurrency() {
        oracle.setSpotPrice(FEED, DEED, "1", new BigDecimal("10"));
        oracle.setReferenceRate(FEED, new BigDecimal("1.5"));

        assertThat(oracle.getPriceInReference(DEED, "1")).isEqualByComparingTo("15");
    }
}
