package com.optionsbacktester.unit.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.optionsbacktester.config.PricingConfig;
import com.optionsbacktester.core.processor.OptionPricingEngine;
import com.optionsbacktester.domain.enums.OptionType;
import com.optionsbacktester.domain.enums.PricingMethod;
import com.optionsbacktester.domain.model.Greeks;
import com.optionsbacktester.domain.model.OptionPrice;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OptionPricingEngineTest {

    private OptionPricingEngine engine;

    @BeforeEach
    void setUp() {
        engine = new OptionPricingEngine(new PricingConfig());
    }

    @Nested
    @DisplayName("Analytic prices")
    class AnalyticPrices {

        @Test
        @DisplayName("ATM one-year call matches the textbook value")
        void atmCallTextbookValue() {
            OptionPrice call = engine.price(100, 100, 1.0, 0.20, 0.05, OptionType.CALL);

            assertThat(call.getValue()).isCloseTo(10.4506, within(0.001));
            assertThat(call.getMethod()).isEqualTo(PricingMethod.ANALYTIC);
        }

        @Test
        @DisplayName("Call minus put equals discounted forward minus discounted strike")
        void putCallParity() {
            double s = 100;
            double k = 105;
            double t = 0.5;
            double r = 0.05;
            double q = 0.01;

            double call = engine.price(s, k, t, 0.25, r, q, OptionType.CALL).getValue();
            double put = engine.price(s, k, t, 0.25, r, q, OptionType.PUT).getValue();

            assertThat(call - put).isCloseTo(s * Math.exp(-q * t) - k * Math.exp(-r * t), within(1e-6));
        }

        @Test
        @DisplayName("Far out-of-the-money value is floored at 0.01")
        void floorsAtMinimumPrice() {
            OptionPrice call = engine.price(100, 1000, 0.01, 0.20, 0.05, OptionType.CALL);

            assertThat(call.getValue()).isEqualTo(OptionPricingEngine.MIN_PRICE);
        }

        @Test
        @DisplayName("Negative time to expiry is clamped, not rejected")
        void negativeTimeIsClamped() {
            OptionPrice put = engine.price(100, 100, -1.0, 0.20, 0.05, OptionType.PUT);

            assertThat(put.getValue()).isGreaterThanOrEqualTo(OptionPricingEngine.MIN_PRICE);
            assertThat(put.getMethod()).isEqualTo(PricingMethod.ANALYTIC);
        }
    }

    @Nested
    @DisplayName("Expiry and degraded pricing")
    class ExpiryAndDegraded {

        @Test
        @DisplayName("Zero time to expiry returns intrinsic value")
        void zeroTimeIsIntrinsic() {
            OptionPrice itmCall = engine.price(110, 100, 0.0, 0.20, 0.05, OptionType.CALL);
            OptionPrice otmPut = engine.price(110, 100, 0.0, 0.20, 0.05, OptionType.PUT);

            assertThat(itmCall.getValue()).isEqualTo(10.0);
            assertThat(itmCall.getMethod()).isEqualTo(PricingMethod.INTRINSIC);
            assertThat(otmPut.getValue()).isEqualTo(OptionPricingEngine.MIN_PRICE);
        }

        @Test
        @DisplayName("Price converges to intrinsic as expiry approaches")
        void convergesToIntrinsic() {
            double[] times = {1e-2, 1e-3, 1e-4, 1e-5};

            for (OptionType type : OptionType.values()) {
                double underlying = type == OptionType.CALL ? 110 : 90;
                double previousGap = Double.MAX_VALUE;
                for (double t : times) {
                    double gap = Math.abs(engine.price(underlying, 100, t, 0.20, 0.05, type).getValue() - 10.0);
                    assertThat(gap).as("%s gap at T=%s", type, t).isLessThan(previousGap);
                    previousGap = gap;
                }
                assertThat(previousGap).isLessThan(0.001);
            }
        }

        @Test
        @DisplayName("Every price is finite and at least 0.01")
        void priceFloorAcrossInputs() {
            double[] underlyings = {50, 100, 150};
            double[] strikes = {25, 100, 400};
            double[] times = {0.0, 1e-6, 0.01, 1.0, 5.0};
            double[] volatilities = {0.01, 0.20, 1.50};

            for (double s : underlyings) {
                for (double k : strikes) {
                    for (double t : times) {
                        for (double vol : volatilities) {
                            for (OptionType type : OptionType.values()) {
                                double value = engine.price(s, k, t, vol, 0.05, type).getValue();
                                assertThat(value)
                                        .as("%s S=%s K=%s T=%s vol=%s", type, s, k, t, vol)
                                        .isFinite()
                                        .isGreaterThanOrEqualTo(OptionPricingEngine.MIN_PRICE);
                            }
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("Non-finite closed form falls back to the approximation")
        void fallsBackToApproximation() {
            // Zero strike makes d1 infinite
            OptionPrice call = engine.price(100, 0, 0.5, 0.20, 0.05, OptionType.CALL);

            assertThat(call.getMethod()).isEqualTo(PricingMethod.APPROXIMATION);
            assertThat(call.isDegraded()).isTrue();
            assertThat(call.getValue()).isGreaterThan(100.0);
        }

        @Test
        @DisplayName("Approximation adds time value to intrinsic")
        void approximationAddsTimeValue() {
            // 100 * 0.2 * sqrt(0.25) * 1.0 * 0.4 = 4.0
            OptionPrice call = engine.approximate(100, 100, 0.25, 0.20, OptionType.CALL);

            assertThat(call.getValue()).isCloseTo(4.0, within(1e-9));
            assertThat(call.getMethod()).isEqualTo(PricingMethod.APPROXIMATION);
        }

        @Test
        @DisplayName("Time to expiry counts minutes to the expiry close and never goes negative")
        void timeToExpiry() {
            LocalDate expiration = LocalDate.of(2025, 9, 11);

            double oneDay = engine.timeToExpiryYears(LocalDateTime.of(2025, 9, 10, 16, 0), expiration);
            double expired = engine.timeToExpiryYears(LocalDateTime.of(2025, 9, 12, 10, 0), expiration);

            assertThat(oneDay).isCloseTo(1440 / 525600.0, within(1e-12));
            assertThat(expired).isZero();
        }
    }

    @Nested
    @DisplayName("Greeks")
    class GreeksTests {

        @Test
        @DisplayName("Call delta rises with the underlying and stays within [0, 1]")
        void callDeltaMonotonic() {
            Greeks low = engine.greeks(90, 100, 0.25, 0.20, 0.05, 0.0, OptionType.CALL);
            Greeks atm = engine.greeks(100, 100, 0.25, 0.20, 0.05, 0.0, OptionType.CALL);
            Greeks high = engine.greeks(110, 100, 0.25, 0.20, 0.05, 0.0, OptionType.CALL);

            assertThat(low.getDelta()).isLessThan(atm.getDelta());
            assertThat(atm.getDelta()).isLessThan(high.getDelta());
            assertThat(high.getDelta().doubleValue()).isBetween(0.0, 1.0);
        }

        @Test
        @DisplayName("Put delta is negative and gamma and vega are non-negative")
        void putGreeksBounds() {
            Greeks put = engine.greeks(100, 100, 0.25, 0.20, 0.05, 0.0, OptionType.PUT);

            assertThat(put.getDelta().doubleValue()).isBetween(-1.0, 0.0);
            assertThat(put.getGamma().signum()).isPositive();
            assertThat(put.getVega().signum()).isPositive();
        }

        @Test
        @DisplayName("Put delta magnitude never grows as the underlying rises")
        void putDeltaMagnitudeNonIncreasing() {
            Greeks previous = engine.greeks(70, 100, 0.25, 0.20, 0.05, 0.0, OptionType.PUT);
            for (int underlying = 75; underlying <= 130; underlying += 5) {
                Greeks current = engine.greeks(underlying, 100, 0.25, 0.20, 0.05, 0.0, OptionType.PUT);

                // Signed delta climbs from -1 toward 0, so its magnitude shrinks
                assertThat(current.getDelta().abs())
                        .as("put delta at S=%s", underlying)
                        .isLessThanOrEqualTo(previous.getDelta().abs());
                assertThat(current.getDelta().doubleValue()).isBetween(-1.0, 0.0);
                previous = current;
            }
        }

        @Test
        @DisplayName("At expiry delta is the exercise indicator")
        void expiryDelta() {
            Greeks itmCall = engine.greeks(110, 100, 0.0, 0.20, 0.05, 0.0, OptionType.CALL);
            Greeks otmPut = engine.greeks(110, 100, 0.0, 0.20, 0.05, 0.0, OptionType.PUT);

            assertThat(itmCall.getDelta().doubleValue()).isEqualTo(1.0);
            assertThat(otmPut.getDelta().doubleValue()).isEqualTo(0.0);
            assertThat(itmCall.getGamma().signum()).isZero();
        }
    }
}
