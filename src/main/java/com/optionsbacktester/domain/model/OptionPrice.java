package com.optionsbacktester.domain.model;

import com.optionsbacktester.domain.enums.PricingMethod;
import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Value;

/** A theoretical option value together with how it was produced. */
@Value
public class OptionPrice {

    double value;
    PricingMethod method;

    public boolean isDegraded() {
        return method.isDegraded();
    }

    public BigDecimal toBigDecimal(int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
    }
}
