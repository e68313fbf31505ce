package com.tradeguard.domain.vo;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Value;

/** Conversion rate from a currency into the base currency. {@code stale} marks a fallback rate. */
@Value
public class FxQuote {

    String currency;
    BigDecimal rate;
    Instant asOf;
    boolean stale;

    public static FxQuote identity(String currency, Instant asOf) {
        return new FxQuote(currency, BigDecimal.ONE, asOf, false);
    }

    public BigDecimal convert(BigDecimal amount) {
        return amount.multiply(rate);
    }
}
