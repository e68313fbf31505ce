package com.tradeguard.ledger;

import java.math.BigDecimal;

/**
 * Source of conversion rates into the base currency. Implemented by an external collaborator;
 * calls may be slow or fail and are always wrapped with a timeout by {@link FxRateService}.
 */
public interface FxRateProvider {

    /** Units of {@code baseCurrency} per one unit of {@code currency}. */
    BigDecimal rate(String currency, String baseCurrency);
}
