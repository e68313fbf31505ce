package com.tradeguard.exception;

import java.util.Map;

public class FxRateUnavailableException extends BaseException {

    public FxRateUnavailableException(String currency, Throwable cause) {
        super(ErrorCode.FX_UNAVAILABLE, "No usable FX rate for " + currency, cause);
    }

    public FxRateUnavailableException(String currency) {
        super(ErrorCode.FX_UNAVAILABLE, "No usable FX rate for " + currency, Map.of("currency", currency));
    }
}
