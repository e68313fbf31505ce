package com.tradeguard.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    UNAUTHORIZED("UNAUTHORIZED", 401),
    NOT_FOUND("NOT_FOUND", 404),
    RECONCILIATION_MISMATCH("RECONCILIATION_MISMATCH", 409),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    VENUE_ERROR("VENUE_ERROR", 502),
    ENGINE_NOT_READY("ENGINE_NOT_READY", 503),
    CHAIN_INTEGRITY("CHAIN_INTEGRITY", 503),
    FX_UNAVAILABLE("FX_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
