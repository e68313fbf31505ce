package com.tradeguard.exception;

import java.util.Map;

/**
 * Raised when trading is refused because the last reconciliation found discrepancies.
 * Fatal to trading until an operator reviews and resets the kill switch.
 */
public class ReconciliationMismatchException extends BaseException {

    public ReconciliationMismatchException(String message, Map<String, Object> details) {
        super(ErrorCode.RECONCILIATION_MISMATCH, message, details);
    }
}
