package com.tradeguard.exception;

import java.util.Map;

/**
 * The audit hash chain failed verification. The engine refuses new intents until an
 * operator intervenes.
 */
public class ChainIntegrityException extends BaseException {

    public ChainIntegrityException(String message, Map<String, Object> details) {
        super(ErrorCode.CHAIN_INTEGRITY, message, details);
    }

    public ChainIntegrityException(String message, Throwable cause) {
        super(ErrorCode.CHAIN_INTEGRITY, message, cause);
    }
}
