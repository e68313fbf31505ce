package com.tradeguard.exception;

import java.util.Map;

/**
 * Simulated or live execution failure. The affected order moves to REJECTED and the
 * strategy may resubmit under a new intent id.
 */
public class VenueException extends BaseException {

    public VenueException(String message) {
        super(ErrorCode.VENUE_ERROR, message);
    }

    public VenueException(String message, Map<String, Object> details) {
        super(ErrorCode.VENUE_ERROR, message, details);
    }

    public VenueException(String message, Throwable cause) {
        super(ErrorCode.VENUE_ERROR, message, cause);
    }
}
