package com.copytrader.exception;

/** The venue API could not be reached or returned something unusable. */
public class VenueException extends BaseException {

    public VenueException(String message) {
        super(ErrorCode.VENUE_ERROR, message);
    }

    public VenueException(String message, Throwable cause) {
        super(ErrorCode.VENUE_ERROR, message, cause);
    }
}
