package com.copytrader.exception;

import java.util.Map;

/** A request parameter is outside the range an endpoint accepts. */
public class InvalidRequestException extends BaseException {

    public InvalidRequestException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
