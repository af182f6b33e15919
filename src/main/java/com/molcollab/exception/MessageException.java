package com.molcollab.exception;

import com.molcollab.dto.ErrorResponse.ErrorCode;

/**
 * Custom exception for malformed or unexpected client messages.
 */
public class MessageException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String details;

    public MessageException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.details = null;
    }

    public MessageException(ErrorCode errorCode, String details) {
        super(errorCode.getMessage() + ": " + details);
        this.errorCode = errorCode;
        this.details = details;
    }

    public MessageException(ErrorCode errorCode, String details, Throwable cause) {
        super(errorCode.getMessage() + ": " + details, cause);
        this.errorCode = errorCode;
        this.details = details;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getDetails() {
        return details;
    }

    public String getCode() {
        return errorCode.getCode();
    }
}
