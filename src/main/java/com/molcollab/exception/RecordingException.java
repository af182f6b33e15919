package com.molcollab.exception;

import com.molcollab.dto.ErrorResponse.ErrorCode;

/**
 * Custom exception for recording lifecycle and encoding errors.
 */
public class RecordingException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String details;

    public RecordingException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.details = null;
    }

    public RecordingException(ErrorCode errorCode, String details) {
        super(errorCode.getMessage() + ": " + details);
        this.errorCode = errorCode;
        this.details = details;
    }

    public RecordingException(ErrorCode errorCode, String details, Throwable cause) {
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
