package com.molcollab.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Standardized error response DTO.
 * Provides consistent error format across REST endpoints and WebSocket error frames.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String type;
    private String code;
    private String message;
    private String details;
    private LocalDateTime timestamp;
    private String path;

    public ErrorResponse() {
        this.timestamp = LocalDateTime.now();
    }

    public ErrorResponse(String code, String message) {
        this();
        this.code = code;
        this.message = message;
        this.type = "error";
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
    }

    public static ErrorResponse of(ErrorCode errorCode, String details) {
        ErrorResponse response = new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
        response.setDetails(details);
        return response;
    }

    // Error code enum for standardized codes
    public enum ErrorCode {
        // Authentication errors (AUTH_XXX)
        AUTH_001("AUTH_001", "Invalid authentication token"),

        // Room errors (ROOM_XXX)
        ROOM_001("ROOM_001", "Room not found"),

        // Recording errors (REC_XXX)
        REC_001("REC_001", "Room is already recording"),
        REC_002("REC_002", "Room is not recording"),
        REC_003("REC_003", "Recording not found"),
        REC_004("REC_004", "Origin user id exceeds 36 bytes"),

        // Replay errors (RPL_XXX)
        RPL_001("RPL_001", "Corrupt event"),
        RPL_002("RPL_002", "Invalid recording"),
        RPL_003("RPL_003", "Replay session not found"),

        // Message errors (MSG_XXX)
        MSG_001("MSG_001", "Malformed message"),
        MSG_002("MSG_002", "Unknown message type"),
        MSG_003("MSG_003", "Handshake required"),

        // Validation errors (VAL_XXX)
        VAL_001("VAL_001", "Invalid input"),
        VAL_002("VAL_002", "Missing required field"),
        VAL_003("VAL_003", "Field too long"),

        // Server errors (SRV_XXX)
        SRV_001("SRV_001", "Internal server error");

        private final String code;
        private final String message;

        ErrorCode(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }
    }

    // Getters and Setters
    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(LocalDateTime timestamp) {
        this.timestamp = timestamp;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
