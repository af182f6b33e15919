package com.molcollab.controller;

import com.molcollab.dto.ErrorResponse;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.exception.AuthException;
import com.molcollab.exception.MessageException;
import com.molcollab.exception.RecordingException;
import com.molcollab.exception.ReplayException;
import com.molcollab.exception.RoomException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps the error-code exceptions thrown by the services to HTTP responses with an
 * {@link ErrorResponse} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RoomException.class)
    public ResponseEntity<ErrorResponse> handleRoom(RoomException e, ServerWebExchange exchange) {
        return respond(e.getErrorCode(), e.getDetails(), exchange);
    }

    @ExceptionHandler(RecordingException.class)
    public ResponseEntity<ErrorResponse> handleRecording(RecordingException e, ServerWebExchange exchange) {
        return respond(e.getErrorCode(), e.getDetails(), exchange);
    }

    @ExceptionHandler(ReplayException.class)
    public ResponseEntity<ErrorResponse> handleReplay(ReplayException e, ServerWebExchange exchange) {
        return respond(e.getErrorCode(), e.getDetails(), exchange);
    }

    @ExceptionHandler(MessageException.class)
    public ResponseEntity<ErrorResponse> handleMessage(MessageException e, ServerWebExchange exchange) {
        return respond(e.getErrorCode(), e.getDetails(), exchange);
    }

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ErrorResponse> handleAuth(AuthException e, ServerWebExchange exchange) {
        return respond(e.getErrorCode(), e.getDetails(), exchange);
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    public ResponseEntity<ErrorResponse> handleBadInput(Exception e, ServerWebExchange exchange) {
        return respond(ErrorCode.VAL_001, e.getMessage(), exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, ServerWebExchange exchange) {
        log.error("Unhandled exception on {}", exchange.getRequest().getPath(), e);
        return respond(ErrorCode.SRV_001, null, exchange);
    }

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case ROOM_001, REC_003, RPL_003 -> HttpStatus.NOT_FOUND;
            case REC_001, REC_002 -> HttpStatus.CONFLICT;
            case AUTH_001 -> HttpStatus.UNAUTHORIZED;
            case SRV_001 -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCode code, String details, ServerWebExchange exchange) {
        HttpStatus status = statusOf(code);
        if (status.is4xxClientError()) {
            log.warn("{} {} -> {} {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(),
                    code.getCode(), details != null ? details : code.getMessage());
        }
        ErrorResponse body = details == null ? ErrorResponse.of(code) : ErrorResponse.of(code, details);
        body.setPath(exchange.getRequest().getPath().value());
        return ResponseEntity.status(status).body(body);
    }
}
