package com.molcollab.validation;

import com.molcollab.config.CollaborationProperties;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.exception.MessageException;
import com.molcollab.model.Vector3;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Centralized validation for handshake fields and post-handshake payloads.
 */
@Component
public class InputValidator {

    // Must fit the fixed user id field of the binary event layout
    public static final int MAX_USER_ID_BYTES = 36;
    public static final int MAX_SUBJECT_ID_LENGTH = 128;
    private static final int MAX_USERNAME_LENGTH = 64;

    private final int maxChatLength;

    public InputValidator(CollaborationProperties properties) {
        this.maxChatLength = properties.getChat().getMaxLength();
    }

    public void validateUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new MessageException(ErrorCode.VAL_002, "userId is required");
        }
        int bytes = userId.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > MAX_USER_ID_BYTES) {
            throw new MessageException(ErrorCode.VAL_003,
                    "userId is " + bytes + " bytes, maximum is " + MAX_USER_ID_BYTES);
        }
    }

    public void validateSubjectId(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new MessageException(ErrorCode.VAL_002, "subjectId is required");
        }
        if (subjectId.length() > MAX_SUBJECT_ID_LENGTH) {
            throw new MessageException(ErrorCode.VAL_003,
                    "subjectId exceeds maximum length of " + MAX_SUBJECT_ID_LENGTH);
        }
    }

    public void validateRoomId(String roomId) {
        if (roomId == null || roomId.isBlank()) {
            throw new MessageException(ErrorCode.VAL_002, "roomId is required");
        }
    }

    /**
     * Sanitize and bound a chat line.
     *
     * @return the text with control characters removed and surrounding whitespace trimmed
     */
    public String validateChatMessage(String text) {
        String sanitized = sanitize(text);
        if (sanitized == null || sanitized.isEmpty()) {
            throw new MessageException(ErrorCode.VAL_002, "message is required");
        }
        if (sanitized.length() > maxChatLength) {
            throw new MessageException(ErrorCode.VAL_003, "message exceeds maximum length of " + maxChatLength);
        }
        return sanitized;
    }

    /**
     * Display name for chat; falls back to the user id when absent.
     */
    public String validateUsername(String username, String fallback) {
        String sanitized = sanitize(username);
        if (sanitized == null || sanitized.isEmpty()) {
            return fallback;
        }
        if (sanitized.length() > MAX_USERNAME_LENGTH) {
            throw new MessageException(ErrorCode.VAL_003, "username exceeds maximum length of " + MAX_USERNAME_LENGTH);
        }
        return sanitized;
    }

    public void validateCursor(Vector3 cursor) {
        if (cursor == null || !cursor.isFinite()) {
            throw new MessageException(ErrorCode.VAL_001, "cursor must have finite x, y and z");
        }
    }

    public void validateSelection(List<Integer> selection) {
        for (Integer index : selection) {
            if (index == null || index < 0) {
                throw new MessageException(ErrorCode.VAL_001, "selection indices must be non-negative integers");
            }
        }
    }

    /**
     * Remove control characters (except line breaks and tabs) and trim.
     */
    public String sanitize(String input) {
        if (input == null) {
            return null;
        }
        return input.replaceAll("[\\p{Cntrl}&&[^\r\n\t]]", "").trim();
    }
}
