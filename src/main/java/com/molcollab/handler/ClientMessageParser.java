package com.molcollab.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.molcollab.codec.UpdateBytes;
import com.molcollab.dto.ClientMessage;
import com.molcollab.dto.ClientMessageType;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.dto.HandshakeAction;
import com.molcollab.exception.MessageException;
import com.molcollab.model.Vector3;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns client text frames into {@link ClientMessage}s and reads their typed payloads.
 * Every failure is a {@link MessageException}: {@code MSG_001} for malformed input and
 * {@code MSG_002} for a type tag outside the protocol.
 */
@Component
public class ClientMessageParser {

    private final ObjectMapper objectMapper;

    public ClientMessageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ClientMessage parse(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MessageException(ErrorCode.MSG_001, "not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MessageException(ErrorCode.MSG_001, "message must be a JSON object");
        }

        String typeName = root.path("type").asText(null);
        if (typeName == null) {
            throw new MessageException(ErrorCode.MSG_001, "type is required");
        }
        ClientMessageType type = ClientMessageType.fromWireName(typeName)
                .orElseThrow(() -> new MessageException(ErrorCode.MSG_002, typeName));

        if (type != ClientMessageType.HANDSHAKE) {
            return ClientMessage.of(type, root.path("payload"));
        }

        String actionName = root.path("action").asText(null);
        HandshakeAction action = HandshakeAction.fromWireName(actionName)
                .orElseThrow(() -> new MessageException(ErrorCode.MSG_001, "unknown handshake action " + actionName));

        // Older clients send the subject as moleculeId
        String subjectId = text(root, "subjectId");
        if (subjectId == null) {
            subjectId = text(root, "moleculeId");
        }
        return ClientMessage.handshake(action, text(root, "userId"), text(root, "roomId"), subjectId,
                text(root, "token"));
    }

    /**
     * Cursor as {@code {x,y,z}} or wrapped in {@code {cursor:{...}}}.
     */
    public Vector3 readCursor(JsonNode payload) {
        JsonNode node = payload.has("cursor") ? payload.get("cursor") : payload;
        if (!node.isObject()) {
            throw new MessageException(ErrorCode.MSG_001, "cursor must be an object");
        }
        return new Vector3(number(node, "x"), number(node, "y"), number(node, "z"));
    }

    /**
     * Selection as an array of atom indices or wrapped in {@code {selection:[...]}}.
     */
    public List<Integer> readSelection(JsonNode payload) {
        JsonNode node = payload.has("selection") ? payload.get("selection") : payload;
        if (!node.isArray()) {
            throw new MessageException(ErrorCode.MSG_001, "selection must be an array");
        }
        List<Integer> selection = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isIntegralNumber() || !element.canConvertToInt()) {
                throw new MessageException(ErrorCode.MSG_001, "selection entries must be integers");
            }
            selection.add(element.intValue());
        }
        return selection;
    }

    /**
     * Update bytes as a byte-value array, base64 text, or either wrapped in {@code {update:...}}.
     */
    public byte[] readUpdate(JsonNode payload) {
        JsonNode node = payload.isObject() && payload.has("update") ? payload.get("update") : payload;
        try {
            return UpdateBytes.fromJson(node);
        } catch (IllegalArgumentException e) {
            throw new MessageException(ErrorCode.MSG_001, e.getMessage(), e);
        }
    }

    public ChatLine readChat(JsonNode payload) {
        if (payload.isTextual()) {
            return new ChatLine(null, payload.asText());
        }
        if (!payload.isObject()) {
            throw new MessageException(ErrorCode.MSG_001, "chat payload must be an object");
        }
        String body = text(payload, "text");
        if (body == null) {
            body = text(payload, "message");
        }
        return new ChatLine(text(payload, "username"), body);
    }

    /**
     * A JSON object either wrapped under {@code field} or given directly as the payload.
     */
    public JsonNode readObject(JsonNode payload, String field) {
        JsonNode node = payload.has(field) ? payload.get(field) : payload;
        if (!node.isObject()) {
            throw new MessageException(ErrorCode.MSG_001, field + " must be an object");
        }
        return node.deepCopy();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new MessageException(ErrorCode.MSG_001, "cursor." + field + " must be a number");
        }
        return value.doubleValue();
    }

    public record ChatLine(String username, String text) {
    }
}
