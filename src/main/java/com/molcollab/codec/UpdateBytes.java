package com.molcollab.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.io.IOException;

/**
 * Conversions between raw state-update bytes and their JSON carriers: an array of unsigned
 * byte values (what browser clients send) or a base64 string.
 */
public final class UpdateBytes {

    private UpdateBytes() {}

    public static int[] toUnsigned(byte[] bytes) {
        int[] values = new int[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            values[i] = Byte.toUnsignedInt(bytes[i]);
        }
        return values;
    }

    public static ArrayNode toJson(byte[] bytes) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode(bytes.length);
        for (byte b : bytes) {
            array.add(Byte.toUnsignedInt(b));
        }
        return array;
    }

    /**
     * @throws IllegalArgumentException if the node is neither a byte-value array nor base64 text
     */
    public static byte[] fromJson(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            throw new IllegalArgumentException("update bytes are missing");
        }
        if (node.isTextual()) {
            try {
                return node.binaryValue();
            } catch (IOException e) {
                throw new IllegalArgumentException("update is not valid base64", e);
            }
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("update must be an array of byte values or base64 text");
        }
        byte[] bytes = new byte[node.size()];
        for (int i = 0; i < bytes.length; i++) {
            JsonNode value = node.get(i);
            if (!value.canConvertToInt() || !value.isIntegralNumber() || value.asInt() < 0 || value.asInt() > 255) {
                throw new IllegalArgumentException("update[" + i + "] is not a byte value");
            }
            bytes[i] = (byte) value.asInt();
        }
        return bytes;
    }
}
