package com.molcollab.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.exception.MessageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Last-writer-wins document over a JSON tree, keyed by dotted field path.
 * <p>
 * Update wire format (UTF-8 JSON):
 * <pre>
 * {"ops":[{"op":"set","path":"camera.fov","value":60},
 *         {"op":"push","path":"annotations","value":{...}},
 *         {"op":"remove","path":"playback"}]}
 * </pre>
 * "Last" is the apply order, which the owning room serializes. A whole update is validated
 * before any op is applied, so a rejected update leaves the document untouched.
 * Not thread-safe; callers provide the single-writer discipline.
 */
public class JsonTreeStateStore implements SharedStateStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonTreeStateStore.class);

    private final ObjectMapper objectMapper;
    private final List<StateUpdateListener> listeners = new CopyOnWriteArrayList<>();
    private ObjectNode document;

    public JsonTreeStateStore(ObjectMapper objectMapper, ObjectNode initial) {
        this.objectMapper = objectMapper;
        this.document = initial == null ? objectMapper.createObjectNode() : initial.deepCopy();
    }

    @Override
    public void applyUpdate(byte[] update, String origin) {
        ArrayNode ops = parseOps(update);

        for (JsonNode op : ops) {
            applyOp(op);
        }

        ObjectNode canonical = objectMapper.createObjectNode();
        canonical.set("ops", ops);
        byte[] emitted;
        try {
            emitted = objectMapper.writeValueAsBytes(canonical);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize applied update", e);
        }

        for (StateUpdateListener listener : listeners) {
            listener.onUpdate(emitted, origin);
        }
    }

    @Override
    public void addUpdateListener(StateUpdateListener listener) {
        listeners.add(listener);
    }

    @Override
    public ObjectNode snapshot() {
        return document.deepCopy();
    }

    @Override
    public void close() {
        listeners.clear();
        document = objectMapper.createObjectNode();
    }

    private ArrayNode parseOps(byte[] update) {
        if (update == null || update.length == 0) {
            throw new MessageException(ErrorCode.MSG_001, "Empty state update");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(update);
        } catch (IOException e) {
            throw new MessageException(ErrorCode.MSG_001, "State update is not valid JSON", e);
        }
        if (root == null || !root.path("ops").isArray()) {
            throw new MessageException(ErrorCode.MSG_001, "State update must carry an 'ops' array");
        }

        ArrayNode ops = (ArrayNode) root.get("ops");
        for (JsonNode op : ops) {
            String kind = op.path("op").asText("");
            String path = op.path("path").asText("");
            if (path.isEmpty() || path.startsWith(".") || path.endsWith(".") || path.contains("..")) {
                throw new MessageException(ErrorCode.MSG_001, "Invalid path: '" + path + "'");
            }
            switch (kind) {
                case "set", "push" -> {
                    if (!op.has("value")) {
                        throw new MessageException(ErrorCode.MSG_001, "Op '" + kind + "' requires a value");
                    }
                }
                case "remove" -> { }
                default -> throw new MessageException(ErrorCode.MSG_001, "Unknown op: '" + kind + "'");
            }
        }
        return ops.deepCopy();
    }

    private void applyOp(JsonNode op) {
        String[] segments = op.get("path").asText().split("\\.");
        String leaf = segments[segments.length - 1];

        switch (op.get("op").asText()) {
            case "set" -> parentOf(segments, true).set(leaf, op.get("value").deepCopy());
            case "push" -> {
                ObjectNode parent = parentOf(segments, true);
                JsonNode existing = parent.get(leaf);
                ArrayNode array = existing instanceof ArrayNode a ? a : parent.putArray(leaf);
                array.add(op.get("value").deepCopy());
            }
            case "remove" -> {
                ObjectNode parent = parentOf(segments, false);
                if (parent != null) {
                    parent.remove(leaf);
                }
            }
            default -> logger.warn("Skipping unknown op {}", op);
        }
    }

    /**
     * Walk to the object holding the last path segment. Missing or scalar intermediates are
     * replaced by objects when {@code create} is set, otherwise the walk yields {@code null}.
     */
    private ObjectNode parentOf(String[] segments, boolean create) {
        ObjectNode node = document;
        for (int i = 0; i < segments.length - 1; i++) {
            JsonNode child = node.get(segments[i]);
            if (child instanceof ObjectNode objectChild) {
                node = objectChild;
            } else if (create) {
                node = node.putObject(segments[i]);
            } else {
                return null;
            }
        }
        return node;
    }
}
