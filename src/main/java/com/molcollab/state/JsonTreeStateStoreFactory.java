package com.molcollab.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.exception.ReplayException;
import org.springframework.stereotype.Component;

/**
 * Builds {@link JsonTreeStateStore} documents seeded with the molecular scene layout:
 * molecule, per-user selections, annotations, camera and trajectory playback.
 */
@Component
public class JsonTreeStateStoreFactory implements SharedStateStoreFactory {

    private final ObjectMapper objectMapper;

    public JsonTreeStateStoreFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public SharedStateStore create(String subjectId) {
        ObjectNode scene = objectMapper.createObjectNode();

        ObjectNode molecule = scene.putObject("molecule");
        molecule.put("id", subjectId);
        molecule.putArray("atoms");
        molecule.putArray("bonds");

        scene.putObject("selections");
        scene.putArray("annotations");

        ObjectNode camera = scene.putObject("camera");
        ObjectNode position = camera.putObject("position");
        position.put("x", 0).put("y", 0).put("z", 10);
        ObjectNode target = camera.putObject("target");
        target.put("x", 0).put("y", 0).put("z", 0);
        camera.put("fov", 45);

        ObjectNode playback = scene.putObject("playback");
        playback.put("isPlaying", false);
        playback.put("currentFrame", 0);
        playback.put("totalFrames", 0);

        return new JsonTreeStateStore(objectMapper, scene);
    }

    @Override
    public SharedStateStore restore(JsonNode snapshot) {
        if (!(snapshot instanceof ObjectNode objectSnapshot)) {
            throw new ReplayException(ErrorCode.RPL_002, "Snapshot state must be a JSON object");
        }
        return new JsonTreeStateStore(objectMapper, objectSnapshot);
    }
}
