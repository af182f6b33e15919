package com.molcollab.model;

import java.util.List;

/**
 * Roster entry as sent to clients and stored in snapshots.
 */
public record ParticipantInfo(
        String userId,
        String sessionId,
        Role role,
        Vector3 cursor,
        List<Integer> selection
) {
    public ParticipantInfo {
        selection = selection == null ? List.of() : List.copyOf(selection);
        if (cursor == null) cursor = Vector3.ORIGIN;
    }
}
