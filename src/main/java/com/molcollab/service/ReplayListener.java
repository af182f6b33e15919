package com.molcollab.service;

import com.molcollab.model.RoomEvent;

/**
 * Observer of a replay's progress. All callbacks run on the thread driving the engine.
 */
public interface ReplayListener {

    ReplayListener NONE = new ReplayListener() {
    };

    /**
     * An event other than a snapshot was applied to the reconstructed views.
     */
    default void onEventApplied(int index, RoomEvent event) {
    }

    /**
     * Reconstructed state was replaced wholesale from the snapshot at the given index.
     */
    default void onStateRestored(int index) {
    }

    /**
     * Playback applied the last event and stopped.
     */
    default void onPlaybackComplete() {
    }
}
