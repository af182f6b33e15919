package com.molcollab.state;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Mergeable document shared by the participants of a room.
 * <p>
 * The collaboration core only relies on applying opaque update bytes, being told about the
 * resulting change, and reading a snapshot tree; the merge strategy belongs to the implementation.
 */
public interface SharedStateStore extends AutoCloseable {

    /**
     * Apply an update. Listeners are notified with the update as emitted by the store and the
     * given origin.
     *
     * @throws com.molcollab.exception.MessageException if the bytes are not a valid update
     */
    void applyUpdate(byte[] update, String origin);

    void addUpdateListener(StateUpdateListener listener);

    /**
     * @return a detached copy of the current document tree
     */
    ObjectNode snapshot();

    /**
     * Release listeners and document state.
     */
    @Override
    void close();

    @FunctionalInterface
    interface StateUpdateListener {
        void onUpdate(byte[] update, String origin);
    }
}
