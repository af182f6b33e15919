package com.molcollab.state;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Creates store instances for live rooms and for replay reconstruction.
 */
public interface SharedStateStoreFactory {

    /**
     * New document for a freshly created room around the given subject.
     */
    SharedStateStore create(String subjectId);

    /**
     * New document whose entire content is the given snapshot tree.
     */
    SharedStateStore restore(JsonNode snapshot);
}
