package com.molcollab.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PlaybackState {
    STOPPED, PLAYING, PAUSED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
