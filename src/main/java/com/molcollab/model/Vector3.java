package com.molcollab.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 3D cursor position in scene coordinates.
 */
public record Vector3(double x, double y, double z) {

    public static final Vector3 ORIGIN = new Vector3(0, 0, 0);

    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }
}
