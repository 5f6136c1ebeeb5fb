package com.sidecar.core.model;

import java.util.Objects;

/**
 * Hash identifying a deploy.
 */
public record DeployHash(Digest inner) {

    public DeployHash {
        Objects.requireNonNull(inner, "inner");
    }

    public String toHex() {
        return inner.toHex();
    }
}
