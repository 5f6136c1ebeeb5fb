package com.sidecar.core.model;

import java.util.Objects;

/**
 * Hash identifying a block.
 */
public record BlockHash(Digest inner) {

    public BlockHash {
        Objects.requireNonNull(inner, "inner");
    }

    public String toHex() {
        return inner.toHex();
    }
}
