package com.sidecar.core.model;

import java.util.Objects;

/**
 * A transformation applied to one global state key. {@code value} is present exactly when
 * the kind carries one.
 */
public record Transform(TransformKind kind, String value) {

    public Transform {
        Objects.requireNonNull(kind, "kind");
        if (kind.carriesValue() && value == null) {
            throw new IllegalArgumentException(kind.wireName() + " requires a value");
        }
        if (!kind.carriesValue() && value != null) {
            throw new IllegalArgumentException(kind.wireName() + " does not take a value");
        }
    }

    public static Transform identity() {
        return new Transform(TransformKind.IDENTITY, null);
    }

    public static Transform of(TransformKind kind, String value) {
        return new Transform(kind, value);
    }
}
