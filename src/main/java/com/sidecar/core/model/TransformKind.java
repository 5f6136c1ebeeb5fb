package com.sidecar.core.model;

import java.util.Optional;

/**
 * Kinds of global state transformation. Kinds that carry a value are rendered as
 * {@code {"AddUInt64": "8"}}; the rest as a bare name.
 */
public enum TransformKind {
    IDENTITY("Identity", false),
    WRITE_CL_VALUE("WriteCLValue", true),
    ADD_INT32("AddInt32", true),
    ADD_UINT64("AddUInt64", true),
    ADD_UINT512("AddUInt512", true),
    ADD_KEYS("AddKeys", true),
    FAILURE("Failure", true);

    private final String wireName;
    private final boolean carriesValue;

    TransformKind(String wireName, boolean carriesValue) {
        this.wireName = wireName;
        this.carriesValue = carriesValue;
    }

    public String wireName() {
        return wireName;
    }

    public boolean carriesValue() {
        return carriesValue;
    }

    public static Optional<TransformKind> fromWireName(String name) {
        for (TransformKind kind : values()) {
            if (kind.wireName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
