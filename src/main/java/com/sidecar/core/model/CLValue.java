package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A serialized contract-language value together with its type name.
 */
public record CLValue(
    @JsonProperty("cl_type") String clType,
    @JsonProperty("bytes") HexBytes bytes
) {

    public CLValue {
        Objects.requireNonNull(clType, "clType");
        Objects.requireNonNull(bytes, "bytes");
    }
}
