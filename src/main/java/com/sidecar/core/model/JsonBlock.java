package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A stored block in the shape the node exposes to clients.
 */
public record JsonBlock(
    @JsonProperty("hash") BlockHash hash,
    @JsonProperty("header") BlockHeader header,
    @JsonProperty("body") BlockBody body,
    @JsonProperty("proofs") List<BlockProof> proofs
) {

    public JsonBlock {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(body, "body");
        proofs = List.copyOf(proofs);
    }

    public long height() {
        return header.height();
    }
}
