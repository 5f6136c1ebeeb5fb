package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Header of a block on the linear chain.
 */
public record BlockHeader(
    @JsonProperty("parent_hash") BlockHash parentHash,
    @JsonProperty("state_root_hash") Digest stateRootHash,
    @JsonProperty("body_hash") Digest bodyHash,
    @JsonProperty("random_bit") boolean randomBit,
    @JsonProperty("accumulated_seed") Digest accumulatedSeed,
    @JsonProperty("timestamp") Timestamp timestamp,
    @JsonProperty("era_id") EraId eraId,
    @JsonProperty("height") long height,
    @JsonProperty("protocol_version") ProtocolVersion protocolVersion
) {

    public BlockHeader {
        Objects.requireNonNull(parentHash, "parentHash");
        Objects.requireNonNull(stateRootHash, "stateRootHash");
        Objects.requireNonNull(bodyHash, "bodyHash");
        Objects.requireNonNull(accumulatedSeed, "accumulatedSeed");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(eraId, "eraId");
        Objects.requireNonNull(protocolVersion, "protocolVersion");
        if (height < 0) {
            throw new IllegalArgumentException("Block height must not be negative: " + height);
        }
    }
}
