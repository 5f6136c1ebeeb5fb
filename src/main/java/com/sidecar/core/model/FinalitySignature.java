package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A validator's attestation that a block is finalized.
 */
public record FinalitySignature(
    @JsonProperty("block_hash") BlockHash blockHash,
    @JsonProperty("era_id") EraId eraId,
    @JsonProperty("signature") Signature signature,
    @JsonProperty("public_key") PublicKey publicKey
) {

    public FinalitySignature {
        Objects.requireNonNull(blockHash, "blockHash");
        Objects.requireNonNull(eraId, "eraId");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(publicKey, "publicKey");
    }
}
