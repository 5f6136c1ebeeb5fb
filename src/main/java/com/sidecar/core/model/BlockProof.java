package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A validator's signature over a block, as carried in the block's proofs.
 */
public record BlockProof(
    @JsonProperty("public_key") PublicKey publicKey,
    @JsonProperty("signature") Signature signature
) {

    public BlockProof {
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(signature, "signature");
    }
}
