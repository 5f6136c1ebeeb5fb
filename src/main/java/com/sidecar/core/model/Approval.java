package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A signer's approval of a deploy hash.
 */
public record Approval(
    @JsonProperty("signer") PublicKey signer,
    @JsonProperty("signature") Signature signature
) {

    public Approval {
        Objects.requireNonNull(signer, "signer");
        Objects.requireNonNull(signature, "signature");
    }
}
