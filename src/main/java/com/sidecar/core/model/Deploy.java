package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A deploy as accepted by the node. Immutable; safe to share between threads.
 */
public record Deploy(
    @JsonProperty("hash") DeployHash hash,
    @JsonProperty("header") DeployHeader header,
    @JsonProperty("payment") ExecutableDeployItem payment,
    @JsonProperty("session") ExecutableDeployItem session,
    @JsonProperty("approvals") List<Approval> approvals
) {

    public Deploy {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(payment, "payment");
        Objects.requireNonNull(session, "session");
        approvals = List.copyOf(approvals);
    }

    public DeployHash id() {
        return hash;
    }
}
