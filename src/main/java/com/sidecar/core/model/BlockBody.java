package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Body of a block: its proposer and the deploys and transfers it contains, in execution order.
 */
public record BlockBody(
    @JsonProperty("proposer") PublicKey proposer,
    @JsonProperty("deploy_hashes") List<DeployHash> deployHashes,
    @JsonProperty("transfer_hashes") List<DeployHash> transferHashes
) {

    public BlockBody {
        Objects.requireNonNull(proposer, "proposer");
        deployHashes = List.copyOf(deployHashes);
        transferHashes = List.copyOf(transferHashes);
    }
}
