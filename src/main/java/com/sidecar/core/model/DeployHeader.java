package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Header of a deploy.
 *
 * @param account      the account that submitted the deploy
 * @param timestamp    when the deploy was created
 * @param ttl          how long the deploy may wait for inclusion before it expires
 * @param gasPrice     gas price offered by the submitter
 * @param bodyHash     hash of the payment and session code
 * @param dependencies deploys that must execute first, in declaration order
 * @param chainName    name of the chain the deploy targets
 */
public record DeployHeader(
    @JsonProperty("account") PublicKey account,
    @JsonProperty("timestamp") Timestamp timestamp,
    @JsonProperty("ttl") TimeDiff ttl,
    @JsonProperty("gas_price") long gasPrice,
    @JsonProperty("body_hash") Digest bodyHash,
    @JsonProperty("dependencies") List<DeployHash> dependencies,
    @JsonProperty("chain_name") String chainName
) {

    public DeployHeader {
        Objects.requireNonNull(account, "account");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(bodyHash, "bodyHash");
        Objects.requireNonNull(chainName, "chainName");
        dependencies = List.copyOf(dependencies);
    }
}
