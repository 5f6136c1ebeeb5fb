package com.sidecar.core.events;

import com.sidecar.core.model.BlockHash;
import com.sidecar.core.model.DeployHash;
import com.sidecar.core.model.ExecutionResult;
import com.sidecar.core.model.PublicKey;
import com.sidecar.core.model.TimeDiff;
import com.sidecar.core.model.Timestamp;

import java.util.List;
import java.util.Objects;

/**
 * The given deploy has been executed, committed and forms part of the given block.
 *
 * @param dependencies dependency hashes in the order the deploy header declares them,
 *                     duplicates included
 */
public record DeployProcessed(
    DeployHash deployHash,
    PublicKey account,
    Timestamp timestamp,
    TimeDiff ttl,
    List<DeployHash> dependencies,
    BlockHash blockHash,
    ExecutionResult executionResult
) implements SseData {

    public DeployProcessed {
        Objects.requireNonNull(deployHash, "deployHash");
        Objects.requireNonNull(account, "account");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(blockHash, "blockHash");
        Objects.requireNonNull(executionResult, "executionResult");
        dependencies = List.copyOf(dependencies);
    }

    public String hexEncodedHash() {
        return deployHash.toHex();
    }

    @Override
    public SseEventType type() {
        return SseEventType.DEPLOY_PROCESSED;
    }

    @Override
    public <R> R accept(SseDataVisitor<R> visitor) {
        return visitor.visitDeployProcessed(this);
    }
}
