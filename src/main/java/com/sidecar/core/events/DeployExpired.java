package com.sidecar.core.events;

import com.sidecar.core.model.DeployHash;

import java.util.Objects;

/**
 * The given deploy's time-to-live elapsed before it was included in a block.
 */
public record DeployExpired(DeployHash deployHash) implements SseData {

    public DeployExpired {
        Objects.requireNonNull(deployHash, "deployHash");
    }

    public String hexEncodedHash() {
        return deployHash.toHex();
    }

    @Override
    public SseEventType type() {
        return SseEventType.DEPLOY_EXPIRED;
    }

    @Override
    public <R> R accept(SseDataVisitor<R> visitor) {
        return visitor.visitDeployExpired(this);
    }
}
