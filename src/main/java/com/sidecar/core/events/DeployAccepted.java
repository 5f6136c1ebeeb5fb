package com.sidecar.core.events;

import com.sidecar.core.model.Deploy;
import com.sidecar.core.model.DeployHash;

import java.util.Objects;

/**
 * The given deploy has been newly accepted by this node.
 * <p>
 * Holds the node's own {@link Deploy} instance. The deploy is immutable, so every
 * subscriber reads the same object and the body is never copied.
 */
public record DeployAccepted(Deploy deploy) implements SseData {

    public DeployAccepted {
        Objects.requireNonNull(deploy, "deploy");
    }

    public DeployHash deployHash() {
        return deploy.id();
    }

    public String hexEncodedHash() {
        return deploy.id().toHex();
    }

    @Override
    public SseEventType type() {
        return SseEventType.DEPLOY_ACCEPTED;
    }

    @Override
    public <R> R accept(SseDataVisitor<R> visitor) {
        return visitor.visitDeployAccepted(this);
    }
}
