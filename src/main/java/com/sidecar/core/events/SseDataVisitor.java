package com.sidecar.core.events;

/**
 * Exhaustive handler over the {@link SseData} variants.
 */
public interface SseDataVisitor<R> {

    R visitApiVersion(ApiVersion event);

    R visitBlockAdded(BlockAdded event);

    R visitDeployAccepted(DeployAccepted event);

    R visitDeployProcessed(DeployProcessed event);

    R visitDeployExpired(DeployExpired event);

    R visitFault(Fault event);

    R visitFinalitySignature(FinalitySignature event);

    R visitStep(Step event);
}
