package com.sidecar.testing;

import com.sidecar.core.events.ApiVersion;
import com.sidecar.core.events.BlockAdded;
import com.sidecar.core.events.DeployAccepted;
import com.sidecar.core.events.DeployExpired;
import com.sidecar.core.events.DeployProcessed;
import com.sidecar.core.events.Fault;
import com.sidecar.core.events.FinalitySignature;
import com.sidecar.core.events.SseData;
import com.sidecar.core.events.Step;
import com.sidecar.core.model.BlockHash;
import com.sidecar.core.model.Deploy;
import com.sidecar.core.model.DeployHash;
import com.sidecar.core.model.Digest;
import com.sidecar.core.model.JsonBlock;

import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * One random constructor per event variant, plus overloads that pin the identifying field.
 */
public final class RandomEvents {

    private RandomEvents() {}

    public static ApiVersion apiVersion(TestRng rng) {
        return new ApiVersion(RandomModel.protocolVersion(rng));
    }

    public static BlockAdded blockAdded(TestRng rng) {
        JsonBlock block = RandomModel.block(rng);
        return new BlockAdded(block.hash(), block);
    }

    public static BlockAdded blockAddedWithHeight(TestRng rng, long height) {
        JsonBlock block = RandomModel.block(rng, height);
        return new BlockAdded(block.hash(), block);
    }

    /**
     * @param hexHash 64 hex characters to use as the event's block hash
     */
    public static BlockAdded blockAddedWithHash(TestRng rng, String hexHash) {
        JsonBlock block = RandomModel.block(rng);
        BlockHash blockHash = new BlockHash(new Digest(HexFormat.of().parseHex(hexHash)));
        return new BlockAdded(blockHash, block);
    }

    public static DeployAccepted deployAccepted(TestRng rng) {
        return new DeployAccepted(RandomModel.deploy(rng));
    }

    /**
     * Takes account, timestamp, ttl and dependencies from a fresh random deploy; the deploy
     * hash is that deploy's unless one is given.
     */
    public static DeployProcessed deployProcessed(TestRng rng, Optional<DeployHash> withDeployHash) {
        Deploy deploy = RandomModel.deploy(rng);
        return new DeployProcessed(
                withDeployHash.orElse(deploy.id()),
                deploy.header().account(),
                deploy.header().timestamp(),
                deploy.header().ttl(),
                deploy.header().dependencies(),
                RandomModel.blockHash(rng),
                RandomModel.executionResult(rng));
    }

    public static DeployProcessed deployProcessed(TestRng rng) {
        return deployProcessed(rng, Optional.empty());
    }

    public static DeployExpired deployExpired(TestRng rng, Optional<DeployHash> withDeployHash) {
        return new DeployExpired(withDeployHash.orElseGet(() -> RandomModel.deploy(rng).id()));
    }

    public static DeployExpired deployExpired(TestRng rng) {
        return deployExpired(rng, Optional.empty());
    }

    public static Fault fault(TestRng rng) {
        return new Fault(RandomModel.eraId(rng), RandomModel.publicKey(rng), RandomModel.timestamp(rng));
    }

    public static FinalitySignature finalitySignature(TestRng rng) {
        return new FinalitySignature(RandomModel.finalitySignature(rng, RandomModel.blockHash(rng)));
    }

    public static Step step(TestRng rng) {
        return new Step(RandomModel.eraId(rng), RandomModel.executionResult(rng).effect());
    }

    /**
     * A random non-handshake event.
     */
    public static SseData any(TestRng rng) {
        return switch (rng.nextInt(7)) {
            case 0 -> blockAdded(rng);
            case 1 -> deployAccepted(rng);
            case 2 -> deployProcessed(rng);
            case 3 -> deployExpired(rng);
            case 4 -> fault(rng);
            case 5 -> finalitySignature(rng);
            default -> step(rng);
        };
    }

    /**
     * One instance of every variant, handshake first.
     */
    public static List<SseData> everyVariant(TestRng rng) {
        return List.of(
                apiVersion(rng),
                blockAdded(rng),
                deployAccepted(rng),
                deployProcessed(rng),
                deployExpired(rng),
                fault(rng),
                finalitySignature(rng),
                step(rng));
    }
}
