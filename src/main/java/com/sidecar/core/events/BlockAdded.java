package com.sidecar.core.events;

import com.sidecar.core.model.BlockHash;
import com.sidecar.core.model.JsonBlock;

import java.util.Objects;

/**
 * The given block has been added to the linear chain and stored locally.
 */
public record BlockAdded(BlockHash blockHash, JsonBlock block) implements SseData {

    public BlockAdded {
        Objects.requireNonNull(blockHash, "blockHash");
        Objects.requireNonNull(block, "block");
    }

    public String hexEncodedHash() {
        return blockHash.toHex();
    }

    public long height() {
        return block.header().height();
    }

    @Override
    public SseEventType type() {
        return SseEventType.BLOCK_ADDED;
    }

    @Override
    public <R> R accept(SseDataVisitor<R> visitor) {
        return visitor.visitBlockAdded(this);
    }
}
