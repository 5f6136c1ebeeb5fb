package com.sidecar.core.model;

import java.util.Objects;

/**
 * Address of a transfer record written by a deploy. Rendered as {@code transfer-<hex>}.
 */
public record TransferAddr(Digest inner) {

    public static final String PREFIX = "transfer-";

    public TransferAddr {
        Objects.requireNonNull(inner, "inner");
    }

    public String toFormattedString() {
        return PREFIX + inner.toHex();
    }
}
