package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Code a deploy runs for payment or as its session.
 * <p>
 * Serialized as a single-field object keyed by the item kind, e.g.
 * {@code {"ModuleBytes": {"module_bytes": "...", "args": [...]}}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ExecutableDeployItem.ModuleBytes.class, name = "ModuleBytes"),
    @JsonSubTypes.Type(value = ExecutableDeployItem.StoredContractByHash.class, name = "StoredContractByHash"),
    @JsonSubTypes.Type(value = ExecutableDeployItem.Transfer.class, name = "Transfer")
})
public sealed interface ExecutableDeployItem {

    List<NamedArg> args();

    record ModuleBytes(
        @JsonProperty("module_bytes") HexBytes moduleBytes,
        @JsonProperty("args") List<NamedArg> args
    ) implements ExecutableDeployItem {

        public ModuleBytes {
            Objects.requireNonNull(moduleBytes, "moduleBytes");
            args = List.copyOf(args);
        }
    }

    record StoredContractByHash(
        @JsonProperty("hash") Digest hash,
        @JsonProperty("entry_point") String entryPoint,
        @JsonProperty("args") List<NamedArg> args
    ) implements ExecutableDeployItem {

        public StoredContractByHash {
            Objects.requireNonNull(hash, "hash");
            Objects.requireNonNull(entryPoint, "entryPoint");
            args = List.copyOf(args);
        }
    }

    record Transfer(
        @JsonProperty("args") List<NamedArg> args
    ) implements ExecutableDeployItem {

        public Transfer {
            args = List.copyOf(args);
        }
    }
}
