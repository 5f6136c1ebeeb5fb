package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of executing a deploy. {@code cost} is a U512 motes amount and is rendered as a
 * decimal string.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ExecutionResult.Success.class, name = "Success"),
    @JsonSubTypes.Type(value = ExecutionResult.Failure.class, name = "Failure")
})
public sealed interface ExecutionResult {

    ExecutionEffect effect();

    List<TransferAddr> transfers();

    BigInteger cost();

    record Success(
        @JsonProperty("effect") ExecutionEffect effect,
        @JsonProperty("transfers") List<TransferAddr> transfers,
        @JsonProperty("cost") @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger cost
    ) implements ExecutionResult {

        public Success {
            Objects.requireNonNull(effect, "effect");
            Objects.requireNonNull(cost, "cost");
            transfers = List.copyOf(transfers);
        }
    }

    record Failure(
        @JsonProperty("effect") ExecutionEffect effect,
        @JsonProperty("transfers") List<TransferAddr> transfers,
        @JsonProperty("cost") @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger cost,
        @JsonProperty("error_message") String errorMessage
    ) implements ExecutionResult {

        public Failure {
            Objects.requireNonNull(effect, "effect");
            Objects.requireNonNull(cost, "cost");
            Objects.requireNonNull(errorMessage, "errorMessage");
            transfers = List.copyOf(transfers);
        }
    }
}
